package com.cgi.dbconnector.core.artifact;

import com.cgi.dbconnector.core.catalog.DriverDescriptor;

import java.nio.file.Path;
import java.util.List;

/**
 * Fixed answers for {@link PriorArtifactPolicy}, selectable from configuration.
 */
public enum StandardPriorArtifactPolicy implements PriorArtifactPolicy {
    DELETE {
        @Override
        public boolean confirmDeletion(DriverDescriptor descriptor, List<Path> priorFiles) {
            return true;
        }
    },
    KEEP {
        @Override
        public boolean confirmDeletion(DriverDescriptor descriptor, List<Path> priorFiles) {
            return false;
        }
    }
}
