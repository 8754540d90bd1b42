package com.cgi.dbconnector.core.artifact;

import com.cgi.dbconnector.core.catalog.DriverDescriptor;

import java.nio.file.Path;
import java.util.List;

/**
 * Decides whether jars left over from an earlier install are deleted before a new download.
 */
@FunctionalInterface
public interface PriorArtifactPolicy {
    /**
     * @param descriptor Driver about to be downloaded
     * @param priorFiles Existing files that match the driver
     * @return true to delete the files, false to keep them
     */
    boolean confirmDeletion(DriverDescriptor descriptor, List<Path> priorFiles);
}
