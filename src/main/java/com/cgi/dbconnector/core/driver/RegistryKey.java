package com.cgi.dbconnector.core.driver;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Cache key of a loaded driver: the driver class together with the class path it was loaded from.
 *
 * @param driverClassName Fully qualified driver class, empty for drivers found through service loading
 * @param classPath Jar paths joined with the platform path separator, may be empty
 */
public record RegistryKey(String driverClassName, String classPath) {

    public RegistryKey {
        driverClassName = driverClassName == null ? "" : driverClassName.trim();
        classPath = classPath == null ? "" : classPath;
    }

    /**
     * Builds a key from a list of jar paths.
     *
     * @param driverClassName Driver class
     * @param jars Jar paths, joined in the given order
     * @return The key
     */
    public static RegistryKey of(String driverClassName, List<Path> jars) {
        return new RegistryKey(driverClassName, jars.stream()
                .map(Path::toString)
                .collect(Collectors.joining(File.pathSeparator)));
    }

    /**
     * Splits the class path into its entries.
     *
     * @return Class path entries, empty when no class path was given
     */
    public List<Path> classPathEntries() {
        return Arrays.stream(classPath.split(File.pathSeparator))
                .map(String::trim)
                .filter(entry -> !entry.isEmpty())
                .map(Paths::get)
                .toList();
    }

    public boolean hasDriverClass() {
        return !driverClassName.isEmpty();
    }
}
