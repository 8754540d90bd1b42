package com.cgi.dbconnector.core.driver;

import com.cgi.dbconnector.exception.DriverClassNotFoundException;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Keeps one driver instance per (driver class, class path) pair.
 */
public interface DriverRegistry {
    /**
     * Returns the cached driver for the given class and class path, loading it on first use.
     * Loading appends the class path to the registry's class loader, checks that the class
     * resolves and instantiates it.
     *
     * @param driverClassName Fully qualified driver class, empty to rely on service loading
     * @param classPath Jar paths joined with {@link java.io.File#pathSeparator}
     * @return The driver handle
     * @throws DriverClassNotFoundException If the class cannot be resolved
     */
    DriverHandle getOrLoadDriver(String driverClassName, String classPath);

    /**
     * Same as {@link #getOrLoadDriver(String, String)} for a list of jar paths.
     *
     * @param driverClassName Fully qualified driver class
     * @param jars Jar paths
     * @return The driver handle
     */
    default DriverHandle getOrLoadDriver(String driverClassName, List<Path> jars) {
        RegistryKey key = RegistryKey.of(driverClassName, jars);
        return getOrLoadDriver(key.driverClassName(), key.classPath());
    }

    boolean isLoaded(RegistryKey key);

    Set<RegistryKey> loadedKeys();
}
