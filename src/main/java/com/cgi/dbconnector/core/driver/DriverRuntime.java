package com.cgi.dbconnector.core.driver;

import java.nio.file.Path;
import java.sql.Driver;
import java.util.List;

/**
 * Class loading operations the registry relies on.
 */
public interface DriverRuntime {
    /**
     * Adds a jar or directory to the class loader search path.
     * Entries are never removed. Paths that do not exist are skipped, so a later call can still add them.
     *
     * @param path Jar or directory
     */
    void addToClassPath(Path path);

    /**
     * Checks whether a class can be resolved with the current search path.
     *
     * @param className Fully qualified class name
     * @return true if the class resolves
     */
    boolean resolveClass(String className);

    /**
     * Instantiates a driver class through its no-arg constructor.
     *
     * @param className Fully qualified driver class name
     * @return The new driver
     * @throws com.cgi.dbconnector.exception.DriverLoadException If the class is not a driver or cannot be created
     */
    Driver instantiate(String className);

    /**
     * Loads the drivers that jars on the search path declare in {@code META-INF/services/java.sql.Driver}
     * and registers them with {@link java.sql.DriverManager}. Drivers registered by an earlier call are skipped.
     *
     * @return Drivers registered by this call
     * @throws com.cgi.dbconnector.exception.DriverLoadException If a declared driver cannot be created
     */
    List<Driver> loadServiceDrivers();
}
