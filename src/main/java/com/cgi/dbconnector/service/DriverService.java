package com.cgi.dbconnector.service;

import com.cgi.dbconnector.core.artifact.DownloadOptions;
import com.cgi.dbconnector.core.catalog.DriverDescriptor;
import com.cgi.dbconnector.core.driver.DriverHandle;
import com.cgi.dbconnector.core.driver.RegistryKey;
import com.cgi.dbconnector.model.DataSourceRequest;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Entry point for installing and loading JDBC drivers.
 */
public interface DriverService {
    /**
     * Gets the drivers that can be downloaded.
     *
     * @return Driver descriptors
     */
    Collection<DriverDescriptor> catalog();

    /**
     * Downloads the drivers for a DBMS (or "all") into a folder.
     *
     * @param dbms DBMS key, alias or "all"
     * @param pathToDriver Target folder, null for the configured default
     * @param options Download options
     * @return The folder the drivers were installed into
     */
    Path downloadDrivers(String dbms, String pathToDriver, DownloadOptions options);

    /**
     * Finds installed jars by file name pattern.
     *
     * @param pattern File name pattern
     * @param pathToDriver Driver folder, null for the configured default
     * @return Matching jar paths
     */
    List<Path> findJars(String pattern, String pathToDriver);

    /**
     * Gets the driver for a DBMS, optionally downloading it first.
     *
     * @param dbms DBMS key or alias
     * @param pathToDriver Driver folder, null for the configured default
     * @param download Whether to download the driver before loading it
     * @return The driver handle
     */
    DriverHandle getDriver(String dbms, String pathToDriver, boolean download);

    /**
     * Loads an arbitrary driver class from an explicit class path.
     *
     * @param driverClassName Driver class
     * @param classPath Jar paths joined with the platform path separator
     * @return The driver handle
     */
    DriverHandle loadDriver(String driverClassName, String classPath);

    Set<RegistryKey> loadedDrivers();

    /**
     * Creates a connection pool on top of a managed driver.
     *
     * @param request Data source request
     * @return The pooled data source
     */
    DataSource createDataSource(DataSourceRequest request);
}
