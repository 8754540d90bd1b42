package com.cgi.dbconnector.service;

import com.cgi.dbconnector.core.artifact.ArtifactManager;
import com.cgi.dbconnector.core.artifact.DownloadOptions;
import com.cgi.dbconnector.core.catalog.DriverCatalog;
import com.cgi.dbconnector.core.catalog.DriverDescriptor;
import com.cgi.dbconnector.core.driver.DriverHandle;
import com.cgi.dbconnector.core.driver.DriverRegistry;
import com.cgi.dbconnector.core.driver.RegistryKey;
import com.cgi.dbconnector.exception.DataSourceException;
import com.cgi.dbconnector.model.DataSourceRequest;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.SimpleDriverDataSource;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Default {@link DriverService}: locates the jars through the {@link ArtifactManager}
 * and hands them to the {@link DriverRegistry}.
 */
@Slf4j
@Service
public class DefaultDriverService implements DriverService {
    private final DriverCatalog catalog;
    private final ArtifactManager artifactManager;
    private final DriverRegistry driverRegistry;

    /**
     * Constructor.
     *
     * @param catalog Driver table
     * @param artifactManager Driver archive manager
     * @param driverRegistry Loaded driver registry
     */
    public DefaultDriverService(DriverCatalog catalog, ArtifactManager artifactManager,
                                DriverRegistry driverRegistry) {
        this.catalog = catalog;
        this.artifactManager = artifactManager;
        this.driverRegistry = driverRegistry;
    }

    @Override
    public Collection<DriverDescriptor> catalog() {
        return catalog.descriptors();
    }

    @Override
    public Path downloadDrivers(String dbms, String pathToDriver, DownloadOptions options) {
        Path folder = artifactManager.resolveFolder(pathToDriver);
        log.info("Downloading {} JDBC drivers to '{}'", dbms, folder);
        return artifactManager.fetchDrivers(dbms, folder, options);
    }

    @Override
    public List<Path> findJars(String pattern, String pathToDriver) {
        return artifactManager.locateJar(pattern, artifactManager.resolveFolder(pathToDriver));
    }

    @Override
    public DriverHandle getDriver(String dbms, String pathToDriver, boolean download) {
        if (catalog.isEmbedded(dbms)) {
            log.debug("{} is embedded, no driver jar needed", dbms);
            return driverRegistry.getOrLoadDriver("", "");
        }
        DriverDescriptor descriptor = catalog.resolve(dbms);
        Path folder = artifactManager.resolveFolder(pathToDriver);
        if (download) {
            artifactManager.fetchDrivers(descriptor.dbmsKey(), folder, DownloadOptions.defaults());
        }
        artifactManager.checkPathToDriver(folder, descriptor.dbmsKey());
        List<Path> jars = artifactManager.locateJar(descriptor.jarPattern(), folder);
        return driverRegistry.getOrLoadDriver(descriptor.driverClassName(), jars);
    }

    @Override
    public DriverHandle loadDriver(String driverClassName, String classPath) {
        return driverRegistry.getOrLoadDriver(driverClassName, classPath);
    }

    @Override
    public Set<RegistryKey> loadedDrivers() {
        return driverRegistry.loadedKeys();
    }

    @Override
    public DataSource createDataSource(DataSourceRequest request) {
        DriverHandle handle = getDriver(request.getDbms(), request.getPathToDriver(), request.isDownload());
        try {
            log.info("Creating data source for {} at {}", request.getDbms(), request.getUrl());
            DataSource target = handle.getDriver()
                    .<DataSource>map(driver -> new SimpleDriverDataSource(
                            driver, request.getUrl(), request.getUsername(), request.getPassword()))
                    .orElseGet(() -> new DriverManagerDataSource(
                            request.getUrl(), request.getUsername(), request.getPassword()));

            HikariConfig config = new HikariConfig();
            config.setDataSource(target);
            config.setPoolName("dbconnector-" + catalog.normalize(request.getDbms()).replace(' ', '-'));
            if (request.getMaxPoolSize() != null) {
                config.setMaximumPoolSize(request.getMaxPoolSize());
            }
            if (request.getConnectionTimeout() != null) {
                config.setConnectionTimeout(request.getConnectionTimeout());
            }
            return new HikariDataSource(config);
        } catch (RuntimeException e) {
            log.error("Failed to create data source for {}", request.getDbms(), e);
            throw new DataSourceException("Failed to create data source for " + request.getDbms(), e);
        }
    }
}
