package com.cgi.dbconnector.core.driver;

import java.sql.Connection;
import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Optional;
import java.util.Properties;

/**
 * A driver owned by the {@link DriverRegistry}.
 * Handles created without a driver class carry no driver instance; connections then go
 * through {@link DriverManager}, which sees the drivers the registry service-loaded from the class path.
 */
public final class DriverHandle {
    private final RegistryKey key;
    private final Driver driver;

    /**
     * Constructor.
     *
     * @param key Registry key the handle is cached under
     * @param driver Driver instance, null to defer to service loading
     */
    public DriverHandle(RegistryKey key, Driver driver) {
        this.key = key;
        this.driver = driver;
    }

    public RegistryKey getKey() {
        return key;
    }

    /**
     * Gets the driver instance.
     *
     * @return The driver, or empty when the handle defers to service loading
     */
    public Optional<Driver> getDriver() {
        return Optional.ofNullable(driver);
    }

    /**
     * Opens a connection through this handle.
     *
     * @param url JDBC URL
     * @param info Connection properties (user, password, ...)
     * @return An open connection
     * @throws SQLException If the driver rejects the URL or the connection fails
     */
    public Connection connect(String url, Properties info) throws SQLException {
        if (driver == null) {
            return DriverManager.getConnection(url, info);
        }
        Connection connection = driver.connect(url, info);
        if (connection == null) {
            throw new SQLException("Driver " + key.driverClassName() + " does not accept URL " + url);
        }
        return connection;
    }

    @Override
    public String toString() {
        return "DriverHandle[" + (key.hasDriverClass() ? key.driverClassName() : "<service loader>")
                + ", classPath=" + key.classPath() + "]";
    }
}
