package com.cgi.dbconnector.core.driver;

import com.cgi.dbconnector.exception.DriverLoadException;

import java.sql.*;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Wraps a driver loaded by the {@link DriverClassLoader} so that {@link DriverManager},
 * which only trusts drivers visible to the caller's class loader, accepts it.
 */
final class DriverShim implements Driver {
    private final Driver driver;

    private DriverShim(Driver driver) {
        this.driver = driver;
    }

    /**
     * Registers a driver from the driver class loader with {@link DriverManager}.
     *
     * @param driver Driver loaded by the {@link DriverClassLoader}
     * @throws DriverLoadException If {@link DriverManager} refuses the registration
     */
    static void register(Driver driver) {
        try {
            DriverManager.registerDriver(new DriverShim(driver));
        } catch (SQLException e) {
            throw new DriverLoadException("Failed to register driver class: " + driver.getClass().getName(), e);
        }
    }

    @Override
    public Connection connect(String url, Properties info) throws SQLException {
        return driver.connect(url, info);
    }

    @Override
    public boolean acceptsURL(String url) throws SQLException {
        return driver.acceptsURL(url);
    }

    @Override
    public DriverPropertyInfo[] getPropertyInfo(String url, Properties info) throws SQLException {
        return driver.getPropertyInfo(url, info);
    }

    @Override
    public int getMajorVersion() {
        return driver.getMajorVersion();
    }

    @Override
    public int getMinorVersion() {
        return driver.getMinorVersion();
    }

    @Override
    public boolean jdbcCompliant() {
        return driver.jdbcCompliant();
    }

    @Override
    public Logger getParentLogger() throws SQLFeatureNotSupportedException {
        return driver.getParentLogger();
    }

    @Override
    public String toString() {
        return "DriverShim[" + driver.getClass().getName() + " " + driver.getMajorVersion() + "."
                + driver.getMinorVersion() + "]";
    }
}
