package com.cgi.dbconnector.exception;

/**
 * Thrown when a driver class cannot be resolved after its class path has been applied.
 */
public class DriverClassNotFoundException extends BaseException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new DriverClassNotFoundException.
     *
     * @param driverClassName The class that could not be found
     * @param classPath The class path that was searched
     */
    public DriverClassNotFoundException(String driverClassName, String classPath) {
        super(String.format("Cannot find JDBC driver class %s (class path: '%s')", driverClassName, classPath),
                "DRIVER_CLASS_NOT_FOUND");
        withDetail("driverClassName", driverClassName);
        withDetail("classPath", classPath);
    }
}
