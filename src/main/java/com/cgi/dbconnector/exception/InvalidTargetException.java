package com.cgi.dbconnector.exception;

import java.nio.file.Path;

/**
 * Thrown when the driver folder is missing, unspecified, or points to a regular file.
 */
public class InvalidTargetException extends BaseException {
    private static final long serialVersionUID = 1L;

    public InvalidTargetException(String message) {
        super(message, "INVALID_TARGET");
    }

    /**
     * Creates the exception for a folder location that turned out to be a file.
     *
     * @param target The offending path
     * @return The exception
     */
    public static InvalidTargetException pointsToFile(Path target) {
        InvalidTargetException exception = new InvalidTargetException(String.format(
                "The folder location pathToDriver = '%s' points to a file, but should point to a folder.", target));
        exception.withDetail("pathToDriver", target);
        return exception;
    }

    /**
     * Creates the exception for a folder location that is missing.
     *
     * @param target The missing path
     * @return The exception
     */
    public static InvalidTargetException doesNotExist(Path target) {
        InvalidTargetException exception = new InvalidTargetException(String.format(
                "The folder location pathToDriver = '%s' does not exist. "
                        + "Please set the path to the location containing the JDBC driver.", target));
        exception.withDetail("pathToDriver", target);
        return exception;
    }
}
