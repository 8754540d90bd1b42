package com.cgi.dbconnector.exception;

import java.nio.file.Path;

/**
 * Thrown when no jar in the driver folder matches the requested name pattern.
 */
public class NoMatchingDriverException extends BaseException {
    private static final long serialVersionUID = 1L;

    public NoMatchingDriverException(String pattern, Path folder) {
        super(String.format("No drivers matching pattern '%s' found in folder '%s'. "
                        + "Please download the JDBC drivers for your database to the folder.", pattern, folder),
                "NO_MATCHING_DRIVER");
        withDetail("pattern", pattern);
        withDetail("folder", folder);
    }
}
