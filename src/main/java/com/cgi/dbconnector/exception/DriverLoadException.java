package com.cgi.dbconnector.exception;

/**
 * Exception for drivers that resolve but cannot be instantiated or registered.
 */
public class DriverLoadException extends BaseException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new DriverLoadException with the specified message.
     *
     * @param message Exception message
     */
    public DriverLoadException(String message) {
        super(message, "DRIVER_LOAD_ERROR");
    }

    /**
     * Creates a new DriverLoadException with the specified message and cause.
     *
     * @param message Exception message
     * @param cause The cause of the exception
     */
    public DriverLoadException(String message, Throwable cause) {
        super(message, cause, "DRIVER_LOAD_ERROR");
    }
}
