package com.cgi.dbconnector.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception for all driver management errors.
 * Every subclass carries an error code and the engine, folder or class path it failed on,
 * both of which the API layer returns to clients.
 */
public abstract class BaseException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String errorCode;
    private final LinkedHashMap<String, String> details = new LinkedHashMap<>();

    protected BaseException(String message, String errorCode) {
        this(message, null, errorCode);
    }

    protected BaseException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Records what the failure was about, e.g. {@code dbms} or {@code targetDir}.
     * Null values are not recorded.
     *
     * @param name Detail name
     * @param value Detail value
     * @return This exception
     */
    protected BaseException withDetail(String name, Object value) {
        if (value != null) {
            details.put(name, String.valueOf(value));
        }
        return this;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Gets the details recorded for this failure, in the order they were added.
     *
     * @return Unmodifiable detail map, empty when there are none
     */
    public Map<String, String> getDetails() {
        return Collections.unmodifiableMap(details);
    }
}
