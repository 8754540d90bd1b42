package com.cgi.dbconnector.exception;

import java.util.Collection;

/**
 * Thrown when a DBMS selector names no known engine.
 */
public class UnsupportedEngineException extends BaseException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new UnsupportedEngineException.
     *
     * @param dbms The unknown selector
     * @param supported The selectors that would have been accepted
     */
    public UnsupportedEngineException(String dbms, Collection<String> supported) {
        super(String.format("Unsupported DBMS '%s'. Supported values are: %s", dbms, supported),
                "UNSUPPORTED_ENGINE");
        withDetail("dbms", dbms);
        withDetail("supported", String.join(", ", supported));
    }
}
