package com.cgi.dbconnector.api.dto;

import lombok.Data;

/**
 * DTO for driver load requests.
 * Either {@code dbms} or {@code driverClassName} (with {@code classPath}) must be given.
 */
@Data
public class DriverLoadRequest {
    private String dbms;
    private String pathToDriver;
    private boolean download;

    private String driverClassName;
    private String classPath;

    public boolean isExplicitClass() {
        return driverClassName != null && !driverClassName.isBlank();
    }
}
