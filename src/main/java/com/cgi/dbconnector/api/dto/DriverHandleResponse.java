package com.cgi.dbconnector.api.dto;

import com.cgi.dbconnector.core.driver.DriverHandle;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.sql.Driver;

/**
 * Description of a loaded driver.
 */
@Data
@AllArgsConstructor
public class DriverHandleResponse {
    private String driverClassName;
    private String classPath;
    private String implementation;
    private Integer majorVersion;
    private Integer minorVersion;

    /**
     * Describes a driver handle.
     *
     * @param handle The handle
     * @return The description
     */
    public static DriverHandleResponse from(DriverHandle handle) {
        Driver driver = handle.getDriver().orElse(null);
        return new DriverHandleResponse(
                handle.getKey().driverClassName(),
                handle.getKey().classPath(),
                driver != null ? driver.getClass().getName() : null,
                driver != null ? driver.getMajorVersion() : null,
                driver != null ? driver.getMinorVersion() : null);
    }
}
