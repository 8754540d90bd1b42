package com.cgi.dbconnector.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request for a pooled data source backed by a managed JDBC driver.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSourceRequest {
    /**
     * Driver selection
     */
    private String dbms;                // DBMS key or alias (postgresql, sql server, ...)
    private String pathToDriver;        // Driver folder (optional, defaults to DATABASECONNECTOR_JAR_FOLDER)
    private boolean download;           // Download the driver before loading it

    /**
     * Connection information
     */
    private String url;                 // Complete JDBC URL
    private String username;            // Username
    private String password;            // Password

    /**
     * Connection pool parameters
     */
    private Integer maxPoolSize;        // Maximum pool size
    private Long connectionTimeout;     // Connection timeout in ms
}
