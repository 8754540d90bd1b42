package com.cgi.dbconnector.config;

import com.cgi.dbconnector.core.artifact.DownloadMethod;
import com.cgi.dbconnector.core.artifact.StandardPriorArtifactPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for JDBC driver downloads.
 * Maps to properties with the prefix "dbconnector.drivers" in the application properties.
 */
@Component
@ConfigurationProperties(prefix = "dbconnector.drivers")
@Getter
@Setter
public class DriverConfigurationProperties {
    /**
     * Default folder holding the driver jars.
     * application.yml binds it to the DATABASECONNECTOR_JAR_FOLDER environment variable.
     */
    private String directory;

    /**
     * Location the driver archives are downloaded from, including the trailing slash.
     */
    private String baseUrl = "https://ohdsi.github.io/DatabaseConnectorJars/";

    /**
     * Transport used when a request asks for {@code AUTO}.
     */
    private DownloadMethod downloadMethod = DownloadMethod.URL_STREAM;

    /**
     * What to do with Redshift jars left from an earlier install.
     */
    private StandardPriorArtifactPolicy priorArtifacts = StandardPriorArtifactPolicy.DELETE;

    private Duration connectTimeout = Duration.ofSeconds(30);

    private Duration readTimeout = Duration.ofMinutes(5);
}
