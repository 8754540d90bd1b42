package com.cgi.dbconnector.config;

import com.cgi.dbconnector.core.artifact.ArtifactDownloader;
import com.cgi.dbconnector.core.artifact.ArtifactManager;
import com.cgi.dbconnector.core.artifact.DefaultArtifactManager;
import com.cgi.dbconnector.core.artifact.DownloadMethod;
import com.cgi.dbconnector.core.artifact.RestTemplateArtifactDownloader;
import com.cgi.dbconnector.core.artifact.UrlStreamArtifactDownloader;
import com.cgi.dbconnector.core.artifact.ZipArchiveExtractor;
import com.cgi.dbconnector.core.catalog.DriverCatalog;
import com.cgi.dbconnector.core.driver.DefaultDriverRegistry;
import com.cgi.dbconnector.core.driver.DriverCache;
import com.cgi.dbconnector.core.driver.DriverRegistry;
import com.cgi.dbconnector.core.driver.DriverRuntime;
import com.cgi.dbconnector.core.driver.LockingDriverCache;
import com.cgi.dbconnector.core.driver.UrlClassLoaderDriverRuntime;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * Wires the driver registry and the artifact manager.
 */
@Configuration
public class DriverManagementConfig {

    @Bean
    public DriverRuntime driverRuntime() {
        return new UrlClassLoaderDriverRuntime();
    }

    @Bean
    public DriverCache driverCache() {
        return new LockingDriverCache();
    }

    @Bean
    public DriverRegistry driverRegistry(DriverRuntime driverRuntime, DriverCache driverCache) {
        return new DefaultDriverRegistry(driverRuntime, driverCache);
    }

    /**
     * Creates the artifact manager with one downloader per download method.
     *
     * @param catalog Driver table
     * @param properties Driver configuration properties
     * @param restTemplateBuilder Builder for the RestTemplate transport
     * @return The artifact manager
     */
    @Bean
    public ArtifactManager artifactManager(DriverCatalog catalog, DriverConfigurationProperties properties,
                                           RestTemplateBuilder restTemplateBuilder) {
        Map<DownloadMethod, ArtifactDownloader> downloaders = Map.of(
                DownloadMethod.URL_STREAM, new UrlStreamArtifactDownloader(
                        properties.getConnectTimeout(), properties.getReadTimeout()),
                DownloadMethod.REST_TEMPLATE, new RestTemplateArtifactDownloader(restTemplateBuilder
                        .setConnectTimeout(properties.getConnectTimeout())
                        .setReadTimeout(properties.getReadTimeout())
                        .build()));
        return new DefaultArtifactManager(catalog, properties, downloaders, new ZipArchiveExtractor());
    }
}
