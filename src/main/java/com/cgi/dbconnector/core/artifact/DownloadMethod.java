package com.cgi.dbconnector.core.artifact;

/**
 * Transport used for downloading archives.
 */
public enum DownloadMethod {
    /**
     * Use the configured default transport.
     */
    AUTO,
    /**
     * Plain {@link java.net.URLConnection} streams.
     */
    URL_STREAM,
    /**
     * Spring {@link org.springframework.web.client.RestTemplate}.
     */
    REST_TEMPLATE
}
