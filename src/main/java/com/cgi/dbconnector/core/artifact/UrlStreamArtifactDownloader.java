package com.cgi.dbconnector.core.artifact;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLConnection;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

/**
 * Downloads archives by copying a {@link URLConnection} stream to disk.
 */
@Slf4j
public class UrlStreamArtifactDownloader implements ArtifactDownloader {
    private final Duration connectTimeout;
    private final Duration readTimeout;

    /**
     * Constructor.
     *
     * @param connectTimeout Connect timeout
     * @param readTimeout Read timeout
     */
    public UrlStreamArtifactDownloader(Duration connectTimeout, Duration readTimeout) {
        this.connectTimeout = connectTimeout;
        this.readTimeout = readTimeout;
    }

    @Override
    public void download(URI source, Path destination) throws IOException {
        log.info("Downloading driver archive from: {}", source);
        URLConnection connection = source.toURL().openConnection();
        connection.setConnectTimeout((int) connectTimeout.toMillis());
        connection.setReadTimeout((int) readTimeout.toMillis());
        try (InputStream in = connection.getInputStream()) {
            long bytes = Files.copy(in, destination, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Downloaded {} bytes to {}", bytes, destination);
        }
    }
}
