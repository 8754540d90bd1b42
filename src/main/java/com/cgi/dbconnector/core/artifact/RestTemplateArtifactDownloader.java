package com.cgi.dbconnector.core.artifact;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Downloads archives through a {@link RestTemplate}, streaming the body straight to disk.
 */
@Slf4j
public class RestTemplateArtifactDownloader implements ArtifactDownloader {
    private final RestTemplate restTemplate;

    public RestTemplateArtifactDownloader(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public void download(URI source, Path destination) throws IOException {
        log.info("Downloading driver archive from: {}", source);
        try {
            restTemplate.execute(source, HttpMethod.GET, null, response -> {
                Files.copy(response.getBody(), destination, StandardCopyOption.REPLACE_EXISTING);
                return destination;
            });
        } catch (RestClientException e) {
            throw new IOException("Failed to download " + source, e);
        }
    }
}
