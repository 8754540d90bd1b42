package com.cgi.dbconnector.core.artifact;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;

/**
 * Transport used to fetch driver archives.
 */
public interface ArtifactDownloader {
    /**
     * Downloads a file, replacing the destination if it exists.
     *
     * @param source Remote location
     * @param destination Local file to write
     * @throws IOException If the transfer fails
     */
    void download(URI source, Path destination) throws IOException;
}
