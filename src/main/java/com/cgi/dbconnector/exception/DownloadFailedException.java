package com.cgi.dbconnector.exception;

import java.nio.file.Path;

/**
 * Thrown when downloading or unzipping a driver archive fails.
 */
public class DownloadFailedException extends BaseException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new DownloadFailedException.
     *
     * @param dbms The engine whose archive failed
     * @param targetDir The folder the archive was downloaded to
     * @param cause The underlying transport or archive error
     */
    public DownloadFailedException(String dbms, Path targetDir, Throwable cause) {
        super(String.format("Downloading and unzipping of %s JDBC driver to '%s' has failed.", dbms, targetDir),
                cause, "DOWNLOAD_FAILED");
        withDetail("dbms", dbms);
        withDetail("targetDir", targetDir);
    }
}
