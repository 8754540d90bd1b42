package com.cgi.dbconnector.core.artifact;

import com.cgi.dbconnector.exception.DownloadFailedException;
import com.cgi.dbconnector.exception.InvalidTargetException;
import com.cgi.dbconnector.exception.NoMatchingDriverException;
import com.cgi.dbconnector.exception.UnsupportedEngineException;

import java.nio.file.Path;
import java.util.List;

/**
 * Downloads driver archives into a folder and finds the installed jars.
 */
public interface ArtifactManager {
    /**
     * Turns a user supplied folder into a path.
     * A null or blank value falls back to the configured default folder and a leading
     * {@code ~} expands to the user's home directory.
     *
     * @param pathToDriver Folder as given by the caller, may be null
     * @return The folder
     * @throws InvalidTargetException If neither the argument nor the default names a folder
     */
    Path resolveFolder(String pathToDriver);

    /**
     * Downloads and unzips the driver archives for the selected engines.
     * Each archive is deleted once extracted. A failure aborts the remaining engines
     * but keeps the jars of the engines already installed.
     *
     * @param dbmsSelector Engine key, alias, or "all"
     * @param targetDir Folder to install into, created when missing
     * @param options Transport and prior-artifact options
     * @return The target folder
     * @throws InvalidTargetException If the target is empty or a regular file
     * @throws UnsupportedEngineException If the selector is unknown
     * @throws DownloadFailedException If a download or extraction fails
     */
    Path fetchDrivers(String dbmsSelector, Path targetDir, DownloadOptions options);

    /**
     * Lists the files in a folder whose name contains a match of the pattern. Not recursive.
     *
     * @param namePattern Regular expression searched in each file name
     * @param targetDir Folder to scan
     * @return Absolute paths in directory enumeration order
     * @throws InvalidTargetException If the folder is missing or a regular file
     * @throws NoMatchingDriverException If nothing matches
     */
    List<Path> locateJar(String namePattern, Path targetDir);

    /**
     * Verifies that a driver folder exists and is a directory.
     * Embedded engines need no folder and always pass.
     *
     * @param targetDir Folder to verify
     * @param dbms Engine the folder is used for, may be null
     * @throws InvalidTargetException If the folder is empty, missing or a regular file
     */
    void checkPathToDriver(Path targetDir, String dbms);
}
