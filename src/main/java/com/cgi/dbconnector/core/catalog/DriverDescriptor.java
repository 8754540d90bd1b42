package com.cgi.dbconnector.core.catalog;

/**
 * Identity of a downloadable JDBC driver archive.
 *
 * @param dbmsKey Canonical lowercase engine key
 * @param archiveFileName File name of the zip archive on the download host
 * @param version Driver version bundled in the archive
 * @param driverClassName Fully qualified driver class inside the extracted jars
 * @param jarPattern Pattern that matches the extracted jar file names
 */
public record DriverDescriptor(
        String dbmsKey,
        String archiveFileName,
        String version,
        String driverClassName,
        String jarPattern) {
}
