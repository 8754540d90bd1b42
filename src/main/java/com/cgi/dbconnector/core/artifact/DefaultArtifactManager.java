package com.cgi.dbconnector.core.artifact;

import com.cgi.dbconnector.config.DriverConfigurationProperties;
import com.cgi.dbconnector.core.catalog.DriverCatalog;
import com.cgi.dbconnector.core.catalog.DriverDescriptor;
import com.cgi.dbconnector.exception.DownloadFailedException;
import com.cgi.dbconnector.exception.InvalidTargetException;
import com.cgi.dbconnector.exception.NoMatchingDriverException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Installs driver archives from the download host into a local folder.
 */
@Slf4j
public class DefaultArtifactManager implements ArtifactManager {
    private static final String REDSHIFT = "redshift";

    private final DriverCatalog catalog;
    private final DriverConfigurationProperties properties;
    private final Map<DownloadMethod, ArtifactDownloader> downloaders;
    private final ZipArchiveExtractor extractor;

    /**
     * Constructor.
     *
     * @param catalog Driver table
     * @param properties Driver configuration properties
     * @param downloaders Transport for each download method
     * @param extractor Zip extractor
     */
    public DefaultArtifactManager(
            DriverCatalog catalog,
            DriverConfigurationProperties properties,
            Map<DownloadMethod, ArtifactDownloader> downloaders,
            ZipArchiveExtractor extractor) {
        this.catalog = catalog;
        this.properties = properties;
        this.downloaders = new EnumMap<>(DownloadMethod.class);
        this.downloaders.putAll(downloaders);
        this.extractor = extractor;
    }

    @Override
    public Path resolveFolder(String pathToDriver) {
        String folder = isBlank(pathToDriver) ? properties.getDirectory() : pathToDriver.trim();
        if (isBlank(folder)) {
            throw new InvalidTargetException("The pathToDriver argument must be specified. Consider setting the "
                    + "DATABASECONNECTOR_JAR_FOLDER environment variable.");
        }
        if (folder.equals("~") || folder.startsWith("~/")) {
            folder = System.getProperty("user.home") + folder.substring(1);
        }
        return Paths.get(folder);
    }

    @Override
    public Path fetchDrivers(String dbmsSelector, Path targetDir, DownloadOptions options) {
        requireNonEmpty(targetDir);
        if (Files.exists(targetDir) && !Files.isDirectory(targetDir)) {
            throw InvalidTargetException.pointsToFile(targetDir);
        }
        List<DriverDescriptor> descriptors = catalog.expand(dbmsSelector);
        suggestEnvironmentVariable(targetDir);
        createIfMissing(targetDir);

        DownloadOptions effective = options != null ? options : DownloadOptions.defaults();
        ArtifactDownloader downloader = downloaderFor(effective.getMethod());
        PriorArtifactPolicy policy = effective.getPriorArtifactPolicy() != null
                ? effective.getPriorArtifactPolicy()
                : properties.getPriorArtifacts();

        for (DriverDescriptor descriptor : descriptors) {
            if (REDSHIFT.equals(descriptor.dbmsKey())) {
                removePriorArtifacts(descriptor, targetDir, policy);
            }
            install(descriptor, targetDir, downloader);
        }
        return targetDir;
    }

    @Override
    public List<Path> locateJar(String namePattern, Path targetDir) {
        checkPathToDriver(targetDir, null);
        List<Path> files = listMatching(targetDir, namePattern);
        if (files.isEmpty()) {
            log.error("No drivers matching pattern '{}' found in folder '{}'", namePattern, targetDir);
            throw new NoMatchingDriverException(namePattern, targetDir);
        }
        return files.stream().map(Path::toAbsolutePath).toList();
    }

    @Override
    public void checkPathToDriver(Path targetDir, String dbms) {
        if (catalog.isEmbedded(dbms)) {
            return;
        }
        if (targetDir == null || targetDir.toString().isBlank()) {
            throw new InvalidTargetException("The pathToDriver argument hasn't been specified. "
                    + "Please set the path to the location containing the JDBC driver.");
        }
        if (!Files.isDirectory(targetDir)) {
            if (Files.exists(targetDir)) {
                throw InvalidTargetException.pointsToFile(targetDir);
            }
            throw InvalidTargetException.doesNotExist(targetDir);
        }
    }

    private void install(DriverDescriptor descriptor, Path targetDir, ArtifactDownloader downloader) {
        URI source = URI.create(properties.getBaseUrl() + descriptor.archiveFileName());
        Path archive = targetDir.resolve(descriptor.archiveFileName());
        try {
            downloader.download(source, archive);
            List<Path> extracted = extractor.extract(archive, targetDir);
            Files.delete(archive);
            log.info("DatabaseConnector {} JDBC driver downloaded to '{}' ({} files)",
                    descriptor.dbmsKey(), targetDir, extracted.size());
        } catch (IOException e) {
            DownloadFailedException failure = new DownloadFailedException(descriptor.dbmsKey(), targetDir, e);
            try {
                Files.deleteIfExists(archive);
            } catch (IOException cleanup) {
                failure.addSuppressed(cleanup);
            }
            log.error("Downloading and unzipping of {} JDBC driver to '{}' has failed", descriptor.dbmsKey(),
                    targetDir, e);
            throw failure;
        }
    }

    private void removePriorArtifacts(DriverDescriptor descriptor, Path targetDir, PriorArtifactPolicy policy) {
        List<Path> priorFiles = listMatching(targetDir, descriptor.jarPattern());
        if (priorFiles.isEmpty()) {
            return;
        }
        String names = priorFiles.stream()
                .map(file -> file.getFileName().toString())
                .collect(Collectors.joining("', '"));
        log.info("Prior JAR files have already been detected: '{}'", names);
        if (!policy.confirmDeletion(descriptor, priorFiles)) {
            log.info("Keeping prior {} JAR files", descriptor.dbmsKey());
            return;
        }
        for (Path file : priorFiles) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete prior JAR file " + file, e);
            }
        }
        log.info("Deleted {} prior {} JAR files", priorFiles.size(), descriptor.dbmsKey());
    }

    private List<Path> listMatching(Path folder, String namePattern) {
        Pattern pattern = Pattern.compile(namePattern);
        try (Stream<Path> files = Files.list(folder)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(file -> pattern.matcher(file.getFileName().toString()).find())
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list folder " + folder, e);
        }
    }

    private ArtifactDownloader downloaderFor(DownloadMethod method) {
        DownloadMethod resolved = method == null || method == DownloadMethod.AUTO
                ? properties.getDownloadMethod()
                : method;
        if (resolved == DownloadMethod.AUTO) {
            resolved = DownloadMethod.URL_STREAM;
        }
        ArtifactDownloader downloader = downloaders.get(resolved);
        if (downloader == null) {
            throw new IllegalArgumentException("No downloader configured for method " + resolved);
        }
        return downloader;
    }

    private void suggestEnvironmentVariable(Path targetDir) {
        if (!isConfiguredFolder(targetDir)) {
            log.info("Consider setting the environment variable DATABASECONNECTOR_JAR_FOLDER='{}'", targetDir);
        }
    }

    boolean isConfiguredFolder(Path targetDir) {
        String configured = properties.getDirectory();
        return !isBlank(configured) && resolveFolder(configured).equals(targetDir);
    }

    private void createIfMissing(Path targetDir) {
        if (Files.isDirectory(targetDir)) {
            return;
        }
        log.warn("The folder location '{}' does not exist. Attempting to create.", targetDir);
        try {
            Files.createDirectories(targetDir);
        } catch (IOException e) {
            log.error("Failed to create driver folder: {}", targetDir, e);
            throw new UncheckedIOException("Failed to create driver folder " + targetDir, e);
        }
    }

    private static void requireNonEmpty(Path targetDir) {
        if (targetDir == null || targetDir.toString().isBlank()) {
            throw new InvalidTargetException("The pathToDriver argument must be specified. Consider setting the "
                    + "DATABASECONNECTOR_JAR_FOLDER environment variable.");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
