package com.cgi.dbconnector.core.artifact;

import com.cgi.dbconnector.config.DriverConfigurationProperties;
import com.cgi.dbconnector.core.catalog.DriverCatalog;
import com.cgi.dbconnector.core.catalog.DriverDescriptor;
import com.cgi.dbconnector.exception.DownloadFailedException;
import com.cgi.dbconnector.exception.InvalidTargetException;
import com.cgi.dbconnector.exception.NoMatchingDriverException;
import com.cgi.dbconnector.exception.UnsupportedEngineException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultArtifactManagerTest {

    private static final String BASE_URL = "https://jars.example.org/";

    @TempDir
    Path tempDir;

    private final DriverCatalog catalog = new DriverCatalog();
    private DriverConfigurationProperties properties;
    private FakeHost host;
    private DefaultArtifactManager manager;

    @BeforeEach
    void setUp() {
        properties = new DriverConfigurationProperties();
        properties.setBaseUrl(BASE_URL);
        host = new FakeHost();
        host.publish("postgresqlV42.2.18.zip", "postgresql-42.2.18.jar");
        host.publish("redShiftV2.1.0.9.zip", "redshift-jdbc42-2.1.0.9.jar");
        host.publish("sqlServerV9.2.0.zip", "mssql-jdbc-9.2.0.jre8.jar");
        host.publish("oracleV19.8.zip", "ojdbc8.jar");
        host.publish("SimbaSparkV2.6.21.zip", "SparkJDBC42.jar");
        host.publish("SnowflakeV3.13.22.zip", "snowflake-jdbc-3.13.22.jar");
        manager = new DefaultArtifactManager(catalog, properties,
                Map.of(DownloadMethod.URL_STREAM, host), new ZipArchiveExtractor());
    }

    @Nested
    class FetchDrivers {

        @Test
        @DisplayName("Installs the postgresql jar and removes the archive")
        void installsPostgresql() throws IOException {
            Path result = manager.fetchDrivers("postgresql", tempDir, DownloadOptions.defaults());

            assertThat(result).isEqualTo(tempDir);
            assertThat(fileNames(tempDir))
                    .anyMatch(name -> name.toLowerCase().contains("postgresql"))
                    .noneMatch(name -> name.endsWith(".zip"));
            assertThat(host.requested).containsExactly(URI.create(BASE_URL + "postgresqlV42.2.18.zip"));
        }

        @Test
        @DisplayName("Creates a missing target directory recursively")
        void createsMissingDirectory() {
            Path target = tempDir.resolve("a/b/drivers");

            manager.fetchDrivers("oracle", target, DownloadOptions.defaults());

            assertThat(target.resolve("ojdbc8.jar")).isRegularFile();
        }

        @Test
        @DisplayName("Refuses a target that is a regular file and leaves it untouched")
        void refusesFileTarget() throws IOException {
            Path file = Files.writeString(tempDir.resolve("drivers"), "keep me");

            assertThatThrownBy(() -> manager.fetchDrivers("postgresql", file, DownloadOptions.defaults()))
                    .isInstanceOf(InvalidTargetException.class)
                    .hasMessageContaining("points to a file");
            assertThat(Files.readString(file)).isEqualTo("keep me");
            assertThat(host.requested).isEmpty();
        }

        @Test
        @DisplayName("Refuses an empty target path")
        void refusesEmptyTarget() {
            assertThatThrownBy(() -> manager.fetchDrivers("postgresql", Paths.get(""), DownloadOptions.defaults()))
                    .isInstanceOf(InvalidTargetException.class);
        }

        @Test
        @DisplayName("Rejects unknown engines before touching the file system")
        void rejectsUnknownEngine() {
            Path target = tempDir.resolve("never-created");

            assertThatThrownBy(() -> manager.fetchDrivers("mysql", target, DownloadOptions.defaults()))
                    .isInstanceOf(UnsupportedEngineException.class);
            assertThat(target).doesNotExist();
        }

        @Test
        @DisplayName("Aliases download the sql server archive")
        void aliasDownloadsSqlServer() {
            manager.fetchDrivers("synapse", tempDir, DownloadOptions.defaults());

            assertThat(host.requested).containsExactly(URI.create(BASE_URL + "sqlServerV9.2.0.zip"));
            assertThat(tempDir.resolve("mssql-jdbc-9.2.0.jre8.jar")).isRegularFile();
        }

        @Test
        @DisplayName("all downloads every archive exactly once")
        void allDownloadsEveryArchive() throws IOException {
            manager.fetchDrivers("all", tempDir, DownloadOptions.defaults());

            assertThat(host.requested)
                    .extracting(uri -> uri.getPath().substring(1))
                    .containsExactlyElementsOf(catalog.descriptors().stream()
                            .map(DriverDescriptor::archiveFileName)
                            .toList());
            assertThat(fileNames(tempDir)).hasSize(6).noneMatch(name -> name.endsWith(".zip"));
        }

        @Test
        @DisplayName("A failure aborts the batch but keeps jars of engines already installed")
        void failureKeepsEarlierEngines() throws IOException {
            host.fail("sqlServerV9.2.0.zip");

            assertThatThrownBy(() -> manager.fetchDrivers("all", tempDir, DownloadOptions.defaults()))
                    .isInstanceOf(DownloadFailedException.class)
                    .hasMessageContaining("sql server")
                    .hasMessageContaining(tempDir.toString())
                    .hasCauseInstanceOf(IOException.class);

            assertThat(fileNames(tempDir))
                    .containsExactlyInAnyOrder("postgresql-42.2.18.jar", "redshift-jdbc42-2.1.0.9.jar");
            assertThat(host.requested).hasSize(3);
        }

        @Test
        @DisplayName("A corrupt archive is reported and removed")
        void corruptArchiveIsRemoved() throws IOException {
            host.serveGarbage("oracleV19.8.zip");

            assertThatThrownBy(() -> manager.fetchDrivers("oracle", tempDir, DownloadOptions.defaults()))
                    .isInstanceOf(DownloadFailedException.class)
                    .hasMessageContaining("oracle");
            assertThat(fileNames(tempDir)).isEmpty();
        }

        @Test
        @DisplayName("Prior Redshift jars are deleted when the policy confirms")
        void priorRedshiftJarsDeleted() throws IOException {
            Files.writeString(tempDir.resolve("RedshiftJDBC42-no-awssdk-1.2.45.1069.jar"), "old");
            List<List<Path>> asked = new ArrayList<>();
            DownloadOptions options = DownloadOptions.builder()
                    .priorArtifactPolicy((descriptor, prior) -> asked.add(prior))
                    .build();

            manager.fetchDrivers("redshift", tempDir, options);

            assertThat(asked).hasSize(1);
            assertThat(asked.get(0)).extracting(path -> path.getFileName().toString())
                    .containsExactly("RedshiftJDBC42-no-awssdk-1.2.45.1069.jar");
            assertThat(fileNames(tempDir)).containsExactly("redshift-jdbc42-2.1.0.9.jar");
        }

        @Test
        @DisplayName("Prior Redshift jars are kept when the policy declines")
        void priorRedshiftJarsKept() throws IOException {
            Files.writeString(tempDir.resolve("RedshiftJDBC42-no-awssdk-1.2.45.1069.jar"), "old");
            DownloadOptions options = DownloadOptions.builder()
                    .priorArtifactPolicy(StandardPriorArtifactPolicy.KEEP)
                    .build();

            manager.fetchDrivers("redshift", tempDir, options);

            assertThat(fileNames(tempDir)).containsExactlyInAnyOrder(
                    "RedshiftJDBC42-no-awssdk-1.2.45.1069.jar", "redshift-jdbc42-2.1.0.9.jar");
        }

        @Test
        @DisplayName("The configured prior-artifact policy applies when the request has none")
        void configuredPolicyApplies() throws IOException {
            properties.setPriorArtifacts(StandardPriorArtifactPolicy.KEEP);
            Files.writeString(tempDir.resolve("RedshiftJDBC4.jar"), "old");

            manager.fetchDrivers("redshift", tempDir, null);

            assertThat(tempDir.resolve("RedshiftJDBC4.jar")).isRegularFile();
        }

        @Test
        @DisplayName("The prior-artifact check only runs for Redshift")
        void priorCheckOnlyForRedshift() throws IOException {
            Files.writeString(tempDir.resolve("postgresql-9.4.jar"), "old");
            DownloadOptions options = DownloadOptions.builder()
                    .priorArtifactPolicy((descriptor, prior) -> {
                        throw new AssertionError("not expected for " + descriptor.dbmsKey());
                    })
                    .build();

            manager.fetchDrivers("postgresql", tempDir, options);

            assertThat(fileNames(tempDir)).contains("postgresql-9.4.jar", "postgresql-42.2.18.jar");
        }

        @Test
        @DisplayName("A method without a configured downloader is rejected")
        void unknownMethodIsRejected() {
            DownloadOptions options = DownloadOptions.builder().method(DownloadMethod.REST_TEMPLATE).build();

            assertThatThrownBy(() -> manager.fetchDrivers("postgresql", tempDir, options))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("REST_TEMPLATE");
        }
    }

    @Nested
    class LocateJar {

        @Test
        @DisplayName("Finds the jar whose name matches the pattern")
        void findsMatchingJar() throws IOException {
            Files.writeString(tempDir.resolve("SnowflakeV3.13.22.jar"), "jar");
            Files.writeString(tempDir.resolve("postgresql-42.2.18.jar"), "jar");

            List<Path> jars = manager.locateJar("Snowflake", tempDir);

            assertThat(jars).hasSize(1);
            assertThat(jars.get(0)).isAbsolute();
            assertThat(jars.get(0).getFileName().toString()).isEqualTo("SnowflakeV3.13.22.jar");
        }

        @Test
        @DisplayName("Fails when nothing matches")
        void failsWithoutMatch() throws IOException {
            Files.writeString(tempDir.resolve("SnowflakeV3.13.22.jar"), "jar");

            assertThatThrownBy(() -> manager.locateJar("Nonexistent", tempDir))
                    .isInstanceOf(NoMatchingDriverException.class)
                    .hasMessageContaining("Nonexistent")
                    .hasMessageContaining(tempDir.toString());
        }

        @Test
        @DisplayName("Does not descend into sub-directories")
        void isNotRecursive() throws IOException {
            Path nested = Files.createDirectories(tempDir.resolve("old"));
            Files.writeString(nested.resolve("ojdbc6.jar"), "jar");

            assertThatThrownBy(() -> manager.locateJar("ojdbc", tempDir))
                    .isInstanceOf(NoMatchingDriverException.class);
        }

        @Test
        @DisplayName("Fails on a missing folder")
        void failsOnMissingFolder() {
            assertThatThrownBy(() -> manager.locateJar("ojdbc", tempDir.resolve("missing")))
                    .isInstanceOf(InvalidTargetException.class)
                    .hasMessageContaining("does not exist");
        }
    }

    @Nested
    class CheckPathToDriver {

        @Test
        @DisplayName("Embedded engines need no folder")
        void embeddedEnginesBypass() {
            manager.checkPathToDriver(null, "sqlite");
            manager.checkPathToDriver(tempDir.resolve("missing"), "sqlite extended");
        }

        @Test
        @DisplayName("Rejects files and empty paths")
        void rejectsInvalidFolders() throws IOException {
            Path file = Files.writeString(tempDir.resolve("file.txt"), "x");

            assertThatThrownBy(() -> manager.checkPathToDriver(file, "oracle"))
                    .isInstanceOf(InvalidTargetException.class)
                    .hasMessageContaining("points to a file");
            assertThatThrownBy(() -> manager.checkPathToDriver(Paths.get(""), "oracle"))
                    .isInstanceOf(InvalidTargetException.class)
                    .hasMessageContaining("hasn't been specified");
        }
    }

    @Nested
    class ResolveFolder {

        @Test
        @DisplayName("Falls back to the configured folder")
        void usesConfiguredDefault() {
            properties.setDirectory(tempDir.toString());

            assertThat(manager.resolveFolder(null)).isEqualTo(tempDir);
            assertThat(manager.resolveFolder("  ")).isEqualTo(tempDir);
        }

        @Test
        @DisplayName("Explicit folders win and ~ expands to the home directory")
        void explicitFolder() {
            properties.setDirectory(tempDir.toString());

            assertThat(manager.resolveFolder("/opt/jdbc")).isEqualTo(Paths.get("/opt/jdbc"));
            assertThat(manager.resolveFolder("~/jdbc"))
                    .isEqualTo(Paths.get(System.getProperty("user.home"), "jdbc"));
        }

        @Test
        @DisplayName("A configured folder under ~ counts as the configured folder once expanded")
        void configuredFolderWithTilde() {
            properties.setDirectory("~/jdbc");

            assertThat(manager.isConfiguredFolder(manager.resolveFolder(null))).isTrue();
            assertThat(manager.isConfiguredFolder(tempDir)).isFalse();
        }

        @Test
        @DisplayName("Without a configured folder every target is unconfigured")
        void noConfiguredFolder() {
            assertThat(manager.isConfiguredFolder(tempDir)).isFalse();
        }

        @Test
        @DisplayName("Fails when no folder is given or configured")
        void failsWithoutFolder() {
            assertThatThrownBy(() -> manager.resolveFolder(""))
                    .isInstanceOf(InvalidTargetException.class)
                    .hasMessageContaining("DATABASECONNECTOR_JAR_FOLDER");
        }
    }

    private static List<String> fileNames(Path folder) throws IOException {
        try (Stream<Path> files = Files.list(folder)) {
            return files.map(path -> path.getFileName().toString()).toList();
        }
    }

    /**
     * Download host serving zips built on the fly.
     */
    private static class FakeHost implements ArtifactDownloader {
        private final Map<String, String[]> archives = new HashMap<>();
        private final List<String> failing = new ArrayList<>();
        private final List<String> garbage = new ArrayList<>();
        final List<URI> requested = new ArrayList<>();

        void publish(String archive, String... entries) {
            archives.put(archive, entries);
        }

        void fail(String archive) {
            failing.add(archive);
        }

        void serveGarbage(String archive) {
            garbage.add(archive);
        }

        @Override
        public void download(URI source, Path destination) throws IOException {
            requested.add(source);
            String name = source.getPath().substring(source.getPath().lastIndexOf('/') + 1);
            if (failing.contains(name)) {
                throw new IOException("HTTP 404 for " + source);
            }
            if (garbage.contains(name)) {
                Files.writeString(destination, "<html>Not Found</html>");
                return;
            }
            ZipFixtures.writeZip(destination, archives.get(name));
        }
    }
}
