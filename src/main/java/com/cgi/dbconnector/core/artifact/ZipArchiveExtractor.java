package com.cgi.dbconnector.core.artifact;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Extracts zip archives in place.
 */
public class ZipArchiveExtractor {

    /**
     * Extracts every entry of the archive below the target directory.
     *
     * @param archive Zip file
     * @param targetDir Directory to extract into
     * @return Extracted files, in archive order
     * @throws IOException If the archive is not a valid zip, or an entry would land outside the target
     */
    public List<Path> extract(Path archive, Path targetDir) throws IOException {
        Path root = targetDir.toAbsolutePath().normalize();
        List<Path> extracted = new ArrayList<>();
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                Path destination = root.resolve(entry.getName()).normalize();
                if (!destination.startsWith(root)) {
                    throw new IOException("Zip entry " + entry.getName() + " escapes target directory " + root);
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(destination);
                    continue;
                }
                Files.createDirectories(destination.getParent());
                try (InputStream in = zip.getInputStream(entry)) {
                    Files.copy(in, destination, StandardCopyOption.REPLACE_EXISTING);
                }
                extracted.add(destination);
            }
        }
        return extracted;
    }
}
