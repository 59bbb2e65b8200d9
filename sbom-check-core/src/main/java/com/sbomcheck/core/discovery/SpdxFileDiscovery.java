package com.sbomcheck.core.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Finds SPDX JSON documents in a folder.
 *
 * <p>Only the folder itself is listed, not its subfolders. Every regular file is
 * returned, sorted by name: files whose name ends with the configured extension
 * (case-insensitively) are documents, all others are rejected with an explanation so
 * they can be reported alongside the checked documents.
 */
public class SpdxFileDiscovery {

    private static final Logger log = LoggerFactory.getLogger(SpdxFileDiscovery.class);

    private final String extension;

    /**
     * @param extension file name suffix of SPDX JSON documents, e.g. {@code .spdx.json}
     */
    public SpdxFileDiscovery(String extension) {
        Objects.requireNonNull(extension, "extension must not be null");
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Lists the files of a folder.
     *
     * @param folder folder to list
     * @return discovered files, sorted by file name
     * @throws IOException if the folder cannot be listed
     */
    public List<DiscoveredFile> discover(Path folder) throws IOException {
        if (!Files.isDirectory(folder)) {
            throw new IOException("Not a directory: " + folder);
        }

        String suffix = extension.toLowerCase(Locale.ROOT);
        try (Stream<Path> paths = Files.list(folder)) {
            return paths
                .filter(Files::isRegularFile)
                .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                .map(path -> classify(path, suffix))
                .toList();
        }
    }

    private DiscoveredFile classify(Path path, String suffix) {
        if (path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(suffix)) {
            log.info("SPDX file {} read.", path);
            return DiscoveredFile.document(path);
        }

        String error = "File " + path + " not recognized. Please ensure your files are SPDX JSON format and end with '"
            + extension + "'.";
        log.warn(error);
        return DiscoveredFile.rejected(path, error);
    }
}
