package com.sbomcheck.core.discovery;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A file found in an input folder.
 *
 * @param path file path
 * @param error reason the file is not checked, or null for SPDX JSON documents
 */
public record DiscoveredFile(
    Path path,
    String error
) {
    public DiscoveredFile {
        Objects.requireNonNull(path, "path must not be null");
    }

    public static DiscoveredFile document(Path path) {
        return new DiscoveredFile(path, null);
    }

    public static DiscoveredFile rejected(Path path, String error) {
        return new DiscoveredFile(path, Objects.requireNonNull(error, "error must not be null"));
    }

    /**
     * @return true if the file is an SPDX JSON document to check
     */
    public boolean isDocument() {
        return error == null;
    }

    /**
     * @return the file name, used as the report key
     */
    public String fileName() {
        return path.getFileName().toString();
    }
}
