package com.sbomcheck.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A file entry of an SPDX document.
 *
 * @param spdxId file identifier
 * @param name file name (path), may be empty
 * @param checksums file checksums
 * @param licenseConcluded concluded license expression
 * @param licenseInfoInFile license identifiers found in the file, possibly empty
 * @param copyrightText copyright text
 */
public record SpdxFile(
    String spdxId,
    String name,
    List<Checksum> checksums,
    SpdxValue licenseConcluded,
    List<String> licenseInfoInFile,
    SpdxValue copyrightText
) {
    /**
     * Compact constructor with validation.
     */
    public SpdxFile {
        Objects.requireNonNull(spdxId, "spdxId must not be null");
        name = name == null ? "" : name;
        checksums = checksums == null ? List.of() : List.copyOf(checksums);
        licenseConcluded = licenseConcluded == null ? SpdxValue.absent() : licenseConcluded;
        licenseInfoInFile = licenseInfoInFile == null ? List.of() : List.copyOf(licenseInfoInFile);
        copyrightText = copyrightText == null ? SpdxValue.absent() : copyrightText;
    }

    /**
     * Finds the checksum for an algorithm.
     *
     * @param algorithm algorithm name, compared case-insensitively
     * @return the checksum if present
     */
    public Optional<Checksum> checksum(String algorithm) {
        return checksums.stream()
            .filter(checksum -> checksum.algorithm().equalsIgnoreCase(algorithm))
            .findFirst();
    }
}
