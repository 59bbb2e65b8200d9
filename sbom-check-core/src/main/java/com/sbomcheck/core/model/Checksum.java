package com.sbomcheck.core.model;

import java.util.Objects;

/**
 * A file or package checksum.
 *
 * @param algorithm algorithm name as written in the document, e.g. {@code SHA1}
 * @param value hex digest
 */
public record Checksum(
    String algorithm,
    String value
) {
    public Checksum {
        Objects.requireNonNull(algorithm, "algorithm must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}
