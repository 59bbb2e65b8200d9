package com.sbomcheck.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Parsed SPDX document graph.
 *
 * <p>Immutable: the collections are defensive copies, and the order of packages and
 * files is the order in which they appear in the serialized document. The first
 * package is treated as the primary package.</p>
 *
 * @param creationInfo document-level metadata
 * @param packages packages in document order
 * @param files files in document order
 * @param relationships relationships between elements
 */
public record SpdxDocument(
    CreationInfo creationInfo,
    List<SpdxPackage> packages,
    List<SpdxFile> files,
    List<Relationship> relationships
) {
    /**
     * Compact constructor with validation.
     */
    public SpdxDocument {
        Objects.requireNonNull(creationInfo, "creationInfo must not be null");
        packages = packages == null ? List.of() : List.copyOf(packages);
        files = files == null ? List.of() : List.copyOf(files);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
    }

    /**
     * Returns the document identifier.
     *
     * @return the creation info's SPDX ID
     */
    public String documentId() {
        return creationInfo.spdxId();
    }
}
