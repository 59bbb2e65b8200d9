package com.sbomcheck.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Document-level metadata of an SPDX document.
 *
 * @param spdxVersion specification version, e.g. {@code SPDX-2.3}
 * @param spdxId document identifier, normally {@code SPDXRef-DOCUMENT}
 * @param name document name, may be empty
 * @param documentNamespace unique URI of the document
 * @param dataLicense license of the document itself
 * @param creators creator strings ({@code Tool: ...}, {@code Organization: ...})
 * @param created creation timestamp as written in the document
 * @param licenseListVersion SPDX license list version, null when missing
 * @param comment optional creator comment
 */
public record CreationInfo(
    String spdxVersion,
    String spdxId,
    String name,
    String documentNamespace,
    String dataLicense,
    List<String> creators,
    String created,
    String licenseListVersion,
    String comment
) {
    /**
     * Compact constructor with validation.
     */
    public CreationInfo {
        Objects.requireNonNull(spdxVersion, "spdxVersion must not be null");
        Objects.requireNonNull(spdxId, "spdxId must not be null");
        Objects.requireNonNull(name, "name must not be null");
        creators = creators == null ? List.of() : List.copyOf(creators);
    }
}
