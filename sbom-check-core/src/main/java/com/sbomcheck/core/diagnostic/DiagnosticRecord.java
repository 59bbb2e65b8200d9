package com.sbomcheck.core.diagnostic;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Flat, presentation-ready view of a {@link Diagnostic}.
 *
 * <p>All fields are non-null; missing IDs are rendered as empty strings. Serializes
 * to JSON with snake_case keys matching the CSV header.</p>
 *
 * @param spdxId subject element ID or empty
 * @param parentId parent element ID or empty
 * @param elementType element type name
 * @param message message, line breaks preserved
 */
@JsonPropertyOrder({"spdx_id", "parent_id", "element_type", "message"})
public record DiagnosticRecord(
    @JsonProperty("spdx_id") String spdxId,
    @JsonProperty("parent_id") String parentId,
    @JsonProperty("element_type") String elementType,
    @JsonProperty("message") String message
) {
    /**
     * Builds the view of a diagnostic.
     *
     * @param diagnostic source diagnostic
     * @return flat record
     */
    public static DiagnosticRecord from(Diagnostic diagnostic) {
        return new DiagnosticRecord(
            diagnostic.spdxId() == null ? "" : diagnostic.spdxId(),
            diagnostic.parentId() == null ? "" : diagnostic.parentId(),
            diagnostic.elementType().name(),
            diagnostic.message()
        );
    }
}
