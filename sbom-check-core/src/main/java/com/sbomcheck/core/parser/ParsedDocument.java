package com.sbomcheck.core.parser;

import com.sbomcheck.core.model.SpdxDocument;

import java.util.Objects;

/**
 * A document as read by the SPDX library, together with the model built from it.
 *
 * <p>The completeness rules work on {@link #document()}; specification validation needs
 * the library's own object graph in {@link #libraryDocument()}.
 *
 * @param document model used by the completeness rules
 * @param libraryDocument the SPDX library's view of the same document
 */
public record ParsedDocument(
    SpdxDocument document,
    org.spdx.library.model.SpdxDocument libraryDocument
) {
    public ParsedDocument {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(libraryDocument, "libraryDocument must not be null");
    }
}
