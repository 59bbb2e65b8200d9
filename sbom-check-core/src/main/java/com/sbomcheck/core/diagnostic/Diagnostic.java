package com.sbomcheck.core.diagnostic;

import java.util.Objects;

/**
 * One finding about an SPDX document.
 *
 * <p>Findings come from two sources that share this shape: the specification validator
 * and the completeness rule engine. Completeness findings carry the
 * {@link #COMPLETENESS_MARKER} in front of their message.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Diagnostic finding = Diagnostic.completeness(
 *     ElementType.PACKAGE,
 *     "SPDXRef-openssl",
 *     "This package has no supplier populated."
 * );
 * }</pre>
 *
 * @param elementType kind of element the finding refers to
 * @param spdxId ID of the subject element, null for document-scoped findings
 * @param parentId ID of the subject's parent element, null when not applicable
 * @param message human-readable description
 */
public record Diagnostic(
    ElementType elementType,
    String spdxId,
    String parentId,
    String message
) {
    /** Prefix that marks completeness findings. */
    public static final String COMPLETENESS_MARKER = "\n*** completeness exception ***\n";

    /**
     * Compact constructor with validation.
     */
    public Diagnostic {
        Objects.requireNonNull(elementType, "elementType must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Creates a completeness finding about a document-level element.
     *
     * @param elementType element type
     * @param text message without the marker
     * @return marked diagnostic without subject ID
     */
    public static Diagnostic completeness(ElementType elementType, String text) {
        return completeness(elementType, null, text);
    }

    /**
     * Creates a completeness finding about a specific element.
     *
     * @param elementType element type
     * @param spdxId subject element ID
     * @param text message without the marker
     * @return marked diagnostic
     */
    public static Diagnostic completeness(ElementType elementType, String spdxId, String text) {
        return new Diagnostic(elementType, spdxId, null, COMPLETENESS_MARKER + text);
    }

    /**
     * Creates a specification finding.
     *
     * @param elementType element type
     * @param spdxId subject element ID, may be null
     * @param parentId parent element ID, may be null
     * @param message message
     * @return unmarked diagnostic
     */
    public static Diagnostic specification(ElementType elementType, String spdxId, String parentId, String message) {
        return new Diagnostic(elementType, spdxId, parentId, message);
    }

    /**
     * Returns true if this finding was produced by the completeness rule engine.
     *
     * @return true when the message carries the completeness marker
     */
    public boolean isCompletenessFinding() {
        return message.startsWith(COMPLETENESS_MARKER);
    }

    /**
     * Returns the message with line breaks removed so it fits on one line.
     *
     * @return single-line message
     */
    public String singleLineMessage() {
        return message.replace("\r", "").replace("\n", "");
    }
}
