package com.sbomcheck.core.model;

import java.util.Objects;

/**
 * A field value that may be absent, an SPDX keyword, or a real value.
 *
 * <p>SPDX distinguishes "no claim is made" ({@code NOASSERTION}) and "there is none"
 * ({@code NONE}) from both a populated value and a missing field. Presence checks
 * switch on {@link #kind()} rather than comparing strings.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * SpdxValue supplier = SpdxValue.parse("Organization: Acme");
 * if (supplier.isAsserted()) {
 *     // a genuine value was supplied
 * }
 * }</pre>
 *
 * @param kind which alternative this value holds
 * @param text the literal value, only set for {@link Kind#VALUE}
 */
public record SpdxValue(
    Kind kind,
    String text
) {
    /** SPDX keyword meaning no claim is made. */
    public static final String NOASSERTION = "NOASSERTION";

    /** SPDX keyword meaning the value is known to be empty. */
    public static final String NONE = "NONE";

    private static final SpdxValue ABSENT_VALUE = new SpdxValue(Kind.ABSENT, null);
    private static final SpdxValue NO_ASSERTION_VALUE = new SpdxValue(Kind.NO_ASSERTION, null);
    private static final SpdxValue NONE_VALUE = new SpdxValue(Kind.NONE, null);

    /**
     * Alternatives of a field value.
     */
    public enum Kind {
        /** Field missing or empty */
        ABSENT,
        /** {@code NOASSERTION} */
        NO_ASSERTION,
        /** {@code NONE} */
        NONE,
        /** A populated value */
        VALUE
    }

    /**
     * Compact constructor with validation.
     */
    public SpdxValue {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == Kind.VALUE) {
            Objects.requireNonNull(text, "text must not be null for VALUE");
        } else if (text != null) {
            throw new IllegalArgumentException("text is only allowed for VALUE, got kind " + kind);
        }
    }

    public static SpdxValue absent() {
        return ABSENT_VALUE;
    }

    public static SpdxValue noAssertion() {
        return NO_ASSERTION_VALUE;
    }

    public static SpdxValue none() {
        return NONE_VALUE;
    }

    public static SpdxValue of(String text) {
        return new SpdxValue(Kind.VALUE, text);
    }

    /**
     * Maps a raw serialized value onto its alternative.
     *
     * <p>{@code null} and the empty string become {@link Kind#ABSENT}. The SPDX keywords
     * {@code NOASSERTION} and {@code NONE} become their own kinds. Anything else is a
     * {@link Kind#VALUE}, trimmed unless it is whitespace only.
     *
     * @param raw raw value from the document, may be null
     * @return the matching value
     */
    public static SpdxValue parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            return ABSENT_VALUE;
        }
        String trimmed = raw.trim();
        if (NOASSERTION.equals(trimmed)) {
            return NO_ASSERTION_VALUE;
        }
        if (NONE.equals(trimmed)) {
            return NONE_VALUE;
        }
        return of(trimmed.isEmpty() ? raw : trimmed);
    }

    /**
     * Returns true if this holds a genuine value.
     *
     * @return true only for {@link Kind#VALUE}
     */
    public boolean isAsserted() {
        return kind == Kind.VALUE;
    }

    /**
     * Returns true if the field was written at all, keywords included.
     *
     * @return false only for {@link Kind#ABSENT}
     */
    public boolean isPresent() {
        return kind != Kind.ABSENT;
    }

    /**
     * Returns true if the field is missing or is {@code NOASSERTION}.
     *
     * @return true when no claim is made
     */
    public boolean isAbsentOrNoAssertion() {
        return kind == Kind.ABSENT || kind == Kind.NO_ASSERTION;
    }

    /**
     * Renders this value the way it appears in an SPDX document.
     *
     * @return the text, the keyword, or null when absent
     */
    public String serialized() {
        return switch (kind) {
            case ABSENT -> null;
            case NO_ASSERTION -> NOASSERTION;
            case NONE -> NONE;
            case VALUE -> text;
        };
    }

    @Override
    public String toString() {
        return kind == Kind.ABSENT ? "<absent>" : serialized();
    }
}
