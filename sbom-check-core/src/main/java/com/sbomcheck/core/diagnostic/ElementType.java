package com.sbomcheck.core.diagnostic;

/**
 * Kind of SPDX element a diagnostic refers to.
 */
public enum ElementType {
    /** Document creation metadata */
    CREATION_INFO,

    /** The document as a whole */
    DOCUMENT,

    /** A package entry */
    PACKAGE,

    /** A file entry */
    FILE
}
