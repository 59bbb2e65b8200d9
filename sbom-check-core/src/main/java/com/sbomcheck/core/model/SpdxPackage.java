package com.sbomcheck.core.model;

import java.util.Objects;

/**
 * A package entry of an SPDX document.
 *
 * @param spdxId package identifier
 * @param name package name
 * @param version version string, null when missing
 * @param supplier supplier actor
 * @param downloadLocation download location
 * @param filesAnalyzed whether the package's files were analyzed (SPDX default true)
 * @param licenseConcluded concluded license expression
 * @param licenseDeclared declared license expression
 * @param copyrightText copyright text
 * @param verificationCode package verification code, null when missing
 */
public record SpdxPackage(
    String spdxId,
    String name,
    String version,
    SpdxValue supplier,
    SpdxValue downloadLocation,
    boolean filesAnalyzed,
    SpdxValue licenseConcluded,
    SpdxValue licenseDeclared,
    SpdxValue copyrightText,
    String verificationCode
) {
    /**
     * Compact constructor with validation.
     */
    public SpdxPackage {
        Objects.requireNonNull(spdxId, "spdxId must not be null");
        Objects.requireNonNull(name, "name must not be null");
        supplier = supplier == null ? SpdxValue.absent() : supplier;
        downloadLocation = downloadLocation == null ? SpdxValue.absent() : downloadLocation;
        licenseConcluded = licenseConcluded == null ? SpdxValue.absent() : licenseConcluded;
        licenseDeclared = licenseDeclared == null ? SpdxValue.absent() : licenseDeclared;
        copyrightText = copyrightText == null ? SpdxValue.absent() : copyrightText;
    }

    /**
     * Returns true if either the concluded or the declared license is a genuine expression.
     *
     * @return true when a license is asserted
     */
    public boolean hasAssertedLicense() {
        return licenseConcluded.isAsserted() || licenseDeclared.isAsserted();
    }
}
