package com.sbomcheck.core.completeness;

import com.sbomcheck.core.diagnostic.Diagnostic;
import com.sbomcheck.core.diagnostic.ElementType;
import com.sbomcheck.core.model.Relationship;
import com.sbomcheck.core.model.RelationshipType;
import com.sbomcheck.core.model.SpdxDocument;

import java.util.List;

/**
 * Checks that the document describes exactly one top-level package and that this
 * package is the first one listed.
 *
 * <p>Only {@code DESCRIBES} relationships whose source is the document itself are
 * counted. A wrong count and a wrong target are mutually exclusive: at most one
 * finding is produced. Expects at least one package, which
 * {@link PackagePresenceStage} guarantees.</p>
 */
public class PrimaryPackageStage implements CompletenessStage {

    @Override
    public String getId() {
        return "primary-package";
    }

    @Override
    public String getDisplayName() {
        return "Primary package is the single DESCRIBES target";
    }

    @Override
    public StageOutcome evaluate(SpdxDocument document) {
        String documentId = document.documentId();
        String primaryPackageId = document.packages().get(0).spdxId();

        List<Relationship> describes = document.relationships().stream()
            .filter(relationship -> relationship.is(RelationshipType.DESCRIBES, documentId))
            .toList();

        if (describes.size() != 1) {
            return StageOutcome.proceed(List.of(Diagnostic.completeness(ElementType.DOCUMENT,
                "This SPDX Document has an incorrect number of DESCRIBES relationships. "
                    + "An SPDX document must directly describe one top-level package. "
                    + "This document describes " + describes.size() + " packages.")));
        }

        if (!primaryPackageId.equals(describes.get(0).relatedSpdxElementId())) {
            return StageOutcome.proceed(List.of(Diagnostic.completeness(ElementType.DOCUMENT,
                "This SPDX Document's DESCRIBES relationship is to a package other than the first "
                    + "in the package info section. Either the relationship is incorrect or the "
                    + "top-level package that the document is describing is not first in the "
                    + "packages collection.")));
        }

        return StageOutcome.proceed();
    }
}
