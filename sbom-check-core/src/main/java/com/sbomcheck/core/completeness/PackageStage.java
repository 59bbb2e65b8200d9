package com.sbomcheck.core.completeness;

import com.sbomcheck.core.diagnostic.Diagnostic;
import com.sbomcheck.core.diagnostic.ElementType;
import com.sbomcheck.core.model.SpdxDocument;
import com.sbomcheck.core.model.SpdxPackage;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-package rules: supplier, analyzed files and copyright evidence for licensed
 * packages. Findings are ordered by package, then by rule.
 */
public class PackageStage implements CompletenessStage {

    @Override
    public String getId() {
        return "packages";
    }

    @Override
    public String getDisplayName() {
        return "Package supplier, analysis and copyright";
    }

    @Override
    public StageOutcome evaluate(SpdxDocument document) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (SpdxPackage spdxPackage : document.packages()) {
            checkPackage(spdxPackage, diagnostics);
        }
        return StageOutcome.proceed(diagnostics);
    }

    private void checkPackage(SpdxPackage spdxPackage, List<Diagnostic> diagnostics) {
        String spdxId = spdxPackage.spdxId();

        if (spdxPackage.supplier().isAbsentOrNoAssertion()) {
            diagnostics.add(Diagnostic.completeness(ElementType.PACKAGE, spdxId,
                "This package has no supplier populated."));
        }

        if (!spdxPackage.filesAnalyzed()) {
            diagnostics.add(Diagnostic.completeness(ElementType.PACKAGE, spdxId,
                "The files have not been analyzed for this package."));
        }

        // packages without any asserted license are exempt
        if (spdxPackage.hasAssertedLicense() && !spdxPackage.copyrightText().isPresent()) {
            diagnostics.add(Diagnostic.completeness(ElementType.PACKAGE, spdxId,
                "This package has declared licenses but no copyright text populated."));
        }
    }
}
