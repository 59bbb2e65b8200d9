package com.sbomcheck.core.completeness;

import com.sbomcheck.core.diagnostic.Diagnostic;
import com.sbomcheck.core.diagnostic.ElementType;
import com.sbomcheck.core.model.SpdxDocument;

/**
 * Halts the engine when the document has no packages.
 */
public class PackagePresenceStage implements CompletenessStage {

    @Override
    public String getId() {
        return "has-packages";
    }

    @Override
    public String getDisplayName() {
        return "Document contains packages";
    }

    @Override
    public StageOutcome evaluate(SpdxDocument document) {
        if (document.packages().isEmpty()) {
            return StageOutcome.halt(Diagnostic.completeness(ElementType.DOCUMENT,
                "The Document contains no packages."));
        }
        return StageOutcome.proceed();
    }
}
