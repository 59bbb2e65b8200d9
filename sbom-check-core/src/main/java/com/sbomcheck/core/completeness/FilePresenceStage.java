package com.sbomcheck.core.completeness;

import com.sbomcheck.core.diagnostic.Diagnostic;
import com.sbomcheck.core.diagnostic.ElementType;
import com.sbomcheck.core.model.SpdxDocument;

/**
 * Halts the engine when the document has no files.
 */
public class FilePresenceStage implements CompletenessStage {

    @Override
    public String getId() {
        return "has-files";
    }

    @Override
    public String getDisplayName() {
        return "Document contains files";
    }

    @Override
    public StageOutcome evaluate(SpdxDocument document) {
        if (document.files().isEmpty()) {
            return StageOutcome.halt(Diagnostic.completeness(ElementType.DOCUMENT,
                "The Document contains no files."));
        }
        return StageOutcome.proceed();
    }
}
