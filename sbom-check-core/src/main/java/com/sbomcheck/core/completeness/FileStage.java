package com.sbomcheck.core.completeness;

import com.sbomcheck.core.diagnostic.Diagnostic;
import com.sbomcheck.core.diagnostic.ElementType;
import com.sbomcheck.core.model.SpdxDocument;
import com.sbomcheck.core.model.SpdxFile;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-file rules: every file needs a name; files with a concluded license also need
 * license information and copyright text.
 */
public class FileStage implements CompletenessStage {

    @Override
    public String getId() {
        return "files";
    }

    @Override
    public String getDisplayName() {
        return "File name, license info and copyright";
    }

    @Override
    public StageOutcome evaluate(SpdxDocument document) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (SpdxFile file : document.files()) {
            checkFile(file, diagnostics);
        }
        return StageOutcome.proceed(diagnostics);
    }

    private void checkFile(SpdxFile file, List<Diagnostic> diagnostics) {
        String spdxId = file.spdxId();

        if (file.name().isEmpty()) {
            diagnostics.add(Diagnostic.completeness(ElementType.FILE, spdxId,
                "This file has no name."));
        }

        if (!file.licenseConcluded().isAsserted()) {
            return;
        }

        if (file.licenseInfoInFile().isEmpty()) {
            diagnostics.add(Diagnostic.completeness(ElementType.FILE, spdxId,
                "This file has a concluded license but license_info_in_file is not populated."));
        }

        if (!file.copyrightText().isPresent()) {
            diagnostics.add(Diagnostic.completeness(ElementType.FILE, spdxId,
                "This file has a concluded license but no copyright text."));
        }
    }
}
