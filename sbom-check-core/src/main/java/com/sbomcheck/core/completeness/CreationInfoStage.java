package com.sbomcheck.core.completeness;

import com.sbomcheck.core.diagnostic.Diagnostic;
import com.sbomcheck.core.diagnostic.ElementType;
import com.sbomcheck.core.model.CreationInfo;
import com.sbomcheck.core.model.SpdxDocument;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks document-level metadata: supported SPDX version, document name and license
 * list version. Always runs and never halts.
 */
public class CreationInfoStage implements CompletenessStage {

    /** Versions accepted when nothing else is configured. */
    public static final List<String> DEFAULT_SPDX_VERSIONS = List.of("SPDX-2.3");

    private final List<String> spdxVersions;

    public CreationInfoStage() {
        this(DEFAULT_SPDX_VERSIONS);
    }

    /**
     * @param spdxVersions accepted specification versions, in the order they are reported
     */
    public CreationInfoStage(List<String> spdxVersions) {
        Objects.requireNonNull(spdxVersions, "spdxVersions must not be null");
        if (spdxVersions.isEmpty()) {
            throw new IllegalArgumentException("At least one SPDX version must be accepted");
        }
        this.spdxVersions = List.copyOf(spdxVersions);
    }

    @Override
    public String getId() {
        return "creation-info";
    }

    @Override
    public String getDisplayName() {
        return "Creation info (version, name, license list version)";
    }

    public List<String> getSpdxVersions() {
        return spdxVersions;
    }

    @Override
    public StageOutcome evaluate(SpdxDocument document) {
        CreationInfo creationInfo = document.creationInfo();
        List<Diagnostic> diagnostics = new ArrayList<>();

        if (!spdxVersions.contains(creationInfo.spdxVersion())) {
            diagnostics.add(Diagnostic.completeness(ElementType.CREATION_INFO,
                "The Document uses an invalid version. Valid versions include: " + spdxVersions + "."));
        }
        if (isEmpty(creationInfo.name())) {
            diagnostics.add(Diagnostic.completeness(ElementType.CREATION_INFO,
                "The Document has no name."));
        }
        if (isEmpty(creationInfo.licenseListVersion())) {
            diagnostics.add(Diagnostic.completeness(ElementType.CREATION_INFO,
                "The Document does not have a license list version."));
        }

        return StageOutcome.proceed(diagnostics);
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
