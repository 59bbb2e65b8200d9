package com.sbomcheck.core.completeness;

import com.sbomcheck.core.diagnostic.Diagnostic;
import com.sbomcheck.core.model.SpdxDocument;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Applies the completeness rules to a parsed SPDX document.
 *
 * <p>Rules are grouped into stages that run in a fixed order:
 * <ol>
 *   <li>{@link CreationInfoStage} - version, name, license list version</li>
 *   <li>{@link PackagePresenceStage} - halts when there are no packages</li>
 *   <li>{@link PrimaryPackageStage} - single DESCRIBES to the first package</li>
 *   <li>{@link PackageStage} - supplier, files analyzed, copyright</li>
 *   <li>{@link FilePresenceStage} - halts when there are no files</li>
 *   <li>{@link FileStage} - file name, license info, copyright</li>
 * </ol>
 *
 * <p>The order of the returned diagnostics is part of the contract: some report
 * consumers read them by position. The engine is stateless and never throws, so one
 * instance may be shared across threads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CompletenessRuleEngine engine = CompletenessRuleEngine.defaults();
 * List<Diagnostic> findings = engine.evaluate(document);
 * }</pre>
 */
public class CompletenessRuleEngine {

    private final List<CompletenessStage> stages;

    /**
     * Creates an engine with an explicit stage order.
     *
     * @param stages stages in execution order
     */
    public CompletenessRuleEngine(List<CompletenessStage> stages) {
        Objects.requireNonNull(stages, "stages must not be null");
        this.stages = List.copyOf(stages);
    }

    /**
     * Creates the standard engine accepting only the default SPDX versions.
     *
     * @return engine with the standard stages
     */
    public static CompletenessRuleEngine defaults() {
        return withSpdxVersions(CreationInfoStage.DEFAULT_SPDX_VERSIONS);
    }

    /**
     * Creates the standard engine with a custom set of accepted SPDX versions.
     *
     * @param spdxVersions accepted specification versions
     * @return engine with the standard stages
     */
    public static CompletenessRuleEngine withSpdxVersions(List<String> spdxVersions) {
        return new CompletenessRuleEngine(List.of(
            new CreationInfoStage(spdxVersions),
            new PackagePresenceStage(),
            new PrimaryPackageStage(),
            new PackageStage(),
            new FilePresenceStage(),
            new FileStage()
        ));
    }

    /**
     * Returns the stages in execution order.
     *
     * @return immutable stage list
     */
    public List<CompletenessStage> stages() {
        return stages;
    }

    /**
     * Evaluates all stages until one halts.
     *
     * @param document parsed document, not modified
     * @return completeness findings in stage order
     */
    public List<Diagnostic> evaluate(SpdxDocument document) {
        Objects.requireNonNull(document, "document must not be null");

        List<Diagnostic> diagnostics = new ArrayList<>();
        for (CompletenessStage stage : stages) {
            StageOutcome outcome = stage.evaluate(document);
            diagnostics.addAll(outcome.diagnostics());
            if (outcome.halt()) {
                break;
            }
        }
        return List.copyOf(diagnostics);
    }
}
