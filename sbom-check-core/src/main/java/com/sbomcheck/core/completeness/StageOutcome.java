package com.sbomcheck.core.completeness;

import com.sbomcheck.core.diagnostic.Diagnostic;

import java.util.List;

/**
 * Result of one {@link CompletenessStage}.
 *
 * @param diagnostics findings in rule order
 * @param halt whether later stages must be skipped
 */
public record StageOutcome(
    List<Diagnostic> diagnostics,
    boolean halt
) {
    /**
     * Compact constructor with validation.
     */
    public StageOutcome {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * Continue with the next stage, nothing found.
     *
     * @return empty outcome
     */
    public static StageOutcome proceed() {
        return new StageOutcome(List.of(), false);
    }

    /**
     * Continue with the next stage.
     *
     * @param diagnostics findings of this stage
     * @return outcome that does not halt
     */
    public static StageOutcome proceed(List<Diagnostic> diagnostics) {
        return new StageOutcome(diagnostics, false);
    }

    /**
     * Stop the engine after this stage.
     *
     * @param diagnostic the finding that caused the stop
     * @return halting outcome
     */
    public static StageOutcome halt(Diagnostic diagnostic) {
        return new StageOutcome(List.of(diagnostic), true);
    }
}
