package com.sbomcheck.core.completeness;

import com.sbomcheck.core.model.SpdxDocument;

/**
 * One group of completeness rules.
 *
 * <p>Stages run in a fixed order inside {@link CompletenessRuleEngine}. A stage may
 * halt the engine, in which case no later stage runs; this is how "no packages" and
 * "no files" suppress the checks that depend on them.</p>
 *
 * <p>Implementations must be stateless, must not mutate the document and must not
 * throw: missing data is reported as a diagnostic.</p>
 *
 * <p><b>Example Implementation:</b></p>
 * <pre>{@code
 * public class HasCommentStage implements CompletenessStage {
 *     @Override
 *     public String getId() {
 *         return "has-comment";
 *     }
 *
 *     @Override
 *     public String getDisplayName() {
 *         return "Document comment";
 *     }
 *
 *     @Override
 *     public StageOutcome evaluate(SpdxDocument document) {
 *         if (document.creationInfo().comment() == null) {
 *             return StageOutcome.proceed(List.of(
 *                 Diagnostic.completeness(ElementType.DOCUMENT, "The Document has no comment.")));
 *         }
 *         return StageOutcome.proceed();
 *     }
 * }
 * }</pre>
 *
 * @see StageOutcome
 */
public interface CompletenessStage {

    /**
     * Returns unique identifier for this stage, in kebab-case.
     *
     * @return stage identifier
     */
    String getId();

    /**
     * Returns human-readable name used by the CLI.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Applies this stage's rules to a document.
     *
     * @param document parsed document
     * @return findings and whether the engine should stop after this stage
     */
    StageOutcome evaluate(SpdxDocument document);
}
