package com.sbomcheck.core.diagnostic;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of checking one SPDX document.
 *
 * <p>A result is either a parse failure (only {@code parseErrors} populated) or a
 * successful check (only {@code diagnostics} populated, possibly empty). Callers tell
 * the three cases apart with {@link #isParseFailure()}, {@link #hasFindings()} and
 * {@link #isClean()}.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * CheckResult result = checker.check(json);
 * if (result.isParseFailure()) {
 *     result.parseErrors().forEach(System.err::println);
 * } else if (result.hasFindings()) {
 *     result.toCsvRows().forEach(row -> System.out.println(String.join(",", row)));
 * }
 * }</pre>
 *
 * @param diagnostics specification findings followed by completeness findings
 * @param parseErrors errors that prevented the document from being parsed
 */
public record CheckResult(
    List<Diagnostic> diagnostics,
    List<String> parseErrors
) {
    public static final String SPDX_ID = "spdx_id";
    public static final String PARENT_ID = "parent_id";
    public static final String ELEMENT_TYPE = "element_type";
    public static final String MESSAGE = "message";

    /** Header row of {@link #toCsvRows()}. */
    public static final List<String> CSV_HEADER = List.of(SPDX_ID, PARENT_ID, ELEMENT_TYPE, MESSAGE);

    /**
     * Compact constructor with validation.
     */
    public CheckResult {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        parseErrors = parseErrors == null ? List.of() : List.copyOf(parseErrors);
        if (!parseErrors.isEmpty() && !diagnostics.isEmpty()) {
            throw new IllegalArgumentException("A parse failure cannot carry diagnostics");
        }
    }

    /**
     * Creates the result for a document that could not be parsed.
     *
     * @param parseErrors parser messages, reported verbatim
     * @return result without diagnostics
     */
    public static CheckResult parseFailure(List<String> parseErrors) {
        return new CheckResult(List.of(), parseErrors);
    }

    /**
     * Creates the result for a parsed document.
     *
     * @param specificationDiagnostics findings of the specification validator
     * @param completenessDiagnostics findings of the completeness rule engine
     * @return result with specification findings first
     */
    public static CheckResult of(List<Diagnostic> specificationDiagnostics, List<Diagnostic> completenessDiagnostics) {
        List<Diagnostic> merged = new ArrayList<>(specificationDiagnostics.size() + completenessDiagnostics.size());
        merged.addAll(specificationDiagnostics);
        merged.addAll(completenessDiagnostics);
        return new CheckResult(merged, List.of());
    }

    /**
     * Returns true if there is anything to report.
     *
     * <p>Note the polarity: {@code true} means the document is <em>not</em> clean.
     *
     * @return true if either diagnostics or parse errors are present
     */
    public boolean hasFindings() {
        return !diagnostics.isEmpty() || !parseErrors.isEmpty();
    }

    /**
     * Returns true if the document could not be parsed.
     *
     * @return true when parse errors are present
     */
    public boolean isParseFailure() {
        return !parseErrors.isEmpty();
    }

    /**
     * Returns true if the document parsed and produced no findings.
     *
     * @return inverse of {@link #hasFindings()}
     */
    public boolean isClean() {
        return !hasFindings();
    }

    /**
     * Returns only the findings produced by the completeness rule engine.
     *
     * @return completeness findings in order
     */
    public List<Diagnostic> completenessDiagnostics() {
        return diagnostics.stream()
            .filter(Diagnostic::isCompletenessFinding)
            .toList();
    }

    /**
     * Projects the diagnostics into flat records.
     *
     * @return one record per diagnostic, in order
     */
    public List<DiagnosticRecord> toRecords() {
        return diagnostics.stream()
            .map(DiagnosticRecord::from)
            .toList();
    }

    /**
     * Projects the diagnostics into CSV rows.
     *
     * <p>The first row is always {@link #CSV_HEADER}. Each following row holds one
     * diagnostic with line breaks stripped from its message.
     *
     * @return header plus one row per diagnostic
     */
    public List<List<String>> toCsvRows() {
        List<List<String>> rows = new ArrayList<>(diagnostics.size() + 1);
        rows.add(CSV_HEADER);
        for (Diagnostic diagnostic : diagnostics) {
            DiagnosticRecord view = DiagnosticRecord.from(diagnostic);
            rows.add(List.of(
                view.spdxId(),
                view.parentId(),
                view.elementType(),
                diagnostic.singleLineMessage()
            ));
        }
        return List.copyOf(rows);
    }
}
