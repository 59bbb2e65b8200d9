package com.sbomcheck.core.report;

import com.sbomcheck.core.diagnostic.CheckResult;

import java.util.Map;

/**
 * Interface for renderers that publish check results.
 *
 * <p>Renderers write results to different targets: the console, a JSON report or one
 * CSV file per document. They are discovered via Java Service Provider Interface (SPI);
 * the CLI selects them by {@link #getId()}.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.sbomcheck.core.report.ReportRenderer}
 *
 * @see RenderContext
 */
public interface ReportRenderer {

    /**
     * Returns unique identifier for this renderer, in lowercase (e.g. "console", "csv").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders results to the target destination.
     *
     * @param results check results keyed by document file name, in report order
     * @param context rendering context with output directory and settings
     * @throws IllegalStateException if output cannot be written
     */
    void render(Map<String, CheckResult> results, RenderContext context);
}
