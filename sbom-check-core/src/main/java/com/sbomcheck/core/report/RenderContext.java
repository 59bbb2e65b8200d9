package com.sbomcheck.core.report;

import com.sbomcheck.core.config.CheckConfig;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Report options shared by every renderer of one check run.
 *
 * <p>File-writing renderers place their reports under {@link #outputDirectory()}; the
 * console renderer only reads {@link #colors()}.
 *
 * @param outputDirectory directory the JSON and CSV reports are written to
 * @param jsonFileName file name of the combined JSON report
 * @param colors whether console findings are highlighted with ANSI colors
 */
public record RenderContext(
    Path outputDirectory,
    String jsonFileName,
    boolean colors
) {
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        if (jsonFileName == null || jsonFileName.isBlank()) {
            jsonFileName = CheckConfig.DEFAULT_JSON_FILE_NAME;
        }
    }

    /**
     * Plain-text context writing to the given directory with the default JSON file name.
     *
     * @param outputDirectory report directory
     * @return context without colors
     */
    public static RenderContext plain(Path outputDirectory) {
        return new RenderContext(outputDirectory, null, false);
    }

    /**
     * Builds the context from the effective output settings of a configuration.
     *
     * @param config loaded configuration
     * @param outputOverride directory given on the command line, may be null
     * @return render context
     */
    public static RenderContext fromConfig(CheckConfig config, String outputOverride) {
        String directory = outputOverride != null ? outputOverride : config.effectiveOutputDirectory();
        return new RenderContext(Paths.get(directory), config.effectiveJsonFileName(), config.effectiveColors());
    }

    /**
     * @return location of the combined JSON report
     */
    public Path jsonReportPath() {
        return outputDirectory.resolve(jsonFileName);
    }

    /**
     * Location of the CSV report for one checked document.
     *
     * @param documentFileName file name of the checked document
     * @return {@code <outputDirectory>/<documentFileName>_exceptions.csv}
     */
    public Path csvReportPath(String documentFileName) {
        return outputDirectory.resolve(documentFileName + "_exceptions.csv");
    }
}
