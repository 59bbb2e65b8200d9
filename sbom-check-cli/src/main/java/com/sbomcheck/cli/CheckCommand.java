package com.sbomcheck.cli;

import com.sbomcheck.core.SbomChecker;
import com.sbomcheck.core.config.CheckConfig;
import com.sbomcheck.core.config.ConfigLoader;
import com.sbomcheck.core.diagnostic.CheckResult;
import com.sbomcheck.core.report.RenderContext;
import com.sbomcheck.core.report.ReportRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to check every SPDX JSON document in a folder.
 *
 * <p>Orchestrates the pipeline:
 * <ol>
 *   <li>Load {@code sbomcheck.yaml} (defaults if missing)</li>
 *   <li>Discover the folder's files and check each SPDX JSON document</li>
 *   <li>Render the results: CSV always, console and JSON on request</li>
 * </ol>
 *
 * <p>Exit codes: {@code 0} when every document is clean, {@code 1} when any document
 * has findings or could not be parsed, {@code 2} when the check itself failed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * sbomcheck check ./sboms
 * sbomcheck check ./sboms --print-console --print-json -o ./reports
 * }</pre>
 */
@Command(
    name = "check",
    description = "Check SPDX JSON documents for specification conformance and completeness",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    static final int EXIT_CLEAN = 0;
    static final int EXIT_FINDINGS = 1;
    static final int EXIT_FAILURE = 2;

    @Parameters(
        index = "0",
        paramLabel = "spdx_json_folder",
        description = "Path to directory containing SPDX JSON file(s)"
    )
    private Path spdxFolder;

    @Option(names = {"--print-console"}, description = "Output results to console")
    private boolean printConsole;

    @Option(names = {"--print-json"}, description = "Output results to a JSON file")
    private boolean printJson;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory for reports (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: sbomcheck.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        try {
            log.info("Checking SPDX documents in: {}", spdxFolder.toAbsolutePath());

            CheckConfig config = ConfigLoader.load(configPath);
            SbomChecker checker = SbomChecker.fromConfig(config);

            Map<String, CheckResult> results = checker.checkAll(spdxFolder);
            if (results.isEmpty()) {
                System.err.println("⚠ WARNING: no files found in " + spdxFolder.toAbsolutePath());
            }

            renderResults(results, config);

            long withFindings = results.values().stream().filter(CheckResult::hasFindings).count();
            log.info("{} of {} files have findings", withFindings, results.size());
            return withFindings == 0 ? EXIT_CLEAN : EXIT_FINDINGS;

        } catch (Exception e) {
            log.error("Check failed", e);
            System.err.println("✗ Check failed: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * Renders results with the selected renderers, discovered via ServiceLoader.
     */
    private void renderResults(Map<String, CheckResult> results, CheckConfig config) {
        List<String> selected = new ArrayList<>();
        if (printConsole) {
            selected.add("console");
        }
        if (printJson) {
            selected.add("json");
        }
        selected.add("csv");

        RenderContext context = RenderContext.fromConfig(config, getOutputDirectory(config));

        List<ReportRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(ReportRenderer.class).forEach(renderers::add);
        log.debug("Discovered {} report renderers", renderers.size());

        for (String id : selected) {
            ReportRenderer renderer = renderers.stream()
                .filter(r -> id.equals(r.getId()))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Report renderer not found: " + id));
            log.debug("Rendering with: {}", renderer.getId());
            renderer.render(results, context);
        }
    }

    private String getOutputDirectory(CheckConfig config) {
        if (outputDir != null) {
            return outputDir.toAbsolutePath().toString();
        }
        return Paths.get(config.effectiveOutputDirectory()).toAbsolutePath().toString();
    }
}
