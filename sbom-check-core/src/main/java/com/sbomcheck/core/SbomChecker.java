package com.sbomcheck.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sbomcheck.core.completeness.CompletenessRuleEngine;
import com.sbomcheck.core.config.CheckConfig;
import com.sbomcheck.core.diagnostic.CheckResult;
import com.sbomcheck.core.diagnostic.Diagnostic;
import com.sbomcheck.core.discovery.DiscoveredFile;
import com.sbomcheck.core.discovery.SpdxFileDiscovery;
import com.sbomcheck.core.parser.ParsedDocument;
import com.sbomcheck.core.parser.SpdxJsonParser;
import com.sbomcheck.core.parser.SpdxParsingException;
import com.sbomcheck.core.validation.SpdxLibraryValidator;
import com.sbomcheck.core.validation.SpecificationValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for checking SPDX JSON documents.
 *
 * <p>Runs the pipeline for one document:
 * <ol>
 *   <li>Read the text as JSON</li>
 *   <li>Load it with the SPDX library and build the document model ({@link SpdxJsonParser})</li>
 *   <li>Validate against the specification with a {@link SpecificationValidator}</li>
 *   <li>Apply the {@link CompletenessRuleEngine}</li>
 * </ol>
 *
 * <p>If step 1 or 2 fails the result carries only parse errors and no later step runs.
 * Otherwise specification findings come first, then completeness findings. Nothing is
 * thrown for bad input. Instances are immutable and thread-safe.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SbomChecker checker = SbomChecker.defaults();
 * CheckResult result = checker.check(Files.readString(path));
 *
 * Map<String, CheckResult> results = checker.checkAll(Paths.get("sboms"));
 * }</pre>
 */
public class SbomChecker {

    private static final Logger log = LoggerFactory.getLogger(SbomChecker.class);

    private final ObjectMapper objectMapper;
    private final SpdxJsonParser parser;
    private final SpecificationValidator specificationValidator;
    private final CompletenessRuleEngine completenessRuleEngine;
    private final SpdxFileDiscovery discovery;

    public SbomChecker(SpdxJsonParser parser,
                       SpecificationValidator specificationValidator,
                       CompletenessRuleEngine completenessRuleEngine,
                       SpdxFileDiscovery discovery) {
        this.objectMapper = new ObjectMapper();
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.specificationValidator = Objects.requireNonNull(specificationValidator,
            "specificationValidator must not be null");
        this.completenessRuleEngine = Objects.requireNonNull(completenessRuleEngine,
            "completenessRuleEngine must not be null");
        this.discovery = Objects.requireNonNull(discovery, "discovery must not be null");
    }

    /**
     * Creates a checker with the default rules and discovery settings.
     *
     * @return default checker
     */
    public static SbomChecker defaults() {
        return fromConfig(CheckConfig.defaults());
    }

    /**
     * Creates a checker from configuration.
     *
     * @param config loaded configuration
     * @return configured checker
     */
    public static SbomChecker fromConfig(CheckConfig config) {
        return new SbomChecker(
            new SpdxJsonParser(),
            new SpdxLibraryValidator(),
            CompletenessRuleEngine.withSpdxVersions(config.effectiveSpdxVersions()),
            new SpdxFileDiscovery(config.effectiveExtension())
        );
    }

    public CompletenessRuleEngine getCompletenessRuleEngine() {
        return completenessRuleEngine;
    }

    /**
     * Checks one SPDX JSON document.
     *
     * @param spdxJson document text
     * @return parse errors, or specification findings followed by completeness findings
     */
    public CheckResult check(String spdxJson) {
        JsonNode tree;
        try {
            tree = objectMapper.readTree(spdxJson == null ? "" : spdxJson);
        } catch (JsonProcessingException e) {
            log.warn("Failed to read the provided JSON: {}", e.getOriginalMessage());
            return CheckResult.parseFailure(List.of("Unable to read document as JSON: " + e.getOriginalMessage()));
        }

        ParsedDocument parsed;
        try {
            parsed = parser.parse(tree);
        } catch (SpdxParsingException e) {
            log.warn("Failed to parse the provided JSON.");
            return CheckResult.parseFailure(e.getMessages());
        }

        log.info("JSON parsed. Beginning validation.");
        List<Diagnostic> specificationDiagnostics = specificationValidator.validate(parsed);
        log.info("Completed standard SPDX validation.");

        List<Diagnostic> completenessDiagnostics = completenessRuleEngine.evaluate(parsed.document());
        log.info("Completed completeness validation.");

        log.debug("{} specification and {} completeness findings",
            specificationDiagnostics.size(), completenessDiagnostics.size());
        return CheckResult.of(specificationDiagnostics, completenessDiagnostics);
    }

    /**
     * Checks one SPDX JSON file, read as UTF-8.
     *
     * @param file document file
     * @return check result; a file that cannot be read is reported as a parse error
     */
    public CheckResult checkFile(Path file) {
        log.info("Parsing {}", file);
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", file, e.getMessage());
            return CheckResult.parseFailure(List.of("Unable to read file " + file + ": " + e.getMessage()));
        }
        return check(content);
    }

    /**
     * Checks every SPDX JSON document in a folder.
     *
     * <p>Files that do not look like SPDX JSON documents are reported as parse failures
     * explaining why they were skipped.
     *
     * @param folder folder containing the documents
     * @return results keyed by file name, in file name order
     * @throws IOException if the folder cannot be listed
     */
    public Map<String, CheckResult> checkAll(Path folder) throws IOException {
        Map<String, CheckResult> results = new LinkedHashMap<>();
        for (DiscoveredFile file : discovery.discover(folder)) {
            if (!file.isDocument()) {
                results.put(file.fileName(), CheckResult.parseFailure(List.of(file.error())));
                continue;
            }
            results.put(file.fileName(), checkFile(file.path()));
        }
        log.info("Checked {} files in {}", results.size(), folder);
        return results;
    }
}
