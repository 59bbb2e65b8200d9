package com.sbomcheck.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sbomcheck.core.diagnostic.CheckResult;
import com.sbomcheck.core.diagnostic.DiagnosticRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renderer that writes all results into a single JSON file.
 *
 * <p>The file maps each document file name to its parse errors and findings:
 * <pre>{@code
 * {
 *   "example.spdx.json" : {
 *     "errors" : [ ],
 *     "validator_results" : [ {
 *       "spdx_id" : "SPDXRef-openssl",
 *       "parent_id" : "",
 *       "element_type" : "PACKAGE",
 *       "message" : "\n*** completeness exception ***\nThis package has no supplier populated."
 *     } ]
 *   }
 * }
 * }</pre>
 *
 * <p>The file is written to {@link RenderContext#jsonReportPath()}.
 */
public class JsonReportRenderer implements ReportRenderer {

    private static final Logger logger = LoggerFactory.getLogger(JsonReportRenderer.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * JSON shape of one document's result.
     *
     * @param errors parse errors
     * @param validatorResults findings as flat records
     */
    public record DocumentReport(
        @JsonProperty("errors") List<String> errors,
        @JsonProperty("validator_results") List<DiagnosticRecord> validatorResults
    ) {
        public static DocumentReport from(CheckResult result) {
            return new DocumentReport(result.parseErrors(), result.toRecords());
        }
    }

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public void render(Map<String, CheckResult> results, RenderContext context) {
        Path target = context.jsonReportPath();
        logger.info("Writing JSON report for {} documents to: {}", results.size(), target);

        try {
            Path parentDir = target.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(target, toJson(results), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write JSON report: " + target, e);
        }
    }

    /**
     * Serializes results to the report's JSON text.
     *
     * @param results results keyed by document file name
     * @return pretty-printed JSON
     */
    public String toJson(Map<String, CheckResult> results) {
        Map<String, DocumentReport> reports = new LinkedHashMap<>();
        results.forEach((fileName, result) -> reports.put(fileName, DocumentReport.from(result)));
        try {
            return objectMapper.writeValueAsString(reports);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize results to JSON", e);
        }
    }
}
