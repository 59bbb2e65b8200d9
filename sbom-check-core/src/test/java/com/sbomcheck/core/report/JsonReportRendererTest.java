package com.sbomcheck.core.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sbomcheck.core.diagnostic.CheckResult;
import com.sbomcheck.core.diagnostic.Diagnostic;
import com.sbomcheck.core.diagnostic.ElementType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonReportRendererTest {

    @TempDir
    Path tempDir;

    private final JsonReportRenderer renderer = new JsonReportRenderer();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void toJson_mapsEachFileToErrorsAndValidatorResults() throws IOException {
        JsonNode root = objectMapper.readTree(renderer.toJson(sampleResults()));

        assertThat(root.fieldNames()).toIterable().containsExactly("broken.spdx.json", "doc.spdx.json");

        JsonNode broken = root.get("broken.spdx.json");
        assertThat(broken.get("errors")).hasSize(1);
        assertThat(broken.get("validator_results")).isEmpty();

        JsonNode finding = root.get("doc.spdx.json").get("validator_results").get(0);
        assertThat(finding.get("spdx_id").asText()).isEqualTo("SPDXRef-app");
        assertThat(finding.get("parent_id").asText()).isEmpty();
        assertThat(finding.get("element_type").asText()).isEqualTo("PACKAGE");
        assertThat(finding.get("message").asText())
            .isEqualTo(Diagnostic.COMPLETENESS_MARKER + "This package has no supplier populated.");
    }

    @Test
    void render_writesConfiguredFileName() throws IOException {
        renderer.render(sampleResults(), new RenderContext(tempDir, "out.json", false));

        Path target = tempDir.resolve("out.json");
        assertThat(target).exists();
        assertThat(objectMapper.readTree(Files.readString(target)).size()).isEqualTo(2);
    }

    @Test
    void render_defaultsToResultsJson() {
        renderer.render(Map.of(), RenderContext.plain(tempDir.resolve("nested")));

        assertThat(tempDir.resolve("nested").resolve("results.json")).exists();
    }

    private static Map<String, CheckResult> sampleResults() {
        Map<String, CheckResult> results = new LinkedHashMap<>();
        results.put("broken.spdx.json", CheckResult.parseFailure(List.of("Error while parsing document: [boom]")));
        results.put("doc.spdx.json", CheckResult.of(List.of(), List.of(
            Diagnostic.completeness(ElementType.PACKAGE, "SPDXRef-app", "This package has no supplier populated."))));
        return results;
    }
}
