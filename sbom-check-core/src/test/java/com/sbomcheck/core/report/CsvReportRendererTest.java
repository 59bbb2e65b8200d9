package com.sbomcheck.core.report;

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

class CsvReportRendererTest {

    @TempDir
    Path tempDir;

    private final CsvReportRenderer renderer = new CsvReportRenderer();

    @Test
    void toCsv_writesHeaderAndOneLinePerDiagnostic() {
        CheckResult result = CheckResult.of(
            List.of(Diagnostic.specification(ElementType.FILE, "SPDXRef-main", "SPDXRef-DOCUMENT",
                "checksums must contain a SHA1 algorithm checksum, but only contains: [MD5]")),
            List.of(Diagnostic.completeness(ElementType.DOCUMENT, "The Document contains no files.")));

        String csv = renderer.toCsv(result);

        List<String> lines = csv.lines().toList();
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).isEqualTo("spdx_id,parent_id,element_type,message");
        assertThat(lines.get(2)).contains("DOCUMENT").contains("*** completeness exception ***The Document contains no files.");
    }

    @Test
    void render_writesFilesOnlyForResultsWithFindings() throws IOException {
        Map<String, CheckResult> results = new LinkedHashMap<>();
        results.put("clean.spdx.json", CheckResult.of(List.of(), List.of()));
        results.put("broken.spdx.json", CheckResult.parseFailure(List.of("boom")));
        results.put("doc.spdx.json", CheckResult.of(List.of(), List.of(
            Diagnostic.completeness(ElementType.PACKAGE, "SPDXRef-app", "This package has no supplier populated."))));

        renderer.render(results, RenderContext.plain(tempDir));

        assertThat(tempDir.resolve("clean.spdx.json_exceptions.csv")).doesNotExist();
        assertThat(Files.readAllLines(tempDir.resolve("broken.spdx.json_exceptions.csv"))).hasSize(1);
        assertThat(Files.readAllLines(tempDir.resolve("doc.spdx.json_exceptions.csv"))).hasSize(2);
    }
}
