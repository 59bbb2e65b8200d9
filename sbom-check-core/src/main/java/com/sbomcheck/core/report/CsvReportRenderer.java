package com.sbomcheck.core.report;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.sbomcheck.core.diagnostic.CheckResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Renderer that writes one CSV file per document with findings.
 *
 * <p>Documents without findings get no file. For a document named {@code x.spdx.json}
 * the file is {@code x.spdx.json_exceptions.csv} (see {@link RenderContext#csvReportPath(String)}), holding
 * {@link CheckResult#toCsvRows()}: the header row and one row per finding.
 */
public class CsvReportRenderer implements ReportRenderer {

    private static final Logger logger = LoggerFactory.getLogger(CsvReportRenderer.class);

    private final CsvMapper csvMapper = CsvMapper.builder()
        .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
        .build();

    @Override
    public String getId() {
        return "csv";
    }

    @Override
    public void render(Map<String, CheckResult> results, RenderContext context) {
        Path outputDir = context.outputDirectory();

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        results.forEach((fileName, result) -> {
            if (!result.hasFindings()) {
                logger.debug("No findings for {}, skipping CSV", fileName);
                return;
            }
            writeFile(context.csvReportPath(fileName), result);
        });
    }

    /**
     * Serializes one result's CSV rows.
     *
     * @param result check result
     * @return CSV text, one line per row
     */
    public String toCsv(CheckResult result) {
        StringWriter out = new StringWriter();
        try (SequenceWriter writer = csvMapper.writer().writeValues(out)) {
            for (List<String> row : result.toCsvRows()) {
                writer.write(row.toArray(new String[0]));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize results to CSV", e);
        }
        return out.toString();
    }

    private void writeFile(Path target, CheckResult result) {
        try {
            Files.writeString(target, toCsv(result), StandardCharsets.UTF_8);
            logger.info("Wrote {} ({} findings)", target, result.diagnostics().size());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write CSV report: " + target, e);
        }
    }
}
