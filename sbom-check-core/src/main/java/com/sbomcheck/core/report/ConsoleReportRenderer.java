package com.sbomcheck.core.report;

import com.sbomcheck.core.diagnostic.CheckResult;
import com.sbomcheck.core.diagnostic.DiagnosticRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Renderer that prints a human-readable summary of each document to the console.
 *
 * <p>Each document gets one of three verdicts: compliant, not parseable (with the parse
 * errors), or parsed but not compliant (with every finding).
 *
 * <p>Verdicts are colored unless {@link RenderContext#colors()} is off.
 */
public class ConsoleReportRenderer implements ReportRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleReportRenderer.class);

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(Map<String, CheckResult> results, RenderContext context) {
        boolean useColors = context.colors();
        logger.debug("Rendering {} results to console (colors: {})", results.size(), useColors);

        results.forEach((fileName, result) -> printResult(fileName, result, useColors));
    }

    private void printResult(String fileName, CheckResult result, boolean useColors) {
        String reset = useColors ? ANSI_RESET : "";

        if (result.isClean()) {
            String color = useColors ? ANSI_BOLD + ANSI_GREEN : "";
            System.out.println();
            System.out.println(color + fileName + " is compliant." + reset);
            System.out.println();
            return;
        }

        if (result.isParseFailure()) {
            String color = useColors ? ANSI_BOLD + ANSI_RED : "";
            System.out.println();
            System.out.println(color + fileName + " is not compliant, as it could not be parsed." + reset);
            System.out.println("The following errors were found:");
            System.out.println();
            for (String error : result.parseErrors()) {
                System.out.println("* " + error);
                System.out.println();
            }
            return;
        }

        String color = useColors ? ANSI_BOLD + ANSI_YELLOW : "";
        System.out.println();
        System.out.println(color + fileName
            + " successfully parsed, but was not compliant with validation standards." + reset);
        System.out.println("The following validation issues were found:");
        System.out.println();
        for (DiagnosticRecord finding : result.toRecords()) {
            printRecord(finding);
        }
    }

    private void printRecord(DiagnosticRecord finding) {
        System.out.println("* Message: " + finding.message());
        System.out.println("\ttype: " + finding.elementType());
        System.out.println("\tspdx_id: " + (finding.spdxId().isEmpty() ? "None" : finding.spdxId())
            + ", parent id: " + finding.parentId());
        System.out.println();
    }
}
