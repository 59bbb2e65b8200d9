package com.sbomcheck.core.completeness;

import com.sbomcheck.core.diagnostic.Diagnostic;
import com.sbomcheck.core.diagnostic.ElementType;
import com.sbomcheck.core.model.SpdxFile;
import com.sbomcheck.core.model.SpdxValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static com.sbomcheck.core.testing.TestDocuments.completeFile;
import static com.sbomcheck.core.testing.TestDocuments.document;
import static com.sbomcheck.core.testing.TestDocuments.spdxFile;
import static org.assertj.core.api.Assertions.assertThat;

class FileStageTest {

    private final FileStage stage = new FileStage();

    @Test
    void evaluate_completeFile_returnsNothing() {
        assertThat(evaluate(completeFile("SPDXRef-main"))).isEmpty();
    }

    @Test
    void evaluate_emptyName_isReportedEvenWithoutLicense() {
        SpdxFile file = spdxFile("SPDXRef-main", "", SpdxValue.noAssertion(), List.of(), SpdxValue.absent());

        assertThat(evaluate(file)).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.elementType()).isEqualTo(ElementType.FILE);
            assertThat(diagnostic.spdxId()).isEqualTo("SPDXRef-main");
            assertThat(diagnostic.message()).endsWith("This file has no name.");
        });
    }

    @Test
    void evaluate_concludedLicenseWithoutEvidence_reportsBoth() {
        SpdxFile file = spdxFile("SPDXRef-main", "main.c", SpdxValue.of("BSD-3-Clause"), List.of(), SpdxValue.absent());

        assertThat(evaluate(file)).extracting(Diagnostic::message).containsExactly(
            Diagnostic.COMPLETENESS_MARKER
                + "This file has a concluded license but license_info_in_file is not populated.",
            Diagnostic.COMPLETENESS_MARKER + "This file has a concluded license but no copyright text.");
    }

    @Test
    void evaluate_noAssertionConcludedLicense_skipsLicenseRules() {
        SpdxFile file = spdxFile("SPDXRef-main", "main.c", SpdxValue.noAssertion(), List.of(), SpdxValue.absent());

        assertThat(evaluate(file)).isEmpty();
    }

    @ParameterizedTest
    @MethodSource("writtenCopyrights")
    void evaluate_keywordOrBlankCopyright_countsAsPresent(SpdxValue copyright) {
        SpdxFile file = spdxFile("SPDXRef-main", "main.c", SpdxValue.of("MIT"), List.of("MIT"), copyright);

        assertThat(evaluate(file)).isEmpty();
    }

    static Stream<SpdxValue> writtenCopyrights() {
        return Stream.of(SpdxValue.none(), SpdxValue.noAssertion(), SpdxValue.parse("   "));
    }

    @Test
    void evaluate_missingCopyright_isReportedForLicensedFile() {
        SpdxFile file = spdxFile("SPDXRef-main", "main.c", SpdxValue.of("MIT"), List.of("MIT"), SpdxValue.absent());

        assertThat(evaluate(file)).extracting(Diagnostic::message)
            .containsExactly(Diagnostic.COMPLETENESS_MARKER + "This file has a concluded license but no copyright text.");
    }

    private List<Diagnostic> evaluate(SpdxFile file) {
        return stage.evaluate(document(List.of(), List.of(file), List.of())).diagnostics();
    }
}
