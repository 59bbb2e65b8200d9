package com.sbomcheck.core;

import com.sbomcheck.core.config.CheckConfig;
import com.sbomcheck.core.diagnostic.CheckResult;
import com.sbomcheck.core.diagnostic.Diagnostic;
import com.sbomcheck.core.diagnostic.ElementType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static com.sbomcheck.core.testing.TestDocuments.fixture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link SbomChecker} on document fixtures.
 */
class SbomCheckerTest {

    private final SbomChecker checker = SbomChecker.defaults();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Complete document is clean")
    void check_completeDocument_isClean() {
        CheckResult result = checker.check(fixture("complete.spdx.json"));

        assertThat(result.isClean()).isTrue();
        assertThat(result.toCsvRows()).hasSize(1);
    }

    @Test
    @DisplayName("Keyword copyright text counts as present")
    void check_noAssertionCopyright_hasNoCompletenessFindings() {
        String json = fixture("complete.spdx.json")
            .replace("\"Copyright (c) 2024 Acme Corp\"", "\"NOASSERTION\"");

        CheckResult result = checker.check(json);

        assertThat(result.isParseFailure()).isFalse();
        assertThat(result.completenessDiagnostics()).isEmpty();
    }

    @Test
    @DisplayName("Malformed license expression is never clean")
    void check_malformedLicenseExpression_isNotClean() {
        String json = fixture("complete.spdx.json")
            .replace("\"licenseDeclared\": \"Zlib\"", "\"licenseDeclared\": \"((Zlib AND AND\"");

        assertThat(checker.check(json).isClean()).isFalse();
    }

    @Test
    @DisplayName("Document without packages stops at no packages")
    void check_noPackages_stopsAtNoPackages() {
        CheckResult result = checker.check(fixture("no-packages.spdx.json"));

        assertThat(result.completenessDiagnostics()).extracting(Diagnostic::message)
            .containsExactly(Diagnostic.COMPLETENESS_MARKER + "The Document contains no packages.");
        assertSpecificationFindingsFirst(result);
    }

    @Test
    void check_incompleteCreationInfo_reportsCompletenessInOrder() {
        CheckResult result = checker.check(fixture("incomplete-creation-info.spdx.json"));

        assertThat(result.completenessDiagnostics()).extracting(Diagnostic::message).containsExactly(
            Diagnostic.COMPLETENESS_MARKER + "The Document has no name.",
            Diagnostic.COMPLETENESS_MARKER + "The Document does not have a license list version.",
            Diagnostic.COMPLETENESS_MARKER + "The files have not been analyzed for this package.",
            Diagnostic.COMPLETENESS_MARKER + "The Document contains no files.");
    }

    @Test
    void check_packageFindings_reportsEachPackageRule() {
        CheckResult result = checker.check(fixture("package-findings.spdx.json"));
        List<Diagnostic> diagnostics = result.completenessDiagnostics();

        assertThat(diagnostics).extracting(Diagnostic::message).containsExactly(
            Diagnostic.COMPLETENESS_MARKER + "This package has no supplier populated.",
            Diagnostic.COMPLETENESS_MARKER + "The files have not been analyzed for this package.",
            Diagnostic.COMPLETENESS_MARKER + "This package has declared licenses but no copyright text populated.",
            Diagnostic.COMPLETENESS_MARKER + "This file has a concluded license but no copyright text.");
        assertThat(diagnostics.subList(0, 3)).extracting(Diagnostic::spdxId).containsOnly("SPDXRef-test.2");
        assertThat(diagnostics.get(3).elementType()).isEqualTo(ElementType.FILE);
        assertSpecificationFindingsFirst(result);
    }

    @Test
    void check_fileFindings_reportsLicenseInfoAndCopyright() {
        CheckResult result = checker.check(fixture("file-findings.spdx.json"));

        assertThat(result.completenessDiagnostics()).extracting(Diagnostic::message).containsExactly(
            Diagnostic.COMPLETENESS_MARKER + "This file has a concluded license but license_info_in_file is not populated.",
            Diagnostic.COMPLETENESS_MARKER + "This file has a concluded license but no copyright text.");
        assertThat(result.completenessDiagnostics()).extracting(Diagnostic::spdxId)
            .containsOnly("SPDXRef-fakepath");
    }

    @Test
    void check_emptyObject_isParseFailure() {
        CheckResult result = checker.check("{}");

        assertThat(result.isParseFailure()).isTrue();
        assertThat(result.parseErrors()).containsExactly("Error while parsing document: [CreationInfo does not exist.]");
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void check_malformedJson_isParseFailure() {
        CheckResult result = checker.check("{ not json");

        assertThat(result.isParseFailure()).isTrue();
        assertThat(result.parseErrors()).singleElement().asString().startsWith("Unable to read document as JSON: ");
    }

    @Test
    void checkAll_mixedFolder_returnsResultPerFileInOrder() throws IOException {
        Files.writeString(tempDir.resolve("a.spdx.json"), fixture("complete.spdx.json"));
        Files.writeString(tempDir.resolve("b.spdx.json"), fixture("no-packages.spdx.json"));
        Files.writeString(tempDir.resolve("c.txt"), "not an sbom");

        Map<String, CheckResult> results = checker.checkAll(tempDir);

        assertThat(results).containsOnlyKeys("a.spdx.json", "b.spdx.json", "c.txt");
        assertThat(results.keySet()).containsExactly("a.spdx.json", "b.spdx.json", "c.txt");
        assertThat(results.get("a.spdx.json").isClean()).isTrue();
        assertThat(results.get("b.spdx.json").completenessDiagnostics()).hasSize(1);
        assertThat(results.get("c.txt").parseErrors()).singleElement().asString().contains("not recognized");
    }

    @Test
    void checkAll_missingFolder_throwsException() {
        assertThatThrownBy(() -> checker.checkAll(tempDir.resolve("missing")))
            .isInstanceOf(IOException.class);
    }

    @Test
    void fromConfig_acceptsConfiguredVersions() {
        CheckConfig config = new CheckConfig(
            new CheckConfig.CompletenessConfig(List.of("SPDX-2.2", "SPDX-2.3")), null, null);
        String spdx22 = fixture("complete.spdx.json").replace("\"SPDX-2.3\"", "\"SPDX-2.2\"");

        assertThat(SbomChecker.fromConfig(config).check(spdx22).completenessDiagnostics()).isEmpty();
        assertThat(checker.check(spdx22).completenessDiagnostics()).singleElement()
            .extracting(Diagnostic::elementType)
            .isEqualTo(ElementType.CREATION_INFO);
    }

    private static void assertSpecificationFindingsFirst(CheckResult result) {
        List<Diagnostic> diagnostics = result.diagnostics();
        int firstCompleteness = diagnostics.indexOf(result.completenessDiagnostics().get(0));
        assertThat(diagnostics.subList(0, firstCompleteness)).noneMatch(Diagnostic::isCompletenessFinding);
        assertThat(diagnostics.subList(firstCompleteness, diagnostics.size())).allMatch(Diagnostic::isCompletenessFinding);
    }
}
