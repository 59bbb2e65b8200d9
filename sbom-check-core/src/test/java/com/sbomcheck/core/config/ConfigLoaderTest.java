package com.sbomcheck.core.config;

import com.sbomcheck.core.completeness.CompletenessRuleEngine;
import com.sbomcheck.core.completeness.CreationInfoStage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("sbomcheck.yaml");
        Files.writeString(configFile, """
            completeness:
              spdxVersions:
                - SPDX-2.2
                - SPDX-2.3

            discovery:
              extension: ".json"

            output:
              directory: "./reports"
              jsonFileName: "sbom-results.json"
              colors: false
            """);

        CheckConfig config = ConfigLoader.load(configFile);

        assertThat(config.effectiveSpdxVersions()).containsExactly("SPDX-2.2", "SPDX-2.3");
        assertThat(config.effectiveExtension()).isEqualTo(".json");
        assertThat(config.effectiveOutputDirectory()).isEqualTo("./reports");
        assertThat(config.effectiveJsonFileName()).isEqualTo("sbom-results.json");
        assertThat(config.effectiveColors()).isFalse();
    }

    @Test
    void load_partialYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("sbomcheck.yaml");
        Files.writeString(configFile, """
            output:
              directory: "./reports"
            """);

        CheckConfig config = ConfigLoader.load(configFile);

        assertThat(config.completeness()).isNull();
        assertThat(config.effectiveSpdxVersions()).containsExactly("SPDX-2.3");
        assertThat(config.effectiveExtension()).isEqualTo(".spdx.json");
        assertThat(config.effectiveJsonFileName()).isEqualTo("results.json");
        assertThat(config.effectiveColors()).isTrue();
    }

    @Test
    void load_nullVersionEntry_fallsBackToDefaults() throws IOException {
        Path configFile = tempDir.resolve("sbomcheck.yaml");
        Files.writeString(configFile, """
            completeness:
              spdxVersions: [~]
            """);

        CheckConfig config = ConfigLoader.load(configFile);

        assertThat(config.effectiveSpdxVersions()).isEqualTo(CreationInfoStage.DEFAULT_SPDX_VERSIONS);
        assertThat(CompletenessRuleEngine.withSpdxVersions(config.effectiveSpdxVersions()).stages()).isNotEmpty();
    }

    @Test
    void load_blankVersionEntries_areDropped() throws IOException {
        Path configFile = tempDir.resolve("sbomcheck.yaml");
        Files.writeString(configFile, """
            completeness:
              spdxVersions: [~, "  ", " SPDX-2.2 "]
            """);

        assertThat(ConfigLoader.load(configFile).effectiveSpdxVersions()).containsExactly("SPDX-2.2");
    }

    @Test
    void defaults_shareTheEngineVersionList() {
        assertThat(CheckConfig.defaults().effectiveSpdxVersions()).isSameAs(CreationInfoStage.DEFAULT_SPDX_VERSIONS);
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("sbomcheck.yaml");
        Files.writeString(configFile, """
            project:
              name: "ignored"
            discovery:
              extension: ".spdx"
            """);

        CheckConfig config = ConfigLoader.load(configFile);

        assertThat(config.effectiveExtension()).isEqualTo(".spdx");
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        CheckConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(CheckConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("sbomcheck.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(CheckConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("sbomcheck.yaml");
        Files.writeString(configFile, """
            completeness:
              spdxVersions: [unclosed
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(CheckConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(CheckConfig.defaults());
    }
}
