package com.sbomcheck.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sbomcheck.core.completeness.CreationInfoStage;

import java.util.List;
import java.util.Objects;

/**
 * Root configuration for SBOM Check.
 *
 * <p>Loaded from {@code sbomcheck.yaml}. Every section is optional; missing sections and
 * fields fall back to the values of {@link #defaults()} through the {@code effective*}
 * accessors.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * completeness:
 *   spdxVersions:
 *     - "SPDX-2.3"
 *
 * discovery:
 *   extension: ".spdx.json"
 *
 * output:
 *   directory: "./reports"
 *   jsonFileName: "results.json"
 *   colors: false
 * }</pre>
 *
 * @param completeness completeness rule settings
 * @param discovery document discovery settings
 * @param output report output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CheckConfig(
    @JsonProperty("completeness") CompletenessConfig completeness,
    @JsonProperty("discovery") DiscoveryConfig discovery,
    @JsonProperty("output") OutputConfig output
) {
    public static final String DEFAULT_EXTENSION = ".spdx.json";
    public static final String DEFAULT_OUTPUT_DIRECTORY = ".";
    public static final String DEFAULT_JSON_FILE_NAME = "results.json";

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static CheckConfig defaults() {
        return new CheckConfig(
            new CompletenessConfig(CreationInfoStage.DEFAULT_SPDX_VERSIONS),
            new DiscoveryConfig(DEFAULT_EXTENSION),
            new OutputConfig(DEFAULT_OUTPUT_DIRECTORY, DEFAULT_JSON_FILE_NAME, true)
        );
    }

    /**
     * Null and blank entries, as written by {@code spdxVersions: [~]}, are dropped.
     *
     * @return configured SPDX versions, or the defaults when none are configured
     */
    public List<String> effectiveSpdxVersions() {
        if (completeness == null || completeness.spdxVersions() == null) {
            return CreationInfoStage.DEFAULT_SPDX_VERSIONS;
        }
        List<String> versions = completeness.spdxVersions().stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(version -> !version.isEmpty())
            .toList();
        return versions.isEmpty() ? CreationInfoStage.DEFAULT_SPDX_VERSIONS : versions;
    }

    /**
     * @return configured document extension, or {@value #DEFAULT_EXTENSION}
     */
    public String effectiveExtension() {
        if (discovery == null || discovery.extension() == null || discovery.extension().isBlank()) {
            return DEFAULT_EXTENSION;
        }
        return discovery.extension();
    }

    /**
     * @return configured output directory, or the working directory
     */
    public String effectiveOutputDirectory() {
        if (output == null || output.directory() == null || output.directory().isBlank()) {
            return DEFAULT_OUTPUT_DIRECTORY;
        }
        return output.directory();
    }

    /**
     * @return configured JSON report file name, or {@value #DEFAULT_JSON_FILE_NAME}
     */
    public String effectiveJsonFileName() {
        if (output == null || output.jsonFileName() == null || output.jsonFileName().isBlank()) {
            return DEFAULT_JSON_FILE_NAME;
        }
        return output.jsonFileName();
    }

    /**
     * @return whether console output uses ANSI colors, true unless disabled
     */
    public boolean effectiveColors() {
        return output == null || output.colors() == null || output.colors();
    }

    /**
     * Completeness rule settings.
     *
     * @param spdxVersions accepted SPDX versions
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CompletenessConfig(
        @JsonProperty("spdxVersions") List<String> spdxVersions
    ) {}

    /**
     * Document discovery settings.
     *
     * @param extension file name suffix of SPDX JSON documents, matched case-insensitively
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DiscoveryConfig(
        @JsonProperty("extension") String extension
    ) {}

    /**
     * Report output settings.
     *
     * @param directory directory reports are written to
     * @param jsonFileName file name of the JSON report
     * @param colors whether console output uses ANSI colors
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("jsonFileName") String jsonFileName,
        @JsonProperty("colors") Boolean colors
    ) {}
}
