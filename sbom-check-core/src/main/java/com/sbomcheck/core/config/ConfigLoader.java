package com.sbomcheck.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading SBOM Check configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code sbomcheck.yaml} into {@link CheckConfig} records.
 * If the config file is missing, unreadable or invalid, returns {@link CheckConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CheckConfig config = ConfigLoader.load(Paths.get("sbomcheck.yaml"));
 * CompletenessRuleEngine engine = CompletenessRuleEngine.withSpdxVersions(config.effectiveSpdxVersions());
 * }</pre>
 */
public final class ConfigLoader {

    /** Default configuration file name. */
    public static final String DEFAULT_FILE_NAME = "sbomcheck.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>Never throws: problems are logged and the defaults are returned.
     *
     * @param configPath path to {@code sbomcheck.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static CheckConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return CheckConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return CheckConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            CheckConfig config = YAML_MAPPER.readValue(configPath.toFile(), CheckConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return CheckConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return CheckConfig.defaults();
        }
    }
}
