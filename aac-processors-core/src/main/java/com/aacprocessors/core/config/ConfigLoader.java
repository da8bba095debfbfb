package com.aacprocessors.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading processor configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code aac-processors.yaml} into {@link ProcessorConfig}
 * records. If the file is missing or invalid, returns {@link ProcessorConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProcessorConfig config = ConfigLoader.load(Path.of("aac-processors.yaml"));
 * ProcessorRegistry registry = new ProcessorRegistry(config);
 * }</pre>
 */
public final class ConfigLoader {

    /** Default configuration file name looked up by the command-line front end. */
    public static final String DEFAULT_FILE_NAME = "aac-processors.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link ProcessorConfig#defaults()}.
     *
     * @param configPath path to the YAML file
     * @return loaded configuration or defaults if unavailable
     */
    public static ProcessorConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return ProcessorConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ProcessorConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ProcessorConfig config = YAML_MAPPER.readValue(configPath.toFile(), ProcessorConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ProcessorConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ProcessorConfig.defaults();
        }
    }
}
