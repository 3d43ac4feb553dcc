package com.codeparse.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link ParserConfig} from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code codeparse.yaml}. A missing, unreadable or invalid file
 * never fails the caller: the loader logs why and returns {@link ParserConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ParserConfig config = ConfigLoader.load(Paths.get("codeparse.yaml"));
 * LanguageParser parser = ParserFactory.createParser("python", config).orElseThrow();
 * }</pre>
 */
public class ConfigLoader {

    /** Conventional file name looked up in the working directory. */
    public static final String DEFAULT_FILE_NAME = "codeparse.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code codeparse.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ParserConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return ParserConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ParserConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ParserConfig config = YAML_MAPPER.readValue(configPath.toFile(), ParserConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ParserConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ParserConfig.defaults();
        }
    }

    /**
     * Parses configuration from YAML text. Invalid text yields defaults.
     */
    public static ParserConfig parse(String yaml) {
        try {
            ParserConfig config = YAML_MAPPER.readValue(yaml, ParserConfig.class);
            return config != null ? config : ParserConfig.defaults();
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse configuration text. Using defaults. Error: {}", e.getMessage());
            return ParserConfig.defaults();
        }
    }
}
