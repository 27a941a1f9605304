package io.github.stephanpirnbaum.mermaid.export.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link ExportConfig} from YAML. A missing or invalid file yields {@link ExportConfig#defaults()}.
 *
 * @author Stephan Pirnbaum
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "mermaid-export.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static ExportConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return ExportConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ExportConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ExportConfig config = YAML_MAPPER.readValue(configPath.toFile(), ExportConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ExportConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}", configPath, e.getMessage());
            return ExportConfig.defaults();
        }
    }

}
