package com.leanblueprint.maven.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.apache.maven.plugin.logging.Log;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads conversion configuration from YAML files.
 */
public class ConversionConfigLoader {

    public static final String DEFAULT_RESOURCE = "/blueprint/default-config.yml";
    public static final String PROJECT_CONFIG_NAME = "blueprint-convert.yml";

    private static final Yaml yaml = new Yaml();

    /**
     * Loads configuration from a YAML file.
     */
    public static ConversionConfig load(Path configPath) throws IOException {
        try (InputStream inputStream = Files.newInputStream(configPath)) {
            Map<String, Object> data = yaml.load(inputStream);
            return ConversionConfig.fromMap(data);
        }
    }

    /**
     * Loads configuration from a classpath resource.
     */
    public static ConversionConfig loadFromResource(String resourcePath) throws IOException {
        try (InputStream inputStream = ConversionConfigLoader.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            Map<String, Object> data = yaml.load(inputStream);
            return ConversionConfig.fromMap(data);
        }
    }

    /**
     * Explicit file if given, else {@value #PROJECT_CONFIG_NAME} in the blueprint
     * directory, else the plugin default.
     */
    public static ConversionConfig resolve(Path explicitConfig, Path blueprintRoot, Log log) throws IOException {
        if (explicitConfig != null) {
            log.debug("Loading config: " + explicitConfig);
            return load(explicitConfig);
        }
        if (blueprintRoot != null) {
            Path projectConfig = blueprintRoot.resolve(PROJECT_CONFIG_NAME);
            if (Files.isRegularFile(projectConfig)) {
                log.debug("Loading config from blueprint directory: " + projectConfig);
                return load(projectConfig);
            }
        }
        log.debug("Loading default config from classpath: " + DEFAULT_RESOURCE);
        return loadFromResource(DEFAULT_RESOURCE);
    }
}
