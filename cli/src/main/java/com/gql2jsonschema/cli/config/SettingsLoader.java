package com.gql2jsonschema.cli.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.gql2jsonschema.core.convert.InvalidOptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves settings from, in order of precedence, the command line, {@code GRAPHQL2JSON_*}
 * environment variables, a YAML config file and the built-in defaults.
 * <p>
 * The config file is the one given with {@code --config}, or {@code ~/.gql2jsonschema.yaml} when it
 * exists. Its keys are the long option names, e.g. {@code id-type: both}.
 */
public class SettingsLoader {
    private static final Logger logger = LoggerFactory.getLogger(SettingsLoader.class);

    public static final String ENV_PREFIX = "GRAPHQL2JSON_";
    public static final String DEFAULT_CONFIG_FILE = ".gql2jsonschema.yaml";

    private final Map<String, String> env;
    private final Path homeDir;
    private final ObjectMapper yamlMapper;

    public SettingsLoader(Map<String, String> env, Path homeDir) {
        this.env = env;
        this.homeDir = homeDir;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    public static SettingsLoader fromSystem() {
        return new SettingsLoader(System.getenv(), Path.of(System.getProperty("user.home")));
    }

    public CliSettings load(CliSettings commandLine, Path configFile) {
        return commandLine
                .orElse(fromEnvironment())
                .orElse(fromConfigFile(configFile))
                .orElse(CliSettings.defaults());
    }

    CliSettings fromEnvironment() {
        String headers = env("headers");
        return new CliSettings(
                env("input"),
                env("output"),
                env("endpoint"),
                headers == null ? null : Arrays.stream(headers.split(","))
                        .map(String::trim)
                        .filter(h -> !h.isEmpty())
                        .toList(),
                parseInt("timeout", env("timeout")),
                parseBoolean("ignore-internals", env("ignore-internals")),
                parseBoolean("nullable-array-items", env("nullable-array-items")),
                env("id-type")
        );
    }

    CliSettings fromConfigFile(Path explicitFile) {
        Path file = explicitFile;
        if (file == null) {
            file = homeDir == null ? null : homeDir.resolve(DEFAULT_CONFIG_FILE);
            if (file == null || !Files.isRegularFile(file)) {
                return CliSettings.empty();
            }
        } else if (!Files.isRegularFile(file)) {
            throw new InvalidOptionException("config file not found: " + file);
        }

        try {
            if (Files.size(file) == 0) {
                return CliSettings.empty();
            }
            CliSettings settings = yamlMapper.readValue(file.toFile(), CliSettings.class);
            logger.info("Using config file: {}", file);
            return settings == null ? CliSettings.empty() : settings;
        } catch (IOException e) {
            throw new InvalidOptionException("error reading config file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * {@code id-type} is read from {@code GRAPHQL2JSON_ID_TYPE}.
     */
    private String env(String key) {
        String value = env.get(ENV_PREFIX + key.toUpperCase(Locale.ROOT).replace('-', '_'));
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Integer parseInt(String key, String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new InvalidOptionException("invalid " + key + ": " + value, e);
        }
    }

    private static Boolean parseBoolean(String key, String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.toLowerCase(Locale.ROOT);
        if (List.of("true", "t", "1").contains(normalized)) {
            return true;
        }
        if (List.of("false", "f", "0").contains(normalized)) {
            return false;
        }
        throw new InvalidOptionException("invalid " + key + ": " + value);
    }
}
