package com.gql2jsonschema.cli.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gql2jsonschema.core.convert.ConvertOptions;
import com.gql2jsonschema.core.convert.IdTypeMapping;

import java.time.Duration;
import java.util.List;

/**
 * Settings of one run. A {@code null} component means "not set at this level"; {@link #orElse}
 * layers command line, environment, config file and defaults on top of each other.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CliSettings(
        @JsonProperty("input") String input,
        @JsonProperty("output") String output,
        @JsonProperty("endpoint") String endpoint,
        @JsonProperty("headers") List<String> headers,
        @JsonProperty("timeout") Integer timeout,
        @JsonProperty("ignore-internals") Boolean ignoreInternals,
        @JsonProperty("nullable-array-items") Boolean nullableArrayItems,
        @JsonProperty("id-type") String idType
) {
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    public static CliSettings empty() {
        return new CliSettings(null, null, null, null, null, null, null, null);
    }

    public static CliSettings defaults() {
        return new CliSettings(null, null, null, List.of(), DEFAULT_TIMEOUT_SECONDS, true, false,
                IdTypeMapping.STRING.value());
    }

    public CliSettings orElse(CliSettings fallback) {
        return new CliSettings(
                firstSet(input, fallback.input),
                firstSet(output, fallback.output),
                firstSet(endpoint, fallback.endpoint),
                firstSet(headers, fallback.headers),
                firstSet(timeout, fallback.timeout),
                firstSet(ignoreInternals, fallback.ignoreInternals),
                firstSet(nullableArrayItems, fallback.nullableArrayItems),
                firstSet(idType, fallback.idType)
        );
    }

    /**
     * @throws com.gql2jsonschema.core.convert.InvalidOptionException if {@code id-type} is unknown
     */
    public ConvertOptions toConvertOptions() {
        ConvertOptions.Builder builder = ConvertOptions.builder();
        if (ignoreInternals != null) {
            builder.ignoreInternals(ignoreInternals);
        }
        if (nullableArrayItems != null) {
            builder.nullableArrayItems(nullableArrayItems);
        }
        if (idType != null) {
            builder.idTypeMapping(idType);
        }
        return builder.build();
    }

    public Duration timeoutDuration() {
        return Duration.ofSeconds(timeout != null ? timeout : DEFAULT_TIMEOUT_SECONDS);
    }

    private static <T> T firstSet(T value, T fallback) {
        if (value instanceof String s && s.isEmpty()) {
            return fallback;
        }
        return value != null ? value : fallback;
    }
}
