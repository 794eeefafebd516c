package com.gql2jsonschema.core.introspect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A field argument or an input object field. {@code defaultValue} is the GraphQL literal as
 * printed by the server, e.g. {@code "10"}, {@code "\"en\""} or {@code "ASC"}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IntrospectionInputValue(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("type") IntrospectionTypeRef type,
        @JsonProperty("defaultValue") String defaultValue
) {}
