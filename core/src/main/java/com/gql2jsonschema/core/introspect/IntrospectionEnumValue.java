package com.gql2jsonschema.core.introspect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IntrospectionEnumValue(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description
) {}
