package com.gql2jsonschema.core.introspect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IntrospectionField(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("args") List<IntrospectionInputValue> args,
        @JsonProperty("type") IntrospectionTypeRef type
) {
    public IntrospectionField {
        args = args == null ? List.of() : args;
    }
}
