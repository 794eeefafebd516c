package com.gql2jsonschema.core.introspect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of an introspection result: the value of {@code data} in the response to the
 * introspection query.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IntrospectionQuery(
        @JsonProperty("__schema") IntrospectionSchema schema
) {}
