package com.gql2jsonschema.core.introspect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IntrospectionSchema(
        @JsonProperty("queryType") TypeName queryType,
        @JsonProperty("mutationType") TypeName mutationType,
        @JsonProperty("subscriptionType") TypeName subscriptionType,
        @JsonProperty("types") List<IntrospectionType> types
) {
    public IntrospectionSchema {
        types = types == null ? List.of() : types;
    }

    public String queryTypeName() {
        return queryType == null ? null : queryType.name();
    }

    public String mutationTypeName() {
        return mutationType == null ? null : mutationType.name();
    }
}
