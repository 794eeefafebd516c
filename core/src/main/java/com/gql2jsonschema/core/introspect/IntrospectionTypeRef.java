package com.gql2jsonschema.core.introspect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A type reference. {@code NON_NULL} and {@code LIST} wrap another reference in {@code ofType};
 * every other kind is a leaf that carries a {@code name}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IntrospectionTypeRef(
        @JsonProperty("kind") TypeKind kind,
        @JsonProperty("name") String name,
        @JsonProperty("ofType") IntrospectionTypeRef ofType
) {
    public IntrospectionTypeRef {
        kind = kind == null ? TypeKind.UNKNOWN : kind;
    }

    public static IntrospectionTypeRef named(TypeKind kind, String name) {
        return new IntrospectionTypeRef(kind, name, null);
    }

    public static IntrospectionTypeRef nonNull(IntrospectionTypeRef ofType) {
        return new IntrospectionTypeRef(TypeKind.NON_NULL, null, ofType);
    }

    public static IntrospectionTypeRef listOf(IntrospectionTypeRef ofType) {
        return new IntrospectionTypeRef(TypeKind.LIST, null, ofType);
    }
}
