package com.gql2jsonschema.core.introspect;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * The {@code __TypeKind} values of GraphQL introspection. Kinds this project does not know
 * about deserialize as {@link #UNKNOWN}.
 */
public enum TypeKind {
    SCALAR,
    OBJECT,
    INTERFACE,
    UNION,
    ENUM,
    INPUT_OBJECT,
    LIST,
    NON_NULL,
    UNKNOWN;

    @JsonCreator
    public static TypeKind fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (TypeKind kind : values()) {
            if (kind.name().equals(value)) {
                return kind;
            }
        }
        return UNKNOWN;
    }
}
