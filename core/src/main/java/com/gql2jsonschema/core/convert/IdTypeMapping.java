package com.gql2jsonschema.core.convert;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How the {@code ID} scalar is typed in generated schemas.
 */
public enum IdTypeMapping {
    STRING("string"),
    NUMBER("number"),
    BOTH("both");

    private final String value;

    IdTypeMapping(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static IdTypeMapping fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (IdTypeMapping mapping : values()) {
                if (mapping.value.equals(normalized)) {
                    return mapping;
                }
            }
        }
        throw new InvalidOptionException("invalid id-type mapping: " + value);
    }
}
