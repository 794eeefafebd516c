package com.gql2jsonschema.core.introspect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A named type declared by the schema. Which member lists are populated depends on {@link #kind()};
 * the others are empty.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IntrospectionType(
        @JsonProperty("kind") TypeKind kind,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("fields") List<IntrospectionField> fields,
        @JsonProperty("inputFields") List<IntrospectionInputValue> inputFields,
        @JsonProperty("interfaces") List<IntrospectionTypeRef> interfaces,
        @JsonProperty("enumValues") List<IntrospectionEnumValue> enumValues,
        @JsonProperty("possibleTypes") List<IntrospectionTypeRef> possibleTypes
) {
    public IntrospectionType {
        kind = kind == null ? TypeKind.UNKNOWN : kind;
        fields = fields == null ? List.of() : fields;
        inputFields = inputFields == null ? List.of() : inputFields;
        interfaces = interfaces == null ? List.of() : interfaces;
        enumValues = enumValues == null ? List.of() : enumValues;
        possibleTypes = possibleTypes == null ? List.of() : possibleTypes;
    }

    public boolean isInternal() {
        return name != null && name.startsWith("__");
    }
}
