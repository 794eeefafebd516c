package com.gql2jsonschema.core.convert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gql2jsonschema.core.introspect.IntrospectionEnumValue;
import com.gql2jsonschema.core.introspect.IntrospectionField;
import com.gql2jsonschema.core.introspect.IntrospectionInputValue;
import com.gql2jsonschema.core.introspect.IntrospectionType;
import com.gql2jsonschema.core.introspect.IntrospectionTypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.gql2jsonschema.core.convert.TypeReferenceResolver.isRequired;

/**
 * Builds the schema body of a named type.
 * <p>
 * Objects and interfaces describe each field as an object with two properties, {@code return}
 * (the field's type) and {@code arguments} (an object of the field's arguments). Input objects
 * describe each input field directly. Enums become a string constrained by an {@code anyOf} of
 * single-value enums, unions a {@code oneOf} of references to their members.
 */
public class TypeBodyBuilder {
    private static final Logger logger = LoggerFactory.getLogger(TypeBodyBuilder.class);
    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;
    private static final ObjectMapper literalMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final TypeReferenceResolver resolver;

    public TypeBodyBuilder(ConvertOptions options) {
        this(new TypeReferenceResolver(options));
    }

    public TypeBodyBuilder(TypeReferenceResolver resolver) {
        this.resolver = resolver;
    }

    public ObjectNode buildType(IntrospectionType type) {
        ObjectNode schema = nodes.objectNode();
        schema.put("type", "object");
        putText(schema, "description", type.description());

        switch (type.kind()) {
            case OBJECT, INTERFACE -> {
                ObjectNode properties = nodes.objectNode();
                ArrayNode required = nodes.arrayNode();
                for (IntrospectionField field : type.fields()) {
                    properties.set(field.name(), buildField(field));
                    if (isRequired(field.type())) {
                        required.add(field.name());
                    }
                }
                putMembers(schema, properties, required);
            }
            case INPUT_OBJECT -> putInputValues(schema, type.inputFields());
            case ENUM -> {
                schema.put("type", "string");
                ArrayNode anyOf = schema.putArray("anyOf");
                for (IntrospectionEnumValue value : type.enumValues()) {
                    ObjectNode option = anyOf.addObject();
                    option.putArray("enum").add(value.name());
                    putText(option, "title", value.description());
                    putText(option, "description", value.description());
                }
            }
            case UNION -> {
                schema.remove("type");
                ArrayNode oneOf = schema.putArray("oneOf");
                for (IntrospectionTypeRef possibleType : type.possibleTypes()) {
                    if (possibleType.name() != null) {
                        oneOf.add(TypeReferenceResolver.reference(possibleType.name()));
                    }
                }
            }
            default -> {
                // scalars and unknown kinds keep the bare object shape
            }
        }
        return schema;
    }

    public ObjectNode buildField(IntrospectionField field) {
        ObjectNode schema = nodes.objectNode();
        schema.put("type", "object");
        putText(schema, "description", field.description());

        ObjectNode properties = schema.putObject("properties");
        properties.set("return", resolver.resolve(field.type()));

        ObjectNode arguments = nodes.objectNode();
        arguments.put("type", "object");
        putInputValues(arguments, field.args());
        properties.set("arguments", arguments);

        return schema;
    }

    public ObjectNode buildInputValue(IntrospectionInputValue input) {
        ObjectNode schema = resolver.resolve(input.type());
        putText(schema, "description", input.description());

        if (input.defaultValue() != null) {
            JsonNode defaultValue = parseDefault(input.name(), input.defaultValue());
            if (defaultValue != null) {
                schema.set("default", defaultValue);
            }
        }
        return schema;
    }

    private void putInputValues(ObjectNode schema, List<IntrospectionInputValue> inputs) {
        ObjectNode properties = nodes.objectNode();
        ArrayNode required = nodes.arrayNode();
        for (IntrospectionInputValue input : inputs) {
            properties.set(input.name(), buildInputValue(input));
            if (isRequired(input.type())) {
                required.add(input.name());
            }
        }
        putMembers(schema, properties, required);
    }

    private static void putMembers(ObjectNode schema, ObjectNode properties, ArrayNode required) {
        if (!properties.isEmpty()) {
            schema.set("properties", properties);
        }
        if (!required.isEmpty()) {
            schema.set("required", required);
        }
    }

    /**
     * Defaults are GraphQL literals, which are only JSON for scalars and lists of them. Enum values
     * and input object literals do not parse and are left out.
     */
    private static JsonNode parseDefault(String inputName, String literal) {
        try {
            JsonNode value = literalMapper.readTree(literal);
            if (value == null || value.isMissingNode() || value.isNull()) {
                return null;
            }
            if (hasNonFiniteNumber(value)) {
                logger.debug("Skipping default value of '{}', out of range: {}", inputName, literal);
                return null;
            }
            return value;
        } catch (JsonProcessingException e) {
            logger.debug("Skipping default value of '{}', not a JSON literal: {}", inputName, literal);
            return null;
        }
    }

    /**
     * Literals past the range of a double parse to infinity, which has no JSON form.
     */
    private static boolean hasNonFiniteNumber(JsonNode value) {
        if (value.isDouble() || value.isFloat()) {
            return !Double.isFinite(value.doubleValue());
        }
        for (JsonNode child : value) {
            if (hasNonFiniteNumber(child)) {
                return true;
            }
        }
        return false;
    }

    private static void putText(ObjectNode schema, String key, String value) {
        if (value == null || value.isEmpty()) {
            schema.remove(key);
        } else {
            schema.put(key, value);
        }
    }
}
