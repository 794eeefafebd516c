package com.gql2jsonschema.core.convert;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gql2jsonschema.core.introspect.IntrospectionTypeRef;
import com.gql2jsonschema.core.introspect.TypeKind;

/**
 * Unwraps a {@code NON_NULL}/{@code LIST} reference chain into a schema node. Named types other
 * than scalars become {@code $ref}s into {@code #/definitions}. Broken chains produce an empty node.
 * <p>
 * Nullability is not part of the node itself; {@link #isRequired} tells the caller whether the
 * property holding the reference belongs in its {@code required} list.
 */
public class TypeReferenceResolver {
    static final String DEFINITIONS_PREFIX = "#/definitions/";

    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private final ConvertOptions options;

    public TypeReferenceResolver(ConvertOptions options) {
        this.options = options == null ? ConvertOptions.defaults() : options;
    }

    public ObjectNode resolve(IntrospectionTypeRef ref) {
        if (ref == null) {
            return nodes.objectNode();
        }

        switch (ref.kind()) {
            case NON_NULL:
                return ref.ofType() != null ? resolve(ref.ofType()) : nodes.objectNode();
            case LIST:
                return resolveList(ref.ofType());
            case SCALAR:
                return ref.name() != null
                        ? ScalarMapper.mapScalar(ref.name(), options.idTypeMapping())
                        : nodes.objectNode();
            default:
                return ref.name() != null ? reference(ref.name()) : nodes.objectNode();
        }
    }

    private ObjectNode resolveList(IntrospectionTypeRef itemType) {
        ObjectNode schema = nodes.objectNode();
        schema.put("type", "array");
        if (itemType == null) {
            return schema;
        }

        ObjectNode items = resolve(itemType);
        if (options.nullableArrayItems() && !isRequired(itemType)) {
            ObjectNode nullable = nodes.objectNode();
            nullable.putArray("anyOf")
                    .add(items)
                    .add(nodes.objectNode().put("type", "null"));
            items = nullable;
        }
        schema.set("items", items);
        return schema;
    }

    public static boolean isRequired(IntrospectionTypeRef ref) {
        return ref != null && ref.kind() == TypeKind.NON_NULL;
    }

    public static ObjectNode reference(String typeName) {
        return nodes.objectNode().put("$ref", DEFINITIONS_PREFIX + typeName);
    }
}
