package com.gql2jsonschema.core.convert;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gql2jsonschema.core.introspect.IntrospectionQuery;
import com.gql2jsonschema.core.introspect.IntrospectionSchema;
import com.gql2jsonschema.core.introspect.IntrospectionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Converts an introspection result into a JSON Schema document.
 * <p>
 * The query and mutation roots become {@code properties.Query} and {@code properties.Mutation};
 * every other named type becomes an entry of {@code definitions}, which the rest of the document
 * points at with {@code $ref}.
 * <p>
 * Conversion is best effort. Types that cannot be found, broken type references, unknown scalars
 * and unreadable default values are left out of the output instead of failing the conversion.
 */
public class SchemaAssembler {
    private static final Logger logger = LoggerFactory.getLogger(SchemaAssembler.class);

    public static final String SCHEMA_VERSION = "http://json-schema.org/draft-06/schema#";
    public static final String QUERY = "Query";
    public static final String MUTATION = "Mutation";

    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private final ConvertOptions options;
    private final TypeBodyBuilder bodyBuilder;

    public SchemaAssembler(ConvertOptions options) {
        this.options = options == null ? ConvertOptions.defaults() : options;
        this.bodyBuilder = new TypeBodyBuilder(this.options);
    }

    public static ObjectNode convert(IntrospectionQuery introspection, ConvertOptions options) {
        return new SchemaAssembler(options).convert(introspection);
    }

    public ObjectNode convert(IntrospectionQuery introspection) {
        ObjectNode root = nodes.objectNode();
        root.put("$schema", SCHEMA_VERSION);
        ObjectNode properties = root.putObject("properties");
        ObjectNode definitions = root.putObject("definitions");

        if (introspection == null || introspection.schema() == null) {
            logger.debug("Introspection result has no __schema, producing an empty schema");
            return root;
        }

        IntrospectionSchema schema = introspection.schema();
        String queryTypeName = schema.queryTypeName();
        String mutationTypeName = schema.mutationTypeName();

        findType(schema.types(), queryTypeName)
                .ifPresent(type -> properties.set(QUERY, bodyBuilder.buildType(type)));
        findType(schema.types(), mutationTypeName)
                .ifPresent(type -> properties.set(MUTATION, bodyBuilder.buildType(type)));

        for (IntrospectionType type : schema.types()) {
            String name = type.name();
            if (name == null || (options.ignoreInternals() && type.isInternal())) {
                continue;
            }
            if (isRootType(name, queryTypeName, mutationTypeName)) {
                continue;
            }
            if (definitions.has(name)) {
                logger.warn("Duplicate type '{}' in introspection result, keeping the first one", name);
                continue;
            }
            definitions.set(name, bodyBuilder.buildType(type));
        }

        logger.debug("Converted {} root types and {} definitions", properties.size(), definitions.size());
        return root;
    }

    /**
     * First type with the given name, internal types included.
     */
    static Optional<IntrospectionType> findType(List<IntrospectionType> types, String name) {
        if (name == null) {
            return Optional.empty();
        }
        return types.stream()
                .filter(type -> name.equals(type.name()))
                .findFirst();
    }

    private static boolean isRootType(String name, String queryTypeName, String mutationTypeName) {
        return QUERY.equals(name) || MUTATION.equals(name)
                || name.equals(queryTypeName) || name.equals(mutationTypeName);
    }
}
