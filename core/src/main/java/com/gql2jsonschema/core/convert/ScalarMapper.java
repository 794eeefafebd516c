package com.gql2jsonschema.core.convert;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Maps GraphQL scalars to JSON Schema primitives. Custom scalars have no JSON type we could
 * know of, so they come out as a node that only carries their name as {@code title}.
 */
public final class ScalarMapper {
    static final String ID_DESCRIPTION = "The `ID` scalar type represents a unique identifier, often used to "
            + "refetch an object or as key for a cache. The ID type appears in a JSON response as a String; "
            + "however, it is not intended to be human-readable. When expected as an input type, any string "
            + "(such as `\"4\"`) or integer (such as `4`) input value will be accepted as an ID.";
    static final String STRING_DESCRIPTION = "The `String` scalar type represents textual data, represented as "
            + "UTF-8 character sequences. The String type is most often used by GraphQL to represent free-form "
            + "human-readable text.";
    static final String BOOLEAN_DESCRIPTION = "The `Boolean` scalar type represents `true` or `false`.";

    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private ScalarMapper() {}

    public static ObjectNode mapScalar(String name, IdTypeMapping idTypeMapping) {
        ObjectNode schema = nodes.objectNode();
        if (name == null) {
            return schema;
        }
        switch (name) {
            case "ID" -> {
                switch (idTypeMapping == null ? IdTypeMapping.STRING : idTypeMapping) {
                    case NUMBER -> schema.put("type", "number");
                    case BOTH -> schema.putArray("type").add("string").add("number");
                    default -> schema.put("type", "string");
                }
                schema.put("description", ID_DESCRIPTION);
            }
            case "String" -> {
                schema.put("type", "string");
                schema.put("description", STRING_DESCRIPTION);
            }
            case "Int", "Float" -> schema.put("type", "number");
            case "Boolean" -> {
                schema.put("type", "boolean");
                schema.put("description", BOOLEAN_DESCRIPTION);
            }
            default -> schema.put("title", name);
        }
        return schema;
    }
}
