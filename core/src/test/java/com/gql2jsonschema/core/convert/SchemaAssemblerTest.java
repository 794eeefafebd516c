package com.gql2jsonschema.core.convert;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gql2jsonschema.core.introspect.IntrospectionField;
import com.gql2jsonschema.core.introspect.IntrospectionQuery;
import com.gql2jsonschema.core.introspect.IntrospectionSchema;
import com.gql2jsonschema.core.introspect.IntrospectionType;
import com.gql2jsonschema.core.introspect.TypeKind;
import com.gql2jsonschema.core.introspect.TypeName;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static com.gql2jsonschema.core.introspect.IntrospectionTypeRef.named;
import static com.gql2jsonschema.core.introspect.IntrospectionTypeRef.nonNull;
import static org.junit.jupiter.api.Assertions.*;

class SchemaAssemblerTest {
    private static final ObjectMapper mapper = new ObjectMapper();

    @Test
    void pingQueryBecomesRootProperty() throws Exception {
        IntrospectionQuery introspection = mapper.readValue("""
                {
                  "__schema": {
                    "queryType": {"name": "Query"},
                    "types": [
                      {
                        "kind": "OBJECT",
                        "name": "Query",
                        "fields": [
                          {"name": "ping", "type": {"kind": "NON_NULL", "ofType": {"kind": "SCALAR", "name": "Boolean"}}}
                        ]
                      }
                    ]
                  }
                }
                """, IntrospectionQuery.class);

        ObjectNode schema = SchemaAssembler.convert(introspection, ConvertOptions.defaults());

        assertEquals("http://json-schema.org/draft-06/schema#", schema.get("$schema").asText());
        JsonNode query = schema.get("properties").get("Query");
        assertEquals(mapper.readTree("""
                {"type": "boolean", "description": "The `Boolean` scalar type represents `true` or `false`."}
                """), query.get("properties").get("ping").get("properties").get("return"));
        assertEquals(mapper.readTree("[\"ping\"]"), query.get("required"));
        assertFalse(schema.get("properties").has("Mutation"));
        assertTrue(schema.get("definitions").isEmpty());
    }

    @Test
    void libraryFixtureConverts() throws Exception {
        ObjectNode schema = SchemaAssembler.convert(loadFixture(), ConvertOptions.defaults());

        JsonNode properties = schema.get("properties");
        assertTrue(properties.has("Query"));
        assertTrue(properties.has("Mutation"));

        JsonNode definitions = schema.get("definitions");
        assertEquals(List.of("Book", "Author", "Genre", "SearchResult", "BookInput", "String", "ID", "Int",
                "Boolean", "DateTime"), fieldNames(definitions));

        JsonNode addBook = properties.get("Mutation").get("properties").get("addBook");
        assertEquals("#/definitions/Book", addBook.get("properties").get("return").get("$ref").asText());
        assertEquals("#/definitions/BookInput",
                addBook.get("properties").get("arguments").get("properties").get("input").get("$ref").asText());

        JsonNode books = properties.get("Query").get("properties").get("books");
        JsonNode limit = books.get("properties").get("arguments").get("properties").get("limit");
        assertEquals(20, limit.get("default").asInt());
        assertEquals("Maximum number of books", limit.get("description").asText());

        assertEquals("DateTime", definitions.get("Book").get("properties").get("published")
                .get("properties").get("return").get("title").asText());
    }

    @Test
    void definitionsNeverContainRootsOrInternals() throws Exception {
        ObjectNode schema = SchemaAssembler.convert(loadFixture(), ConvertOptions.defaults());

        for (String name : fieldNames(schema.get("definitions"))) {
            assertNotEquals("Query", name);
            assertNotEquals("Mutation", name);
            assertFalse(name.startsWith("__"), name);
        }
    }

    @Test
    void internalsAreKeptWhenAskedFor() throws Exception {
        ConvertOptions options = ConvertOptions.builder().ignoreInternals(false).build();
        ObjectNode schema = SchemaAssembler.convert(loadFixture(), options);

        assertTrue(schema.get("definitions").has("__Schema"));
        assertTrue(schema.get("definitions").has("__TypeKind"));
        assertEquals("string", schema.get("definitions").get("__TypeKind").get("type").asText());
    }

    @Test
    void renamedRootsAreExcludedByName() {
        IntrospectionType root = object("RootQuery", field("hello"));
        IntrospectionType query = object("Query", field("shadow"));
        IntrospectionType other = object("Other", field("x"));
        IntrospectionQuery introspection = new IntrospectionQuery(new IntrospectionSchema(
                new TypeName("RootQuery"), null, null, List.of(root, query, other)));

        ObjectNode schema = SchemaAssembler.convert(introspection, ConvertOptions.defaults());

        assertTrue(schema.get("properties").get("Query").get("properties").has("hello"));
        assertEquals(List.of("Other"), fieldNames(schema.get("definitions")));
    }

    @Test
    void rootTypesAreFoundEvenWhenInternal() {
        IntrospectionType root = object("__Root", field("hello"));
        IntrospectionQuery introspection = new IntrospectionQuery(new IntrospectionSchema(
                new TypeName("__Root"), null, null, List.of(root)));

        ObjectNode schema = SchemaAssembler.convert(introspection, ConvertOptions.defaults());

        assertTrue(schema.get("properties").get("Query").get("properties").has("hello"));
        assertTrue(schema.get("definitions").isEmpty());
    }

    @Test
    void missingRootsAreSkipped() {
        IntrospectionQuery introspection = new IntrospectionQuery(new IntrospectionSchema(
                new TypeName("Query"), new TypeName("Mutation"), null, List.of(object("Other", field("x")))));

        ObjectNode schema = SchemaAssembler.convert(introspection, ConvertOptions.defaults());

        assertTrue(schema.get("properties").isEmpty());
        assertEquals(List.of("Other"), fieldNames(schema.get("definitions")));
    }

    @Test
    void firstDuplicateWins() {
        IntrospectionType first = object("Query", field("first"));
        IntrospectionType second = object("Query", field("second"));
        IntrospectionType thing = object("Thing", field("a"));
        IntrospectionType shadow = object("Thing", field("b"));
        IntrospectionQuery introspection = new IntrospectionQuery(new IntrospectionSchema(
                new TypeName("Query"), null, null, List.of(first, second, thing, shadow)));

        ObjectNode schema = SchemaAssembler.convert(introspection, ConvertOptions.defaults());

        assertTrue(schema.get("properties").get("Query").get("properties").has("first"));
        JsonNode definedThing = schema.get("definitions").get("Thing");
        assertTrue(definedThing.get("properties").has("a"));
        assertFalse(definedThing.get("properties").has("b"));
    }

    @Test
    void emptyDocumentsGiveAnEmptySchema() {
        for (IntrospectionQuery introspection : new IntrospectionQuery[]{
                null,
                new IntrospectionQuery(null),
                new IntrospectionQuery(new IntrospectionSchema(null, null, null, null))}) {
            ObjectNode schema = SchemaAssembler.convert(introspection, null);

            assertEquals(SchemaAssembler.SCHEMA_VERSION, schema.get("$schema").asText());
            assertTrue(schema.get("properties").isEmpty());
            assertTrue(schema.get("definitions").isEmpty());
        }
    }

    @Test
    void idTypeBothAppliesToIdFields() {
        IntrospectionType query = new IntrospectionType(TypeKind.OBJECT, "Query", null,
                List.of(new IntrospectionField("node", null, List.of(), nonNull(named(TypeKind.SCALAR, "ID")))),
                null, null, null, null);
        IntrospectionQuery introspection = new IntrospectionQuery(new IntrospectionSchema(
                new TypeName("Query"), null, null, List.of(query)));

        ObjectNode schema = SchemaAssembler.convert(introspection,
                ConvertOptions.builder().idTypeMapping("both").build());

        JsonNode type = schema.at("/properties/Query/properties/node/properties/return/type");
        assertEquals(mapper.createArrayNode().add("string").add("number"), type);
    }

    @Test
    void conversionIsRepeatable() throws Exception {
        IntrospectionQuery introspection = loadFixture();
        ConvertOptions options = ConvertOptions.builder().nullableArrayItems(true).build();

        String first = mapper.writeValueAsString(SchemaAssembler.convert(introspection, options));
        String second = mapper.writeValueAsString(SchemaAssembler.convert(introspection, options));

        assertEquals(first, second);
    }

    @Test
    void unknownIdTypeMappingIsRejected() {
        InvalidOptionException e = assertThrows(InvalidOptionException.class,
                () -> ConvertOptions.builder().idTypeMapping("uuid"));
        assertEquals("invalid id-type mapping: uuid", e.getMessage());
    }

    private static IntrospectionQuery loadFixture() throws Exception {
        try (InputStream is = SchemaAssemblerTest.class.getResourceAsStream("/library-introspection.json")) {
            assertNotNull(is, "Fixture file not found");
            return mapper.readValue(is, IntrospectionQuery.class);
        }
    }

    private static IntrospectionType object(String name, IntrospectionField... fields) {
        return new IntrospectionType(TypeKind.OBJECT, name, null, List.of(fields), null, null, null, null);
    }

    private static IntrospectionField field(String name) {
        return new IntrospectionField(name, null, List.of(), named(TypeKind.SCALAR, "String"));
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        Iterator<String> it = node.fieldNames();
        it.forEachRemaining(names::add);
        return names;
    }
}
