package com.gql2jsonschema.cli.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SchemaWriterTest {
    private static final ObjectMapper mapper = new ObjectMapper();

    @Test
    void writesPrettyJsonToStdout() throws Exception {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        JsonNode schema = mapper.readTree("{\"$schema\": \"x\", \"properties\": {}}");

        new SchemaWriter(new PrintStream(buffer, true, StandardCharsets.UTF_8)).write(schema, null);

        String written = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(written.contains("\n  \"properties\""), written);
        assertEquals(schema, mapper.readTree(written));
    }

    @Test
    void createsParentDirectories(@TempDir Path dir) throws Exception {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        Path output = dir.resolve("nested/deeper/schema.json");
        JsonNode schema = mapper.readTree("{\"definitions\": {\"A\": {\"type\": \"object\"}}}");

        new SchemaWriter(new PrintStream(buffer)).write(schema, output);

        assertTrue(Files.exists(output));
        assertEquals(schema, mapper.readTree(Files.readString(output)));
        assertEquals(0, buffer.size());
    }
}
