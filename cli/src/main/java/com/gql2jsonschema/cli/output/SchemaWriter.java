package com.gql2jsonschema.cli.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

public class SchemaWriter {
    private static final Logger logger = LoggerFactory.getLogger(SchemaWriter.class);

    private final ObjectMapper mapper;
    private final PrintStream stdout;

    public SchemaWriter(PrintStream stdout) {
        this.stdout = stdout;
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Writes to {@code output}, creating missing parent directories, or to stdout when
     * {@code output} is {@code null}.
     */
    public void write(JsonNode schema, Path output) throws IOException {
        String json = mapper.writeValueAsString(schema);
        if (output == null) {
            stdout.println(json);
            stdout.flush();
            return;
        }

        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, json + System.lineSeparator());
        logger.info("Schema written to {}", output.toAbsolutePath());
    }
}
