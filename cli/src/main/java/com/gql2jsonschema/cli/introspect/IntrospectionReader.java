package com.gql2jsonschema.cli.introspect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gql2jsonschema.core.introspect.IntrospectionQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads an introspection result saved to a file or piped to stdin. Both the bare
 * {@code {"__schema": ...}} document and a full GraphQL response around it are accepted.
 */
public class IntrospectionReader {
    private static final Logger logger = LoggerFactory.getLogger(IntrospectionReader.class);

    private final ObjectMapper mapper;

    public IntrospectionReader() {
        this(new ObjectMapper());
    }

    public IntrospectionReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public IntrospectionQuery read(Path file) {
        logger.debug("Reading introspection result from {}", file);
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.toString());
        } catch (IOException e) {
            throw new IntrospectionException("error reading input file: " + e.getMessage(), e);
        }
    }

    public IntrospectionQuery read(InputStream in, String source) {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (IOException e) {
            throw new IntrospectionException("error parsing " + source + ": " + e.getMessage(), e);
        }
        return unwrap(root, source);
    }

    IntrospectionQuery unwrap(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new IntrospectionException("error parsing " + source + ": expected a JSON object");
        }
        try {
            if (root.has("__schema")) {
                return mapper.treeToValue(root, IntrospectionQuery.class);
            }
            if (root.has("data") || root.has("errors")) {
                return mapper.treeToValue(root, GraphQLResponse.class).dataOrThrow();
            }
        } catch (JsonProcessingException e) {
            throw new IntrospectionException("error parsing " + source + ": " + e.getOriginalMessage(), e);
        }
        throw new IntrospectionException("error parsing " + source + ": no __schema or data found");
    }
}
