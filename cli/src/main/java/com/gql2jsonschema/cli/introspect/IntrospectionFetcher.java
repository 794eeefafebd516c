package com.gql2jsonschema.cli.introspect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gql2jsonschema.core.introspect.IntrospectionQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the introspection query against a live GraphQL endpoint.
 */
public class IntrospectionFetcher {
    private static final Logger logger = LoggerFactory.getLogger(IntrospectionFetcher.class);

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Duration timeout;

    /**
     * @param timeout connect and request timeout; {@code null}, zero or negative means no timeout
     */
    public IntrospectionFetcher(Duration timeout) {
        this.timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? null : timeout;
        HttpClient.Builder clientBuilder = HttpClient.newBuilder();
        if (this.timeout != null) {
            clientBuilder.connectTimeout(this.timeout);
        }
        this.httpClient = clientBuilder.build();
        this.mapper = new ObjectMapper();
    }

    /**
     * @param headers extra request headers, each formatted as {@code "Name: value"}
     */
    public IntrospectionQuery fetch(URI endpoint, List<String> headers) {
        HttpRequest request = createRequest(endpoint, parseHeaders(headers));

        logger.info("Fetching schema from endpoint: {}", endpoint);

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new IntrospectionException("error making request: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IntrospectionException("request interrupted", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            logger.debug("Endpoint answered {}: {}", response.statusCode(), response.body());
            throw new IntrospectionException("HTTP error: " + response.statusCode());
        }

        GraphQLResponse graphQLResponse;
        try {
            graphQLResponse = mapper.readValue(response.body(), GraphQLResponse.class);
        } catch (JsonProcessingException e) {
            throw new IntrospectionException("error parsing response: " + e.getOriginalMessage(), e);
        }
        return graphQLResponse.dataOrThrow();
    }

    private HttpRequest createRequest(URI endpoint, Map<String, String> headers) {
        String body;
        try {
            body = mapper.writeValueAsString(Map.of("query", IntrospectionQueries.INTROSPECTION));
        } catch (JsonProcessingException e) {
            throw new IntrospectionException("error marshaling query", e);
        }

        var builder = HttpRequest.newBuilder()
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        try {
            builder.uri(endpoint);
        } catch (IllegalArgumentException e) {
            throw new IntrospectionException("invalid endpoint " + endpoint + ": " + e.getMessage(), e);
        }
        if (timeout != null) {
            builder.timeout(timeout);
        }

        headers.forEach((name, value) -> {
            try {
                builder.setHeader(name, value);
            } catch (IllegalArgumentException e) {
                throw new IntrospectionException("invalid header '" + name + "': " + e.getMessage(), e);
            }
        });
        return builder.build();
    }

    /**
     * Splits {@code "Name: value"} strings at the first colon. Entries without a colon are dropped.
     */
    static Map<String, String> parseHeaders(List<String> headers) {
        Map<String, String> parsed = new LinkedHashMap<>();
        if (headers == null) {
            return parsed;
        }
        for (String header : headers) {
            int colon = header.indexOf(':');
            if (colon < 0) {
                logger.warn("Ignoring malformed header '{}', expected 'Name: value'", header);
                continue;
            }
            parsed.put(header.substring(0, colon).trim(), header.substring(colon + 1).trim());
        }
        return parsed;
    }
}
