package com.gql2jsonschema.cli.introspect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gql2jsonschema.core.introspect.IntrospectionQuery;

import java.util.List;

/**
 * The {@code {"data": ..., "errors": [...]}} envelope a GraphQL server answers the introspection
 * query with.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphQLResponse(
        @JsonProperty("data") IntrospectionQuery data,
        @JsonProperty("errors") List<Error> errors
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Error(
            @JsonProperty("message") String message
    ) {}

    /**
     * @throws IntrospectionException if the server reported errors or sent no data
     */
    public IntrospectionQuery dataOrThrow() {
        if (errors != null && !errors.isEmpty()) {
            throw new IntrospectionException("GraphQL error: " + errors.get(0).message());
        }
        if (data == null) {
            throw new IntrospectionException("no data in response");
        }
        return data;
    }
}
