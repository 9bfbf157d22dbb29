package com.di.logingest.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Describes how to interpret one raw object: parser, policy schema and compression.
 *
 * <p>Parser and compression are kept as given so that an unsupported value surfaces
 * as a configuration error of the affected source rather than a binding failure of
 * the whole request.
 */
@Value
@Builder
@Jacksonized
public class SourceDescriptor {

    private static final String SCHEMA_QUERY_PREFIX = "data.schema.";

    String parser;
    String schema;
    String compress;

    public ParserKind parserKind() {
        return ParserKind.of(parser);
    }

    public CompressionKind compressionKind() {
        return CompressionKind.of(compress);
    }

    /** Policy query path that transforms raw records of this schema. */
    public String schemaQuery() {
        return SCHEMA_QUERY_PREFIX + schema;
    }
}
