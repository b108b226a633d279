package com.streamsql.statement;

import com.streamsql.logical.QueryModel;
import com.streamsql.logical.RenderOptions;
import com.streamsql.logical.SourceDescriptor;

import java.util.Objects;
import java.util.function.Function;

/**
 * Inputs of one CREATE ... AS SELECT compilation.
 *
 * @param name target stream or table name, also the sink topic
 * @param model the query model
 * @param keySchemaFullName optional key schema full name
 * @param valueSchemaFullName optional value schema full name; falls back to the model's extras
 * @param partitionBy optional explicit partition column list
 * @param options key-path style and result type hints
 * @param sourceNameResolver maps a source to its FROM/JOIN identifier
 */
public record CreateRequest(
        String name,
        QueryModel model,
        String keySchemaFullName,
        String valueSchemaFullName,
        String partitionBy,
        RenderOptions options,
        Function<SourceDescriptor, String> sourceNameResolver) {

    public CreateRequest {
        Objects.requireNonNull(model, "model must not be null");
        if (options == null) {
            options = RenderOptions.defaults();
        }
        if (sourceNameResolver == null) {
            sourceNameResolver = SourceDescriptor::sourceName;
        }
    }

    public static CreateRequest of(String name, QueryModel model) {
        return new CreateRequest(name, model, null, null, null, null, null);
    }

    public CreateRequest withSchemas(String keySchema, String valueSchema) {
        return new CreateRequest(name, model, keySchema, valueSchema, partitionBy, options, sourceNameResolver);
    }

    public CreateRequest withPartitionBy(String columns) {
        return new CreateRequest(name, model, keySchemaFullName, valueSchemaFullName, columns, options,
            sourceNameResolver);
    }

    public CreateRequest withOptions(RenderOptions renderOptions) {
        return new CreateRequest(name, model, keySchemaFullName, valueSchemaFullName, partitionBy, renderOptions,
            sourceNameResolver);
    }

    public CreateRequest withSourceNameResolver(Function<SourceDescriptor, String> resolver) {
        return new CreateRequest(name, model, keySchemaFullName, valueSchemaFullName, partitionBy, options,
            resolver);
    }
}
