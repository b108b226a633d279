package com.streamsql.logical;

import java.util.Objects;
import java.util.Optional;

/**
 * Rendering options for statement assembly.
 *
 * @param keyPathStyle key-path style override; {@link KeyPathStyle#NONE} selects per source
 * @param resultType optional result type for cast hints
 */
public record RenderOptions(KeyPathStyle keyPathStyle, ResultType resultType) {

    private static final RenderOptions DEFAULTS = new RenderOptions(KeyPathStyle.NONE, null);

    public RenderOptions {
        Objects.requireNonNull(keyPathStyle, "keyPathStyle must not be null");
    }

    public static RenderOptions defaults() {
        return DEFAULTS;
    }

    public static RenderOptions withKeyPathStyle(KeyPathStyle style) {
        return new RenderOptions(style, null);
    }

    public static RenderOptions withResultType(ResultType resultType) {
        return new RenderOptions(KeyPathStyle.NONE, resultType);
    }

    public Optional<ResultType> result() {
        return Optional.ofNullable(resultType);
    }
}
