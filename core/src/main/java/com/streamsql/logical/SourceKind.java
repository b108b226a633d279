package com.streamsql.logical;

/**
 * Declared kind of a source or sink.
 */
public enum SourceKind {
    STREAM,
    TABLE;

    /**
     * Returns the statement keyword for this kind.
     *
     * @return {@code STREAM} or {@code TABLE}
     */
    public String keyword() {
        return name();
    }
}
