package com.streamsql.hub;

/**
 * Classification of a projection member.
 */
public enum ProjectionMemberKind {
    /** Reads the grouping key or one of its parts. */
    KEY,
    /** Reads a source column. */
    VALUE,
    /** A single aggregate call. */
    AGGREGATE,
    /** Anything else: constants, arithmetic, conditionals, nested objects. */
    COMPUTED
}
