package com.streamsql.logical;

/**
 * How key-column references are rendered.
 *
 * <ul>
 *   <li>{@link #NONE}: leave references bare or alias-qualified</li>
 *   <li>{@link #DOT}: {@code key.COL}</li>
 *   <li>{@link #ARROW}: {@code KEY->COL}, the table-key form</li>
 * </ul>
 */
public enum KeyPathStyle {
    NONE,
    DOT,
    ARROW
}
