package com.streamsql.exception;

/**
 * Exception thrown when a statement is compiled without an active
 * {@link com.streamsql.statement.CompilationScope}.
 *
 * <p>This always indicates a caller bug.
 */
public class CompilationScopeException extends IllegalStateException {

    public CompilationScopeException(String message) {
        super(message);
    }
}
