package com.streamsql.exception;

/**
 * Exception thrown when an expression uses a construct the target dialect has
 * no rendering for: an unknown method, a function that is not allowed in a
 * clause, or an unmappable type.
 */
public class UnsupportedConstructException extends UnsupportedOperationException {

    private final String construct;

    /**
     * Creates an unsupported-construct exception.
     *
     * @param message the error message
     * @param construct the name of the offending method or type
     */
    public UnsupportedConstructException(String message, String construct) {
        super(message);
        this.construct = construct;
    }

    /**
     * Returns the name of the method or type that could not be translated.
     *
     * @return the construct name
     */
    public String getConstruct() {
        return construct;
    }
}
