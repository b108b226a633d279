package com.streamsql.exception;

/**
 * Exception thrown when a query model violates a precondition of statement
 * compilation.
 *
 * <p>Carries the compilation phase that detected the problem, a short rendering
 * of the offending context and an optional suggestion for the caller.
 *
 * <p>Example:
 * <pre>
 *   throw new ValidationException(
 *       "Join condition required for two table join",
 *       "join validation",
 *       "sources: Orders, Customers",
 *       "Supply an equality predicate between the two sources");
 * </pre>
 */
public class ValidationException extends RuntimeException {

    private final String phase;
    private final String context;
    private final String suggestion;

    public ValidationException(String message) {
        this(message, null, null, null);
    }

    public ValidationException(String message, String phase, String context, String suggestion) {
        super(message);
        this.phase = phase;
        this.context = context;
        this.suggestion = suggestion;
    }

    /**
     * Returns the compilation phase where validation failed.
     *
     * @return the phase, or null
     */
    public String getPhase() {
        return phase;
    }

    public String getContext() {
        return context;
    }

    public String getSuggestion() {
        return suggestion;
    }

    /**
     * Returns a user-friendly error message including phase and suggestion.
     *
     * @return the formatted message
     */
    public String getUserMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (phase != null) {
            sb.append(" [").append(phase).append("]");
        }
        if (suggestion != null) {
            sb.append(". ").append(suggestion);
        }
        return sb.toString();
    }
}
