package com.streamsql.exception;

/**
 * Exception thrown when statement generation fails for a reason other than a
 * validation or unsupported-construct error.
 *
 * <p>Typed failures ({@link ValidationException}, {@link UnsupportedOperationException},
 * {@link IllegalArgumentException}, {@link IllegalStateException}) propagate unwrapped;
 * anything else is wrapped here together with the name of the statement being built.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       String sql = assembler.build(scope, "orders_by_customer", model);
 *   } catch (StatementGenerationException e) {
 *       log.error(e.getTechnicalMessage());
 *   }
 * </pre>
 */
public class StatementGenerationException extends RuntimeException {

    private final String statementName;

    /**
     * Creates a statement generation exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param statementName the name of the target stream, table or sink
     */
    public StatementGenerationException(String message, Throwable cause, String statementName) {
        super(message + " (statement: " + (statementName != null ? statementName : "null") + ")", cause);
        this.statementName = statementName;
    }

    public String getStatementName() {
        return statementName;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        return "Failed to generate statement for '" + statementName + "'. "
            + "Please simplify the query or check the projection.";
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Statement Generation Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");
        sb.append("Statement: ").append(statementName).append("\n");
        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getName())
              .append(": ").append(getCause().getMessage()).append("\n");
        }
        return sb.toString();
    }
}
