package com.streamsql.functions;

import java.util.Objects;

/**
 * Mapping from a source method name to target dialect function syntax.
 *
 * <p>Mappings are immutable. The {@code with...} methods return adjusted copies,
 * which keeps the catalog table readable:
 * <pre>
 *   FunctionMapping.of("UPPER", 1).withGroupBy().withOrderBy()
 *   FunctionMapping.templated("SUBSTRING({0}, 1, {1})", 2).withGroupBy()
 *   FunctionMapping.of("COUNT", 0, 1).withSpecialHandling()
 * </pre>
 *
 * @param function the target function name (or the template text for templated mappings)
 * @param minArgs minimum effective argument count (inclusive)
 * @param maxArgs maximum effective argument count (inclusive)
 * @param specialHandling whether the translator renders this function with dedicated logic
 * @param template positional template using {@code {0}}, {@code {1}}, ... placeholders, or null
 * @param allowedInGroupBy whether the function may appear in a GROUP BY key
 * @param allowedInOrderBy whether the function may appear in an ORDER BY key
 */
public record FunctionMapping(
        String function,
        int minArgs,
        int maxArgs,
        boolean specialHandling,
        String template,
        boolean allowedInGroupBy,
        boolean allowedInOrderBy) {

    /** Upper bound for variadic functions. */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public FunctionMapping {
        Objects.requireNonNull(function, "function must not be null");
        if (minArgs < 0 || maxArgs < minArgs) {
            throw new IllegalArgumentException(
                "Invalid argument bounds for " + function + ": " + minArgs + "-" + maxArgs);
        }
    }

    public static FunctionMapping of(String function, int exactArgs) {
        return new FunctionMapping(function, exactArgs, exactArgs, false, null, false, false);
    }

    public static FunctionMapping of(String function, int minArgs, int maxArgs) {
        return new FunctionMapping(function, minArgs, maxArgs, false, null, false, false);
    }

    /**
     * Creates a mapping rendered through a positional template. The template text
     * doubles as the function name.
     *
     * @param template the template
     * @param exactArgs the exact argument count
     * @return the mapping
     */
    public static FunctionMapping templated(String template, int exactArgs) {
        return new FunctionMapping(template, exactArgs, exactArgs, false, template, false, false);
    }

    public FunctionMapping withTemplate(String newTemplate) {
        return new FunctionMapping(function, minArgs, maxArgs, specialHandling, newTemplate,
            allowedInGroupBy, allowedInOrderBy);
    }

    public FunctionMapping withSpecialHandling() {
        return new FunctionMapping(function, minArgs, maxArgs, true, template,
            allowedInGroupBy, allowedInOrderBy);
    }

    public FunctionMapping withGroupBy() {
        return new FunctionMapping(function, minArgs, maxArgs, specialHandling, template,
            true, allowedInOrderBy);
    }

    public FunctionMapping withOrderBy() {
        return new FunctionMapping(function, minArgs, maxArgs, specialHandling, template,
            allowedInGroupBy, true);
    }

    /**
     * Returns true if the argument count lies within the declared bounds.
     *
     * @param argCount the effective argument count
     * @return true if valid
     */
    public boolean isValidArgCount(int argCount) {
        return argCount >= minArgs && argCount <= maxArgs;
    }

    public boolean hasTemplate() {
        return template != null && !template.isEmpty();
    }

    /**
     * Renders the standard call form: template substitution when a template is
     * declared, otherwise {@code FUNCTION(arg0, arg1, ...)}.
     *
     * @param args rendered argument fragments
     * @return the rendered call
     * @throws IllegalArgumentException if the argument count is out of bounds
     */
    public String generateStandardCall(String... args) {
        if (!isValidArgCount(args.length)) {
            throw new IllegalArgumentException("Invalid argument count for " + function
                + ". Expected " + minArgs + "-" + maxArgs + ", got " + args.length);
        }
        if (hasTemplate()) {
            String result = template;
            for (int i = 0; i < args.length; i++) {
                result = result.replace("{" + i + "}", args[i]);
            }
            return result;
        }
        return function + "(" + String.join(", ", args) + ")";
    }
}
