package com.streamsql.exception;

/**
 * Exception thrown when a function receives an argument whose type category is
 * outside the function's allow-list (for example SUM over a STRING column).
 */
public class TypeIncompatibilityException extends UnsupportedConstructException {

    private final String functionName;
    private final String argumentCategory;

    public TypeIncompatibilityException(String functionName, String argumentCategory) {
        super("Function '" + functionName + "' does not support argument type " + argumentCategory,
              functionName);
        this.functionName = functionName;
        this.argumentCategory = argumentCategory;
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getArgumentCategory() {
        return argumentCategory;
    }
}
