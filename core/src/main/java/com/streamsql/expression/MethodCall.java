package com.streamsql.expression;

import com.streamsql.types.ValueType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A method call captured from the query DSL.
 *
 * <p>Three call shapes exist:
 * <ul>
 *   <li>Instance calls ({@code o.Name.ToUpper()}): the receiver is set and counts
 *       as one implicit argument</li>
 *   <li>Static calls ({@code Convert.ToInt32(o.Code)}): no receiver</li>
 *   <li>Extension calls ({@code g.Sum(x =&gt; x.Amount)}): static calls whose first
 *       argument is the logical receiver; that argument is not counted</li>
 * </ul>
 *
 * <p>Examples:
 * <pre>
 *   MethodCall.instance(name, "ToUpper", ValueType.STRING)
 *   MethodCall.staticCall("Convert", "ToInt32", ValueType.INT, code)
 *   MethodCall.extension("Enumerable", "Sum", ValueType.DOUBLE, g, selector)
 * </pre>
 */
public final class MethodCall implements Expression {

    private final String declaringType;
    private final String methodName;
    private final Expression receiver;
    private final List<Expression> arguments;
    private final boolean isStatic;
    private final boolean extension;
    private final ValueType valueType;

    /**
     * Creates a method call.
     *
     * @param declaringType simple name of the declaring type (may be null)
     * @param methodName the method name
     * @param receiver the instance receiver, or null for static calls
     * @param arguments the arguments, including the receiver of an extension call
     * @param isStatic whether the method is static
     * @param extension whether the method is an extension method
     * @param valueType the result type
     */
    public MethodCall(String declaringType, String methodName, Expression receiver,
                      List<Expression> arguments, boolean isStatic, boolean extension,
                      ValueType valueType) {
        this.declaringType = declaringType;
        this.methodName = Objects.requireNonNull(methodName, "methodName must not be null");
        this.receiver = receiver;
        this.arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments must not be null"));
        this.isStatic = isStatic;
        this.extension = extension;
        this.valueType = Objects.requireNonNull(valueType, "valueType must not be null");
        if (extension && (!isStatic || this.arguments.isEmpty())) {
            throw new IllegalArgumentException(
                "extension call '" + methodName + "' must be static and carry its receiver as first argument");
        }
    }

    public static MethodCall instance(Expression receiver, String methodName, ValueType valueType,
                                      Expression... arguments) {
        Objects.requireNonNull(receiver, "receiver must not be null");
        return new MethodCall(null, methodName, receiver, Arrays.asList(arguments), false, false, valueType);
    }

    public static MethodCall staticCall(String declaringType, String methodName, ValueType valueType,
                                        Expression... arguments) {
        return new MethodCall(declaringType, methodName, null, Arrays.asList(arguments), true, false, valueType);
    }

    public static MethodCall extension(String declaringType, String methodName, ValueType valueType,
                                       Expression receiver, Expression... arguments) {
        List<Expression> all = new ArrayList<>(arguments.length + 1);
        all.add(Objects.requireNonNull(receiver, "receiver must not be null"));
        all.addAll(Arrays.asList(arguments));
        return new MethodCall(declaringType, methodName, null, all, true, true, valueType);
    }

    public String declaringType() {
        return declaringType;
    }

    public String methodName() {
        return methodName;
    }

    /**
     * Returns the instance receiver.
     *
     * @return the receiver, or null for static and extension calls
     */
    public Expression receiver() {
        return receiver;
    }

    public List<Expression> arguments() {
        return arguments;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public boolean isExtension() {
        return extension;
    }

    /**
     * Returns true for a non-static call with a receiver.
     *
     * @return true for instance calls
     */
    public boolean hasInstanceReceiver() {
        return receiver != null && !isStatic;
    }

    /**
     * Returns the argument count used for arity validation: the declared
     * arguments, plus one for an instance receiver, minus one for the receiver
     * of an extension call.
     *
     * @return the effective argument count
     */
    public int effectiveArgumentCount() {
        int count = arguments.size();
        if (hasInstanceReceiver()) {
            count++;
        }
        if (extension) {
            count--;
        }
        return count;
    }

    /**
     * Returns the arguments that are rendered into the target function call: the
     * instance receiver (if any) followed by the declared arguments, with the
     * receiver of an extension call dropped.
     *
     * @return the rendered arguments
     */
    public List<Expression> renderedArguments() {
        List<Expression> result = new ArrayList<>(arguments.size() + 1);
        if (hasInstanceReceiver()) {
            result.add(receiver);
        }
        result.addAll(extension ? arguments.subList(1, arguments.size()) : arguments);
        return result;
    }

    @Override
    public Kind kind() {
        return Kind.METHOD_CALL;
    }

    @Override
    public ValueType valueType() {
        return valueType;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MethodCall)) return false;
        MethodCall that = (MethodCall) obj;
        return isStatic == that.isStatic
            && extension == that.extension
            && Objects.equals(declaringType, that.declaringType)
            && methodName.equals(that.methodName)
            && Objects.equals(receiver, that.receiver)
            && arguments.equals(that.arguments)
            && valueType == that.valueType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(declaringType, methodName, receiver, arguments, isStatic, extension, valueType);
    }

    @Override
    public String toString() {
        String prefix = receiver != null ? receiver + "." : (declaringType != null ? declaringType + "." : "");
        return prefix + methodName + arguments;
    }
}
