package com.streamsql.expression;

import com.streamsql.types.ValueType;

/**
 * Base interface for all nodes of the typed query-expression model.
 *
 * <p>Expressions are built by the query DSL from lambda bodies and represent:
 * <ul>
 *   <li>Method calls (o.Name.ToUpper(), g.Sum(x =&gt; x.Amount))</li>
 *   <li>Member accesses (o.Id, g.Key.Symbol)</li>
 *   <li>Constants and lambda parameters</li>
 *   <li>Unary, binary and conditional operators</li>
 *   <li>Object initializers (the SELECT projection shape)</li>
 * </ul>
 *
 * <p>The node set is closed. Renderers switch on {@link #kind()} so that adding a
 * node kind is a compile error at every exhaustive switch instead of a runtime
 * fallback.
 */
public sealed interface Expression
        permits MethodCall, MemberAccess, Constant, Parameter, Lambda,
                UnaryExpression, BinaryExpression, Conditional, ObjectInit {

    /**
     * Node kinds of the expression model.
     */
    enum Kind {
        METHOD_CALL,
        MEMBER_ACCESS,
        CONSTANT,
        PARAMETER,
        LAMBDA,
        UNARY,
        BINARY,
        CONDITIONAL,
        OBJECT_INIT
    }

    /**
     * Returns the node kind.
     *
     * @return the kind
     */
    Kind kind();

    /**
     * Returns the static value type produced by this expression.
     *
     * @return the value type
     */
    ValueType valueType();
}
