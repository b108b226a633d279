package com.streamsql.expression;

import com.streamsql.types.ValueType;

import java.util.Objects;

/**
 * Access to a member of a record, e.g. {@code o.Amount} or {@code g.Key.Symbol}.
 *
 * <p>The {@code key} flag marks a member declared as a key column of its source
 * record. Key members are rendered upper-cased and alias-qualified in GROUP BY
 * and SELECT.
 */
public final class MemberAccess implements Expression {

    private final Expression target;
    private final String member;
    private final ValueType valueType;
    private final boolean key;

    public MemberAccess(Expression target, String member, ValueType valueType, boolean key) {
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.member = Objects.requireNonNull(member, "member must not be null");
        this.valueType = Objects.requireNonNull(valueType, "valueType must not be null");
        this.key = key;
    }

    public MemberAccess(Expression target, String member, ValueType valueType) {
        this(target, member, valueType, false);
    }

    /**
     * Creates a key member access.
     *
     * @param target the record expression
     * @param member the member name
     * @param valueType the member type
     * @return the member access
     */
    public static MemberAccess key(Expression target, String member, ValueType valueType) {
        return new MemberAccess(target, member, valueType, true);
    }

    public Expression target() {
        return target;
    }

    public String member() {
        return member;
    }

    public boolean isKey() {
        return key;
    }

    /**
     * Returns the parameter at the root of the member chain, or null if the chain
     * does not end in a parameter.
     *
     * @return the root parameter, or null
     */
    public Parameter rootParameter() {
        Expression current = target;
        while (current instanceof MemberAccess) {
            current = ((MemberAccess) current).target;
        }
        return current instanceof Parameter ? (Parameter) current : null;
    }

    @Override
    public Kind kind() {
        return Kind.MEMBER_ACCESS;
    }

    @Override
    public ValueType valueType() {
        return valueType;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MemberAccess)) return false;
        MemberAccess that = (MemberAccess) obj;
        return key == that.key
            && target.equals(that.target)
            && member.equals(that.member)
            && valueType == that.valueType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, member, valueType, key);
    }

    @Override
    public String toString() {
        return target + "." + member;
    }
}
