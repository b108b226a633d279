package com.streamsql.expression;

import com.streamsql.types.ValueType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An object initializer, the usual shape of a SELECT projection or a composite
 * GROUP BY key.
 *
 * <p>A null type name marks an anonymous type. Named result types are subject to
 * the group-key order check in SELECT.
 */
public final class ObjectInit implements Expression {

    private final String typeName;
    private final List<MemberBinding> bindings;

    public ObjectInit(String typeName, List<MemberBinding> bindings) {
        this.typeName = typeName;
        this.bindings = List.copyOf(Objects.requireNonNull(bindings, "bindings must not be null"));
    }

    /**
     * Starts building an anonymous object initializer.
     *
     * @return a new builder
     */
    public static Builder anonymous() {
        return new Builder(null);
    }

    /**
     * Starts building an initializer of a named result type.
     *
     * @param typeName the result type name
     * @return a new builder
     */
    public static Builder named(String typeName) {
        return new Builder(Objects.requireNonNull(typeName, "typeName must not be null"));
    }

    public Optional<String> typeName() {
        return Optional.ofNullable(typeName);
    }

    public boolean isAnonymous() {
        return typeName == null;
    }

    public List<MemberBinding> bindings() {
        return bindings;
    }

    /**
     * Returns a copy with the given bindings and the same type name.
     *
     * @param newBindings the replacement bindings
     * @return the new initializer
     */
    public ObjectInit withBindings(List<MemberBinding> newBindings) {
        return new ObjectInit(typeName, newBindings);
    }

    @Override
    public Kind kind() {
        return Kind.OBJECT_INIT;
    }

    @Override
    public ValueType valueType() {
        return ValueType.STRUCT;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ObjectInit)) return false;
        ObjectInit that = (ObjectInit) obj;
        return Objects.equals(typeName, that.typeName) && bindings.equals(that.bindings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeName, bindings);
    }

    @Override
    public String toString() {
        return "new " + (typeName != null ? typeName + " " : "") + bindings;
    }

    /**
     * Builder for object initializers.
     */
    public static final class Builder {
        private final String typeName;
        private final List<MemberBinding> bindings = new ArrayList<>();

        private Builder(String typeName) {
            this.typeName = typeName;
        }

        public Builder bind(String member, Expression expression) {
            bindings.add(new MemberBinding(member, expression));
            return this;
        }

        public ObjectInit build() {
            return new ObjectInit(typeName, bindings);
        }
    }
}
