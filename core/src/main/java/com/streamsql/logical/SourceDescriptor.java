package com.streamsql.logical;

import com.streamsql.expression.ExpressionUtils;
import com.streamsql.expression.MemberAccess;
import com.streamsql.expression.Parameter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Metadata view of a record type bound to a topic.
 *
 * <p>Produced by the type-reflection layer; this compiler only reads it. The
 * source name used in FROM is the declared topic upper-cased, or the type name
 * when no topic is declared.
 */
public final class SourceDescriptor {

    private final String typeName;
    private final String topic;
    private final SourceKind kind;
    private final List<ColumnDescriptor> columns;

    public SourceDescriptor(String typeName, String topic, SourceKind kind, List<ColumnDescriptor> columns) {
        this.typeName = Objects.requireNonNull(typeName, "typeName must not be null");
        this.topic = topic;
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.columns = List.copyOf(Objects.requireNonNull(columns, "columns must not be null"));
    }

    public static SourceDescriptor stream(String typeName, String topic, ColumnDescriptor... columns) {
        return new SourceDescriptor(typeName, topic, SourceKind.STREAM, List.of(columns));
    }

    public static SourceDescriptor table(String typeName, String topic, ColumnDescriptor... columns) {
        return new SourceDescriptor(typeName, topic, SourceKind.TABLE, List.of(columns));
    }

    public String typeName() {
        return typeName;
    }

    public Optional<String> topic() {
        return Optional.ofNullable(topic);
    }

    public SourceKind kind() {
        return kind;
    }

    public boolean isTable() {
        return kind == SourceKind.TABLE;
    }

    public List<ColumnDescriptor> columns() {
        return columns;
    }

    /**
     * Returns the identifier used in FROM and JOIN.
     *
     * @return the upper-cased topic, or the type name
     */
    public String sourceName() {
        if (topic != null && !topic.isBlank()) {
            return topic.toUpperCase(Locale.ROOT);
        }
        return typeName;
    }

    /**
     * Returns the key columns in declaration order.
     *
     * @return the key columns
     */
    public List<ColumnDescriptor> keyColumns() {
        List<ColumnDescriptor> keys = new ArrayList<>();
        for (ColumnDescriptor column : columns) {
            if (column.key()) {
                keys.add(column);
            }
        }
        return Collections.unmodifiableList(keys);
    }

    public boolean hasKey() {
        return columns.stream().anyMatch(ColumnDescriptor::key);
    }

    /**
     * Returns the sanitized, upper-cased names of all columns.
     *
     * @return the column identifiers in declaration order
     */
    public Set<String> columnIdentifiers() {
        Set<String> identifiers = new LinkedHashSet<>();
        for (ColumnDescriptor column : columns) {
            identifiers.add(ExpressionUtils.sanitizeName(column.name()).toUpperCase(Locale.ROOT));
        }
        return Collections.unmodifiableSet(identifiers);
    }

    public Optional<ColumnDescriptor> column(String name) {
        for (ColumnDescriptor column : columns) {
            if (column.name().equals(name)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    /**
     * Creates a member access on a lambda parameter for one of this source's columns,
     * carrying the column's value type and key flag.
     *
     * @param parameter the lambda parameter bound to this source
     * @param name the column name
     * @return the member access
     * @throws IllegalArgumentException if the column is not declared
     */
    public MemberAccess member(Parameter parameter, String name) {
        ColumnDescriptor column = column(name).orElseThrow(() ->
            new IllegalArgumentException("Column '" + name + "' is not declared on " + typeName));
        return new MemberAccess(parameter, column.name(), column.valueType(), column.key());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SourceDescriptor)) return false;
        SourceDescriptor that = (SourceDescriptor) obj;
        return typeName.equals(that.typeName) && Objects.equals(topic, that.topic)
            && kind == that.kind && columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeName, topic, kind, columns);
    }

    @Override
    public String toString() {
        return String.format("SourceDescriptor[%s, topic=%s, %s, columns=%d]", typeName, topic, kind, columns.size());
    }
}
