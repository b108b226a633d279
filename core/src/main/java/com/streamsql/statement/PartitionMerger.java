package com.streamsql.statement;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Normalizes an explicit partition column list and folds it into GROUP BY.
 *
 * <p>Partition columns are compared by their unqualified, upper-cased name;
 * a qualifier ({@code o.}, {@code KEY->}) keeps otherwise equal columns apart when
 * deduplicating the partition list itself.
 */
final class PartitionMerger {

    private static final String GROUP_BY = "GROUP BY";

    /**
     * GROUP BY clause after merging, and whether any partition column took part.
     */
    record Merge(String groupByClause, boolean merged) {
    }

    private record Token(String original, String unqualified, String normalized, String qualifier, int index) {
    }

    private PartitionMerger() {
        // Utility class
    }

    /**
     * Trims each column and rejoins them with {@code ", "}.
     */
    static String normalize(String partitionBy) {
        if (partitionBy == null || partitionBy.isBlank()) {
            return partitionBy;
        }
        return String.join(", ", SqlIdentifiers.split(partitionBy));
    }

    /**
     * Returns the normalized unqualified column names of a partition list.
     */
    static List<String> columnKeys(String partitionBy) {
        List<String> keys = new ArrayList<>();
        for (String part : SqlIdentifiers.split(partitionBy)) {
            String normalized = SqlIdentifiers.normalizedColumn(part);
            if (!normalized.isEmpty()) {
                keys.add(normalized);
            }
        }
        return keys;
    }

    /**
     * Returns true if the partition columns are exactly the declared key columns.
     *
     * @param partitionKeys normalized partition column names
     * @param primaryKeys upper-cased key column names of the primary source
     * @return true when both sets agree
     */
    static boolean matchesKey(List<String> partitionKeys, Set<String> primaryKeys) {
        if (primaryKeys.isEmpty() || partitionKeys.size() != primaryKeys.size()) {
            return false;
        }
        Set<String> keys = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        keys.addAll(primaryKeys);
        return keys.containsAll(partitionKeys);
    }

    /**
     * Removes duplicate partition columns and orders the rest by name, then qualifier.
     */
    static String deduplicate(String partitionBy) {
        if (partitionBy == null || partitionBy.isBlank()) {
            return partitionBy;
        }
        String[] parts = partitionBy.split(",");
        List<Token> tokens = new ArrayList<>();
        for (int i = 0; i < parts.length; i++) {
            String trimmed = parts[i].trim();
            String unqualified = SqlIdentifiers.unqualified(trimmed);
            String normalized = SqlIdentifiers.normalize(unqualified);
            if (trimmed.isEmpty() || unqualified.isEmpty() || normalized.isEmpty()) {
                continue;
            }
            tokens.add(new Token(trimmed, unqualified, normalized, SqlIdentifiers.qualifier(trimmed), i));
        }
        if (tokens.isEmpty()) {
            return "";
        }

        tokens.sort(Comparator.comparing(Token::normalized, String.CASE_INSENSITIVE_ORDER)
            .thenComparing(Token::qualifier, String.CASE_INSENSITIVE_ORDER)
            .thenComparingInt(Token::index));

        Set<String> seen = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        List<String> result = new ArrayList<>();
        for (Token token : tokens) {
            if (seen.add(dedupKey(token))) {
                result.add(token.qualifier().isEmpty() ? token.unqualified() : token.original());
            }
        }
        return String.join(", ", result);
    }

    private static String dedupKey(Token token) {
        if (token.qualifier().isEmpty()) {
            return token.normalized();
        }
        return token.qualifier().toUpperCase(Locale.ROOT) + "::" + token.normalized();
    }

    /**
     * Appends partition columns that GROUP BY does not already name.
     *
     * @param groupByClause the GROUP BY clause including its keyword, may be empty
     * @param partitionColumns the deduplicated partition list
     * @return the merged clause
     */
    static Merge merge(String groupByClause, String partitionColumns) {
        if (partitionColumns == null || partitionColumns.isBlank()) {
            return new Merge(groupByClause, false);
        }
        List<String> groupColumns = SqlIdentifiers.split(stripKeyword(groupByClause));
        Set<String> known = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (String column : groupColumns) {
            known.add(SqlIdentifiers.normalizedColumn(column));
        }

        List<String> partitionList = SqlIdentifiers.split(partitionColumns);
        for (String column : partitionList) {
            if (known.add(SqlIdentifiers.normalizedColumn(column))) {
                groupColumns.add(column);
            }
        }
        boolean merged = !partitionList.isEmpty();
        if (groupColumns.isEmpty()) {
            return new Merge("", merged);
        }
        return new Merge(GROUP_BY + " " + String.join(", ", groupColumns), merged);
    }

    private static String stripKeyword(String groupByClause) {
        if (groupByClause == null || groupByClause.isBlank()) {
            return "";
        }
        String value = groupByClause.trim();
        if (value.regionMatches(true, 0, GROUP_BY, 0, GROUP_BY.length())) {
            value = value.substring(GROUP_BY.length()).trim();
        }
        return value;
    }
}
