package com.streamsql.statement;

import com.streamsql.logical.SourceDescriptor;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes short source aliases from rendered clauses where they are not needed.
 *
 * <p>SELECT loses its alias prefixes only for a single unambiguous source. In the
 * other clauses an {@code alias.column} reference becomes the bare column, unless
 * the column exists in more than one source; then it is qualified with the full
 * source name.
 */
final class ClauseDealiaser {

    /**
     * One alias in use, with the source it names and that source's column identifiers.
     */
    record SourceAlias(String alias, String sourceName, Set<String> columnIdentifiers) {
    }

    private ClauseDealiaser() {
        // Utility class
    }

    /**
     * Builds alias metadata from the FROM clause's alias map.
     *
     * @param aliasToSource alias to source name, primary first
     * @param sources the model's sources in the same order
     * @return alias metadata keyed by alias
     */
    static Map<String, SourceAlias> aliasMetadata(Map<String, String> aliasToSource, List<SourceDescriptor> sources) {
        Map<String, SourceAlias> result = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : aliasToSource.entrySet()) {
            String alias = entry.getKey();
            SourceDescriptor source = null;
            if (FromClauseBuilder.PRIMARY_ALIAS.equals(alias) && !sources.isEmpty()) {
                source = sources.get(0);
            } else if (FromClauseBuilder.JOIN_ALIAS.equals(alias) && sources.size() > 1) {
                source = sources.get(1);
            }
            Set<String> columns = source == null ? Collections.emptySet() : source.columnIdentifiers();
            result.put(alias, new SourceAlias(alias, entry.getValue(), columns));
        }
        return result;
    }

    /**
     * Returns the column identifiers declared by more than one aliased source.
     */
    static Set<String> ambiguousColumns(Collection<SourceAlias> aliases) {
        Map<String, Integer> counts = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (SourceAlias alias : aliases) {
            for (String column : alias.columnIdentifiers()) {
                if (column != null && !column.isEmpty()) {
                    counts.merge(column, 1, Integer::sum);
                }
            }
        }
        Set<String> ambiguous = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > 1) {
                ambiguous.add(entry.getKey());
            }
        }
        return ambiguous;
    }

    /**
     * Strips {@code alias.} from every column reference in a SELECT list.
     */
    static String stripSelectAlias(String select, SourceAlias alias) {
        if (select == null || select.isBlank()) {
            return select;
        }
        String quoted = Pattern.quote(alias.alias());
        String result = replace(select, "\\b" + quoted + "\\.`(?<column>[^`]+)`",
            m -> "`" + m.group("column") + "`");
        result = replace(result, "\\b" + quoted + "\\.\"(?<column>[^\"]+)\"",
            m -> "\"" + m.group("column") + "\"");
        return replace(result, "\\b" + quoted + "\\.(?<column>[A-Za-z_][A-Za-z0-9_]*)",
            m -> m.group("column"));
    }

    /**
     * Rewrites alias-qualified references in a non-SELECT clause for every alias.
     */
    static String preferScope(String clause, Collection<SourceAlias> aliases, Set<String> ambiguous) {
        if (clause == null || clause.isBlank()) {
            return clause;
        }
        String result = clause;
        for (SourceAlias alias : aliases) {
            String quoted = Pattern.quote(alias.alias());
            result = replace(result, "\\b" + quoted + "\\.`(?<column>[A-Za-z0-9_]+)`",
                m -> scoped(alias, ambiguous, m.group("column"), "`" + m.group("column") + "`"));
            result = replace(result, "\\b" + quoted + "\\.\"(?<column>[A-Za-z0-9_]+)\"",
                m -> scoped(alias, ambiguous, m.group("column"), "\"" + m.group("column") + "\""));
            result = replace(result, "\\b" + quoted + "\\.(?<column>[A-Za-z0-9_]+)",
                m -> scoped(alias, ambiguous, m.group("column"), m.group("column")));
        }
        return result;
    }

    private static String scoped(SourceAlias alias, Set<String> ambiguous, String column, String rendered) {
        if (ambiguous.contains(SqlIdentifiers.normalize(column))) {
            return alias.sourceName() + "." + rendered;
        }
        return rendered;
    }

    private static String replace(String input, String regex, Function<Matcher, String> replacer) {
        Matcher matcher = Pattern.compile(regex, Pattern.CASE_INSENSITIVE).matcher(input);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacer.apply(matcher)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
