package com.streamsql.statement;

import com.streamsql.logical.ColumnDescriptor;
import com.streamsql.logical.KeyPathStyle;
import com.streamsql.logical.QueryModel;
import com.streamsql.logical.SourceDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites key-column references in rendered clauses into table-key syntax.
 *
 * <p>With {@link KeyPathStyle#ARROW} a key column {@code ID} becomes {@code KEY->ID};
 * with {@link KeyPathStyle#DOT} it becomes {@code key.ID}. References that are
 * already prefixed, quoted, or the target of an {@code AS} rename are left alone.
 */
final class KeyPathStyler {

    private static final Pattern STANDALONE_KEY =
        Pattern.compile("\\bKEY\\b(?!->|\\.)", Pattern.CASE_INSENSITIVE);

    /**
     * Key columns and style for one source alias; the alias is empty when the
     * primary source is not aliased.
     */
    record KeyAlias(String alias, Set<String> keys, KeyPathStyle style) {

        KeyAlias {
            keys = Collections.unmodifiableSet(new LinkedHashSet<>(keys));
        }
    }

    private KeyPathStyler() {
        // Utility class
    }

    /**
     * Builds the per-alias key map of a model.
     *
     * @param model the query model
     * @param overrideStyle the caller's style; NONE selects ARROW for tables and NONE for streams
     * @return one entry per source
     */
    static List<KeyAlias> keyAliases(QueryModel model, KeyPathStyle overrideStyle) {
        List<KeyAlias> result = new ArrayList<>();
        List<SourceDescriptor> sources = model.sources();
        if (!sources.isEmpty()) {
            String alias = model.primarySourceRequiresAlias() ? FromClauseBuilder.PRIMARY_ALIAS : "";
            result.add(new KeyAlias(alias, keyNames(sources.get(0)), styleFor(sources.get(0), overrideStyle)));
        }
        if (sources.size() > 1) {
            result.add(new KeyAlias(FromClauseBuilder.JOIN_ALIAS, keyNames(sources.get(1)),
                styleFor(sources.get(1), overrideStyle)));
        }
        return result;
    }

    static Set<String> keyNames(SourceDescriptor source) {
        Set<String> keys = new LinkedHashSet<>();
        for (ColumnDescriptor column : source.keyColumns()) {
            keys.add(column.name().toUpperCase(Locale.ROOT));
        }
        return keys;
    }

    static KeyPathStyle styleFor(SourceDescriptor source, KeyPathStyle overrideStyle) {
        if (overrideStyle != null && overrideStyle != KeyPathStyle.NONE) {
            return overrideStyle;
        }
        return source.isTable() ? KeyPathStyle.ARROW : KeyPathStyle.NONE;
    }

    /**
     * Applies the key map to one clause.
     *
     * @param clause the rendered clause, may be empty
     * @param entries the key map
     * @return the rewritten clause
     */
    static String apply(String clause, List<KeyAlias> entries) {
        if (clause == null || clause.isEmpty()) {
            return clause;
        }
        String result = clause;
        for (KeyAlias entry : entries) {
            if (entry.style() == KeyPathStyle.NONE) {
                continue;
            }
            if (entry.keys().size() == 1) {
                String lone = entry.keys().iterator().next();
                result = STANDALONE_KEY.matcher(result)
                    .replaceAll(Matcher.quoteReplacement(styled(lone, entry.style())));
            }
            for (String key : entry.keys()) {
                String replacement = styled(key, entry.style());
                if (entry.alias().isEmpty()) {
                    result = replaceBare(result, key, replacement);
                } else {
                    Pattern qualified = Pattern.compile(
                        "(?<!KEY->)(?<!key\\.)(?<![`'\"])\\b" + Pattern.quote(entry.alias()) + "\\."
                            + Pattern.quote(key) + "\\b(?![`'\"])",
                        Pattern.CASE_INSENSITIVE);
                    result = qualified.matcher(result).replaceAll(Matcher.quoteReplacement(replacement));
                }
            }
        }
        return result;
    }

    private static String replaceBare(String clause, String key, String replacement) {
        Pattern bare = Pattern.compile(
            "(?<!KEY->)(?<!key\\.)(?<![`'\"])\\b" + Pattern.quote(key) + "\\b(?![`'\"])",
            Pattern.CASE_INSENSITIVE);
        Matcher matcher = bare.matcher(clause);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = isRenameTarget(clause, matcher.start()) ? matcher.group() : replacement;
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Returns true if the nearest preceding word is {@code AS}.
     */
    private static boolean isRenameTarget(String clause, int index) {
        int i = index - 1;
        while (i >= 0 && Character.isWhitespace(clause.charAt(i))) {
            i--;
        }
        if (i < 1) {
            return false;
        }
        int end = i;
        while (i >= 0 && Character.isLetter(clause.charAt(i))) {
            i--;
        }
        return "AS".equalsIgnoreCase(clause.substring(i + 1, end + 1));
    }

    private static String styled(String key, KeyPathStyle style) {
        switch (style) {
            case DOT:
                return "key." + key;
            case ARROW:
                return "KEY->" + key;
            default:
                return key;
        }
    }
}
