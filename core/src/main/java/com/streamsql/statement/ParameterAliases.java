package com.streamsql.statement;

import com.streamsql.expression.Lambda;
import com.streamsql.expression.Parameter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps clause lambda parameters to the source aliases {@code o} and {@code i}.
 */
final class ParameterAliases {

    private ParameterAliases() {
        // Utility class
    }

    /**
     * Aliases parameters positionally against the declared sources: the first
     * parameter gets {@code o} only when the primary source is aliased, the
     * second always gets {@code i}.
     */
    static Map<String, String> forSources(Lambda lambda, int sourceCount, boolean aliasPrimary) {
        Map<String, String> map = new LinkedHashMap<>();
        List<Parameter> parameters = lambda.parameters();
        for (int i = 0; i < parameters.size() && i < sourceCount; i++) {
            if (i == 0 && aliasPrimary) {
                map.put(parameters.get(i).name(), FromClauseBuilder.PRIMARY_ALIAS);
            } else if (i == 1) {
                map.put(parameters.get(i).name(), FromClauseBuilder.JOIN_ALIAS);
            }
        }
        return map;
    }

    /**
     * Aliases predicate parameters without checking the source count.
     */
    static Map<String, String> forPredicate(Lambda lambda, boolean aliasPrimary) {
        Map<String, String> map = new LinkedHashMap<>();
        List<Parameter> parameters = lambda.parameters();
        if (!parameters.isEmpty() && aliasPrimary) {
            map.put(parameters.get(0).name(), FromClauseBuilder.PRIMARY_ALIAS);
        }
        if (parameters.size() > 1) {
            map.put(parameters.get(1).name(), FromClauseBuilder.JOIN_ALIAS);
        }
        return map;
    }
}
