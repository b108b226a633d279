package com.streamsql.hub;

import com.streamsql.expression.Expression;
import com.streamsql.expression.Lambda;
import com.streamsql.expression.MemberBinding;
import com.streamsql.expression.MethodCall;
import com.streamsql.expression.ObjectInit;
import com.streamsql.expression.Parameter;
import com.streamsql.types.ValueType;

import java.util.ArrayList;
import java.util.List;

/**
 * Adapts a grouped projection so it can read a derived per-second rows stream.
 *
 * <p>A {@code BucketStart} member is rebound to the window start of the group;
 * every other member is kept and left to {@link HubSelectPolicy}. Projections that
 * are not over a grouping parameter, or not a named object initializer, are
 * returned unchanged.
 */
public final class HubRowsProjectionAdapter {

    static final String BUCKET_START = "BucketStart";

    private HubRowsProjectionAdapter() {
        // Utility class
    }

    public static Expression adapt(Expression projection) {
        if (!(projection instanceof Lambda lambda) || lambda.parameters().isEmpty()) {
            return projection;
        }
        Parameter group = lambda.parameters().get(0);
        if (!group.isGrouping() || !(lambda.body() instanceof ObjectInit init) || init.isAnonymous()) {
            return projection;
        }

        List<MemberBinding> bindings = new ArrayList<>(init.bindings().size());
        boolean changed = false;
        for (MemberBinding binding : init.bindings()) {
            if (BUCKET_START.equalsIgnoreCase(binding.member())) {
                Expression windowStart = MethodCall.extension(
                    "WindowExtensions", "WindowStart", ValueType.DATETIME, group);
                bindings.add(new MemberBinding(binding.member(), windowStart));
                changed = true;
            } else {
                bindings.add(binding);
            }
        }
        if (!changed) {
            return projection;
        }
        return new Lambda(lambda.parameters(), init.withBindings(bindings));
    }
}
