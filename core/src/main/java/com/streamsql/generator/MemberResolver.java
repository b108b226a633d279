package com.streamsql.generator;

import com.streamsql.expression.MemberAccess;

/**
 * Resolves a member access to a column reference for one translation call.
 *
 * <p>Clause builders pass their own resolver so that one translator serves
 * different alias regimes. Returning null falls back to the bare member name.
 */
@FunctionalInterface
public interface MemberResolver {

    /** Resolver that always falls back to the member name. */
    MemberResolver BARE = member -> null;

    /**
     * Resolves a member access.
     *
     * @param member the member access
     * @return the column text, or null to use the member name
     */
    String resolve(MemberAccess member);
}
