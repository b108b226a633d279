package com.streamsql.statement;

import com.streamsql.exception.CompilationScopeException;

import java.util.Objects;

/**
 * Capability token that must be held while statements are compiled.
 *
 * <p>The component that owns model creation opens a scope, passes it to every
 * assembler call and closes it when it is done. Compiling the same model from two
 * threads races on its memoized extras, so a scope is not meant to be shared
 * across threads.
 *
 * <pre>
 *   try (CompilationScope scope = CompilationScope.open("orders-pipeline")) {
 *       String sql = assembler.build(scope, CreateRequest.of("ORDERS_5M", model));
 *   }
 * </pre>
 */
public final class CompilationScope implements AutoCloseable {

    private final String owner;
    private boolean active = true;

    private CompilationScope(String owner) {
        this.owner = owner;
    }

    /**
     * Opens a new scope.
     *
     * @param owner a short label for diagnostics
     * @return the active scope
     */
    public static CompilationScope open(String owner) {
        return new CompilationScope(Objects.requireNonNull(owner, "owner must not be null"));
    }

    public String owner() {
        return owner;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * Fails unless the given scope is present and still open.
     *
     * @param scope the scope passed by the caller
     * @throws CompilationScopeException if the scope is null or closed
     */
    static void require(CompilationScope scope) {
        if (scope == null) {
            throw new CompilationScopeException(
                "Statement compilation requires an active model-creation scope");
        }
        if (!scope.active) {
            throw new CompilationScopeException(
                "Compilation scope '" + scope.owner + "' is closed");
        }
    }

    @Override
    public void close() {
        active = false;
    }

    @Override
    public String toString() {
        return "CompilationScope[" + owner + (active ? "" : ", closed") + "]";
    }
}
