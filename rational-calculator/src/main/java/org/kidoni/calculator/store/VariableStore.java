package org.kidoni.calculator.store;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import org.kidoni.calculator.expr.Expr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Name to expression bindings for one session, together with the set of names currently being resolved.
 * <p>
 * A name is in progress only inside {@link #resolving(String, Supplier)}; while it is, {@link #get(String)}
 * reports it as absent, so a self-referencing binding surfaces as an unresolved name instead of endless recursion.
 * Not thread-safe: a session owns its store.
 */
public class VariableStore {
    private static final Logger log = LoggerFactory.getLogger(VariableStore.class);

    private final Map<String, Expr> bindings = new LinkedHashMap<>();
    private final Set<String> inProgress = new HashSet<>();

    public void insert(final String name, final Expr value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        Expr previous = bindings.put(name, value);
        if (previous != null) {
            log.debug("rebound {} (was {})", name, previous);
        }
        else {
            log.debug("bound {}", name);
        }
    }

    /**
     * The bound value, or empty when the name is unbound or being resolved. Values are immutable trees, so the
     * caller can never alter the stored binding through the result.
     */
    public Optional<Expr> get(final String name) {
        if (inProgress.contains(name)) {
            return Optional.empty();
        }
        return Optional.ofNullable(bindings.get(name));
    }

    public boolean isResolving(final String name) {
        return inProgress.contains(name);
    }

    /**
     * Runs {@code resolution} with {@code name} marked in progress. Nested calls for other names stack; the mark is
     * removed when {@code resolution} returns or throws.
     */
    public <T> T resolving(final String name, final Supplier<T> resolution) {
        if (!inProgress.add(name)) {
            throw new IllegalStateException(name + " is already being resolved");
        }
        try {
            return resolution.get();
        }
        finally {
            inProgress.remove(name);
        }
    }
}
