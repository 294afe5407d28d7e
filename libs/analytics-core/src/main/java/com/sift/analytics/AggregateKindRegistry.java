package com.sift.analytics;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Table of the event kinds known to the host.
 * <p>
 * Guarantees key uniqueness: a second, different kind declared under an existing key is rejected
 * at registration time, so the aggregation store can never receive two incompatible payloads for
 * the same key. Registering the same kind twice is a no-op.
 */
public final class AggregateKindRegistry {

    private final Map<String, AggregateKind<?>> kinds = new ConcurrentHashMap<>();

    /**
     * Registers a kind.
     *
     * @throws IllegalArgumentException if the kind is null or another kind already uses its key
     */
    public AggregateKindRegistry register(AggregateKind<?> kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        AggregateKind<?> existing = kinds.putIfAbsent(kind.key(), kind);
        if (existing != null && existing != kind) {
            throw new IllegalArgumentException(
                    "key '" + kind.key() + "' is already registered to " + existing);
        }
        return this;
    }

    /**
     * Registers several kinds.
     */
    public AggregateKindRegistry registerAll(Collection<? extends AggregateKind<?>> toRegister) {
        toRegister.forEach(this::register);
        return this;
    }

    /**
     * Looks up a kind by key.
     */
    public Optional<AggregateKind<?>> find(String key) {
        return Optional.ofNullable(kinds.get(key));
    }

    /**
     * Returns true if exactly this kind is registered under its key.
     */
    public boolean contains(AggregateKind<?> kind) {
        return kind != null && kinds.get(kind.key()) == kind;
    }

    /** Registered kinds, unordered. */
    public Collection<AggregateKind<?>> kinds() {
        return Collections.unmodifiableCollection(kinds.values());
    }

    public int size() {
        return kinds.size();
    }
}
