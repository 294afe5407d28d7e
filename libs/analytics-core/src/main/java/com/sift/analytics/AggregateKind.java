package com.sift.analytics;

import java.util.Objects;
import java.util.function.BinaryOperator;

/**
 * Descriptor of one event kind: a stable key, the event name it is exported under, the concrete
 * payload class and the merge function for that class.
 * <p>
 * Kinds are compared by identity. Declare each one once, as a constant next to its aggregate
 * class, and register it in an {@link AggregateKindRegistry}:
 * <pre>{@code
 * public static final AggregateKind<SimilarAggregator> SIMILAR_GET =
 *         AggregateKind.of("similar.get", "Similar GET", SimilarAggregator.class);
 * }</pre>
 *
 * @param <T> the concrete aggregate type
 */
public final class AggregateKind<T extends Aggregate<T>> {

    private final String key;
    private final String eventName;
    private final Class<T> type;
    private final BinaryOperator<T> merger;

    private AggregateKind(String key, String eventName, Class<T> type, BinaryOperator<T> merger) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be null or blank");
        }
        if (eventName == null || eventName.isBlank()) {
            throw new IllegalArgumentException("eventName must not be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (merger == null) {
            throw new IllegalArgumentException("merger must not be null");
        }
        this.key = key;
        this.eventName = eventName;
        this.type = type;
        this.merger = merger;
    }

    /**
     * Creates a kind merged through {@link Aggregate#aggregate(Aggregate)}.
     */
    public static <T extends Aggregate<T>> AggregateKind<T> of(String key, String eventName, Class<T> type) {
        return new AggregateKind<>(
                key, eventName, type, (first, second) -> first.aggregate(second));
    }

    /**
     * Creates a kind with an explicit merge function.
     */
    public static <T extends Aggregate<T>> AggregateKind<T> of(
            String key, String eventName, Class<T> type, BinaryOperator<T> merger) {
        return new AggregateKind<>(key, eventName, type, merger);
    }

    /**
     * Merges two payloads of this kind.
     */
    public T merge(T first, T second) {
        return merger.apply(
                Objects.requireNonNull(first, "first"), Objects.requireNonNull(second, "second"));
    }

    /**
     * Casts a payload whose kind is known to be this one.
     */
    T cast(Object payload) {
        return type.cast(payload);
    }

    /** Stable key, unique per kind; the aggregation store is keyed on it. */
    public String key() {
        return key;
    }

    /** Name of the exported event. */
    public String eventName() {
        return eventName;
    }

    /** Concrete payload class. */
    public Class<T> type() {
        return type;
    }

    @Override
    public String toString() {
        return "AggregateKind[" + key + " -> " + eventName + "]";
    }
}
