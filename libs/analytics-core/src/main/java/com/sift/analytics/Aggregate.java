package com.sift.analytics;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Capability implemented by every kind of analytics event.
 * <p>
 * Instances of the same kind are folded together by {@link #aggregate(Aggregate)} until the next
 * flush, where {@link #intoEvent()} turns the accumulated statistics into the properties of one
 * tracked event.
 * <p>
 * Implementations must merge <em>every</em> field: a field left out of {@code aggregate} silently
 * loses the data of all but one request per flush interval.
 *
 * @param <T> the concrete aggregate type
 */
public interface Aggregate<T extends Aggregate<T>> {

    /**
     * The kind this payload belongs to. Must return the same descriptor for every instance that
     * should be merged together.
     */
    AggregateKind<T> kind();

    /**
     * Event name used at export time. Depends only on the kind, never on the instance.
     */
    default String eventName() {
        return kind().eventName();
    }

    /**
     * Combines this payload with another one of the same kind and returns the result.
     * <p>
     * Must be associative and commutative field by field: counters add (saturating), booleans
     * OR, maxima take the max, frequency tables add key-wise, samples concatenate, sets union.
     * Neither operand may be modified.
     */
    T aggregate(T other);

    /**
     * Converts the accumulated statistics into event properties, grouped by concern
     * (e.g. {@code requests}, {@code filter}, {@code pagination}).
     * <p>
     * Single use: the payload must not be used after this call.
     * <p>
     * The {@code user-agent} property and {@code requests.total_received} are filled in by the
     * aggregation store when left unset.
     */
    ObjectNode intoEvent();
}
