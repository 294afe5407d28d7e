package com.sift.analytics;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Entry point for producers of analytics events.
 * <p>
 * Request handlers build a payload for their event kind and publish it. Publishing never blocks
 * and never throws because of the analytics pipeline; when the pipeline is disabled or saturated
 * the event is silently discarded.
 * <pre>{@code
 * SearchAggregator aggregate = SearchAggregator.fromQuery(SearchMethod.POST, query);
 * SearchResult result = search(query);
 * aggregate.succeed(result);
 * analytics.publish(aggregate, UserAgents.extract(clientHeader, userAgent));
 * }</pre>
 */
public interface Analytics {

    /**
     * Publishes one event.
     *
     * @param payload the event payload
     * @param sources client labels of the originating request
     * @return true if the event was accepted for aggregation
     */
    <T extends Aggregate<T>> boolean publish(T payload, Set<String> sources);

    /** Uid of this instance, empty when analytics are disabled. */
    Optional<UUID> instanceUid();

    /** False for the no-op implementation. */
    boolean isEnabled();

    /**
     * Analytics that discard every event.
     */
    static Analytics disabled() {
        return DisabledAnalytics.INSTANCE;
    }
}
