package com.sift.analytics;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds at most one envelope per event kind between two flushes.
 * <p>
 * Not thread-safe: owned by the single aggregator thread. Producers never touch it directly;
 * they go through the aggregator's mailbox.
 */
public final class AggregationStore {

    private static final Logger log = LoggerFactory.getLogger(AggregationStore.class);

    private final AnalyticsMetrics metrics;
    private Map<String, AggregateEnvelope<?>> envelopes = new HashMap<>();

    public AggregationStore(AnalyticsMetrics metrics) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.metrics = metrics;
    }

    /**
     * Folds an envelope into the store.
     * <p>
     * The first envelope of a kind is stored as is; later ones are merged into it. If the stored
     * payload cannot be merged with the incoming one, the incoming event is dropped and the
     * stored envelope is kept unchanged.
     *
     * @return false if the incoming event was dropped
     */
    public boolean record(AggregateEnvelope<?> incoming) {
        if (incoming == null) {
            throw new IllegalArgumentException("incoming must not be null");
        }
        String key = incoming.kind().key();
        AggregateEnvelope<?> existing = envelopes.get(key);
        if (existing == null) {
            envelopes.put(key, incoming);
            return true;
        }
        Optional<? extends AggregateEnvelope<?>> merged = existing.mergeWith(incoming);
        if (merged.isEmpty()) {
            log.debug("Dropping analytics event: {} cannot be merged into {}", incoming, existing);
            metrics.mismatched();
            return false;
        }
        envelopes.put(key, merged.get());
        return true;
    }

    /**
     * Empties the store and pushes one track record per drained kind to the sink.
     * <p>
     * The map is swapped for an empty one before anything is exported, so the store is empty
     * afterwards even if exporting or pushing fails, and no event can appear in two flushes.
     * Failures of individual records are logged and discarded.
     *
     * @param sink   delivery client
     * @param userId identity the records are attributed to
     * @return the number of kinds drained
     */
    public int drainAndExport(AnalyticsSink sink, String userId) {
        Map<String, AggregateEnvelope<?>> drained = envelopes;
        envelopes = new HashMap<>();

        for (AggregateEnvelope<?> envelope : drained.values()) {
            AnalyticsRecord record;
            try {
                record = envelope.export(userId);
            } catch (RuntimeException e) {
                log.warn("Failed to export analytics for {}", envelope.kind(), e);
                metrics.recordFailed();
                continue;
            }
            try {
                sink.push(record);
            } catch (SinkException e) {
                log.debug("Analytics sink refused {}: {}", record.event(), e.getMessage());
                metrics.recordFailed();
            } catch (RuntimeException e) {
                log.warn("Analytics sink failed on {}", record.event(), e);
                metrics.recordFailed();
            }
        }
        return drained.size();
    }

    /**
     * Current envelope for a kind key, if any.
     */
    public Optional<AggregateEnvelope<?>> get(String key) {
        return Optional.ofNullable(envelopes.get(key));
    }

    /** Kind keys currently held. */
    public Set<String> keys() {
        return Collections.unmodifiableSet(envelopes.keySet());
    }

    public int size() {
        return envelopes.size();
    }

    public boolean isEmpty() {
        return envelopes.isEmpty();
    }
}
