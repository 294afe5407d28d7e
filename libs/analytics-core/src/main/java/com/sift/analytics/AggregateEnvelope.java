package com.sift.analytics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Kind-independent wrapper around one aggregate payload, as seen by the aggregation store.
 * <p>
 * Besides the payload, an envelope tracks when its data was first observed, which clients
 * (user agents) produced it, and how many original events were folded into it. Envelopes are
 * immutable; merging produces a new envelope.
 *
 * @param <T> the concrete aggregate type
 */
public final class AggregateEnvelope<T extends Aggregate<T>> {

    /** Property filled with the client labels when the payload leaves it unset. */
    public static final String USER_AGENT_PROPERTY = "user-agent";

    /** Section holding request counters. */
    public static final String REQUESTS_SECTION = "requests";

    /** Counter filled with the occurrence count when the payload leaves it unset. */
    public static final String TOTAL_RECEIVED_PROPERTY = "total_received";

    private final AggregateKind<T> kind;
    private final T payload;
    private final Instant firstSeen;
    private final SortedSet<String> sources;
    private final long occurrences;

    private AggregateEnvelope(
            AggregateKind<T> kind, T payload, Instant firstSeen, Set<String> sources, long occurrences) {
        this.kind = kind;
        this.payload = payload;
        this.firstSeen = firstSeen;
        SortedSet<String> labels = new TreeSet<>();
        for (String source : sources) {
            if (source != null) {
                labels.add(source);
            }
        }
        this.sources = Collections.unmodifiableSortedSet(labels);
        this.occurrences = occurrences;
    }

    /**
     * Wraps a single freshly observed event.
     *
     * @param payload  the event payload; its {@link Aggregate#kind()} becomes the envelope kind
     * @param sources  client labels of the request that produced the event; {@code null} labels are ignored
     * @param observed when the event was observed
     */
    public static <T extends Aggregate<T>> AggregateEnvelope<T> of(T payload, Set<String> sources, Instant observed) {
        return of(payload, sources, observed, 1);
    }

    /**
     * Wraps a payload that already represents {@code occurrences} events.
     */
    public static <T extends Aggregate<T>> AggregateEnvelope<T> of(
            T payload, Set<String> sources, Instant observed, long occurrences) {
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        AggregateKind<T> kind = payload.kind();
        if (kind == null) {
            throw new IllegalArgumentException("payload kind must not be null");
        }
        if (observed == null) {
            throw new IllegalArgumentException("observed must not be null");
        }
        if (occurrences < 0) {
            throw new IllegalArgumentException("occurrences must not be negative");
        }
        return new AggregateEnvelope<>(kind, payload, observed, sources == null ? Set.of() : sources, occurrences);
    }

    /**
     * Merges the payload of {@code other} into this envelope's payload.
     * <p>
     * Returns empty if {@code other} belongs to a different kind; the caller is expected to drop
     * the incoming event.
     */
    public Optional<T> tryMerge(AggregateEnvelope<?> other) {
        if (other == null || other.kind != kind) {
            return Optional.empty();
        }
        return Optional.of(kind.merge(payload, kind.cast(other.payload)));
    }

    /**
     * Merges a complete envelope: payloads via {@link #tryMerge}, the earliest first-seen
     * timestamp, the union of sources and the saturating sum of occurrences.
     */
    public Optional<AggregateEnvelope<T>> mergeWith(AggregateEnvelope<?> other) {
        return tryMerge(other).map(merged -> {
            Set<String> union = new TreeSet<>(sources);
            union.addAll(other.sources);
            Instant earliest = other.firstSeen.isBefore(firstSeen) ? other.firstSeen : firstSeen;
            return new AggregateEnvelope<>(
                    kind, merged, earliest, union, Saturating.add(occurrences, other.occurrences));
        });
    }

    /**
     * Exports the payload as a track record attributed to {@code userId}, timestamped with the
     * first time this data was observed.
     * <p>
     * Consumes the payload.
     */
    public AnalyticsRecord export(String userId) {
        ObjectNode properties = payload.intoEvent();
        if (properties == null) {
            properties = AnalyticsJson.object();
        }
        if (isUnset(properties.get(USER_AGENT_PROPERTY))) {
            properties.set(USER_AGENT_PROPERTY, AnalyticsJson.strings(sources));
        }
        JsonNode requests = properties.get(REQUESTS_SECTION);
        ObjectNode requestsSection = requests instanceof ObjectNode section
                ? section
                : properties.putObject(REQUESTS_SECTION);
        if (isUnset(requestsSection.get(TOTAL_RECEIVED_PROPERTY))) {
            requestsSection.put(TOTAL_RECEIVED_PROPERTY, occurrences);
        }
        return AnalyticsRecord.track(userId, payload.eventName(), properties, firstSeen);
    }

    private static boolean isUnset(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    public AggregateKind<T> kind() {
        return kind;
    }

    public T payload() {
        return payload;
    }

    /** When the earliest event folded into this envelope was observed. */
    public Instant firstSeen() {
        return firstSeen;
    }

    /** Client labels seen since the envelope was created, sorted. */
    public SortedSet<String> sources() {
        return sources;
    }

    /** Number of original events folded into this envelope. */
    public long occurrences() {
        return occurrences;
    }

    @Override
    public String toString() {
        return "AggregateEnvelope[kind=" + kind.key() + ", firstSeen=" + firstSeen
                + ", occurrences=" + occurrences + "]";
    }
}
