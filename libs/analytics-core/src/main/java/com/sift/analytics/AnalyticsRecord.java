package com.sift.analytics;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.Optional;

/**
 * One record handed to an {@link AnalyticsSink}.
 *
 * @param type      track or identify
 * @param userId    identity the record is attributed to (instance uid or a shared identity)
 * @param event     event name; {@code null} for identify records
 * @param payload   event properties (track) or instance traits (identify)
 * @param context   optional extra context, e.g. the application version; may be {@code null}
 * @param timestamp when the underlying data was first observed; {@code null} lets the
 *                  endpoint use its reception time
 */
public record AnalyticsRecord(
        RecordType type,
        String userId,
        String event,
        ObjectNode payload,
        ObjectNode context,
        Instant timestamp) {

    /** Identity that aggregates first launches across all instances. */
    public static final String TOTAL_LAUNCH_USER = "total_launch";

    /** Event pushed when an instance starts for the first time. */
    public static final String LAUNCHED_EVENT = "Launched";

    public AnalyticsRecord {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        if (type == RecordType.TRACK && (event == null || event.isBlank())) {
            throw new IllegalArgumentException("event must not be null or blank for track records");
        }
        if (payload == null) {
            payload = AnalyticsJson.objectMapper().createObjectNode();
        }
    }

    /**
     * Creates a track record.
     */
    public static AnalyticsRecord track(String userId, String event, ObjectNode properties, Instant timestamp) {
        return new AnalyticsRecord(RecordType.TRACK, userId, event, properties, null, timestamp);
    }

    /**
     * Creates an identify record.
     */
    public static AnalyticsRecord identify(String userId, ObjectNode traits, ObjectNode context) {
        return new AnalyticsRecord(RecordType.IDENTIFY, userId, null, traits, context, null);
    }

    /**
     * Creates a {@value #LAUNCHED_EVENT} track record without properties.
     */
    public static AnalyticsRecord launched(String userId) {
        return track(userId, LAUNCHED_EVENT, null, null);
    }

    /** Timestamp, if one was set explicitly. */
    public Optional<Instant> explicitTimestamp() {
        return Optional.ofNullable(timestamp);
    }
}
