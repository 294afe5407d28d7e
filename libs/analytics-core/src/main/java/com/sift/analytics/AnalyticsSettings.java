package com.sift.analytics;

import java.time.Duration;

/**
 * Tuning of the aggregation engine.
 *
 * @param serviceName     service tag on the pipeline's own metrics
 * @param mailboxCapacity events that may wait for the aggregator before new ones are dropped
 * @param flushInterval   period between two flushes; the first flush happens one period after start
 */
public record AnalyticsSettings(String serviceName, int mailboxCapacity, Duration flushInterval) {

    public static final String DEFAULT_SERVICE_NAME = "sift";
    public static final int DEFAULT_MAILBOX_CAPACITY = 100;
    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofHours(1);

    /**
     * Applies defaults for unset values and rejects invalid ones.
     */
    public AnalyticsSettings {
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = DEFAULT_SERVICE_NAME;
        }
        if (mailboxCapacity == 0) {
            mailboxCapacity = DEFAULT_MAILBOX_CAPACITY;
        }
        if (mailboxCapacity < 0) {
            throw new IllegalArgumentException("mailboxCapacity must be positive");
        }
        if (flushInterval == null) {
            flushInterval = DEFAULT_FLUSH_INTERVAL;
        }
        if (flushInterval.isZero() || flushInterval.isNegative()) {
            throw new IllegalArgumentException("flushInterval must be positive");
        }
    }

    /** Settings with every default. */
    public static AnalyticsSettings defaults() {
        return new AnalyticsSettings(null, 0, null);
    }
}
