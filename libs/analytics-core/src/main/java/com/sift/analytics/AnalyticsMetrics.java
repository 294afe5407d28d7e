package com.sift.analytics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Collection;

/**
 * Micrometer instrumentation of the analytics pipeline itself.
 * <p>
 * Every meter carries a {@code service} tag. Meter names:
 * <ul>
 *   <li>{@value #EVENTS_ACCEPTED} – events accepted into the mailbox
 *   <li>{@value #EVENTS_DROPPED} – events discarded because the mailbox was full
 *   <li>{@value #EVENTS_MISMATCHED} – events dropped because their payload did not match the stored kind
 *   <li>{@value #FLUSHES} – completed flush cycles
 *   <li>{@value #RECORDS_FAILED} – records the sink refused or could not export
 *   <li>{@value #MAILBOX_SIZE} – events waiting in the mailbox
 * </ul>
 */
public final class AnalyticsMetrics {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    public static final String EVENTS_ACCEPTED = "sift.analytics.events.accepted";
    public static final String EVENTS_DROPPED = "sift.analytics.events.dropped";
    public static final String EVENTS_MISMATCHED = "sift.analytics.events.mismatched";
    public static final String FLUSHES = "sift.analytics.flushes";
    public static final String RECORDS_FAILED = "sift.analytics.records.failed";
    public static final String MAILBOX_SIZE = "sift.analytics.mailbox.size";

    private final MeterRegistry registry;
    private final Tags tags;
    private final Counter accepted;
    private final Counter dropped;
    private final Counter mismatched;
    private final Counter flushes;
    private final Counter failedRecords;

    /**
     * Creates the meters in the given registry.
     *
     * @param registry    the Micrometer meter registry
     * @param serviceName logical service name included as a tag
     */
    public AnalyticsMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.tags = Tags.of(TAG_SERVICE, serviceName);
        this.accepted = counter(EVENTS_ACCEPTED, "Analytics events accepted into the mailbox");
        this.dropped = counter(EVENTS_DROPPED, "Analytics events dropped because the mailbox was full");
        this.mismatched = counter(EVENTS_MISMATCHED, "Analytics events dropped on a kind mismatch");
        this.flushes = counter(FLUSHES, "Completed analytics flush cycles");
        this.failedRecords = counter(RECORDS_FAILED, "Analytics records that could not be exported or pushed");
    }

    /**
     * Metrics backed by a private {@link SimpleMeterRegistry}, for hosts that do not export meters.
     */
    public static AnalyticsMetrics standalone(String serviceName) {
        return new AnalyticsMetrics(new SimpleMeterRegistry(), serviceName);
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name).description(description).tags(tags).register(registry);
    }

    /**
     * Registers a gauge reporting the number of events waiting in the mailbox.
     */
    public void bindMailbox(Collection<?> mailbox) {
        Gauge.builder(MAILBOX_SIZE, mailbox, Collection::size)
                .description("Analytics events waiting in the mailbox")
                .tags(tags)
                .register(registry);
    }

    void accepted() {
        accepted.increment();
    }

    void dropped() {
        dropped.increment();
    }

    void mismatched() {
        mismatched.increment();
    }

    void flushed() {
        flushes.increment();
    }

    void recordFailed() {
        failedRecords.increment();
    }

    /** Returns the underlying meter registry. */
    public MeterRegistry registry() {
        return registry;
    }
}
