package com.sift.analytics;

/**
 * Delivery client for analytics records.
 * <p>
 * Implementations may batch records internally; {@link #flush()} forces the batch out. Both
 * operations are best-effort from the caller's point of view: failures are reported as
 * {@link SinkException} and are never retried by this library.
 * <p>
 * Called from a single thread (the aggregator), except for the one-off launch records pushed
 * while the subsystem starts.
 */
public interface AnalyticsSink {

    /**
     * Accepts one record for delivery.
     *
     * @throws SinkException if the record cannot be accepted
     */
    void push(AnalyticsRecord record) throws SinkException;

    /**
     * Delivers every record accepted so far.
     *
     * @throws SinkException if delivery fails; the batch is not kept for a retry
     */
    void flush() throws SinkException;
}
