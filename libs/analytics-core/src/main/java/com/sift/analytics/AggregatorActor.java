package com.sift.analytics;

import com.sift.analytics.snapshot.SnapshotProvider;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single consumer of analytics events.
 * <p>
 * Producers {@link #offer(AggregateEnvelope) offer} envelopes into a bounded mailbox; an offer
 * never blocks and is dropped when the mailbox is full. One dedicated thread reacts to two
 * triggers:
 * <ul>
 *   <li>an envelope in the mailbox: it is folded into the {@link AggregationStore};
 *   <li>the flush timer: the snapshot is pushed, the store is drained to the sink, and the sink is
 *       flushed.
 * </ul>
 * The timer fires at a fixed rate, the first time one interval after {@link #start()}. The store is
 * only ever touched by the aggregator thread.
 */
public final class AggregatorActor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AggregatorActor.class);

    /** Name of the aggregator thread. */
    public static final String THREAD_NAME = "sift-analytics-aggregator";

    private final BlockingQueue<AggregateEnvelope<?>> mailbox;
    private final AggregationStore store;
    private final AnalyticsSink sink;
    private final SnapshotProvider snapshots;
    private final String userId;
    private final long intervalNanos;
    private final AnalyticsMetrics metrics;
    private final Thread thread;

    private volatile boolean running;

    /**
     * Creates the actor; no thread runs until {@link #start()}.
     *
     * @param settings  mailbox capacity and flush interval
     * @param sink      delivery client
     * @param snapshots snapshot pushed ahead of every flush
     * @param userId    identity every record is attributed to
     * @param metrics   pipeline metrics
     */
    public AggregatorActor(
            AnalyticsSettings settings,
            AnalyticsSink sink,
            SnapshotProvider snapshots,
            String userId,
            AnalyticsMetrics metrics) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink must not be null");
        }
        if (snapshots == null) {
            throw new IllegalArgumentException("snapshots must not be null");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.mailbox = new ArrayBlockingQueue<>(settings.mailboxCapacity());
        this.store = new AggregationStore(metrics);
        this.sink = sink;
        this.snapshots = snapshots;
        this.userId = userId;
        this.intervalNanos = settings.flushInterval().toNanos();
        this.metrics = metrics;
        this.thread = new Thread(this::run, THREAD_NAME);
        this.thread.setDaemon(true);
        metrics.bindMailbox(mailbox);
    }

    /**
     * Starts the aggregator thread. The first flush happens one interval from now.
     *
     * @throws IllegalStateException if already started
     */
    public synchronized AggregatorActor start() {
        if (thread.getState() != Thread.State.NEW) {
            throw new IllegalStateException("aggregator already started");
        }
        running = true;
        thread.start();
        log.info("Analytics aggregator started, flushing every {}", Duration.ofNanos(intervalNanos));
        return this;
    }

    /**
     * Hands an envelope to the aggregator without blocking.
     *
     * @return false if the mailbox was full and the event was dropped
     */
    public boolean offer(AggregateEnvelope<?> envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope must not be null");
        }
        if (mailbox.offer(envelope)) {
            metrics.accepted();
            return true;
        }
        metrics.dropped();
        log.trace("Analytics mailbox full, dropping {}", envelope);
        return false;
    }

    private void run() {
        long nextFlush = System.nanoTime() + intervalNanos;
        while (running) {
            try {
                long remaining = nextFlush - System.nanoTime();
                if (remaining <= 0) {
                    nextFlush += intervalNanos;
                    flush();
                    continue;
                }
                AggregateEnvelope<?> envelope = mailbox.poll(remaining, TimeUnit.NANOSECONDS);
                if (envelope != null) {
                    store.record(envelope);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                running = false;
            } catch (RuntimeException e) {
                log.warn("Analytics aggregator recovered from an unexpected error", e);
            }
        }
        log.debug("Analytics aggregator stopped");
    }

    /**
     * One flush cycle: snapshot first, then one record per kind, then a sink flush.
     */
    void flush() {
        try {
            snapshots.snapshot(userId).ifPresent(this::pushQuietly);
        } catch (RuntimeException e) {
            log.warn("Analytics snapshot failed", e);
        }
        int kinds = store.drainAndExport(sink, userId);
        try {
            sink.flush();
        } catch (SinkException e) {
            log.debug("Analytics sink flush failed: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Analytics sink flush failed", e);
        }
        metrics.flushed();
        log.debug("Analytics flush exported {} event kinds", kinds);
    }

    private void pushQuietly(AnalyticsRecord record) {
        try {
            sink.push(record);
        } catch (SinkException e) {
            log.debug("Analytics sink refused the snapshot: {}", e.getMessage());
            metrics.recordFailed();
        } catch (RuntimeException e) {
            log.warn("Analytics sink failed on the snapshot", e);
            metrics.recordFailed();
        }
    }

    /**
     * Stops the aggregator thread. Events not yet flushed are discarded.
     */
    @Override
    public void close() {
        running = false;
        thread.interrupt();
    }

    /** Events waiting in the mailbox. */
    public int pending() {
        return mailbox.size();
    }

    public boolean isRunning() {
        return running && thread.isAlive();
    }

    AggregationStore store() {
        return store;
    }
}
