package com.sift.analytics;

import com.sift.analytics.identity.InstanceIdentity;
import com.sift.analytics.snapshot.SnapshotProvider;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Analytics backed by an {@link AggregatorActor}.
 * <p>
 * Only kinds present in the {@link AggregateKindRegistry} are accepted; payloads of other kinds
 * are discarded.
 */
public final class AggregatingAnalytics implements Analytics, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AggregatingAnalytics.class);

    private final InstanceIdentity identity;
    private final AggregateKindRegistry kinds;
    private final AggregatorActor actor;
    private final Clock clock;

    private AggregatingAnalytics(
            InstanceIdentity identity, AggregateKindRegistry kinds, AggregatorActor actor, Clock clock) {
        this.identity = identity;
        this.kinds = kinds;
        this.actor = actor;
        this.clock = clock;
    }

    /**
     * Starts the pipeline.
     * <p>
     * On the very first run of the instance, a {@value AnalyticsRecord#LAUNCHED_EVENT} event is
     * pushed and flushed under the shared {@value AnalyticsRecord#TOTAL_LAUNCH_USER} identity, then
     * pushed again under the instance's own identity, where it waits for the first flush.
     */
    public static AggregatingAnalytics start(
            AnalyticsSettings settings,
            InstanceIdentity identity,
            AnalyticsSink sink,
            SnapshotProvider snapshots,
            AggregateKindRegistry kinds,
            AnalyticsMetrics metrics,
            Clock clock) {
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        if (kinds == null) {
            throw new IllegalArgumentException("kinds must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        AggregatorActor actor = new AggregatorActor(settings, sink, snapshots, identity.userId(), metrics);
        if (identity.firstTimeRun()) {
            announceLaunch(sink, identity.userId());
        }
        actor.start();
        return new AggregatingAnalytics(identity, kinds, actor, clock);
    }

    private static void announceLaunch(AnalyticsSink sink, String userId) {
        try {
            sink.push(AnalyticsRecord.launched(AnalyticsRecord.TOTAL_LAUNCH_USER));
            sink.flush();
            sink.push(AnalyticsRecord.launched(userId));
        } catch (SinkException e) {
            log.debug("Could not announce first launch: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Could not announce first launch", e);
        }
    }

    @Override
    public <T extends Aggregate<T>> boolean publish(T payload, Set<String> sources) {
        if (payload == null) {
            return false;
        }
        if (!kinds.contains(payload.kind())) {
            log.debug("Discarding analytics event of unregistered kind {}", payload.kind());
            return false;
        }
        return actor.offer(AggregateEnvelope.of(payload, sources, clock.instant()));
    }

    @Override
    public Optional<UUID> instanceUid() {
        return Optional.of(identity.uid());
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    /** Identity records are attributed to. */
    public InstanceIdentity identity() {
        return identity;
    }

    AggregatorActor actor() {
        return actor;
    }

    /**
     * Stops the aggregator; unflushed events are lost.
     */
    @Override
    public void close() {
        actor.close();
    }
}
