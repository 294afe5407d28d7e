package com.sift.analytics;

import com.sift.analytics.identity.InstanceIdStore;
import com.sift.analytics.identity.InstanceIdentity;
import com.sift.analytics.snapshot.SnapshotProvider;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Boots the analytics subsystem for a host.
 * <p>
 * Resolves the instance identity, builds the delivery client and starts the aggregator. When the
 * delivery client cannot be built the whole subsystem is disabled and the host carries on without
 * analytics.
 */
public final class AnalyticsLauncher {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsLauncher.class);

    /**
     * Builds the delivery client.
     */
    @FunctionalInterface
    public interface SinkFactory {
        AnalyticsSink create() throws SinkException;
    }

    private final AnalyticsSettings settings;
    private final AggregateKindRegistry kinds;
    private SnapshotProvider snapshots = SnapshotProvider.NONE;
    private AnalyticsMetrics metrics;
    private Clock clock = Clock.systemUTC();

    public AnalyticsLauncher(AnalyticsSettings settings, AggregateKindRegistry kinds) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        if (kinds == null) {
            throw new IllegalArgumentException("kinds must not be null");
        }
        this.settings = settings;
        this.kinds = kinds;
    }

    public AnalyticsLauncher snapshots(SnapshotProvider snapshots) {
        this.snapshots = snapshots;
        return this;
    }

    public AnalyticsLauncher metrics(AnalyticsMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    public AnalyticsLauncher clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * Starts analytics, or returns {@link Analytics#disabled()} if the sink cannot be built.
     *
     * @param identities  where the instance uid is persisted
     * @param sinkFactory builds the delivery client
     */
    public Analytics launch(InstanceIdStore identities, SinkFactory sinkFactory) {
        InstanceIdentity identity = identities.load();

        AnalyticsSink sink;
        try {
            sink = sinkFactory.create();
        } catch (SinkException | RuntimeException e) {
            log.warn("Analytics disabled: cannot build the delivery client ({})", e.getMessage());
            return Analytics.disabled();
        }

        AnalyticsMetrics effectiveMetrics =
                metrics != null ? metrics : AnalyticsMetrics.standalone(settings.serviceName());
        return AggregatingAnalytics.start(
                settings, identity, sink, snapshots, kinds, effectiveMetrics, clock);
    }
}
