package com.sift.analyticsservice.config;

import com.sift.analytics.Analytics;
import com.sift.analytics.AnalyticsLauncher;
import com.sift.analytics.AnalyticsMetrics;
import com.sift.analytics.identity.InstanceIdStore;
import com.sift.analytics.sink.HttpBatchSink;
import com.sift.analytics.snapshot.HostSnapshotProvider;
import com.sift.analytics.snapshot.InstanceStatsSource;
import com.sift.analytics.snapshot.SystemFacts;
import com.sift.analyticsservice.snapshot.DataDirectoryStats;
import com.sift.analyticsservice.snapshot.IndexDocumentCounts;
import com.sift.searchanalytics.SearchAnalyticsKinds;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the {@link Analytics} bean.
 *
 * <p>When analytics are disabled by configuration, or the delivery client cannot be built, the bean
 * is the no-op implementation and the service runs without telemetry. The aggregator thread is
 * stopped when the context closes.
 */
@Configuration
public class AnalyticsConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsConfiguration.class);

    @Bean
    public SystemFacts systemFacts() {
        return SystemFacts.capture(System.getenv());
    }

    @Bean
    public InstanceStatsSource instanceStatsSource(
            AnalyticsProperties properties, ObjectProvider<IndexDocumentCounts> documentCounts) {
        return new DataDirectoryStats(
                properties.dataDir(), documentCounts.getIfAvailable(() -> IndexDocumentCounts.NONE), infos(properties));
    }

    @Bean
    public Analytics analytics(
            AnalyticsProperties properties,
            SystemFacts systemFacts,
            InstanceStatsSource instanceStatsSource,
            MeterRegistry meterRegistry) {
        if (!properties.isEnabled()) {
            log.info("Analytics disabled by configuration");
            return Analytics.disabled();
        }
        Clock clock = Clock.systemUTC();
        var snapshots = new HostSnapshotProvider(
                systemFacts, Instant.now(clock), clock, properties.version(), instanceStatsSource);
        Analytics analytics = new AnalyticsLauncher(properties.toSettings(), SearchAnalyticsKinds.registry())
                .snapshots(snapshots)
                .metrics(new AnalyticsMetrics(meterRegistry, properties.serviceName()))
                .clock(clock)
                .launch(
                        new InstanceIdStore(properties.dataDir(), properties.configDir()),
                        () -> HttpBatchSink.create(
                                properties.endpoint(), properties.writeKey(), properties.connectTimeout()));
        analytics.instanceUid().ifPresent(uid -> log.info("Analytics enabled for instance {}", uid));
        return analytics;
    }

    /**
     * Configuration facts reported in snapshots. Locations and keys are reduced to whether they
     * are customised.
     */
    static Map<String, Object> infos(AnalyticsProperties properties) {
        Map<String, Object> infos = new LinkedHashMap<>();
        infos.put("db_path", !AnalyticsProperties.DEFAULT_DATA_DIR.equals(properties.dataDir()));
        infos.put("mailbox_capacity", properties.toSettings().mailboxCapacity());
        infos.put("flush_interval_seconds", properties.flushInterval().toSeconds());
        infos.put("custom_endpoint", properties.endpoint() != null && !properties.endpoint().isBlank());
        return infos;
    }
}
