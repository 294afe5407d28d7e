package com.sift.analyticsservice.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.sift.analytics.Analytics;
import com.sift.analytics.AnalyticsMetrics;
import com.sift.analytics.snapshot.InstanceStats;
import com.sift.analytics.snapshot.SystemFacts;
import com.sift.analyticsservice.snapshot.IndexDocumentCounts;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;

@DisplayName("AnalyticsConfiguration")
class AnalyticsConfigurationTest {

    @TempDir
    Path root;

    private final AnalyticsConfiguration configuration = new AnalyticsConfiguration();
    private final SystemFacts system = new SystemFacts("Linux", "6.8.0", 4, null, null, null);

    private AnalyticsProperties properties(boolean enabled, String endpoint) {
        return new AnalyticsProperties(enabled, "test-service", "1.0.0", endpoint, "write-key",
                root.resolve("data"), root.resolve("config"), 0, null, null);
    }

    private Analytics build(AnalyticsProperties properties, SimpleMeterRegistry registry) {
        return configuration.analytics(
                properties, system, () -> new InstanceStats(0, List.of(), Map.of()), registry);
    }

    @Test
    @DisplayName("returns the no-op analytics when disabled by configuration")
    void disabledByConfiguration() {
        Analytics analytics = build(properties(false, "https://telemetry.example.com"), new SimpleMeterRegistry());

        assertThat(analytics.isEnabled()).isFalse();
    }

    @Test
    @DisplayName("returns the no-op analytics when the endpoint is unusable")
    void disabledOnInvalidEndpoint() {
        Analytics analytics = build(properties(true, ""), new SimpleMeterRegistry());

        assertThat(analytics.isEnabled()).isFalse();
    }

    @Test
    @DisplayName("starts the aggregator and binds its meters to the host registry")
    void enabled() throws Exception {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        Analytics analytics = build(properties(true, "http://127.0.0.1:9"), registry);
        try {
            assertThat(analytics.isEnabled()).isTrue();
            assertThat(analytics.instanceUid()).isPresent();
            assertThat(registry.find(AnalyticsMetrics.MAILBOX_SIZE).gauge()).isNotNull();
        } finally {
            ((AutoCloseable) analytics).close();
        }
    }

    @Test
    @DisplayName("reports document counts from the host's index bean")
    void documentCountsFromBean() throws Exception {
        DefaultListableBeanFactory beans = new DefaultListableBeanFactory();
        beans.registerSingleton("indexDocumentCounts", (IndexDocumentCounts) () -> List.of(12L, 30L));

        InstanceStats stats = configuration.instanceStatsSource(
                properties(true, null), beans.getBeanProvider(IndexDocumentCounts.class)).current();

        assertThat(stats.documentsPerIndex()).containsExactly(12L, 30L);
        assertThat(stats.indexesNumber()).isEqualTo(2);
    }

    @Test
    @DisplayName("reports no indexes when the host exposes none")
    void noDocumentCounts() throws Exception {
        DefaultListableBeanFactory beans = new DefaultListableBeanFactory();

        InstanceStats stats = configuration.instanceStatsSource(
                properties(true, null), beans.getBeanProvider(IndexDocumentCounts.class)).current();

        assertThat(stats.documentsPerIndex()).isEmpty();
        assertThat(stats.indexesNumber()).isZero();
    }
}
