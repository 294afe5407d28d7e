package com.sift.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import com.sift.analytics.identity.InstanceIdentity;
import com.sift.analytics.snapshot.SnapshotProvider;
import com.sift.analytics.testing.InMemoryAnalyticsSink;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AggregatingAnalytics")
class AggregatingAnalyticsTest {

    private static final UUID UID = UUID.fromString("3c4f6f3a-4a52-4c5b-9d39-7d0b4c6a1e11");
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryAnalyticsSink sink;
    private AggregateKindRegistry kinds;
    private AggregatingAnalytics analytics;

    @BeforeEach
    void setUp() {
        sink = new InMemoryAnalyticsSink();
        kinds = new AggregateKindRegistry().register(CountingAggregate.KIND);
    }

    @AfterEach
    void tearDown() {
        if (analytics != null) {
            analytics.close();
        }
    }

    private AggregatingAnalytics start(boolean firstTimeRun, Duration interval) {
        analytics = AggregatingAnalytics.start(
                new AnalyticsSettings("test-service", 100, interval),
                new InstanceIdentity(UID, firstTimeRun),
                sink,
                SnapshotProvider.NONE,
                kinds,
                AnalyticsMetrics.standalone("test-service"),
                Clock.fixed(NOW, ZoneOffset.UTC));
        return analytics;
    }

    @Nested
    @DisplayName("first launch")
    class FirstLaunch {

        @Test
        @DisplayName("announces the launch under the shared identity, then under the instance uid")
        void announcesLaunch() {
            start(true, Duration.ofHours(1));

            List<AnalyticsRecord> launched = sink.tracked(AnalyticsRecord.LAUNCHED_EVENT);
            assertThat(launched).extracting(AnalyticsRecord::userId)
                    .containsExactly(AnalyticsRecord.TOTAL_LAUNCH_USER, UID.toString());
            assertThat(sink.flushedBatches()).hasSize(1);
            assertThat(sink.flushedBatches().get(0)).extracting(AnalyticsRecord::userId)
                    .containsExactly(AnalyticsRecord.TOTAL_LAUNCH_USER);
            assertThat(sink.pending()).extracting(AnalyticsRecord::userId).containsExactly(UID.toString());
        }

        @Test
        @DisplayName("starts even when the launch announcement fails")
        void toleratesSinkFailure() {
            sink.failPushes(true);

            start(true, Duration.ofHours(1));

            assertThat(analytics.isEnabled()).isTrue();
            assertThat(analytics.actor().isRunning()).isTrue();
        }

        @Test
        @DisplayName("does not announce anything on later runs")
        void laterRuns() {
            start(false, Duration.ofHours(1));

            assertThat(sink.pushed()).isEmpty();
            assertThat(sink.flushCount()).isZero();
        }
    }

    @Nested
    @DisplayName("publish()")
    class Publish {

        @Test
        @DisplayName("aggregates registered kinds and stamps them with the clock")
        void publishesRegisteredKinds() throws Exception {
            start(false, Duration.ofMillis(300));

            assertThat(analytics.publish(CountingAggregate.one(), Set.of("sift-js"))).isTrue();
            assertThat(analytics.publish(CountingAggregate.one(), Set.of("curl/8.0"))).isTrue();

            assertThat(sink.awaitFlushes(1, Duration.ofSeconds(10))).isTrue();
            AnalyticsRecord record = sink.tracked("Counting Tested").get(0);
            assertThat(record.timestamp()).isEqualTo(NOW);
            assertThat(record.userId()).isEqualTo(UID.toString());
            assertThat(record.payload().get("user-agent").size()).isEqualTo(2);
        }

        @Test
        @DisplayName("skips null client labels instead of failing the caller")
        void skipsNullSources() throws Exception {
            start(false, Duration.ofMillis(300));

            assertThat(analytics.publish(CountingAggregate.one(), new HashSet<>(Arrays.asList("sift-js", null))))
                    .isTrue();

            assertThat(sink.awaitFlushes(1, Duration.ofSeconds(10))).isTrue();
            AnalyticsRecord record = sink.tracked("Counting Tested").get(0);
            assertThat(record.payload().get("user-agent").size()).isEqualTo(1);
            assertThat(record.payload().get("user-agent").get(0).asText()).isEqualTo("sift-js");
        }

        @Test
        @DisplayName("discards kinds missing from the registry")
        void discardsUnregisteredKinds() {
            start(false, Duration.ofHours(1));
            var other = new CountingAggregate(CountingAggregate.OTHER_KIND, 1, false, 0, Map.of(), List.of());

            assertThat(analytics.publish(other, Set.of())).isFalse();
            assertThat(analytics.actor().pending()).isZero();
        }

        @Test
        @DisplayName("ignores a null payload")
        void ignoresNull() {
            start(false, Duration.ofHours(1));

            assertThat(analytics.publish((CountingAggregate) null, Set.of())).isFalse();
        }
    }

    @Test
    @DisplayName("exposes the instance uid")
    void exposesUid() {
        start(false, Duration.ofHours(1));

        assertThat(analytics.instanceUid()).contains(UID);
        assertThat(analytics.identity().userId()).isEqualTo(UID.toString());
    }

    @Test
    @DisplayName("disabled analytics accept nothing and have no uid")
    void disabled() {
        Analytics disabled = Analytics.disabled();

        assertThat(disabled.isEnabled()).isFalse();
        assertThat(disabled.publish(CountingAggregate.one(), Set.of("sift-js"))).isFalse();
        assertThat(disabled.instanceUid()).isEmpty();
    }
}
