package com.sift.analytics.testing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sift.analytics.AnalyticsJson;
import com.sift.analytics.AnalyticsRecord;
import com.sift.analytics.SinkException;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryAnalyticsSink")
class InMemoryAnalyticsSinkTest {

    private final InMemoryAnalyticsSink sink = new InMemoryAnalyticsSink();

    @Test
    @DisplayName("groups pushed records by flush")
    void groupsByFlush() throws Exception {
        sink.push(AnalyticsRecord.launched("a"));
        sink.flush();
        sink.push(AnalyticsRecord.identify("a", AnalyticsJson.object(), null));

        assertThat(sink.pushed()).hasSize(2);
        assertThat(sink.flushedBatches()).hasSize(1);
        assertThat(sink.tracked(AnalyticsRecord.LAUNCHED_EVENT)).hasSize(1);
        assertThat(sink.identified()).hasSize(1);
        assertThat(sink.pending()).hasSize(1);
    }

    @Test
    @DisplayName("fails on demand but still counts failed flushes")
    void failsOnDemand() throws Exception {
        sink.failPushes(true).failFlushes(true);

        assertThatThrownBy(() -> sink.push(AnalyticsRecord.launched("a"))).isInstanceOf(SinkException.class);
        assertThatThrownBy(sink::flush).isInstanceOf(SinkException.class);
        assertThat(sink.flushCount()).isEqualTo(1);
        assertThat(sink.pushed()).isEmpty();
    }

    @Test
    @DisplayName("awaitFlushes() times out when nothing flushes")
    void awaitTimesOut() throws Exception {
        assertThat(sink.awaitFlushes(1, Duration.ofMillis(50))).isFalse();
    }
}
