package com.sift.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Statistics")
class StatisticsTest {

    @Nested
    @DisplayName("percentile99()")
    class Percentile {

        @Test
        @DisplayName("is empty for an empty sample set")
        void emptySamples() {
            assertThat(Statistics.percentile99(List.of())).isEmpty();
        }

        @Test
        @DisplayName("selects index floor(10 * 99 / 100) = 9 of ten samples")
        void nearestRankOfTenSamples() {
            List<Long> samples = List.of(70L, 10L, 100L, 40L, 20L, 90L, 30L, 60L, 50L, 80L);

            assertThat(Statistics.percentile99(samples)).hasValue(100);
        }

        @Test
        @DisplayName("does not interpolate on larger sample sets")
        void noInterpolation() {
            List<Long> samples = new ArrayList<>();
            for (long i = 1; i <= 200; i++) {
                samples.add(i);
            }
            // index 198 of the sorted samples
            assertThat(Statistics.percentile99(samples)).hasValue(199);
        }

        @Test
        @DisplayName("returns the only sample")
        void singleSample() {
            assertThat(Statistics.percentile99(List.of(42L))).hasValue(42);
        }

        @Test
        @DisplayName("does not modify the samples")
        void leavesSamplesUntouched() {
            List<Long> samples = new ArrayList<>(List.of(3L, 1L, 2L));
            Statistics.percentile99(samples);
            assertThat(samples).containsExactly(3L, 1L, 2L);
        }

        @Test
        @DisplayName("rejects percentiles outside 0..100")
        void rejectsInvalidPercentile() {
            assertThatThrownBy(() -> Statistics.nearestRank(List.of(1L), 101))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("100th percentile falls past the end and is empty")
        void hundredthPercentile() {
            assertThat(Statistics.nearestRank(List.of(1L, 2L), 100)).isEmpty();
        }
    }

    @Nested
    @DisplayName("mostUsed()")
    class MostUsed {

        @Test
        @DisplayName("is empty without observations")
        void empty() {
            assertThat(Statistics.mostUsed(Map.of())).isEmpty();
        }

        @Test
        @DisplayName("returns the key with the highest count")
        void highestCount() {
            assertThat(Statistics.mostUsed(Map.of("string", 3L, "array", 5L, "mixed", 1L)))
                    .hasValue("array");
        }

        @Test
        @DisplayName("breaks ties on the smallest key")
        void ties() {
            assertThat(Statistics.mostUsed(Map.of("string", 2L, "array", 2L))).hasValue("array");
        }
    }

    @Test
    @DisplayName("mergeFrequencies() adds counts key-wise without touching inputs")
    void mergeFrequencies() {
        Map<String, Long> a = Map.of("last", 2L, "all", 1L);
        Map<String, Long> b = Map.of("last", Long.MAX_VALUE, "frequency", 4L);

        Map<String, Long> merged = Statistics.mergeFrequencies(a, b);

        assertThat(merged)
                .containsEntry("last", Long.MAX_VALUE)
                .containsEntry("all", 1L)
                .containsEntry("frequency", 4L)
                .hasSize(3);
        assertThat(a).hasSize(2);
    }

    @Test
    @DisplayName("formatRatio() uses two decimals and yields NaN on 0/0")
    void formatRatio() {
        assertThat(Statistics.formatRatio(7, 2)).isEqualTo("3.50");
        assertThat(Statistics.formatRatio(1, 3)).isEqualTo("0.33");
        assertThat(Statistics.formatRatio(0, 0)).isEqualTo("NaN");
    }
}
