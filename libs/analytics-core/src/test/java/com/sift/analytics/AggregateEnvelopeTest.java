package com.sift.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AggregateEnvelope")
class AggregateEnvelopeTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Nested
    @DisplayName("tryMerge()")
    class TryMerge {

        @Test
        @DisplayName("merges payloads of the same kind through the kind's merge function")
        void mergesSameKind() {
            var a = AggregateEnvelope.of(CountingAggregate.of(1, false, 3, "array"), Set.of(), T0);
            var b = AggregateEnvelope.of(CountingAggregate.of(2, true, 7, "array"), Set.of(), T0);

            CountingAggregate merged = a.tryMerge(b).orElseThrow();

            assertThat(merged.received).isEqualTo(3);
            assertThat(merged.flag).isTrue();
            assertThat(merged.max).isEqualTo(7);
            assertThat(merged.variants).containsEntry("array", 2L);
        }

        @Test
        @DisplayName("returns empty instead of throwing when kinds differ")
        void mismatchedKinds() {
            var a = AggregateEnvelope.of(CountingAggregate.one(), Set.of(), T0);
            var other = new CountingAggregate(
                    CountingAggregate.OTHER_KIND, 1, false, 0, Map.of(), List.of());
            var b = AggregateEnvelope.of(other, Set.of(), T0);

            assertThat(a.tryMerge(b)).isEmpty();
            assertThat(a.mergeWith(b)).isEmpty();
        }
    }

    @Nested
    @DisplayName("mergeWith()")
    class MergeWith {

        @Test
        @DisplayName("keeps the first-seen timestamp of the earliest event")
        void keepsFirstSeen() {
            var first = AggregateEnvelope.of(CountingAggregate.one(), Set.of(), T0);
            var later = AggregateEnvelope.of(CountingAggregate.one(), Set.of(), T0.plusSeconds(10));

            assertThat(first.mergeWith(later).orElseThrow().firstSeen()).isEqualTo(T0);
            assertThat(later.mergeWith(first).orElseThrow().firstSeen()).isEqualTo(T0);
        }

        @Test
        @DisplayName("unions sources and adds occurrences")
        void unionsSourcesAndCounts() {
            var a = AggregateEnvelope.of(CountingAggregate.one(), Set.of("sift-js", "curl/8.0"), T0);
            var b = AggregateEnvelope.of(CountingAggregate.one(), Set.of("sift-js", "sift-php"), T0, 4);

            var merged = a.mergeWith(b).orElseThrow();

            assertThat(merged.sources()).containsExactly("curl/8.0", "sift-js", "sift-php");
            assertThat(merged.occurrences()).isEqualTo(5);
        }

        @Test
        @DisplayName("saturates occurrences instead of overflowing")
        void saturatesOccurrences() {
            var a = AggregateEnvelope.of(CountingAggregate.one(), Set.of(), T0, Long.MAX_VALUE - 1);
            var b = AggregateEnvelope.of(CountingAggregate.one(), Set.of(), T0, 5);

            assertThat(a.mergeWith(b).orElseThrow().occurrences()).isEqualTo(Long.MAX_VALUE);
        }
    }

    @Nested
    @DisplayName("export()")
    class Export {

        @Test
        @DisplayName("timestamps the record with the first-seen instant")
        void timestampIsFirstSeen() {
            var envelope = AggregateEnvelope.of(CountingAggregate.one(), Set.of(), T0)
                    .mergeWith(AggregateEnvelope.of(CountingAggregate.one(), Set.of(), T0.plusSeconds(10)))
                    .orElseThrow();

            AnalyticsRecord record = envelope.export("uid-1");

            assertThat(record.timestamp()).isEqualTo(T0);
            assertThat(record.type()).isEqualTo(RecordType.TRACK);
            assertThat(record.event()).isEqualTo("Counting Tested");
            assertThat(record.userId()).isEqualTo("uid-1");
        }

        @Test
        @DisplayName("fills user-agent and requests.total_received when unset")
        void fillsDefaults() {
            var envelope = AggregateEnvelope.of(CountingAggregate.one(), Set.of("sift-js", "curl/8.0"), T0, 3);

            ObjectNode properties = envelope.export("uid").payload();

            assertThat(properties.get("user-agent").size()).isEqualTo(2);
            assertThat(properties.get("user-agent").get(0).asText()).isEqualTo("curl/8.0");
            assertThat(properties.get("requests").get("total_received").asLong()).isEqualTo(3);
        }

        @Test
        @DisplayName("does not overwrite defaults the payload already set")
        void keepsPayloadValues() {
            var envelope = AggregateEnvelope.of(new SelfCounting(), Set.of("agent"), T0, 9);

            ObjectNode properties = envelope.export("uid").payload();

            assertThat(properties.get("requests").get("total_received").asLong()).isEqualTo(42);
            assertThat(properties.get("user-agent").asText()).isEqualTo("self");
        }

        @Test
        @DisplayName("rejects a null payload")
        void rejectsNullPayload() {
            assertThatThrownBy(() -> AggregateEnvelope.of((CountingAggregate) null, Set.of(), T0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    /** Aggregate that tracks its own provenance and request count. */
    private static final class SelfCounting implements Aggregate<SelfCounting> {

        static final AggregateKind<SelfCounting> KIND =
                AggregateKind.of("test.self-counting", "Self Counting", SelfCounting.class);

        @Override
        public AggregateKind<SelfCounting> kind() {
            return KIND;
        }

        @Override
        public SelfCounting aggregate(SelfCounting other) {
            return this;
        }

        @Override
        public ObjectNode intoEvent() {
            ObjectNode event = AnalyticsJson.object();
            event.put("user-agent", "self");
            event.putObject("requests").put("total_received", 42);
            return event;
        }
    }
}
