package io.casetime.engine;

import io.casetime.core.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static io.casetime.engine.ScopeFixture.SCOPE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SegmenterTest {

    private ScopeFixture fx;

    @BeforeEach
    void setUp() {
        fx = new ScopeFixture();
    }

    @Test
    void byGapSplitsWhenDeltaExceedsThreshold() {
        var a = fx.instant(OwnerRef.event("a"), "a", "09:00");
        var b = fx.instant(OwnerRef.event("b"), "b", "09:10");
        var c = fx.instant(OwnerRef.event("c"), "c", "11:15");
        fx.inference.recomputeTimelineOrder(SCOPE);

        var segments = fx.segmenter.group(SCOPE, SegmentStrategy.BY_GAP, Duration.ofSeconds(3600));

        assertThat(segments).containsOnlyKeys("segment-1", "segment-2");
        assertThat(segments.get("segment-1")).extracting(TemporalFact::id).containsExactly(a, b);
        assertThat(segments.get("segment-2")).extracting(TemporalFact::id).containsExactly(c);
    }

    @Test
    void byGapFollowsStartsAfterFactsMoveOrArrive() {
        var a = fx.instant(OwnerRef.event("a"), "a", "09:00");
        var b = fx.instant(OwnerRef.event("b"), "b", "10:30");
        fx.inference.recomputeTimelineOrder(SCOPE);
        fx.store.upsertFact(OwnerRef.event("a"), SCOPE, RegionType.INSTANT, ScopeFixture.at("12:00"), null,
                Granularity.MINUTES);
        var c = fx.instant(OwnerRef.event("c"), "c", "07:00");

        var segments = fx.segmenter.group(SCOPE, SegmentStrategy.BY_GAP, Duration.ofSeconds(3600));

        assertThat(segments).containsOnlyKeys("segment-1", "segment-2", "segment-3");
        assertThat(segments.get("segment-1")).extracting(TemporalFact::id).containsExactly(c);
        assertThat(segments.get("segment-2")).extracting(TemporalFact::id).containsExactly(b);
        assertThat(segments.get("segment-3")).extracting(TemporalFact::id).containsExactly(a);
    }

    @Test
    void byGapExactlyAtThresholdStaysTogether() {
        fx.instant(OwnerRef.event("a"), "a", "09:00");
        fx.instant(OwnerRef.event("b"), "b", "10:00");

        assertThat(fx.segmenter.group(SCOPE, SegmentStrategy.BY_GAP)).hasSize(1);
    }

    @Test
    void byActorBucketsUnknownActorsAsUnassigned() {
        fx.entities.register(OwnerRef.event("a"), EntityDescription.of("a", "engineer-1"));
        fx.entities.register(OwnerRef.action("b"), EntityDescription.of("b", "client"));
        fx.entities.register(OwnerRef.action("c"), EntityDescription.of("c", "engineer-1"));
        var a = fx.store.upsertFact(OwnerRef.event("a"), SCOPE, RegionType.INSTANT, ScopeFixture.at("09:00"), null, null);
        var b = fx.store.upsertFact(OwnerRef.action("b"), SCOPE, RegionType.INSTANT, ScopeFixture.at("09:05"), null, null);
        var c = fx.store.upsertFact(OwnerRef.action("c"), SCOPE, RegionType.INSTANT, ScopeFixture.at("09:10"), null, null);
        var d = fx.instant(OwnerRef.event("d"), "nobody", "09:15");

        var segments = fx.segmenter.group(SCOPE, SegmentStrategy.BY_ACTOR);

        assertThat(segments.keySet()).containsExactly("engineer-1", "client", "unassigned");
        assertThat(segments.get("engineer-1")).extracting(TemporalFact::id).containsExactly(a, c);
        assertThat(segments.get("client")).extracting(TemporalFact::id).containsExactly(b);
        assertThat(segments.get("unassigned")).extracting(TemporalFact::id).containsExactly(d);
    }

    @Test
    void byKindAlwaysHasThreeBuckets() {
        var e = fx.instant(OwnerRef.event("e"), "e", "09:00");
        var d = fx.instant(OwnerRef.decision("d"), "d", "09:10");

        var segments = fx.segmenter.group(SCOPE, SegmentStrategy.BY_KIND);

        assertThat(segments.keySet()).containsExactly("events", "actions", "decisions");
        assertThat(segments.get("events")).extracting(TemporalFact::id).containsExactly(e);
        assertThat(segments.get("actions")).isEmpty();
        assertThat(segments.get("decisions")).extracting(TemporalFact::id).containsExactly(d);
    }

    @Test
    void autoBatchesByFive() {
        for (int i = 0; i < 12; i++) {
            fx.instant(OwnerRef.event("e" + i), "e" + i, String.format("09:%02d", i));
        }

        var segments = fx.segmenter.group(SCOPE, SegmentStrategy.AUTO);

        assertThat(segments.keySet()).containsExactly("batch-1", "batch-2", "batch-3");
        assertThat(segments.get("batch-1")).hasSize(5);
        assertThat(segments.get("batch-3")).hasSize(2);
        assertThat(segments.get("batch-3").get(1).start()).isEqualTo(ScopeFixture.at("09:11"));
    }

    @Test
    void emptyScopeGivesNoSegments() {
        assertThat(fx.segmenter.group(SCOPE, SegmentStrategy.BY_GAP)).isEmpty();
        assertThat(fx.segmenter.group(SCOPE, SegmentStrategy.AUTO)).isEmpty();
    }

    @Test
    void strategyParsesWireNames() {
        assertThat(SegmentStrategy.parse("by_actor")).isEqualTo(SegmentStrategy.BY_ACTOR);
        assertThat(SegmentStrategy.parse(" ")).isEqualTo(SegmentStrategy.AUTO);
        assertThatThrownBy(() -> SegmentStrategy.parse("by_mood")).isInstanceOf(IllegalArgumentException.class);
    }
}
