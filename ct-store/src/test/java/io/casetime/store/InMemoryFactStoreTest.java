package io.casetime.store;

import io.casetime.core.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryFactStoreTest {

    private InMemoryFactStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryFactStore();
    }

    private static Instant at(String hhmm) {
        return Instant.parse("2025-03-01T" + hhmm + ":00Z");
    }

    private static TemporalFact instant(String scope, OwnerRef owner, String hhmm) {
        return new TemporalFact(FactId.random(), owner, scope, RegionType.INSTANT, at(hhmm), null,
                Granularity.MINUTES, 1.0, null, null);
    }

    private static TemporalFact interval(String scope, OwnerRef owner, String from, String to) {
        return new TemporalFact(FactId.random(), owner, scope, RegionType.INTERVAL, at(from),
                to == null ? null : at(to), Granularity.MINUTES, 1.0, null, null);
    }

    @Test
    void saveAndFindByIdAndOwner() {
        var f = instant("s1", OwnerRef.event("e1"), "09:00");
        store.save(List.of(f));

        assertThat(store.find(f.id())).contains(f);
        assertThat(store.findByOwner("s1", OwnerRef.event("e1"))).contains(f);
        assertThat(store.findByOwner("s2", OwnerRef.event("e1"))).isEmpty();
    }

    @Test
    void readIsScopedAndChronological() {
        var late = instant("s1", OwnerRef.event("e2"), "11:00");
        var early = instant("s1", OwnerRef.event("e1"), "09:00");
        var other = instant("s2", OwnerRef.event("e3"), "08:00");
        store.save(List.of(late, early, other));

        assertThat(store.read("s1")).containsExactly(early, late);
    }

    @Test
    void searchAppliesFrameKindAndLimit() {
        var inside = instant("s1", OwnerRef.event("e1"), "09:30");
        var outside = instant("s1", OwnerRef.event("e2"), "12:00");
        var spanning = interval("s1", OwnerRef.action("a1"), "08:00", "09:15");
        var ongoing = interval("s1", OwnerRef.action("a2"), "07:00", null);
        var endedBefore = interval("s1", OwnerRef.action("a3"), "06:00", "08:59");
        store.save(List.of(inside, outside, spanning, ongoing, endedBefore));

        var from = at("09:00");
        var to = at("10:00");

        assertThat(store.search("s1", null, from, to, null))
                .containsExactly(ongoing, spanning, inside);
        assertThat(store.search("s1", EntityKind.EVENT, from, to, null))
                .containsExactly(inside);
        assertThat(store.search("s1", null, null, null, 2))
                .containsExactly(endedBefore, ongoing);
    }

    @Test
    void instantOnFrameBoundaryMatches() {
        var edge = instant("s1", OwnerRef.event("e1"), "10:00");
        store.save(List.of(edge));

        assertThat(store.search("s1", null, at("09:00"), at("10:00"), null)).containsExactly(edge);
    }

    @Test
    void secondFactForSameOwnerIsRejected() {
        store.save(List.of(instant("s1", OwnerRef.event("e1"), "09:00")));

        assertThatThrownBy(() -> store.save(List.of(instant("s1", OwnerRef.event("e1"), "10:00"))))
                .isInstanceOf(IllegalStateException.class);
        assertThat(store.read("s1")).hasSize(1);
    }

    @Test
    void deleteScopeCascades() {
        var a = instant("s1", OwnerRef.event("e1"), "09:00");
        var b = instant("s1", OwnerRef.event("e2"), "09:05");
        var c = instant("s2", OwnerRef.event("e1"), "09:00");
        store.save(List.of(a, b, c));

        assertThat(store.deleteScope("s1")).isEqualTo(2);
        assertThat(store.read("s1")).isEmpty();
        assertThat(store.find(a.id())).isEmpty();
        assertThat(store.find(c.id())).isPresent();
        assertThat(store.deleteScope("missing")).isZero();
    }
}
