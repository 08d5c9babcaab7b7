package io.casetime.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class GranularityTest {

    private static final Instant T = Instant.parse("2025-03-13T09:10:42Z"); // a Thursday

    @Test
    void truncatesToBucketStart() {
        assertThat(Granularity.MINUTES.truncate(T)).isEqualTo(Instant.parse("2025-03-13T09:10:00Z"));
        assertThat(Granularity.HOURS.truncate(T)).isEqualTo(Instant.parse("2025-03-13T09:00:00Z"));
        assertThat(Granularity.DAYS.truncate(T)).isEqualTo(Instant.parse("2025-03-13T00:00:00Z"));
        assertThat(Granularity.WEEKS.truncate(T)).isEqualTo(Instant.parse("2025-03-10T00:00:00Z"));
        assertThat(Granularity.MONTHS.truncate(T)).isEqualTo(Instant.parse("2025-03-01T00:00:00Z"));
        assertThat(Granularity.YEARS.truncate(T)).isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
    }

    @Test
    void coarserPicksLargerUnit() {
        assertThat(Granularity.coarser(Granularity.MINUTES, Granularity.DAYS)).isEqualTo(Granularity.DAYS);
        assertThat(Granularity.coarser(Granularity.YEARS, Granularity.SECONDS)).isEqualTo(Granularity.YEARS);
    }

    @Test
    void parsesWireNames() {
        assertThat(Granularity.parse("weeks")).isEqualTo(Granularity.WEEKS);
        assertThat(Granularity.parse(null)).isEqualTo(Granularity.MINUTES);
    }
}
