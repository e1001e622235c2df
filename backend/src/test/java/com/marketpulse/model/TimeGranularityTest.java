package com.marketpulse.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class TimeGranularityTest {

    @Test
    void spanBoundaries() {
        assertThat(TimeGranularity.forSpanDays(0)).isEqualTo(TimeGranularity.DAILY);
        assertThat(TimeGranularity.forSpanDays(59)).isEqualTo(TimeGranularity.DAILY);
        assertThat(TimeGranularity.forSpanDays(60)).isEqualTo(TimeGranularity.WEEKLY);
        assertThat(TimeGranularity.forSpanDays(364)).isEqualTo(TimeGranularity.WEEKLY);
        assertThat(TimeGranularity.forSpanDays(365)).isEqualTo(TimeGranularity.MONTHLY);
    }

    @Test
    void weeklyBucketIsTheClosingSunday() {
        // 2024-03-06 is a Wednesday
        assertThat(TimeGranularity.WEEKLY.bucketOf(LocalDate.of(2024, 3, 6))).isEqualTo(LocalDate.of(2024, 3, 10));
        assertThat(TimeGranularity.WEEKLY.bucketOf(LocalDate.of(2024, 3, 10))).isEqualTo(LocalDate.of(2024, 3, 10));
    }

    @Test
    void monthlyBucketIsTheLastDayOfMonth() {
        assertThat(TimeGranularity.MONTHLY.bucketOf(LocalDate.of(2024, 2, 3))).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(TimeGranularity.DAILY.bucketOf(LocalDate.of(2024, 2, 3))).isEqualTo(LocalDate.of(2024, 2, 3));
    }
}
