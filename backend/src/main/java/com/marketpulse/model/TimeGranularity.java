package com.marketpulse.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/** Bucket size for sentiment trends, chosen from the observed time span. */
public enum TimeGranularity {
    DAILY,
    WEEKLY,
    MONTHLY;

    public static TimeGranularity forSpanDays(long spanDays) {
        if (spanDays < 60) return DAILY;
        if (spanDays < 365) return WEEKLY;
        return MONTHLY;
    }

    /** Bucket label date: the day itself, the Sunday closing its week, or the last day of its month. */
    public LocalDate bucketOf(LocalDate day) {
        switch (this) {
            case WEEKLY:
                return day.with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY));
            case MONTHLY:
                return day.with(TemporalAdjusters.lastDayOfMonth());
            default:
                return day;
        }
    }
}
