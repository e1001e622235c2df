package com.marketpulse.service.pipeline;

import com.marketpulse.dto.analytics.TrendPoint;
import com.marketpulse.model.RecordTable;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import static com.marketpulse.TestTables.row;
import static com.marketpulse.TestTables.table;
import static org.assertj.core.api.Assertions.assertThat;

class TrendAggregatorTest {

    private static final List<String> COLUMNS = List.of("date", "sentiment");

    private final TrendAggregator aggregator = new TrendAggregator(new ColumnRoleResolver());

    @Test
    void singleDayGivesOneDailyBucket() {
        RecordTable t = table(COLUMNS,
            row("date", at(2024, 3, 5, 9), "sentiment", "Positive"),
            row("date", at(2024, 3, 5, 12), "sentiment", "Positive"),
            row("date", at(2024, 3, 5, 18), "sentiment", "Negative"));

        List<TrendPoint> points = aggregator.aggregate(t);

        assertThat(points).containsExactly(new TrendPoint("2024-03-05", 2, 1, 0));
    }

    @Test
    void exportedTimestampTextAndEpochValuesAreBucketed() {
        RecordTable t = table(COLUMNS,
            row("date", "2024-03-05 10:00:00.123456", "sentiment", "Positive"),
            row("date", "2024-03-05 23:30:00+00:00", "sentiment", "Negative"),
            row("date", 1709719200L, "sentiment", "Neutral"));

        List<TrendPoint> points = aggregator.aggregate(t);

        assertThat(points).containsExactly(
            new TrendPoint("2024-03-05", 1, 1, 0),
            new TrendPoint("2024-03-06", 0, 0, 1));
    }

    @Test
    void bucketsAreAscendingAndZeroFilled() {
        RecordTable t = table(COLUMNS,
            row("date", at(2024, 3, 7, 0), "sentiment", "Neutral"),
            row("date", at(2024, 3, 5, 0), "sentiment", "Positive"),
            row("date", at(2024, 3, 6, 0), "sentiment", "Negative"));

        List<TrendPoint> points = aggregator.aggregate(t);

        assertThat(points).containsExactly(
            new TrendPoint("2024-03-05", 1, 0, 0),
            new TrendPoint("2024-03-06", 0, 1, 0),
            new TrendPoint("2024-03-07", 0, 0, 1));
    }

    @Test
    void sixtyDaySpanSwitchesToWeeklyBuckets() {
        // 2024-01-01 is a Monday, 2024-03-01 a Friday: exactly 60 days apart
        RecordTable t = table(COLUMNS,
            row("date", at(2024, 1, 1, 0), "sentiment", "Positive"),
            row("date", at(2024, 1, 3, 0), "sentiment", "Negative"),
            row("date", at(2024, 3, 1, 0), "sentiment", "Positive"));

        List<String> labels = labels(aggregator.aggregate(t));

        assertThat(labels).containsExactly("2024-01-07", "2024-03-03");
    }

    @Test
    void fiftyNineDaySpanStaysDaily() {
        RecordTable t = table(COLUMNS,
            row("date", at(2024, 1, 1, 0), "sentiment", "Positive"),
            row("date", at(2024, 2, 29, 0), "sentiment", "Positive"));

        assertThat(labels(aggregator.aggregate(t))).containsExactly("2024-01-01", "2024-02-29");
    }

    @Test
    void yearLongSpanUsesMonthlyBuckets() {
        RecordTable t = table(COLUMNS,
            row("date", at(2023, 1, 15, 0), "sentiment", "Positive"),
            row("date", at(2023, 1, 20, 0), "sentiment", "Negative"),
            row("date", at(2024, 1, 15, 0), "sentiment", "Neutral"));

        List<TrendPoint> points = aggregator.aggregate(t);

        assertThat(points).containsExactly(
            new TrendPoint("2023-01-31", 1, 1, 0),
            new TrendPoint("2024-01-31", 0, 0, 1));
    }

    @Test
    void rowsWithUnreadableTimestampsAreSkipped() {
        RecordTable t = table(List.of("created", "sentiment"),
            row("created", "2024-03-05", "sentiment", "Positive"),
            row("created", "garbage", "sentiment", "Negative"),
            row("created", null, "sentiment", "Negative"));

        assertThat(aggregator.aggregate(t)).containsExactly(new TrendPoint("2024-03-05", 1, 0, 0));
    }

    @Test
    void emptyWithoutTimeOrSentiment() {
        RecordTable noTime = table(List.of("review", "sentiment"), row("review", "x", "sentiment", "Positive"));
        RecordTable noSentiment = table(List.of("date"), row("date", at(2024, 1, 1, 0)));
        RecordTable noTimestamps = table(COLUMNS, row("date", "n/a", "sentiment", "Positive"));

        assertThat(aggregator.aggregate(noTime)).isEmpty();
        assertThat(aggregator.aggregate(noSentiment)).isEmpty();
        assertThat(aggregator.aggregate(noTimestamps)).isEmpty();
    }

    private static LocalDateTime at(int y, int m, int d, int h) {
        return LocalDateTime.of(y, m, d, h, 0);
    }

    private static List<String> labels(List<TrendPoint> points) {
        return points.stream().map(TrendPoint::getDateStr).collect(Collectors.toList());
    }
}
