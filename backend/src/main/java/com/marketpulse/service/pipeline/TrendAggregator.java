package com.marketpulse.service.pipeline;

import com.marketpulse.dto.analytics.TrendPoint;
import com.marketpulse.model.RecordTable;
import com.marketpulse.model.SentimentLabel;
import com.marketpulse.model.TimeGranularity;
import com.marketpulse.util.TimestampParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

// ========== Trend Aggregator ==========
@Service
@RequiredArgsConstructor
@Slf4j
public class TrendAggregator {

    private static final DateTimeFormatter LABEL = DateTimeFormatter.ISO_LOCAL_DATE;

    private final ColumnRoleResolver roleResolver;

    /**
     * Sentiment counts over time.
     *
     * Steps:
     * 1. Keep rows with a readable timestamp
     * 2. Pick the bucket size from the span: < 60 days daily, < 365 weekly, else monthly
     * 3. Count rows per (bucket, sentiment)
     * 4. Pivot to one point per bucket, ascending, every label zero-filled
     *
     * Empty when there is no time column, no sentiment column or no usable timestamp.
     */
    public List<TrendPoint> aggregate(RecordTable table) {
        Optional<String> timeColumn = roleResolver.resolveTime(table);
        if (timeColumn.isEmpty() || !table.hasColumn(SentimentClassifier.SENTIMENT_COLUMN)) {
            return List.of();
        }
        try {
            return aggregate(table, timeColumn.get());
        } catch (RuntimeException e) {
            log.warn("Error in sentiment trends: {}", e.getMessage(), e);
            return List.of();
        }
    }

    List<TrendPoint> aggregate(RecordTable table, String timeColumn) {
        List<LocalDateTime> times = new ArrayList<>();
        List<SentimentLabel> labels = new ArrayList<>();
        for (Map<String, Object> row : table.rows()) {
            Optional<LocalDateTime> time = TimestampParser.parse(row.get(timeColumn));
            Optional<SentimentLabel> label = SentimentLabel.fromValue(row.get(SentimentClassifier.SENTIMENT_COLUMN));
            if (time.isPresent() && label.isPresent()) {
                times.add(time.get());
                labels.add(label.get());
            }
        }
        if (times.isEmpty()) {
            return List.of();
        }

        LocalDateTime min = times.stream().min(LocalDateTime::compareTo).get();
        LocalDateTime max = times.stream().max(LocalDateTime::compareTo).get();
        TimeGranularity granularity = TimeGranularity.forSpanDays(ChronoUnit.DAYS.between(min, max));
        log.info("Aggregating sentiment trend over {} rows with {} buckets", times.size(), granularity);

        TreeMap<LocalDate, Map<SentimentLabel, Long>> buckets = new TreeMap<>();
        for (int i = 0; i < times.size(); i++) {
            LocalDate bucket = granularity.bucketOf(times.get(i).toLocalDate());
            buckets.computeIfAbsent(bucket, b -> new EnumMap<>(SentimentLabel.class))
                .merge(labels.get(i), 1L, Long::sum);
        }

        List<TrendPoint> points = new ArrayList<>(buckets.size());
        for (Map.Entry<LocalDate, Map<SentimentLabel, Long>> e : buckets.entrySet()) {
            Map<SentimentLabel, Long> counts = e.getValue();
            points.add(TrendPoint.builder()
                .dateStr(e.getKey().format(LABEL))
                .positive(counts.getOrDefault(SentimentLabel.POSITIVE, 0L))
                .negative(counts.getOrDefault(SentimentLabel.NEGATIVE, 0L))
                .neutral(counts.getOrDefault(SentimentLabel.NEUTRAL, 0L))
                .build());
        }
        return points;
    }
}
