package com.marketpulse.service;

import com.marketpulse.dto.analytics.AnalysisReport;
import com.marketpulse.dto.analytics.EmergingIssue;
import com.marketpulse.dto.analytics.HistogramBin;
import com.marketpulse.dto.analytics.MarketInsight;
import com.marketpulse.dto.analytics.TrendPoint;
import com.marketpulse.dto.analytics.TrendingTopic;
import com.marketpulse.dto.dataset.DatasetSummary;
import com.marketpulse.model.LoadedDataset;
import com.marketpulse.model.RecordTable;
import com.marketpulse.model.SentimentLabel;
import com.marketpulse.service.dataset.DatasetService;
import com.marketpulse.service.dataset.DatasetSummarizer;
import com.marketpulse.service.pipeline.IssueDetector;
import com.marketpulse.service.pipeline.KeywordExtractor;
import com.marketpulse.service.pipeline.MarketInsightSynthesizer;
import com.marketpulse.service.pipeline.SentimentClassifier;
import com.marketpulse.service.pipeline.TrendAggregator;
import com.marketpulse.util.Rounding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the analysis stages over one loaded dataset.
 *
 * Every method reads a single immutable snapshot, so a dataset swapped in
 * mid-request never mixes into a running report.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalysisService {

    static final int HISTOGRAM_BINS = 20;

    private final DatasetSummarizer summarizer;
    private final DatasetService datasetService;
    private final TrendAggregator trendAggregator;
    private final KeywordExtractor keywordExtractor;
    private final MarketInsightSynthesizer marketSynthesizer;
    private final IssueDetector issueDetector;

    @Cacheable(value = DatasetService.REPORT_CACHE, key = "#dataset.cacheKey()")
    public AnalysisReport report(LoadedDataset dataset) {
        log.info("Building analysis report for {}", dataset.getFileName());
        RecordTable table = dataset.getTable();
        return AnalysisReport.builder()
            .dataset(datasetService.info(dataset))
            .summary(summary(dataset))
            .trends(trends(dataset))
            .trendingTopics(topics(dataset, null))
            .marketInsights(market(dataset))
            .emergingIssues(issues(dataset))
            .keywords(keywords(dataset))
            .sentimentDistribution(sentimentDistribution(table))
            .scoreHistogram(scoreHistogram(table))
            .build();
    }

    public DatasetSummary summary(LoadedDataset dataset) {
        return summarizer.summarize(dataset.getTable(), dataset.getFileName());
    }

    public List<TrendPoint> trends(LoadedDataset dataset) {
        return trendAggregator.aggregate(dataset.getTable());
    }

    /** Top topics; {@code limit} null means the configured default. */
    public Map<String, TrendingTopic> topics(LoadedDataset dataset, Integer limit) {
        if (limit == null) {
            return keywordExtractor.trendingTopics(dataset.getTable());
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        return keywordExtractor.trendingTopics(dataset.getTable(), limit);
    }

    public Map<String, Long> keywords(LoadedDataset dataset) {
        return keywordExtractor.commonKeywords(dataset.getTable());
    }

    public MarketInsight market(LoadedDataset dataset) {
        return marketSynthesizer.synthesize(dataset.getTable());
    }

    public List<EmergingIssue> issues(LoadedDataset dataset) {
        return issueDetector.detect(dataset.getTable());
    }

    /** Rows per label, every label present (zero when absent). Empty when the table is unclassified. */
    Map<String, Long> sentimentDistribution(RecordTable table) {
        Map<String, Long> counts = new LinkedHashMap<>();
        if (!table.hasColumn(SentimentClassifier.SENTIMENT_COLUMN)) {
            return counts;
        }
        for (SentimentLabel label : SentimentLabel.values()) {
            counts.put(label.label(), 0L);
        }
        for (Object value : table.column(SentimentClassifier.SENTIMENT_COLUMN)) {
            SentimentLabel.fromValue(value).ifPresent(l -> counts.merge(l.label(), 1L, Long::sum));
        }
        return counts;
    }

    /** Twenty equal-width bins over [-1, 1]; empty when the table carries no scores. */
    List<HistogramBin> scoreHistogram(RecordTable table) {
        List<HistogramBin> bins = new ArrayList<>();
        if (!table.hasColumn(SentimentClassifier.SCORE_COLUMN)) {
            return bins;
        }
        long[] counts = new long[HISTOGRAM_BINS];
        for (Object value : table.column(SentimentClassifier.SCORE_COLUMN)) {
            if (!(value instanceof Number)) {
                continue;
            }
            double score = Math.max(-1.0, Math.min(1.0, ((Number) value).doubleValue()));
            int bin = (int) Math.floor((score + 1.0) * HISTOGRAM_BINS / 2.0);
            counts[Math.min(bin, HISTOGRAM_BINS - 1)]++;
        }
        double width = 2.0 / HISTOGRAM_BINS;
        for (int i = 0; i < HISTOGRAM_BINS; i++) {
            bins.add(new HistogramBin(
                Rounding.round(-1.0 + i * width, 2),
                Rounding.round(-1.0 + (i + 1) * width, 2),
                counts[i]));
        }
        return bins;
    }
}
