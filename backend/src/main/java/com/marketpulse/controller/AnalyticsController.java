package com.marketpulse.controller;

import com.marketpulse.dto.analytics.*;
import com.marketpulse.dto.dataset.DatasetSummary;
import com.marketpulse.service.AnalysisService;
import com.marketpulse.service.dataset.DatasetService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

// ========== Analytics Controller ==========
@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
@Tag(name = "Analytics", description = "Sentiment, trend, topic and issue analysis of the current dataset")
public class AnalyticsController {

    private final AnalysisService analysisService;
    private final DatasetService datasetService;

    @GetMapping("/report")
    @Operation(summary = "Full report for the current dataset")
    public ResponseEntity<AnalysisReport> getReport() {
        return ResponseEntity.ok(analysisService.report(datasetService.requireCurrent()));
    }

    @GetMapping("/summary")
    @Operation(summary = "Column types and descriptive statistics")
    public ResponseEntity<DatasetSummary> getSummary() {
        return ResponseEntity.ok(analysisService.summary(datasetService.requireCurrent()));
    }

    @GetMapping("/trends")
    @Operation(summary = "Sentiment counts per time bucket")
    public ResponseEntity<List<TrendPoint>> getTrends() {
        return ResponseEntity.ok(analysisService.trends(datasetService.requireCurrent()));
    }

    @GetMapping("/topics")
    @Operation(summary = "Most mentioned topics with their sentiment split")
    public ResponseEntity<Map<String, TrendingTopic>> getTopics(
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(analysisService.topics(datasetService.requireCurrent(), limit));
    }

    @GetMapping("/keywords")
    @Operation(summary = "Most common words")
    public ResponseEntity<Map<String, Long>> getKeywords() {
        return ResponseEntity.ok(analysisService.keywords(datasetService.requireCurrent()));
    }

    @GetMapping("/market")
    @Operation(summary = "Overall market verdict and recommendations")
    public ResponseEntity<MarketInsight> getMarketInsight() {
        return ResponseEntity.ok(analysisService.market(datasetService.requireCurrent()));
    }

    @GetMapping("/issues")
    @Operation(summary = "Recurring complaint categories")
    public ResponseEntity<List<EmergingIssue>> getIssues() {
        return ResponseEntity.ok(analysisService.issues(datasetService.requireCurrent()));
    }
}
