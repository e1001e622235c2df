package com.marketpulse.service.assistant;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketpulse.model.LoadedDataset;
import com.marketpulse.model.RecordTable;
import com.marketpulse.model.SentimentLabel;
import com.marketpulse.service.dataset.DatasetService;
import com.marketpulse.service.dataset.DatasetSummarizer;
import com.marketpulse.service.pipeline.SentimentClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// ========== Data Assistant ==========
@Service
@RequiredArgsConstructor
@Slf4j
public class AssistantService {

    static final String NO_SENTIMENT_DATA = "No sentiment data";

    private final DatasetService datasetService;
    private final DatasetSummarizer summarizer;
    private final LlmGateway llmGateway;
    private final ObjectMapper objectMapper;

    /**
     * Answers a question about the current dataset, grounded only in its summary.
     */
    public String chat(String message) {
        LoadedDataset dataset = datasetService.requireCurrent();
        String digest = summarizer.toPromptText(summarizer.summarize(dataset.getTable(), dataset.getFileName()));
        List<LlmMessage> messages = List.of(
            LlmMessage.system(chatSystemPrompt(digest)),
            LlmMessage.user(message.strip()));
        log.info("Assistant question on {} ({} chars)", dataset.getFileName(), message.length());
        return llmGateway.chat(messages);
    }

    /**
     * Three short business observations on volume and sentiment balance.
     */
    public String insights() {
        LoadedDataset dataset = datasetService.requireCurrent();
        String prompt = insightsPrompt(dataset.getFileName(), insightStats(dataset.getTable()));
        log.info("Generating insights for {}", dataset.getFileName());
        return llmGateway.insights(List.of(LlmMessage.user(prompt)));
    }

    static String chatSystemPrompt(String digest) {
        return "You are a Data Analyst. Answer based ONLY on this summary:\n"
            + digest
            + "\nIf the answer isn't there, say so. Keep answers concise.";
    }

    String insightsPrompt(String fileName, Map<String, Object> stats) {
        String json;
        try {
            json = objectMapper.writeValueAsString(stats);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize dataset metadata", e);
        }
        return "Analyze this dataset metadata for '" + fileName + "': " + json + "\n\n"
            + "Provide 3 brief, high-level business insights or observations in a numbered list.\n"
            + "Focus on sentiment balance and data volume.";
    }

    /** rows, cols, and label counts most frequent first (or a marker when unclassified). */
    static Map<String, Object> insightStats(RecordTable table) {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("rows", table.rowCount());
        stats.put("cols", table.columns());
        if (!table.hasColumn(SentimentClassifier.SENTIMENT_COLUMN)) {
            stats.put("sentiment_counts", NO_SENTIMENT_DATA);
            return stats;
        }
        Map<SentimentLabel, Long> counts = new EnumMap<>(SentimentLabel.class);
        for (Object value : table.column(SentimentClassifier.SENTIMENT_COLUMN)) {
            SentimentLabel.fromValue(value).ifPresent(l -> counts.merge(l, 1L, Long::sum));
        }
        List<Map.Entry<SentimentLabel, Long>> ordered = new ArrayList<>(counts.entrySet());
        ordered.sort(Map.Entry.<SentimentLabel, Long>comparingByValue().reversed());
        Map<String, Long> sentimentCounts = new LinkedHashMap<>();
        for (Map.Entry<SentimentLabel, Long> e : ordered) {
            sentimentCounts.put(e.getKey().label(), e.getValue());
        }
        stats.put("sentiment_counts", sentimentCounts);
        return stats;
    }
}
