package com.marketpulse.service.pipeline;

import com.marketpulse.model.RecordTable;
import com.marketpulse.model.SentimentLabel;
import com.marketpulse.service.nlp.PolarityScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

// ========== Sentiment Classifier ==========
@Service
@RequiredArgsConstructor
@Slf4j
public class SentimentClassifier {

    public static final String SENTIMENT_COLUMN = "sentiment";
    public static final String SCORE_COLUMN = "sentiment_score";

    private final PolarityScorer scorer;
    private final ColumnRoleResolver roleResolver;

    /**
     * Appends {@code sentiment} and {@code sentiment_score} to every row.
     * The text column is found by name, falling back to the longest string column.
     * Without any text column the table is returned unchanged.
     */
    public RecordTable classify(RecordTable table) {
        Optional<String> textColumn = roleResolver.resolveText(
            table, ColumnRoleResolver.TextStrategy.SYNONYMS_THEN_LONGEST_STRING);
        if (textColumn.isEmpty()) {
            log.info("No suitable text column found. Skipping sentiment analysis.");
            return table;
        }
        return classify(table, textColumn.get());
    }

    public RecordTable classify(RecordTable table, String textColumn) {
        log.info("Running sentiment analysis on column: {} ({} rows)", textColumn, table.rowCount());
        List<Double> scores = new ArrayList<>(table.rowCount());
        List<String> labels = new ArrayList<>(table.rowCount());
        for (Map<String, Object> row : table.rows()) {
            double score = score(row.get(textColumn));
            scores.add(score);
            labels.add(SentimentLabel.fromScore(score).label());
        }
        return table
            .withColumn(SENTIMENT_COLUMN, labels)
            .withColumn(SCORE_COLUMN, scores);
    }

    /** Non-string values score 0. */
    private double score(Object value) {
        if (!(value instanceof String)) {
            return 0.0;
        }
        return scorer.compound((String) value);
    }
}
