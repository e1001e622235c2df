package com.marketpulse.service.pipeline;

import com.marketpulse.model.ColumnRole;
import com.marketpulse.model.ColumnRoles;
import com.marketpulse.model.RecordTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

// ========== Column Role Resolver ==========
@Service
@Slf4j
public class ColumnRoleResolver {

    /** How the text column is looked up. */
    public enum TextStrategy {
        /** Name synonyms only. */
        SYNONYMS,
        /** Name synonyms, then the string column with the longest mean length. */
        SYNONYMS_THEN_LONGEST_STRING
    }

    public ColumnRoles resolve(RecordTable table) {
        return resolve(table, TextStrategy.SYNONYMS);
    }

    public ColumnRoles resolve(RecordTable table, TextStrategy textStrategy) {
        return new ColumnRoles(resolveText(table, textStrategy), resolveTime(table));
    }

    public Optional<String> resolveText(RecordTable table) {
        return resolveByName(table, ColumnRole.TEXT);
    }

    public Optional<String> resolveText(RecordTable table, TextStrategy strategy) {
        Optional<String> byName = resolveText(table);
        if (byName.isPresent() || strategy == TextStrategy.SYNONYMS) {
            return byName;
        }
        Optional<String> longest = longestStringColumn(table);
        longest.ifPresent(c -> log.info("No text column by name; falling back to longest string column '{}'", c));
        return longest;
    }

    /** First column whose name contains a time synonym; the classifier's own columns never qualify. */
    public Optional<String> resolveTime(RecordTable table) {
        for (String column : table.columns()) {
            if (isClassifierOutput(column)) {
                continue;
            }
            for (String synonym : ColumnRole.TIME.synonyms()) {
                if (ColumnRole.TIME.matches(column, synonym)) {
                    return Optional.of(column);
                }
            }
        }
        return Optional.empty();
    }

    public Optional<String> resolveEngagement(RecordTable table) {
        return resolveByName(table, ColumnRole.ENGAGEMENT);
    }

    // "sentiment" contains "time"
    static boolean isClassifierOutput(String column) {
        return SentimentClassifier.SENTIMENT_COLUMN.equals(column) || SentimentClassifier.SCORE_COLUMN.equals(column);
    }

    /** Synonym priority wins over column order. */
    private Optional<String> resolveByName(RecordTable table, ColumnRole role) {
        for (String synonym : role.synonyms()) {
            for (String column : table.columns()) {
                if (role.matches(column, synonym)) {
                    return Optional.of(column);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * A column is string-typed when it holds at least one value and every value is a String.
     * Missing cells count as length 0. Ties keep the earlier column. The classifier's own columns never qualify.
     */
    Optional<String> longestStringColumn(RecordTable table) {
        String best = null;
        double bestMean = -1;
        for (String column : table.columns()) {
            if (isClassifierOutput(column)) {
                continue;
            }
            boolean stringTyped = false;
            long totalLength = 0;
            for (Map<String, Object> row : table.rows()) {
                Object value = row.get(column);
                if (value == null) {
                    continue;
                }
                if (!(value instanceof String)) {
                    stringTyped = false;
                    break;
                }
                stringTyped = true;
                totalLength += ((String) value).length();
            }
            if (!stringTyped || table.rowCount() == 0) {
                continue;
            }
            double mean = (double) totalLength / table.rowCount();
            if (mean > bestMean) {
                bestMean = mean;
                best = column;
            }
        }
        return Optional.ofNullable(best);
    }
}
