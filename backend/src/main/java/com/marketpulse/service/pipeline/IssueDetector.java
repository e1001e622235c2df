package com.marketpulse.service.pipeline;

import com.marketpulse.dto.analytics.EmergingIssue;
import com.marketpulse.model.IssueCategory;
import com.marketpulse.model.RecordTable;
import com.marketpulse.model.SentimentLabel;
import com.marketpulse.model.SeverityTier;
import com.marketpulse.util.Rounding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

// ========== Issue Detector ==========
@Service
@RequiredArgsConstructor
@Slf4j
public class IssueDetector {

    static final int MAX_ISSUES = 5;

    private final ColumnRoleResolver roleResolver;

    /**
     * Scans negative rows for known problem categories.
     *
     * A row counts once per category it mentions. Severity is relative to the
     * number of negative rows N: more than 30% of N is High, more than 10% Medium,
     * anything else Low. Categories with no mentions are left out.
     */
    public List<EmergingIssue> detect(RecordTable table) {
        if (!table.hasColumn(SentimentClassifier.SENTIMENT_COLUMN)) {
            return List.of();
        }
        Optional<String> textColumn = roleResolver.resolveText(table);
        if (textColumn.isEmpty()) {
            return List.of();
        }

        List<String> negativeTexts = new ArrayList<>();
        for (Map<String, Object> row : table.rows()) {
            boolean negative = SentimentLabel.fromValue(row.get(SentimentClassifier.SENTIMENT_COLUMN))
                .filter(l -> l == SentimentLabel.NEGATIVE)
                .isPresent();
            if (negative) {
                Object text = row.get(textColumn.get());
                negativeTexts.add(text == null ? null : String.valueOf(text).toLowerCase(Locale.ROOT));
            }
        }
        if (negativeTexts.isEmpty()) {
            return List.of();
        }
        long negativeRows = negativeTexts.size();

        List<EmergingIssue> issues = new ArrayList<>();
        for (IssueCategory category : IssueCategory.values()) {
            long mentions = negativeTexts.stream()
                .filter(t -> t != null && category.matches(t))
                .count();
            if (mentions == 0) {
                continue;
            }
            issues.add(EmergingIssue.builder()
                .issue(category.title())
                .mentions(mentions)
                .severity(SeverityTier.of(mentions, negativeRows))
                .percentage(Rounding.percent(mentions, negativeRows))
                .build());
        }

        issues.sort(Comparator.comparingLong(EmergingIssue::getMentions).reversed());
        log.info("Detected {} issue categories across {} negative rows", issues.size(), negativeRows);
        return issues.size() > MAX_ISSUES ? new ArrayList<>(issues.subList(0, MAX_ISSUES)) : issues;
    }
}
