package com.marketpulse.service.dataset;

import com.marketpulse.dto.dataset.DatasetSummary;
import com.marketpulse.dto.dataset.DatasetSummary.CategoricalStats;
import com.marketpulse.model.RecordTable;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static com.marketpulse.TestTables.row;
import static com.marketpulse.TestTables.table;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DatasetSummarizerTest {

    private final DatasetSummarizer summarizer = new DatasetSummarizer();

    @Test
    void infersColumnTypesAndNonNullCounts() {
        RecordTable t = table(List.of("review", "likes", "date", "verified", "misc"),
            row("review", "good", "likes", 3L, "date", LocalDateTime.now(), "verified", true, "misc", "x"),
            row("review", "bad", "likes", null, "date", LocalDateTime.now(), "verified", false, "misc", 2L));

        DatasetSummary summary = summarizer.summarize(t, "reviews.csv");

        assertThat(summary.getFileName()).isEqualTo("reviews.csv");
        assertThat(summary.getTotalRows()).isEqualTo(2);
        assertThat(summary.getTotalColumns()).isEqualTo(5);
        assertThat(summary.getColumnDetails())
            .extracting(DatasetSummary.ColumnDetail::getType)
            .containsExactly("text", "number", "timestamp", "boolean", "mixed");
        assertThat(summary.getColumnDetails().get(1).getNonNull()).isEqualTo(1);
    }

    @Test
    void describesNumericColumns() {
        RecordTable t = table(List.of("n"), row("n", 1L), row("n", 2L), row("n", 3.0), row("n", 4L));

        Map<String, Double> stats = summarizer.summarize(t, "f.csv").getNumericSummary().get("n");

        assertThat(stats.keySet()).containsExactly("count", "mean", "std", "min", "25%", "50%", "75%", "max");
        assertThat(stats.get("count")).isEqualTo(4.0);
        assertThat(stats.get("mean")).isEqualTo(2.5);
        assertThat(stats.get("std")).isCloseTo(1.291, within(0.001));
        assertThat(stats.get("min")).isEqualTo(1.0);
        assertThat(stats.get("25%")).isEqualTo(1.75);
        assertThat(stats.get("50%")).isEqualTo(2.5);
        assertThat(stats.get("75%")).isEqualTo(3.25);
        assertThat(stats.get("max")).isEqualTo(4.0);
    }

    @Test
    void singleValueHasNoStandardDeviation() {
        Map<String, Double> stats = DatasetSummarizer.describeNumbers(List.of(7L));

        assertThat(stats.get("std")).isNull();
        assertThat(stats.get("50%")).isEqualTo(7.0);
    }

    @Test
    void describesCategoricalColumns() {
        CategoricalStats stats = DatasetSummarizer.describeCategories(List.of("b", "a", "a", "b", "c"));

        assertThat(stats.getCount()).isEqualTo(5);
        assertThat(stats.getUnique()).isEqualTo(3);
        assertThat(stats.getTop()).isEqualTo("b");
        assertThat(stats.getFreq()).isEqualTo(2);
    }

    @Test
    void promptTextListsEverySection() {
        RecordTable t = table(List.of("review"), row("review", "good"), row("review", "good"));

        String text = summarizer.toPromptText(summarizer.summarize(t, "reviews.csv"));

        assertThat(text)
            .contains("'reviews.csv'")
            .contains("Total Rows: 2")
            .contains("Total Columns: 1")
            .contains("review: text, 2 non-null")
            .contains("No numerical data.")
            .contains("review: count=2 unique=1 top=good freq=2");
    }
}
