package com.marketpulse.service.pipeline;

import com.marketpulse.model.RecordTable;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static com.marketpulse.TestTables.row;
import static com.marketpulse.TestTables.table;
import static org.assertj.core.api.Assertions.assertThat;

class DatasetNormalizerTest {

    private final DatasetNormalizer normalizer = new DatasetNormalizer();

    @Test
    void dropsEmptyRowsAndColumns() {
        RecordTable raw = table(List.of("Review", "Unused", "Rating"),
            row("Review", "Great", "Unused", null, "Rating", 5L),
            row("Review", "  ", "Unused", "", "Rating", null),
            row("Review", "Bad", "Unused", null, "Rating", Double.NaN));

        RecordTable out = normalizer.normalize(raw);

        assertThat(out.columns()).containsExactly("review", "rating");
        assertThat(out.rowCount()).isEqualTo(2);
        assertThat(out.column("rating")).containsExactly(5L, null);
    }

    @Test
    void trimsLowercasesAndDeduplicatesNames() {
        RecordTable raw = table(List.of(" Review ", "review", "REVIEW"),
            row(" Review ", "a", "review", "b", "REVIEW", "c"));

        RecordTable out = normalizer.normalize(raw);

        assertThat(out.columns()).containsExactly("review", "review.1", "review.2");
        assertThat(out.rows().get(0)).containsEntry("review.2", "c");
    }

    @Test
    void parsesTimeLikeColumns() {
        RecordTable raw = table(List.of("Created At", "text"),
            row("Created At", "2024-03-05 10:00:00", "text", "ok"),
            row("Created At", "yesterday-ish", "text", "ok"));

        RecordTable out = normalizer.normalize(raw);

        assertThat(out.column("created at"))
            .containsExactly(LocalDateTime.of(2024, 3, 5, 10, 0), null);
    }

    @Test
    void microsecondAndEpochTimestampsSurviveNormalization() {
        RecordTable raw = table(List.of("timestamp", "text"),
            row("timestamp", "2024-03-05 10:00:00.123456", "text", "ok"),
            row("timestamp", 1709632800L, "text", "ok"));

        RecordTable out = normalizer.normalize(raw);

        assertThat(out.column("timestamp")).containsExactly(
            LocalDateTime.of(2024, 3, 5, 10, 0, 0, 123_456_000),
            LocalDateTime.of(2024, 3, 5, 10, 0));
    }

    @Test
    void existingSentimentColumnIsNotParsedAsTime() {
        RecordTable raw = table(List.of("Sentiment"), row("Sentiment", "Positive"));

        assertThat(normalizer.normalize(raw).column("sentiment")).containsExactly("Positive");
    }

    @Test
    void leavesOtherValuesAlone() {
        RecordTable raw = table(List.of("text", "likes"),
            row("text", " padded ", "likes", 3L));

        RecordTable out = normalizer.normalize(raw);

        assertThat(out.rows().get(0)).containsEntry("text", " padded ").containsEntry("likes", 3L);
    }

    @Test
    void emptyInputGivesEmptyTable() {
        assertThat(normalizer.normalize(RecordTable.empty()).isEmpty()).isTrue();
        assertThat(normalizer.normalize(table(List.of("a"), row("a", ""))).isEmpty()).isTrue();
    }
}
