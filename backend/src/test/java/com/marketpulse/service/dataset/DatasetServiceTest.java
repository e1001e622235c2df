package com.marketpulse.service.dataset;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketpulse.dto.dataset.DatasetInfo;
import com.marketpulse.exception.DatasetLoadException;
import com.marketpulse.exception.DatasetNotFoundException;
import com.marketpulse.exception.NoDatasetLoadedException;
import com.marketpulse.exception.UnsupportedDatasetException;
import com.marketpulse.model.LoadedDataset;
import com.marketpulse.service.nlp.LexiconPolarityScorer;
import com.marketpulse.service.pipeline.ColumnRoleResolver;
import com.marketpulse.service.pipeline.DatasetNormalizer;
import com.marketpulse.service.pipeline.SentimentClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetServiceTest {

    private static final String CSV = "Review,Date,Likes\n"
        + "I love this phone,2024-03-01,10\n"
        + "Terrible battery,2024-03-02,3\n"
        + ",,\n";

    @TempDir
    Path uploadDir;

    private DatasetService service;

    @BeforeEach
    void setUp() {
        ColumnRoleResolver resolver = new ColumnRoleResolver();
        service = new DatasetService(
            new DatasetLoader(new ObjectMapper()),
            new DatasetNormalizer(),
            new SentimentClassifier(new LexiconPolarityScorer(), resolver),
            resolver,
            uploadDir.toString());
    }

    @Test
    void uploadStoresNormalizesAndClassifies() {
        LoadedDataset dataset = service.upload(csvFile("reviews.csv"));

        assertThat(uploadDir.resolve("reviews.csv")).exists();
        assertThat(dataset.getTable().rowCount()).isEqualTo(2);
        assertThat(dataset.getTable().columns()).containsExactly("review", "date", "likes", "sentiment", "sentiment_score");
        assertThat(dataset.getTable().column("sentiment")).containsExactly("Positive", "Negative");
        assertThat(dataset.getRoles().getTextColumn()).contains("review");
        assertThat(dataset.getRoles().getTimeColumn()).contains("date");
        assertThat(service.current()).containsSame(dataset);
    }

    @Test
    void uploadKeepsOnlyTheBaseName() {
        service.upload(csvFile("../../outside.csv"));

        assertThat(uploadDir.resolve("outside.csv")).exists();
        assertThat(uploadDir.getParent().resolve("outside.csv")).doesNotExist();
    }

    @Test
    void uploadRejectsUnsupportedTypes() {
        MockMultipartFile txt = new MockMultipartFile("file", "notes.txt", "text/plain", "hi".getBytes(StandardCharsets.UTF_8));
        MockMultipartFile unnamed = new MockMultipartFile("file", "", "text/csv", CSV.getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> service.upload(txt)).isInstanceOf(UnsupportedDatasetException.class);
        assertThatThrownBy(() -> service.upload(unnamed)).isInstanceOf(UnsupportedDatasetException.class);
        assertThat(service.current()).isEmpty();
    }

    @Test
    void fileWithoutUsableRowsIsRejectedAndPreviousDatasetKept() {
        LoadedDataset previous = service.upload(csvFile("reviews.csv"));
        MockMultipartFile empty = new MockMultipartFile("file", "empty.csv", "text/csv",
            "review,likes\n,\n".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> service.upload(empty)).isInstanceOf(DatasetLoadException.class);
        assertThat(service.current()).containsSame(previous);
    }

    @Test
    void loadReadsAPreviousUpload() throws IOException {
        Files.writeString(uploadDir.resolve("old.csv"), CSV);

        LoadedDataset dataset = service.load("old.csv");

        assertThat(dataset.getFileName()).isEqualTo("old.csv");
        assertThat(service.requireCurrent()).isSameAs(dataset);
    }

    @Test
    void loadOfMissingFileIsNotFound() {
        assertThatThrownBy(() -> service.load("missing.csv")).isInstanceOf(DatasetNotFoundException.class);
        assertThatThrownBy(() -> service.load("../secret.csv")).isInstanceOf(DatasetNotFoundException.class);
    }

    @Test
    void resetClearsTheCurrentDataset() {
        service.upload(csvFile("reviews.csv"));

        service.reset();

        assertThat(service.current()).isEmpty();
        assertThatThrownBy(() -> service.requireCurrent()).isInstanceOf(NoDatasetLoadedException.class);
    }

    @Test
    void listFilesNewestFirstAndOnlySupportedTypes() throws IOException {
        Files.writeString(uploadDir.resolve("a.csv"), CSV);
        Files.writeString(uploadDir.resolve("b.json"), "[]");
        Files.writeString(uploadDir.resolve("readme.txt"), "x");
        Files.setLastModifiedTime(uploadDir.resolve("a.csv"), FileTime.from(Instant.parse("2024-01-01T00:00:00Z")));
        Files.setLastModifiedTime(uploadDir.resolve("b.json"), FileTime.from(Instant.parse("2024-06-01T00:00:00Z")));

        assertThat(service.listFiles()).containsExactly("b.json", "a.csv");
    }

    @Test
    void listFilesWithoutUploadDirectoryIsEmpty() {
        ColumnRoleResolver resolver = new ColumnRoleResolver();
        DatasetService fresh = new DatasetService(
            new DatasetLoader(new ObjectMapper()),
            new DatasetNormalizer(),
            new SentimentClassifier(new LexiconPolarityScorer(), resolver),
            resolver,
            uploadDir.resolve("not-created-yet").toString());

        assertThat(fresh.listFiles()).isEmpty();
    }

    @Test
    void infoDescribesTheDataset() {
        DatasetInfo info = service.info(service.upload(csvFile("reviews.csv")));

        assertThat(info.getFileName()).isEqualTo("reviews.csv");
        assertThat(info.getRows()).isEqualTo(2);
        assertThat(info.getTextColumn()).isEqualTo("review");
        assertThat(info.getTimeColumn()).isEqualTo("date");
        assertThat(info.isClassified()).isTrue();
    }

    @Test
    void infoReportsTheColumnTheClassifierScored() {
        String csv = "notes,stars\n"
            + "Arrived quickly and works great,5\n"
            + "Broke after a week,1\n";
        MockMultipartFile file = new MockMultipartFile("file", "feedback.csv", "text/csv", csv.getBytes(StandardCharsets.UTF_8));

        LoadedDataset dataset = service.upload(file);
        DatasetInfo info = service.info(dataset);

        assertThat(dataset.getTable().column("sentiment")).containsExactly("Positive", "Negative");
        assertThat(info.getTextColumn()).isEqualTo("notes");
        assertThat(info.isClassified()).isTrue();
    }

    @Test
    void baseNameStripsDirectories() {
        assertThat(DatasetService.baseName("a/b/c.csv")).isEqualTo("c.csv");
        assertThat(DatasetService.baseName("C:\\data\\d.csv")).isEqualTo("d.csv");
        assertThat(DatasetService.baseName(null)).isEmpty();
    }

    private static MockMultipartFile csvFile(String name) {
        return new MockMultipartFile("file", name, "text/csv", CSV.getBytes(StandardCharsets.UTF_8));
    }
}
