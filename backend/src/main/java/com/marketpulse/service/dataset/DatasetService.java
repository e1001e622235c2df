package com.marketpulse.service.dataset;

import com.marketpulse.dto.dataset.DatasetInfo;
import com.marketpulse.exception.DatasetLoadException;
import com.marketpulse.exception.DatasetNotFoundException;
import com.marketpulse.exception.NoDatasetLoadedException;
import com.marketpulse.exception.UnsupportedDatasetException;
import com.marketpulse.model.ColumnRoles;
import com.marketpulse.model.LoadedDataset;
import com.marketpulse.model.RecordTable;
import com.marketpulse.service.pipeline.ColumnRoleResolver;
import com.marketpulse.service.pipeline.ColumnRoleResolver.TextStrategy;
import com.marketpulse.service.pipeline.DatasetNormalizer;
import com.marketpulse.service.pipeline.SentimentClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

// ========== Dataset Service ==========
@Service
@Slf4j
public class DatasetService {

    public static final String REPORT_CACHE = "reports";

    private final DatasetLoader loader;
    private final DatasetNormalizer normalizer;
    private final SentimentClassifier classifier;
    private final ColumnRoleResolver roleResolver;
    private final Path uploadDir;

    // last write wins; readers always see one complete dataset
    private final AtomicReference<LoadedDataset> current = new AtomicReference<>();

    public DatasetService(
            DatasetLoader loader,
            DatasetNormalizer normalizer,
            SentimentClassifier classifier,
            ColumnRoleResolver roleResolver,
            @Value("${marketpulse.storage.upload-dir:data}") String uploadDir) {
        this.loader = loader;
        this.normalizer = normalizer;
        this.classifier = classifier;
        this.roleResolver = roleResolver;
        this.uploadDir = Paths.get(uploadDir);
    }

    /**
     * Stores the uploaded file in the upload directory and makes it the current dataset.
     */
    @CacheEvict(value = REPORT_CACHE, allEntries = true)
    public LoadedDataset upload(MultipartFile file) {
        String fileName = baseName(file.getOriginalFilename());
        if (fileName.isEmpty()) {
            throw new UnsupportedDatasetException("No file selected");
        }
        if (!DatasetLoader.isSupported(fileName)) {
            throw new UnsupportedDatasetException("Unsupported file type: " + fileName);
        }
        try {
            byte[] content = file.getBytes();
            Files.createDirectories(uploadDir);
            Files.write(uploadDir.resolve(fileName), content);
            log.info("Stored upload {} ({} bytes) in {}", fileName, content.length, uploadDir);
            return process(fileName, content);
        } catch (IOException e) {
            throw new DatasetLoadException("Failed to store upload: " + fileName, e);
        }
    }

    /**
     * Re-loads a previously uploaded file and makes it the current dataset.
     */
    @CacheEvict(value = REPORT_CACHE, allEntries = true)
    public LoadedDataset load(String name) {
        String fileName = baseName(name);
        Path path = uploadDir.resolve(fileName);
        if (fileName.isEmpty() || !Files.isRegularFile(path)) {
            throw new DatasetNotFoundException("File not found: " + fileName);
        }
        try {
            return process(fileName, Files.readAllBytes(path));
        } catch (IOException e) {
            throw new DatasetLoadException("File corrupted or unreadable: " + fileName, e);
        }
    }

    @CacheEvict(value = REPORT_CACHE, allEntries = true)
    public void reset() {
        LoadedDataset previous = current.getAndSet(null);
        if (previous != null) {
            log.info("Cleared current dataset {}", previous.getFileName());
        }
    }

    public Optional<LoadedDataset> current() {
        return Optional.ofNullable(current.get());
    }

    public LoadedDataset requireCurrent() {
        return current().orElseThrow(() -> new NoDatasetLoadedException("No dataset loaded. Upload or load a file first."));
    }

    /** Accepted files in the upload directory, most recently modified first. */
    public List<String> listFiles() {
        if (!Files.isDirectory(uploadDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(uploadDir)) {
            return files
                .filter(Files::isRegularFile)
                .filter(p -> DatasetLoader.isSupported(p.getFileName().toString()))
                .sorted(Comparator.comparing(DatasetService::lastModified).reversed())
                .map(p -> p.getFileName().toString())
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + uploadDir, e);
        }
    }

    public DatasetInfo info(LoadedDataset dataset) {
        return DatasetInfo.builder()
            .fileName(dataset.getFileName())
            .loadedAt(dataset.getLoadedAt())
            .rows(dataset.getTable().rowCount())
            .columns(dataset.getTable().columns())
            .textColumn(dataset.getRoles().getTextColumn().orElse(null))
            .timeColumn(dataset.getRoles().getTimeColumn().orElse(null))
            .classified(dataset.getTable().hasColumn(SentimentClassifier.SENTIMENT_COLUMN))
            .build();
    }

    private LoadedDataset process(String fileName, byte[] content) {
        RecordTable normalized = normalizer.normalize(loader.load(fileName, content));
        if (normalized.isEmpty()) {
            throw new DatasetLoadException("Error reading file: " + fileName + " holds no usable rows");
        }
        RecordTable classified = classifier.classify(normalized);
        ColumnRoles roles = roleResolver.resolve(classified, TextStrategy.SYNONYMS_THEN_LONGEST_STRING);
        LoadedDataset dataset = new LoadedDataset(fileName, Instant.now(), classified, roles);
        current.set(dataset);
        log.info("Current dataset is now {} ({} rows, {} columns)",
            fileName, classified.rowCount(), classified.columnCount());
        return dataset;
    }

    private static Instant lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path).toInstant();
        } catch (IOException e) {
            log.debug("Cannot read modification time of {}: {}", path, e.getMessage());
            return Instant.EPOCH;
        }
    }

    static String baseName(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        Path fileName = Paths.get(name.replace('\\', '/')).getFileName();
        return fileName == null ? "" : fileName.toString();
    }
}
