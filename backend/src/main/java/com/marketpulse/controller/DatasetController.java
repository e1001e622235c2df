package com.marketpulse.controller;

import com.marketpulse.dto.dataset.DatasetInfo;
import com.marketpulse.service.dataset.DatasetService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

// ========== Dataset Controller ==========
@RestController
@RequestMapping("/api/datasets")
@RequiredArgsConstructor
@Tag(name = "Datasets", description = "Upload, load and reset the analysed dataset")
public class DatasetController {

    private final DatasetService datasetService;

    @GetMapping
    @Operation(summary = "Uploaded files, newest first")
    public ResponseEntity<List<String>> listFiles() {
        return ResponseEntity.ok(datasetService.listFiles());
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload a CSV, JSON or Excel file and make it the current dataset")
    public ResponseEntity<DatasetInfo> upload(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(datasetService.info(datasetService.upload(file)));
    }

    @PostMapping("/{name}/load")
    @Operation(summary = "Load a previously uploaded file")
    public ResponseEntity<DatasetInfo> load(@PathVariable String name) {
        return ResponseEntity.ok(datasetService.info(datasetService.load(name)));
    }

    @GetMapping("/current")
    @Operation(summary = "Currently loaded dataset")
    public ResponseEntity<DatasetInfo> current() {
        return ResponseEntity.ok(datasetService.info(datasetService.requireCurrent()));
    }

    @DeleteMapping("/current")
    @Operation(summary = "Clear the current dataset")
    public ResponseEntity<Void> reset() {
        datasetService.reset();
        return ResponseEntity.noContent().build();
    }
}
