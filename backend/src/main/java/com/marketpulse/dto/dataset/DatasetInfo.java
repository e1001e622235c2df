package com.marketpulse.dto.dataset;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

// ========== Loaded Dataset Info DTO ==========
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetInfo {
    @JsonProperty("file_name")
    private String fileName;

    @JsonProperty("loaded_at")
    private Instant loadedAt;

    private long rows;
    private List<String> columns;

    @JsonProperty("text_column")
    private String textColumn;      // null when none resolved

    @JsonProperty("time_column")
    private String timeColumn;

    private boolean classified;
}
