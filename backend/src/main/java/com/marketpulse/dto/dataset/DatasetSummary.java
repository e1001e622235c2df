package com.marketpulse.dto.dataset;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

// ========== Dataset Summary DTO ==========
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetSummary {
    @JsonProperty("file_name")
    private String fileName;

    @JsonProperty("total_rows")
    private long totalRows;

    @JsonProperty("total_columns")
    private long totalColumns;

    @JsonProperty("column_details")
    private List<ColumnDetail> columnDetails;

    // column -> statistic (count, mean, std, min, 25%, 50%, 75%, max) -> value
    @JsonProperty("numeric_summary")
    private Map<String, Map<String, Double>> numericSummary;

    // column -> {count, unique, top, freq}
    @JsonProperty("categorical_summary")
    private Map<String, CategoricalStats> categoricalSummary;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ColumnDetail {
        private String name;
        private String type;
        @JsonProperty("non_null")
        private long nonNull;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CategoricalStats {
        private long count;
        private long unique;
        private String top;
        private long freq;
    }
}
