package com.marketpulse.service.pipeline;

import com.marketpulse.model.RecordTable;
import com.marketpulse.util.TimestampParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

// ========== Dataset Normalizer ==========
@Service
@Slf4j
public class DatasetNormalizer {

    static final List<String> TIME_NAME_HINTS = List.of("date", "time", "created", "timestamp");

    /**
     * Coerces a raw table into the canonical shape every pipeline stage expects.
     *
     * Steps:
     * 1. Blank strings become missing
     * 2. Drop rows where every cell is missing
     * 3. Drop columns where every cell is missing
     * 4. Trim and lower-case column names (collisions get a .1, .2 ... suffix)
     * 5. Parse time-like columns into timestamps; unparseable cells become missing
     *
     * Best effort only: nothing here throws on bad data.
     */
    public RecordTable normalize(RecordTable raw) {
        Objects.requireNonNull(raw, "raw");
        log.info("Normalizing dataset: {} rows, {} columns", raw.rowCount(), raw.columnCount());

        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, Object> row : raw.rows()) {
            Map<String, Object> cleaned = new LinkedHashMap<>();
            boolean anyValue = false;
            for (String column : raw.columns()) {
                Object value = blankToNull(row.get(column));
                cleaned.put(column, value);
                anyValue |= value != null;
            }
            if (anyValue) {
                rows.add(cleaned);
            }
        }

        List<String> kept = new ArrayList<>();
        for (String column : raw.columns()) {
            if (rows.stream().anyMatch(r -> r.get(column) != null)) {
                kept.add(column);
            }
        }

        Map<String, String> renamed = renameColumns(kept);
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            for (String column : kept) {
                String name = renamed.get(column);
                Object value = row.get(column);
                normalized.put(name, isTimeLike(name) ? TimestampParser.parse(value).orElse(null) : value);
            }
            out.add(normalized);
        }

        RecordTable table = RecordTable.of(new ArrayList<>(renamed.values()), out);
        log.info("Normalized dataset: {} rows, {} columns (dropped {} rows, {} columns)",
            table.rowCount(), table.columnCount(),
            raw.rowCount() - table.rowCount(), raw.columnCount() - table.columnCount());
        return table;
    }

    static boolean isTimeLike(String columnName) {
        if (ColumnRoleResolver.isClassifierOutput(columnName)) {
            return false;
        }
        for (String hint : TIME_NAME_HINTS) {
            if (columnName.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, String> renameColumns(List<String> columns) {
        Map<String, String> renamed = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        for (String column : columns) {
            String base = column == null ? "" : column.strip().toLowerCase(Locale.ROOT);
            String name = base;
            int suffix = 1;
            while (!used.add(name)) {
                name = base + "." + suffix++;
            }
            renamed.put(column, name);
        }
        return renamed;
    }

    private static Object blankToNull(Object value) {
        if (value instanceof String && ((String) value).isBlank()) {
            return null;
        }
        if (value instanceof Double && ((Double) value).isNaN()) {
            return null;
        }
        return value;
    }
}
