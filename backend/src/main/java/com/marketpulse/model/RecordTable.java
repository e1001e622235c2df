package com.marketpulse.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, ordered in-memory dataset.
 *
 * Each row maps a column name to a String, Number, Boolean, LocalDateTime or null.
 * Every row carries every column (missing cells map to null). Operations that
 * "change" the table return a new instance and leave this one untouched.
 */
public final class RecordTable {

    private static final RecordTable EMPTY = new RecordTable(List.of(), List.of());

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    private RecordTable(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public static RecordTable empty() {
        return EMPTY;
    }

    /**
     * Builds a table from column names and raw rows. Cells missing from a row
     * become null; keys not listed in {@code columns} are ignored.
     */
    public static RecordTable of(List<String> columns, List<? extends Map<String, ?>> rows) {
        Objects.requireNonNull(columns, "columns");
        Objects.requireNonNull(rows, "rows");
        List<String> cols = List.copyOf(new LinkedHashSet<>(columns));
        if (cols.size() != columns.size()) {
            throw new IllegalArgumentException("Duplicate column names: " + columns);
        }
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, ?> raw : rows) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (String c : cols) {
                row.put(c, raw.get(c));
            }
            copy.add(Collections.unmodifiableMap(row));
        }
        return new RecordTable(cols, Collections.unmodifiableList(copy));
    }

    public List<String> columns() {
        return columns;
    }

    public List<Map<String, Object>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty() || columns.isEmpty();
    }

    public boolean hasColumn(String name) {
        return columns.contains(name);
    }

    /** All values of one column, in row order. */
    public List<Object> column(String name) {
        if (!hasColumn(name)) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        List<Object> out = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            out.add(row.get(name));
        }
        return out;
    }

    /** Returns a new table with {@code name} set row by row from {@code values}. */
    public RecordTable withColumn(String name, List<?> values) {
        if (values.size() != rows.size()) {
            throw new IllegalArgumentException(
                "Column '" + name + "' has " + values.size() + " values for " + rows.size() + " rows");
        }
        List<String> cols = new ArrayList<>(columns);
        if (!cols.contains(name)) {
            cols.add(name);
        }
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> copy = new LinkedHashMap<>(rows.get(i));
            copy.put(name, values.get(i));
            out.add(copy);
        }
        return RecordTable.of(cols, out);
    }

    @Override
    public String toString() {
        return "RecordTable[" + rowCount() + " rows x " + columnCount() + " columns " + columns + "]";
    }
}
