package com.marketpulse.service.dataset;

import com.marketpulse.dto.dataset.DatasetSummary;
import com.marketpulse.dto.dataset.DatasetSummary.CategoricalStats;
import com.marketpulse.dto.dataset.DatasetSummary.ColumnDetail;
import com.marketpulse.model.RecordTable;
import com.marketpulse.util.Rounding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Describes a table column by column: inferred type, non-null count, and
 * distribution statistics for numeric and text columns.
 */
@Service
@Slf4j
public class DatasetSummarizer {

    static final String TYPE_TEXT = "text";
    static final String TYPE_NUMBER = "number";
    static final String TYPE_TIMESTAMP = "timestamp";
    static final String TYPE_BOOLEAN = "boolean";
    static final String TYPE_MIXED = "mixed";
    static final String TYPE_EMPTY = "empty";

    static final List<String> NUMERIC_STATS = List.of("count", "mean", "std", "min", "25%", "50%", "75%", "max");

    public DatasetSummary summarize(RecordTable table, String fileName) {
        log.debug("Summarizing {} ({} columns)", fileName, table.columnCount());
        List<ColumnDetail> details = new ArrayList<>();
        Map<String, Map<String, Double>> numeric = new LinkedHashMap<>();
        Map<String, CategoricalStats> categorical = new LinkedHashMap<>();

        for (String column : table.columns()) {
            List<Object> values = nonNull(table.column(column));
            String type = inferType(values);
            details.add(new ColumnDetail(column, type, values.size()));
            if (TYPE_NUMBER.equals(type)) {
                numeric.put(column, describeNumbers(values));
            } else if (TYPE_TEXT.equals(type) || TYPE_MIXED.equals(type)) {
                categorical.put(column, describeCategories(values));
            }
        }

        return DatasetSummary.builder()
            .fileName(fileName)
            .totalRows(table.rowCount())
            .totalColumns(table.columnCount())
            .columnDetails(details)
            .numericSummary(numeric)
            .categoricalSummary(categorical)
            .build();
    }

    /** Renders the summary as plain text for a language model prompt. */
    public String toPromptText(DatasetSummary summary) {
        StringBuilder sb = new StringBuilder();
        sb.append("Here is a summary of the data from the file '").append(summary.getFileName()).append("':\n\n");

        sb.append("--- FILE INFO ---\n");
        sb.append("Total Rows: ").append(summary.getTotalRows()).append('\n');
        sb.append("Total Columns: ").append(summary.getTotalColumns()).append("\n\n");

        sb.append("--- COLUMN DETAILS (Name, Type, Non-Null) ---\n");
        for (ColumnDetail d : summary.getColumnDetails()) {
            sb.append(String.format(Locale.ROOT, "%s: %s, %d non-null%n", d.getName(), d.getType(), d.getNonNull()));
        }

        sb.append("\n--- NUMERICAL DATA SUMMARY ---\n");
        if (summary.getNumericSummary().isEmpty()) {
            sb.append("No numerical data.\n");
        }
        summary.getNumericSummary().forEach((column, stats) -> {
            sb.append(column).append(':');
            stats.forEach((stat, value) -> sb.append(String.format(Locale.ROOT, " %s=%.4f", stat, value)));
            sb.append('\n');
        });

        sb.append("\n--- CATEGORICAL DATA SUMMARY ---\n");
        if (summary.getCategoricalSummary().isEmpty()) {
            sb.append("No categorical data.\n");
        }
        summary.getCategoricalSummary().forEach((column, stats) -> sb.append(String.format(Locale.ROOT,
            "%s: count=%d unique=%d top=%s freq=%d%n",
            column, stats.getCount(), stats.getUnique(), abbreviate(stats.getTop()), stats.getFreq())));
        return sb.toString();
    }

    static String inferType(List<Object> values) {
        if (values.isEmpty()) {
            return TYPE_EMPTY;
        }
        String type = null;
        for (Object v : values) {
            String t = typeOf(v);
            if (type == null) {
                type = t;
            } else if (!type.equals(t)) {
                return TYPE_MIXED;
            }
        }
        return type;
    }

    private static String typeOf(Object value) {
        if (value instanceof Boolean) {
            return TYPE_BOOLEAN;
        }
        if (value instanceof Number) {
            return TYPE_NUMBER;
        }
        if (value instanceof LocalDateTime) {
            return TYPE_TIMESTAMP;
        }
        return TYPE_TEXT;
    }

    /** count, mean, sample std, min, linear-interpolated quartiles, max. */
    static Map<String, Double> describeNumbers(List<Object> values) {
        double[] xs = new double[values.size()];
        double sum = 0;
        for (int i = 0; i < xs.length; i++) {
            xs[i] = ((Number) values.get(i)).doubleValue();
            sum += xs[i];
        }
        Arrays.sort(xs);
        int n = xs.length;
        double mean = sum / n;
        double squares = 0;
        for (double x : xs) {
            squares += (x - mean) * (x - mean);
        }
        double std = n > 1 ? Math.sqrt(squares / (n - 1)) : Double.NaN;

        Map<String, Double> stats = new LinkedHashMap<>();
        stats.put("count", (double) n);
        stats.put("mean", Rounding.round(mean, 4));
        stats.put("std", Double.isNaN(std) ? null : Rounding.round(std, 4));
        stats.put("min", xs[0]);
        stats.put("25%", Rounding.round(quantile(xs, 0.25), 4));
        stats.put("50%", Rounding.round(quantile(xs, 0.50), 4));
        stats.put("75%", Rounding.round(quantile(xs, 0.75), 4));
        stats.put("max", xs[n - 1]);
        return stats;
    }

    static double quantile(double[] sorted, double q) {
        double pos = q * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (pos - lo);
    }

    /** Most frequent value wins; ties go to the value seen first. */
    static CategoricalStats describeCategories(List<Object> values) {
        Map<String, Long> freq = new LinkedHashMap<>();
        for (Object v : values) {
            freq.merge(String.valueOf(v), 1L, Long::sum);
        }
        String top = null;
        long topFreq = 0;
        for (Map.Entry<String, Long> e : freq.entrySet()) {
            if (e.getValue() > topFreq) {
                top = e.getKey();
                topFreq = e.getValue();
            }
        }
        return new CategoricalStats(values.size(), freq.size(), top, topFreq);
    }

    private static List<Object> nonNull(List<Object> values) {
        List<Object> out = new ArrayList<>(values.size());
        for (Object v : values) {
            if (v != null) {
                out.add(v);
            }
        }
        return out;
    }

    private static String abbreviate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() <= 60 ? value : value.substring(0, 57) + "...";
    }
}
