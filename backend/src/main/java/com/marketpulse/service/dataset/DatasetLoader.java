package com.marketpulse.service.dataset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketpulse.exception.DatasetLoadException;
import com.marketpulse.exception.UnsupportedDatasetException;
import com.marketpulse.model.RecordTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads CSV, JSON and Excel files into a raw {@link RecordTable}.
 *
 * CSV is decoded as UTF-8 first and re-read as Latin-1 when that fails.
 * JSON may be an array of objects, an object wrapping one under "data" or "records",
 * or a column-oriented object mapping each column to its values by row index.
 * Excel reads the first sheet with the header on row 0.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DatasetLoader {

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of("csv", "json", "xls", "xlsx");

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");

    private final ObjectMapper objectMapper;

    public static boolean isSupported(String fileName) {
        return SUPPORTED_EXTENSIONS.contains(extension(fileName));
    }

    public RecordTable load(String fileName, byte[] content) {
        String ext = extension(fileName);
        if (!SUPPORTED_EXTENSIONS.contains(ext)) {
            throw new UnsupportedDatasetException("Unsupported file type: " + fileName);
        }
        log.info("Loading dataset '{}' ({} bytes, type={})", fileName, content.length, ext);
        try {
            if (ext.equals("csv")) {
                return readCsv(content);
            }
            if (ext.equals("json")) {
                return readJson(content);
            }
            return readExcel(content);
        } catch (DatasetLoadException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            log.error("Error loading file {}: {}", fileName, e.getMessage());
            throw new DatasetLoadException("Error reading file: " + fileName, e);
        }
    }

    // ---- CSV ----

    private RecordTable readCsv(byte[] content) throws IOException {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(content))
                .toString();
        } catch (CharacterCodingException e) {
            log.info("CSV is not valid UTF-8, retrying as Latin-1");
            text = new String(content, StandardCharsets.ISO_8859_1);
        }
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }

        List<String> headers = null;
        List<List<String>> cells = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(new StringReader(text), CSVFormat.DEFAULT)) {
            for (CSVRecord record : parser) {
                List<String> values = new ArrayList<>(record.size());
                record.forEach(values::add);
                if (headers == null) {
                    headers = uniqueHeaders(values);
                } else {
                    cells.add(values);
                }
            }
        }
        if (headers == null) {
            return RecordTable.empty();
        }

        List<Boolean> numeric = new ArrayList<>();
        for (int c = 0; c < headers.size(); c++) {
            numeric.add(isNumericColumn(cells, c));
        }

        List<Map<String, Object>> rows = new ArrayList<>(cells.size());
        for (List<String> values : cells) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int c = 0; c < headers.size(); c++) {
                String raw = c < values.size() ? values.get(c) : null;
                row.put(headers.get(c), convertCsvCell(raw, numeric.get(c)));
            }
            rows.add(row);
        }
        return RecordTable.of(headers, rows);
    }

    private static boolean isNumericColumn(List<List<String>> cells, int column) {
        boolean any = false;
        for (List<String> values : cells) {
            if (column >= values.size() || values.get(column).isBlank()) {
                continue;
            }
            if (!DECIMAL.matcher(values.get(column).trim()).matches()) {
                return false;
            }
            any = true;
        }
        return any;
    }

    private static Object convertCsvCell(String raw, boolean numeric) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        if (!numeric) {
            return raw;
        }
        String t = raw.trim();
        if (INTEGER.matcher(t).matches()) {
            try {
                return Long.parseLong(t);
            } catch (NumberFormatException e) {
                return Double.parseDouble(t);
            }
        }
        return Double.parseDouble(t);
    }

    // ---- JSON ----

    private RecordTable readJson(byte[] content) throws IOException {
        JsonNode root = objectMapper.readTree(content);
        JsonNode array = root;
        if (root != null && root.isObject()) {
            JsonNode wrapped = root.has("data") ? root.get("data") : root.get("records");
            if (isRecordArray(wrapped)) {
                array = wrapped;
            } else if (isColumnar(root)) {
                return readColumnarJson(root);
            } else {
                array = null;
            }
        }
        if (array == null || !array.isArray()) {
            throw new DatasetLoadException(
                "JSON dataset must be an array of objects or an object of columns");
        }

        List<String> headers = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode item : array) {
            if (!item.isObject()) {
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (seen.add(field.getKey())) {
                    headers.add(field.getKey());
                }
                row.put(field.getKey(), jsonValue(field.getValue()));
            }
            rows.add(row);
        }
        return RecordTable.of(headers, rows);
    }

    /**
     * Column-oriented JSON: {"col": {"0": v, "1": w}, ...} or {"col": [v, w], ...}.
     * Rows are keyed by index (array position or object key) in first-seen order.
     */
    private RecordTable readColumnarJson(JsonNode root) {
        List<String> headers = new ArrayList<>();
        Map<String, Map<String, Object>> byIndex = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> columns = root.fields();
        while (columns.hasNext()) {
            Map.Entry<String, JsonNode> column = columns.next();
            String header = column.getKey();
            headers.add(header);
            JsonNode values = column.getValue();
            if (values.isArray()) {
                for (int i = 0; i < values.size(); i++) {
                    byIndex.computeIfAbsent(String.valueOf(i), k -> new LinkedHashMap<>())
                        .put(header, jsonValue(values.get(i)));
                }
            } else {
                Iterator<Map.Entry<String, JsonNode>> cells = values.fields();
                while (cells.hasNext()) {
                    Map.Entry<String, JsonNode> cell = cells.next();
                    byIndex.computeIfAbsent(cell.getKey(), k -> new LinkedHashMap<>())
                        .put(header, jsonValue(cell.getValue()));
                }
            }
        }
        log.info("Read column-oriented JSON: {} columns, {} rows", headers.size(), byIndex.size());
        return RecordTable.of(headers, new ArrayList<>(byIndex.values()));
    }

    private static boolean isRecordArray(JsonNode node) {
        if (node == null || !node.isArray()) {
            return false;
        }
        for (JsonNode item : node) {
            if (!item.isObject()) {
                return false;
            }
        }
        return true;
    }

    private static boolean isColumnar(JsonNode root) {
        if (root.size() == 0) {
            return false;
        }
        for (JsonNode column : root) {
            if (!column.isObject() && !column.isArray()) {
                return false;
            }
        }
        return true;
    }

    private static Object jsonValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.asLong();
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return node.toString();
    }

    // ---- Excel ----

    private RecordTable readExcel(byte[] content) throws IOException {
        try (InputStream is = new ByteArrayInputStream(content);
             Workbook workbook = WorkbookFactory.create(is)) {

            Sheet sheet = workbook.getSheetAt(0);
            Row headerRow = sheet.getRow(0);
            if (headerRow == null) {
                return RecordTable.empty();
            }

            List<String> rawHeaders = new ArrayList<>();
            for (int j = 0; j < headerRow.getLastCellNum(); j++) {
                rawHeaders.add(getCellStringValue(headerRow.getCell(j)));
            }
            List<String> headers = uniqueHeaders(rawHeaders);

            List<Map<String, Object>> rows = new ArrayList<>();
            for (int i = 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null) {
                    continue;
                }
                Map<String, Object> record = new LinkedHashMap<>();
                for (int j = 0; j < headers.size(); j++) {
                    record.put(headers.get(j), getCellValue(row.getCell(j)));
                }
                rows.add(record);
            }

            log.info("Read {} rows from Excel sheet '{}'", rows.size(), sheet.getSheetName());
            return RecordTable.of(headers, rows);
        }
    }

    private static String getCellStringValue(Cell cell) {
        if (cell == null) {
            return "";
        }
        switch (cell.getCellType()) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                return String.valueOf((long) cell.getNumericCellValue());
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return "";
        }
    }

    private static Object getCellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        switch (cell.getCellType()) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue();
                }
                double num = cell.getNumericCellValue();
                if (num == Math.floor(num) && !Double.isInfinite(num)) {
                    return (long) num;
                }
                return num;
            case BOOLEAN:
                return cell.getBooleanCellValue();
            case FORMULA:
                try {
                    return cell.getNumericCellValue();
                } catch (IllegalStateException e) {
                    return cell.getStringCellValue();
                }
            default:
                return null;
        }
    }

    // ---- helpers ----

    /** Blank headers become "unnamed: i"; exact repeats get a .1, .2 ... suffix. */
    static List<String> uniqueHeaders(List<String> raw) {
        List<String> headers = new ArrayList<>(raw.size());
        Set<String> used = new HashSet<>();
        for (int i = 0; i < raw.size(); i++) {
            String base = raw.get(i) == null || raw.get(i).isBlank() ? "unnamed: " + i : raw.get(i);
            String name = base;
            int suffix = 1;
            while (!used.add(name)) {
                name = base + "." + suffix++;
            }
            headers.add(name);
        }
        return headers;
    }

    static String extension(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
