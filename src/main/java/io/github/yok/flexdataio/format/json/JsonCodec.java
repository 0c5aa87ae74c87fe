package io.github.yok.flexdataio.format.json;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.github.yok.flexdataio.format.FileCodec;
import io.github.yok.flexdataio.format.FileOptions;
import io.github.yok.flexdataio.util.FileSupport;
import io.github.yok.flexdataio.util.TableSupport;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.codec.binary.Hex;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;

/**
 * Reads and writes a single table as JSON using Jackson.
 *
 * <p>
 * When reading with {@code inferTypes}, JSON numbers become {@code Integer}, {@code Long} or
 * {@code Double} and JSON booleans {@code Boolean}; without it every value is read as text. Nested
 * objects and arrays are kept as their JSON text. The table name is the file base name.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
class JsonCodec implements FileCodec<ITable> {

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * {@inheritDoc}
     */
    @Override
    public ITable decode(Path path, Map<String, Object> options) throws Exception {
        JsonNode root;
        try (BufferedReader reader = Files.newBufferedReader(path, FileOptions.charset(options))) {
            root = mapper.readTree(reader);
        }
        if (root == null || root.isMissingNode()) {
            throw new DataSetException("JSON file is empty: " + path);
        }
        boolean infer = JsonTableReader.INFER_TYPES.valueIn(options);
        List<String> columns = new ArrayList<>();
        List<Object[]> rows = new ArrayList<>();
        switch (JsonOptions.ORIENT.valueIn(options)) {
            case COLUMNS:
                readColumns(root, infer, columns, rows);
                break;
            case SPLIT:
                readSplit(root, infer, columns, rows);
                break;
            case RECORDS:
            default:
                readRecords(root, infer, columns, rows);
                break;
        }
        return TableSupport.fromRows(FileSupport.baseName(path), columns, rows);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void encode(ITable data, Path path, Map<String, Object> options) throws Exception {
        List<String> columns = TableSupport.columnNames(data);
        List<Object[]> rows = TableSupport.rows(data);
        Object document;
        switch (JsonOptions.ORIENT.valueIn(options)) {
            case COLUMNS:
                Map<String, List<Object>> byColumn = new LinkedHashMap<>();
                for (int c = 0; c < columns.size(); c++) {
                    List<Object> values = new ArrayList<>(rows.size());
                    for (Object[] row : rows) {
                        values.add(jsonValue(row[c]));
                    }
                    byColumn.put(columns.get(c), values);
                }
                document = byColumn;
                break;
            case SPLIT:
                List<List<Object>> matrix = new ArrayList<>(rows.size());
                for (Object[] row : rows) {
                    List<Object> values = new ArrayList<>(row.length);
                    for (Object value : row) {
                        values.add(jsonValue(value));
                    }
                    matrix.add(values);
                }
                Map<String, Object> split = new LinkedHashMap<>();
                split.put("columns", columns);
                split.put("data", matrix);
                document = split;
                break;
            case RECORDS:
            default:
                List<Map<String, Object>> records = new ArrayList<>(rows.size());
                for (Object[] row : rows) {
                    Map<String, Object> record = new LinkedHashMap<>();
                    for (int c = 0; c < columns.size(); c++) {
                        record.put(columns.get(c), jsonValue(row[c]));
                    }
                    records.add(record);
                }
                document = records;
                break;
        }
        try (BufferedWriter w = Files.newBufferedWriter(path, FileOptions.charset(options))) {
            writer(JsonTableWriter.INDENT.valueIn(options)).writeValue(w, document);
        }
    }

    private ObjectWriter writer(Integer indent) {
        if (indent == null) {
            return mapper.writer();
        }
        DefaultIndenter indenter = new DefaultIndenter(" ".repeat(indent), DefaultIndenter.SYS_LF);
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter();
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        return mapper.writer(printer);
    }

    private static void readRecords(JsonNode root, boolean infer, List<String> columns,
            List<Object[]> rows) throws DataSetException {
        if (!root.isArray()) {
            throw new DataSetException("orient=records expects a JSON array");
        }
        // Column order is the order of first appearance across records
        Set<String> names = new LinkedHashSet<>();
        for (JsonNode record : root) {
            if (!record.isObject()) {
                throw new DataSetException("orient=records expects an array of objects");
            }
            record.fieldNames().forEachRemaining(names::add);
        }
        columns.addAll(names);
        for (JsonNode record : root) {
            Object[] row = new Object[columns.size()];
            for (int c = 0; c < row.length; c++) {
                row[c] = javaValue(record.get(columns.get(c)), infer);
            }
            rows.add(row);
        }
    }

    private static void readColumns(JsonNode root, boolean infer, List<String> columns,
            List<Object[]> rows) throws DataSetException {
        if (!root.isObject()) {
            throw new DataSetException("orient=columns expects a JSON object");
        }
        List<List<JsonNode>> values = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        int rowCount = 0;
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            List<JsonNode> cells = new ArrayList<>();
            field.getValue().elements().forEachRemaining(cells::add);
            columns.add(field.getKey());
            values.add(cells);
            rowCount = Math.max(rowCount, cells.size());
        }
        for (int r = 0; r < rowCount; r++) {
            Object[] row = new Object[columns.size()];
            for (int c = 0; c < row.length; c++) {
                List<JsonNode> cells = values.get(c);
                row[c] = r < cells.size() ? javaValue(cells.get(r), infer) : null;
            }
            rows.add(row);
        }
    }

    private static void readSplit(JsonNode root, boolean infer, List<String> columns,
            List<Object[]> rows) throws DataSetException {
        JsonNode names = root.path("columns");
        JsonNode data = root.path("data");
        if (!names.isArray() || !data.isArray()) {
            throw new DataSetException(
                    "orient=split expects an object with 'columns' and 'data' arrays");
        }
        names.forEach(n -> columns.add(n.asText()));
        for (JsonNode values : data) {
            Object[] row = new Object[columns.size()];
            for (int c = 0; c < row.length; c++) {
                row[c] = javaValue(values.get(c), infer);
            }
            rows.add(row);
        }
    }

    private static Object javaValue(JsonNode node, boolean infer) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isContainerNode()) {
            return node.toString();
        }
        if (!infer) {
            return node.asText();
        }
        if (node.isIntegralNumber()) {
            if (node.canConvertToInt()) {
                return node.intValue();
            }
            return node.canConvertToLong() ? (Object) node.longValue() : node.asText();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.asText();
    }

    private static Object jsonValue(Object value) {
        if (value == null || value instanceof Number || value instanceof Boolean
                || value instanceof String) {
            return value;
        }
        if (value instanceof byte[]) {
            return Hex.encodeHexString((byte[]) value).toUpperCase();
        }
        return value.toString();
    }
}
