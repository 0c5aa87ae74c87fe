package io.github.yok.flexdataio.format.csv;

import io.github.yok.flexdataio.format.FileCodec;
import io.github.yok.flexdataio.format.FileOptions;
import io.github.yok.flexdataio.util.ColumnTypeInference;
import io.github.yok.flexdataio.util.FileSupport;
import io.github.yok.flexdataio.util.TableSupport;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;

/**
 * Reads and writes a single table as CSV using Apache Commons CSV.
 *
 * <p>
 * The table name of a decoded table is the file base name. Binary values are written as upper-case
 * hexadecimal text; other values through {@code toString()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
class CsvCodec implements FileCodec<ITable> {

    /**
     * {@inheritDoc}
     */
    @Override
    public ITable decode(Path path, Map<String, Object> options) throws Exception {
        CSVFormat fmt = CSVFormat.DEFAULT.builder()
                .setDelimiter(CsvOptions.DELIMITER.valueIn(options))
                .setQuote(CsvOptions.QUOTE.valueIn(options))
                .setEscape(CsvOptions.ESCAPE.valueIn(options))
                .setNullString(CsvOptions.NULL_STRING.valueIn(options))
                .setIgnoreEmptyLines(CsvTableReader.IGNORE_EMPTY_LINES.valueIn(options))
                .setTrim(CsvTableReader.TRIM.valueIn(options)).get();
        boolean header = CsvOptions.HEADER.valueIn(options);
        int skipRows = CsvTableReader.SKIP_ROWS.valueIn(options);

        List<String[]> records = new ArrayList<>();
        try (BufferedReader reader =
                Files.newBufferedReader(path, FileOptions.charset(options))) {
            // Leading lines are skipped before the header is read
            for (int i = 0; i < skipRows; i++) {
                if (reader.readLine() == null) {
                    break;
                }
            }
            try (CSVParser parser = fmt.parse(reader)) {
                for (CSVRecord record : parser) {
                    records.add(record.values());
                }
            }
        }

        List<String> columns = new ArrayList<>();
        List<String[]> rows = records;
        if (header) {
            if (records.isEmpty()) {
                throw new DataSetException("CSV file has no header record: " + path);
            }
            columns.addAll(Arrays.asList(records.get(0)));
            rows = records.subList(1, records.size());
        } else {
            int width = records.stream().mapToInt(r -> r.length).max().orElse(0);
            for (int c = 0; c < width; c++) {
                columns.add("col" + (c + 1));
            }
        }
        return ColumnTypeInference.toTable(FileSupport.baseName(path), columns, rows,
                CsvTableReader.INFER_TYPES.valueIn(options));
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void encode(ITable data, Path path, Map<String, Object> options) throws Exception {
        List<String> columns = TableSupport.columnNames(data);
        CSVFormat.Builder builder = CSVFormat.DEFAULT.builder()
                .setDelimiter(CsvOptions.DELIMITER.valueIn(options))
                .setQuote(CsvOptions.QUOTE.valueIn(options))
                .setEscape(CsvOptions.ESCAPE.valueIn(options))
                .setQuoteMode(CsvTableWriter.QUOTE_MODE.valueIn(options))
                .setRecordSeparator(CsvTableWriter.RECORD_SEPARATOR.valueIn(options))
                .setNullString(CsvOptions.NULL_STRING.valueIn(options));
        if (CsvOptions.HEADER.valueIn(options)) {
            builder.setHeader(columns.toArray(new String[0]));
        }
        try (BufferedWriter w = Files.newBufferedWriter(path, FileOptions.charset(options));
                CSVPrinter printer = new CSVPrinter(w, builder.get())) {
            for (Object[] row : TableSupport.rows(data)) {
                List<Object> cells = new ArrayList<>(row.length);
                for (Object value : row) {
                    cells.add(value instanceof byte[]
                            ? Hex.encodeHexString((byte[]) value).toUpperCase()
                            : value);
                }
                printer.printRecord(cells);
            }
        }
    }
}
