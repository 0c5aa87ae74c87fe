package io.github.yok.flexdataio.format.yaml;

import io.github.yok.flexdataio.format.FileCodec;
import io.github.yok.flexdataio.format.FileOptions;
import io.github.yok.flexdataio.util.FileSupport;
import io.github.yok.flexdataio.util.TableSupport;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * Reads and writes a single table as a YAML sequence of mappings using SnakeYAML.
 *
 * <pre>
 * - ID: 10
 *   NAME: Sales
 * - ID: 20
 *   NAME: Support
 * </pre>
 *
 * <p>
 * Scalars keep the types SnakeYAML resolves (integers, floats, booleans, timestamps, strings). The
 * table name is the file base name; an empty sequence yields a table without columns.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
class YamlCodec implements FileCodec<ITable> {

    /**
     * {@inheritDoc}
     */
    @Override
    public ITable decode(Path path, Map<String, Object> options) throws Exception {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setAllowDuplicateKeys(YamlTableReader.ALLOW_DUPLICATE_KEYS.valueIn(options));
        loaderOptions.setMaxAliasesForCollections(
                YamlTableReader.MAX_ALIASES_FOR_COLLECTIONS.valueIn(options));
        Yaml yaml = new Yaml(new SafeConstructor(loaderOptions));

        Object root;
        try (BufferedReader reader = Files.newBufferedReader(path, FileOptions.charset(options))) {
            root = yaml.load(reader);
        }
        if (root == null) {
            root = List.of();
        }
        if (!(root instanceof List)) {
            throw new DataSetException("YAML root must be a sequence of mappings: " + path);
        }
        List<?> records = (List<?>) root;

        // Column order is the order of first appearance across records
        Set<String> names = new LinkedHashSet<>();
        for (Object record : records) {
            if (!(record instanceof Map)) {
                throw new DataSetException("YAML sequence item is not a mapping: " + record);
            }
            for (Object key : ((Map<?, ?>) record).keySet()) {
                names.add(String.valueOf(key));
            }
        }
        List<String> columns = new ArrayList<>(names);
        List<Object[]> rows = new ArrayList<>(records.size());
        for (Object record : records) {
            Map<String, Object> byName = new LinkedHashMap<>();
            ((Map<?, ?>) record).forEach((k, v) -> byName.put(String.valueOf(k), v));
            Object[] row = new Object[columns.size()];
            for (int c = 0; c < row.length; c++) {
                row[c] = byName.get(columns.get(c));
            }
            rows.add(row);
        }
        return TableSupport.fromRows(FileSupport.baseName(path), columns, rows);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void encode(ITable data, Path path, Map<String, Object> options) throws Exception {
        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setIndent(YamlTableWriter.INDENT.valueIn(options));
        dumperOptions.setDefaultFlowStyle(YamlTableWriter.FLOW_STYLE.valueIn(options));
        dumperOptions.setExplicitStart(YamlTableWriter.EXPLICIT_START.valueIn(options));
        Yaml yaml = new Yaml(dumperOptions);

        List<String> columns = TableSupport.columnNames(data);
        List<Map<String, Object>> records = new ArrayList<>();
        for (Object[] row : TableSupport.rows(data)) {
            Map<String, Object> record = new LinkedHashMap<>();
            for (int c = 0; c < columns.size(); c++) {
                record.put(columns.get(c), yamlValue(row[c]));
            }
            records.add(record);
        }
        try (BufferedWriter w = Files.newBufferedWriter(path, FileOptions.charset(options))) {
            yaml.dump(records, w);
        }
    }

    private static Object yamlValue(Object value) {
        if (value == null || value instanceof Integer || value instanceof Long
                || value instanceof Double || value instanceof Boolean || value instanceof String
                || value instanceof byte[]) {
            return value;
        }
        if (value instanceof Date) {
            // Plain java.util.Date so SnakeYAML emits a !!timestamp scalar
            return new Date(((Date) value).getTime());
        }
        return value.toString();
    }
}
