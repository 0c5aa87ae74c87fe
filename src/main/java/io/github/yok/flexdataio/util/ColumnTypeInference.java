package io.github.yok.flexdataio.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.datatype.DataType;

/**
 * Infers column types for text-based formats (CSV, JSON, HTML) and converts cell text to values.
 *
 * <p>
 * Rules, applied per column to its non-empty cells:
 * </p>
 * <ul>
 * <li>all integers: {@code INTEGER}, or {@code BIGINT} when a value exceeds the int range</li>
 * <li>all decimal numbers: {@code DOUBLE}</li>
 * <li>all {@code true}/{@code false} (case-insensitive): {@code BOOLEAN}</li>
 * <li>otherwise: {@code VARCHAR}</li>
 * </ul>
 * <p>
 * Empty cells always become {@code null}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ColumnTypeInference {

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");

    private static final Pattern DECIMAL =
            Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private ColumnTypeInference() {
        // Utility class; do not instantiate.
    }

    /**
     * Builds a table from text cells.
     *
     * @param tableName table name
     * @param columnNames ordered column names
     * @param rows text cells; short rows are padded with {@code null}
     * @param inferTypes whether to infer column types; when {@code false} every column is
     *        {@code VARCHAR}
     * @return a new table
     * @throws DataSetException if a row cannot be added
     */
    public static DefaultTable toTable(String tableName, List<String> columnNames,
            List<String[]> rows, boolean inferTypes) throws DataSetException {
        List<DataType> types = new ArrayList<>(columnNames.size());
        for (int c = 0; c < columnNames.size(); c++) {
            types.add(inferTypes ? infer(column(rows, c)) : DataType.VARCHAR);
        }
        List<Object[]> values = new ArrayList<>(rows.size());
        for (String[] row : rows) {
            Object[] out = new Object[columnNames.size()];
            for (int c = 0; c < out.length; c++) {
                out[c] = convert(c < row.length ? row[c] : null, types.get(c));
            }
            values.add(out);
        }
        return TableSupport.newTable(tableName, columnNames, types, values);
    }

    /**
     * Infers the type of one column.
     *
     * @param cells cell text; {@code null} and empty cells are ignored
     * @return the inferred type; {@code VARCHAR} when the column has no non-empty cell
     */
    public static DataType infer(List<String> cells) {
        boolean any = false;
        boolean integers = true;
        boolean longs = false;
        boolean decimals = true;
        boolean booleans = true;
        for (String cell : cells) {
            if (StringUtils.isEmpty(cell)) {
                continue;
            }
            any = true;
            String text = cell.trim();
            if (INTEGER.matcher(text).matches()) {
                try {
                    long value = Long.parseLong(text);
                    longs |= value != (int) value;
                } catch (NumberFormatException e) {
                    // Beyond long range; keep as text
                    integers = false;
                    decimals = false;
                }
            } else {
                integers = false;
                decimals &= DECIMAL.matcher(text).matches();
            }
            booleans &= "true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text);
        }
        if (!any) {
            return DataType.VARCHAR;
        }
        if (integers) {
            return longs ? DataType.BIGINT_AUX_LONG : DataType.INTEGER;
        }
        if (decimals) {
            return DataType.DOUBLE;
        }
        return booleans ? DataType.BOOLEAN : DataType.VARCHAR;
    }

    /**
     * Converts one cell to a value of the given type.
     *
     * @param cell cell text
     * @param type column type returned by {@link #infer(List)}
     * @return the value, or {@code null} for an empty cell
     */
    public static Object convert(String cell, DataType type) {
        if (StringUtils.isEmpty(cell)) {
            return null;
        }
        if (type == DataType.INTEGER) {
            return Integer.valueOf(cell.trim());
        }
        if (type == DataType.BIGINT_AUX_LONG) {
            return Long.valueOf(cell.trim());
        }
        if (type == DataType.DOUBLE) {
            return Double.valueOf(cell.trim());
        }
        if (type == DataType.BOOLEAN) {
            return Boolean.valueOf(cell.trim());
        }
        return cell;
    }

    private static List<String> column(List<String[]> rows, int c) {
        List<String> cells = new ArrayList<>(rows.size());
        for (String[] row : rows) {
            cells.add(c < row.length ? row[c] : null);
        }
        return cells;
    }
}
