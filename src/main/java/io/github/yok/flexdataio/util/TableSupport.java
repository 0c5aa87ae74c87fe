package io.github.yok.flexdataio.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.DefaultTableMetaData;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.NoSuchTableException;
import org.dbunit.dataset.datatype.DataType;

/**
 * Helpers for building and reading DBUnit tables, the in-memory representation every adapter
 * produces or consumes.
 *
 * @author Yasuharu.Okawauchi
 */
public final class TableSupport {

    private TableSupport() {
        // Utility class; do not instantiate.
    }

    /**
     * Builds a table from column-oriented data. Column types are derived from the Java classes of
     * the values (see {@link #dataTypeOf(Class)}).
     *
     * @param tableName table name
     * @param columns column name to values, in column order; all lists must have equal length
     * @return a new table
     * @throws DataSetException if the table cannot be built
     * @throws IllegalArgumentException if the columns differ in length
     */
    public static DefaultTable fromColumns(String tableName,
            Map<String, ? extends List<?>> columns) throws DataSetException {
        List<String> names = new ArrayList<>(columns.keySet());
        int rowCount = -1;
        for (Map.Entry<String, ? extends List<?>> entry : columns.entrySet()) {
            int size = entry.getValue().size();
            if (rowCount >= 0 && size != rowCount) {
                throw new IllegalArgumentException("Column '" + entry.getKey() + "' has " + size
                        + " values but previous columns have " + rowCount);
            }
            rowCount = size;
        }
        List<Object[]> rows = new ArrayList<>();
        for (int r = 0; r < Math.max(rowCount, 0); r++) {
            Object[] row = new Object[names.size()];
            int c = 0;
            for (List<?> values : columns.values()) {
                row[c++] = values.get(r);
            }
            rows.add(row);
        }
        return fromRows(tableName, names, rows);
    }

    /**
     * Builds a table from row-oriented data, deriving each column type from its values.
     *
     * <p>
     * A column whose non-null values share one class takes the type of that class; a mix of
     * integral numbers becomes {@code BIGINT}, any other numeric mix {@code DOUBLE}, and anything
     * else {@code VARCHAR} with the values rendered as text. An all-null column is {@code VARCHAR}.
     * </p>
     *
     * @param tableName table name
     * @param columnNames ordered column names
     * @param rows row values aligned with {@code columnNames}
     * @return a new table
     * @throws DataSetException if the table cannot be built
     */
    public static DefaultTable fromRows(String tableName, List<String> columnNames,
            List<Object[]> rows) throws DataSetException {
        DataType[] types = new DataType[columnNames.size()];
        for (int c = 0; c < types.length; c++) {
            types[c] = unify(rows, c);
        }
        List<Object[]> converted = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            Object[] out = new Object[types.length];
            for (int c = 0; c < types.length; c++) {
                out[c] = coerce(c < row.length ? row[c] : null, types[c]);
            }
            converted.add(out);
        }
        return newTable(tableName, columnNames, List.of(types), converted);
    }

    /**
     * Builds a table whose column types are already known. Values are stored as given.
     *
     * @param tableName table name
     * @param columnNames ordered column names
     * @param types column types aligned with {@code columnNames}
     * @param rows row values
     * @return a new table
     * @throws DataSetException if a row cannot be added
     */
    public static DefaultTable newTable(String tableName, List<String> columnNames,
            List<DataType> types, List<Object[]> rows) throws DataSetException {
        Column[] columns = new Column[columnNames.size()];
        for (int c = 0; c < columns.length; c++) {
            columns[c] = new Column(columnNames.get(c), types.get(c));
        }
        DefaultTable table = new DefaultTable(new DefaultTableMetaData(tableName, columns));
        for (Object[] row : rows) {
            table.addRow(row);
        }
        return table;
    }

    /**
     * Maps a Java value class to a DBUnit data type.
     *
     * @param type value class
     * @return the data type; {@code VARCHAR} for unmapped classes
     */
    public static DataType dataTypeOf(Class<?> type) {
        if (type == Integer.class || type == Short.class || type == Byte.class) {
            return DataType.INTEGER;
        }
        if (type == Long.class || type == BigInteger.class) {
            return DataType.BIGINT_AUX_LONG;
        }
        if (type == Double.class) {
            return DataType.DOUBLE;
        }
        if (type == Float.class) {
            return DataType.REAL;
        }
        if (type == BigDecimal.class) {
            return DataType.DECIMAL;
        }
        if (type == Boolean.class) {
            return DataType.BOOLEAN;
        }
        if (type == java.sql.Date.class || type == LocalDate.class) {
            return DataType.DATE;
        }
        if (type == java.sql.Timestamp.class || type == java.util.Date.class
                || type == Instant.class || type == LocalDateTime.class) {
            return DataType.TIMESTAMP;
        }
        if (type == byte[].class) {
            return DataType.BINARY;
        }
        return DataType.VARCHAR;
    }

    /**
     * Returns the column names of a table in column order.
     *
     * @param table table
     * @return column names
     * @throws DataSetException if the metadata cannot be read
     */
    public static List<String> columnNames(ITable table) throws DataSetException {
        List<String> names = new ArrayList<>();
        for (Column column : table.getTableMetaData().getColumns()) {
            names.add(column.getColumnName());
        }
        return names;
    }

    /**
     * Reads every row of a table.
     *
     * @param table table
     * @return row values in column order
     * @throws DataSetException if a value cannot be read
     */
    public static List<Object[]> rows(ITable table) throws DataSetException {
        Column[] columns = table.getTableMetaData().getColumns();
        List<Object[]> rows = new ArrayList<>(table.getRowCount());
        for (int r = 0; r < table.getRowCount(); r++) {
            Object[] row = new Object[columns.length];
            for (int c = 0; c < columns.length; c++) {
                row[c] = table.getValue(r, columns[c].getColumnName());
            }
            rows.add(row);
        }
        return rows;
    }

    /**
     * Selects a table from a data set.
     *
     * @param dataSet data set
     * @param tableName table to select, or {@code null} for the first table
     * @return the table
     * @throws DataSetException if the data set is empty or has no such table
     */
    public static ITable selectTable(IDataSet dataSet, String tableName)
            throws DataSetException {
        if (tableName != null) {
            return dataSet.getTable(tableName);
        }
        String[] names = dataSet.getTableNames();
        if (names.length == 0) {
            throw new NoSuchTableException("Document contains no table");
        }
        return dataSet.getTable(names[0]);
    }

    /**
     * Selects a table from a data set by position.
     *
     * @param dataSet data set
     * @param index zero-based table index
     * @return the table
     * @throws DataSetException if there is no table at that position
     */
    public static ITable selectTable(IDataSet dataSet, int index) throws DataSetException {
        String[] names = dataSet.getTableNames();
        if (index < 0 || index >= names.length) {
            throw new NoSuchTableException(
                    "No table at index " + index + "; document contains " + names.length);
        }
        return dataSet.getTable(names[index]);
    }

    private static DataType unify(List<Object[]> rows, int c) {
        Class<?> common = null;
        boolean integral = true;
        boolean numeric = true;
        for (Object[] row : rows) {
            Object value = c < row.length ? row[c] : null;
            if (value == null) {
                continue;
            }
            Class<?> cls = value.getClass();
            common = common == null || common == cls ? cls : Object.class;
            integral &= value instanceof Integer || value instanceof Long
                    || value instanceof Short || value instanceof Byte
                    || value instanceof BigInteger;
            numeric &= value instanceof Number;
        }
        if (common == null) {
            return DataType.VARCHAR;
        }
        if (common != Object.class) {
            return dataTypeOf(common);
        }
        if (integral) {
            return DataType.BIGINT_AUX_LONG;
        }
        return numeric ? DataType.DOUBLE : DataType.VARCHAR;
    }

    private static Object coerce(Object value, DataType type) {
        if (value == null) {
            return null;
        }
        if (type == DataType.VARCHAR && !(value instanceof String)) {
            return value.toString();
        }
        if (type == DataType.BIGINT_AUX_LONG && !(value instanceof Long)) {
            return ((Number) value).longValue();
        }
        if (type == DataType.INTEGER && !(value instanceof Integer)) {
            return ((Number) value).intValue();
        }
        if (type == DataType.DOUBLE && !(value instanceof Double)) {
            return ((Number) value).doubleValue();
        }
        return value;
    }
}
