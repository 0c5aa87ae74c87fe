package io.github.yok.flexdataio.format.sql;

import io.github.yok.flexdataio.util.TableSupport;
import java.sql.Types;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.datatype.DataType;

/**
 * Maps DBUnit column types to portable DDL types used when the SQL writer creates a table.
 *
 * <p>
 * Character and binary columns get a length of at least 255, widened to the longest value. Columns
 * of unknown type take the type of their first non-null value.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
final class SqlTypeMapper {

    private static final int MIN_LENGTH = 255;

    private SqlTypeMapper() {
        // Utility class; do not instantiate.
    }

    /**
     * Returns the DDL type of a column.
     *
     * @param table table holding the column
     * @param column column
     * @return DDL type text, e.g. {@code VARCHAR(255)}
     * @throws DataSetException if column values cannot be read
     */
    static String ddlType(ITable table, Column column) throws DataSetException {
        DataType type = column.getDataType();
        if (type == DataType.UNKNOWN) {
            type = firstValueType(table, column.getColumnName());
        }
        switch (type.getSqlType()) {
            case Types.INTEGER:
            case Types.SMALLINT:
            case Types.TINYINT:
                return "INTEGER";
            case Types.BIGINT:
                return "BIGINT";
            case Types.DOUBLE:
            case Types.FLOAT:
                return "DOUBLE PRECISION";
            case Types.REAL:
                return "REAL";
            case Types.DECIMAL:
            case Types.NUMERIC:
                return "DECIMAL(38,10)";
            case Types.BOOLEAN:
            case Types.BIT:
                return "BOOLEAN";
            case Types.DATE:
                return "DATE";
            case Types.TIME:
                return "TIME";
            case Types.TIMESTAMP:
                return "TIMESTAMP";
            case Types.BINARY:
            case Types.VARBINARY:
            case Types.LONGVARBINARY:
            case Types.BLOB:
                return "VARBINARY(" + maxLength(table, column.getColumnName(), true) + ")";
            default:
                return "VARCHAR(" + maxLength(table, column.getColumnName(), false) + ")";
        }
    }

    private static DataType firstValueType(ITable table, String columnName)
            throws DataSetException {
        for (int r = 0; r < table.getRowCount(); r++) {
            Object value = table.getValue(r, columnName);
            if (value != null) {
                return TableSupport.dataTypeOf(value.getClass());
            }
        }
        return DataType.VARCHAR;
    }

    private static int maxLength(ITable table, String columnName, boolean binary)
            throws DataSetException {
        int max = MIN_LENGTH;
        for (int r = 0; r < table.getRowCount(); r++) {
            Object value = table.getValue(r, columnName);
            if (value == null) {
                continue;
            }
            int length = binary && value instanceof byte[] ? ((byte[]) value).length
                    : value.toString().length();
            max = Math.max(max, length);
        }
        return max;
    }
}
