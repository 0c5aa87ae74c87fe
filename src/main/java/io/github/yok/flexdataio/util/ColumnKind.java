package io.github.yok.flexdataio.util;

import java.sql.Date;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.datatype.DataType;

/**
 * Storage class of a table column in the columnar file formats.
 *
 * <p>
 * A column's DBUnit type is reduced to one of these kinds; a column of unknown type takes the kind
 * of its first non-null value. {@link #normalize(Object)} converts a cell to the single Java class
 * the kind is stored as.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
public enum ColumnKind {

    // String
    STRING(DataType.VARCHAR),
    // Integer
    INT(DataType.INTEGER),
    // Long
    LONG(DataType.BIGINT_AUX_LONG),
    // Double
    DOUBLE(DataType.DOUBLE),
    // Float
    FLOAT(DataType.REAL),
    // Boolean
    BOOLEAN(DataType.BOOLEAN),
    // java.sql.Date
    DATE(DataType.DATE),
    // java.sql.Timestamp
    TIMESTAMP(DataType.TIMESTAMP),
    // byte[]
    BINARY(DataType.BINARY);

    // DBUnit type of columns read back with this kind
    private final DataType dataType;

    /**
     * Resolves the kind of a column.
     *
     * @param table table holding the column
     * @param column column
     * @return the column kind
     * @throws DataSetException if column values cannot be read
     */
    public static ColumnKind of(ITable table, Column column) throws DataSetException {
        DataType type = column.getDataType();
        if (type == DataType.UNKNOWN) {
            type = DataType.VARCHAR;
            for (int r = 0; r < table.getRowCount(); r++) {
                Object value = table.getValue(r, column.getColumnName());
                if (value != null) {
                    type = TableSupport.dataTypeOf(value.getClass());
                    break;
                }
            }
        }
        switch (type.getSqlType()) {
            case Types.INTEGER:
            case Types.SMALLINT:
            case Types.TINYINT:
                return INT;
            case Types.BIGINT:
                return LONG;
            case Types.DOUBLE:
            case Types.FLOAT:
            case Types.DECIMAL:
            case Types.NUMERIC:
                return DOUBLE;
            case Types.REAL:
                return FLOAT;
            case Types.BOOLEAN:
            case Types.BIT:
                return BOOLEAN;
            case Types.DATE:
                return DATE;
            case Types.TIMESTAMP:
                return TIMESTAMP;
            case Types.BINARY:
            case Types.VARBINARY:
            case Types.LONGVARBINARY:
            case Types.BLOB:
                return BINARY;
            default:
                return STRING;
        }
    }

    /**
     * Converts a cell value to this kind's Java class.
     *
     * @param value cell value (may be {@code null})
     * @return the converted value, or {@code null}
     * @throws DataSetException if the value cannot be converted
     */
    public Object normalize(Object value) throws DataSetException {
        if (value == null) {
            return null;
        }
        switch (this) {
            case INT:
                return ((Number) DataType.INTEGER.typeCast(value)).intValue();
            case LONG:
                return ((Number) DataType.BIGINT_AUX_LONG.typeCast(value)).longValue();
            case DOUBLE:
                return ((Number) DataType.DOUBLE.typeCast(value)).doubleValue();
            case FLOAT:
                return ((Number) DataType.REAL.typeCast(value)).floatValue();
            case BOOLEAN:
                return DataType.BOOLEAN.typeCast(value);
            case DATE:
                if (value instanceof LocalDate) {
                    return Date.valueOf((LocalDate) value);
                }
                return DataType.DATE.typeCast(value);
            case TIMESTAMP:
                if (value instanceof Instant) {
                    return Timestamp.from((Instant) value);
                }
                if (value instanceof LocalDateTime) {
                    return Timestamp.valueOf((LocalDateTime) value);
                }
                return DataType.TIMESTAMP.typeCast(value);
            case BINARY:
                return DataType.BINARY.typeCast(value);
            default:
                return value.toString();
        }
    }
}
