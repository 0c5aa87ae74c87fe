package io.github.yok.flexdataio.format.avro;

import io.github.yok.flexdataio.util.TableSupport;
import java.nio.ByteBuffer;
import java.sql.Date;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.datatype.DataType;

/**
 * Mapping between DBUnit tables and Avro records, shared by the Avro and Parquet codecs.
 *
 * <p>
 * Every column becomes a nullable field:
 * </p>
 * <ul>
 * <li>VARCHAR and other character types: {@code string}</li>
 * <li>INTEGER, SMALLINT, TINYINT: {@code int}</li>
 * <li>BIGINT: {@code long}</li>
 * <li>DOUBLE, FLOAT, DECIMAL, NUMERIC: {@code double}</li>
 * <li>REAL: {@code float}</li>
 * <li>BOOLEAN, BIT: {@code boolean}</li>
 * <li>DATE: {@code int} with logical type {@code date}</li>
 * <li>TIMESTAMP: {@code long} with logical type {@code timestamp-millis}</li>
 * <li>BINARY, VARBINARY, LONGVARBINARY, BLOB: {@code bytes}</li>
 * </ul>
 * <p>
 * A column of unknown type takes the type of its first non-null value. Column names that are not
 * valid Avro names are sanitized; the original name is kept in the field property
 * {@value #COLUMN_PROPERTY} and restored on read.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class AvroSchemas {

    // Field property holding the original column name
    public static final String COLUMN_PROPERTY = "column";

    private static final Pattern AVRO_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private AvroSchemas() {
        // Utility class; do not instantiate.
    }

    /**
     * Derives the record schema of a table.
     *
     * @param table table
     * @return record schema named after the table
     * @throws DataSetException if the table cannot be read
     */
    public static Schema toSchema(ITable table) throws DataSetException {
        SchemaBuilder.FieldAssembler<Schema> fields =
                SchemaBuilder.record(avroName(table.getTableMetaData().getTableName())).fields();
        for (Column column : table.getTableMetaData().getColumns()) {
            String name = column.getColumnName();
            Schema type = Schema.createUnion(Schema.create(Schema.Type.NULL),
                    fieldType(table, column));
            SchemaBuilder.FieldBuilder<Schema> field = fields.name(avroName(name));
            if (!AVRO_NAME.matcher(name).matches()) {
                field = field.prop(COLUMN_PROPERTY, name);
            }
            fields = field.type(type).withDefault(null);
        }
        return fields.endRecord();
    }

    /**
     * Converts the rows of a table to records of the given schema.
     *
     * @param table table
     * @param schema schema returned by {@link #toSchema(ITable)}
     * @return one record per row
     * @throws DataSetException if a value cannot be read or converted
     */
    public static List<GenericRecord> toRecords(ITable table, Schema schema)
            throws DataSetException {
        Column[] columns = table.getTableMetaData().getColumns();
        List<Schema.Field> fields = schema.getFields();
        List<GenericRecord> records = new ArrayList<>(table.getRowCount());
        for (int r = 0; r < table.getRowCount(); r++) {
            GenericData.Record record = new GenericData.Record(schema);
            for (int c = 0; c < columns.length; c++) {
                Object value = table.getValue(r, columns[c].getColumnName());
                record.put(c, toAvro(value, valueSchema(fields.get(c).schema())));
            }
            records.add(record);
        }
        return records;
    }

    /**
     * Builds a table from records.
     *
     * @param tableName table name
     * @param schema record schema
     * @param records records of {@code schema}
     * @return a new table
     * @throws DataSetException if the table cannot be built
     */
    public static ITable toTable(String tableName, Schema schema, List<GenericRecord> records)
            throws DataSetException {
        List<String> names = new ArrayList<>();
        List<DataType> types = new ArrayList<>();
        for (Schema.Field field : schema.getFields()) {
            String original = field.getProp(COLUMN_PROPERTY);
            names.add(original != null ? original : field.name());
            types.add(dataTypeOf(valueSchema(field.schema())));
        }
        List<Object[]> rows = new ArrayList<>(records.size());
        for (GenericRecord record : records) {
            Object[] row = new Object[names.size()];
            int c = 0;
            for (Schema.Field field : schema.getFields()) {
                row[c++] = fromAvro(record.get(field.name()), valueSchema(field.schema()));
            }
            rows.add(row);
        }
        return TableSupport.newTable(tableName, names, types, rows);
    }

    /**
     * Returns the non-null branch of a nullable union, or the schema itself.
     *
     * @param schema field schema
     * @return value schema
     */
    static Schema valueSchema(Schema schema) {
        if (schema.getType() != Schema.Type.UNION) {
            return schema;
        }
        for (Schema branch : schema.getTypes()) {
            if (branch.getType() != Schema.Type.NULL) {
                return branch;
            }
        }
        return schema;
    }

    private static Schema fieldType(ITable table, Column column) throws DataSetException {
        int sqlType = column.getDataType().getSqlType();
        if (column.getDataType() == DataType.UNKNOWN) {
            sqlType = firstValueType(table, column).getSqlType();
        }
        switch (sqlType) {
            case Types.INTEGER:
            case Types.SMALLINT:
            case Types.TINYINT:
                return Schema.create(Schema.Type.INT);
            case Types.BIGINT:
                return Schema.create(Schema.Type.LONG);
            case Types.DOUBLE:
            case Types.FLOAT:
            case Types.DECIMAL:
            case Types.NUMERIC:
                return Schema.create(Schema.Type.DOUBLE);
            case Types.REAL:
                return Schema.create(Schema.Type.FLOAT);
            case Types.BOOLEAN:
            case Types.BIT:
                return Schema.create(Schema.Type.BOOLEAN);
            case Types.DATE:
                return LogicalTypes.date().addToSchema(Schema.create(Schema.Type.INT));
            case Types.TIMESTAMP:
                return LogicalTypes.timestampMillis()
                        .addToSchema(Schema.create(Schema.Type.LONG));
            case Types.BINARY:
            case Types.VARBINARY:
            case Types.LONGVARBINARY:
            case Types.BLOB:
                return Schema.create(Schema.Type.BYTES);
            default:
                return Schema.create(Schema.Type.STRING);
        }
    }

    private static DataType firstValueType(ITable table, Column column)
            throws DataSetException {
        for (int r = 0; r < table.getRowCount(); r++) {
            Object value = table.getValue(r, column.getColumnName());
            if (value != null) {
                return TableSupport.dataTypeOf(value.getClass());
            }
        }
        return DataType.VARCHAR;
    }

    private static Object toAvro(Object value, Schema schema) throws DataSetException {
        if (value == null) {
            return null;
        }
        LogicalType logical = schema.getLogicalType();
        if (logical instanceof LogicalTypes.Date) {
            LocalDate date = value instanceof LocalDate ? (LocalDate) value
                    : ((Date) DataType.DATE.typeCast(value)).toLocalDate();
            return (int) date.toEpochDay();
        }
        if (logical instanceof LogicalTypes.TimestampMillis) {
            if (value instanceof Instant) {
                return ((Instant) value).toEpochMilli();
            }
            if (value instanceof LocalDateTime) {
                return Timestamp.valueOf((LocalDateTime) value).getTime();
            }
            return ((Timestamp) DataType.TIMESTAMP.typeCast(value)).getTime();
        }
        switch (schema.getType()) {
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
            case BYTES:
                return ByteBuffer.wrap((byte[]) DataType.BINARY.typeCast(value));
            default:
                return value.toString();
        }
    }

    private static Object fromAvro(Object value, Schema schema) {
        if (value == null) {
            return null;
        }
        LogicalType logical = schema.getLogicalType();
        if (logical instanceof LogicalTypes.Date) {
            LocalDate date = value instanceof LocalDate ? (LocalDate) value
                    : LocalDate.ofEpochDay(((Number) value).longValue());
            return Date.valueOf(date);
        }
        if (logical instanceof LogicalTypes.TimestampMillis) {
            long millis = value instanceof Instant ? ((Instant) value).toEpochMilli()
                    : ((Number) value).longValue();
            return new Timestamp(millis);
        }
        if (value instanceof ByteBuffer) {
            ByteBuffer buffer = ((ByteBuffer) value).duplicate();
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            return bytes;
        }
        if (value instanceof CharSequence) {
            return value.toString();
        }
        return value;
    }

    private static DataType dataTypeOf(Schema schema) {
        LogicalType logical = schema.getLogicalType();
        if (logical instanceof LogicalTypes.Date) {
            return DataType.DATE;
        }
        if (logical instanceof LogicalTypes.TimestampMillis) {
            return DataType.TIMESTAMP;
        }
        switch (schema.getType()) {
            case INT:
                return DataType.INTEGER;
            case LONG:
                return DataType.BIGINT_AUX_LONG;
            case DOUBLE:
                return DataType.DOUBLE;
            case FLOAT:
                return DataType.REAL;
            case BOOLEAN:
                return DataType.BOOLEAN;
            case BYTES:
                return DataType.BINARY;
            default:
                return DataType.VARCHAR;
        }
    }

    private static String avroName(String name) {
        if (AVRO_NAME.matcher(name).matches()) {
            return name;
        }
        String sanitized = name.replaceAll("[^A-Za-z0-9_]", "_");
        return sanitized.isEmpty() || Character.isDigit(sanitized.charAt(0)) ? "_" + sanitized
                : sanitized;
    }
}
