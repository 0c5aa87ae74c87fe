package io.github.yok.flexdataio.format.orc;

import io.github.yok.flexdataio.format.FileCodec;
import io.github.yok.flexdataio.util.ColumnKind;
import io.github.yok.flexdataio.util.FileSupport;
import io.github.yok.flexdataio.util.TableSupport;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.RawLocalFileSystem;
import org.apache.hadoop.hive.ql.exec.vector.BytesColumnVector;
import org.apache.hadoop.hive.ql.exec.vector.ColumnVector;
import org.apache.hadoop.hive.ql.exec.vector.DecimalColumnVector;
import org.apache.hadoop.hive.ql.exec.vector.DoubleColumnVector;
import org.apache.hadoop.hive.ql.exec.vector.LongColumnVector;
import org.apache.hadoop.hive.ql.exec.vector.TimestampColumnVector;
import org.apache.hadoop.hive.ql.exec.vector.VectorizedRowBatch;
import org.apache.orc.OrcFile;
import org.apache.orc.Reader;
import org.apache.orc.RecordReader;
import org.apache.orc.TypeDescription;
import org.apache.orc.Writer;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.datatype.DataType;

/**
 * Reads and writes a single table as an ORC file whose root type is a struct with one field per
 * column.
 *
 * <p>
 * Column kinds map to ORC types {@code string}, {@code int}, {@code bigint}, {@code double},
 * {@code float}, {@code boolean}, {@code date}, {@code timestamp} and {@code binary}. Files are
 * accessed through Hadoop's raw local file system, so no checksum side files are written.
 * Timestamps are stored in UTC.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
class OrcCodec implements FileCodec<ITable> {

    /**
     * {@inheritDoc}
     */
    @Override
    public ITable decode(Path path, Map<String, Object> options) throws Exception {
        Configuration conf = new Configuration(false);
        try (FileSystem fs = localFileSystem(conf);
                Reader reader = OrcFile.createReader(hadoopPath(path),
                        OrcFile.readerOptions(conf).filesystem(fs).useUTCTimestamp(true))) {
            TypeDescription schema = reader.getSchema();
            if (schema.getCategory() != TypeDescription.Category.STRUCT) {
                throw new DataSetException("ORC root type must be a struct but was " + schema);
            }
            List<String> fieldNames = schema.getFieldNames();
            List<TypeDescription> children = schema.getChildren();
            List<Integer> selected = select(fieldNames, OrcTableReader.COLUMNS.valueIn(options));

            boolean[] include = new boolean[schema.getMaximumId() + 1];
            include[0] = true;
            List<String> names = new ArrayList<>();
            List<DataType> types = new ArrayList<>();
            for (int c : selected) {
                TypeDescription child = children.get(c);
                Arrays.fill(include, child.getId(), child.getMaximumId() + 1, true);
                names.add(fieldNames.get(c));
                types.add(dataTypeOf(child));
            }

            List<Object[]> rows = new ArrayList<>();
            VectorizedRowBatch batch = schema.createRowBatch();
            try (RecordReader records = reader.rows(reader.options().include(include))) {
                while (records.nextBatch(batch)) {
                    for (int r = 0; r < batch.size; r++) {
                        Object[] row = new Object[selected.size()];
                        for (int i = 0; i < row.length; i++) {
                            int c = selected.get(i);
                            row[i] = read(batch.cols[c], children.get(c), r);
                        }
                        rows.add(row);
                    }
                }
            }
            return TableSupport.newTable(FileSupport.baseName(path), names, types, rows);
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void encode(ITable data, Path path, Map<String, Object> options) throws Exception {
        Column[] columns = data.getTableMetaData().getColumns();
        List<ColumnKind> kinds = new ArrayList<>(columns.length);
        TypeDescription schema = TypeDescription.createStruct();
        for (Column column : columns) {
            ColumnKind kind = ColumnKind.of(data, column);
            kinds.add(kind);
            schema.addField(column.getColumnName(), orcType(kind));
        }

        Configuration conf = new Configuration(false);
        try (FileSystem fs = localFileSystem(conf);
                Writer writer = OrcFile.createWriter(hadoopPath(path), OrcFile.writerOptions(conf)
                        .fileSystem(fs).setSchema(schema).useUTCTimestamp(true)
                        .compress(OrcTableWriter.COMPRESSION.valueIn(options).getKind())
                        .stripeSize(OrcTableWriter.STRIPE_SIZE.valueIn(options))
                        .rowIndexStride(OrcTableWriter.ROW_INDEX_STRIDE.valueIn(options))
                        .overwrite(OrcTableWriter.OVERWRITE.valueIn(options)))) {
            VectorizedRowBatch batch = schema.createRowBatch();
            batch.reset();
            for (int r = 0; r < data.getRowCount(); r++) {
                int row = batch.size++;
                for (int c = 0; c < columns.length; c++) {
                    Object value = kinds.get(c)
                            .normalize(data.getValue(r, columns[c].getColumnName()));
                    write(batch.cols[c], kinds.get(c), row, value);
                }
                if (batch.size == batch.getMaxSize()) {
                    writer.addRowBatch(batch);
                    batch.reset();
                }
            }
            if (batch.size > 0) {
                writer.addRowBatch(batch);
            }
        }
    }

    private static List<Integer> select(List<String> fieldNames, List<String> columns)
            throws DataSetException {
        List<Integer> selected = new ArrayList<>();
        if (columns == null) {
            for (int c = 0; c < fieldNames.size(); c++) {
                selected.add(c);
            }
            return selected;
        }
        for (String column : columns) {
            int index = fieldNames.indexOf(column);
            if (index < 0) {
                throw new DataSetException("Column '" + column
                        + "' not found; available columns are " + fieldNames);
            }
            selected.add(index);
        }
        return selected;
    }

    private static TypeDescription orcType(ColumnKind kind) {
        switch (kind) {
            case INT:
                return TypeDescription.createInt();
            case LONG:
                return TypeDescription.createLong();
            case DOUBLE:
                return TypeDescription.createDouble();
            case FLOAT:
                return TypeDescription.createFloat();
            case BOOLEAN:
                return TypeDescription.createBoolean();
            case DATE:
                return TypeDescription.createDate();
            case TIMESTAMP:
                return TypeDescription.createTimestamp();
            case BINARY:
                return TypeDescription.createBinary();
            default:
                return TypeDescription.createString();
        }
    }

    private static void write(ColumnVector vector, ColumnKind kind, int row, Object value) {
        if (value == null) {
            vector.noNulls = false;
            vector.isNull[row] = true;
            return;
        }
        switch (kind) {
            case INT:
            case LONG:
                ((LongColumnVector) vector).vector[row] = ((Number) value).longValue();
                break;
            case DOUBLE:
            case FLOAT:
                ((DoubleColumnVector) vector).vector[row] = ((Number) value).doubleValue();
                break;
            case BOOLEAN:
                ((LongColumnVector) vector).vector[row] = (Boolean) value ? 1 : 0;
                break;
            case DATE:
                ((LongColumnVector) vector).vector[row] =
                        ((Date) value).toLocalDate().toEpochDay();
                break;
            case TIMESTAMP:
                ((TimestampColumnVector) vector).set(row, (Timestamp) value);
                break;
            case BINARY:
                ((BytesColumnVector) vector).setVal(row, (byte[]) value);
                break;
            default:
                ((BytesColumnVector) vector).setVal(row,
                        value.toString().getBytes(StandardCharsets.UTF_8));
                break;
        }
    }

    private static Object read(ColumnVector vector, TypeDescription type, int row)
            throws DataSetException {
        int index = vector.isRepeating ? 0 : row;
        if (!vector.noNulls && vector.isNull[index]) {
            return null;
        }
        switch (type.getCategory()) {
            case BOOLEAN:
                return ((LongColumnVector) vector).vector[index] != 0;
            case BYTE:
            case SHORT:
            case INT:
                return (int) ((LongColumnVector) vector).vector[index];
            case LONG:
                return ((LongColumnVector) vector).vector[index];
            case FLOAT:
                return (float) ((DoubleColumnVector) vector).vector[index];
            case DOUBLE:
                return ((DoubleColumnVector) vector).vector[index];
            case DATE:
                long days = ((LongColumnVector) vector).vector[index];
                return Date.valueOf(LocalDate.ofEpochDay(days));
            case TIMESTAMP:
            case TIMESTAMP_INSTANT:
                TimestampColumnVector timestamps = (TimestampColumnVector) vector;
                Timestamp timestamp = new Timestamp(timestamps.time[index]);
                timestamp.setNanos(timestamps.nanos[index]);
                return timestamp;
            case DECIMAL:
                return ((DecimalColumnVector) vector).vector[index].getHiveDecimal()
                        .bigDecimalValue();
            case BINARY:
                BytesColumnVector binary = (BytesColumnVector) vector;
                return Arrays.copyOfRange(binary.vector[index], binary.start[index],
                        binary.start[index] + binary.length[index]);
            case STRING:
            case VARCHAR:
            case CHAR:
                BytesColumnVector text = (BytesColumnVector) vector;
                return new String(text.vector[index], text.start[index], text.length[index],
                        StandardCharsets.UTF_8);
            default:
                throw new DataSetException("Unsupported ORC column type " + type);
        }
    }

    private static DataType dataTypeOf(TypeDescription type) throws DataSetException {
        switch (type.getCategory()) {
            case BOOLEAN:
                return DataType.BOOLEAN;
            case BYTE:
            case SHORT:
            case INT:
                return DataType.INTEGER;
            case LONG:
                return DataType.BIGINT_AUX_LONG;
            case FLOAT:
                return DataType.REAL;
            case DOUBLE:
                return DataType.DOUBLE;
            case DATE:
                return DataType.DATE;
            case TIMESTAMP:
            case TIMESTAMP_INSTANT:
                return DataType.TIMESTAMP;
            case DECIMAL:
                return DataType.DECIMAL;
            case BINARY:
                return DataType.BINARY;
            case STRING:
            case VARCHAR:
            case CHAR:
                return DataType.VARCHAR;
            default:
                throw new DataSetException("Unsupported ORC column type " + type);
        }
    }

    private static FileSystem localFileSystem(Configuration conf) throws Exception {
        RawLocalFileSystem fs = new RawLocalFileSystem();
        fs.initialize(URI.create("file:///"), conf);
        return fs;
    }

    private static org.apache.hadoop.fs.Path hadoopPath(Path path) {
        return new org.apache.hadoop.fs.Path(path.toAbsolutePath().toUri());
    }
}
