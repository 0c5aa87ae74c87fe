package io.github.yok.flexdataio.format.feather;

import io.github.yok.flexdataio.format.FileCodec;
import io.github.yok.flexdataio.util.ColumnKind;
import io.github.yok.flexdataio.util.FileSupport;
import io.github.yok.flexdataio.util.TableSupport;
import java.math.BigDecimal;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.apache.arrow.compression.CommonsCompressionFactory;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DateMilliVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.TimeStampMilliVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.ipc.ArrowFileReader;
import org.apache.arrow.vector.ipc.ArrowFileWriter;
import org.apache.arrow.vector.ipc.message.IpcOption;
import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.datatype.DataType;

/**
 * Reads and writes a single table as a Feather V2 file, which is the Arrow IPC file format.
 *
 * <p>
 * Column kinds map to the Arrow types {@code Utf8}, {@code Int(32)}, {@code Int(64)},
 * {@code FloatingPoint(DOUBLE)}, {@code FloatingPoint(SINGLE)}, {@code Bool}, {@code Date(DAY)},
 * {@code Timestamp(MILLISECOND)} and {@code Binary}; every field is nullable. Reading also accepts
 * other timestamp units, millisecond dates, large strings and binaries and decimals.
 * </p>
 *
 * <p>
 * Arrow accesses direct buffers reflectively; on JDK 17 the JVM needs
 * {@code --add-opens=java.base/java.nio=ALL-UNNAMED}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
class FeatherCodec implements FileCodec<ITable> {

    // Parent of the per-call allocators
    private static final RootAllocator ROOT_ALLOCATOR = new RootAllocator(Long.MAX_VALUE);

    /**
     * {@inheritDoc}
     */
    @Override
    public ITable decode(Path path, Map<String, Object> options) throws Exception {
        try (BufferAllocator allocator = ROOT_ALLOCATOR.newChildAllocator("feather-read", 0,
                Long.MAX_VALUE);
                FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
                ArrowFileReader reader = new ArrowFileReader(channel, allocator,
                        CommonsCompressionFactory.INSTANCE)) {
            VectorSchemaRoot root = reader.getVectorSchemaRoot();
            List<Field> fields = root.getSchema().getFields();
            List<Integer> selected =
                    select(fields, FeatherTableReader.COLUMNS.valueIn(options));

            List<String> names = new ArrayList<>();
            List<DataType> types = new ArrayList<>();
            for (int c : selected) {
                names.add(fields.get(c).getName());
                types.add(dataTypeOf(fields.get(c)));
            }
            List<Object[]> rows = new ArrayList<>();
            while (reader.loadNextBatch()) {
                for (int r = 0; r < root.getRowCount(); r++) {
                    Object[] row = new Object[selected.size()];
                    for (int i = 0; i < row.length; i++) {
                        row[i] = read(root.getVector(selected.get(i)), r);
                    }
                    rows.add(row);
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
        List<Field> fields = new ArrayList<>(columns.length);
        for (Column column : columns) {
            ColumnKind kind = ColumnKind.of(data, column);
            kinds.add(kind);
            fields.add(Field.nullable(column.getColumnName(), arrowType(kind)));
        }
        int chunkSize = FeatherTableWriter.CHUNK_SIZE.valueIn(options);
        FeatherCompression compression = FeatherTableWriter.COMPRESSION.valueIn(options);

        try (BufferAllocator allocator = ROOT_ALLOCATOR.newChildAllocator("feather-write", 0,
                Long.MAX_VALUE);
                VectorSchemaRoot root = VectorSchemaRoot.create(new Schema(fields), allocator);
                FileChannel channel = FileChannel.open(path, StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
                ArrowFileWriter writer = new ArrowFileWriter(root,
                        new DictionaryProvider.MapDictionaryProvider(), channel,
                        Collections.emptyMap(), IpcOption.DEFAULT,
                        CommonsCompressionFactory.INSTANCE, compression.getCodecType())) {
            writer.start();
            int total = data.getRowCount();
            int start = 0;
            // An empty table is still written as one empty batch
            do {
                int count = Math.min(chunkSize, total - start);
                root.allocateNew();
                for (int c = 0; c < columns.length; c++) {
                    FieldVector vector = root.getVector(c);
                    for (int i = 0; i < count; i++) {
                        Object value = kinds.get(c)
                                .normalize(data.getValue(start + i, columns[c].getColumnName()));
                        if (value != null) {
                            write(vector, kinds.get(c), i, value);
                        }
                    }
                }
                root.setRowCount(count);
                writer.writeBatch();
                start += count;
            } while (start < total);
            writer.end();
        }
    }

    private static List<Integer> select(List<Field> fields, List<String> columns)
            throws DataSetException {
        List<String> available = new ArrayList<>(fields.size());
        for (Field field : fields) {
            available.add(field.getName());
        }
        List<Integer> selected = new ArrayList<>();
        if (columns == null) {
            for (int c = 0; c < fields.size(); c++) {
                selected.add(c);
            }
            return selected;
        }
        for (String column : columns) {
            int index = available.indexOf(column);
            if (index < 0) {
                throw new DataSetException("Column '" + column
                        + "' not found; available columns are " + available);
            }
            selected.add(index);
        }
        return selected;
    }

    private static ArrowType arrowType(ColumnKind kind) {
        switch (kind) {
            case INT:
                return new ArrowType.Int(Integer.SIZE, true);
            case LONG:
                return new ArrowType.Int(Long.SIZE, true);
            case DOUBLE:
                return new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
            case FLOAT:
                return new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE);
            case BOOLEAN:
                return ArrowType.Bool.INSTANCE;
            case DATE:
                return new ArrowType.Date(DateUnit.DAY);
            case TIMESTAMP:
                return new ArrowType.Timestamp(TimeUnit.MILLISECOND, null);
            case BINARY:
                return ArrowType.Binary.INSTANCE;
            default:
                return ArrowType.Utf8.INSTANCE;
        }
    }

    private static void write(FieldVector vector, ColumnKind kind, int index, Object value) {
        switch (kind) {
            case INT:
                ((IntVector) vector).setSafe(index, (Integer) value);
                break;
            case LONG:
                ((BigIntVector) vector).setSafe(index, (Long) value);
                break;
            case DOUBLE:
                ((Float8Vector) vector).setSafe(index, (Double) value);
                break;
            case FLOAT:
                ((Float4Vector) vector).setSafe(index, (Float) value);
                break;
            case BOOLEAN:
                ((BitVector) vector).setSafe(index, (Boolean) value ? 1 : 0);
                break;
            case DATE:
                ((DateDayVector) vector).setSafe(index,
                        (int) ((Date) value).toLocalDate().toEpochDay());
                break;
            case TIMESTAMP:
                ((TimeStampMilliVector) vector).setSafe(index, ((Timestamp) value).getTime());
                break;
            case BINARY:
                ((VarBinaryVector) vector).setSafe(index, (byte[]) value);
                break;
            default:
                ((VarCharVector) vector).setSafe(index,
                        value.toString().getBytes(StandardCharsets.UTF_8));
                break;
        }
    }

    private static Object read(FieldVector vector, int index) throws DataSetException {
        if (vector.isNull(index)) {
            return null;
        }
        ArrowType type = vector.getField().getType();
        switch (type.getTypeID()) {
            case Int:
                Number number = (Number) vector.getObject(index);
                return ((ArrowType.Int) type).getBitWidth() == Long.SIZE ? number.longValue()
                        : (Object) number.intValue();
            case FloatingPoint:
                if (vector instanceof Float4Vector) {
                    return ((Float4Vector) vector).get(index);
                }
                return ((Float8Vector) vector).get(index);
            case Bool:
                return ((BitVector) vector).get(index) != 0;
            case Date:
                if (vector instanceof DateDayVector) {
                    return Date.valueOf(LocalDate.ofEpochDay(((DateDayVector) vector).get(index)));
                }
                long millis = ((DateMilliVector) vector).get(index);
                return Date.valueOf(LocalDate.ofEpochDay(Math.floorDiv(millis, 86_400_000L)));
            case Timestamp:
                long raw = ((TimeStampVector) vector).get(index);
                long perSecond = unitsPerSecond(((ArrowType.Timestamp) type).getUnit());
                return Timestamp.from(Instant.ofEpochSecond(Math.floorDiv(raw, perSecond),
                        Math.floorMod(raw, perSecond) * (1_000_000_000L / perSecond)));
            case Utf8:
            case LargeUtf8:
                return vector.getObject(index).toString();
            case Binary:
            case LargeBinary:
            case FixedSizeBinary:
                return vector.getObject(index);
            case Decimal:
                return (BigDecimal) vector.getObject(index);
            default:
                throw new DataSetException("Unsupported Arrow column type " + type);
        }
    }

    private static DataType dataTypeOf(Field field) throws DataSetException {
        ArrowType type = field.getType();
        switch (type.getTypeID()) {
            case Int:
                ArrowType.Int integer = (ArrowType.Int) type;
                if (!integer.getIsSigned()) {
                    throw new DataSetException("Unsupported Arrow column type " + type
                            + " in column '" + field.getName() + "'");
                }
                return integer.getBitWidth() == Long.SIZE ? DataType.BIGINT_AUX_LONG
                        : DataType.INTEGER;
            case FloatingPoint:
                switch (((ArrowType.FloatingPoint) type).getPrecision()) {
                    case SINGLE:
                        return DataType.REAL;
                    case DOUBLE:
                        return DataType.DOUBLE;
                    default:
                        throw new DataSetException("Unsupported Arrow column type " + type
                                + " in column '" + field.getName() + "'");
                }
            case Bool:
                return DataType.BOOLEAN;
            case Date:
                return DataType.DATE;
            case Timestamp:
                return DataType.TIMESTAMP;
            case Utf8:
            case LargeUtf8:
                return DataType.VARCHAR;
            case Binary:
            case LargeBinary:
            case FixedSizeBinary:
                return DataType.BINARY;
            case Decimal:
                return DataType.DECIMAL;
            default:
                throw new DataSetException("Unsupported Arrow column type " + type
                        + " in column '" + field.getName() + "'");
        }
    }

    private static long unitsPerSecond(TimeUnit unit) {
        switch (unit) {
            case SECOND:
                return 1L;
            case MILLISECOND:
                return 1_000L;
            case MICROSECOND:
                return 1_000_000L;
            default:
                return 1_000_000_000L;
        }
    }
}
