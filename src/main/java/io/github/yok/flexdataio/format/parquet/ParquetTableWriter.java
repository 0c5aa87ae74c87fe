package io.github.yok.flexdataio.format.parquet;

import io.github.yok.flexdataio.adapter.AdapterKind;
import io.github.yok.flexdataio.config.AdapterOptions;
import io.github.yok.flexdataio.config.OptionSchema;
import io.github.yok.flexdataio.config.OptionSpec;
import io.github.yok.flexdataio.format.AbstractFileWriter;
import io.github.yok.flexdataio.format.DataFormat;
import io.github.yok.flexdataio.format.FileCodec;
import io.github.yok.flexdataio.format.FileOptions;
import java.util.List;
import java.util.Map;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.dbunit.dataset.ITable;

/**
 * Writes an {@link ITable} to a Parquet file.
 *
 * <p>
 * Options:
 * </p>
 * <ul>
 * <li>{@code path} (required)</li>
 * <li>{@code compression}: {@link ParquetCompression} (default {@code SNAPPY})</li>
 * <li>{@code rowGroupSize} (bytes), {@code pageSize} (bytes), {@code enableDictionary}</li>
 * <li>{@code writeMode}: {@code OVERWRITE} (default) or {@code CREATE}, which fails when the file
 * exists</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public class ParquetTableWriter extends AbstractFileWriter<ITable> {

    static final OptionSpec<ParquetCompression> COMPRESSION = OptionSpec
            .optional("compression", ParquetCompression.class, ParquetCompression.SNAPPY);

    static final OptionSpec<Long> ROW_GROUP_SIZE = OptionSpec
            .optional("rowGroupSize", Long.class, (long) ParquetWriter.DEFAULT_BLOCK_SIZE)
            .validatedBy(n -> n > 0, "must be > 0");

    static final OptionSpec<Integer> PAGE_SIZE = OptionSpec
            .optional("pageSize", Integer.class, ParquetWriter.DEFAULT_PAGE_SIZE)
            .validatedBy(n -> n > 0, "must be > 0");

    static final OptionSpec<Boolean> ENABLE_DICTIONARY = OptionSpec.optional("enableDictionary",
            Boolean.class, ParquetWriter.DEFAULT_IS_DICTIONARY_ENABLED);

    static final OptionSpec<ParquetFileWriter.Mode> WRITE_MODE = OptionSpec.optional("writeMode",
            ParquetFileWriter.Mode.class, ParquetFileWriter.Mode.OVERWRITE);

    static final OptionSchema SCHEMA = OptionSchema.of(FileOptions.PATH, COMPRESSION,
            ROW_GROUP_SIZE, PAGE_SIZE, ENABLE_DICTIONARY, WRITE_MODE);

    public static final AdapterKind<ParquetTableWriter> KIND = AdapterKind.writer(
            DataFormat.PARQUET, ParquetTableWriter.class, SCHEMA, ParquetTableWriter::new,
            ITable.class);

    /**
     * Creates a writer from bound options.
     *
     * @param options options bound against {@link #KIND}
     */
    public ParquetTableWriter(AdapterOptions options) {
        this(options, new ParquetCodec());
    }

    ParquetTableWriter(AdapterOptions options, FileCodec<ITable> codec) {
        super(options, codec);
    }

    /**
     * Creates a writer from raw options.
     *
     * @param options raw option values
     * @return a new writer
     * @throws io.github.yok.flexdataio.exception.ConfigurationException if the options are invalid
     */
    public static ParquetTableWriter of(Map<String, ?> options) {
        return KIND.create(options);
    }

    /**
     * Returns the types this writer accepts.
     *
     * @return {@code [ITable]}
     */
    public static List<Class<?>> applicableTypes() {
        return KIND.getApplicableTypes();
    }

    @Override
    public AdapterKind<ParquetTableWriter> kind() {
        return KIND;
    }

    @Override
    public Map<String, Object> savingOptions() {
        return options().project(COMPRESSION, ROW_GROUP_SIZE, PAGE_SIZE, ENABLE_DICTIONARY,
                WRITE_MODE);
    }
}
