package io.github.yok.flexdataio.format.parquet;

import io.github.yok.flexdataio.adapter.AdapterKind;
import io.github.yok.flexdataio.config.AdapterOptions;
import io.github.yok.flexdataio.config.OptionSchema;
import io.github.yok.flexdataio.config.OptionSpec;
import io.github.yok.flexdataio.format.AbstractFileReader;
import io.github.yok.flexdataio.format.DataFormat;
import io.github.yok.flexdataio.format.FileCodec;
import io.github.yok.flexdataio.format.FileOptions;
import java.util.List;
import java.util.Map;
import org.dbunit.dataset.ITable;

/**
 * Reads a Parquet file into an {@link ITable} named after the file.
 *
 * <p>
 * Options: {@code path} (required), {@code columns} (columns to read, in the order given; all
 * columns when absent).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ParquetTableReader extends AbstractFileReader<ITable> {

    static final OptionSpec<List<String>> COLUMNS = OptionSpec.list("columns", String.class)
            .validatedBy(l -> !l.isEmpty(), "must name at least one column");

    static final OptionSchema SCHEMA = OptionSchema.of(FileOptions.PATH, COLUMNS);

    public static final AdapterKind<ParquetTableReader> KIND = AdapterKind.reader(
            DataFormat.PARQUET, ParquetTableReader.class, SCHEMA, ParquetTableReader::new,
            ITable.class);

    /**
     * Creates a reader from bound options.
     *
     * @param options options bound against {@link #KIND}
     */
    public ParquetTableReader(AdapterOptions options) {
        this(options, new ParquetCodec());
    }

    ParquetTableReader(AdapterOptions options, FileCodec<ITable> codec) {
        super(options, codec);
    }

    /**
     * Creates a reader from raw options.
     *
     * @param options raw option values
     * @return a new reader
     * @throws io.github.yok.flexdataio.exception.ConfigurationException if the options are invalid
     */
    public static ParquetTableReader of(Map<String, ?> options) {
        return KIND.create(options);
    }

    /**
     * Returns the types this reader can produce.
     *
     * @return {@code [ITable]}
     */
    public static List<Class<?>> applicableTypes() {
        return KIND.getApplicableTypes();
    }

    @Override
    public AdapterKind<ParquetTableReader> kind() {
        return KIND;
    }

    @Override
    public Map<String, Object> loadingOptions() {
        return options().project(COLUMNS);
    }
}
