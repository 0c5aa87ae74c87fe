package io.github.yok.flexdataio.format.orc;

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
 * Reads an ORC file into an {@link ITable} named after the file.
 *
 * <p>
 * Options: {@code path} (required), {@code columns} (columns to read, in the order given; all
 * columns when absent). Only the selected columns are decoded.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class OrcTableReader extends AbstractFileReader<ITable> {

    static final OptionSpec<List<String>> COLUMNS = OptionSpec.list("columns", String.class)
            .validatedBy(l -> !l.isEmpty(), "must name at least one column");

    static final OptionSchema SCHEMA = OptionSchema.of(FileOptions.PATH, COLUMNS);

    public static final AdapterKind<OrcTableReader> KIND = AdapterKind.reader(DataFormat.ORC,
            OrcTableReader.class, SCHEMA, OrcTableReader::new, ITable.class);

    /**
     * Creates a reader from bound options.
     *
     * @param options options bound against {@link #KIND}
     */
    public OrcTableReader(AdapterOptions options) {
        this(options, new OrcCodec());
    }

    OrcTableReader(AdapterOptions options, FileCodec<ITable> codec) {
        super(options, codec);
    }

    /**
     * Creates a reader from raw options.
     *
     * @param options raw option values
     * @return a new reader
     * @throws io.github.yok.flexdataio.exception.ConfigurationException if the options are invalid
     */
    public static OrcTableReader of(Map<String, ?> options) {
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
    public AdapterKind<OrcTableReader> kind() {
        return KIND;
    }

    @Override
    public Map<String, Object> loadingOptions() {
        return options().project(COLUMNS);
    }
}
