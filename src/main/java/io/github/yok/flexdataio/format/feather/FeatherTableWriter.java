package io.github.yok.flexdataio.format.feather;

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
import org.dbunit.dataset.ITable;

/**
 * Writes an {@link ITable} to a Feather V2 (Arrow IPC) file.
 *
 * <p>
 * Options:
 * </p>
 * <ul>
 * <li>{@code path} (required)</li>
 * <li>{@code compression}: {@link FeatherCompression} (default {@code LZ4})</li>
 * <li>{@code chunkSize}: rows per record batch (default 65536)</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public class FeatherTableWriter extends AbstractFileWriter<ITable> {

    static final OptionSpec<FeatherCompression> COMPRESSION = OptionSpec
            .optional("compression", FeatherCompression.class, FeatherCompression.LZ4);

    static final OptionSpec<Integer> CHUNK_SIZE = OptionSpec
            .optional("chunkSize", Integer.class, 64 * 1024)
            .validatedBy(n -> n > 0, "must be > 0");

    static final OptionSchema SCHEMA =
            OptionSchema.of(FileOptions.PATH, COMPRESSION, CHUNK_SIZE);

    public static final AdapterKind<FeatherTableWriter> KIND =
            AdapterKind.writer(DataFormat.FEATHER, FeatherTableWriter.class, SCHEMA,
                    FeatherTableWriter::new, ITable.class);

    /**
     * Creates a writer from bound options.
     *
     * @param options options bound against {@link #KIND}
     */
    public FeatherTableWriter(AdapterOptions options) {
        this(options, new FeatherCodec());
    }

    FeatherTableWriter(AdapterOptions options, FileCodec<ITable> codec) {
        super(options, codec);
    }

    /**
     * Creates a writer from raw options.
     *
     * @param options raw option values
     * @return a new writer
     * @throws io.github.yok.flexdataio.exception.ConfigurationException if the options are invalid
     */
    public static FeatherTableWriter of(Map<String, ?> options) {
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
    public AdapterKind<FeatherTableWriter> kind() {
        return KIND;
    }

    @Override
    public Map<String, Object> savingOptions() {
        return options().project(COMPRESSION, CHUNK_SIZE);
    }
}
