package io.github.yok.flexdataio.format.orc;

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
 * Writes an {@link ITable} to an ORC file.
 *
 * <p>
 * Options:
 * </p>
 * <ul>
 * <li>{@code path} (required)</li>
 * <li>{@code compression}: {@link OrcCompression} (default {@code ZLIB})</li>
 * <li>{@code stripeSize} (bytes, default 64 MiB), {@code rowIndexStride} (rows, default 10000,
 * {@code 0} disables the row index)</li>
 * <li>{@code overwrite}: replace an existing file (default {@code true}); when {@code false} an
 * existing file makes the save fail</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public class OrcTableWriter extends AbstractFileWriter<ITable> {

    static final OptionSpec<OrcCompression> COMPRESSION =
            OptionSpec.optional("compression", OrcCompression.class, OrcCompression.ZLIB);

    static final OptionSpec<Long> STRIPE_SIZE = OptionSpec
            .optional("stripeSize", Long.class, 64L * 1024 * 1024)
            .validatedBy(n -> n > 0, "must be > 0");

    static final OptionSpec<Integer> ROW_INDEX_STRIDE = OptionSpec
            .optional("rowIndexStride", Integer.class, 10000)
            .validatedBy(n -> n == 0 || n >= 1000, "must be 0 or >= 1000");

    static final OptionSpec<Boolean> OVERWRITE =
            OptionSpec.optional("overwrite", Boolean.class, true);

    static final OptionSchema SCHEMA = OptionSchema.of(FileOptions.PATH, COMPRESSION,
            STRIPE_SIZE, ROW_INDEX_STRIDE, OVERWRITE);

    public static final AdapterKind<OrcTableWriter> KIND = AdapterKind.writer(DataFormat.ORC,
            OrcTableWriter.class, SCHEMA, OrcTableWriter::new, ITable.class);

    /**
     * Creates a writer from bound options.
     *
     * @param options options bound against {@link #KIND}
     */
    public OrcTableWriter(AdapterOptions options) {
        this(options, new OrcCodec());
    }

    OrcTableWriter(AdapterOptions options, FileCodec<ITable> codec) {
        super(options, codec);
    }

    /**
     * Creates a writer from raw options.
     *
     * @param options raw option values
     * @return a new writer
     * @throws io.github.yok.flexdataio.exception.ConfigurationException if the options are invalid
     */
    public static OrcTableWriter of(Map<String, ?> options) {
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
    public AdapterKind<OrcTableWriter> kind() {
        return KIND;
    }

    @Override
    public Map<String, Object> savingOptions() {
        return options().project(COMPRESSION, STRIPE_SIZE, ROW_INDEX_STRIDE, OVERWRITE);
    }
}
