package io.github.yok.flexdataio.format.avro;

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
import org.apache.avro.AvroRuntimeException;
import org.apache.avro.file.CodecFactory;
import org.apache.avro.file.DataFileConstants;
import org.dbunit.dataset.ITable;

/**
 * Writes an {@link ITable} to an Avro container file.
 *
 * <p>
 * Options: {@code path} (required), {@code codec} (an Avro codec name such as {@code null},
 * {@code deflate} or {@code snappy}; default {@code null}), {@code syncInterval} (approximate block
 * size in bytes, 32 to 2^30).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class AvroTableWriter extends AbstractFileWriter<ITable> {

    static final OptionSpec<String> CODEC = OptionSpec
            .optional("codec", String.class, DataFileConstants.NULL_CODEC)
            .validatedBy(AvroTableWriter::isKnownCodec, "must be a known Avro codec name");

    static final OptionSpec<Integer> SYNC_INTERVAL = OptionSpec
            .optional("syncInterval", Integer.class, DataFileConstants.DEFAULT_SYNC_INTERVAL)
            .validatedBy(n -> n >= 32 && n <= (1 << 30), "must be between 32 and 2^30");

    static final OptionSchema SCHEMA = OptionSchema.of(FileOptions.PATH, CODEC, SYNC_INTERVAL);

    public static final AdapterKind<AvroTableWriter> KIND = AdapterKind.writer(DataFormat.AVRO,
            AvroTableWriter.class, SCHEMA, AvroTableWriter::new, ITable.class);

    /**
     * Creates a writer from bound options.
     *
     * @param options options bound against {@link #KIND}
     */
    public AvroTableWriter(AdapterOptions options) {
        this(options, new AvroCodec());
    }

    AvroTableWriter(AdapterOptions options, FileCodec<ITable> codec) {
        super(options, codec);
    }

    /**
     * Creates a writer from raw options.
     *
     * @param options raw option values
     * @return a new writer
     * @throws io.github.yok.flexdataio.exception.ConfigurationException if the options are invalid
     */
    public static AvroTableWriter of(Map<String, ?> options) {
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
    public AdapterKind<AvroTableWriter> kind() {
        return KIND;
    }

    @Override
    public Map<String, Object> savingOptions() {
        return options().project(CODEC, SYNC_INTERVAL);
    }

    private static boolean isKnownCodec(String name) {
        try {
            CodecFactory.fromString(name);
            return true;
        } catch (AvroRuntimeException e) {
            return false;
        }
    }
}
