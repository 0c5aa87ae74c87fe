package io.github.yok.flexdataio.format.json;

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
 * Reads a JSON document into an {@link ITable} named after the file.
 *
 * <p>
 * Options: {@code path} (required), {@code orient} (default {@link JsonOrient#RECORDS}),
 * {@code encoding} (default UTF-8), {@code inferTypes} (default {@code true}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class JsonTableReader extends AbstractFileReader<ITable> {

    static final OptionSpec<Boolean> INFER_TYPES =
            OptionSpec.optional("inferTypes", Boolean.class, true);

    static final OptionSchema SCHEMA = OptionSchema.of(FileOptions.PATH, JsonOptions.ORIENT,
            FileOptions.ENCODING, INFER_TYPES);

    public static final AdapterKind<JsonTableReader> KIND = AdapterKind.reader(DataFormat.JSON,
            JsonTableReader.class, SCHEMA, JsonTableReader::new, ITable.class);

    /**
     * Creates a reader from bound options.
     *
     * @param options options bound against {@link #KIND}
     */
    public JsonTableReader(AdapterOptions options) {
        this(options, new JsonCodec());
    }

    JsonTableReader(AdapterOptions options, FileCodec<ITable> codec) {
        super(options, codec);
    }

    /**
     * Creates a reader from raw options.
     *
     * @param options raw option values
     * @return a new reader
     */
    public static JsonTableReader of(Map<String, ?> options) {
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
    public AdapterKind<JsonTableReader> kind() {
        return KIND;
    }

    @Override
    public Map<String, Object> loadingOptions() {
        return options().project(JsonOptions.ORIENT, FileOptions.ENCODING, INFER_TYPES);
    }
}
