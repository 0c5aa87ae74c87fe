package io.github.yok.flexdataio.format.json;

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
 * Writes an {@link ITable} as a JSON document.
 *
 * <p>
 * Options: {@code path} (required), {@code orient} (default {@link JsonOrient#RECORDS}),
 * {@code indent} (spaces per level; compact output when absent), {@code encoding} (default UTF-8).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class JsonTableWriter extends AbstractFileWriter<ITable> {

    static final OptionSpec<Integer> INDENT = OptionSpec.optional("indent", Integer.class, null)
            .validatedBy(n -> n >= 0, "must be >= 0");

    static final OptionSchema SCHEMA =
            OptionSchema.of(FileOptions.PATH, JsonOptions.ORIENT, INDENT, FileOptions.ENCODING);

    public static final AdapterKind<JsonTableWriter> KIND = AdapterKind.writer(DataFormat.JSON,
            JsonTableWriter.class, SCHEMA, JsonTableWriter::new, ITable.class);

    /**
     * Creates a writer from bound options.
     *
     * @param options options bound against {@link #KIND}
     */
    public JsonTableWriter(AdapterOptions options) {
        this(options, new JsonCodec());
    }

    JsonTableWriter(AdapterOptions options, FileCodec<ITable> codec) {
        super(options, codec);
    }

    /**
     * Creates a writer from raw options.
     *
     * @param options raw option values
     * @return a new writer
     */
    public static JsonTableWriter of(Map<String, ?> options) {
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
    public AdapterKind<JsonTableWriter> kind() {
        return KIND;
    }

    @Override
    public Map<String, Object> savingOptions() {
        return options().project(JsonOptions.ORIENT, INDENT, FileOptions.ENCODING);
    }
}
