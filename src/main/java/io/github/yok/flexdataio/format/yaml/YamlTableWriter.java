package io.github.yok.flexdataio.format.yaml;

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
import org.yaml.snakeyaml.DumperOptions;

/**
 * Writes an {@link ITable} as a YAML sequence of mappings.
 *
 * <p>
 * Options: {@code path} (required), {@code encoding} (default UTF-8), {@code indent} (1 to 10,
 * default 2), {@code flowStyle} ({@code BLOCK}, {@code FLOW} or {@code AUTO}; default
 * {@code BLOCK}), {@code explicitStart} (emit {@code ---}; default {@code false}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class YamlTableWriter extends AbstractFileWriter<ITable> {

    static final OptionSpec<Integer> INDENT = OptionSpec.optional("indent", Integer.class, 2)
            .validatedBy(n -> n >= 1 && n <= 10, "must be between 1 and 10");

    static final OptionSpec<DumperOptions.FlowStyle> FLOW_STYLE = OptionSpec.optional("flowStyle",
            DumperOptions.FlowStyle.class, DumperOptions.FlowStyle.BLOCK);

    static final OptionSpec<Boolean> EXPLICIT_START =
            OptionSpec.optional("explicitStart", Boolean.class, false);

    static final OptionSchema SCHEMA = OptionSchema.of(FileOptions.PATH, FileOptions.ENCODING,
            INDENT, FLOW_STYLE, EXPLICIT_START);

    public static final AdapterKind<YamlTableWriter> KIND = AdapterKind.writer(DataFormat.YAML,
            YamlTableWriter.class, SCHEMA, YamlTableWriter::new, ITable.class);

    /**
     * Creates a writer from bound options.
     *
     * @param options options bound against {@link #KIND}
     */
    public YamlTableWriter(AdapterOptions options) {
        this(options, new YamlCodec());
    }

    YamlTableWriter(AdapterOptions options, FileCodec<ITable> codec) {
        super(options, codec);
    }

    /**
     * Creates a writer from raw options.
     *
     * @param options raw option values
     * @return a new writer
     */
    public static YamlTableWriter of(Map<String, ?> options) {
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
    public AdapterKind<YamlTableWriter> kind() {
        return KIND;
    }

    @Override
    public Map<String, Object> savingOptions() {
        return options().project(FileOptions.ENCODING, INDENT, FLOW_STYLE, EXPLICIT_START);
    }
}
