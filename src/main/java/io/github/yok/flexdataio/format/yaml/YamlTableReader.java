package io.github.yok.flexdataio.format.yaml;

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
 * Reads a YAML sequence of mappings into an {@link ITable} named after the file.
 *
 * <p>
 * Options: {@code path} (required), {@code encoding} (default UTF-8), {@code allowDuplicateKeys}
 * (default {@code true}), {@code maxAliasesForCollections} (default 50).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class YamlTableReader extends AbstractFileReader<ITable> {

    static final OptionSpec<Boolean> ALLOW_DUPLICATE_KEYS =
            OptionSpec.optional("allowDuplicateKeys", Boolean.class, true);

    static final OptionSpec<Integer> MAX_ALIASES_FOR_COLLECTIONS = OptionSpec
            .optional("maxAliasesForCollections", Integer.class, 50)
            .validatedBy(n -> n > 0, "must be > 0");

    static final OptionSchema SCHEMA = OptionSchema.of(FileOptions.PATH, FileOptions.ENCODING,
            ALLOW_DUPLICATE_KEYS, MAX_ALIASES_FOR_COLLECTIONS);

    public static final AdapterKind<YamlTableReader> KIND = AdapterKind.reader(DataFormat.YAML,
            YamlTableReader.class, SCHEMA, YamlTableReader::new, ITable.class);

    /**
     * Creates a reader from bound options.
     *
     * @param options options bound against {@link #KIND}
     */
    public YamlTableReader(AdapterOptions options) {
        this(options, new YamlCodec());
    }

    YamlTableReader(AdapterOptions options, FileCodec<ITable> codec) {
        super(options, codec);
    }

    /**
     * Creates a reader from raw options.
     *
     * @param options raw option values
     * @return a new reader
     */
    public static YamlTableReader of(Map<String, ?> options) {
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
    public AdapterKind<YamlTableReader> kind() {
        return KIND;
    }

    @Override
    public Map<String, Object> loadingOptions() {
        return options().project(FileOptions.ENCODING, ALLOW_DUPLICATE_KEYS,
                MAX_ALIASES_FOR_COLLECTIONS);
    }
}
