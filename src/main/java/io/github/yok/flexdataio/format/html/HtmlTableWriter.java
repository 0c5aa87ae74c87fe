package io.github.yok.flexdataio.format.html;

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
import org.dbunit.dataset.DefaultDataSet;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.ITable;

/**
 * Writes an {@link ITable} as an HTML document holding one {@code <table class="dataframe">}.
 *
 * <p>
 * Options: {@code path} (required), {@code classes} (extra CSS classes), {@code border} (default
 * 1), {@code tableId}, {@code header} (emit a {@code thead}; default {@code true}), {@code naRep}
 * (text for null cells; default empty), {@code encoding} (default UTF-8).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class HtmlTableWriter extends AbstractFileWriter<IDataSet> {

    static final OptionSpec<List<String>> CLASSES = OptionSpec.list("classes", String.class);

    static final OptionSpec<Integer> BORDER = OptionSpec.optional("border", Integer.class, 1)
            .validatedBy(n -> n >= 0, "must be >= 0");

    static final OptionSpec<String> TABLE_ID = OptionSpec.optional("tableId", String.class, null);

    static final OptionSpec<Boolean> HEADER = OptionSpec.optional("header", Boolean.class, true);

    static final OptionSpec<String> NA_REP = OptionSpec.optional("naRep", String.class, "");

    static final OptionSchema SCHEMA = OptionSchema.of(FileOptions.PATH, CLASSES, BORDER,
            TABLE_ID, HEADER, NA_REP, FileOptions.ENCODING);

    public static final AdapterKind<HtmlTableWriter> KIND = AdapterKind.writer(DataFormat.HTML,
            HtmlTableWriter.class, SCHEMA, HtmlTableWriter::new, ITable.class);

    /**
     * Creates a writer from bound options.
     *
     * @param options options bound against {@link #KIND}
     */
    public HtmlTableWriter(AdapterOptions options) {
        this(options, new HtmlCodec());
    }

    HtmlTableWriter(AdapterOptions options, FileCodec<IDataSet> codec) {
        super(options, codec);
    }

    /**
     * Creates a writer from raw options.
     *
     * @param options raw option values
     * @return a new writer
     */
    public static HtmlTableWriter of(Map<String, ?> options) {
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
    public AdapterKind<HtmlTableWriter> kind() {
        return KIND;
    }

    @Override
    public Map<String, Object> savingOptions() {
        return options().project(CLASSES, BORDER, TABLE_ID, HEADER, NA_REP, FileOptions.ENCODING);
    }

    @Override
    protected IDataSet prepare(Object data) throws Exception {
        return new DefaultDataSet((ITable) data);
    }
}
