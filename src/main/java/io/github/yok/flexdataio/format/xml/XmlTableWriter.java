package io.github.yok.flexdataio.format.xml;

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
 * Writes an {@link ITable} or {@link IDataSet} as a DBUnit flat XML document.
 *
 * <p>
 * Options: {@code path} (required), {@code encoding} (default UTF-8), {@code prettyPrint}
 * (default {@code true}), {@code includeEmptyTable} (default {@code false}), {@code docType}
 * (DTD system id; none when absent).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class XmlTableWriter extends AbstractFileWriter<IDataSet> {

    static final OptionSpec<Boolean> PRETTY_PRINT =
            OptionSpec.optional("prettyPrint", Boolean.class, true);

    static final OptionSpec<Boolean> INCLUDE_EMPTY_TABLE =
            OptionSpec.optional("includeEmptyTable", Boolean.class, false);

    static final OptionSpec<String> DOC_TYPE = OptionSpec.optional("docType", String.class, null);

    static final OptionSchema SCHEMA = OptionSchema.of(FileOptions.PATH, FileOptions.ENCODING,
            PRETTY_PRINT, INCLUDE_EMPTY_TABLE, DOC_TYPE);

    public static final AdapterKind<XmlTableWriter> KIND = AdapterKind.writer(DataFormat.XML,
            XmlTableWriter.class, SCHEMA, XmlTableWriter::new, ITable.class, IDataSet.class);

    /**
     * Creates a writer from bound options.
     *
     * @param options options bound against {@link #KIND}
     */
    public XmlTableWriter(AdapterOptions options) {
        this(options, new XmlCodec());
    }

    XmlTableWriter(AdapterOptions options, FileCodec<IDataSet> codec) {
        super(options, codec);
    }

    /**
     * Creates a writer from raw options.
     *
     * @param options raw option values
     * @return a new writer
     */
    public static XmlTableWriter of(Map<String, ?> options) {
        return KIND.create(options);
    }

    /**
     * Returns the types this writer accepts.
     *
     * @return {@code [ITable, IDataSet]}
     */
    public static List<Class<?>> applicableTypes() {
        return KIND.getApplicableTypes();
    }

    @Override
    public AdapterKind<XmlTableWriter> kind() {
        return KIND;
    }

    @Override
    public Map<String, Object> savingOptions() {
        return options().project(FileOptions.ENCODING, PRETTY_PRINT, INCLUDE_EMPTY_TABLE,
                DOC_TYPE);
    }

    @Override
    protected IDataSet prepare(Object data) throws Exception {
        if (data instanceof ITable) {
            return new DefaultDataSet((ITable) data);
        }
        return (IDataSet) data;
    }
}
