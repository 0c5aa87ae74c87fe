package io.github.yok.flexdataio.format.xml;

import io.github.yok.flexdataio.adapter.AdapterKind;
import io.github.yok.flexdataio.config.AdapterOptions;
import io.github.yok.flexdataio.config.OptionSchema;
import io.github.yok.flexdataio.config.OptionSpec;
import io.github.yok.flexdataio.format.AbstractFileReader;
import io.github.yok.flexdataio.format.DataFormat;
import io.github.yok.flexdataio.format.FileCodec;
import io.github.yok.flexdataio.format.FileOptions;
import io.github.yok.flexdataio.util.TableSupport;
import java.util.List;
import java.util.Map;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.ITable;

/**
 * Reads a DBUnit flat XML document into an {@link IDataSet}, or one of its tables into an
 * {@link ITable}.
 *
 * <p>
 * Options:
 * </p>
 * <ul>
 * <li>{@code path} (required): source file</li>
 * <li>{@code tableName}: table returned when loading an {@link ITable}; the first table when
 * absent</li>
 * <li>{@code columnSensing} (default {@code true}), {@code caseSensitiveTableNames} (default
 * {@code false}), {@code dtdMetadata} (default {@code false})</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public class XmlTableReader extends AbstractFileReader<IDataSet> {

    static final OptionSpec<String> TABLE_NAME =
            OptionSpec.optional("tableName", String.class, null);

    static final OptionSpec<Boolean> COLUMN_SENSING =
            OptionSpec.optional("columnSensing", Boolean.class, true);

    static final OptionSpec<Boolean> CASE_SENSITIVE_TABLE_NAMES =
            OptionSpec.optional("caseSensitiveTableNames", Boolean.class, false);

    static final OptionSpec<Boolean> DTD_METADATA =
            OptionSpec.optional("dtdMetadata", Boolean.class, false);

    static final OptionSchema SCHEMA = OptionSchema.of(FileOptions.PATH, TABLE_NAME,
            COLUMN_SENSING, CASE_SENSITIVE_TABLE_NAMES, DTD_METADATA);

    public static final AdapterKind<XmlTableReader> KIND = AdapterKind.reader(DataFormat.XML,
            XmlTableReader.class, SCHEMA, XmlTableReader::new, ITable.class, IDataSet.class);

    /**
     * Creates a reader from bound options.
     *
     * @param options options bound against {@link #KIND}
     */
    public XmlTableReader(AdapterOptions options) {
        this(options, new XmlCodec());
    }

    XmlTableReader(AdapterOptions options, FileCodec<IDataSet> codec) {
        super(options, codec);
    }

    /**
     * Creates a reader from raw options.
     *
     * @param options raw option values
     * @return a new reader
     */
    public static XmlTableReader of(Map<String, ?> options) {
        return KIND.create(options);
    }

    /**
     * Returns the types this reader can produce.
     *
     * @return {@code [ITable, IDataSet]}
     */
    public static List<Class<?>> applicableTypes() {
        return KIND.getApplicableTypes();
    }

    @Override
    public AdapterKind<XmlTableReader> kind() {
        return KIND;
    }

    @Override
    public Map<String, Object> loadingOptions() {
        return options().project(COLUMN_SENSING, CASE_SENSITIVE_TABLE_NAMES, DTD_METADATA);
    }

    @Override
    protected Object select(IDataSet decoded, Class<?> type) throws Exception {
        if (type == IDataSet.class) {
            return decoded;
        }
        return TableSupport.selectTable(decoded, options().get(TABLE_NAME));
    }
}
