package io.github.yok.flexdataio.format.html;

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
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.ITable;

/**
 * Reads the tables of an HTML document into an {@link IDataSet}, or one of them into an
 * {@link ITable}.
 *
 * <p>
 * Options:
 * </p>
 * <ul>
 * <li>{@code path} (required): source file</li>
 * <li>{@code selector}: CSS selector locating the tables (default {@code table})</li>
 * <li>{@code match}: regular expression the table text must contain</li>
 * <li>{@code headerRow}: index of the row holding column names (default 0; -1 for none)</li>
 * <li>{@code tableIndex}: matched table returned when loading an {@link ITable} (default 0)</li>
 * <li>{@code encoding} (default UTF-8), {@code inferTypes} (default {@code true})</li>
 * </ul>
 * <p>
 * A document without matching tables fails to load.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class HtmlTableReader extends AbstractFileReader<IDataSet> {

    static final OptionSpec<String> SELECTOR = OptionSpec
            .optional("selector", String.class, "table")
            .validatedBy(s -> !s.isBlank(), "must not be blank");

    static final OptionSpec<String> MATCH = OptionSpec.optional("match", String.class, null)
            .validatedBy(HtmlTableReader::isRegex, "must be a valid regular expression");

    static final OptionSpec<Integer> HEADER_ROW = OptionSpec
            .optional("headerRow", Integer.class, 0).validatedBy(n -> n >= -1, "must be >= -1");

    static final OptionSpec<Integer> TABLE_INDEX = OptionSpec
            .optional("tableIndex", Integer.class, 0).validatedBy(n -> n >= 0, "must be >= 0");

    static final OptionSpec<Boolean> INFER_TYPES =
            OptionSpec.optional("inferTypes", Boolean.class, true);

    static final OptionSchema SCHEMA = OptionSchema.of(FileOptions.PATH, SELECTOR, MATCH,
            HEADER_ROW, TABLE_INDEX, FileOptions.ENCODING, INFER_TYPES);

    public static final AdapterKind<HtmlTableReader> KIND = AdapterKind.reader(DataFormat.HTML,
            HtmlTableReader.class, SCHEMA, HtmlTableReader::new, IDataSet.class, ITable.class);

    /**
     * Creates a reader from bound options.
     *
     * @param options options bound against {@link #KIND}
     */
    public HtmlTableReader(AdapterOptions options) {
        this(options, new HtmlCodec());
    }

    HtmlTableReader(AdapterOptions options, FileCodec<IDataSet> codec) {
        super(options, codec);
    }

    /**
     * Creates a reader from raw options.
     *
     * @param options raw option values
     * @return a new reader
     */
    public static HtmlTableReader of(Map<String, ?> options) {
        return KIND.create(options);
    }

    /**
     * Returns the types this reader can produce.
     *
     * @return {@code [IDataSet, ITable]}
     */
    public static List<Class<?>> applicableTypes() {
        return KIND.getApplicableTypes();
    }

    @Override
    public AdapterKind<HtmlTableReader> kind() {
        return KIND;
    }

    @Override
    public Map<String, Object> loadingOptions() {
        return options().project(SELECTOR, MATCH, HEADER_ROW, FileOptions.ENCODING, INFER_TYPES);
    }

    @Override
    protected Object select(IDataSet decoded, Class<?> type) throws Exception {
        if (type == IDataSet.class) {
            return decoded;
        }
        return TableSupport.selectTable(decoded, options().get(TABLE_INDEX));
    }

    private static boolean isRegex(String text) {
        try {
            Pattern.compile(text);
            return true;
        } catch (PatternSyntaxException e) {
            return false;
        }
    }
}
