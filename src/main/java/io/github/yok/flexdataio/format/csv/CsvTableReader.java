package io.github.yok.flexdataio.format.csv;

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
 * Reads a CSV file into an {@link ITable} named after the file.
 *
 * <p>
 * Options:
 * </p>
 * <ul>
 * <li>{@code path} (required): source file</li>
 * <li>{@code delimiter}, {@code quote}, {@code escape}: single characters</li>
 * <li>{@code header}: first record holds column names (default {@code true}); otherwise columns
 * are named {@code col1}, {@code col2}, ...</li>
 * <li>{@code encoding} (default UTF-8), {@code skipRows} (lines skipped before the header),
 * {@code nullString}, {@code ignoreEmptyLines}, {@code trim}</li>
 * <li>{@code inferTypes}: infer INTEGER/BIGINT/DOUBLE/BOOLEAN columns (default {@code true})</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public class CsvTableReader extends AbstractFileReader<ITable> {

    static final OptionSpec<Integer> SKIP_ROWS = OptionSpec
            .optional("skipRows", Integer.class, 0).validatedBy(n -> n >= 0, "must be >= 0");

    static final OptionSpec<Boolean> IGNORE_EMPTY_LINES =
            OptionSpec.optional("ignoreEmptyLines", Boolean.class, true);

    static final OptionSpec<Boolean> TRIM = OptionSpec.optional("trim", Boolean.class, false);

    static final OptionSpec<Boolean> INFER_TYPES =
            OptionSpec.optional("inferTypes", Boolean.class, true);

    static final OptionSchema SCHEMA = OptionSchema.of(FileOptions.PATH, CsvOptions.DELIMITER,
            CsvOptions.QUOTE, CsvOptions.ESCAPE, CsvOptions.HEADER, FileOptions.ENCODING,
            SKIP_ROWS, CsvOptions.NULL_STRING, IGNORE_EMPTY_LINES, TRIM, INFER_TYPES);

    public static final AdapterKind<CsvTableReader> KIND = AdapterKind.reader(DataFormat.CSV,
            CsvTableReader.class, SCHEMA, CsvTableReader::new, ITable.class);

    /**
     * Creates a reader from bound options.
     *
     * @param options options bound against {@link #KIND}
     */
    public CsvTableReader(AdapterOptions options) {
        this(options, new CsvCodec());
    }

    CsvTableReader(AdapterOptions options, FileCodec<ITable> codec) {
        super(options, codec);
    }

    /**
     * Creates a reader from raw options.
     *
     * @param options raw option values
     * @return a new reader
     * @throws io.github.yok.flexdataio.exception.ConfigurationException if the options are invalid
     */
    public static CsvTableReader of(Map<String, ?> options) {
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
    public AdapterKind<CsvTableReader> kind() {
        return KIND;
    }

    @Override
    public Map<String, Object> loadingOptions() {
        return options().project(CsvOptions.DELIMITER, CsvOptions.QUOTE, CsvOptions.ESCAPE,
                CsvOptions.HEADER, FileOptions.ENCODING, SKIP_ROWS, CsvOptions.NULL_STRING,
                IGNORE_EMPTY_LINES, TRIM, INFER_TYPES);
    }
}
