package io.github.yok.flexdataio.format.csv;

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
import org.apache.commons.csv.QuoteMode;
import org.dbunit.dataset.ITable;

/**
 * Writes an {@link ITable} to a CSV file.
 *
 * <p>
 * Options: {@code path} (required), {@code delimiter}, {@code quote}, {@code escape},
 * {@code quoteMode} (default {@link QuoteMode#MINIMAL}), {@code recordSeparator} (default the
 * platform line separator), {@code header} (default {@code true}), {@code nullString},
 * {@code encoding} (default UTF-8).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class CsvTableWriter extends AbstractFileWriter<ITable> {

    static final OptionSpec<QuoteMode> QUOTE_MODE =
            OptionSpec.optional("quoteMode", QuoteMode.class, QuoteMode.MINIMAL);

    static final OptionSpec<String> RECORD_SEPARATOR = OptionSpec
            .optional("recordSeparator", String.class, System.lineSeparator())
            .validatedBy(s -> !s.isEmpty(), "must not be empty");

    static final OptionSchema SCHEMA = OptionSchema.of(FileOptions.PATH, CsvOptions.DELIMITER,
            CsvOptions.QUOTE, CsvOptions.ESCAPE, QUOTE_MODE, RECORD_SEPARATOR, CsvOptions.HEADER,
            CsvOptions.NULL_STRING, FileOptions.ENCODING);

    public static final AdapterKind<CsvTableWriter> KIND = AdapterKind.writer(DataFormat.CSV,
            CsvTableWriter.class, SCHEMA, CsvTableWriter::new, ITable.class);

    /**
     * Creates a writer from bound options.
     *
     * @param options options bound against {@link #KIND}
     */
    public CsvTableWriter(AdapterOptions options) {
        this(options, new CsvCodec());
    }

    CsvTableWriter(AdapterOptions options, FileCodec<ITable> codec) {
        super(options, codec);
    }

    /**
     * Creates a writer from raw options.
     *
     * @param options raw option values
     * @return a new writer
     * @throws io.github.yok.flexdataio.exception.ConfigurationException if the options are invalid
     */
    public static CsvTableWriter of(Map<String, ?> options) {
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
    public AdapterKind<CsvTableWriter> kind() {
        return KIND;
    }

    @Override
    public Map<String, Object> savingOptions() {
        return options().project(CsvOptions.DELIMITER, CsvOptions.QUOTE, CsvOptions.ESCAPE,
                QUOTE_MODE, RECORD_SEPARATOR, CsvOptions.HEADER, CsvOptions.NULL_STRING,
                FileOptions.ENCODING);
    }
}
