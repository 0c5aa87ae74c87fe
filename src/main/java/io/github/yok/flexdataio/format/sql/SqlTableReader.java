package io.github.yok.flexdataio.format.sql;

import io.github.yok.flexdataio.adapter.AbstractDataReader;
import io.github.yok.flexdataio.adapter.AdapterKind;
import io.github.yok.flexdataio.config.AdapterOptions;
import io.github.yok.flexdataio.config.OptionSchema;
import io.github.yok.flexdataio.config.OptionSpec;
import io.github.yok.flexdataio.format.DataFormat;
import io.github.yok.flexdataio.metadata.SqlTransport;
import io.github.yok.flexdataio.metadata.TransportInfo;
import java.sql.Connection;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.dbunit.dataset.ITable;

/**
 * Reads a database table or query result into an {@link ITable}.
 *
 * <p>
 * Options:
 * </p>
 * <ul>
 * <li>{@code queryOrTable} (required): a table name, optionally schema-qualified, read with
 * {@code SELECT *}; anything else is executed as a query</li>
 * <li>{@code connection} (required): open JDBC connection, never closed by the reader</li>
 * <li>{@code schema}, {@code dataTypeFactoryMode}, {@code configFactory}: DBUnit setup</li>
 * <li>{@code coerceFloat}: read DECIMAL/NUMERIC columns as DOUBLE (default {@code true})</li>
 * <li>{@code params}: positional query parameters</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public class SqlTableReader extends AbstractDataReader {

    // Bare or schema-qualified identifier, e.g. "bar" or "PUBLIC.bar"
    private static final Pattern IDENTIFIER =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*(\\.[A-Za-z_][A-Za-z0-9_$]*)?");

    // Name of the result table of a free-form query
    static final String QUERY_RESULT_NAME = "query";

    static final OptionSpec<String> QUERY_OR_TABLE = OptionSpec
            .required("queryOrTable", String.class)
            .validatedBy(s -> !s.isBlank(), "must not be blank");

    static final OptionSpec<Boolean> COERCE_FLOAT =
            OptionSpec.optional("coerceFloat", Boolean.class, true);

    static final OptionSpec<List<Object>> PARAMS = OptionSpec.list("params", Object.class);

    static final OptionSchema SCHEMA = OptionSchema.of(QUERY_OR_TABLE, SqlOptions.CONNECTION,
            SqlOptions.SCHEMA, SqlOptions.DATA_TYPE_FACTORY_MODE, SqlOptions.CONFIG_FACTORY,
            COERCE_FLOAT, PARAMS);

    public static final AdapterKind<SqlTableReader> KIND = AdapterKind.reader(DataFormat.SQL,
            SqlTableReader.class, SCHEMA, SqlTableReader::new, ITable.class);

    private final SqlCodec codec;

    // Table name when queryOrTable is an identifier; null for queries
    private final String tableName;

    // SQL actually executed
    private final String query;

    /**
     * Creates a reader from bound options.
     *
     * @param options options bound against {@link #KIND}
     */
    public SqlTableReader(AdapterOptions options) {
        this(options,
                new DbUnitSqlCodec(SqlOptions.configFactory(options.get(SqlOptions.CONFIG_FACTORY)),
                        options.get(SqlOptions.DATA_TYPE_FACTORY_MODE)));
    }

    SqlTableReader(AdapterOptions options, SqlCodec codec) {
        super(options);
        this.codec = codec;
        String queryOrTable = options.get(QUERY_OR_TABLE).trim();
        if (IDENTIFIER.matcher(queryOrTable).matches()) {
            this.tableName = queryOrTable;
            this.query = "SELECT * FROM " + Arrays.stream(queryOrTable.split("\\."))
                    .map(DbUnitSqlCodec::quote).collect(Collectors.joining("."));
        } else {
            this.tableName = null;
            this.query = queryOrTable;
        }
    }

    /**
     * Creates a reader from raw options.
     *
     * @param options raw option values
     * @return a new reader
     */
    public static SqlTableReader of(Map<String, ?> options) {
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
    public AdapterKind<SqlTableReader> kind() {
        return KIND;
    }

    @Override
    public Map<String, Object> loadingOptions() {
        return options().project(COERCE_FLOAT, PARAMS);
    }

    /**
     * Returns the SQL this reader executes.
     *
     * @return query text
     */
    public String getQuery() {
        return query;
    }

    @Override
    protected Object read(Class<?> type, Map<String, Object> loadingOptions) throws Exception {
        Connection connection = options().get(SqlOptions.CONNECTION);
        String resultName = tableName != null ? tableName : QUERY_RESULT_NAME;
        return codec.read(connection, options().get(SqlOptions.SCHEMA), resultName, query,
                loadingOptions);
    }

    @Override
    protected TransportInfo transport(Object data) {
        return new SqlTransport(((ITable) data).getRowCount(), query, tableName);
    }

    @Override
    protected String describeSource() {
        return query;
    }
}
