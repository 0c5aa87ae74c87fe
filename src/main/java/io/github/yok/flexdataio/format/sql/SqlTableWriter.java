package io.github.yok.flexdataio.format.sql;

import io.github.yok.flexdataio.adapter.AbstractDataWriter;
import io.github.yok.flexdataio.adapter.AdapterKind;
import io.github.yok.flexdataio.config.AdapterOptions;
import io.github.yok.flexdataio.config.OptionSchema;
import io.github.yok.flexdataio.config.OptionSpec;
import io.github.yok.flexdataio.format.DataFormat;
import io.github.yok.flexdataio.metadata.SqlTransport;
import io.github.yok.flexdataio.metadata.TransportInfo;
import java.util.List;
import java.util.Map;
import org.dbunit.dataset.ITable;

/**
 * Writes an {@link ITable} into a database table.
 *
 * <p>
 * Options:
 * </p>
 * <ul>
 * <li>{@code tableName} (required): target table, created with quoted identifiers when missing</li>
 * <li>{@code connection} (required): open JDBC connection, never closed by the writer</li>
 * <li>{@code schema}, {@code dataTypeFactoryMode}, {@code configFactory}: DBUnit setup</li>
 * <li>{@code ifExists}: {@link IfExists#FAIL} (default), {@link IfExists#REPLACE} or
 * {@link IfExists#APPEND}</li>
 * <li>{@code batchSize}: statements per batch; {@code dbunit.config.batch-size} when absent</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public class SqlTableWriter extends AbstractDataWriter {

    static final OptionSpec<String> TABLE_NAME = OptionSpec.required("tableName", String.class)
            .validatedBy(s -> !s.isBlank(), "must not be blank");

    static final OptionSpec<IfExists> IF_EXISTS =
            OptionSpec.optional("ifExists", IfExists.class, IfExists.FAIL);

    static final OptionSpec<Integer> BATCH_SIZE = OptionSpec
            .optional("batchSize", Integer.class, null).validatedBy(n -> n > 0, "must be > 0");

    static final OptionSchema SCHEMA = OptionSchema.of(TABLE_NAME, SqlOptions.CONNECTION,
            SqlOptions.SCHEMA, SqlOptions.DATA_TYPE_FACTORY_MODE, SqlOptions.CONFIG_FACTORY,
            IF_EXISTS, BATCH_SIZE);

    public static final AdapterKind<SqlTableWriter> KIND = AdapterKind.writer(DataFormat.SQL,
            SqlTableWriter.class, SCHEMA, SqlTableWriter::new, ITable.class);

    private final SqlCodec codec;

    /**
     * Creates a writer from bound options.
     *
     * @param options options bound against {@link #KIND}
     */
    public SqlTableWriter(AdapterOptions options) {
        this(options,
                new DbUnitSqlCodec(SqlOptions.configFactory(options.get(SqlOptions.CONFIG_FACTORY)),
                        options.get(SqlOptions.DATA_TYPE_FACTORY_MODE)));
    }

    SqlTableWriter(AdapterOptions options, SqlCodec codec) {
        super(options);
        this.codec = codec;
    }

    /**
     * Creates a writer from raw options.
     *
     * @param options raw option values
     * @return a new writer
     */
    public static SqlTableWriter of(Map<String, ?> options) {
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
    public AdapterKind<SqlTableWriter> kind() {
        return KIND;
    }

    @Override
    public Map<String, Object> savingOptions() {
        return options().project(IF_EXISTS, BATCH_SIZE);
    }

    @Override
    protected TransportInfo write(Object data, Map<String, Object> savingOptions)
            throws Exception {
        ITable table = (ITable) data;
        String tableName = options().get(TABLE_NAME);
        codec.write(table, options().get(SqlOptions.CONNECTION), options().get(SqlOptions.SCHEMA),
                tableName, savingOptions);
        return new SqlTransport(table.getRowCount(), null, tableName);
    }

    @Override
    protected String describeTarget() {
        return "table " + options().get(TABLE_NAME);
    }
}
