package io.github.yok.flexdataio.format.sql;

import io.github.yok.flexdataio.config.DataTypeFactoryMode;
import io.github.yok.flexdataio.config.OptionSpec;
import io.github.yok.flexdataio.db.DbUnitConfigFactory;
import java.sql.Connection;

/**
 * Bookkeeping options shared by the SQL reader and writer. None of them is forwarded to the codec
 * call.
 *
 * @author Yasuharu.Okawauchi
 */
final class SqlOptions {

    // Externally owned JDBC connection; never closed by the adapters
    static final OptionSpec<Connection> CONNECTION =
            OptionSpec.required("connection", Connection.class);

    // Schema of the table; the connection's current schema when absent
    static final OptionSpec<String> SCHEMA = OptionSpec.optional("schema", String.class, null);

    // Database product selecting the DBUnit data type factory
    static final OptionSpec<DataTypeFactoryMode> DATA_TYPE_FACTORY_MODE = OptionSpec.optional(
            "dataTypeFactoryMode", DataTypeFactoryMode.class, DataTypeFactoryMode.DEFAULT);

    // DBUnit settings; defaults of DbUnitConfigProperties when absent
    static final OptionSpec<DbUnitConfigFactory> CONFIG_FACTORY =
            OptionSpec.optional("configFactory", DbUnitConfigFactory.class, null);

    private SqlOptions() {
        // Constants only.
    }

    static DbUnitConfigFactory configFactory(DbUnitConfigFactory configured) {
        return configured != null ? configured : new DbUnitConfigFactory();
    }
}
