package io.github.yok.flexdataio.format.sql;

import io.github.yok.flexdataio.config.DataTypeFactoryMode;
import io.github.yok.flexdataio.db.DataTypeFactoryResolver;
import io.github.yok.flexdataio.db.DbUnitConfigFactory;
import io.github.yok.flexdataio.util.TableSupport;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.CompositeTable;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultDataSet;
import org.dbunit.dataset.DefaultTableMetaData;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.datatype.DataType;
import org.dbunit.operation.DatabaseOperation;

/**
 * {@link SqlCodec} backed by DBUnit.
 *
 * <p>
 * Queries are materialized through {@link DatabaseConnection#createQueryTable(String, String)} (or
 * a prepared statement when parameters are given). Writes create the table with quoted
 * identifiers, so column case is preserved, and insert rows with {@link DatabaseOperation#INSERT}
 * inside a transaction. The JDBC connection is wrapped, never closed.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
class DbUnitSqlCodec implements SqlCodec {

    // Applies dbunit.config.* settings to each DBUnit connection
    private final DbUnitConfigFactory configFactory;

    // Database product whose data type factory is used
    private final DataTypeFactoryMode mode;

    /**
     * {@inheritDoc}
     */
    @Override
    public ITable read(Connection connection, String schema, String resultName, String sql,
            Map<String, Object> options) throws Exception {
        DatabaseConnection dbConn = open(connection, schema, null);
        List<Object> params = SqlTableReader.PARAMS.valueIn(options);
        ITable result;
        if (params == null || params.isEmpty()) {
            result = dbConn.createQueryTable(resultName, sql);
        } else {
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                for (int i = 0; i < params.size(); i++) {
                    ps.setObject(i + 1, params.get(i));
                }
                result = dbConn.createTable(resultName, ps);
            }
        }
        return copy(result, SqlTableReader.COERCE_FLOAT.valueIn(options));
    }

    /**
     * {@inheritDoc}
     *
     * <p>
     * Table creation, replacement and inserts run in one transaction on the borrowed connection;
     * its auto-commit flag is restored afterwards. A table created by a failed call is dropped
     * again, since some databases commit DDL implicitly.
     * </p>
     */
    @Override
    public void write(ITable data, Connection connection, String schema, String tableName,
            Map<String, Object> options) throws Exception {
        String effectiveSchema = schema != null ? schema : connection.getSchema();
        String qualified = qualify(effectiveSchema, tableName);
        IfExists ifExists = SqlTableWriter.IF_EXISTS.valueIn(options);

        boolean exists = tableExists(connection, effectiveSchema, tableName);
        if (exists && ifExists == IfExists.FAIL) {
            throw new DataSetException("Table " + qualified + " already exists");
        }
        checkCastable(data);

        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try {
            if (!exists) {
                execute(connection, createTableSql(qualified, data));
            } else if (ifExists == IfExists.REPLACE) {
                execute(connection, "DROP TABLE " + qualified);
                execute(connection, createTableSql(qualified, data));
            } else {
                log.debug("Appending to existing table {}", qualified);
            }
            insert(data, connection, effectiveSchema, tableName,
                    SqlTableWriter.BATCH_SIZE.valueIn(options));
            connection.commit();
            log.debug("Transaction committed for {}", qualified);
        } catch (Exception e) {
            rollback(connection, effectiveSchema, tableName, exists, e);
            throw e;
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    private void insert(ITable data, Connection connection, String schema, String tableName,
            Integer batchSize) throws Exception {
        Column[] columns = data.getTableMetaData().getColumns();
        ITable renamed = new CompositeTable(new DefaultTableMetaData(tableName, columns), data);
        DatabaseConnection dbConn = open(connection, schema, batchSize);
        DatabaseConfig config = dbConn.getConfig();
        int size = (Integer) config.getProperty(DatabaseConfig.PROPERTY_BATCH_SIZE);
        boolean batched =
                Boolean.TRUE.equals(config.getProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS));
        if (batched && data.getRowCount() % size == 0) {
            // DBUnit flushes one more, empty batch after a full last one, which some drivers reject
            config.setProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS, false);
            log.debug("Batching disabled: {} rows fill whole batches of {}", data.getRowCount(),
                    size);
        }
        DatabaseOperation.INSERT.execute(dbConn, new DefaultDataSet(renamed));
    }

    private static void rollback(Connection connection, String schema, String tableName,
            boolean existed, Exception cause) {
        try {
            connection.rollback();
            log.warn("Transaction rolled back for table {}", tableName);
            if (!existed && tableExists(connection, schema, tableName)) {
                execute(connection, "DROP TABLE " + qualify(schema, tableName));
                connection.commit();
            }
        } catch (SQLException rollbackEx) {
            log.warn("Rollback failed: {}", rollbackEx.getMessage(), rollbackEx);
            cause.addSuppressed(rollbackEx);
        }
    }

    /**
     * Checks that every value can be cast to its column's declared type, so conversion errors
     * surface before any DDL runs.
     *
     * @param data table to check
     * @throws DataSetException if a value cannot be cast
     */
    static void checkCastable(ITable data) throws DataSetException {
        Column[] columns = data.getTableMetaData().getColumns();
        for (int r = 0; r < data.getRowCount(); r++) {
            for (Column column : columns) {
                DataType type = column.getDataType();
                if (type != DataType.UNKNOWN) {
                    type.typeCast(data.getValue(r, column.getColumnName()));
                }
            }
        }
    }

    private DatabaseConnection open(Connection connection, String schema, Integer batchSize)
            throws Exception {
        String effectiveSchema = schema != null ? schema : connection.getSchema();
        DatabaseConnection dbConn = effectiveSchema == null ? new DatabaseConnection(connection)
                : new DatabaseConnection(connection, effectiveSchema);
        DatabaseConfig config = dbConn.getConfig();
        configFactory.configure(config, DataTypeFactoryResolver.create(mode), batchSize);
        // Table names are created quoted, so metadata lookups must not fold their case
        config.setProperty(DatabaseConfig.FEATURE_CASE_SENSITIVE_TABLE_NAMES, true);
        return dbConn;
    }

    static String createTableSql(String qualifiedName, ITable data) throws DataSetException {
        List<String> defs = new ArrayList<>();
        for (Column column : data.getTableMetaData().getColumns()) {
            defs.add(quote(column.getColumnName()) + " "
                    + SqlTypeMapper.ddlType(data, column));
        }
        return "CREATE TABLE " + qualifiedName + " (" + String.join(", ", defs) + ")";
    }

    static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    private static String qualify(String schema, String tableName) {
        return schema == null ? quote(tableName) : quote(schema) + "." + quote(tableName);
    }

    private static boolean tableExists(Connection connection, String schema, String tableName)
            throws SQLException {
        DatabaseMetaData meta = connection.getMetaData();
        String escape = meta.getSearchStringEscape();
        try (ResultSet rs = meta.getTables(connection.getCatalog(), escapeLike(schema, escape),
                escapeLike(tableName, escape), new String[] {"TABLE"})) {
            return rs.next();
        }
    }

    // Metadata lookups take LIKE patterns; names are matched literally
    static String escapeLike(String name, String escape) {
        if (name == null || escape == null || escape.isEmpty()) {
            return name;
        }
        return name.replace(escape, escape + escape).replace("_", escape + "_").replace("%",
                escape + "%");
    }

    private static void execute(Connection connection, String sql) throws SQLException {
        log.debug("Executing: {}", sql);
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
        }
    }

    private static ITable copy(ITable result, boolean coerceFloat) throws DataSetException {
        Column[] columns = result.getTableMetaData().getColumns();
        List<DataType> types = new ArrayList<>(columns.length);
        for (Column column : columns) {
            int sqlType = column.getDataType().getSqlType();
            boolean decimal = sqlType == Types.DECIMAL || sqlType == Types.NUMERIC;
            types.add(coerceFloat && decimal ? DataType.DOUBLE : column.getDataType());
        }
        List<Object[]> rows = new ArrayList<>(result.getRowCount());
        for (Object[] row : TableSupport.rows(result)) {
            for (int c = 0; c < row.length; c++) {
                if (types.get(c) == DataType.DOUBLE && row[c] instanceof BigDecimal) {
                    row[c] = ((BigDecimal) row[c]).doubleValue();
                }
            }
            rows.add(row);
        }
        List<String> names = Arrays.stream(columns).map(Column::getColumnName)
                .collect(Collectors.toList());
        return TableSupport.newTable(result.getTableMetaData().getTableName(), names, types,
                rows);
    }
}
