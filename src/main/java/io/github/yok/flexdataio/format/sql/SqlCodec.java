package io.github.yok.flexdataio.format.sql;

import java.sql.Connection;
import java.util.Map;
import org.dbunit.dataset.ITable;

/**
 * Narrow seam between the SQL adapters and the database. The connection is owned by the caller and
 * is never closed by a codec.
 *
 * @author Yasuharu.Okawauchi
 */
public interface SqlCodec {

    /**
     * Executes a query and materializes its result.
     *
     * @param connection open JDBC connection
     * @param schema schema, or {@code null} for the connection's current schema
     * @param resultName name given to the result table
     * @param sql query text
     * @param options loading options ({@code coerceFloat}, {@code params})
     * @return the fully read result
     * @throws Exception if the query fails
     */
    ITable read(Connection connection, String schema, String resultName, String sql,
            Map<String, Object> options) throws Exception;

    /**
     * Writes a table, creating the database table when needed.
     *
     * @param data rows to insert
     * @param connection open JDBC connection
     * @param schema schema, or {@code null} for the connection's current schema
     * @param tableName target table
     * @param options saving options ({@code ifExists}, {@code batchSize})
     * @throws Exception if the table exists and {@code ifExists} is {@code FAIL}, or a statement
     *         fails
     */
    void write(ITable data, Connection connection, String schema, String tableName,
            Map<String, Object> options) throws Exception;
}
