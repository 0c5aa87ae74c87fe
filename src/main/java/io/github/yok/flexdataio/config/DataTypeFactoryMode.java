package io.github.yok.flexdataio.config;

/**
 * Database product whose DBUnit {@code IDataTypeFactory} the SQL adapters use to map column types.
 *
 * <ul>
 * <li>DEFAULT: DBUnit's generic JDBC type mapping</li>
 * <li>HSQLDB: for HyperSQL</li>
 * <li>H2: for H2 Database</li>
 * <li>ORACLE: for Oracle Database</li>
 * <li>POSTGRESQL: for PostgreSQL</li>
 * <li>MYSQL: for MySQL</li>
 * <li>SQLSERVER: for Microsoft SQL Server</li>
 * <li>DB2: for IBM Db2</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum DataTypeFactoryMode {
    // Generic JDBC type mapping
    DEFAULT,
    // HyperSQL
    HSQLDB,
    // H2 Database
    H2,
    // Oracle DB
    ORACLE,
    // PostgreSQL
    POSTGRESQL,
    // MySQL
    MYSQL,
    // Microsoft SQL Server
    SQLSERVER,
    // IBM Db2
    DB2
}
