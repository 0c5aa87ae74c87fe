package io.github.yok.flexdataio.db;

import io.github.yok.flexdataio.config.DataTypeFactoryMode;
import org.dbunit.dataset.datatype.DefaultDataTypeFactory;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.db2.Db2DataTypeFactory;
import org.dbunit.ext.h2.H2DataTypeFactory;
import org.dbunit.ext.hsqldb.HsqldbDataTypeFactory;
import org.dbunit.ext.mssql.MsSqlDataTypeFactory;
import org.dbunit.ext.mysql.MySqlDataTypeFactory;
import org.dbunit.ext.oracle.Oracle10DataTypeFactory;
import org.dbunit.ext.postgresql.PostgresqlDataTypeFactory;

/**
 * Maps a {@link DataTypeFactoryMode} to the DBUnit {@link IDataTypeFactory} for that product.
 *
 * @author Yasuharu.Okawauchi
 */
public final class DataTypeFactoryResolver {

    private DataTypeFactoryResolver() {
        // Utility class; do not instantiate.
    }

    /**
     * Creates the data type factory for a database product.
     *
     * @param mode database product
     * @return a new factory instance
     */
    public static IDataTypeFactory create(DataTypeFactoryMode mode) {
        switch (mode) {
            case HSQLDB:
                return new HsqldbDataTypeFactory();
            case H2:
                return new H2DataTypeFactory();
            case ORACLE:
                return new Oracle10DataTypeFactory();
            case POSTGRESQL:
                return new PostgresqlDataTypeFactory();
            case MYSQL:
                return new MySqlDataTypeFactory();
            case SQLSERVER:
                return new MsSqlDataTypeFactory();
            case DB2:
                return new Db2DataTypeFactory();
            case DEFAULT:
            default:
                return new DefaultDataTypeFactory();
        }
    }
}
