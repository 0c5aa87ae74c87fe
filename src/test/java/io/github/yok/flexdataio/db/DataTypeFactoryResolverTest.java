package io.github.yok.flexdataio.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import io.github.yok.flexdataio.config.DataTypeFactoryMode;
import org.dbunit.dataset.datatype.DefaultDataTypeFactory;
import org.dbunit.ext.hsqldb.HsqldbDataTypeFactory;
import org.dbunit.ext.oracle.Oracle10DataTypeFactory;
import org.dbunit.ext.postgresql.PostgresqlDataTypeFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class DataTypeFactoryResolverTest {

    @Test
    void create_正常ケース_製品を指定する_対応するファクトリが返ること() {
        assertEquals(HsqldbDataTypeFactory.class,
                DataTypeFactoryResolver.create(DataTypeFactoryMode.HSQLDB).getClass());
        assertEquals(Oracle10DataTypeFactory.class,
                DataTypeFactoryResolver.create(DataTypeFactoryMode.ORACLE).getClass());
        assertEquals(PostgresqlDataTypeFactory.class,
                DataTypeFactoryResolver.create(DataTypeFactoryMode.POSTGRESQL).getClass());
        assertEquals(DefaultDataTypeFactory.class,
                DataTypeFactoryResolver.create(DataTypeFactoryMode.DEFAULT).getClass());
    }

    @ParameterizedTest
    @EnumSource(DataTypeFactoryMode.class)
    void create_正常ケース_全ての製品を指定する_ファクトリが生成されること(DataTypeFactoryMode mode) {
        assertNotNull(DataTypeFactoryResolver.create(mode));
    }
}
