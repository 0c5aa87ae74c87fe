package io.github.yok.flexdataio.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import io.github.yok.flexdataio.config.DbUnitConfigProperties;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.dataset.datatype.DefaultDataTypeFactory;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.junit.jupiter.api.Test;

class DbUnitConfigFactoryTest {

    @Test
    void configure_正常ケース_デフォルト設定を適用する_各プロパティが設定されること() {
        DatabaseConfig cfg = new DatabaseConfig();
        IDataTypeFactory dtf = new DefaultDataTypeFactory();

        new DbUnitConfigFactory().configure(cfg, dtf);

        assertSame(dtf, cfg.getProperty(DatabaseConfig.PROPERTY_DATATYPE_FACTORY));
        assertEquals("\"?\"", cfg.getProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN));
        assertEquals(Boolean.TRUE, cfg.getProperty(DatabaseConfig.FEATURE_ALLOW_EMPTY_FIELDS));
        assertEquals(Boolean.TRUE, cfg.getProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS));
        assertEquals(100, cfg.getProperty(DatabaseConfig.PROPERTY_BATCH_SIZE));
        assertEquals(100, cfg.getProperty(DatabaseConfig.PROPERTY_FETCH_SIZE));
    }

    @Test
    void configure_正常ケース_プロパティを変更する_変更値が設定されること() {
        DbUnitConfigProperties props = new DbUnitConfigProperties();
        props.setAllowEmptyFields(false);
        props.setBatchedStatements(false);
        props.setBatchSize(10);
        props.setFetchSize(20);
        props.setEscapePattern("`?`");
        DatabaseConfig cfg = new DatabaseConfig();

        new DbUnitConfigFactory(props).configure(cfg, new DefaultDataTypeFactory());

        assertEquals(Boolean.FALSE, cfg.getProperty(DatabaseConfig.FEATURE_ALLOW_EMPTY_FIELDS));
        assertEquals(Boolean.FALSE, cfg.getProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS));
        assertEquals(10, cfg.getProperty(DatabaseConfig.PROPERTY_BATCH_SIZE));
        assertEquals(20, cfg.getProperty(DatabaseConfig.PROPERTY_FETCH_SIZE));
        assertEquals("`?`", cfg.getProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN));
    }

    @Test
    void configure_正常ケース_バッチサイズを上書きする_上書き値が優先されること() {
        DatabaseConfig cfg = new DatabaseConfig();
        new DbUnitConfigFactory().configure(cfg, new DefaultDataTypeFactory(), 7);
        assertEquals(7, cfg.getProperty(DatabaseConfig.PROPERTY_BATCH_SIZE));
    }
}
