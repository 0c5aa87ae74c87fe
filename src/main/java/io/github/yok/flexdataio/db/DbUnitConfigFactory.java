package io.github.yok.flexdataio.db;

import io.github.yok.flexdataio.config.DbUnitConfigProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.dataset.datatype.IDataTypeFactory;

/**
 * Applies application-wide settings to DBUnit's {@link DatabaseConfig} for the SQL adapters.
 *
 * <p>
 * Every {@code DatabaseConnection} the SQL adapters open receives the same data type factory and
 * the settings of {@link DbUnitConfigProperties}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class DbUnitConfigFactory {

    // Properties class that externalizes DBUnit settings
    private final DbUnitConfigProperties props;

    /**
     * Creates a factory with default {@link DbUnitConfigProperties}, for use outside the Spring
     * container.
     */
    public DbUnitConfigFactory() {
        this.props = new DbUnitConfigProperties();
    }

    /**
     * Applies application-wide settings to the specified {@link DatabaseConfig}.
     *
     * @param cfg DBUnit {@link DatabaseConfig} object
     * @param dataTypeFactory vendor-specific {@link IDataTypeFactory} implementation
     */
    public void configure(DatabaseConfig cfg, IDataTypeFactory dataTypeFactory) {
        configure(cfg, dataTypeFactory, null);
    }

    /**
     * Applies application-wide settings, overriding the batch size.
     *
     * @param cfg DBUnit {@link DatabaseConfig} object
     * @param dataTypeFactory vendor-specific {@link IDataTypeFactory} implementation
     * @param batchSize batch size to use instead of the configured one, or {@code null}
     */
    public void configure(DatabaseConfig cfg, IDataTypeFactory dataTypeFactory,
            Integer batchSize) {
        cfg.setProperty(DatabaseConfig.PROPERTY_DATATYPE_FACTORY, dataTypeFactory);
        log.debug("DBUnit: DataTypeFactory set to {}", dataTypeFactory.getClass().getSimpleName());

        cfg.setProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN, props.getEscapePattern());
        cfg.setProperty(DatabaseConfig.PROPERTY_FETCH_SIZE, props.getFetchSize());

        cfg.setProperty(DatabaseConfig.FEATURE_ALLOW_EMPTY_FIELDS, props.isAllowEmptyFields());
        cfg.setProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS, props.isBatchedStatements());

        int size = batchSize != null ? batchSize : props.getBatchSize();
        cfg.setProperty(DatabaseConfig.PROPERTY_BATCH_SIZE, size);
        log.debug("DBUnit: allow empty fields = {}, batched statements = {}, batch size = {}",
                props.isAllowEmptyFields(), props.isBatchedStatements(), size);
    }
}
