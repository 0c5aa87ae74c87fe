package io.github.yok.flexdataio.config;

import io.github.yok.flexdataio.core.DataIo;
import io.github.yok.flexdataio.db.DbUnitConfigFactory;
import io.github.yok.flexdataio.registry.AdapterRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration exposing {@link DataIo} together with its registry and DBUnit settings.
 *
 * <p>
 * Binds {@code flexdataio.*} into {@link DataIoProperties} and {@code dbunit.config.*} into
 * {@link DbUnitConfigProperties}. Import it from an application with
 * {@code @Import(DataIoConfiguration.class)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Configuration
@EnableConfigurationProperties({DataIoProperties.class, DbUnitConfigProperties.class})
public class DataIoConfiguration {

    @Bean
    public AdapterRegistry adapterRegistry() {
        return AdapterRegistry.defaultRegistry();
    }

    @Bean
    public DbUnitConfigFactory dbUnitConfigFactory(DbUnitConfigProperties properties) {
        return new DbUnitConfigFactory(properties);
    }

    @Bean
    public DataIo dataIo(AdapterRegistry adapterRegistry, DataIoProperties properties,
            DbUnitConfigFactory dbUnitConfigFactory) {
        return new DataIo(adapterRegistry, properties, dbUnitConfigFactory);
    }
}
