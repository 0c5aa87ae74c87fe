package io.github.yok.flexdataio.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * DBUnit settings shared by every connection the SQL adapters open.
 *
 * <p>
 * Bound from {@code application.yml}:
 * </p>
 * <ul>
 * <li>{@code dbunit.config.allow-empty-fields}: accept {@code ""} as a column value</li>
 * <li>{@code dbunit.config.batched-statements}: send inserts as JDBC batches</li>
 * <li>{@code dbunit.config.batch-size}: statements per batch</li>
 * <li>{@code dbunit.config.fetch-size}: rows fetched per round trip when reading</li>
 * <li>{@code dbunit.config.escape-pattern}: identifier quoting, {@code ?} standing for the
 * name</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "dbunit.config")
@Getter
@Setter
@NoArgsConstructor
public class DbUnitConfigProperties {

    /**
     * Whether DBUnit accepts empty strings as field values.
     */
    private boolean allowEmptyFields = true;

    /**
     * Whether inserts are executed as JDBC batches.
     */
    private boolean batchedStatements = true;

    /**
     * Statements per batch. A {@code batchSize} option on a SQL writer overrides it for that
     * writer.
     */
    private int batchSize = 100;

    /**
     * JDBC fetch size used for SQL reads.
     */
    private int fetchSize = 100;

    /**
     * Escape pattern applied to table and column names. Tables are created with quoted names, so
     * the default keeps their case.
     */
    private String escapePattern = "\"?\"";
}
