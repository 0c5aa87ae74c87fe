package io.github.yok.flexdataio.metadata;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Database partition of a {@link ResultMetadata}.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class SqlMetadata {

    // Rows read or written
    private final int rows;

    // Query text (readers only)
    private final String query;

    // Table name, when the operation addressed a table
    private final String tableName;
}
