package io.github.yok.flexdataio.metadata;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Transport signals of a database-backed load or save.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@RequiredArgsConstructor
public final class SqlTransport extends TransportInfo {

    // Rows read or written
    private final int rows;

    // Query text executed by a reader; null for writers
    private final String query;

    // Table read from or written to; null for free-form queries
    private final String tableName;
}
