package io.github.yok.flexdataio.metadata;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Shape partition of a {@link ResultMetadata}, present for every load and save.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DataFrameMetadata {

    private final int rows;

    private final ImmutableList<String> columnNames;

    // Data-type labels aligned with columnNames
    private final ImmutableList<String> datatypes;

    DataFrameMetadata(DataShape shape) {
        this.rows = shape.getRowCount();
        this.columnNames = shape.getColumnNames();
        this.datatypes = shape.getDatatypes();
    }
}
