package io.github.yok.flexdataio.metadata;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import lombok.ToString;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.ITable;

/**
 * Row count, ordered column names and aligned data-type labels of an in-memory dataset.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class DataShape {

    // Shape of an empty data set
    private static final DataShape EMPTY = new DataShape(0, List.of(), List.of());

    private final int rowCount;

    private final ImmutableList<String> columnNames;

    // One label per column, aligned with columnNames
    private final ImmutableList<String> datatypes;

    /**
     * Creates a shape.
     *
     * @param rowCount number of rows
     * @param columnNames ordered column names
     * @param datatypes data-type labels aligned with {@code columnNames}
     * @throws IllegalArgumentException if the lists differ in length or the count is negative
     */
    public DataShape(int rowCount, List<String> columnNames, List<String> datatypes) {
        if (rowCount < 0) {
            throw new IllegalArgumentException("rowCount must not be negative: " + rowCount);
        }
        if (columnNames.size() != datatypes.size()) {
            throw new IllegalArgumentException("column names and datatypes differ in length: "
                    + columnNames.size() + " != " + datatypes.size());
        }
        this.rowCount = rowCount;
        this.columnNames = ImmutableList.copyOf(columnNames);
        this.datatypes = ImmutableList.copyOf(datatypes);
    }

    /**
     * Derives the shape of a table. Data-type labels are DBUnit {@code DataType} names.
     *
     * @param table table
     * @return its shape
     * @throws DataSetException if the table metadata cannot be read
     */
    public static DataShape of(ITable table) throws DataSetException {
        Column[] columns = table.getTableMetaData().getColumns();
        ImmutableList.Builder<String> names = ImmutableList.builder();
        ImmutableList.Builder<String> types = ImmutableList.builder();
        for (Column column : columns) {
            names.add(column.getColumnName());
            types.add(column.getDataType().toString());
        }
        return new DataShape(table.getRowCount(), names.build(), types.build());
    }

    /**
     * Derives the shape of a data set from its first table.
     *
     * @param dataSet data set
     * @return the shape of the first table, or an empty shape when there is none
     * @throws DataSetException if the data set cannot be read
     */
    public static DataShape of(IDataSet dataSet) throws DataSetException {
        String[] names = dataSet.getTableNames();
        if (names.length == 0) {
            return EMPTY;
        }
        return of(dataSet.getTable(names[0]));
    }

    /**
     * Derives the shape of a value of one of the supported in-memory types.
     *
     * @param data an {@link ITable} or {@link IDataSet}
     * @return its shape
     * @throws DataSetException if the data cannot be read
     * @throws IllegalArgumentException if the value is of another type
     */
    public static DataShape ofData(Object data) throws DataSetException {
        if (data instanceof ITable) {
            return of((ITable) data);
        }
        if (data instanceof IDataSet) {
            return of((IDataSet) data);
        }
        throw new IllegalArgumentException("Unsupported data type: "
                + (data == null ? "null" : data.getClass().getName()));
    }
}
