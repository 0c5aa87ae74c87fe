package io.github.yok.flexdataio.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.datatype.DataType;
import org.junit.jupiter.api.Test;

class ColumnKindTest {

    @Test
    void of_正常ケース_型が宣言された列_宣言型から決まること() throws Exception {
        DefaultTable table = new DefaultTable("t", new Column[] {
                new Column("small", DataType.SMALLINT), new Column("n", DataType.NUMERIC),
                new Column("blob", DataType.BLOB), new Column("text", DataType.CLOB)});

        assertEquals(ColumnKind.INT,
                ColumnKind.of(table, table.getTableMetaData().getColumns()[0]));
        assertEquals(ColumnKind.DOUBLE,
                ColumnKind.of(table, table.getTableMetaData().getColumns()[1]));
        assertEquals(ColumnKind.BINARY,
                ColumnKind.of(table, table.getTableMetaData().getColumns()[2]));
        assertEquals(ColumnKind.STRING,
                ColumnKind.of(table, table.getTableMetaData().getColumns()[3]));
    }

    @Test
    void of_正常ケース_型が不明な列_最初の非null値から決まること() throws Exception {
        Column column = new Column("c", DataType.UNKNOWN);
        DefaultTable table = new DefaultTable("t", new Column[] {column});
        table.addRow(new Object[] {null});
        table.addRow(new Object[] {LocalDate.of(2024, 1, 2)});

        assertEquals(ColumnKind.DATE, ColumnKind.of(table, column));
    }

    @Test
    void of_正常ケース_型が不明で全てnullの列_文字列になること() throws Exception {
        Column column = new Column("c", DataType.UNKNOWN);
        DefaultTable table = new DefaultTable("t", new Column[] {column});
        table.addRow(new Object[] {null});

        assertEquals(ColumnKind.STRING, ColumnKind.of(table, column));
    }

    @Test
    void normalize_正常ケース_異なる表現の値_種別のJava型に変換されること() throws Exception {
        assertEquals(7, ColumnKind.INT.normalize("7"));
        assertEquals(7L, ColumnKind.LONG.normalize(7));
        assertEquals(1.5f, ColumnKind.FLOAT.normalize(1.5));
        assertEquals(Date.valueOf("2024-01-02"),
                ColumnKind.DATE.normalize(LocalDate.of(2024, 1, 2)));
        assertEquals(new Timestamp(0L), ColumnKind.TIMESTAMP.normalize(Instant.EPOCH));
        assertEquals("12", ColumnKind.STRING.normalize(12));
        assertNull(ColumnKind.BOOLEAN.normalize(null));
    }

    @Test
    void normalize_異常ケース_数値でない文字列_DataSetExceptionが送出されること() {
        assertThrows(DataSetException.class, () -> ColumnKind.INT.normalize("abc"));
    }

    @Test
    void getDataType_正常ケース_全種別_読み戻し時の型が返ること() {
        assertEquals(List.of(DataType.VARCHAR, DataType.INTEGER, DataType.BIGINT_AUX_LONG,
                DataType.DOUBLE, DataType.REAL, DataType.BOOLEAN, DataType.DATE,
                DataType.TIMESTAMP, DataType.BINARY),
                Arrays.stream(ColumnKind.values()).map(ColumnKind::getDataType)
                        .collect(Collectors.toList()));
    }
}
