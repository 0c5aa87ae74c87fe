package io.github.yok.flexdataio.format.parquet;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexdataio.adapter.LoadResult;
import io.github.yok.flexdataio.exception.CodecException;
import io.github.yok.flexdataio.exception.ConfigurationException;
import io.github.yok.flexdataio.util.TableSupport;
import java.nio.file.Path;
import java.sql.Date;
import java.sql.Timestamp;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.dbunit.dataset.ITable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ParquetTableReaderTest {

    @TempDir
    Path tempDir;

    private Path file;

    @BeforeEach
    void setup() throws Exception {
        file = tempDir.resolve("events.parquet");
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("id", List.of(1L, 2L));
        columns.put("event name", Arrays.asList("start", null));
        columns.put("day", List.of(Date.valueOf("2024-01-02"), Date.valueOf("2024-01-03")));
        columns.put("at", List.of(Timestamp.valueOf("2024-01-02 03:04:05"),
                Timestamp.valueOf("2024-01-03 03:04:05")));
        columns.put("payload", List.of(new byte[] {1, 2}, new byte[] {3}));
        ParquetTableWriter.of(Map.of("path", file))
                .save(TableSupport.fromColumns("events", columns));
    }

    @Test
    void load_正常ケース_全列を読み込む_列名と型が保たれること() throws Exception {
        LoadResult<ITable> result = ParquetTableReader.of(Map.of("path", file)).load(ITable.class);

        ITable table = result.getData();
        assertEquals("events", table.getTableMetaData().getTableName());
        assertEquals(List.of("id", "event name", "day", "at", "payload"),
                result.getMetadata().getDataframeMetadata().getColumnNames());
        assertEquals(2L, table.getValue(1, "id"));
        assertNull(table.getValue(1, "event name"));
        assertEquals(Date.valueOf("2024-01-02"), table.getValue(0, "day"));
        assertEquals(Timestamp.valueOf("2024-01-03 03:04:05"), table.getValue(1, "at"));
        assertArrayEquals(new byte[] {1, 2}, (byte[]) table.getValue(0, "payload"));
    }

    @Test
    void load_正常ケース_列を指定する_指定順の列のみ返ること() throws Exception {
        ITable table = ParquetTableReader
                .of(Map.of("path", file, "columns", List.of("event name", "id")))
                .load(ITable.class).getData();

        assertEquals(2, table.getTableMetaData().getColumns().length);
        assertEquals("event name", table.getTableMetaData().getColumns()[0].getColumnName());
        assertEquals("start", table.getValue(0, "event name"));
    }

    @Test
    void load_異常ケース_存在しない列を指定する_利用可能な列が示されること() {
        CodecException ex = assertThrows(CodecException.class, () -> ParquetTableReader
                .of(Map.of("path", file, "columns", List.of("missing"))).load(ITable.class));

        assertTrue(ex.getMessage().contains("Column 'missing' not found"));
        assertTrue(ex.getMessage().contains("event name"));
    }

    @Test
    void of_異常ケース_空の列一覧を指定する_ConfigurationExceptionが送出されること() {
        assertThrows(ConfigurationException.class,
                () -> ParquetTableReader.of(Map.of("path", file, "columns", List.of())));
    }

    @Test
    void loadingOptions_正常ケース_列を指定する_列一覧のみが返ること() {
        Map<String, Object> options = ParquetTableReader
                .of(Map.of("path", file, "columns", List.of("id"))).loadingOptions();

        assertEquals(Map.of("columns", List.of("id")), options);
    }
}
