package io.github.yok.flexdataio.format.feather;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.flexdataio.exception.ConfigurationException;
import io.github.yok.flexdataio.metadata.ResultMetadata;
import io.github.yok.flexdataio.util.TableSupport;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.datatype.DataType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FeatherTableWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void save_正常ケース_非圧縮で全種類の列を書き込む_型と値が往復すること() throws Exception {
        Path file = tempDir.resolve("all.feather");
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("i", List.of(1, 2));
        columns.put("d", List.of(1.5, 2.5));
        columns.put("f", List.of(0.5f, 1.5f));
        columns.put("b", Arrays.asList(true, null));
        columns.put("s", List.of("x", "あ"));

        ResultMetadata saved = FeatherTableWriter
                .of(Map.of("path", file, "compression", "uncompressed"))
                .save(TableSupport.fromColumns("df", columns));
        ITable table = FeatherTableReader.of(Map.of("path", file)).load(ITable.class).getData();

        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(file), files.collect(Collectors.toList()));
        }
        assertEquals(Files.size(file), saved.getFileMetadata().orElseThrow().getSize());
        assertEquals(DataType.INTEGER, table.getTableMetaData().getColumns()[0].getDataType());
        assertEquals(2, table.getValue(1, "i"));
        assertEquals(2.5, table.getValue(1, "d"));
        assertEquals(0.5f, table.getValue(0, "f"));
        assertEquals(true, table.getValue(0, "b"));
        assertNull(table.getValue(1, "b"));
        assertEquals("あ", table.getValue(1, "s"));
    }

    @Test
    void save_正常ケース_チャンクより多い行を書き込む_全行が読み直せること() throws Exception {
        Path file = tempDir.resolve("chunks.arrow");

        FeatherTableWriter.of(Map.of("path", file, "chunkSize", 1)).save(sample(1, 2, 3));
        ITable table = FeatherTableReader.of(Map.of("path", file)).load(ITable.class).getData();

        assertEquals(3, table.getRowCount());
        assertEquals(3L, table.getValue(2, "col1"));
        assertEquals("v2", table.getValue(1, "col2"));
    }

    @Test
    void save_正常ケース_空のテーブルを書き込む_列のみ読み直せること() throws Exception {
        Path file = tempDir.resolve("empty.feather");

        FeatherTableWriter.of(Map.of("path", file)).save(sample());
        ITable table = FeatherTableReader.of(Map.of("path", file)).load(ITable.class).getData();

        assertEquals(0, table.getRowCount());
        assertEquals(2, table.getTableMetaData().getColumns().length);
    }

    @Test
    void savingOptions_正常ケース_既定値で生成する_LZ4圧縮とチャンク行数が返ること() {
        Map<String, Object> options =
                FeatherTableWriter.of(Map.of("path", tempDir.resolve("x.feather"))).savingOptions();

        assertEquals(Map.of("compression", FeatherCompression.LZ4, "chunkSize", 65536), options);
    }

    @Test
    void of_異常ケース_チャンク行数に0を指定する_ConfigurationExceptionが送出されること() {
        assertThrows(ConfigurationException.class, () -> FeatherTableWriter
                .of(Map.of("path", tempDir.resolve("x.feather"), "chunkSize", 0)));
    }

    @Test
    void of_異常ケース_未知の圧縮方式を指定する_ConfigurationExceptionが送出されること() {
        assertThrows(ConfigurationException.class, () -> FeatherTableWriter
                .of(Map.of("path", tempDir.resolve("x.feather"), "compression", "gzip")));
    }

    private static ITable sample(int... values) throws Exception {
        List<Long> col1 = new ArrayList<>();
        List<String> col2 = new ArrayList<>();
        for (int value : values) {
            col1.add((long) value);
            col2.add("v" + value);
        }
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("col1", col1);
        columns.put("col2", col2);
        return TableSupport.fromColumns("df", columns);
    }
}
