package io.github.yok.flexdataio.format.orc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import io.github.yok.flexdataio.config.AdapterOptions;
import io.github.yok.flexdataio.exception.CodecException;
import io.github.yok.flexdataio.exception.ConfigurationException;
import io.github.yok.flexdataio.exception.TypeMismatchException;
import io.github.yok.flexdataio.format.DataFormat;
import io.github.yok.flexdataio.format.FileCodec;
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
import org.dbunit.dataset.DefaultDataSet;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.datatype.DataType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OrcTableWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void save_正常ケース_全種類の列を書き込む_型と値が往復すること() throws Exception {
        Path file = tempDir.resolve("all.orc");
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("i", List.of(1, 2));
        columns.put("d", List.of(1.5, 2.5));
        columns.put("f", List.of(0.5f, 1.5f));
        columns.put("b", Arrays.asList(true, null));
        columns.put("s", List.of("x", "y"));

        ResultMetadata saved = OrcTableWriter.of(Map.of("path", file))
                .save(TableSupport.fromColumns("df", columns));
        ITable table = OrcTableReader.of(Map.of("path", file)).load(ITable.class).getData();

        assertEquals(Files.size(file), saved.getFileMetadata().orElseThrow().getSize());
        assertEquals(2, saved.getDataframeMetadata().getRows());
        assertEquals(DataType.INTEGER, table.getTableMetaData().getColumns()[0].getDataType());
        assertEquals(2, table.getValue(1, "i"));
        assertEquals(2.5, table.getValue(1, "d"));
        assertEquals(1.5f, table.getValue(1, "f"));
        assertEquals(true, table.getValue(0, "b"));
        assertNull(table.getValue(1, "b"));
        assertEquals("y", table.getValue(1, "s"));
    }

    @Test
    void save_正常ケース_圧縮を指定する_チェックサムファイルを作らず読み直せること()
            throws Exception {
        Path file = tempDir.resolve("sample_df.orc");

        OrcTableWriter.of(Map.of("path", file, "compression", "snappy")).save(sample(1, 2, 3));
        ITable table = OrcTableReader.of(Map.of("path", file)).load(ITable.class).getData();

        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(file), files.collect(Collectors.toList()));
        }
        assertEquals(3, table.getRowCount());
        assertEquals(3L, table.getValue(2, "col1"));
    }

    @Test
    void save_正常ケース_空のテーブルを書き込む_列のみ読み直せること() throws Exception {
        Path file = tempDir.resolve("empty.orc");

        OrcTableWriter.of(Map.of("path", file)).save(sample());
        ITable table = OrcTableReader.of(Map.of("path", file)).load(ITable.class).getData();

        assertEquals(0, table.getRowCount());
        assertEquals(2, table.getTableMetaData().getColumns().length);
    }

    @Test
    void save_異常ケース_上書き不可で既存ファイルへ書き込む_CodecExceptionが送出されること()
            throws Exception {
        Path file = tempDir.resolve("exists.orc");
        Files.writeString(file, "x");

        assertThrows(CodecException.class,
                () -> OrcTableWriter.of(Map.of("path", file, "overwrite", false)).save(sample(1)));
        assertEquals("x", Files.readString(file));
    }

    @Test
    void save_異常ケース_適用外の型を渡す_コーデックが呼ばれないこと() throws Exception {
        @SuppressWarnings("unchecked")
        FileCodec<ITable> codec = mock(FileCodec.class);
        OrcTableWriter writer = new OrcTableWriter(
                bind(Map.of("path", tempDir.resolve("x.orc"))), codec);

        assertThrows(TypeMismatchException.class, () -> writer.save(new DefaultDataSet()));

        verify(codec, never()).encode(any(), any(), any());
    }

    @Test
    void savingOptions_正常ケース_既定値で生成する_ORCの既定値が返ること() {
        Map<String, Object> options =
                OrcTableWriter.of(Map.of("path", tempDir.resolve("x.orc"))).savingOptions();

        assertEquals(List.of("compression", "stripeSize", "rowIndexStride", "overwrite"),
                List.copyOf(options.keySet()));
        assertEquals(OrcCompression.ZLIB, options.get("compression"));
        assertEquals(64L * 1024 * 1024, options.get("stripeSize"));
        assertEquals(10000, options.get("rowIndexStride"));
        assertEquals(true, options.get("overwrite"));
    }

    @Test
    void of_異常ケース_未知の圧縮方式を指定する_ConfigurationExceptionが送出されること() {
        assertThrows(ConfigurationException.class, () -> OrcTableWriter
                .of(Map.of("path", tempDir.resolve("x.orc"), "compression", "brotli2")));
    }

    @Test
    void of_異常ケース_小さすぎる行インデックス間隔を指定する_ConfigurationExceptionが送出されること() {
        assertThrows(ConfigurationException.class, () -> OrcTableWriter
                .of(Map.of("path", tempDir.resolve("x.orc"), "rowIndexStride", 10)));
    }

    private static AdapterOptions bind(Map<String, ?> options) {
        return OrcTableWriter.SCHEMA.bind(DataFormat.ORC, options);
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
