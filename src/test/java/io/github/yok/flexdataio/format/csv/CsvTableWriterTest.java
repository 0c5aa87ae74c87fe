package io.github.yok.flexdataio.format.csv;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import io.github.yok.flexdataio.exception.TypeMismatchException;
import io.github.yok.flexdataio.format.DataFormat;
import io.github.yok.flexdataio.format.FileCodec;
import io.github.yok.flexdataio.metadata.ResultMetadata;
import io.github.yok.flexdataio.util.TableSupport;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.dbunit.dataset.DefaultDataSet;
import org.dbunit.dataset.ITable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvTableWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void save_正常ケース_テーブルを書き込む_ヘッダと値が出力されること() throws Exception {
        Path file = tempDir.resolve("nested/dir/out.csv");

        ResultMetadata metadata = CsvTableWriter.of(Map.of("path", file, "recordSeparator", "\n"))
                .save(sample());

        assertEquals("col1,col2\n1,4\n2,\"a,b\"\n",
                Files.readString(file, StandardCharsets.UTF_8));
        assertEquals(Files.size(file), metadata.getFileMetadata().get().getSize());
        assertEquals(2, metadata.getDataframeMetadata().getRows());
        assertEquals(List.of("col1", "col2"), metadata.getDataframeMetadata().getColumnNames());
    }

    @Test
    void save_正常ケース_ヘッダなしとnull文字列と区切り文字を指定する_指定どおり出力されること()
            throws Exception {
        Path file = tempDir.resolve("out.tsv");
        ITable table = TableSupport.fromRows("t", List.of("a", "b"),
                Arrays.<Object[]>asList(new Object[] {"x", null}));

        CsvTableWriter.of(Map.of("path", file, "header", false, "delimiter", "\\t",
                "nullString", "NULL", "recordSeparator", "\n")).save(table);

        assertEquals("x\tNULL\n", Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void save_正常ケース_バイナリ値を書き込む_大文字16進で出力されること() throws Exception {
        Path file = tempDir.resolve("bin.csv");
        ITable table = TableSupport.fromRows("t", List.of("data"),
                Arrays.<Object[]>asList(new Object[] {new byte[] {0x01, 0x2A, (byte) 0xFF}}));

        CsvTableWriter.of(Map.of("path", file, "recordSeparator", "\n")).save(table);

        assertEquals("data\n012AFF\n", Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void save_正常ケース_書き込んだファイルを読み直す_同じ値が返ること() throws Exception {
        Path file = tempDir.resolve("round.csv");
        CsvTableWriter.of(Map.of("path", file)).save(sample());

        ITable read = CsvTableReader.of(Map.of("path", file)).load(ITable.class).getData();

        assertEquals(2, read.getRowCount());
        assertEquals(2, read.getValue(1, "col1"));
        assertEquals("4", read.getValue(0, "col2"));
        assertEquals("a,b", read.getValue(1, "col2"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void save_異常ケース_適用外の型を渡す_コーデックが呼ばれないこと() throws Exception {
        FileCodec<ITable> codec = mock(FileCodec.class);
        Path file = tempDir.resolve("never.csv");
        CsvTableWriter writer = new CsvTableWriter(
                CsvTableWriter.SCHEMA.bind(DataFormat.CSV, Map.of("path", file)), codec);

        assertThrows(TypeMismatchException.class, () -> writer.save(new DefaultDataSet()));

        verify(codec, never()).encode(any(), any(), any());
        assertFalse(Files.exists(file));
    }

    @Test
    void savingOptions_正常ケース_既定値で生成する_書込オプションのみが返ること() {
        Map<String, Object> options = CsvTableWriter.of(Map.of("path", "x.csv")).savingOptions();

        assertEquals(List.of("delimiter", "quote", "quoteMode", "recordSeparator", "header",
                "encoding"), List.copyOf(options.keySet()));
        assertTrue(options.get("quoteMode") instanceof org.apache.commons.csv.QuoteMode);
    }

    private static ITable sample() throws Exception {
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("col1", List.of(1, 2));
        columns.put("col2", List.of(4, "a,b"));
        return TableSupport.fromColumns("sample", columns);
    }
}
