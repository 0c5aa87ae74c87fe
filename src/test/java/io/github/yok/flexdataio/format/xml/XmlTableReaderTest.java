package io.github.yok.flexdataio.format.xml;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.flexdataio.adapter.LoadResult;
import io.github.yok.flexdataio.exception.CodecException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.ITable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class XmlTableReaderTest {

    @TempDir
    Path tempDir;

    private Path file;

    @BeforeEach
    void setup() throws Exception {
        file = tempDir.resolve("dataset.xml");
        Files.writeString(file, "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<dataset>\n"
                + "  <users id=\"1\" name=\"alice\"/>\n" + "  <users id=\"2\" mail=\"b@x\"/>\n"
                + "  <orders no=\"9\"/>\n" + "</dataset>\n", StandardCharsets.UTF_8);
    }

    @Test
    void load_正常ケース_データセットとして読み込む_全テーブルが返ること() throws Exception {
        LoadResult<IDataSet> result = XmlTableReader.of(Map.of("path", file)).load(IDataSet.class);

        assertArrayEquals(new String[] {"users", "orders"}, result.getData().getTableNames());
        // Shape follows the first table
        assertEquals(2, result.getMetadata().getDataframeMetadata().getRows());
    }

    @Test
    void load_正常ケース_テーブル名を省略する_先頭テーブルの列が検出されること() throws Exception {
        LoadResult<ITable> result = XmlTableReader.of(Map.of("path", file)).load(ITable.class);

        ITable table = result.getData();
        assertEquals("users", table.getTableMetaData().getTableName());
        assertEquals(List.of("id", "name", "mail"),
                result.getMetadata().getDataframeMetadata().getColumnNames());
        assertNull(table.getValue(0, "mail"));
        assertEquals("b@x", table.getValue(1, "mail"));
    }

    @Test
    void load_正常ケース_テーブル名を指定する_指定テーブルが返ること() throws Exception {
        ITable table = XmlTableReader.of(Map.of("path", file, "tableName", "orders"))
                .load(ITable.class).getData();

        assertEquals(1, table.getRowCount());
        assertEquals("9", table.getValue(0, "no"));
    }

    @Test
    void load_異常ケース_存在しないテーブル名を指定する_CodecExceptionが送出されること() {
        assertThrows(CodecException.class, () -> XmlTableReader
                .of(Map.of("path", file, "tableName", "missing")).load(ITable.class));
    }

    @Test
    void loadingOptions_正常ケース_既定値で生成する_テーブル名とパスを含まないこと() {
        Map<String, Object> options = XmlTableReader.of(Map.of("path", file)).loadingOptions();

        assertEquals(List.of("columnSensing", "caseSensitiveTableNames", "dtdMetadata"),
                List.copyOf(options.keySet()));
        assertEquals(true, options.get("columnSensing"));
    }
}
