package io.github.yok.flexdataio.format.yaml;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexdataio.exception.ConfigurationException;
import io.github.yok.flexdataio.util.TableSupport;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.dbunit.dataset.ITable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.DumperOptions;

class YamlTableWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void save_正常ケース_既定値で書き込む_ブロック形式で出力されること() throws Exception {
        Path file = tempDir.resolve("out.yaml");

        YamlTableWriter.of(Map.of("path", file)).save(sample());

        assertEquals("- col1: 1\n  col2: x\n- col1: 2\n  col2: null\n",
                Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void save_正常ケース_文書開始記号を指定する_先頭に記号が出力されること() throws Exception {
        Path file = tempDir.resolve("start.yaml");

        YamlTableWriter.of(Map.of("path", file, "explicitStart", true)).save(sample());

        assertTrue(Files.readString(file, StandardCharsets.UTF_8).startsWith("---"));
    }

    @Test
    void save_正常ケース_書き込んだファイルを読み直す_同じ値が返ること() throws Exception {
        Path file = tempDir.resolve("round.yaml");
        YamlTableWriter.of(Map.of("path", file, "flowStyle", "flow")).save(sample());

        ITable read = YamlTableReader.of(Map.of("path", file)).load(ITable.class).getData();

        assertEquals(2, read.getRowCount());
        assertEquals("x", read.getValue(0, "col2"));
        assertEquals(2, read.getValue(1, "col1"));
    }

    @Test
    void savingOptions_正常ケース_スタイルを指定する_変換後の値が返ること() {
        Map<String, Object> options = YamlTableWriter
                .of(Map.of("path", "out.yaml", "flowStyle", "FLOW", "indent", 4))
                .savingOptions();

        assertEquals(DumperOptions.FlowStyle.FLOW, options.get("flowStyle"));
        assertEquals(4, options.get("indent"));
        assertEquals(false, options.get("explicitStart"));
    }

    @Test
    void of_異常ケース_範囲外のインデントを指定する_ConfigurationExceptionが送出されること() {
        assertThrows(ConfigurationException.class,
                () -> YamlTableWriter.of(Map.of("path", "out.yaml", "indent", 11)));
    }

    private static ITable sample() throws Exception {
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("col1", List.of(1, 2));
        columns.put("col2", Arrays.asList("x", null));
        return TableSupport.fromColumns("sample", columns);
    }
}
