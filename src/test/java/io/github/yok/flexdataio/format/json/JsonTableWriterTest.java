package io.github.yok.flexdataio.format.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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

class JsonTableWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void savingOptions_正常ケース_インデントと文字コードを指定する_指定値が返ること() {
        JsonTableWriter writer =
                JsonTableWriter.of(Map.of("path", "out.json", "indent", 4, "encoding", "UTF-16"));

        Map<String, Object> options = writer.savingOptions();

        assertEquals(4, options.get("indent"));
        assertEquals("UTF-16", options.get("encoding"));
        assertEquals(JsonOrient.RECORDS, options.get("orient"));
        assertFalse(options.containsKey("path"));
    }

    @Test
    void save_正常ケース_既定値で書き込む_1行のレコード配列が出力されること() throws Exception {
        Path file = tempDir.resolve("out.json");

        JsonTableWriter.of(Map.of("path", file)).save(sample());

        assertEquals("[{\"col1\":1,\"col2\":\"x\"},{\"col1\":2,\"col2\":null}]",
                Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void save_正常ケース_インデント4を指定する_4桁で字下げされること() throws Exception {
        Path file = tempDir.resolve("pretty.json");

        JsonTableWriter.of(Map.of("path", file, "indent", 4)).save(sample());

        String text = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(text.contains("\n    {"));
        assertTrue(text.contains("\n        \"col1\""));
        assertEquals(2, new ObjectMapper().readTree(text).size());
    }

    @Test
    void save_正常ケース_列形式と分割形式で書き込む_読み直すと同じ値が返ること() throws Exception {
        for (String orient : List.of("columns", "split")) {
            Path file = tempDir.resolve(orient + ".json");
            JsonTableWriter.of(Map.of("path", file, "orient", orient)).save(sample());

            ITable read = JsonTableReader.of(Map.of("path", file, "orient", orient))
                    .load(ITable.class).getData();

            assertEquals(2, read.getRowCount(), orient);
            assertEquals(2, read.getValue(1, "col1"), orient);
            assertEquals("x", read.getValue(0, "col2"), orient);
        }
        JsonNode split = new ObjectMapper().readTree(tempDir.resolve("split.json").toFile());
        assertEquals("col2", split.path("columns").get(1).asText());
    }

    @Test
    void of_異常ケース_負のインデントを指定する_ConfigurationExceptionが送出されること() {
        assertThrows(ConfigurationException.class,
                () -> JsonTableWriter.of(Map.of("path", "out.json", "indent", -1)));
    }

    private static ITable sample() throws Exception {
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("col1", List.of(1, 2));
        columns.put("col2", Arrays.asList("x", null));
        return TableSupport.fromColumns("sample", columns);
    }
}
