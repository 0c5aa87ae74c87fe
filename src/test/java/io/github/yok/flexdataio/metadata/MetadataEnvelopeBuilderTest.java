package io.github.yok.flexdataio.metadata;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MetadataEnvelopeBuilderTest {

    @TempDir
    Path tempDir;

    private static final DataShape SHAPE =
            new DataShape(2, List.of("col1", "col2"), List.of("INTEGER", "INTEGER"));

    // -------------------------------------------------------------------------
    // build
    // -------------------------------------------------------------------------

    @Test
    void build_正常ケース_ファイル転送を指定する_fileMetadataのみが設定されること() throws Exception {
        Path file = tempDir.resolve("data.csv");
        Files.writeString(file, "col1,col2\n1,4\n2,3\n", StandardCharsets.UTF_8);

        ResultMetadata metadata = MetadataEnvelopeBuilder.build(FileTransport.describe(file), SHAPE);

        assertTrue(metadata.getFileMetadata().isPresent());
        assertFalse(metadata.getSqlMetadata().isPresent());
        FileMetadata fileMetadata = metadata.getFileMetadata().get();
        assertEquals(file.toAbsolutePath().normalize().toString(), fileMetadata.getPath());
        assertEquals(Files.size(file), fileMetadata.getSize());
        assertEquals(2, metadata.getDataframeMetadata().getRows());
        assertEquals(List.of("col1", "col2"), metadata.getDataframeMetadata().getColumnNames());
    }

    @Test
    void build_正常ケース_SQL転送を指定する_sqlMetadataのみが設定されること() {
        ResultMetadata metadata =
                MetadataEnvelopeBuilder.build(new SqlTransport(2, null, "bar"), SHAPE);

        assertFalse(metadata.getFileMetadata().isPresent());
        SqlMetadata sql = metadata.getSqlMetadata().get();
        assertEquals(2, sql.getRows());
        assertEquals("bar", sql.getTableName());
    }

    // -------------------------------------------------------------------------
    // toMap / toJson
    // -------------------------------------------------------------------------

    @Test
    void toMap_正常ケース_ファイル転送を指定する_規定のキーで返ること() {
        Instant time = Instant.parse("2024-01-02T03:04:05Z");
        FileTransport transport = new FileTransport(tempDir.resolve("x.json"), 10, time, time);

        Map<String, Object> map = MetadataEnvelopeBuilder.build(transport, SHAPE).toMap();

        assertEquals(List.of("file_metadata", "dataframe_metadata"), List.copyOf(map.keySet()));
        @SuppressWarnings("unchecked")
        Map<String, Object> file = (Map<String, Object>) map.get("file_metadata");
        assertEquals(10L, file.get("size"));
        assertEquals("2024-01-02T03:04:05Z", file.get("last_modified"));
        @SuppressWarnings("unchecked")
        Map<String, Object> frame = (Map<String, Object>) map.get("dataframe_metadata");
        assertEquals(2, frame.get("rows"));
        assertEquals(List.of("col1", "col2"), frame.get("column_names"));
        assertEquals(List.of("INTEGER", "INTEGER"), frame.get("datatypes"));
    }

    @Test
    void toMap_正常ケース_クエリなしのSQL転送を指定する_queryキーが省略されること() {
        Map<String, Object> map = MetadataEnvelopeBuilder
                .build(new SqlTransport(2, null, "bar"), SHAPE).toMap();

        @SuppressWarnings("unchecked")
        Map<String, Object> sql = (Map<String, Object>) map.get("sql_metadata");
        assertEquals(Map.of("rows", 2, "table_name", "bar"), sql);
        assertFalse(map.containsKey("file_metadata"));
    }

    @Test
    void toJson_正常ケース_SQL転送を指定する_JSONとして解析できること() throws Exception {
        String json = MetadataEnvelopeBuilder
                .build(new SqlTransport(2, "SELECT 1", null), SHAPE).toJson();

        JsonNode node = new ObjectMapper().readTree(json);
        assertEquals(2, node.path("sql_metadata").path("rows").asInt());
        assertEquals("SELECT 1", node.path("sql_metadata").path("query").asText());
        assertEquals("col2", node.path("dataframe_metadata").path("column_names").get(1).asText());
    }
}
