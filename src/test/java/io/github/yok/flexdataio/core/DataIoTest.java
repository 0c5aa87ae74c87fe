package io.github.yok.flexdataio.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexdataio.adapter.DataReader;
import io.github.yok.flexdataio.adapter.DataWriter;
import io.github.yok.flexdataio.adapter.Direction;
import io.github.yok.flexdataio.adapter.LoadResult;
import io.github.yok.flexdataio.config.DataIoProperties;
import io.github.yok.flexdataio.db.DbUnitConfigFactory;
import io.github.yok.flexdataio.exception.ConfigurationException;
import io.github.yok.flexdataio.exception.NoAdapterFoundException;
import io.github.yok.flexdataio.format.DataFormat;
import io.github.yok.flexdataio.format.csv.CsvTableReader;
import io.github.yok.flexdataio.format.sql.SqlTableWriter;
import io.github.yok.flexdataio.metadata.ResultMetadata;
import io.github.yok.flexdataio.registry.AdapterRegistry;
import io.github.yok.flexdataio.util.TableSupport;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.ITable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DataIoTest {

    @TempDir
    Path tempDir;

    private DataIoProperties properties;

    private DbUnitConfigFactory configFactory;

    private DataIo dataIo;

    @BeforeEach
    void setup() {
        properties = new DataIoProperties();
        configFactory = new DbUnitConfigFactory();
        dataIo = new DataIo(AdapterRegistry.defaultRegistry(), properties, configFactory);
    }

    // ---------------------------------------------------------------------
    // load / save by format id
    // ---------------------------------------------------------------------

    @Test
    void save_正常ケース_形式IDで保存して読み込む_同じ表が返ること() throws Exception {
        Path file = tempDir.resolve("data.json");

        ResultMetadata saved = dataIo.save("json", ITable.class, sample(), Map.of("path", file));
        LoadResult<ITable> loaded = dataIo.load("JSON", ITable.class, Map.of("path", file));

        assertEquals(2, saved.getDataframeMetadata().getRows());
        assertTrue(saved.getFileMetadata().isPresent());
        assertEquals(2, loaded.getData().getRowCount());
        assertEquals(4, loaded.getData().getValue(1, "col2"));
    }

    @Test
    void save_正常ケース_SQL形式で保存して問い合わせる_行数が一致すること() throws Exception {
        Connection connection =
                DriverManager.getConnection("jdbc:hsqldb:mem:" + UUID.randomUUID(), "SA", "");
        try {
            ResultMetadata saved = dataIo.save("sql", ITable.class, sample(),
                    Map.of("connection", connection, "tableName", "bar"));
            LoadResult<ITable> loaded = dataIo.load("sql", ITable.class,
                    Map.of("connection", connection, "queryOrTable",
                            "SELECT \"col1\" FROM \"bar\""));

            assertEquals(2, saved.getSqlMetadata().orElseThrow().getRows());
            assertEquals(2, loaded.getData().getRowCount());
            assertEquals(1, loaded.getData().getTableMetaData().getColumns().length);
        } finally {
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("SHUTDOWN");
            }
            connection.close();
        }
    }

    @Test
    void load_異常ケース_未知の形式IDを指定する_NoAdapterFoundExceptionが送出されること() {
        assertThrows(NoAdapterFoundException.class,
                () -> dataIo.load("xlsx", ITable.class, Map.of("path", "x.xlsx")));
    }

    @Test
    void load_異常ケース_形式が扱えない型を指定する_NoAdapterFoundExceptionが送出されること() {
        NoAdapterFoundException ex = assertThrows(NoAdapterFoundException.class,
                () -> dataIo.load("json", IDataSet.class, Map.of("path", "x.json")));

        assertEquals(DataFormat.JSON, ex.getFormat());
    }

    @Test
    void load_異常ケース_不正なオプションを指定する_ConfigurationExceptionが送出されること() {
        assertThrows(ConfigurationException.class,
                () -> dataIo.load("csv", ITable.class, Map.of("path", "x.csv", "skipRows", -1)));
    }

    // ---------------------------------------------------------------------
    // load / save by path
    // ---------------------------------------------------------------------

    @Test
    void save_正常ケース_拡張子から形式を判定する_対応する形式で読み書きされること()
            throws Exception {
        Path file = tempDir.resolve("data.yaml");

        dataIo.save(file, ITable.class, sample(), Map.of());
        LoadResult<ITable> loaded = dataIo.load(file, ITable.class, null);

        assertTrue(Files.readString(file, StandardCharsets.UTF_8).startsWith("- col1: 1"));
        assertEquals(2, loaded.getData().getRowCount());
    }

    @Test
    void save_正常ケース_列指向形式の拡張子を指定する_ORCとArrowで読み書きされること()
            throws Exception {
        Path orc = tempDir.resolve("data.orc");
        Path arrow = tempDir.resolve("data.arrow");

        dataIo.save(orc, ITable.class, sample(), Map.of());
        dataIo.save(arrow, ITable.class, sample(), Map.of());

        assertEquals(4, dataIo.load(orc, ITable.class, null).getData().getValue(1, "col2"));
        assertEquals(4, dataIo.load(arrow, ITable.class, null).getData().getValue(1, "col2"));
        assertEquals(DataFormat.FEATHER, DataFormat.fromPath(arrow).orElseThrow());
    }

    @Test
    void load_異常ケース_未知の拡張子を指定する_NoAdapterFoundExceptionが送出されること() {
        assertThrows(NoAdapterFoundException.class,
                () -> dataIo.load(tempDir.resolve("data.bin"), ITable.class, Map.of()));
    }

    // ---------------------------------------------------------------------
    // option layers
    // ---------------------------------------------------------------------

    @Test
    void save_正常ケース_アプリケーション既定値を設定する_呼び出しの指定が優先されること()
            throws Exception {
        properties.getWriters().put("csv", Map.of("delimiter", ";", "recordSeparator", "\n"));
        Path byDefault = tempDir.resolve("default.csv");
        Path byCall = tempDir.resolve("call.csv");

        dataIo.save(byDefault, ITable.class, sample(), Map.of());
        dataIo.save(byCall, ITable.class, sample(), Map.of("delimiter", "|"));

        assertEquals("col1;col2\n1;3\n2;4\n",
                Files.readString(byDefault, StandardCharsets.UTF_8));
        assertTrue(Files.readString(byCall, StandardCharsets.UTF_8).startsWith("col1|col2\n"));
    }

    @Test
    void newReader_正常ケース_読込既定値を設定する_読込オプションに反映されること() {
        properties.getReaders().put("csv", Map.of("delimiter", "\t"));

        DataReader reader = dataIo.newReader("csv", ITable.class, Map.of("path", "x.tsv"));

        assertTrue(reader instanceof CsvTableReader);
        assertEquals('\t', reader.loadingOptions().get("delimiter"));
    }

    @Test
    void newWriter_正常ケース_インデントを指定する_保存オプションに反映されること() {
        DataWriter writer =
                dataIo.newWriter("json", ITable.class, Map.of("path", "x.json", "indent", 4));

        assertEquals(DataFormat.JSON, writer.format());
        assertEquals(4, writer.savingOptions().get("indent"));
        assertEquals("UTF-8", writer.savingOptions().get("encoding"));
    }

    @Test
    void mergeOptions_正常ケース_SQLの書込アダプタ_共有のDBUnit設定が注入されること() {
        Map<String, Object> merged = dataIo.mergeOptions(SqlTableWriter.KIND, Map.of());

        assertSame(configFactory, merged.get("configFactory"));
    }

    @Test
    void mergeOptions_正常ケース_ファイル形式のアダプタ_DBUnit設定が注入されないこと() {
        Map<String, Object> merged = dataIo.mergeOptions(CsvTableReader.KIND, null);

        assertFalse(merged.containsKey("configFactory"));
        assertEquals(Direction.READER, CsvTableReader.KIND.getDirection());
    }

    private static ITable sample() throws Exception {
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("col1", List.of(1, 2));
        columns.put("col2", List.of(3, 4));
        return TableSupport.fromColumns("df", columns);
    }
}
