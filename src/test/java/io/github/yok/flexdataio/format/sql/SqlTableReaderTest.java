package io.github.yok.flexdataio.format.sql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.flexdataio.adapter.LoadResult;
import io.github.yok.flexdataio.exception.CodecException;
import io.github.yok.flexdataio.exception.ConfigurationException;
import io.github.yok.flexdataio.format.DataFormat;
import io.github.yok.flexdataio.metadata.SqlMetadata;
import io.github.yok.flexdataio.util.TableSupport;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.dbunit.dataset.ITable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SqlTableReaderTest {

    private Connection connection;

    @BeforeEach
    void setup() throws Exception {
        connection = DriverManager.getConnection("jdbc:hsqldb:mem:" + UUID.randomUUID(), "SA", "");
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("CREATE TABLE \"bar\" (\"col1\" INTEGER, \"col2\" INTEGER)");
            stmt.execute("INSERT INTO \"bar\" VALUES (1, 3)");
            stmt.execute("INSERT INTO \"bar\" VALUES (2, 4)");
            stmt.execute("CREATE TABLE PRICES (ID INTEGER, AMOUNT DECIMAL(10,2))");
            stmt.execute("INSERT INTO PRICES VALUES (1, 1.50)");
        }
    }

    @AfterEach
    void teardown() throws Exception {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("SHUTDOWN");
        }
        connection.close();
    }

    @Test
    void load_正常ケース_テーブル名を指定する_全行と問い合わせが記録されること() throws Exception {
        LoadResult<ITable> result = reader(Map.of("queryOrTable", "bar")).load(ITable.class);

        assertEquals(2, result.getData().getRowCount());
        assertEquals("bar", result.getData().getTableMetaData().getTableName());
        SqlMetadata sql = result.getMetadata().getSqlMetadata().orElseThrow();
        assertEquals(2, sql.getRows());
        assertEquals("SELECT * FROM \"bar\"", sql.getQuery());
        assertEquals("bar", sql.getTableName());
    }

    @Test
    void load_正常ケース_問い合わせを指定する_結果の列のみが返ること() throws Exception {
        LoadResult<ITable> result =
                reader(Map.of("queryOrTable", "SELECT \"col1\" FROM \"bar\"")).load(ITable.class);

        ITable table = result.getData();
        assertEquals(2, table.getRowCount());
        assertEquals(1, table.getTableMetaData().getColumns().length);
        assertEquals("query", table.getTableMetaData().getTableName());
        assertNull(result.getMetadata().getSqlMetadata().orElseThrow().getTableName());
    }

    @Test
    void load_正常ケース_パラメータを指定する_条件に合う行のみ返ること() throws Exception {
        ITable table = reader(Map.of("queryOrTable",
                "SELECT * FROM \"bar\" WHERE \"col1\" > ?", "params", List.of(1)))
                .load(ITable.class).getData();

        assertEquals(1, table.getRowCount());
        assertEquals(4, ((Number) table.getValue(0, "col2")).intValue());
    }

    @Test
    void load_正常ケース_スキーマ修飾した名前を指定する_全行が返ること() throws Exception {
        ITable table = reader(Map.of("queryOrTable", "PUBLIC.PRICES")).load(ITable.class)
                .getData();

        assertEquals(1, table.getRowCount());
    }

    @Test
    void load_正常ケース_十進数列を既定値で読み込む_浮動小数点に変換されること() throws Exception {
        ITable coerced = reader(Map.of("queryOrTable", "PRICES")).load(ITable.class).getData();
        ITable exact = reader(Map.of("queryOrTable", "PRICES", "coerceFloat", false))
                .load(ITable.class).getData();

        assertEquals(1.5, coerced.getValue(0, "AMOUNT"));
        assertInstanceOf(BigDecimal.class, exact.getValue(0, "AMOUNT"));
    }

    @Test
    void load_正常ケース_書き込んだ表を読み直す_同じ行数が返ること() throws Exception {
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("col1", List.of(10, 20, 30));
        SqlTableWriter.of(Map.of("tableName", "baz", "connection", connection))
                .save(TableSupport.fromColumns("df", columns));

        ITable table = reader(Map.of("queryOrTable", "baz")).load(ITable.class).getData();

        assertEquals(3, table.getRowCount());
    }

    @Test
    void load_異常ケース_存在しないテーブルを指定する_CodecExceptionが送出されること() {
        CodecException ex = assertThrows(CodecException.class,
                () -> reader(Map.of("queryOrTable", "missing")).load(ITable.class));

        assertEquals(DataFormat.SQL, ex.getFormat());
    }

    @Test
    void load_正常ケース_コーデックを差し替える_問い合わせ文と結果名が渡されること() throws Exception {
        SqlCodec codec = mock(SqlCodec.class);
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("col1", List.of(1));
        ITable stub = TableSupport.fromColumns("bar", columns);
        when(codec.read(any(), any(), any(), any(), any())).thenReturn(stub);
        SqlTableReader reader = new SqlTableReader(SqlTableReader.SCHEMA.bind(DataFormat.SQL,
                Map.of("queryOrTable", " bar ", "connection", connection)), codec);

        reader.load(ITable.class);

        verify(codec).read(eq(connection), isNull(), eq("bar"), eq("SELECT * FROM \"bar\""),
                eq(reader.loadingOptions()));
    }

    @Test
    void loadingOptions_正常ケース_既定値で生成する_読込オプションのみが返ること() {
        Map<String, Object> options = reader(Map.of("queryOrTable", "bar")).loadingOptions();

        assertEquals(List.of("coerceFloat"), List.copyOf(options.keySet()));
        assertEquals(true, options.get("coerceFloat"));
    }

    @Test
    void of_異常ケース_空白の問い合わせを指定する_ConfigurationExceptionが送出されること() {
        assertThrows(ConfigurationException.class,
                () -> reader(Map.of("queryOrTable", "  ")));
    }

    private SqlTableReader reader(Map<String, Object> extra) {
        Map<String, Object> options = new LinkedHashMap<>(extra);
        options.put("connection", connection);
        options.put("dataTypeFactoryMode", "HSQLDB");
        return SqlTableReader.of(options);
    }
}
