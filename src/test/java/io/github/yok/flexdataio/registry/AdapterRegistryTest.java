package io.github.yok.flexdataio.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexdataio.adapter.AdapterKind;
import io.github.yok.flexdataio.adapter.Direction;
import io.github.yok.flexdataio.adapter.StubAdapters.OtherReader;
import io.github.yok.flexdataio.adapter.StubAdapters.StubReader;
import io.github.yok.flexdataio.adapter.StubAdapters.StubWriter;
import io.github.yok.flexdataio.exception.AmbiguousAdapterException;
import io.github.yok.flexdataio.exception.NoAdapterFoundException;
import io.github.yok.flexdataio.format.DataFormat;
import io.github.yok.flexdataio.format.avro.AvroTableReader;
import io.github.yok.flexdataio.format.csv.CsvTableReader;
import io.github.yok.flexdataio.format.csv.CsvTableWriter;
import io.github.yok.flexdataio.format.html.HtmlTableReader;
import io.github.yok.flexdataio.format.sql.SqlTableWriter;
import io.github.yok.flexdataio.format.xml.XmlTableWriter;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.ITable;
import org.junit.jupiter.api.Test;

class AdapterRegistryTest {

    // -------------------------------------------------------------------------
    // register / resolve
    // -------------------------------------------------------------------------

    @Test
    void register_正常ケース_全ての適用型で解決できること() {
        AdapterRegistry registry = new AdapterRegistry();
        registry.register(StubReader.KIND);

        assertSame(StubReader.KIND, registry.resolve(DataFormat.CSV, Direction.READER, ITable.class));
        assertSame(StubReader.KIND, registry.resolveReader(DataFormat.CSV, IDataSet.class));
        assertEquals(2, registry.snapshot().size());
    }

    @Test
    void register_正常ケース_同じクラスを再登録する_何も変わらないこと() {
        AdapterRegistry registry = new AdapterRegistry();
        registry.register(StubReader.KIND);
        Map<AdapterKey, AdapterKind<?>> before = registry.snapshot();

        registry.register(StubReader.KIND);

        assertEquals(before, registry.snapshot());
    }

    @Test
    void register_異常ケース_別クラスが同じキーを宣言する_AmbiguousAdapterExceptionが送出され表は変わらないこと() {
        AdapterRegistry registry = new AdapterRegistry();
        registry.register(StubReader.KIND);
        Map<AdapterKey, AdapterKind<?>> before = registry.snapshot();

        AmbiguousAdapterException ex = assertThrows(AmbiguousAdapterException.class,
                () -> registry.registerAll(List.of(StubWriter.KIND, OtherReader.KIND)));

        assertTrue(ex.getMessage().contains(OtherReader.class.getName()));
        assertSame(before, registry.snapshot());
        assertSame(StubReader.KIND, registry.resolveReader(DataFormat.CSV, ITable.class));
        assertThrows(NoAdapterFoundException.class,
                () -> registry.resolveWriter(DataFormat.SQL, ITable.class));
    }

    @Test
    void resolve_異常ケース_未登録のキー_NoAdapterFoundExceptionが送出されること() {
        AdapterRegistry registry = new AdapterRegistry();
        registry.register(StubReader.KIND);

        NoAdapterFoundException ex = assertThrows(NoAdapterFoundException.class,
                () -> registry.resolve(DataFormat.CSV, Direction.WRITER, ITable.class));

        assertEquals(DataFormat.CSV, ex.getFormat());
        assertTrue(ex.getMessage().contains("No writer registered"));
    }

    @Test
    void resolve_正常ケース_繰り返し解決する_同じ種別が返ること() {
        AdapterRegistry registry = AdapterRegistry.defaultRegistry();
        assertSame(registry.resolveReader(DataFormat.CSV, ITable.class),
                registry.resolveReader(DataFormat.CSV, ITable.class));
    }

    // -------------------------------------------------------------------------
    // discover / defaultRegistry
    // -------------------------------------------------------------------------

    @Test
    void discover_正常ケース_サービス定義から全形式が登録されること() {
        AdapterRegistry registry = AdapterRegistry.discover(getClass().getClassLoader());

        assertEquals(EnumSet.allOf(DataFormat.class), EnumSet.copyOf(registry.formats()));
        assertSame(CsvTableReader.KIND, registry.resolveReader(DataFormat.CSV, ITable.class));
        assertSame(CsvTableWriter.KIND, registry.resolveWriter(DataFormat.CSV, ITable.class));
        assertSame(HtmlTableReader.KIND, registry.resolveReader(DataFormat.HTML, IDataSet.class));
        assertSame(XmlTableWriter.KIND, registry.resolveWriter(DataFormat.XML, IDataSet.class));
        assertSame(SqlTableWriter.KIND, registry.resolveWriter(DataFormat.SQL, ITable.class));
        assertSame(AvroTableReader.KIND, registry.resolveReader(DataFormat.AVRO, ITable.class));
        assertEquals(20, registry.kinds().size());
    }

    @Test
    void discover_正常ケース_登録された全種別_適用型が空でないこと() {
        for (AdapterKind<?> kind : AdapterRegistry.defaultRegistry().kinds()) {
            assertFalse(kind.getApplicableTypes().isEmpty(), kind.toString());
        }
    }

    @Test
    void defaultRegistry_正常ケース_複数回取得する_同一インスタンスが返ること() {
        assertSame(AdapterRegistry.defaultRegistry(), AdapterRegistry.defaultRegistry());
    }
}
