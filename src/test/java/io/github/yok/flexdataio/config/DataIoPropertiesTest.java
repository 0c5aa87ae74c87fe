package io.github.yok.flexdataio.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexdataio.adapter.Direction;
import io.github.yok.flexdataio.format.DataFormat;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DataIoPropertiesTest {

    @Test
    void defaultsFor_正常ケース_設定がない_空のマップが返ること() {
        DataIoProperties props = new DataIoProperties();
        assertTrue(props.defaultsFor(DataFormat.CSV, Direction.READER).isEmpty());
    }

    @Test
    void defaultsFor_正常ケース_読込と書込を設定する_方向ごとに返ること() {
        DataIoProperties props = new DataIoProperties();
        props.getReaders().put("csv", Map.of("delimiter", ";"));
        props.getWriters().put("csv", Map.of("header", "false"));

        assertEquals(Map.of("delimiter", ";"),
                props.defaultsFor(DataFormat.CSV, Direction.READER));
        assertEquals(Map.of("header", "false"),
                props.defaultsFor(DataFormat.CSV, Direction.WRITER));
        assertTrue(props.defaultsFor(DataFormat.JSON, Direction.WRITER).isEmpty());
    }
}
