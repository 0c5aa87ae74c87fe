package io.github.yok.flexdataio.format.sql;

import io.github.yok.flexdataio.adapter.AdapterKind;
import io.github.yok.flexdataio.adapter.AdapterProvider;
import java.util.List;

/**
 * Contributes the SQL reader and writer.
 *
 * @author Yasuharu.Okawauchi
 */
public class SqlAdapterProvider implements AdapterProvider {

    @Override
    public List<AdapterKind<?>> kinds() {
        return List.of(SqlTableReader.KIND, SqlTableWriter.KIND);
    }
}
