package io.github.yok.flexdataio.format.parquet;

import io.github.yok.flexdataio.adapter.AdapterKind;
import io.github.yok.flexdataio.adapter.AdapterProvider;
import java.util.List;

/**
 * Contributes the Parquet reader and writer.
 *
 * @author Yasuharu.Okawauchi
 */
public class ParquetAdapterProvider implements AdapterProvider {

    @Override
    public List<AdapterKind<?>> kinds() {
        return List.of(ParquetTableReader.KIND, ParquetTableWriter.KIND);
    }
}
