package io.github.yok.flexdataio.format.csv;

import io.github.yok.flexdataio.adapter.AdapterKind;
import io.github.yok.flexdataio.adapter.AdapterProvider;
import java.util.List;

/**
 * Contributes the CSV reader and writer.
 *
 * @author Yasuharu.Okawauchi
 */
public class CsvAdapterProvider implements AdapterProvider {

    @Override
    public List<AdapterKind<?>> kinds() {
        return List.of(CsvTableReader.KIND, CsvTableWriter.KIND);
    }
}
