package io.github.yok.flexdataio.format.orc;

import io.github.yok.flexdataio.adapter.AdapterKind;
import io.github.yok.flexdataio.adapter.AdapterProvider;
import java.util.List;

/**
 * Contributes the ORC reader and writer.
 *
 * @author Yasuharu.Okawauchi
 */
public class OrcAdapterProvider implements AdapterProvider {

    @Override
    public List<AdapterKind<?>> kinds() {
        return List.of(OrcTableReader.KIND, OrcTableWriter.KIND);
    }
}
