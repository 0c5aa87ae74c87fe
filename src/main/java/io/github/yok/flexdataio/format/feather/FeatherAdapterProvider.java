package io.github.yok.flexdataio.format.feather;

import io.github.yok.flexdataio.adapter.AdapterKind;
import io.github.yok.flexdataio.adapter.AdapterProvider;
import java.util.List;

/**
 * Contributes the Feather reader and writer.
 *
 * @author Yasuharu.Okawauchi
 */
public class FeatherAdapterProvider implements AdapterProvider {

    @Override
    public List<AdapterKind<?>> kinds() {
        return List.of(FeatherTableReader.KIND, FeatherTableWriter.KIND);
    }
}
