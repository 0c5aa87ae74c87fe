package io.github.yok.flexdataio.format.yaml;

import io.github.yok.flexdataio.adapter.AdapterKind;
import io.github.yok.flexdataio.adapter.AdapterProvider;
import java.util.List;

/**
 * Contributes the YAML reader and writer.
 *
 * @author Yasuharu.Okawauchi
 */
public class YamlAdapterProvider implements AdapterProvider {

    @Override
    public List<AdapterKind<?>> kinds() {
        return List.of(YamlTableReader.KIND, YamlTableWriter.KIND);
    }
}
