package io.github.yok.flexdataio.format.json;

import io.github.yok.flexdataio.adapter.AdapterKind;
import io.github.yok.flexdataio.adapter.AdapterProvider;
import java.util.List;

/**
 * Contributes the JSON reader and writer.
 *
 * @author Yasuharu.Okawauchi
 */
public class JsonAdapterProvider implements AdapterProvider {

    @Override
    public List<AdapterKind<?>> kinds() {
        return List.of(JsonTableReader.KIND, JsonTableWriter.KIND);
    }
}
