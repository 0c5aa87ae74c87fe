package io.github.yok.flexdataio.format.html;

import io.github.yok.flexdataio.adapter.AdapterKind;
import io.github.yok.flexdataio.adapter.AdapterProvider;
import java.util.List;

/**
 * Contributes the HTML reader and writer.
 *
 * @author Yasuharu.Okawauchi
 */
public class HtmlAdapterProvider implements AdapterProvider {

    @Override
    public List<AdapterKind<?>> kinds() {
        return List.of(HtmlTableReader.KIND, HtmlTableWriter.KIND);
    }
}
