package io.github.yok.flexdataio.format.xml;

import io.github.yok.flexdataio.adapter.AdapterKind;
import io.github.yok.flexdataio.adapter.AdapterProvider;
import java.util.List;

/**
 * Contributes the flat XML reader and writer.
 *
 * @author Yasuharu.Okawauchi
 */
public class XmlAdapterProvider implements AdapterProvider {

    @Override
    public List<AdapterKind<?>> kinds() {
        return List.of(XmlTableReader.KIND, XmlTableWriter.KIND);
    }
}
