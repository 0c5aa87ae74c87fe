package io.github.yok.flexdataio.format.avro;

import io.github.yok.flexdataio.adapter.AdapterKind;
import io.github.yok.flexdataio.adapter.AdapterProvider;
import java.util.List;

/**
 * Contributes the Avro reader and writer.
 *
 * @author Yasuharu.Okawauchi
 */
public class AvroAdapterProvider implements AdapterProvider {

    @Override
    public List<AdapterKind<?>> kinds() {
        return List.of(AvroTableReader.KIND, AvroTableWriter.KIND);
    }
}
