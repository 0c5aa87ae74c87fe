package io.github.yok.flexdataio.format.avro;

import io.github.yok.flexdataio.adapter.AdapterKind;
import io.github.yok.flexdataio.config.AdapterOptions;
import io.github.yok.flexdataio.config.OptionSchema;
import io.github.yok.flexdataio.format.AbstractFileReader;
import io.github.yok.flexdataio.format.DataFormat;
import io.github.yok.flexdataio.format.FileCodec;
import io.github.yok.flexdataio.format.FileOptions;
import java.util.List;
import java.util.Map;
import org.dbunit.dataset.ITable;

/**
 * Reads an Avro container file into an {@link ITable} named after the file. The only option is
 * {@code path}.
 *
 * @author Yasuharu.Okawauchi
 */
public class AvroTableReader extends AbstractFileReader<ITable> {

    static final OptionSchema SCHEMA = OptionSchema.of(FileOptions.PATH);

    public static final AdapterKind<AvroTableReader> KIND = AdapterKind.reader(DataFormat.AVRO,
            AvroTableReader.class, SCHEMA, AvroTableReader::new, ITable.class);

    public AvroTableReader(AdapterOptions options) {
        this(options, new AvroCodec());
    }

    AvroTableReader(AdapterOptions options, FileCodec<ITable> codec) {
        super(options, codec);
    }

    public static AvroTableReader of(Map<String, ?> options) {
        return KIND.create(options);
    }

    public static List<Class<?>> applicableTypes() {
        return KIND.getApplicableTypes();
    }

    @Override
    public AdapterKind<AvroTableReader> kind() {
        return KIND;
    }

    @Override
    public Map<String, Object> loadingOptions() {
        return options().project();
    }
}
