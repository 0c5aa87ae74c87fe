package io.github.yok.flexdataio.format.avro;

import io.github.yok.flexdataio.format.FileCodec;
import io.github.yok.flexdataio.util.FileSupport;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.avro.Schema;
import org.apache.avro.file.CodecFactory;
import org.apache.avro.file.DataFileReader;
import org.apache.avro.file.DataFileWriter;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.dbunit.dataset.ITable;

/**
 * Reads and writes a single table as an Avro object container file. The writer schema is stored
 * in the file, so reading needs no schema of its own.
 *
 * @author Yasuharu.Okawauchi
 */
class AvroCodec implements FileCodec<ITable> {

    /**
     * {@inheritDoc}
     */
    @Override
    public ITable decode(Path path, Map<String, Object> options) throws Exception {
        List<GenericRecord> records = new ArrayList<>();
        try (DataFileReader<GenericRecord> reader =
                new DataFileReader<>(path.toFile(), new GenericDatumReader<>())) {
            Schema schema = reader.getSchema();
            for (GenericRecord record : reader) {
                records.add(record);
            }
            return AvroSchemas.toTable(FileSupport.baseName(path), schema, records);
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void encode(ITable data, Path path, Map<String, Object> options) throws Exception {
        Schema schema = AvroSchemas.toSchema(data);
        try (DataFileWriter<GenericRecord> writer =
                new DataFileWriter<>(new GenericDatumWriter<>(schema))) {
            writer.setCodec(CodecFactory.fromString(AvroTableWriter.CODEC.valueIn(options)));
            writer.setSyncInterval(AvroTableWriter.SYNC_INTERVAL.valueIn(options));
            writer.create(schema, path.toFile());
            for (GenericRecord record : AvroSchemas.toRecords(data, schema)) {
                writer.append(record);
            }
        }
    }
}
