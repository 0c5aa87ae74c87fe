package io.github.yok.flexdataio.format.parquet;

import io.github.yok.flexdataio.format.FileCodec;
import io.github.yok.flexdataio.format.avro.AvroSchemas;
import io.github.yok.flexdataio.util.FileSupport;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.avro.AvroReadSupport;
import org.apache.parquet.avro.AvroSchemaConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.FileMetaData;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.LocalInputFile;
import org.apache.parquet.io.LocalOutputFile;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;

/**
 * Reads and writes a single table as a Parquet file through parquet-avro. Files are accessed with
 * the local {@link InputFile}/{@code OutputFile} implementations, so no Hadoop file system is
 * involved and no checksum side files are written.
 *
 * @author Yasuharu.Okawauchi
 */
class ParquetCodec implements FileCodec<ITable> {

    // Footer keys under which parquet-avro stores the writer's Avro schema
    private static final String[] AVRO_SCHEMA_KEYS = {"parquet.avro.schema", "avro.schema"};

    /**
     * {@inheritDoc}
     */
    @Override
    public ITable decode(Path path, Map<String, Object> options) throws Exception {
        InputFile file = new LocalInputFile(path);
        Schema schema = fileSchema(file);
        List<String> columns = ParquetTableReader.COLUMNS.valueIn(options);
        if (columns != null) {
            schema = project(schema, columns);
        }
        Configuration conf = new Configuration(false);
        AvroReadSupport.setRequestedProjection(conf, schema);
        AvroReadSupport.setAvroReadSchema(conf, schema);

        List<GenericRecord> records = new ArrayList<>();
        try (ParquetReader<GenericRecord> reader = AvroParquetReader
                .<GenericRecord>builder(file).withDataModel(GenericData.get()).withConf(conf)
                .build()) {
            GenericRecord record;
            while ((record = reader.read()) != null) {
                records.add(record);
            }
        }
        return AvroSchemas.toTable(FileSupport.baseName(path), schema, records);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void encode(ITable data, Path path, Map<String, Object> options) throws Exception {
        Schema schema = AvroSchemas.toSchema(data);
        try (ParquetWriter<GenericRecord> writer = AvroParquetWriter
                .<GenericRecord>builder(new LocalOutputFile(path)).withSchema(schema)
                .withDataModel(GenericData.get()).withConf(new Configuration(false))
                .withCompressionCodec(
                        ParquetTableWriter.COMPRESSION.valueIn(options).getCodecName())
                .withRowGroupSize(ParquetTableWriter.ROW_GROUP_SIZE.valueIn(options))
                .withPageSize(ParquetTableWriter.PAGE_SIZE.valueIn(options))
                .withDictionaryEncoding(ParquetTableWriter.ENABLE_DICTIONARY.valueIn(options))
                .withWriteMode(ParquetTableWriter.WRITE_MODE.valueIn(options)).build()) {
            for (GenericRecord record : AvroSchemas.toRecords(data, schema)) {
                writer.write(record);
            }
        }
    }

    private static Schema fileSchema(InputFile file) throws Exception {
        try (ParquetFileReader reader = ParquetFileReader.open(file)) {
            FileMetaData meta = reader.getFooter().getFileMetaData();
            for (String key : AVRO_SCHEMA_KEYS) {
                String json = meta.getKeyValueMetaData().get(key);
                if (json != null) {
                    return new Schema.Parser().parse(json);
                }
            }
            return new AvroSchemaConverter().convert(meta.getSchema());
        }
    }

    private static Schema project(Schema schema, List<String> columns) throws DataSetException {
        List<Schema.Field> fields = new ArrayList<>();
        for (String column : columns) {
            Schema.Field found = null;
            for (Schema.Field field : schema.getFields()) {
                if (column.equals(columnName(field))) {
                    found = field;
                    break;
                }
            }
            if (found == null) {
                List<String> available = schema.getFields().stream()
                        .map(ParquetCodec::columnName).collect(Collectors.toList());
                throw new DataSetException(
                        "Column '" + column + "' not found; available columns are " + available);
            }
            fields.add(new Schema.Field(found, found.schema()));
        }
        return Schema.createRecord(schema.getName(), schema.getDoc(), schema.getNamespace(),
                false, fields);
    }

    private static String columnName(Schema.Field field) {
        String original = field.getProp(AvroSchemas.COLUMN_PROPERTY);
        return original != null ? original : field.name();
    }
}
