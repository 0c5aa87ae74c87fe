package io.github.yok.flexdataio.format.xml;

import io.github.yok.flexdataio.format.FileCodec;
import io.github.yok.flexdataio.format.FileOptions;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.xml.FlatXmlDataSetBuilder;
import org.dbunit.dataset.xml.FlatXmlWriter;

/**
 * Reads and writes DBUnit flat XML documents, one element per row:
 *
 * <pre>
 * &lt;dataset&gt;
 *   &lt;DEPT ID="10" NAME="Sales"/&gt;
 * &lt;/dataset&gt;
 * </pre>
 *
 * <p>
 * Values are read as text. The document encoding comes from the XML declaration when reading.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
class XmlCodec implements FileCodec<IDataSet> {

    /**
     * {@inheritDoc}
     */
    @Override
    public IDataSet decode(Path path, Map<String, Object> options) throws Exception {
        FlatXmlDataSetBuilder builder = new FlatXmlDataSetBuilder()
                .setColumnSensing(XmlTableReader.COLUMN_SENSING.valueIn(options))
                .setCaseSensitiveTableNames(
                        XmlTableReader.CASE_SENSITIVE_TABLE_NAMES.valueIn(options))
                .setDtdMetadata(XmlTableReader.DTD_METADATA.valueIn(options));
        try (InputStream in = Files.newInputStream(path)) {
            return builder.build(in);
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void encode(IDataSet data, Path path, Map<String, Object> options) throws Exception {
        try (OutputStream out = Files.newOutputStream(path)) {
            FlatXmlWriter writer = new FlatXmlWriter(out, FileOptions.charset(options).name());
            writer.setPrettyPrint(XmlTableWriter.PRETTY_PRINT.valueIn(options));
            writer.setIncludeEmptyTable(XmlTableWriter.INCLUDE_EMPTY_TABLE.valueIn(options));
            String docType = XmlTableWriter.DOC_TYPE.valueIn(options);
            if (docType != null) {
                writer.setDocType(docType);
            }
            writer.write(data);
        }
    }
}
