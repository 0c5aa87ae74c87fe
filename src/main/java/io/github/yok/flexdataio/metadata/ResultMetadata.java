package io.github.yok.flexdataio.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Uniform metadata envelope returned by every load and save.
 *
 * <p>
 * Exactly one transport partition is present: {@link #getFileMetadata()} for file-backed formats or
 * {@link #getSqlMetadata()} for the database transport. {@link #getDataframeMetadata()} is always
 * present. {@link #toMap()} renders the envelope as nested maps:
 * </p>
 *
 * <pre>
 * {
 *   "file_metadata": {"path": ..., "size": ..., "last_modified": ..., "timestamp": ...},
 *   "dataframe_metadata": {"rows": ..., "column_names": [...], "datatypes": [...]}
 * }
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ToString
@EqualsAndHashCode
public final class ResultMetadata {

    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final FileMetadata fileMetadata;

    private final SqlMetadata sqlMetadata;

    @Getter
    private final DataFrameMetadata dataframeMetadata;

    ResultMetadata(FileMetadata fileMetadata, SqlMetadata sqlMetadata,
            DataFrameMetadata dataframeMetadata) {
        this.fileMetadata = fileMetadata;
        this.sqlMetadata = sqlMetadata;
        this.dataframeMetadata = dataframeMetadata;
    }

    /**
     * Returns the file partition.
     *
     * @return file metadata, empty for the database transport
     */
    public Optional<FileMetadata> getFileMetadata() {
        return Optional.ofNullable(fileMetadata);
    }

    /**
     * Returns the database partition.
     *
     * @return SQL metadata, empty for file transports
     */
    public Optional<SqlMetadata> getSqlMetadata() {
        return Optional.ofNullable(sqlMetadata);
    }

    /**
     * Renders the envelope as ordered nested maps with snake_case keys. Absent partitions and
     * {@code null} fields are omitted; instants are rendered as ISO-8601 text.
     *
     * @return an unmodifiable map
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        if (fileMetadata != null) {
            Map<String, Object> file = new LinkedHashMap<>();
            file.put("path", fileMetadata.getPath());
            file.put("size", fileMetadata.getSize());
            putIfPresent(file, "last_modified", fileMetadata.getLastModified());
            putIfPresent(file, "timestamp", fileMetadata.getTimestamp());
            out.put("file_metadata", Collections.unmodifiableMap(file));
        }
        if (sqlMetadata != null) {
            Map<String, Object> sql = new LinkedHashMap<>();
            sql.put("rows", sqlMetadata.getRows());
            putIfPresent(sql, "query", sqlMetadata.getQuery());
            putIfPresent(sql, "table_name", sqlMetadata.getTableName());
            out.put("sql_metadata", Collections.unmodifiableMap(sql));
        }
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("rows", dataframeMetadata.getRows());
        frame.put("column_names", dataframeMetadata.getColumnNames());
        frame.put("datatypes", dataframeMetadata.getDatatypes());
        out.put("dataframe_metadata", Collections.unmodifiableMap(frame));
        return Collections.unmodifiableMap(out);
    }

    /**
     * Renders {@link #toMap()} as indented JSON.
     *
     * @return JSON text
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(toMap());
        } catch (JsonProcessingException e) {
            // Only strings, numbers and lists are rendered
            throw new IllegalStateException("Failed to render metadata as JSON", e);
        }
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value.toString());
        }
    }
}
