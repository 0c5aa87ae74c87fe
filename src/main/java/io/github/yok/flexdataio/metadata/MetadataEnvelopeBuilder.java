package io.github.yok.flexdataio.metadata;

import java.util.Objects;

/**
 * Builds {@link ResultMetadata} from the raw signals of one load or save.
 *
 * <p>
 * The transport partition is chosen by the type of {@link TransportInfo}: file signals fill
 * {@code file_metadata}, database signals fill {@code sql_metadata}. The shape always fills
 * {@code dataframe_metadata}. Builds are pure and never touch the file system or the database.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class MetadataEnvelopeBuilder {

    private MetadataEnvelopeBuilder() {
        // Utility class; do not instantiate.
    }

    /**
     * Builds the envelope.
     *
     * @param transport transport signals
     * @param shape shape of the data loaded or saved
     * @return the envelope
     */
    public static ResultMetadata build(TransportInfo transport, DataShape shape) {
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(shape, "shape");
        DataFrameMetadata frame = new DataFrameMetadata(shape);
        if (transport instanceof FileTransport) {
            FileTransport file = (FileTransport) transport;
            return new ResultMetadata(new FileMetadata(file.getPath().toString(), file.getSize(),
                    file.getLastModified(), file.getTimestamp()), null, frame);
        }
        SqlTransport sql = (SqlTransport) transport;
        return new ResultMetadata(null,
                new SqlMetadata(sql.getRows(), sql.getQuery(), sql.getTableName()), frame);
    }
}
