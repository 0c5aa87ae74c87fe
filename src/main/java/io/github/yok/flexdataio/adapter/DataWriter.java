package io.github.yok.flexdataio.adapter;

import io.github.yok.flexdataio.metadata.ResultMetadata;
import java.util.Map;

/**
 * Adapter that writes an in-memory representation to a target.
 *
 * @author Yasuharu.Okawauchi
 */
public interface DataWriter extends DataAdapter {

    /**
     * Writes the data.
     *
     * @param data data to write; must be an instance of one of the applicable types of
     *        {@link #kind()}
     * @return the metadata envelope of the written data
     * @throws io.github.yok.flexdataio.exception.TypeMismatchException if the data is not of an
     *         applicable type; raised before any I/O
     * @throws io.github.yok.flexdataio.exception.CodecException if encoding fails
     */
    ResultMetadata save(Object data);

    /**
     * Returns the options forwarded to the encode call. Bookkeeping fields (path, connection,
     * table name) and {@code null} values are not included.
     *
     * @return an unmodifiable map
     */
    Map<String, Object> savingOptions();
}
