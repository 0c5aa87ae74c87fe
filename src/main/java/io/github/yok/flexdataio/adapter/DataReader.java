package io.github.yok.flexdataio.adapter;

import java.util.Map;

/**
 * Adapter that loads data from a source into an in-memory representation.
 *
 * @author Yasuharu.Okawauchi
 */
public interface DataReader extends DataAdapter {

    /**
     * Loads the data as the requested type.
     *
     * @param type requested in-memory type; must be one of the applicable types of
     *        {@link #kind()}
     * @param <T> requested type
     * @return the data with its metadata envelope
     * @throws io.github.yok.flexdataio.exception.TypeMismatchException if the type is not
     *         applicable; raised before any I/O
     * @throws io.github.yok.flexdataio.exception.CodecException if decoding fails
     */
    <T> LoadResult<T> load(Class<T> type);

    /**
     * Returns the options forwarded to the decode call. Bookkeeping fields (path, connection,
     * table name) and {@code null} values are not included.
     *
     * @return an unmodifiable map
     */
    Map<String, Object> loadingOptions();
}
