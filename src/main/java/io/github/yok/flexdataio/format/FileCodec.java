package io.github.yok.flexdataio.format;

import java.nio.file.Path;
import java.util.Map;

/**
 * Narrow seam between a file-backed adapter and the library that encodes or decodes its format.
 *
 * <p>
 * Adapters make exactly one call to a codec per load or save, passing their projected
 * loading/saving options; a codec never sees bookkeeping fields such as the path.
 * </p>
 *
 * @param <D> in-memory type produced and consumed by the codec
 *
 * @author Yasuharu.Okawauchi
 */
public interface FileCodec<D> {

    /**
     * Reads a file.
     *
     * @param path file to read
     * @param options codec options
     * @return decoded data
     * @throws Exception if the file cannot be read or parsed
     */
    D decode(Path path, Map<String, Object> options) throws Exception;

    /**
     * Writes a file, replacing any existing content.
     *
     * @param data data to write
     * @param path file to write; its parent directory exists
     * @param options codec options
     * @throws Exception if the data cannot be encoded or written
     */
    void encode(D data, Path path, Map<String, Object> options) throws Exception;
}
