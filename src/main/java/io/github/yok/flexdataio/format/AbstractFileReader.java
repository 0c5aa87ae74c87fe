package io.github.yok.flexdataio.format;

import io.github.yok.flexdataio.adapter.AbstractDataReader;
import io.github.yok.flexdataio.config.AdapterOptions;
import io.github.yok.flexdataio.metadata.FileTransport;
import io.github.yok.flexdataio.metadata.TransportInfo;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import lombok.Getter;

/**
 * Base class of readers whose source is a single file.
 *
 * @param <D> type produced by the codec
 *
 * @author Yasuharu.Okawauchi
 */
public abstract class AbstractFileReader<D> extends AbstractDataReader {

    // Source file
    @Getter
    private final Path path;

    // Decoder of the format
    private final FileCodec<D> codec;

    /**
     * Creates a reader.
     *
     * @param options bound configuration; must contain {@link FileOptions#PATH}
     * @param codec format codec
     */
    protected AbstractFileReader(AdapterOptions options, FileCodec<D> codec) {
        super(options);
        this.path = options.get(FileOptions.PATH);
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    protected final Object read(Class<?> type, Map<String, Object> loadingOptions)
            throws Exception {
        return select(codec.decode(path, loadingOptions), type);
    }

    /**
     * Converts the decoded value to the requested type. Readers with a single applicable type
     * return the value unchanged.
     *
     * @param decoded value returned by the codec
     * @param type requested type
     * @return an instance of {@code type}
     * @throws Exception if the conversion fails
     */
    protected Object select(D decoded, Class<?> type) throws Exception {
        return decoded;
    }

    @Override
    protected TransportInfo transport(Object data) throws Exception {
        return FileTransport.describe(path);
    }

    @Override
    protected String describeSource() {
        return path.toString();
    }
}
