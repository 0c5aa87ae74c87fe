package io.github.yok.flexdataio.format;

import io.github.yok.flexdataio.adapter.AbstractDataWriter;
import io.github.yok.flexdataio.config.AdapterOptions;
import io.github.yok.flexdataio.metadata.FileTransport;
import io.github.yok.flexdataio.metadata.TransportInfo;
import io.github.yok.flexdataio.util.FileSupport;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import lombok.Getter;

/**
 * Base class of writers whose target is a single file. Missing parent directories are created
 * before the codec is called.
 *
 * @param <D> type consumed by the codec
 *
 * @author Yasuharu.Okawauchi
 */
public abstract class AbstractFileWriter<D> extends AbstractDataWriter {

    // Target file
    @Getter
    private final Path path;

    // Encoder of the format
    private final FileCodec<D> codec;

    /**
     * Creates a writer.
     *
     * @param options bound configuration; must contain {@link FileOptions#PATH}
     * @param codec format codec
     */
    protected AbstractFileWriter(AdapterOptions options, FileCodec<D> codec) {
        super(options);
        this.path = options.get(FileOptions.PATH);
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    protected final TransportInfo write(Object data, Map<String, Object> savingOptions)
            throws Exception {
        D prepared = prepare(data);
        FileSupport.createParentDirectories(path);
        codec.encode(prepared, path, savingOptions);
        return FileTransport.describe(path);
    }

    /**
     * Converts the input data to the codec's type.
     *
     * @param data data of an applicable type
     * @return the value handed to the codec
     * @throws Exception if the conversion fails
     */
    @SuppressWarnings("unchecked")
    protected D prepare(Object data) throws Exception {
        return (D) data;
    }

    @Override
    protected String describeTarget() {
        return path.toString();
    }
}
