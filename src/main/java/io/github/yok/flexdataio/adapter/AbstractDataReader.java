package io.github.yok.flexdataio.adapter;

import io.github.yok.flexdataio.config.AdapterOptions;
import io.github.yok.flexdataio.exception.CodecException;
import io.github.yok.flexdataio.exception.DataIoException;
import io.github.yok.flexdataio.exception.TypeMismatchException;
import io.github.yok.flexdataio.metadata.DataShape;
import io.github.yok.flexdataio.metadata.MetadataEnvelopeBuilder;
import io.github.yok.flexdataio.metadata.ResultMetadata;
import io.github.yok.flexdataio.metadata.TransportInfo;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class of reader adapters.
 *
 * <p>
 * {@link #load(Class)} runs the same steps for every format:
 * </p>
 * <ol>
 * <li>reject a type that is not applicable with {@link TypeMismatchException}, before any I/O</li>
 * <li>decode once with {@link #loadingOptions()} ({@link #read(Class, Map)})</li>
 * <li>collect transport signals ({@link #transport(Object)}) and build the metadata envelope</li>
 * </ol>
 * <p>
 * Failures other than {@link DataIoException} are wrapped in {@link CodecException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public abstract class AbstractDataReader implements DataReader {

    // Bound configuration
    private final AdapterOptions options;

    /**
     * Creates a reader.
     *
     * @param options bound configuration
     */
    protected AbstractDataReader(AdapterOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public AdapterOptions options() {
        return options;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public final <T> LoadResult<T> load(Class<T> type) {
        AdapterKind<?> kind = kind();
        if (!kind.supports(type)) {
            throw new TypeMismatchException(format(), Direction.READER, type,
                    kind.getApplicableTypes());
        }
        Map<String, Object> loadingOptions = loadingOptions();
        log.debug("[{}] loading {} with {}", format(), type.getSimpleName(), loadingOptions);
        try {
            Object data = read(type, loadingOptions);
            ResultMetadata metadata =
                    MetadataEnvelopeBuilder.build(transport(data), DataShape.ofData(data));
            log.info("[{}] loaded {} rows as {} from {}", format(),
                    metadata.getDataframeMetadata().getRows(), type.getSimpleName(),
                    describeSource());
            return new LoadResult<>(type.cast(data), metadata);
        } catch (DataIoException e) {
            throw e;
        } catch (Exception e) {
            throw new CodecException(format(), Direction.READER, type, e);
        }
    }

    /**
     * Decodes the source with exactly one codec call.
     *
     * @param type requested type, already checked to be applicable
     * @param loadingOptions codec options as returned by {@link #loadingOptions()}
     * @return an instance of {@code type}
     * @throws Exception if decoding fails
     */
    protected abstract Object read(Class<?> type, Map<String, Object> loadingOptions)
            throws Exception;

    /**
     * Collects the transport signals after a successful decode.
     *
     * @param data decoded data
     * @return transport signals
     * @throws Exception if the signals cannot be collected
     */
    protected abstract TransportInfo transport(Object data) throws Exception;

    /**
     * Describes the source for log messages.
     *
     * @return source description
     */
    protected abstract String describeSource();
}
