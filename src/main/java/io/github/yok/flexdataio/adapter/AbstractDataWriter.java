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
 * Base class of writer adapters.
 *
 * <p>
 * {@link #save(Object)} rejects data that is not an instance of an applicable type (including
 * {@code null}) with {@link TypeMismatchException} before any I/O, encodes once with
 * {@link #savingOptions()}, then describes the input data in the metadata envelope. Failures other
 * than {@link DataIoException} are wrapped in {@link CodecException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public abstract class AbstractDataWriter implements DataWriter {

    // Bound configuration
    private final AdapterOptions options;

    /**
     * Creates a writer.
     *
     * @param options bound configuration
     */
    protected AbstractDataWriter(AdapterOptions options) {
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
    public final ResultMetadata save(Object data) {
        AdapterKind<?> kind = kind();
        Class<?> type = kind.typeOf(data);
        if (type == null) {
            throw new TypeMismatchException(format(), Direction.WRITER,
                    data == null ? null : data.getClass(), kind.getApplicableTypes());
        }
        Map<String, Object> savingOptions = savingOptions();
        log.debug("[{}] saving {} with {}", format(), type.getSimpleName(), savingOptions);
        try {
            DataShape shape = DataShape.ofData(data);
            ResultMetadata metadata =
                    MetadataEnvelopeBuilder.build(write(data, savingOptions), shape);
            log.info("[{}] saved {} rows from {} to {}", format(), shape.getRowCount(),
                    type.getSimpleName(), describeTarget());
            return metadata;
        } catch (DataIoException e) {
            throw e;
        } catch (Exception e) {
            throw new CodecException(format(), Direction.WRITER, type, e);
        }
    }

    /**
     * Encodes the data with exactly one codec call.
     *
     * @param data data, already checked to be of an applicable type
     * @param savingOptions codec options as returned by {@link #savingOptions()}
     * @return transport signals of the written target
     * @throws Exception if encoding fails
     */
    protected abstract TransportInfo write(Object data, Map<String, Object> savingOptions)
            throws Exception;

    /**
     * Describes the target for log messages.
     *
     * @return target description
     */
    protected abstract String describeTarget();
}
