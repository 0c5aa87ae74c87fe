package io.github.yok.flexdataio.exception;

import io.github.yok.flexdataio.format.DataFormat;
import lombok.Getter;

/**
 * Base class of every failure raised by the data-interchange layer.
 *
 * <p>
 * Each instance carries the format identifier and, when known, the in-memory type involved, so a
 * caller can tell a wrong adapter choice from bad data or bad configuration. Both are rendered into
 * the message as {@code [format=csv, type=ITable]}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class DataIoException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    // Format involved in the failure (may be null when the format could not be determined)
    private final DataFormat format;

    // In-memory type involved in the failure (may be null)
    private final Class<?> type;

    /**
     * Creates an exception.
     *
     * @param format format involved, or {@code null}
     * @param type in-memory type involved, or {@code null}
     * @param message detail message
     * @param cause root cause, or {@code null}
     */
    protected DataIoException(DataFormat format, Class<?> type, String message, Throwable cause) {
        super(describe(format, type, message), cause);
        this.format = format;
        this.type = type;
    }

    private static String describe(DataFormat format, Class<?> type, String message) {
        StringBuilder sb = new StringBuilder("[format=");
        sb.append(format == null ? "?" : format.getId());
        if (type != null) {
            sb.append(", type=").append(type.getSimpleName());
        }
        return sb.append("] ").append(message).toString();
    }
}
