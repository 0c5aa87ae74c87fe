package io.github.yok.flexdataio.exception;

import io.github.yok.flexdataio.adapter.Direction;
import io.github.yok.flexdataio.format.DataFormat;
import lombok.Getter;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Wraps any failure of the external encode/decode call (malformed file, missing columns, connection
 * errors, ...), tagged with the originating format and operation.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class CodecException extends DataIoException {

    private static final long serialVersionUID = 1L;

    // Direction of the failed operation (READER = load, WRITER = save)
    private final Direction direction;

    /**
     * Creates an exception wrapping a codec failure.
     *
     * @param format adapter format
     * @param direction operation direction
     * @param type in-memory type involved
     * @param cause codec failure
     */
    public CodecException(DataFormat format, Direction direction, Class<?> type,
            Throwable cause) {
        super(format, type, direction.getOperation() + " failed: "
                + ExceptionUtils.getRootCauseMessage(cause), cause);
        this.direction = direction;
    }

    /**
     * Creates an exception for a failure detected by the adapter itself.
     *
     * @param format adapter format
     * @param direction operation direction
     * @param type in-memory type involved
     * @param message detail message
     */
    public CodecException(DataFormat format, Direction direction, Class<?> type,
            String message) {
        super(format, type, direction.getOperation() + " failed: " + message, null);
        this.direction = direction;
    }
}
