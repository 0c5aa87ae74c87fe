package io.github.yok.flexdataio.exception;

import io.github.yok.flexdataio.adapter.Direction;
import io.github.yok.flexdataio.format.DataFormat;

/**
 * Thrown when no adapter is registered for a (format, direction, type) key, or when the format
 * itself cannot be determined. Indicates a setup error rather than bad data.
 *
 * @author Yasuharu.Okawauchi
 */
public class NoAdapterFoundException extends DataIoException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception for a missing registry entry.
     *
     * @param format requested format
     * @param direction requested direction
     * @param type requested type
     */
    public NoAdapterFoundException(DataFormat format, Direction direction, Class<?> type) {
        super(format, type, "No " + direction.name().toLowerCase() + " registered for type "
                + (type == null ? "null" : type.getName()), null);
    }

    /**
     * Creates an exception for an unresolvable format.
     *
     * @param message detail message
     */
    public NoAdapterFoundException(String message) {
        super(null, null, message, null);
    }
}
