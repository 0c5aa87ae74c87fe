package io.github.yok.flexdataio.exception;

import io.github.yok.flexdataio.adapter.Direction;
import io.github.yok.flexdataio.format.DataFormat;

/**
 * Thrown at registration time when a second adapter class claims a (format, direction, type) key
 * that another adapter class already owns.
 *
 * @author Yasuharu.Okawauchi
 */
public class AmbiguousAdapterException extends DataIoException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception.
     *
     * @param format contested format
     * @param direction contested direction
     * @param type contested type
     * @param existing adapter class already registered
     * @param rejected adapter class being registered
     */
    public AmbiguousAdapterException(DataFormat format, Direction direction, Class<?> type,
            Class<?> existing, Class<?> rejected) {
        super(format, type, "Both " + existing.getName() + " and " + rejected.getName()
                + " declare a " + direction.name().toLowerCase() + " for this type", null);
    }
}
