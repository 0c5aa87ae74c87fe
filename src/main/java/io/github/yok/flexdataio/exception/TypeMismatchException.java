package io.github.yok.flexdataio.exception;

import io.github.yok.flexdataio.adapter.Direction;
import io.github.yok.flexdataio.format.DataFormat;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Thrown when the requested (reader) or supplied (writer) in-memory type is not one of the
 * adapter's applicable types. Always raised before any I/O is attempted.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class TypeMismatchException extends DataIoException {

    private static final long serialVersionUID = 1L;

    // Types the adapter does support, in declaration order
    private final transient List<Class<?>> applicableTypes;

    /**
     * Creates an exception.
     *
     * @param format adapter format
     * @param direction adapter direction
     * @param type offending type ({@code null} when a writer received {@code null})
     * @param applicableTypes types the adapter supports
     */
    public TypeMismatchException(DataFormat format, Direction direction, Class<?> type,
            List<Class<?>> applicableTypes) {
        super(format, type, "Cannot " + direction.getOperation() + " "
                + (type == null ? "null" : type.getName()) + "; applicable types are "
                + applicableTypes.stream().map(Class::getSimpleName).collect(Collectors.toList()),
                null);
        this.applicableTypes = List.copyOf(applicableTypes);
    }
}
