package io.github.yok.flexdataio.registry;

import io.github.yok.flexdataio.adapter.Direction;
import io.github.yok.flexdataio.format.DataFormat;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lookup key of the adapter registry: at most one adapter class owns each key.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public final class AdapterKey {

    private final DataFormat format;

    private final Direction direction;

    private final Class<?> type;

    @Override
    public String toString() {
        return format + "/" + direction.name().toLowerCase() + "/" + type.getSimpleName();
    }
}
