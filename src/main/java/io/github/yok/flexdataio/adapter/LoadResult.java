package io.github.yok.flexdataio.adapter;

import io.github.yok.flexdataio.metadata.ResultMetadata;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Data produced by a reader together with its metadata envelope.
 *
 * @param <T> in-memory type of the data
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@RequiredArgsConstructor
public final class LoadResult<T> {

    private final T data;

    private final ResultMetadata metadata;
}
