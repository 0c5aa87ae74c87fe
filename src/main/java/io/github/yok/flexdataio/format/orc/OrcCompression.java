package io.github.yok.flexdataio.format.orc;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.orc.CompressionKind;

/**
 * Compression codecs accepted by the ORC writer. ORC implements each of them in Java.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
public enum OrcCompression {

    NONE(CompressionKind.NONE),

    ZLIB(CompressionKind.ZLIB),

    SNAPPY(CompressionKind.SNAPPY),

    LZ4(CompressionKind.LZ4),

    ZSTD(CompressionKind.ZSTD);

    private final CompressionKind kind;
}
