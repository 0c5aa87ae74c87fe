package io.github.yok.flexdataio.format.feather;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.arrow.vector.compression.CompressionUtil;

/**
 * Buffer compression codecs of the Feather writer.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
public enum FeatherCompression {

    UNCOMPRESSED(CompressionUtil.CodecType.NO_COMPRESSION),

    LZ4(CompressionUtil.CodecType.LZ4_FRAME),

    ZSTD(CompressionUtil.CodecType.ZSTD);

    private final CompressionUtil.CodecType codecType;
}
