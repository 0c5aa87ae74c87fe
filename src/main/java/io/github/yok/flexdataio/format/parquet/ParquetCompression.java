package io.github.yok.flexdataio.format.parquet;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;

/**
 * Compression codecs accepted by the Parquet writer. Each one works without native libraries.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
public enum ParquetCompression {

    UNCOMPRESSED(CompressionCodecName.UNCOMPRESSED),

    SNAPPY(CompressionCodecName.SNAPPY),

    GZIP(CompressionCodecName.GZIP);

    private final CompressionCodecName codecName;
}
