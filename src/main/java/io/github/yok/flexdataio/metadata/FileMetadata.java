package io.github.yok.flexdataio.metadata;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * File partition of a {@link ResultMetadata}.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class FileMetadata {

    // Absolute file path
    private final String path;

    // File size in bytes
    private final long size;

    private final Instant lastModified;

    private final Instant timestamp;
}
