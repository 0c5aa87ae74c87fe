package io.github.yok.flexdataio.metadata;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import lombok.Getter;
import lombok.ToString;

/**
 * Transport signals of a file-backed load or save.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class FileTransport extends TransportInfo {

    // Absolute, normalized file path
    private final Path path;

    // File size in bytes
    private final long size;

    // File system last-modified time
    private final Instant lastModified;

    // Time the operation completed
    private final Instant timestamp;

    /**
     * Creates transport signals from explicit values.
     *
     * @param path file path
     * @param size file size in bytes
     * @param lastModified last-modified time
     * @param timestamp completion time
     */
    public FileTransport(Path path, long size, Instant lastModified, Instant timestamp) {
        this.path = path.toAbsolutePath().normalize();
        this.size = size;
        this.lastModified = lastModified;
        this.timestamp = timestamp;
    }

    /**
     * Reads size and last-modified time of an existing file.
     *
     * @param path file path
     * @return transport signals stamped with the current time
     * @throws IOException if the file attributes cannot be read
     */
    public static FileTransport describe(Path path) throws IOException {
        return new FileTransport(path, Files.size(path),
                Files.getLastModifiedTime(path).toInstant(), Instant.now());
    }
}
