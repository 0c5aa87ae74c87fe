package io.github.yok.flexdataio.format;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;
import org.apache.commons.io.FilenameUtils;

/**
 * Enumeration of supported serialization formats.
 *
 * <p>
 * Each format has a stable identifier used by callers and configuration files, the transport it
 * travels over, and zero or more file extensions recognized as belonging to it. For example,
 * {@link #YAML} supports both {@code .yaml} and {@code .yml}; {@link #SQL} has no extension because
 * it is database-backed.
 * </p>
 *
 * <p>
 * Extension matching is centralized here so that the orchestrator does not need to hardcode string
 * comparisons when inferring a format from a path.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum DataFormat {

    // Comma-Separated Values format (CSV).
    CSV("csv", TransportKind.FILE, "csv"),

    // JavaScript Object Notation format (JSON).
    JSON("json", TransportKind.FILE, "json"),

    // YAML Ain't Markup Language format (YAML/YML).
    YAML("yaml", TransportKind.FILE, "yaml", "yml"),

    // DBUnit flat XML format.
    XML("xml", TransportKind.FILE, "xml"),

    // HTML tables.
    HTML("html", TransportKind.FILE, "html", "htm"),

    // Relational database table or query.
    SQL("sql", TransportKind.DATABASE),

    // Apache Parquet columnar format.
    PARQUET("parquet", TransportKind.FILE, "parquet"),

    // Apache Avro object container format.
    AVRO("avro", TransportKind.FILE, "avro"),

    // Apache ORC columnar format.
    ORC("orc", TransportKind.FILE, "orc"),

    // Feather V2, the Apache Arrow IPC file format.
    FEATHER("feather", TransportKind.FILE, "feather", "arrow");

    // Identifier used in configuration and dispatch (lowercase).
    private final String id;

    // Transport the format travels over.
    private final TransportKind transportKind;

    // Set of valid extensions for this format (all lowercase).
    private final Set<String> extensions;

    DataFormat(String id, TransportKind transportKind, String... exts) {
        this.id = id;
        this.transportKind = transportKind;
        this.extensions = Arrays.stream(exts).map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Determines whether the given file extension belongs to this format.
     *
     * @param ext file extension to check (case-insensitive, without dot)
     * @return {@code true} if the extension matches this format, {@code false} otherwise
     */
    public boolean matches(String ext) {
        return ext != null && extensions.contains(ext.toLowerCase(Locale.ROOT));
    }

    /**
     * Looks up a format by its identifier.
     *
     * @param id format identifier (case-insensitive)
     * @return the matching format, or empty if none
     */
    public static Optional<DataFormat> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(f -> f.id.equals(normalized)).findFirst();
    }

    /**
     * Infers the format of a file from its extension.
     *
     * @param path file path
     * @return the matching format, or empty if the extension is unknown
     */
    public static Optional<DataFormat> fromPath(Path path) {
        if (path == null || path.getFileName() == null) {
            return Optional.empty();
        }
        String ext = FilenameUtils.getExtension(path.getFileName().toString());
        return Arrays.stream(values()).filter(f -> f.matches(ext)).findFirst();
    }

    @Override
    public String toString() {
        return id;
    }
}
