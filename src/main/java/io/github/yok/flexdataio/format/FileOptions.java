package io.github.yok.flexdataio.format;

import io.github.yok.flexdataio.config.OptionSpec;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Option declarations shared by file-backed adapters.
 *
 * @author Yasuharu.Okawauchi
 */
public final class FileOptions {

    // File read or written; bookkeeping, never forwarded to a codec
    public static final OptionSpec<Path> PATH = OptionSpec.required("path", Path.class);

    // Text encoding of the file
    public static final OptionSpec<String> ENCODING =
            OptionSpec.optional("encoding", String.class, StandardCharsets.UTF_8.name())
                    .validatedBy(FileOptions::isSupportedCharset, "must be a supported charset");

    private FileOptions() {
        // Utility class; do not instantiate.
    }

    /**
     * Checks whether a charset name is legal and supported by this JVM.
     *
     * @param name charset name
     * @return {@code true} if {@link Charset#forName(String)} would succeed
     */
    public static boolean isSupportedCharset(String name) {
        if (StringUtils.isBlank(name)) {
            return false;
        }
        try {
            return Charset.isSupported(name);
        } catch (IllegalArgumentException e) {
            // Illegal charset name
            return false;
        }
    }

    /**
     * Reads the charset option from a codec option map.
     *
     * @param options codec options
     * @return the configured charset, or UTF-8 when absent
     */
    public static Charset charset(Map<String, Object> options) {
        Object name = options.get(ENCODING.getName());
        return name == null ? StandardCharsets.UTF_8 : Charset.forName(name.toString());
    }
}
