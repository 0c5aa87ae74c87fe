package io.github.yok.flexdataio.config;

import io.github.yok.flexdataio.adapter.Direction;
import io.github.yok.flexdataio.format.DataFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application-level option defaults for adapters, layered between the adapter's declared defaults
 * and the options passed on each call.
 *
 * <p>
 * Specify the following properties in {@code application.yml}.
 * </p>
 *
 * <pre>
 * flexdataio:
 *   readers:
 *     csv:
 *       delimiter: ";"
 *   writers:
 *     parquet:
 *       compression: GZIP
 * </pre>
 *
 * <p>
 * Keys below the format id are option names as declared by the adapter; values are converted to
 * the option type when the adapter is constructed.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "flexdataio")
@Getter
@Setter
@NoArgsConstructor
public class DataIoProperties {

    /**
     * Reader option defaults keyed by format id.
     */
    private Map<String, Map<String, String>> readers = new LinkedHashMap<>();

    /**
     * Writer option defaults keyed by format id.
     */
    private Map<String, Map<String, String>> writers = new LinkedHashMap<>();

    /**
     * Returns the configured defaults for one adapter.
     *
     * @param format adapter format
     * @param direction adapter direction
     * @return the defaults, or an empty map when none are configured
     */
    public Map<String, String> defaultsFor(DataFormat format, Direction direction) {
        Map<String, Map<String, String>> byFormat =
                direction == Direction.READER ? readers : writers;
        Map<String, String> defaults = byFormat.get(format.getId());
        return defaults == null ? Map.of() : defaults;
    }
}
