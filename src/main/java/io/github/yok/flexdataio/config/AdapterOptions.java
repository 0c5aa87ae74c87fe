package io.github.yok.flexdataio.config;

import io.github.yok.flexdataio.format.DataFormat;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Immutable option values bound by an {@link OptionSchema}.
 *
 * <p>
 * Every declared option is present; absent options hold their default, which may be {@code null}.
 * Adapters read typed values with {@link #get(OptionSpec)} and build their codec-facing maps with
 * {@link #project(OptionSpec...)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class AdapterOptions {

    // Format of the adapter the options belong to
    @Getter
    private final DataFormat format;

    // Bound values keyed by option name (null values allowed)
    private final Map<String, Object> values;

    AdapterOptions(DataFormat format, Map<String, Object> values) {
        this.format = format;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Returns the bound value of an option.
     *
     * @param spec option declaration
     * @param <T> value type
     * @return the value, or {@code null} if neither supplied nor defaulted
     * @throws IllegalArgumentException if the option was not part of the binding schema
     */
    public <T> T get(OptionSpec<T> spec) {
        if (!values.containsKey(spec.getName())) {
            throw new IllegalArgumentException("Option not bound: " + spec.getName());
        }
        return spec.getType().cast(values.get(spec.getName()));
    }

    /**
     * Projects the given options into a new ordered map, omitting {@code null} values.
     *
     * @param specs options to include, in output order
     * @return a new unmodifiable map
     */
    public Map<String, Object> project(OptionSpec<?>... specs) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (OptionSpec<?> spec : specs) {
            Object value = get(spec);
            if (value != null) {
                out.put(spec.getName(), value);
            }
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * Returns all bound values, including bookkeeping fields.
     *
     * @return an unmodifiable view
     */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return format + values.toString();
    }
}
