package io.github.yok.flexdataio.config;

import com.google.common.collect.ImmutableMap;
import io.github.yok.flexdataio.exception.ConfigurationException;
import io.github.yok.flexdataio.format.DataFormat;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ordered set of {@link OptionSpec} declarations accepted by one adapter class.
 *
 * <p>
 * {@link #bind(DataFormat, Map)} turns a raw name/value map into {@link AdapterOptions}, failing
 * eagerly with {@link ConfigurationException} when:
 * </p>
 * <ul>
 * <li>a name is not declared by the schema</li>
 * <li>a required option is missing or {@code null}</li>
 * <li>a value cannot be converted to the declared type</li>
 * <li>a converted value violates the declared constraint</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public final class OptionSchema {

    // Declarations keyed by option name, in declaration order
    private final ImmutableMap<String, OptionSpec<?>> specs;

    private OptionSchema(ImmutableMap<String, OptionSpec<?>> specs) {
        this.specs = specs;
    }

    /**
     * Creates a schema from declarations.
     *
     * @param specs option declarations; names must be unique
     * @return the schema
     * @throws IllegalArgumentException if two declarations share a name
     */
    public static OptionSchema of(OptionSpec<?>... specs) {
        ImmutableMap.Builder<String, OptionSpec<?>> builder = ImmutableMap.builder();
        for (OptionSpec<?> spec : specs) {
            builder.put(spec.getName(), spec);
        }
        return new OptionSchema(builder.buildOrThrow());
    }

    /**
     * Returns the declared option names in declaration order.
     *
     * @return option names
     */
    public Set<String> names() {
        return specs.keySet();
    }

    /**
     * Returns the declarations in declaration order.
     *
     * @return option declarations
     */
    public Collection<OptionSpec<?>> specs() {
        return specs.values();
    }

    /**
     * Binds raw values against this schema.
     *
     * @param format format of the adapter being configured (used in error messages)
     * @param values raw option values; {@code null} values mean "use the default"
     * @return bound options containing every declared name
     * @throws ConfigurationException if the values do not satisfy the schema
     */
    public AdapterOptions bind(DataFormat format, Map<String, ?> values) {
        Map<String, ?> raw = values == null ? Map.of() : values;
        Set<String> unknown = new TreeSet<>(raw.keySet());
        unknown.removeAll(specs.keySet());
        if (!unknown.isEmpty()) {
            throw new ConfigurationException(format,
                    "Unknown option(s) " + unknown + "; supported options are " + names());
        }

        Map<String, Object> bound = new LinkedHashMap<>();
        for (OptionSpec<?> spec : specs.values()) {
            bound.put(spec.getName(), bindOne(format, spec, raw.get(spec.getName())));
        }
        return new AdapterOptions(format, bound);
    }

    private static <T> T bindOne(DataFormat format, OptionSpec<T> spec, Object raw) {
        if (raw == null) {
            if (spec.isRequired()) {
                throw new ConfigurationException(format,
                        "Missing required option '" + spec.getName() + "'");
            }
            return spec.getDefaultValue();
        }
        T value;
        try {
            value = spec.convert(raw);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(format,
                    "Invalid value for option '" + spec.getName() + "': " + e.getMessage(), e);
        }
        if (!spec.accepts(value)) {
            throw new ConfigurationException(format, "Invalid value for option '" + spec.getName()
                    + "': " + raw + " (" + spec.getConstraint() + ")");
        }
        return value;
    }
}
