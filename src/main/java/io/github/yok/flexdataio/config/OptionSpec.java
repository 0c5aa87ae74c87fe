package io.github.yok.flexdataio.config;

import java.io.File;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import lombok.Getter;
import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.EnumUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Declaration of one named adapter option: its value type, default, whether it is required, and an
 * optional semantic constraint.
 *
 * <p>
 * Raw values arrive from Java callers (already typed) or from {@code application.yml} (strings), so
 * {@link #convert(Object)} accepts both and coerces strings to the declared type:
 * </p>
 * <ul>
 * <li>{@code Integer}, {@code Long}, {@code Double}: decimal text; numbers are widened or narrowed
 * when the value fits</li>
 * <li>{@code Boolean}: {@code true}/{@code false}/{@code yes}/{@code no}/{@code on}/{@code off}</li>
 * <li>{@code Character}: exactly one character; the two-character text {@code \t} is a tab</li>
 * <li>{@code Path}: path text or a {@link File}</li>
 * <li>enums: constant name, case-insensitive</li>
 * <li>{@code List}: a list, or comma-separated text</li>
 * </ul>
 *
 * @param <T> value type
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class OptionSpec<T> {

    // Option name as used in option maps and configuration files
    private final String name;

    // Declared value type
    private final Class<T> type;

    // Element type for list options; null for scalar options
    private final Class<?> elementType;

    // Value used when the option is absent (may be null)
    private final T defaultValue;

    // Whether the option must be supplied
    private final boolean required;

    // Semantic constraint; always true when none was declared
    private final Predicate<? super T> validator;

    // Human-readable description of the constraint, used in error messages
    private final String constraint;

    private OptionSpec(String name, Class<T> type, Class<?> elementType, T defaultValue,
            boolean required, Predicate<? super T> validator, String constraint) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.elementType = elementType;
        this.defaultValue = defaultValue;
        this.required = required;
        this.validator = validator;
        this.constraint = constraint;
    }

    /**
     * Declares a required option without default.
     *
     * @param name option name
     * @param type value type
     * @param <T> value type
     * @return the option declaration
     */
    public static <T> OptionSpec<T> required(String name, Class<T> type) {
        return new OptionSpec<>(name, type, null, null, true, v -> true, null);
    }

    /**
     * Declares an optional option.
     *
     * @param name option name
     * @param type value type
     * @param defaultValue value used when the option is absent (may be {@code null})
     * @param <T> value type
     * @return the option declaration
     */
    public static <T> OptionSpec<T> optional(String name, Class<T> type, T defaultValue) {
        return new OptionSpec<>(name, type, null, defaultValue, false, v -> true, null);
    }

    /**
     * Declares an optional list option whose default is {@code null}.
     *
     * @param name option name
     * @param elementType list element type
     * @param <E> element type
     * @return the option declaration
     */
    @SuppressWarnings("unchecked")
    public static <E> OptionSpec<List<E>> list(String name, Class<E> elementType) {
        Class<List<E>> listType = (Class<List<E>>) (Class<?>) List.class;
        return new OptionSpec<>(name, listType, elementType, null, false, v -> true, null);
    }

    /**
     * Returns a copy of this declaration with a semantic constraint.
     *
     * @param check predicate the (non-null) value must satisfy
     * @param description constraint description for error messages
     * @return a new declaration
     */
    public OptionSpec<T> validatedBy(Predicate<? super T> check, String description) {
        return new OptionSpec<>(name, type, elementType, defaultValue, required, check,
                description);
    }

    /**
     * Checks the semantic constraint against a converted value.
     *
     * @param value converted value (non-null)
     * @return {@code true} if the value is acceptable
     */
    public boolean accepts(T value) {
        return validator.test(value);
    }

    /**
     * Reads this option from a projected option map, as handed to a codec.
     *
     * @param options option map keyed by option name
     * @return the value, or the default when the map has no value for this option
     */
    public T valueIn(Map<String, ?> options) {
        Object value = options.get(name);
        return value == null ? defaultValue : type.cast(value);
    }

    /**
     * Converts a raw value to the declared type.
     *
     * @param raw raw value (non-null)
     * @return converted value
     * @throws IllegalArgumentException if the value cannot be converted
     */
    public T convert(Object raw) {
        if (elementType != null) {
            List<Object> out = new ArrayList<>();
            Iterable<?> items;
            if (raw instanceof Iterable) {
                items = (Iterable<?>) raw;
            } else if (raw instanceof String) {
                items = Arrays.asList(StringUtils.split((String) raw, ','));
            } else {
                throw new IllegalArgumentException(
                        "expected a list but got " + raw.getClass().getSimpleName());
            }
            for (Object item : items) {
                out.add(item == null ? null : convertScalar(item, elementType));
            }
            return type.cast(Collections.unmodifiableList(out));
        }
        return type.cast(convertScalar(raw, type));
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static Object convertScalar(Object raw, Class<?> target) {
        if (target.isInstance(raw)) {
            return raw;
        }
        if (raw instanceof String) {
            String text = ((String) raw).trim();
            if (target == Integer.class) {
                return Integer.valueOf(text);
            }
            if (target == Long.class) {
                return Long.valueOf(text);
            }
            if (target == Double.class) {
                return Double.valueOf(text);
            }
            if (target == Boolean.class) {
                Boolean b = BooleanUtils.toBooleanObject(text);
                if (b == null) {
                    throw new IllegalArgumentException("not a boolean: " + raw);
                }
                return b;
            }
            if (target == Character.class) {
                String unescaped = "\\t".equals(raw) ? "\t" : (String) raw;
                if (unescaped.length() != 1) {
                    throw new IllegalArgumentException("expected a single character: " + raw);
                }
                return unescaped.charAt(0);
            }
            if (target == Path.class) {
                return Paths.get(text);
            }
            if (target.isEnum()) {
                Object constant = EnumUtils.getEnumIgnoreCase((Class<Enum>) target, text);
                if (constant == null) {
                    throw new IllegalArgumentException("unknown constant '" + raw
                            + "', expected one of " + Arrays.toString(target.getEnumConstants()));
                }
                return constant;
            }
        }
        if (raw instanceof Number) {
            Number n = (Number) raw;
            if (target == Integer.class && n.longValue() == n.intValue()
                    && n.doubleValue() == n.longValue()) {
                return n.intValue();
            }
            if (target == Long.class && n.doubleValue() == n.longValue()) {
                return n.longValue();
            }
            if (target == Double.class) {
                return n.doubleValue();
            }
        }
        if (raw instanceof File && target == Path.class) {
            return ((File) raw).toPath();
        }
        if (target == String.class && (raw instanceof Number || raw instanceof Character
                || raw instanceof Enum || raw instanceof Charset || raw instanceof Path)) {
            return raw instanceof Charset ? ((Charset) raw).name() : raw.toString();
        }
        throw new IllegalArgumentException("expected " + target.getSimpleName() + " but got "
                + raw.getClass().getSimpleName());
    }

    @Override
    public String toString() {
        return name + ":" + type.getSimpleName();
    }
}
