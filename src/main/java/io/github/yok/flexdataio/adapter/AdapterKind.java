package io.github.yok.flexdataio.adapter;

import com.google.common.collect.ImmutableList;
import io.github.yok.flexdataio.config.AdapterOptions;
import io.github.yok.flexdataio.config.OptionSchema;
import io.github.yok.flexdataio.format.DataFormat;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import lombok.Getter;

/**
 * Class-level descriptor of an adapter class: what it handles and how to build it.
 *
 * <p>
 * Every adapter class publishes one instance as {@code public static final KIND}, so its format,
 * direction and applicable types can be queried without constructing an adapter. The applicable
 * types are non-empty and fixed when the kind is created.
 * </p>
 *
 * @param <A> adapter class
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class AdapterKind<A extends DataAdapter> {

    private final DataFormat format;

    private final Direction direction;

    private final Class<A> adapterClass;

    // Supported in-memory types, in declaration order
    private final ImmutableList<Class<?>> applicableTypes;

    // Options accepted by the adapter's factory
    private final OptionSchema schema;

    // Creates an adapter from bound options
    private final Function<AdapterOptions, A> factory;

    private AdapterKind(DataFormat format, Direction direction, Class<A> adapterClass,
            ImmutableList<Class<?>> applicableTypes, OptionSchema schema,
            Function<AdapterOptions, A> factory) {
        if (applicableTypes.isEmpty()) {
            throw new IllegalArgumentException(
                    adapterClass.getName() + " must declare at least one applicable type");
        }
        this.format = Objects.requireNonNull(format, "format");
        this.direction = direction;
        this.adapterClass = adapterClass;
        this.applicableTypes = applicableTypes;
        this.schema = Objects.requireNonNull(schema, "schema");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /**
     * Describes a reader class.
     *
     * @param format handled format
     * @param readerClass reader class
     * @param schema accepted options
     * @param factory creates a reader from bound options
     * @param types applicable types, in preference order
     * @param <R> reader class
     * @return the kind
     */
    public static <R extends DataReader> AdapterKind<R> reader(DataFormat format,
            Class<R> readerClass, OptionSchema schema, Function<AdapterOptions, R> factory,
            Class<?>... types) {
        return new AdapterKind<>(format, Direction.READER, readerClass,
                ImmutableList.copyOf(types), schema, factory);
    }

    /**
     * Describes a writer class.
     *
     * @param format handled format
     * @param writerClass writer class
     * @param schema accepted options
     * @param factory creates a writer from bound options
     * @param types applicable types, in preference order
     * @param <W> writer class
     * @return the kind
     */
    public static <W extends DataWriter> AdapterKind<W> writer(DataFormat format,
            Class<W> writerClass, OptionSchema schema, Function<AdapterOptions, W> factory,
            Class<?>... types) {
        return new AdapterKind<>(format, Direction.WRITER, writerClass,
                ImmutableList.copyOf(types), schema, factory);
    }

    /**
     * Checks whether a requested type is one of the applicable types.
     *
     * @param type requested type
     * @return {@code true} if the adapter handles exactly this type
     */
    public boolean supports(Class<?> type) {
        return type != null && applicableTypes.contains(type);
    }

    /**
     * Returns the applicable type a value is an instance of.
     *
     * @param data value to classify
     * @return the first applicable type {@code data} is an instance of, or {@code null}
     */
    public Class<?> typeOf(Object data) {
        if (data == null) {
            return null;
        }
        for (Class<?> type : applicableTypes) {
            if (type.isInstance(data)) {
                return type;
            }
        }
        return null;
    }

    /**
     * Binds raw options and creates an adapter.
     *
     * @param options raw option values
     * @return a new adapter
     * @throws io.github.yok.flexdataio.exception.ConfigurationException if the options are invalid
     */
    public A create(Map<String, ?> options) {
        return factory.apply(schema.bind(format, options));
    }

    @Override
    public String toString() {
        return format + " " + direction.name().toLowerCase() + " " + adapterClass.getSimpleName();
    }
}
