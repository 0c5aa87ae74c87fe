package io.github.yok.flexdataio.registry;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.github.yok.flexdataio.adapter.AdapterKind;
import io.github.yok.flexdataio.adapter.AdapterProvider;
import io.github.yok.flexdataio.adapter.DataReader;
import io.github.yok.flexdataio.adapter.DataWriter;
import io.github.yok.flexdataio.adapter.Direction;
import io.github.yok.flexdataio.exception.AmbiguousAdapterException;
import io.github.yok.flexdataio.exception.NoAdapterFoundException;
import io.github.yok.flexdataio.format.DataFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps {@code (format, direction, type)} to the adapter kind that handles it.
 *
 * <h2>Uniqueness</h2>
 *
 * <p>
 * Each key is owned by at most one adapter class. Registering a kind whose class differs from the
 * owner of any of its keys fails with {@link AmbiguousAdapterException} and leaves the registry
 * unchanged; registering the same class again is a no-op.
 * </p>
 *
 * <h2>Thread-safety</h2>
 *
 * <p>
 * Lookups read a {@code volatile} {@link ImmutableMap} snapshot without locking. Registration
 * builds a new snapshot under a lock and publishes it in one write, so a lookup never observes a
 * partially registered kind.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class AdapterRegistry {

    // Current lookup table, replaced as a whole on registration
    private volatile ImmutableMap<AdapterKey, AdapterKind<?>> table = ImmutableMap.of();

    // Guards snapshot replacement
    private final Object lock = new Object();

    /**
     * Creates an empty registry.
     */
    public AdapterRegistry() {
        // Empty; populate with register(...) or use discover(...)
    }

    /**
     * Creates a registry populated from every {@link AdapterProvider} visible to a class loader.
     *
     * @param classLoader class loader used by {@link ServiceLoader}
     * @return a new registry
     * @throws AmbiguousAdapterException if two providers contribute different adapter classes for
     *         the same key
     */
    public static AdapterRegistry discover(ClassLoader classLoader) {
        AdapterRegistry registry = new AdapterRegistry();
        for (AdapterProvider provider : ServiceLoader.load(AdapterProvider.class, classLoader)) {
            log.debug("Discovered adapter provider {}", provider.getClass().getName());
            registry.registerAll(provider.kinds());
        }
        log.info("Adapter registry initialized: {} formats, {} entries", registry.formats().size(),
                registry.table.size());
        return registry;
    }

    /**
     * Returns the process-wide registry, discovered from the context class loader on first use.
     *
     * @return the shared registry
     */
    public static AdapterRegistry defaultRegistry() {
        return Holder.INSTANCE;
    }

    /**
     * Registers an adapter kind under each of its applicable types.
     *
     * @param kind adapter kind
     * @throws AmbiguousAdapterException if a key is already owned by another adapter class
     */
    public void register(AdapterKind<?> kind) {
        registerAll(ImmutableList.of(kind));
    }

    /**
     * Registers several adapter kinds atomically: either all are added or none is.
     *
     * @param kinds adapter kinds
     * @throws AmbiguousAdapterException if a key is already owned by another adapter class
     */
    public void registerAll(Iterable<? extends AdapterKind<?>> kinds) {
        synchronized (lock) {
            Map<AdapterKey, AdapterKind<?>> next = new LinkedHashMap<>(table);
            for (AdapterKind<?> kind : kinds) {
                Objects.requireNonNull(kind, "kind");
                for (Class<?> type : kind.getApplicableTypes()) {
                    AdapterKey key = new AdapterKey(kind.getFormat(), kind.getDirection(), type);
                    AdapterKind<?> existing = next.get(key);
                    if (existing == null) {
                        next.put(key, kind);
                        log.debug("register: {} -> {}", key, kind.getAdapterClass().getName());
                    } else if (existing.getAdapterClass() != kind.getAdapterClass()) {
                        throw new AmbiguousAdapterException(kind.getFormat(), kind.getDirection(),
                                type, existing.getAdapterClass(), kind.getAdapterClass());
                    }
                }
            }
            table = ImmutableMap.copyOf(next);
        }
    }

    /**
     * Resolves the adapter kind for a key.
     *
     * @param format format
     * @param direction direction
     * @param type in-memory type
     * @return the registered kind
     * @throws NoAdapterFoundException if no kind is registered for the key
     */
    public AdapterKind<?> resolve(DataFormat format, Direction direction, Class<?> type) {
        AdapterKind<?> kind = table.get(new AdapterKey(format, direction, type));
        if (kind == null) {
            throw new NoAdapterFoundException(format, direction, type);
        }
        return kind;
    }

    /**
     * Resolves the reader kind for a format and requested type.
     *
     * @param format format
     * @param type requested type
     * @return the registered reader kind
     * @throws NoAdapterFoundException if no reader is registered
     */
    @SuppressWarnings("unchecked")
    public AdapterKind<? extends DataReader> resolveReader(DataFormat format, Class<?> type) {
        return (AdapterKind<? extends DataReader>) resolve(format, Direction.READER, type);
    }

    /**
     * Resolves the writer kind for a format and input type.
     *
     * @param format format
     * @param type input type
     * @return the registered writer kind
     * @throws NoAdapterFoundException if no writer is registered
     */
    @SuppressWarnings("unchecked")
    public AdapterKind<? extends DataWriter> resolveWriter(DataFormat format, Class<?> type) {
        return (AdapterKind<? extends DataWriter>) resolve(format, Direction.WRITER, type);
    }

    /**
     * Returns the distinct registered kinds in registration order.
     *
     * @return registered kinds
     */
    public ImmutableSet<AdapterKind<?>> kinds() {
        return ImmutableSet.copyOf(table.values());
    }

    /**
     * Returns the formats with at least one registered adapter.
     *
     * @return formats in registration order
     */
    public ImmutableSet<DataFormat> formats() {
        return table.keySet().stream().map(AdapterKey::getFormat)
                .collect(ImmutableSet.toImmutableSet());
    }

    /**
     * Returns a snapshot of the lookup table.
     *
     * @return immutable key-to-kind map
     */
    public ImmutableMap<AdapterKey, AdapterKind<?>> snapshot() {
        return table;
    }

    private static final class Holder {
        private static final AdapterRegistry INSTANCE = discover(classLoader());

        private static ClassLoader classLoader() {
            ClassLoader context = Thread.currentThread().getContextClassLoader();
            return context != null ? context : AdapterRegistry.class.getClassLoader();
        }
    }
}
