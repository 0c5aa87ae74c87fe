package io.github.yok.flexdataio.core;

import io.github.yok.flexdataio.adapter.AdapterKind;
import io.github.yok.flexdataio.adapter.DataReader;
import io.github.yok.flexdataio.adapter.DataWriter;
import io.github.yok.flexdataio.adapter.LoadResult;
import io.github.yok.flexdataio.config.DataIoProperties;
import io.github.yok.flexdataio.db.DbUnitConfigFactory;
import io.github.yok.flexdataio.exception.DataIoException;
import io.github.yok.flexdataio.exception.NoAdapterFoundException;
import io.github.yok.flexdataio.format.DataFormat;
import io.github.yok.flexdataio.format.FileOptions;
import io.github.yok.flexdataio.metadata.ResultMetadata;
import io.github.yok.flexdataio.registry.AdapterRegistry;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for loading and saving data in any registered format.
 *
 * <p>
 * A call resolves the adapter kind for the format and type in the {@link AdapterRegistry}, merges
 * option layers, constructs the adapter and runs it once. Option layers, later ones winning:
 * </p>
 * <ol>
 * <li>defaults declared by the adapter</li>
 * <li>application defaults from {@link DataIoProperties} ({@code flexdataio.readers.<format>.*},
 * {@code flexdataio.writers.<format>.*})</li>
 * <li>the options passed to the call</li>
 * </ol>
 * <p>
 * SQL adapters receive the shared {@link DbUnitConfigFactory} unless the call supplies its own
 * {@code configFactory}.
 * </p>
 *
 * <p>
 * Every failure is a {@link DataIoException}; it is logged once at ERROR level here and rethrown
 * unchanged.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DataIo {

    // Option of SQL adapters carrying the DBUnit settings
    private static final String CONFIG_FACTORY_OPTION = "configFactory";

    @Getter
    private final AdapterRegistry registry;

    private final DataIoProperties properties;

    private final DbUnitConfigFactory dbUnitConfigFactory;

    /**
     * Creates an orchestrator over the default registry without application defaults.
     */
    public DataIo() {
        this(AdapterRegistry.defaultRegistry(), new DataIoProperties(), new DbUnitConfigFactory());
    }

    /**
     * Creates an orchestrator.
     *
     * @param registry adapter registry
     * @param properties application-level option defaults
     * @param dbUnitConfigFactory DBUnit settings handed to SQL adapters
     */
    public DataIo(AdapterRegistry registry, DataIoProperties properties,
            DbUnitConfigFactory dbUnitConfigFactory) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.dbUnitConfigFactory = Objects.requireNonNull(dbUnitConfigFactory,
                "dbUnitConfigFactory");
    }

    /**
     * Loads data with an already constructed reader.
     *
     * @param reader reader
     * @param type requested in-memory type
     * @param <T> requested type
     * @return the data and its metadata
     * @throws DataIoException if the load fails
     */
    public <T> LoadResult<T> load(DataReader reader, Class<T> type) {
        return logged("load", reader.format(), type, () -> reader.load(type));
    }

    /**
     * Saves data with an already constructed writer.
     *
     * @param writer writer
     * @param data data of one of the writer's applicable types
     * @return metadata of the save
     * @throws DataIoException if the save fails
     */
    public ResultMetadata save(DataWriter writer, Object data) {
        return logged("save", writer.format(), data == null ? null : data.getClass(),
                () -> writer.save(data));
    }

    /**
     * Loads data in a format identified by id.
     *
     * @param formatId format id such as {@code csv}
     * @param type requested in-memory type
     * @param options reader options
     * @param <T> requested type
     * @return the data and its metadata
     * @throws DataIoException if the format is unknown, the options are invalid or the load fails
     */
    public <T> LoadResult<T> load(String formatId, Class<T> type, Map<String, ?> options) {
        return logged("load", formatId, type,
                () -> createReader(format(formatId), type, options).load(type));
    }

    /**
     * Saves data in a format identified by id.
     *
     * @param formatId format id such as {@code csv}
     * @param dataType in-memory type the writer is resolved for
     * @param data data to save
     * @param options writer options
     * @return metadata of the save
     * @throws DataIoException if the format is unknown, the options are invalid or the save fails
     */
    public ResultMetadata save(String formatId, Class<?> dataType, Object data,
            Map<String, ?> options) {
        return logged("save", formatId, dataType,
                () -> createWriter(format(formatId), dataType, options).save(data));
    }

    /**
     * Loads a file whose format is inferred from its extension.
     *
     * @param path source file
     * @param type requested in-memory type
     * @param options reader options other than {@code path}
     * @param <T> requested type
     * @return the data and its metadata
     * @throws DataIoException if the extension is unknown, the options are invalid or the load
     *         fails
     */
    public <T> LoadResult<T> load(Path path, Class<T> type, Map<String, ?> options) {
        return logged("load", String.valueOf(path), type,
                () -> createReader(format(path), type, withPath(path, options)).load(type));
    }

    /**
     * Saves to a file whose format is inferred from its extension.
     *
     * @param path target file
     * @param dataType in-memory type the writer is resolved for
     * @param data data to save
     * @param options writer options other than {@code path}
     * @return metadata of the save
     * @throws DataIoException if the extension is unknown, the options are invalid or the save
     *         fails
     */
    public ResultMetadata save(Path path, Class<?> dataType, Object data,
            Map<String, ?> options) {
        return logged("save", String.valueOf(path), dataType,
                () -> createWriter(format(path), dataType, withPath(path, options)).save(data));
    }

    /**
     * Builds a reader without running it.
     *
     * @param formatId format id
     * @param type requested in-memory type
     * @param options reader options
     * @return the reader
     * @throws DataIoException if the format is unknown or the options are invalid
     */
    public DataReader newReader(String formatId, Class<?> type, Map<String, ?> options) {
        return logged("create reader", formatId, type,
                () -> createReader(format(formatId), type, options));
    }

    /**
     * Builds a writer without running it.
     *
     * @param formatId format id
     * @param dataType in-memory type
     * @param options writer options
     * @return the writer
     * @throws DataIoException if the format is unknown or the options are invalid
     */
    public DataWriter newWriter(String formatId, Class<?> dataType, Map<String, ?> options) {
        return logged("create writer", formatId, dataType,
                () -> createWriter(format(formatId), dataType, options));
    }

    /**
     * Merges the option layers for one adapter kind.
     *
     * @param kind adapter kind
     * @param options per-call options
     * @return merged raw options
     */
    Map<String, Object> mergeOptions(AdapterKind<?> kind, Map<String, ?> options) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (kind.getSchema().names().contains(CONFIG_FACTORY_OPTION)) {
            merged.put(CONFIG_FACTORY_OPTION, dbUnitConfigFactory);
        }
        merged.putAll(properties.defaultsFor(kind.getFormat(), kind.getDirection()));
        if (options != null) {
            merged.putAll(options);
        }
        return merged;
    }

    private DataReader createReader(DataFormat format, Class<?> type, Map<String, ?> options) {
        AdapterKind<? extends DataReader> kind = registry.resolveReader(format, type);
        return kind.create(mergeOptions(kind, options));
    }

    private DataWriter createWriter(DataFormat format, Class<?> type, Map<String, ?> options) {
        AdapterKind<? extends DataWriter> kind = registry.resolveWriter(format, type);
        return kind.create(mergeOptions(kind, options));
    }

    private static DataFormat format(String formatId) {
        return DataFormat.fromId(formatId).orElseThrow(
                () -> new NoAdapterFoundException("Unknown format '" + formatId + "'"));
    }

    private static DataFormat format(Path path) {
        return DataFormat.fromPath(path).orElseThrow(() -> new NoAdapterFoundException(
                "No format is registered for the extension of " + path));
    }

    private static Map<String, Object> withPath(Path path, Map<String, ?> options) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (options != null) {
            merged.putAll(options);
        }
        merged.put(FileOptions.PATH.getName(), path);
        return merged;
    }

    private static <R> R logged(String operation, Object target, Class<?> type,
            Supplier<R> call) {
        try {
            return call.get();
        } catch (DataIoException e) {
            log.error("Failed to {} {} as {}: {}", operation, target,
                    type == null ? "null" : type.getSimpleName(), e.getMessage(), e);
            throw e;
        }
    }
}
