package io.github.yok.flexdataio.adapter;

import io.github.yok.flexdataio.config.AdapterOptions;
import io.github.yok.flexdataio.format.DataFormat;

/**
 * Common contract of reader and writer adapters.
 *
 * <p>
 * An adapter is bound to one {@link DataFormat} and is constructed with all of its configuration;
 * instances are immutable and intended to be used for a single load or save.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DataAdapter {

    /**
     * Returns the class-level descriptor of this adapter.
     *
     * @return adapter kind
     */
    AdapterKind<?> kind();

    /**
     * Returns the bound configuration, including bookkeeping fields.
     *
     * @return bound options
     */
    AdapterOptions options();

    /**
     * Returns the format this adapter handles.
     *
     * @return format
     */
    default DataFormat format() {
        return kind().getFormat();
    }
}
