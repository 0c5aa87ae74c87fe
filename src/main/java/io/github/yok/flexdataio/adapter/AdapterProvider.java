package io.github.yok.flexdataio.adapter;

import java.util.List;

/**
 * Service-provider interface through which adapter kinds are discovered.
 *
 * <p>
 * Implementations are listed in
 * {@code META-INF/services/io.github.yok.flexdataio.adapter.AdapterProvider} and loaded with
 * {@link java.util.ServiceLoader}; each normally contributes the reader and writer of one format.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface AdapterProvider {

    /**
     * Returns the adapter kinds contributed by this provider.
     *
     * @return adapter kinds
     */
    List<AdapterKind<?>> kinds();
}
