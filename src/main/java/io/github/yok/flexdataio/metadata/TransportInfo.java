package io.github.yok.flexdataio.metadata;

/**
 * Raw transport-level signals collected by an adapter after its codec call. Either
 * {@link FileTransport} or {@link SqlTransport}.
 *
 * @author Yasuharu.Okawauchi
 */
public abstract class TransportInfo {

    TransportInfo() {
        // Subclassed only within this package.
    }
}
