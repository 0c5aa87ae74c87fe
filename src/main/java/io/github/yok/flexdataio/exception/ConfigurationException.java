package io.github.yok.flexdataio.exception;

import io.github.yok.flexdataio.format.DataFormat;

/**
 * Thrown when an adapter is constructed with missing, unknown or semantically invalid options.
 * Raised eagerly at construction time, before any I/O.
 *
 * @author Yasuharu.Okawauchi
 */
public class ConfigurationException extends DataIoException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception.
     *
     * @param format format of the adapter being configured
     * @param message detail message
     */
    public ConfigurationException(DataFormat format, String message) {
        super(format, null, message, null);
    }

    /**
     * Creates an exception with a cause.
     *
     * @param format format of the adapter being configured
     * @param message detail message
     * @param cause root cause
     */
    public ConfigurationException(DataFormat format, String message, Throwable cause) {
        super(format, null, message, cause);
    }
}
