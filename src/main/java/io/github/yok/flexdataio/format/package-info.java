/**
 * Format identifiers and the file-based adapter bases.
 *
 * <p>
 * Each subpackage implements one format: a codec doing the actual encoding and decoding, a reader,
 * a writer and an {@code AdapterProvider} registered through {@code ServiceLoader}.
 * </p>
 */
package io.github.yok.flexdataio.format;
