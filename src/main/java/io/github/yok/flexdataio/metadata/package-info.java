/**
 * Result metadata envelope.
 *
 * <p>
 * Every load and save returns a {@code ResultMetadata} holding exactly one transport section
 * ({@code file_metadata} or {@code sql_metadata}) and a {@code dataframe_metadata} section
 * describing the shape of the data.
 * </p>
 */
package io.github.yok.flexdataio.metadata;
