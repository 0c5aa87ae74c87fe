/**
 * Adapter contracts.
 *
 * <p>
 * Defines {@code DataReader} and {@code DataWriter}, the {@code AdapterKind} descriptor that the
 * registry keys adapters by, and abstract bases that check types, build the metadata envelope and
 * translate codec failures into {@code CodecException}.
 * </p>
 */
package io.github.yok.flexdataio.adapter;
