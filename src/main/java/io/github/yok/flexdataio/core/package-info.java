/**
 * Load/save orchestration.
 *
 * <p>
 * {@code DataIo} resolves adapters by format and type, layers application defaults under per-call
 * options and logs failures once.
 * </p>
 */
package io.github.yok.flexdataio.core;
