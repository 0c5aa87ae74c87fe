/**
 * Adapter registry keyed by format, direction and in-memory type.
 */
package io.github.yok.flexdataio.registry;
