/**
 * DBUnit connection settings shared by the SQL adapters.
 */
package io.github.yok.flexdataio.db;
