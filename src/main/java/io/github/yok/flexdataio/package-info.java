/**
 * Root package of FlexDataIO.
 *
 * <p>
 * FlexDataIO moves tabular data between DBUnit {@code ITable}/{@code IDataSet} values and external
 * formats (CSV, JSON, YAML, flat XML, HTML, Parquet, Avro and SQL databases) through pluggable
 * reader and writer adapters.
 * </p>
 *
 * <p>
 * Start with {@code core.DataIo}, or construct an adapter directly through its {@code of(Map)}
 * factory.
 * </p>
 */
package io.github.yok.flexdataio;
