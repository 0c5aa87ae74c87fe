/**
 * Option and configuration model.
 *
 * <p>
 * Holds the typed option declarations ({@code OptionSpec}, {@code OptionSchema}) that adapters
 * validate their inputs against, and the {@code @ConfigurationProperties} classes bound from
 * {@code application.yml} ({@code flexdataio.*}, {@code dbunit.*}).
 * </p>
 */
package io.github.yok.flexdataio.config;
