package io.github.yok.flexdataio.format.csv;

import io.github.yok.flexdataio.config.OptionSpec;

/**
 * Options shared by the CSV reader and writer.
 *
 * @author Yasuharu.Okawauchi
 */
final class CsvOptions {

    // Field separator
    static final OptionSpec<Character> DELIMITER = OptionSpec
            .optional("delimiter", Character.class, ',')
            .validatedBy(c -> c != '\n' && c != '\r', "must not be a line break");

    // Quote character; null disables quoting
    static final OptionSpec<Character> QUOTE = OptionSpec.optional("quote", Character.class, '"');

    // Escape character; null disables escaping
    static final OptionSpec<Character> ESCAPE =
            OptionSpec.optional("escape", Character.class, null);

    // Whether the first record holds the column names
    static final OptionSpec<Boolean> HEADER = OptionSpec.optional("header", Boolean.class, true);

    // Text read as / written for null values
    static final OptionSpec<String> NULL_STRING =
            OptionSpec.optional("nullString", String.class, null);

    private CsvOptions() {
        // Constants only.
    }
}
