package io.github.yok.flexdataio.format.json;

import io.github.yok.flexdataio.config.OptionSpec;

/**
 * Options shared by the JSON reader and writer.
 *
 * @author Yasuharu.Okawauchi
 */
final class JsonOptions {

    // Document layout
    static final OptionSpec<JsonOrient> ORIENT =
            OptionSpec.optional("orient", JsonOrient.class, JsonOrient.RECORDS);

    private JsonOptions() {
        // Constants only.
    }
}
