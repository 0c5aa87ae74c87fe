package io.github.yok.flexdataio.adapter;

import lombok.Getter;

/**
 * Direction of an adapter: a reader produces data, a writer consumes it.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum Direction {

    // Produces in-memory data from a source (load).
    READER("load"),

    // Consumes in-memory data and writes it to a target (save).
    WRITER("save");

    // Name of the operation an adapter of this direction performs.
    private final String operation;

    Direction(String operation) {
        this.operation = operation;
    }
}
