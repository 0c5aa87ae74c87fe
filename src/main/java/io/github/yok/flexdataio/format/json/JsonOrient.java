package io.github.yok.flexdataio.format.json;

/**
 * Layout of a table in a JSON document.
 *
 * <ul>
 * <li>RECORDS: {@code [{"a": 1, "b": "x"}, ...]}</li>
 * <li>COLUMNS: {@code {"a": [1, ...], "b": ["x", ...]}}; per-column objects keyed by row index
 * are also accepted when reading</li>
 * <li>SPLIT: {@code {"columns": ["a", "b"], "data": [[1, "x"], ...]}}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum JsonOrient {
    // Array of row objects
    RECORDS,
    // Object of column arrays
    COLUMNS,
    // Column list plus row arrays
    SPLIT
}
