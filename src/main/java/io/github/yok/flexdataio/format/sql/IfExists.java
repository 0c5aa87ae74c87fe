package io.github.yok.flexdataio.format.sql;

/**
 * Behavior of the SQL writer when the target table already exists.
 *
 * <ul>
 * <li>FAIL: abort without touching the table</li>
 * <li>REPLACE: drop the table, recreate it from the data and insert</li>
 * <li>APPEND: insert into the existing table</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum IfExists {
    // Abort the save
    FAIL,
    // Drop and recreate
    REPLACE,
    // Insert into the existing table
    APPEND
}
