package io.github.yok.flexdataio.format;

/**
 * Transport a format travels over. Decides which partition of the result metadata is filled.
 *
 * <ul>
 * <li>FILE: data lives in a file addressed by a path</li>
 * <li>DATABASE: data lives in a relational table reached through a JDBC connection</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum TransportKind {
    // File-system backed formats
    FILE,
    // Database backed formats
    DATABASE
}
