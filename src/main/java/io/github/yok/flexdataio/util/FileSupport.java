package io.github.yok.flexdataio.util;

import java.io.IOException;
import java.nio.file.Path;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;

/**
 * File helpers shared by the file-backed adapters.
 *
 * @author Yasuharu.Okawauchi
 */
public final class FileSupport {

    private FileSupport() {
        // Utility class; do not instantiate.
    }

    /**
     * Creates the parent directories of a file if they do not exist.
     *
     * @param file target file
     * @throws IOException if a directory cannot be created
     */
    public static void createParentDirectories(Path file) throws IOException {
        FileUtils.forceMkdirParent(file.toAbsolutePath().toFile());
    }

    /**
     * Returns the file name without directory and extension, used as the table name of a file that
     * holds a single table.
     *
     * @param file file path
     * @return base name
     */
    public static String baseName(Path file) {
        return FilenameUtils.getBaseName(file.getFileName().toString());
    }
}
