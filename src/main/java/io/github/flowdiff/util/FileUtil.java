package io.github.flowdiff.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

public final class FileUtil {
    private FileUtil() {
    }

    /**
     * Deletes a file or directory tree. Missing paths are ignored.
     */
    public static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            // children sort after their parents, so reverse order deletes files first
            List<Path> pathsToDelete = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path p : pathsToDelete) {
                Files.delete(p);
            }
        }
    }
}
