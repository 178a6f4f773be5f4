package io.github.flowdiff.analyzer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * A directory tree to analyze, with the directories that discovery must never enter.
 */
public final class Project {
    private static final Logger logger = LogManager.getLogger(Project.class);

    private final Path root;
    private final Set<String> excludedDirectories;
    private final boolean excludeHidden;

    public Project(Path root, Set<String> excludedDirectories, boolean excludeHidden) {
        this.root = root.toAbsolutePath().normalize();
        this.excludedDirectories = Set.copyOf(excludedDirectories);
        this.excludeHidden = excludeHidden;
    }

    public Path getRoot() {
        return root;
    }

    private boolean isExcludedDirectoryName(String name) {
        return excludedDirectories.contains(name) || (excludeHidden && name.startsWith(".") && name.length() > 1);
    }

    /**
     * All regular files below the root outside excluded directories, sorted by relative path.
     * Unreadable directories are logged and skipped.
     */
    public List<ProjectFile> getAllFiles() {
        var files = new ArrayList<ProjectFile>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && isExcludedDirectoryName(dir.getFileName().toString())) {
                        logger.trace("Skipping excluded directory {}", dir);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        files.add(new ProjectFile(root, root.relativize(file)));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    logger.warn("Unable to read {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            logger.warn("File discovery under {} failed: {}", root, e.getMessage());
            return List.of();
        }
        Collections.sort(files);
        return files;
    }
}
