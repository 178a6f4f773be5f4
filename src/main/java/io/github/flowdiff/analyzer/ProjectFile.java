package io.github.flowdiff.analyzer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A source file identified by the analysis root plus a path relative to it.  Symbols carry the
 * relative part forward so that two trees of the same project, extracted to different directories,
 * report the same locations.
 */
public class ProjectFile implements Comparable<ProjectFile> {
    private final Path root;
    private final Path relPath;

    /**
     * root must be absolute and normalized; relPath is normalized here
     */
    public ProjectFile(Path root, Path relPath) {
        if (!root.isAbsolute()) {
            throw new IllegalArgumentException("Root must be absolute, got " + root);
        }
        if (!root.equals(root.normalize())) {
            throw new IllegalArgumentException("Root must be normalized, got " + root);
        }
        if (relPath.isAbsolute()) {
            throw new IllegalArgumentException("RelPath must be relative, got " + relPath);
        }

        this.root = root;
        this.relPath = relPath.normalize();
    }

    public ProjectFile(Path root, String relName) {
        this(root, Path.of(relName));
    }

    public Path getRoot() {
        return root;
    }

    public Path getRelPath() {
        return relPath;
    }

    public Path absPath() {
        return root.resolve(relPath);
    }

    public String read() throws IOException {
        return Files.readString(absPath(), StandardCharsets.UTF_8);
    }

    public String getFileName() {
        return relPath.getFileName().toString();
    }

    /**
     * The relative path with forward slashes regardless of platform.
     */
    public String getRelPathString() {
        return relPath.toString().replace('\\', '/');
    }

    @Override
    public int compareTo(ProjectFile other) {
        return getRelPathString().compareTo(other.getRelPathString());
    }

    @Override
    public String toString() {
        return getRelPathString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectFile projectFile)) return false;
        return Objects.equals(root, projectFile.root) &&
               Objects.equals(relPath, projectFile.relPath);
    }

    @Override
    public int hashCode() {
        return relPath.hashCode();
    }
}
