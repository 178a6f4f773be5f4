package io.github.flowdiff.git;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A changed file, with paths relative to the project root using forward slashes. {@code oldPath}
 * is null for additions and {@code newPath} is null for deletions.
 */
public record FileChange(ChangeType type, @Nullable String oldPath, @Nullable String newPath) {
    public FileChange {
        Objects.requireNonNull(type, "type must not be null");
        if (oldPath == null && newPath == null) {
            throw new IllegalArgumentException("A file change needs at least one path");
        }
    }

    public static FileChange added(String path) {
        return new FileChange(ChangeType.ADDED, null, path);
    }

    public static FileChange modified(String path) {
        return new FileChange(ChangeType.MODIFIED, path, path);
    }

    public static FileChange deleted(String path) {
        return new FileChange(ChangeType.DELETED, path, null);
    }

    public static FileChange renamed(String oldPath, String newPath) {
        return new FileChange(ChangeType.RENAMED, oldPath, newPath);
    }

    /** The path on the after side when there is one. */
    public String path() {
        return newPath != null ? newPath : Objects.requireNonNull(oldPath);
    }
}
