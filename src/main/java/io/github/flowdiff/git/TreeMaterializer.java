package io.github.flowdiff.git;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;

/**
 * Writes the full file tree of a commit into a directory, so it can be analyzed like a checkout.
 */
public interface TreeMaterializer {

    /**
     * Writes every file of commit {@code sha} below {@code targetDir}, which must exist and be empty.
     */
    void materialize(GitRepo repo, String sha, Path targetDir) throws MaterializationException;

    /**
     * Extracting a commit failed. The message names the commit and, for external tools, the command.
     * When the commit was requested through a reference, that reference is kept as well.
     */
    class MaterializationException extends GitRepo.GitRepoException {
        private final @Nullable String ref;
        private final String sha;

        public MaterializationException(String message, String sha, @Nullable Throwable cause) {
            this(message, null, sha, cause);
        }

        public MaterializationException(String message, @Nullable String ref, String sha, @Nullable Throwable cause) {
            super(message, cause);
            this.ref = ref;
            this.sha = sha;
        }

        /** The reference as the caller wrote it, e.g. {@code HEAD~1}; null when only a SHA was known. */
        public @Nullable String getRef() {
            return ref;
        }

        public String getSha() {
            return sha;
        }
    }
}
