package io.github.flowdiff.git;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.errors.RevisionSyntaxException;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.treewalk.AbstractTreeIterator;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;
import org.eclipse.jgit.treewalk.FileTreeIterator;
import org.eclipse.jgit.treewalk.filter.PathFilter;
import org.jetbrains.annotations.Nullable;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The git repository containing a project directory, seen through JGit.
 * <p>
 * The project directory may be the repository's working tree root or any directory below it.
 * Paths handed out by this class are relative to the project directory, and changes outside it
 * are ignored.
 */
public final class GitRepo implements Closeable {
    private static final Logger logger = LogManager.getLogger(GitRepo.class);

    public static final String WORKING_TREE_DESCRIPTION = "Working directory (uncommitted changes)";

    private final Path projectRoot;
    private final Path workTree;
    private final Repository repository;
    private final String workingTreeRef;
    private final Set<String> excludedDirectories;
    private final boolean excludeHiddenDirectories;

    /**
     * Returns true if the directory is inside a git working tree.
     */
    public static boolean hasGitRepo(Path dir) {
        var builder = new FileRepositoryBuilder();
        builder.findGitDir(dir.toFile());
        return builder.getGitDir() != null;
    }

    public GitRepo(Path projectRoot, String workingTreeRef, Set<String> excludedDirectories) throws GitAPIException {
        this(projectRoot, workingTreeRef, excludedDirectories, true);
    }

    /**
     * @param excludeHiddenDirectories drop changes below directories whose name starts with a dot,
     *                                 matching project discovery
     */
    public GitRepo(Path projectRoot,
                   String workingTreeRef,
                   Set<String> excludedDirectories,
                   boolean excludeHiddenDirectories) throws GitAPIException {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
        this.workingTreeRef = workingTreeRef;
        this.excludedDirectories = Set.copyOf(excludedDirectories);
        this.excludeHiddenDirectories = excludeHiddenDirectories;

        var builder = new FileRepositoryBuilder();
        builder.findGitDir(this.projectRoot.toFile());
        if (builder.getGitDir() == null) {
            throw new NoRepositoryException(this.projectRoot);
        }
        try {
            repository = builder.build();
        } catch (IOException e) {
            throw new GitRepoException("Unable to open git repository for " + this.projectRoot, e);
        }
        if (repository.isBare()) {
            repository.close();
            throw new NoRepositoryException(this.projectRoot);
        }
        workTree = repository.getWorkTree().toPath().toAbsolutePath().normalize();
        logger.debug("Opened git repository {} for project {}", repository.getDirectory(), this.projectRoot);
    }

    public Repository getRepository() {
        return repository;
    }

    /**
     * The project directory relative to the working tree root, with forward slashes; empty when
     * the project is the whole repository.
     */
    public String getProjectPrefix() {
        return workTree.relativize(projectRoot).toString().replace('\\', '/');
    }

    public boolean isWorkingTreeRef(String ref) {
        return workingTreeRef.equals(ref);
    }

    /**
     * Resolves a reference to a commit SHA. The working-tree token resolves to empty.
     *
     * @throws InvalidReferenceException if the reference does not name a commit
     */
    public Optional<String> resolveRef(String ref) throws GitAPIException {
        if (isWorkingTreeRef(ref)) {
            return Optional.empty();
        }
        return Optional.of(resolveCommit(ref).name());
    }

    private ObjectId resolveCommit(String ref) throws GitAPIException {
        ObjectId id;
        try {
            id = repository.resolve(ref + "^{commit}");
        } catch (RevisionSyntaxException e) {
            throw new InvalidReferenceException(ref, e);
        } catch (IOException e) {
            throw new GitRepoException("Unable to resolve " + ref, e);
        }
        if (id == null) {
            throw new InvalidReferenceException(ref, null);
        }
        return id;
    }

    /**
     * Human-readable form of a reference, e.g. {@code "main (1a2b3c4) - Fix parser"}.
     */
    public String describeRef(String ref) throws GitAPIException {
        if (isWorkingTreeRef(ref)) {
            return WORKING_TREE_DESCRIPTION;
        }
        var id = resolveCommit(ref);
        try (var revWalk = new RevWalk(repository)) {
            RevCommit commit = revWalk.parseCommit(id);
            var firstLine = commit.getFullMessage().lines().findFirst().orElse("").strip();
            return "%s (%s) - %s".formatted(ref, id.abbreviate(7).name(), firstLine);
        } catch (IOException e) {
            throw new GitWrappedIOException(e);
        }
    }

    /**
     * Files that differ between two states, limited to the given extensions (e.g. {@code ".py"}).
     * A null SHA stands for the working tree. Ignored and excluded files never appear; renames are
     * detected. Two working trees, or the same commit twice, give no changes.
     */
    public List<FileChange> listFileChanges(@Nullable String beforeSha,
                                            @Nullable String afterSha,
                                            Set<String> extensions) throws GitAPIException {
        if (beforeSha == null && afterSha == null) {
            return List.of();
        }
        if (beforeSha != null && beforeSha.equals(afterSha)) {
            logger.debug("Both sides are commit {}; no file changes", beforeSha);
            return List.of();
        }

        try (var reader = repository.newObjectReader();
             var formatter = new DiffFormatter(new ByteArrayOutputStream())) {
            formatter.setRepository(repository);
            formatter.setDetectRenames(true);
            var prefix = getProjectPrefix();
            if (!prefix.isEmpty()) {
                formatter.setPathFilter(PathFilter.create(prefix));
            }

            var entries = formatter.scan(treeIterator(beforeSha, reader), treeIterator(afterSha, reader));
            var changes = new ArrayList<FileChange>();
            for (var entry : entries) {
                var change = toFileChange(entry, prefix);
                if (change != null && isRelevant(change, extensions)) {
                    changes.add(change);
                }
            }
            changes.sort(Comparator.comparing(FileChange::path));
            logger.debug("{} relevant file changes between {} and {}", changes.size(),
                         beforeSha == null ? workingTreeRef : beforeSha,
                         afterSha == null ? workingTreeRef : afterSha);
            return changes;
        } catch (IOException e) {
            throw new GitWrappedIOException(e);
        }
    }

    private AbstractTreeIterator treeIterator(@Nullable String sha, ObjectReader reader) throws IOException {
        if (sha == null) {
            return new FileTreeIterator(repository);
        }
        try (var revWalk = new RevWalk(reader)) {
            var commit = revWalk.parseCommit(ObjectId.fromString(sha));
            return new CanonicalTreeParser(null, reader, commit.getTree());
        }
    }

    private static @Nullable FileChange toFileChange(DiffEntry entry, String prefix) {
        var oldPath = stripPrefix(entry.getOldPath(), prefix);
        var newPath = stripPrefix(entry.getNewPath(), prefix);
        return switch (entry.getChangeType()) {
            case ADD, COPY -> newPath == null ? null : FileChange.added(newPath);
            case MODIFY -> newPath == null ? null : FileChange.modified(newPath);
            case DELETE -> oldPath == null ? null : FileChange.deleted(oldPath);
            case RENAME -> {
                if (oldPath == null && newPath == null) {
                    yield null;
                }
                if (oldPath == null) {
                    yield FileChange.added(newPath);
                }
                if (newPath == null) {
                    yield FileChange.deleted(oldPath);
                }
                yield FileChange.renamed(oldPath, newPath);
            }
        };
    }

    /** Project-relative path, or null for {@code /dev/null} and paths outside the project. */
    private static @Nullable String stripPrefix(String gitPath, String prefix) {
        if (DiffEntry.DEV_NULL.equals(gitPath)) {
            return null;
        }
        if (prefix.isEmpty()) {
            return gitPath;
        }
        return gitPath.startsWith(prefix + "/") ? gitPath.substring(prefix.length() + 1) : null;
    }

    private boolean isRelevant(FileChange change, Set<String> extensions) {
        return (change.oldPath() != null && isRelevantPath(change.oldPath(), extensions))
                || (change.newPath() != null && isRelevantPath(change.newPath(), extensions));
    }

    private boolean isRelevantPath(String path, Set<String> extensions) {
        if (extensions.stream().noneMatch(path::endsWith)) {
            return false;
        }
        var segments = path.split("/");
        for (int i = 0; i < segments.length - 1; i++) {
            var segment = segments[i];
            if (excludedDirectories.contains(segment)
                    || (excludeHiddenDirectories && segment.startsWith(".") && segment.length() > 1)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void close() {
        repository.close();
    }

    public static class GitRepoException extends GitAPIException {
        public GitRepoException(String message, @Nullable Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * The project directory is not inside a git working tree.
     */
    public static class NoRepositoryException extends GitRepoException {
        private final Path path;

        public NoRepositoryException(Path path) {
            super("No git repository found at or above " + path, null);
            this.path = path;
        }

        public Path getPath() {
            return path;
        }
    }

    /**
     * A reference string that does not resolve to a commit.
     */
    public static class InvalidReferenceException extends GitRepoException {
        private final String ref;

        public InvalidReferenceException(String ref, @Nullable Throwable cause) {
            super("Cannot resolve reference '" + ref + "' to a commit", cause);
            this.ref = ref;
        }

        public String getRef() {
            return ref;
        }
    }

    private static class GitWrappedIOException extends GitAPIException {
        public GitWrappedIOException(IOException e) {
            super(e.getMessage(), e);
        }
    }
}
