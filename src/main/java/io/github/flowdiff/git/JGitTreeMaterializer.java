package io.github.flowdiff.git;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.lib.FileMode;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.TreeWalk;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Copies blobs straight out of the object database. Symbolic links and submodules are skipped.
 */
public final class JGitTreeMaterializer implements TreeMaterializer {
    private static final Logger logger = LogManager.getLogger(JGitTreeMaterializer.class);

    @Override
    public void materialize(GitRepo repo, String sha, Path targetDir) throws MaterializationException {
        var repository = repo.getRepository();
        var root = targetDir.toAbsolutePath().normalize();
        int written = 0;
        try (var revWalk = new RevWalk(repository);
             var treeWalk = new TreeWalk(repository)) {
            var commit = revWalk.parseCommit(ObjectId.fromString(sha));
            treeWalk.addTree(commit.getTree());
            treeWalk.setRecursive(true);
            while (treeWalk.next()) {
                var mode = treeWalk.getFileMode(0);
                if (mode != FileMode.REGULAR_FILE && mode != FileMode.EXECUTABLE_FILE) {
                    logger.trace("Skipping {} ({})", treeWalk.getPathString(), mode);
                    continue;
                }
                var target = root.resolve(treeWalk.getPathString()).normalize();
                if (!target.startsWith(root)) {
                    throw new MaterializationException("Refusing to write %s outside %s".formatted(treeWalk.getPathString(), root), sha, null);
                }
                Files.createDirectories(target.getParent());
                try (var out = Files.newOutputStream(target)) {
                    repository.open(treeWalk.getObjectId(0)).copyTo(out);
                }
                written++;
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new MaterializationException("Unable to materialize commit %s into %s: %s".formatted(sha, targetDir, e.getMessage()), sha, e);
        }
        logger.debug("Materialized {} files of {} into {}", written, sha, targetDir);
    }
}
