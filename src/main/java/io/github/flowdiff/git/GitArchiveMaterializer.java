package io.github.flowdiff.git;

import io.github.flowdiff.util.Environment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Materializes with the command-line tools: {@code git archive} into a tarball, then {@code tar -x}.
 * Both run with a bounded wait.
 */
public final class GitArchiveMaterializer implements TreeMaterializer {
    private static final Logger logger = LogManager.getLogger(GitArchiveMaterializer.class);

    private final int timeoutSeconds;

    public GitArchiveMaterializer(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public void materialize(GitRepo repo, String sha, Path targetDir) throws MaterializationException {
        var workTree = repo.getRepository().getWorkTree().toPath();
        Path archive;
        try {
            archive = Files.createTempFile("flowdiff-", ".tar");
        } catch (IOException e) {
            throw new MaterializationException("Unable to create archive file for " + sha, sha, e);
        }

        try {
            run(List.of("git", "archive", "--format=tar", "-o", archive.toString(), sha), workTree, sha);
            run(List.of("tar", "-xf", archive.toString(), "-C", targetDir.toString()), workTree, sha);
            logger.debug("Extracted {} into {}", sha, targetDir);
        } finally {
            try {
                Files.deleteIfExists(archive);
            } catch (IOException e) {
                logger.warn("Unable to delete temporary archive {}: {}", archive, e.getMessage());
            }
        }
    }

    private void run(List<String> command, Path workingDir, String sha) throws MaterializationException {
        try {
            Environment.runCommand(command, workingDir, timeoutSeconds);
        } catch (Environment.SubprocessException e) {
            var output = e.getOutput().isBlank() ? "" : "\n" + e.getOutput();
            throw new MaterializationException("Materializing %s failed: %s%s".formatted(sha, e.getMessage(), output), sha, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MaterializationException("Interrupted while materializing " + sha, sha, e);
        }
    }
}
