package io.github.flowdiff.git;

import io.github.flowdiff.testutil.TestProjects;
import io.github.flowdiff.util.Environment;
import org.eclipse.jgit.api.Git;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class TreeMaterializerTest {
    @TempDir
    Path repoDir;

    @TempDir
    Path target;

    private Git git;
    private GitRepo repo;
    private String firstSha;

    @BeforeEach
    void setUp() throws Exception {
        git = TestProjects.initRepo(repoDir);
        TestProjects.write(repoDir, "app.py", "def first():\n    pass\n");
        TestProjects.write(repoDir, "pkg/util.py", "def helper():\n    pass\n");
        firstSha = TestProjects.commitAll(git, "first");

        TestProjects.write(repoDir, "app.py", "def second():\n    pass\n");
        TestProjects.write(repoDir, "later.sh", "echo later\n");
        TestProjects.commitAll(git, "second");

        // uncommitted edits must not leak into a materialized commit
        TestProjects.write(repoDir, "app.py", "def dirty():\n    pass\n");

        repo = new GitRepo(repoDir, "working", Set.of());
    }

    @AfterEach
    void tearDown() {
        repo.close();
        git.close();
    }

    private void assertFirstCommit(Path dir) throws Exception {
        assertEquals("def first():\n    pass\n", Files.readString(dir.resolve("app.py")));
        assertEquals("def helper():\n    pass\n", Files.readString(dir.resolve("pkg/util.py")));
        assertFalse(Files.exists(dir.resolve("later.sh")));
        assertFalse(Files.exists(dir.resolve(".git")));
    }

    @Test
    void testJGitMaterializer() throws Exception {
        new JGitTreeMaterializer().materialize(repo, firstSha, target);
        assertFirstCommit(target);
    }

    @Test
    void testJGitMaterializerRejectsUnknownCommit() {
        var missing = "0123456789abcdef0123456789abcdef01234567";
        var e = assertThrows(TreeMaterializer.MaterializationException.class,
                             () -> new JGitTreeMaterializer().materialize(repo, missing, target));
        assertEquals(missing, e.getSha());
    }

    @Test
    void testArchiveMaterializer() throws Exception {
        assumeTrue(Environment.isAvailable("git") && Environment.isAvailable("tar"), "git and tar are required");

        new GitArchiveMaterializer(30).materialize(repo, firstSha, target);
        assertFirstCommit(target);
    }
}
