package io.github.flowdiff.diff;

import io.github.flowdiff.FlowDiffConfig;
import io.github.flowdiff.analyzer.AnalysisOrchestrator;
import io.github.flowdiff.git.FileChange;
import io.github.flowdiff.git.GitArchiveMaterializer;
import io.github.flowdiff.git.GitRepo;
import io.github.flowdiff.git.TreeMaterializer;
import io.github.flowdiff.testutil.TestProjects;
import io.github.flowdiff.tree.CallTreeNode;
import io.github.flowdiff.util.Environment;
import org.eclipse.jgit.api.Git;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class DiffAnalyzerTest {
    private static final FlowDiffConfig CONFIG = FlowDiffConfig.of(Map.of(FlowDiffConfig.PARALLEL_KEY, "false"));

    @TempDir
    Path projectRoot;

    private Git git;
    private String baseSha;

    @BeforeEach
    void setUp() throws Exception {
        git = TestProjects.initRepo(projectRoot);
        TestProjects.copyFixture("testcode-flow", projectRoot);
        baseSha = TestProjects.commitAll(git, "Initial import");
    }

    @AfterEach
    void tearDown() {
        git.close();
    }

    private DiffResult diff(String before, String after) throws Exception {
        return new DiffAnalyzer(projectRoot, CONFIG).analyzeDiff(before, after);
    }

    private void edit(String relPath, String from, String to) throws Exception {
        var file = projectRoot.resolve(relPath);
        var content = Files.readString(file);
        assertTrue(content.contains(from), relPath + " does not contain " + from);
        Files.writeString(file, content.replace(from, to));
    }

    private static @Nullable CallTreeNode find(List<CallTreeNode> nodes, String qualifiedName) {
        for (var node : nodes) {
            if (node.getSymbol().getQualifiedName().equals(qualifiedName)) {
                return node;
            }
            var found = find(node.getChildren(), qualifiedName);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    @Test
    void testSameCommitHasNoChanges() throws Exception {
        var result = diff("HEAD", baseSha);

        assertFalse(result.hasChanges());
        assertTrue(result.fileChanges().isEmpty());
        assertTrue(result.symbolChanges().isEmpty());
        assertEquals(0, result.added() + result.modified() + result.deleted());
        assertEquals(result.beforeTrees().size(), result.afterTrees().size());
        assertNotNull(find(result.afterTrees(), "scripts.analyze"));
    }

    @Test
    void testMovedCodeIsNotAChange() throws Exception {
        edit("services/analysis.py", "from services.store import Store",
             "# Analysis services.\n# Nothing here changes behaviour.\n\nfrom services.store import Store");
        var after = TestProjects.commitAll(git, "Add a header comment");

        var result = diff(baseSha, after);
        assertEquals(List.of(FileChange.modified("services/analysis.py")), result.fileChanges());
        assertTrue(result.symbolChanges().isEmpty(), () -> "unexpected changes " + result.symbolChanges().keySet());
        assertFalse(result.hasChanges());
    }

    @Test
    void testAddedModifiedDeleted() throws Exception {
        edit("services/analysis.py", "return self._score(data)", "return data");
        edit("api.py", "@app.get(\"/health\")\ndef health():\n    return {\"status\": \"ok\"}", "");
        edit("tools/report.py", "def render(args):", "def extra():\n    pass\n\n\ndef render(args):");
        var after = TestProjects.commitAll(git, "Rework the service");

        var result = diff(baseSha, after);
        assertTrue(result.hasChanges());
        assertEquals(3, result.fileChanges().size());

        var changes = result.symbolChanges();
        assertEquals(ChangeKind.MODIFIED, changes.get("services.analysis.AnalysisService.run_analysis").kind());
        assertTrue(changes.get("services.analysis.AnalysisService.run_analysis").differences()
                           .contains(SymbolChange.RESOLVED_CALLS));
        assertEquals(ChangeKind.DELETED, changes.get("api.health").kind());
        assertEquals(ChangeKind.ADDED, changes.get("tools.report.extra").kind());
        assertEquals(1, result.added());
        assertEquals(1, result.modified());
        assertEquals(1, result.deleted());

        var changedNode = find(result.afterTrees(), "services.analysis.AnalysisService.run_analysis");
        assertNotNull(changedNode);
        assertTrue(changedNode.getSymbol().isHasChanges());
        assertFalse(find(result.afterTrees(), "api.analyze").getSymbol().isHasChanges());

        var deletedRoot = find(result.beforeTrees(), "api.health");
        assertNotNull(deletedRoot);
        assertTrue(deletedRoot.getSymbol().isHasChanges());
        assertNull(find(result.afterTrees(), "api.health"));
    }

    @Test
    void testWorkingTreeSide() throws Exception {
        edit("tools/report.py", "    render(args)\n", "    render(args)\n    render(args)\n    finish()\n");
        edit("tools/report.py", "def render(args):", "def finish():\n    pass\n\n\ndef render(args):");

        var result = diff("HEAD", "working");
        assertEquals(GitRepo.WORKING_TREE_DESCRIPTION, result.afterDescription());
        assertTrue(result.beforeDescription().endsWith(" - Initial import"), result.beforeDescription());
        assertEquals(List.of(FileChange.modified("tools/report.py")), result.fileChanges());
        assertEquals(ChangeKind.MODIFIED, result.symbolChanges().get("tools.report.main").kind());
        assertEquals(ChangeKind.ADDED, result.symbolChanges().get("tools.report.finish").kind());

        // the working tree is analysed in place and left untouched
        assertTrue(Files.readString(projectRoot.resolve("tools/report.py")).contains("def finish():"));
    }

    @Test
    void testInvalidReference() {
        var e = assertThrows(GitRepo.InvalidReferenceException.class, () -> diff("HEAD", "does-not-exist"));
        assertEquals("does-not-exist", e.getRef());
    }

    @Test
    void testMaterializationFailureNamesTheReference() {
        TreeMaterializer failing = (repo, sha, targetDir) -> {
            throw new TreeMaterializer.MaterializationException("disk full", sha, null);
        };
        var analyzer = new DiffAnalyzer(projectRoot, CONFIG, AnalysisOrchestrator.defaultRegistry(), failing, null);

        var e = assertThrows(TreeMaterializer.MaterializationException.class,
                             () -> analyzer.analyzeDiff("HEAD", "working"));
        assertEquals("HEAD", e.getRef());
        assertEquals(baseSha, e.getSha());
        assertTrue(e.getMessage().contains("HEAD (" + baseSha + ")"), e.getMessage());
        assertTrue(e.getMessage().contains("disk full"), e.getMessage());
    }

    @Test
    void testNotARepository(@TempDir Path plain) throws Exception {
        TestProjects.copyFixture("testcode-flow", plain);
        assertThrows(GitRepo.NoRepositoryException.class,
                     () -> new DiffAnalyzer(plain, CONFIG).analyzeDiff("HEAD", "working"));
    }

    @Test
    void testArchiveMaterializerGivesSameResult() throws Exception {
        assumeTrue(Environment.isAvailable("git") && Environment.isAvailable("tar"), "git and tar are required");
        edit("services/analysis.py", "return self._score(data)", "return data");
        var after = TestProjects.commitAll(git, "Drop scoring");

        var analyzer = new DiffAnalyzer(projectRoot, CONFIG, AnalysisOrchestrator.defaultRegistry(),
                                        new GitArchiveMaterializer(30), null);
        var result = analyzer.analyzeDiff(baseSha, after);
        assertEquals(List.of("services.analysis.AnalysisService.run_analysis"),
                     List.copyOf(result.symbolChanges().keySet()));
    }
}
