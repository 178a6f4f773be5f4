package io.github.flowdiff;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.flowdiff.analyzer.AnalysisOrchestrator;
import io.github.flowdiff.analyzer.Symbol;
import io.github.flowdiff.testutil.TestProjects;
import io.github.flowdiff.util.Json;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FlowDiffTest {
    private final FlowDiff flowDiff = new FlowDiff(AnalysisOrchestrator.defaultRegistry(), null,
                                                   FlowDiffConfig.of(Map.of(FlowDiffConfig.PARALLEL_KEY, "false")));

    @Test
    void testAnalyzeAndBuildTrees() {
        var tables = flowDiff.analyze(TestProjects.fixture("testcode-flow"));
        var entryPoints = flowDiff.getEntryPoints(tables);
        var universe = flowDiff.flatten(tables);
        var trees = flowDiff.buildCallTrees(entryPoints, universe);

        assertEquals(entryPoints.size(), trees.size());
        var scriptTree = trees.stream()
                .filter(t -> t.getSymbol().getQualifiedName().equals("scripts.analyze"))
                .findFirst()
                .orElseThrow();
        assertEquals(2, scriptTree.getChildren().size());
        var handler = scriptTree.getChildren().get(0);
        assertEquals("api.analyze", handler.getSymbol().getQualifiedName());
        assertEquals(2, handler.getChildren().size());
        assertTrue(handler.isExpanded());
    }

    @Test
    void testTreeDepthComesFromProjectConfiguration(@TempDir Path root) throws Exception {
        TestProjects.write(root, FlowDiffConfig.PROJECT_CONFIG_FILE, FlowDiffConfig.DEFAULT_EXPANSION_DEPTH_KEY + "=2\n");
        TestProjects.write(root, "chain.py", """
                def a():
                    b()


                def b():
                    c()


                def c():
                    d()


                def d():
                    pass


                if __name__ == "__main__":
                    a()
                """);

        var configured = new FlowDiff();
        var tables = configured.analyze(root);
        var trees = configured.buildCallTrees(configured.getEntryPoints(tables), configured.flatten(tables));
        var node = trees.stream()
                .filter(t -> t.getSymbol().getQualifiedName().equals("chain.a"))
                .findFirst()
                .orElseThrow();

        for (int depth = 0; depth < 4; depth++) {
            assertEquals(depth, node.getDepth());
            assertEquals(depth < 2, node.isExpanded(), "depth " + depth);
            if (depth < 3) {
                node = node.getChildren().get(0);
            }
        }
    }

    @Test
    void testJsonShape() throws Exception {
        var tables = flowDiff.analyze(TestProjects.fixture("testcode-flow"));
        var universe = flowDiff.flatten(tables);

        Symbol handler = universe.get("api.analyze");
        var json = FlowDiff.toJson(handler);
        assertTrue(json.contains("\"kind\" : \"python\""), json);

        JsonNode node = Json.getMapper().readTree(json);
        assertEquals("api.analyze", node.get("qualifiedName").asText());
        assertEquals("api.py", node.get("filePath").asText());
        assertEquals("POST", node.get("metadata").get("httpMethod").asText());
        assertTrue(node.get("entryPoint").asBoolean());
        assertFalse(node.has("source"));

        var script = Json.getMapper().readTree(FlowDiff.toJson(universe.get("scripts.analyze")));
        assertEquals("shell", script.get("metadata").get("kind").asText());
        assertEquals("/analyze", script.get("metadata").get("httpCalls").get(0).get("path").asText());

        var trees = flowDiff.buildCallTrees(flowDiff.getEntryPoints(tables), universe);
        var tree = Json.getMapper().readTree(FlowDiff.toJson(trees.get(0)));
        assertTrue(tree.has("symbol"));
        assertTrue(tree.has("children"));
        assertEquals(0, tree.get("depth").asInt());
    }

    @Test
    void testAnalyzeDiffThroughFacade(@TempDir Path root) throws Exception {
        try (var git = TestProjects.initRepo(root)) {
            TestProjects.copyFixture("testcode-flow", root);
            TestProjects.commitAll(git, "Initial import");

            var report = root.resolve("tools/report.py");
            Files.writeString(report, Files.readString(report).replace("    render(args)\n", "    return args\n"));

            var result = flowDiff.analyzeDiff(root, "HEAD", "working");
            assertTrue(result.hasChanges());
            assertEquals(1, result.modified());

            var json = Json.getMapper().readTree(FlowDiff.toJson(result));
            assertEquals("working", json.get("afterRef").asText());
            assertEquals("MODIFIED", json.get("symbolChanges").get("tools.report.main").get("kind").asText());
        }
    }
}
