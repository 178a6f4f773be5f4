package io.github.flowdiff.analyzer;

import io.github.flowdiff.FlowDiffConfig;
import io.github.flowdiff.analyzer.bridge.HttpToPythonBridge;
import io.github.flowdiff.analyzer.python.PythonAnalyzer;
import io.github.flowdiff.analyzer.shell.ShellAnalyzer;
import io.github.flowdiff.testutil.TestProjects;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

public class AnalysisOrchestratorTest {
    private static final Set<String> FIXTURE_ENTRY_POINTS =
            Set.of("api.analyze", "api.health", "server.server", "tools.report.main", "scripts.analyze");

    private final Path root = TestProjects.fixture("testcode-flow");

    private static FlowDiffConfig config(boolean parallel) {
        return FlowDiffConfig.of(Map.of(FlowDiffConfig.PARALLEL_KEY, Boolean.toString(parallel)));
    }

    private Map<String, SymbolTable> analyze(@Nullable EntryPointFilter filter) {
        return new AnalysisOrchestrator(root, config(false), AnalysisOrchestrator.defaultRegistry(), filter).analyze();
    }

    private static Set<String> entryPointNames(Map<String, SymbolTable> tables) {
        return AnalysisOrchestrator.getEntryPoints(tables).stream()
                .map(Symbol::getQualifiedName)
                .collect(Collectors.toSet());
    }

    @Test
    void testCurlReachesHandlerAndItsCallees() {
        var tables = analyze(null);
        assertEquals(List.of(PythonAnalyzer.LANGUAGE, ShellAnalyzer.LANGUAGE), new ArrayList<>(tables.keySet()));

        var python = tables.get(PythonAnalyzer.LANGUAGE);
        var shell = tables.get(ShellAnalyzer.LANGUAGE);

        var script = shell.getSymbol("scripts.analyze");
        assertNotNull(script);
        assertEquals(List.of("HTTP:POST:/analyze", "PYTHON:tools.report"), script.getRawCalls());
        assertEquals(List.of("api.analyze", "tools.report.main"), script.getResolvedCalls());
        assertEquals("Kicks off an analysis against the local server\nand renders the report afterwards.",
                     script.getDocumentation());

        assertEquals(List.of("services.analysis.AnalysisService.__init__",
                             "services.analysis.AnalysisService.run_analysis"),
                     python.getSymbol("api.analyze").getResolvedCalls());
        assertEquals(List.of("services.analysis.BaseService.log",
                             "services.store.Store.load",
                             "services.analysis.AnalysisService._score"),
                     python.getSymbol("services.analysis.AnalysisService.run_analysis").getResolvedCalls());
        assertEquals(List.of("tools.report.render"), python.getSymbol("tools.report.main").getResolvedCalls());
        assertEquals("Run a full analysis for the request.", python.getSymbol("api.analyze").getDocumentation());
    }

    @Test
    void testExcludedDirectoriesAndBrokenFilesAreSkipped() {
        var tables = analyze(null);
        var universe = AnalysisOrchestrator.flatten(tables);

        assertFalse(universe.containsKey("venv.lib.vendored.main"));
        assertFalse(universe.containsKey("node_modules.pkg.build"));
        assertFalse(universe.containsKey("broken.broken"));
        assertEquals(1, tables.get(ShellAnalyzer.LANGUAGE).size());
        assertTrue(universe.containsKey("services.store.Store.load"));
    }

    @Test
    void testEntryPoints() {
        var tables = analyze(null);
        assertEquals(FIXTURE_ENTRY_POINTS, entryPointNames(tables));

        var entryPoints = AnalysisOrchestrator.getEntryPoints(tables);
        assertEquals("scripts.analyze", entryPoints.get(entryPoints.size() - 1).getQualifiedName(),
                     "shell tables come after Python in registration order");
    }

    @Test
    void testParallelAndSequentialAgree() {
        var sequential = AnalysisOrchestrator.flatten(analyze(null));
        var parallel = AnalysisOrchestrator.flatten(
                new AnalysisOrchestrator(root, config(true)).analyze());

        assertEquals(new ArrayList<>(sequential.keySet()), new ArrayList<>(parallel.keySet()));
        sequential.forEach((name, symbol) ->
                assertEquals(symbol.getResolvedCalls(), parallel.get(name).getResolvedCalls(), name));
    }

    @Test
    void testFilterDropsUnacceptedCandidates() {
        var seen = new ArrayList<EntryPointCandidate>();
        var tables = analyze(candidates -> {
            seen.addAll(candidates);
            return Set.of("api.analyze");
        });

        assertEquals(Set.of("api.analyze", "scripts.analyze"), entryPointNames(tables));
        assertEquals(Set.of("api.analyze", "api.health", "server.server", "tools.report.main"),
                     seen.stream().map(EntryPointCandidate::qualifiedName).collect(Collectors.toSet()),
                     "shell scripts are never offered to the filter");

        var main = seen.stream().filter(c -> c.qualifiedName().equals("tools.report.main")).findFirst().orElseThrow();
        assertTrue(main.usesCliParsing());
        assertTrue(main.calledInMainGuard());
        assertEquals(1, main.calleeCount());
        assertNull(main.httpMethod());
        assertNull(main.httpRoute());

        var handler = seen.stream().filter(c -> c.qualifiedName().equals("api.analyze")).findFirst().orElseThrow();
        assertEquals("POST", handler.httpMethod());
        assertEquals("/analyze", handler.httpRoute());
        assertEquals(PythonAnalyzer.LANGUAGE, handler.language());
    }

    @Test
    void testFilterSeesCrossLanguageCallers() {
        var seen = new LinkedHashMap<String, EntryPointCandidate>();
        analyze(candidates -> {
            candidates.forEach(c -> seen.put(c.qualifiedName(), c));
            return seen.keySet();
        });

        assertEquals(1, seen.get("api.analyze").callerCount(), "reached by curl in scripts/analyze.sh");
        assertEquals(1, seen.get("tools.report.main").callerCount(), "reached by python3 -m tools.report");
        assertEquals(0, seen.get("api.health").callerCount());
    }

    @Test
    void testDeeplyNestedExpressionDoesNotStopAnalysis(@TempDir Path project) throws Exception {
        var sum = IntStream.rangeClosed(0, 20000)
                .mapToObj(i -> "f(" + i + ")")
                .collect(Collectors.joining(" + "));
        TestProjects.write(project, "gen.py", "def f(x):\n    return x\n\n\ndef total():\n    return " + sum + "\n");
        TestProjects.write(project, "ok.py", "def helper():\n    pass\n\n\ndef main():\n    helper()\n");

        var tables = new AnalysisOrchestrator(project, config(false)).analyze();
        var python = tables.get(PythonAnalyzer.LANGUAGE);

        assertEquals(List.of("ok.helper"), python.getSymbol("ok.main").getResolvedCalls());
        var total = python.getSymbol("gen.total");
        assertNotNull(total);
        assertEquals(20001, total.getRawCalls().size());
        assertEquals(List.of("gen.f"), total.getResolvedCalls());
    }

    @Test
    void testFilterFailuresKeepEveryCandidate() {
        var throwing = analyze(candidates -> {
            throw new IllegalStateException("model unavailable");
        });
        assertEquals(FIXTURE_ENTRY_POINTS, entryPointNames(throwing));

        var silent = analyze(candidates -> null);
        assertEquals(FIXTURE_ENTRY_POINTS, entryPointNames(silent));
    }

    @Test
    void testFailingBridgeLeavesOtherEdges() {
        var registry = new LanguageRegistry()
                .register(new PythonAnalyzer())
                .register(new ShellAnalyzer())
                .register(new LanguageBridge() {
                    @Override
                    public boolean canBridge(String fromLanguage, String toLanguage) {
                        return true;
                    }

                    @Override
                    public Map<String, List<String>> resolve(Map<String, SymbolTable> tables) {
                        throw new IllegalStateException("bridge broke");
                    }
                })
                .register(new HttpToPythonBridge());

        var tables = new AnalysisOrchestrator(root, config(false), registry, null).analyze();
        assertEquals(List.of("api.analyze"),
                     tables.get(ShellAnalyzer.LANGUAGE).getSymbol("scripts.analyze").getResolvedCalls());
    }

    @Test
    void testFlattenLaterTableWins() {
        var first = new PythonAnalyzer().emptyTable();
        var second = new PythonAnalyzer().emptyTable();
        first.addSymbol(TestProjects.pythonSymbol("dup.name"));
        var shadow = TestProjects.pythonSymbol("dup.name", "x.y");
        second.addSymbol(shadow);
        second.addSymbol(TestProjects.pythonSymbol("only.second"));

        var tables = new LinkedHashMap<String, SymbolTable>();
        tables.put("first", first);
        tables.put("second", second);

        var universe = AnalysisOrchestrator.flatten(tables);
        assertSame(shadow, universe.get("dup.name"));
        assertEquals(2, universe.size());
    }
}
