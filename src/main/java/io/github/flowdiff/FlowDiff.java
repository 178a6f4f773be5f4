package io.github.flowdiff;

import io.github.flowdiff.analyzer.AnalysisOrchestrator;
import io.github.flowdiff.analyzer.EntryPointFilter;
import io.github.flowdiff.analyzer.LanguageRegistry;
import io.github.flowdiff.analyzer.Symbol;
import io.github.flowdiff.analyzer.SymbolTable;
import io.github.flowdiff.diff.DiffAnalyzer;
import io.github.flowdiff.diff.DiffResult;
import io.github.flowdiff.tree.CallTreeBuilder;
import io.github.flowdiff.tree.CallTreeNode;
import io.github.flowdiff.util.Json;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Entry point for embedding: one-shot analysis, call trees, and structural diffs between git
 * references. Configuration is read from the project root on each call.
 */
public final class FlowDiff {
    private final LanguageRegistry registry;
    private final @Nullable EntryPointFilter entryPointFilter;
    private final @Nullable FlowDiffConfig configOverride;

    public FlowDiff() {
        this(AnalysisOrchestrator.defaultRegistry(), null, null);
    }

    /**
     * @param configOverride used instead of loading configuration from each project, when not null
     */
    public FlowDiff(LanguageRegistry registry,
                    @Nullable EntryPointFilter entryPointFilter,
                    @Nullable FlowDiffConfig configOverride) {
        this.registry = registry;
        this.entryPointFilter = entryPointFilter;
        this.configOverride = configOverride;
    }

    private FlowDiffConfig configFor(Path root) {
        return configOverride != null ? configOverride : FlowDiffConfig.load(root);
    }

    /**
     * Language name to fully resolved symbol table.
     */
    public Map<String, SymbolTable> analyze(Path root) {
        return new AnalysisOrchestrator(root, configFor(root), registry, entryPointFilter).analyze();
    }

    /**
     * Shell scripts, plus every symbol of the other languages flagged as an entry point.
     */
    public List<Symbol> getEntryPoints(Map<String, SymbolTable> tables) {
        return AnalysisOrchestrator.getEntryPoints(tables);
    }

    public Map<String, Symbol> flatten(Map<String, SymbolTable> tables) {
        return AnalysisOrchestrator.flatten(tables);
    }

    /**
     * Trees expanded to the configured default depth. Configuration comes from the root the entry
     * points were analyzed under.
     */
    public List<CallTreeNode> buildCallTrees(List<Symbol> entryPoints, Map<String, Symbol> universe) {
        FlowDiffConfig config;
        if (configOverride != null) {
            config = configOverride;
        } else if (!entryPoints.isEmpty()) {
            config = FlowDiffConfig.load(entryPoints.get(0).getSource().getRoot());
        } else {
            config = FlowDiffConfig.load(null, System.getenv(), System.getProperties());
        }
        return new CallTreeBuilder(config.getDefaultExpansionDepth()).build(entryPoints, universe);
    }

    public DiffResult analyzeDiff(Path root, String beforeRef, String afterRef) throws GitAPIException {
        var config = configFor(root);
        return new DiffAnalyzer(root, config, registry, DiffAnalyzer.materializerFor(config), entryPointFilter)
                .analyzeDiff(beforeRef, afterRef);
    }

    /**
     * JSON for symbols, trees and diff results, as consumed by the visualization layer.
     */
    public static String toJson(Object value) {
        return Json.toJson(value);
    }
}
