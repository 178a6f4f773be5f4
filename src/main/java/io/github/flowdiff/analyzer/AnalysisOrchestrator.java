package io.github.flowdiff.analyzer;

import io.github.flowdiff.FlowDiffConfig;
import io.github.flowdiff.analyzer.bridge.HttpToPythonBridge;
import io.github.flowdiff.analyzer.bridge.PythonInvocationBridge;
import io.github.flowdiff.analyzer.python.PythonAnalyzer;
import io.github.flowdiff.analyzer.python.PythonEntryPoints;
import io.github.flowdiff.analyzer.shell.ShellAnalyzer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs the full analysis of one directory: discover files, build and merge per-language tables,
 * resolve intra-language calls, mark entry points, connect languages through the bridges, and
 * finally let the optional {@link EntryPointFilter} prune the entry points.
 * <p>
 * Each call to {@link #analyze()} produces a fresh set of tables owned by the caller.
 */
public final class AnalysisOrchestrator {
    private static final Logger logger = LogManager.getLogger(AnalysisOrchestrator.class);

    private final Project project;
    private final FlowDiffConfig config;
    private final LanguageRegistry registry;
    private final @Nullable EntryPointFilter entryPointFilter;

    public AnalysisOrchestrator(Path root, FlowDiffConfig config) {
        this(root, config, defaultRegistry(), null);
    }

    public AnalysisOrchestrator(Path root,
                                FlowDiffConfig config,
                                LanguageRegistry registry,
                                @Nullable EntryPointFilter entryPointFilter) {
        this.project = new Project(root, config.getExcludedDirectories(), config.isExcludeHiddenDirectories());
        this.config = config;
        this.registry = registry;
        this.entryPointFilter = entryPointFilter;
    }

    /**
     * Python and shell analyzers with both shell-to-Python bridges.
     */
    public static LanguageRegistry defaultRegistry() {
        return new LanguageRegistry()
                .register(new PythonAnalyzer())
                .register(new ShellAnalyzer())
                .register(new HttpToPythonBridge())
                .register(new PythonInvocationBridge());
    }

    /**
     * Language name to fully resolved table, one entry per registered analyzer.
     */
    public Map<String, SymbolTable> analyze() {
        var files = project.getAllFiles();
        logger.debug("Discovered {} files under {}", files.size(), project.getRoot());

        var byAnalyzer = new LinkedHashMap<LanguageAnalyzer, List<ProjectFile>>();
        registry.getAnalyzers().forEach(a -> byAnalyzer.put(a, new ArrayList<>()));
        for (var file : files) {
            var analyzer = registry.analyzerFor(file.getRelPath());
            if (analyzer != null) {
                byAnalyzer.get(analyzer).add(file);
            }
        }

        var tables = new LinkedHashMap<String, SymbolTable>();
        byAnalyzer.forEach((analyzer, languageFiles) -> {
            var merged = analyzer.mergeSymbolTables(buildTables(analyzer, languageFiles));
            analyzer.resolveCalls(merged);
            analyzer.markEntryPoints(merged);
            tables.put(analyzer.getLanguageName(), merged);
            logger.debug("{}: {} files, {} symbols", analyzer.getLanguageName(), languageFiles.size(), merged.size());
        });

        int edges = new CrossLanguageResolver(registry.getBridges()).apply(tables);
        logger.debug("Bridges added {} cross-language calls", edges);

        // caller counts include the bridge edges
        if (entryPointFilter != null) {
            applyEntryPointFilter(tables, entryPointFilter);
        }
        return tables;
    }

    /**
     * Per-file tables in path order. Parallel builds are collected back into that order so the
     * merge stays deterministic.
     */
    private List<SymbolTable> buildTables(LanguageAnalyzer analyzer, List<ProjectFile> files) {
        var stream = config.isParallel() ? files.parallelStream() : files.stream();
        return stream.map(file -> {
                    try {
                        return analyzer.buildSymbolTable(file);
                    } catch (RuntimeException e) {
                        logger.warn("{} analyzer failed on {}; file skipped", analyzer.getLanguageName(), file, e);
                        return analyzer.emptyTable();
                    } catch (StackOverflowError e) {
                        logger.warn("{} analyzer ran out of stack on {}; file skipped", analyzer.getLanguageName(), file);
                        return analyzer.emptyTable();
                    }
                })
                .toList();
    }

    /**
     * Offers the heuristic entry points of every non-shell language to the filter. Candidates the
     * filter does not accept lose their flag. Any failure keeps all of them.
     */
    void applyEntryPointFilter(Map<String, SymbolTable> tables, EntryPointFilter filter) {
        var callerCounts = callerCounts(tables);
        var candidates = new ArrayList<EntryPointCandidate>();
        var flagged = new ArrayList<Symbol>();
        tables.forEach((language, table) -> {
            if (ShellAnalyzer.LANGUAGE.equals(language)) {
                return;
            }
            for (var symbol : table.getAllSymbols()) {
                if (symbol.isEntryPoint()) {
                    flagged.add(symbol);
                    candidates.add(toCandidate(symbol, callerCounts.getOrDefault(symbol.getQualifiedName(), 0)));
                }
            }
        });
        if (candidates.isEmpty()) {
            return;
        }

        Set<String> accepted;
        try {
            accepted = filter.accept(Collections.unmodifiableList(candidates));
        } catch (Exception e) {
            logger.warn("Entry point filter failed; keeping all {} candidates", candidates.size(), e);
            return;
        }
        if (accepted == null) {
            logger.warn("Entry point filter returned no answer; keeping all {} candidates", candidates.size());
            return;
        }

        int dropped = 0;
        for (var symbol : flagged) {
            if (!accepted.contains(symbol.getQualifiedName())) {
                symbol.setEntryPoint(false);
                dropped++;
            }
        }
        logger.debug("Entry point filter kept {} of {} candidates", candidates.size() - dropped, candidates.size());
    }

    private static Map<String, Integer> callerCounts(Map<String, SymbolTable> tables) {
        var counts = new HashMap<String, Integer>();
        for (var table : tables.values()) {
            for (var symbol : table.getAllSymbols()) {
                symbol.getResolvedCalls().forEach(target -> counts.merge(target, 1, Integer::sum));
            }
        }
        return counts;
    }

    static EntryPointCandidate toCandidate(Symbol symbol, int callerCount) {
        var metadata = symbol.pythonMetadata();
        return new EntryPointCandidate(symbol.getQualifiedName(),
                                       symbol.getName(),
                                       symbol.getFilePath(),
                                       symbol.getLanguage(),
                                       metadata != null && metadata.usesCliParsing(),
                                       metadata != null && metadata.calledInMainGuard(),
                                       metadata != null && PythonEntryPoints.isTest(symbol),
                                       PythonEntryPoints.isPrivate(symbol.getName()),
                                       callerCount,
                                       symbol.getResolvedCalls().size(),
                                       metadata == null ? null : metadata.httpMethod(),
                                       metadata == null ? null : metadata.httpRoute(),
                                       symbol.getDocumentation());
    }

    /**
     * Every shell symbol plus the flagged symbols of the other languages, in table order.
     */
    public static List<Symbol> getEntryPoints(Map<String, SymbolTable> tables) {
        var result = new ArrayList<Symbol>();
        tables.forEach((language, table) -> {
            for (var symbol : table.getAllSymbols()) {
                if (ShellAnalyzer.LANGUAGE.equals(language) || symbol.isEntryPoint()) {
                    result.add(symbol);
                }
            }
        });
        return result;
    }

    /**
     * All symbols of all languages by qualified name. Should two languages define the same name,
     * the language registered later wins.
     */
    public static Map<String, Symbol> flatten(Map<String, SymbolTable> tables) {
        var universe = new LinkedHashMap<String, Symbol>();
        for (var table : tables.values()) {
            for (var symbol : table.getAllSymbols()) {
                var previous = universe.put(symbol.getQualifiedName(), symbol);
                if (previous != null) {
                    logger.debug("{} shadows {} symbol of the same name", symbol, previous.getLanguage());
                }
            }
        }
        return universe;
    }
}
