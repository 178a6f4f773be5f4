package io.github.flowdiff.analyzer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs every bridge over the resolved tables and appends the edges they find. A bridge runs only
 * when it can bridge some pair of the languages present. A bridge that fails is logged and
 * contributes nothing; the others still run.
 */
public final class CrossLanguageResolver {
    private static final Logger logger = LogManager.getLogger(CrossLanguageResolver.class);

    private final List<LanguageBridge> bridges;

    public CrossLanguageResolver(List<LanguageBridge> bridges) {
        this.bridges = List.copyOf(bridges);
    }

    /**
     * Collects all cross-language edges, keyed by source qualified name.
     */
    public Map<String, Set<String>> resolveAll(Map<String, SymbolTable> tables) {
        var combined = new LinkedHashMap<String, Set<String>>();
        for (var bridge : bridges) {
            if (!bridgesAnyPair(bridge, tables.keySet())) {
                logger.debug("Bridge {} has no language pair among {}", bridge.getBridgeName(), tables.keySet());
                continue;
            }
            Map<String, List<String>> refs;
            try {
                refs = bridge.resolve(tables);
            } catch (RuntimeException e) {
                logger.warn("Bridge {} failed; its cross-language calls are omitted", bridge.getBridgeName(), e);
                continue;
            }
            if (refs == null) {
                continue;
            }
            refs.forEach((source, targets) -> combined.computeIfAbsent(source, k -> new LinkedHashSet<>())
                                                      .addAll(targets));
            logger.debug("Bridge {} produced edges for {} symbols", bridge.getBridgeName(), refs.size());
        }
        return combined;
    }

    private static boolean bridgesAnyPair(LanguageBridge bridge, Set<String> languages) {
        for (var from : languages) {
            for (var to : languages) {
                if (!from.equals(to) && bridge.canBridge(from, to)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Resolves and appends the edges to the source symbols. A source name defined in several
     * languages gets the edges in each of them. Returns the number of edges added.
     */
    public int apply(Map<String, SymbolTable> tables) {
        var refs = resolveAll(tables);
        int added = 0;
        for (var entry : refs.entrySet()) {
            var sources = findSymbols(tables, entry.getKey());
            if (sources.isEmpty()) {
                logger.debug("Bridge edge source {} is not a known symbol", entry.getKey());
                continue;
            }
            for (var symbol : sources) {
                int before = symbol.getResolvedCalls().size();
                symbol.addResolvedCalls(entry.getValue());
                added += symbol.getResolvedCalls().size() - before;
            }
        }
        return added;
    }

    private static List<Symbol> findSymbols(Map<String, SymbolTable> tables, String qualifiedName) {
        var result = new ArrayList<Symbol>();
        for (var table : tables.values()) {
            var symbol = table.getSymbol(qualifiedName);
            if (symbol != null) {
                result.add(symbol);
            }
        }
        return result;
    }
}
