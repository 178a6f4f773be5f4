package io.github.flowdiff.tree;

import io.github.flowdiff.FlowDiffConfig;
import io.github.flowdiff.analyzer.Symbol;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds one call tree per entry point from a flat symbol universe.
 * <p>
 * Construction follows resolved calls to symbols in the universe. A symbol already on the path
 * from the root becomes a leaf, so recursion always terminates. Once every tree is built, nodes
 * shallower than the expansion depth are marked expanded; that depth is the configured default,
 * raised to the depth of the deepest changed symbol so that every change is visible.
 * <p>
 * Not thread-safe; use one builder per thread.
 */
public final class CallTreeBuilder {
    private static final Logger logger = LogManager.getLogger(CallTreeBuilder.class);

    private final int defaultExpansionDepth;
    private int maxChangedDepth;
    private int lastExpansionDepth;

    public CallTreeBuilder() {
        this(FlowDiffConfig.DEFAULT_EXPANSION_DEPTH);
    }

    public CallTreeBuilder(int defaultExpansionDepth) {
        if (defaultExpansionDepth < 0) {
            throw new IllegalArgumentException("defaultExpansionDepth must not be negative: " + defaultExpansionDepth);
        }
        this.defaultExpansionDepth = defaultExpansionDepth;
        this.lastExpansionDepth = defaultExpansionDepth;
    }

    public List<CallTreeNode> build(List<Symbol> entryPoints, Map<String, Symbol> universe) {
        maxChangedDepth = 0;
        var roots = new ArrayList<CallTreeNode>(entryPoints.size());
        var path = new HashSet<String>();
        for (var entry : entryPoints) {
            roots.add(buildNode(entry, universe, 0, path));
        }

        lastExpansionDepth = Math.max(defaultExpansionDepth, maxChangedDepth);
        roots.forEach(this::expand);
        logger.debug("Built {} call trees, expansion depth {}", roots.size(), lastExpansionDepth);
        return roots;
    }

    private CallTreeNode buildNode(Symbol symbol, Map<String, Symbol> universe, int depth, Set<String> path) {
        if (symbol.isHasChanges()) {
            maxChangedDepth = Math.max(maxChangedDepth, depth);
        }
        var qualifiedName = symbol.getQualifiedName();
        if (!path.add(qualifiedName)) {
            return new CallTreeNode(symbol, List.of(), depth);
        }

        var children = new ArrayList<CallTreeNode>();
        for (var target : symbol.getResolvedCalls()) {
            var callee = universe.get(target);
            if (callee != null) {
                children.add(buildNode(callee, universe, depth + 1, path));
            }
        }
        path.remove(qualifiedName);
        return new CallTreeNode(symbol, children, depth);
    }

    private void expand(CallTreeNode node) {
        node.setExpanded(node.getDepth() < lastExpansionDepth);
        node.getChildren().forEach(this::expand);
    }

    /**
     * The expansion depth applied by the most recent {@link #build}.
     */
    public int getLastExpansionDepth() {
        return lastExpansionDepth;
    }
}
