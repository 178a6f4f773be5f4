package io.github.flowdiff.tree;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.github.flowdiff.analyzer.Symbol;

import java.util.List;
import java.util.Objects;

/**
 * A symbol at one position in a call tree. The same symbol may appear under several parents;
 * each appearance is its own node.
 */
@JsonPropertyOrder({"symbol", "depth", "expanded", "children"})
public final class CallTreeNode {
    private final Symbol symbol;
    private final List<CallTreeNode> children;
    private final int depth;
    private boolean expanded;

    CallTreeNode(Symbol symbol, List<CallTreeNode> children, int depth) {
        this.symbol = Objects.requireNonNull(symbol, "symbol must not be null");
        this.children = List.copyOf(children);
        this.depth = depth;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public List<CallTreeNode> getChildren() {
        return children;
    }

    /** Zero for the entry point. */
    public int getDepth() {
        return depth;
    }

    public boolean isExpanded() {
        return expanded;
    }

    void setExpanded(boolean expanded) {
        this.expanded = expanded;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    @Override
    public String toString() {
        return "CallTreeNode{" + symbol.getQualifiedName() + " @" + depth + ", " + children.size() + " children}";
    }
}
