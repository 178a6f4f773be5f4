package io.github.flowdiff.diff;

import io.github.flowdiff.git.FileChange;
import io.github.flowdiff.tree.CallTreeNode;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Everything a structural diff produces: both sides' descriptions and call trees, the changed
 * files, and the per-symbol changes keyed by qualified name.
 */
public record DiffResult(String beforeRef,
                         String afterRef,
                         String beforeDescription,
                         String afterDescription,
                         List<FileChange> fileChanges,
                         SortedMap<String, SymbolChange> symbolChanges,
                         List<CallTreeNode> beforeTrees,
                         List<CallTreeNode> afterTrees,
                         int added,
                         int modified,
                         int deleted) {
    public DiffResult {
        fileChanges = List.copyOf(fileChanges);
        symbolChanges = Collections.unmodifiableSortedMap(new TreeMap<>(symbolChanges));
        beforeTrees = List.copyOf(beforeTrees);
        afterTrees = List.copyOf(afterTrees);
    }

    public boolean hasChanges() {
        return added + modified + deleted > 0;
    }
}
