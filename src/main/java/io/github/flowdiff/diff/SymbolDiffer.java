package io.github.flowdiff.diff;

import io.github.flowdiff.analyzer.Symbol;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Compares two symbol universes by qualified name.
 * <p>
 * A symbol present on both sides is modified when its metadata, the set of calls it resolves to,
 * or its documentation differs. Where it sits in its file is not compared, so code that only moved
 * is unchanged.
 */
public final class SymbolDiffer {
    private SymbolDiffer() {
    }

    public static SortedMap<String, SymbolChange> diff(Map<String, Symbol> before, Map<String, Symbol> after) {
        var changes = new TreeMap<String, SymbolChange>();
        before.forEach((name, beforeSymbol) -> {
            var afterSymbol = after.get(name);
            if (afterSymbol == null) {
                changes.put(name, SymbolChange.deleted(beforeSymbol));
                return;
            }
            var differences = differences(beforeSymbol, afterSymbol);
            if (!differences.isEmpty()) {
                changes.put(name, SymbolChange.modified(beforeSymbol, afterSymbol, differences));
            }
        });
        after.forEach((name, afterSymbol) -> {
            if (!before.containsKey(name)) {
                changes.put(name, SymbolChange.added(afterSymbol));
            }
        });
        return changes;
    }

    /**
     * Names of the compared aspects that differ, empty when the symbols are equivalent.
     */
    public static List<String> differences(Symbol before, Symbol after) {
        var result = new ArrayList<String>();
        if (!before.getMetadata().equals(after.getMetadata())) {
            result.add(SymbolChange.METADATA);
        }
        if (!before.resolvedCallSet().equals(after.resolvedCallSet())) {
            result.add(SymbolChange.RESOLVED_CALLS);
        }
        if (!Objects.equals(before.getDocumentation(), after.getDocumentation())) {
            result.add(SymbolChange.DOCUMENTATION);
        }
        return result;
    }
}
