package io.github.flowdiff.diff;

import io.github.flowdiff.analyzer.Symbol;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * How one qualified name differs between two analyses.
 *
 * @param differences for MODIFIED, which of {@code metadata}, {@code resolvedCalls} and
 *                    {@code documentation} changed; empty otherwise
 */
public record SymbolChange(String qualifiedName,
                           ChangeKind kind,
                           @Nullable Symbol before,
                           @Nullable Symbol after,
                           List<String> differences) {
    public static final String METADATA = "metadata";
    public static final String RESOLVED_CALLS = "resolvedCalls";
    public static final String DOCUMENTATION = "documentation";

    public SymbolChange {
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        differences = List.copyOf(differences);
    }

    public static SymbolChange added(Symbol after) {
        return new SymbolChange(after.getQualifiedName(), ChangeKind.ADDED, null, after, List.of());
    }

    public static SymbolChange deleted(Symbol before) {
        return new SymbolChange(before.getQualifiedName(), ChangeKind.DELETED, before, null, List.of());
    }

    public static SymbolChange modified(Symbol before, Symbol after, List<String> differences) {
        return new SymbolChange(before.getQualifiedName(), ChangeKind.MODIFIED, before, after, differences);
    }
}
