package io.github.flowdiff.analyzer;

import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Symbols of one language, keyed by qualified name, plus whatever indices the language's
 * resolver needs. Adding a symbol whose qualified name is already present replaces the earlier one.
 */
public abstract class SymbolTable {
    private final String language;
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();

    protected SymbolTable(String language) {
        this.language = Objects.requireNonNull(language, "language must not be null");
    }

    public String getLanguage() {
        return language;
    }

    public void addSymbol(Symbol symbol) {
        if (!language.equals(symbol.getLanguage())) {
            throw new IllegalArgumentException("Cannot add %s symbol %s to %s table"
                                                       .formatted(symbol.getLanguage(), symbol.getQualifiedName(), language));
        }
        symbols.remove(symbol.getQualifiedName());
        symbols.put(symbol.getQualifiedName(), symbol);
    }

    public @Nullable Symbol getSymbol(String qualifiedName) {
        return symbols.get(qualifiedName);
    }

    public boolean contains(String qualifiedName) {
        return symbols.containsKey(qualifiedName);
    }

    /** Symbols in insertion order; a replaced symbol moves to the end. */
    public Collection<Symbol> getAllSymbols() {
        return Collections.unmodifiableCollection(symbols.values());
    }

    public int size() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + language + ", " + symbols.size() + " symbols}";
    }
}
