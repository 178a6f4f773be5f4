package io.github.flowdiff.analyzer;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Turns the source files of one language into a {@link SymbolTable} and resolves calls between
 * them. Implementations are stateless apart from configuration, so one instance may build tables
 * for many files concurrently.
 */
public interface LanguageAnalyzer {

    /**
     * File name suffixes this analyzer owns, including the dot.
     */
    Set<String> getFileExtensions();

    /**
     * True if this analyzer owns the file. Only the name is looked at, never the contents.
     */
    default boolean canAnalyze(Path file) {
        var name = file.getFileName();
        return name != null && getFileExtensions().stream().anyMatch(name.toString()::endsWith);
    }

    /**
     * Extracts the symbols of a single file. Never throws for unreadable or malformed input:
     * such files yield an empty table and a logged warning.
     */
    SymbolTable buildSymbolTable(ProjectFile file);

    /**
     * Combines per-file tables. On a qualified-name collision the table later in the list wins,
     * so callers that need reproducible results must pass the tables in a stable order.
     */
    SymbolTable mergeSymbolTables(List<SymbolTable> tables);

    /**
     * Recomputes every symbol's resolved calls from its raw calls. Running it twice gives the same result.
     */
    void resolveCalls(SymbolTable table);

    /**
     * Flags the symbols a user would start from. Languages without heuristics keep the default.
     */
    default void markEntryPoints(SymbolTable table) {
    }

    String getLanguageName();

    /**
     * Empty table of this analyzer's type, returned for files that fail to parse.
     */
    SymbolTable emptyTable();
}
