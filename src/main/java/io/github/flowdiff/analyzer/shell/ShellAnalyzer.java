package io.github.flowdiff.analyzer.shell;

import io.github.flowdiff.analyzer.LanguageAnalyzer;
import io.github.flowdiff.analyzer.ProjectFile;
import io.github.flowdiff.analyzer.Symbol;
import io.github.flowdiff.analyzer.SymbolTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * Treats each shell script as a single symbol whose raw calls are the HTTP requests and Python
 * invocations it makes. Scripts are always entry points: their only caller is the operator.
 */
public final class ShellAnalyzer implements LanguageAnalyzer {
    private static final Logger logger = LogManager.getLogger(ShellAnalyzer.class);

    public static final String LANGUAGE = "shell";

    private static final Set<String> EXTENSIONS = Set.of(".sh", ".bash");

    @Override
    public Set<String> getFileExtensions() {
        return EXTENSIONS;
    }

    @Override
    public SymbolTable buildSymbolTable(ProjectFile file) {
        var table = new ShellSymbolTable();
        String content;
        try {
            content = file.read();
        } catch (IOException e) {
            logger.warn("Skipping unreadable shell script {}: {}", file, e.getMessage());
            return table;
        }

        var extracted = ShellCommandExtractor.extract(content);
        var symbol = new Symbol(file.getFileName(), qualifiedName(file), LANGUAGE, file, 1,
                                extracted.metadata(), extracted.rawCalls(), extracted.documentation());
        symbol.setEntryPoint(true);
        table.addSymbol(symbol);
        logger.trace("Script {} issues {} recognised commands", file, extracted.rawCalls().size());
        return table;
    }

    @Override
    public SymbolTable mergeSymbolTables(List<SymbolTable> tables) {
        var merged = new ShellSymbolTable();
        for (var table : tables) {
            if (table instanceof ShellSymbolTable) {
                table.getAllSymbols().forEach(merged::addSymbol);
            } else {
                logger.warn("Ignoring non-shell table {} during merge", table);
            }
        }
        return merged;
    }

    /**
     * Shell calls only ever leave the language, so intra-language resolution yields nothing.
     */
    @Override
    public void resolveCalls(SymbolTable table) {
        table.getAllSymbols().forEach(symbol -> symbol.replaceResolvedCalls(List.of()));
    }

    @Override
    public void markEntryPoints(SymbolTable table) {
        table.getAllSymbols().forEach(symbol -> symbol.setEntryPoint(true));
    }

    @Override
    public String getLanguageName() {
        return LANGUAGE;
    }

    @Override
    public SymbolTable emptyTable() {
        return new ShellSymbolTable();
    }

    /** {@code scripts/analyze.sh} becomes {@code scripts.analyze}. */
    public static String qualifiedName(ProjectFile file) {
        var rel = file.getRelPathString();
        int dot = rel.lastIndexOf('.');
        int slash = rel.lastIndexOf('/');
        if (dot > slash + 1) {
            rel = rel.substring(0, dot);
        }
        return rel.replace('/', '.');
    }
}
