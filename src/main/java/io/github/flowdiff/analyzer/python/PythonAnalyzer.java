package io.github.flowdiff.analyzer.python;

import io.github.flowdiff.analyzer.LanguageAnalyzer;
import io.github.flowdiff.analyzer.ProjectFile;
import io.github.flowdiff.analyzer.SymbolTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TreeSitterPython;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Python analysis backed by tree-sitter. Module names follow the directory layout relative to the
 * analysis root ({@code pkg/mod.py} is {@code pkg.mod}, {@code pkg/__init__.py} is {@code pkg}).
 */
public final class PythonAnalyzer implements LanguageAnalyzer {
    private static final Logger logger = LogManager.getLogger(PythonAnalyzer.class);

    public static final String LANGUAGE = "python";

    private static final TSLanguage PY_LANGUAGE = new TreeSitterPython();

    @Override
    public Set<String> getFileExtensions() {
        return Set.of(".py");
    }

    @Override
    public SymbolTable buildSymbolTable(ProjectFile file) {
        var table = new PythonSymbolTable();
        String src;
        try {
            src = file.read();
        } catch (IOException e) {
            logger.warn("Skipping unreadable Python file {}: {}", file, e.getMessage());
            return table;
        }

        // TSParser is not threadsafe, so each build gets its own
        var parser = new TSParser();
        if (!parser.setLanguage(PY_LANGUAGE)) {
            logger.error("Failed to set Python language on TSParser for {}", file);
            return table;
        }
        var tree = parser.parseString(null, src);
        var root = tree.getRootNode();
        if (root == null || root.isNull()) {
            logger.warn("Parsing produced no root node for {}", file);
            return table;
        }
        if (root.hasError()) {
            logger.warn("Skipping {}: syntax errors in source", file);
            return table;
        }

        try {
            new PythonSymbolExtractor(file, moduleName(file), src, table).extract(root);
        } catch (RuntimeException e) {
            logger.warn("Error analyzing {}; file skipped", file, e);
            return new PythonSymbolTable();
        }
        logger.trace("Extracted {} symbols from {}", table.size(), file);
        return table;
    }

    @Override
    public SymbolTable mergeSymbolTables(List<SymbolTable> tables) {
        var merged = new PythonSymbolTable();
        for (var table : tables) {
            if (table instanceof PythonSymbolTable pythonTable) {
                merged.absorb(pythonTable);
            } else {
                logger.warn("Ignoring non-Python table {} during merge", table);
            }
        }
        return merged;
    }

    @Override
    public void resolveCalls(SymbolTable table) {
        if (!(table instanceof PythonSymbolTable pythonTable)) {
            logger.warn("Cannot resolve calls in non-Python table {}", table);
            return;
        }
        var resolver = new PythonCallResolver(pythonTable);
        for (var symbol : pythonTable.getAllSymbols()) {
            symbol.replaceResolvedCalls(resolver.resolveAll(symbol));
        }
    }

    @Override
    public void markEntryPoints(SymbolTable table) {
        if (table instanceof PythonSymbolTable pythonTable) {
            PythonEntryPoints.mark(pythonTable);
        }
    }

    @Override
    public String getLanguageName() {
        return LANGUAGE;
    }

    @Override
    public SymbolTable emptyTable() {
        return new PythonSymbolTable();
    }

    /**
     * Dotted module name for a file relative to the analysis root.
     */
    public static String moduleName(ProjectFile file) {
        var rel = file.getRelPathString();
        if (rel.endsWith(".py")) {
            rel = rel.substring(0, rel.length() - 3);
        }
        var parts = new ArrayList<>(List.of(rel.split("/")));
        if (parts.size() > 1 && parts.get(parts.size() - 1).equals("__init__")) {
            parts.remove(parts.size() - 1);
        }
        return String.join(".", parts);
    }
}
