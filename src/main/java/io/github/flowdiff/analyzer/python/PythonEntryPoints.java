package io.github.flowdiff.analyzer.python;

import io.github.flowdiff.analyzer.Symbol;

import java.util.Set;

/**
 * Heuristics deciding which Python symbols a user would start reading from.
 */
public final class PythonEntryPoints {
    private static final Set<String> RUNNER_NAMES = Set.of("main", "run", "execute", "start", "init", "initialize");
    private static final Set<String> TEST_FIXTURE_NAMES = Set.of("setUp", "tearDown", "setUpClass", "tearDownClass",
                                                                 "setUpModule", "tearDownModule");

    private PythonEntryPoints() {
    }

    /** Underscore-prefixed names, dunders included, are never entry points. */
    public static boolean isPrivate(String name) {
        return name.startsWith("_");
    }

    public static boolean isTest(Symbol symbol) {
        var name = symbol.getName();
        if (name.startsWith("test_") || TEST_FIXTURE_NAMES.contains(name)) {
            return true;
        }
        var fileName = symbol.getSource().getFileName();
        return fileName.startsWith("test_") || fileName.endsWith("_test.py");
    }

    public static boolean isEntryPoint(Symbol symbol) {
        var metadata = symbol.pythonMetadata();
        if (metadata == null) {
            return false;
        }
        if (metadata.scriptEntry()) {
            return true;
        }
        if (isPrivate(symbol.getName())) {
            return false;
        }
        return metadata.isHttpHandler()
                || isTest(symbol)
                || metadata.calledInMainGuard()
                || metadata.usesCliParsing()
                || RUNNER_NAMES.contains(symbol.getName());
    }

    static void mark(PythonSymbolTable table) {
        for (var symbol : table.getAllSymbols()) {
            symbol.setEntryPoint(isEntryPoint(symbol));
        }
    }
}
