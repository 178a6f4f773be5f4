package io.github.flowdiff.analyzer.shell;

import io.github.flowdiff.analyzer.SymbolTable;

/**
 * One symbol per script. Shell needs no resolution indices.
 */
public final class ShellSymbolTable extends SymbolTable {
    public ShellSymbolTable() {
        super(ShellAnalyzer.LANGUAGE);
    }
}
