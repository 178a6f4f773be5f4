package io.github.flowdiff.analyzer;

import java.util.List;
import java.util.Map;

/**
 * Resolves calls that leave one language and land in another. Bridges run after every analyzer
 * has resolved its own calls.
 */
public interface LanguageBridge {

    boolean canBridge(String fromLanguage, String toLanguage);

    /**
     * Maps source qualified names to the qualified names of their targets in the other language.
     * Returns an empty map when either language's table is absent.
     */
    Map<String, List<String>> resolve(Map<String, SymbolTable> tables);

    default String getBridgeName() {
        return getClass().getSimpleName();
    }
}
