package io.github.flowdiff.analyzer;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Analyzers keyed by language name, plus the bridges that connect them. Registration order is the
 * order in which analyzers are asked whether they own a file.
 */
public final class LanguageRegistry {
    private final Map<String, LanguageAnalyzer> analyzers = new LinkedHashMap<>();
    private final List<LanguageBridge> bridges = new ArrayList<>();

    public LanguageRegistry register(LanguageAnalyzer analyzer) {
        var name = analyzer.getLanguageName();
        if (analyzers.containsKey(name)) {
            throw new IllegalArgumentException("Analyzer already registered for language " + name);
        }
        analyzers.put(name, analyzer);
        return this;
    }

    public LanguageRegistry register(LanguageBridge bridge) {
        bridges.add(bridge);
        return this;
    }

    public @Nullable LanguageAnalyzer getAnalyzer(String language) {
        return analyzers.get(language);
    }

    /**
     * The first registered analyzer that owns the file, or null if none does.
     */
    public @Nullable LanguageAnalyzer analyzerFor(Path file) {
        for (var analyzer : analyzers.values()) {
            if (analyzer.canAnalyze(file)) {
                return analyzer;
            }
        }
        return null;
    }

    /**
     * Every extension owned by a registered analyzer.
     */
    public Set<String> getFileExtensions() {
        var extensions = new LinkedHashSet<String>();
        analyzers.values().forEach(a -> extensions.addAll(a.getFileExtensions()));
        return extensions;
    }

    public Collection<LanguageAnalyzer> getAnalyzers() {
        return Collections.unmodifiableCollection(analyzers.values());
    }

    public List<LanguageBridge> getBridges() {
        return Collections.unmodifiableList(bridges);
    }
}
