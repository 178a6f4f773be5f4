package io.github.flowdiff.analyzer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One callable unit (function, method, script) in the analyzed project.
 * <p>
 * Identity is the qualified name alone: symbols built from different checkouts of the same code
 * are equal, so they can be used interchangeably as map keys. Call edges are held as qualified-name
 * strings, never as references to other Symbol instances.
 */
@JsonPropertyOrder({"name", "qualifiedName", "language", "filePath", "lineNumber", "entryPoint",
                    "hasChanges", "documentation", "metadata", "rawCalls", "resolvedCalls"})
public final class Symbol {
    private final String name;
    private final String qualifiedName;
    private final String language;
    private final ProjectFile source;
    private final int lineNumber;
    private final SymbolMetadata metadata;
    private final List<String> rawCalls;
    private final @Nullable String documentation;

    private final LinkedHashSet<String> resolvedCalls = new LinkedHashSet<>();
    private boolean entryPoint;
    private boolean hasChanges;

    public Symbol(String name,
                  String qualifiedName,
                  String language,
                  ProjectFile source,
                  int lineNumber,
                  SymbolMetadata metadata,
                  List<String> rawCalls,
                  @Nullable String documentation) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.qualifiedName = Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        this.language = Objects.requireNonNull(language, "language must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
        if (qualifiedName.isBlank()) {
            throw new IllegalArgumentException("qualifiedName must not be blank");
        }
        this.lineNumber = lineNumber;
        this.rawCalls = List.copyOf(rawCalls);
        this.documentation = documentation;
    }

    public String getName() {
        return name;
    }

    public String getQualifiedName() {
        return qualifiedName;
    }

    public String getLanguage() {
        return language;
    }

    @JsonIgnore
    public ProjectFile getSource() {
        return source;
    }

    /** Path relative to the analysis root, with forward slashes. */
    public String getFilePath() {
        return source.getRelPathString();
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public SymbolMetadata getMetadata() {
        return metadata;
    }

    public List<String> getRawCalls() {
        return rawCalls;
    }

    public @Nullable String getDocumentation() {
        return documentation;
    }

    /** Resolved targets in the order they were first added. */
    public List<String> getResolvedCalls() {
        return List.copyOf(resolvedCalls);
    }

    /**
     * Appends targets not already present. Existing entries are never removed.
     */
    public void addResolvedCalls(Collection<String> targets) {
        resolvedCalls.addAll(targets);
    }

    /**
     * Discards previous intra-language results and installs a freshly computed list.
     * Only analyzers call this, from their resolve pass, before any bridge runs.
     */
    public void replaceResolvedCalls(Collection<String> targets) {
        resolvedCalls.clear();
        resolvedCalls.addAll(targets);
    }

    public boolean isEntryPoint() {
        return entryPoint;
    }

    public void setEntryPoint(boolean entryPoint) {
        this.entryPoint = entryPoint;
    }

    public boolean isHasChanges() {
        return hasChanges;
    }

    public void setHasChanges(boolean hasChanges) {
        this.hasChanges = hasChanges;
    }

    /** Convenience for callers that only handle one language. */
    @JsonIgnore
    public @Nullable PythonMetadata pythonMetadata() {
        return metadata instanceof PythonMetadata pm ? pm : null;
    }

    @JsonIgnore
    public @Nullable ShellMetadata shellMetadata() {
        return metadata instanceof ShellMetadata sm ? sm : null;
    }

    /**
     * Unordered view of the resolved calls, used when comparing two versions of a symbol.
     */
    @JsonIgnore
    public Set<String> resolvedCallSet() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(resolvedCalls));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Symbol other)) return false;
        return qualifiedName.equals(other.qualifiedName);
    }

    @Override
    public int hashCode() {
        return qualifiedName.hashCode();
    }

    @Override
    public String toString() {
        return "Symbol{" + qualifiedName + " (" + language + ") at " + source + ":" + lineNumber + "}";
    }
}
