package io.github.flowdiff.analyzer;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Language-specific facts attached to a {@link Symbol}. Implementations are value types: two
 * metadata instances describing the same code compare equal even when they were extracted from
 * different checkouts, which is what the structural diff relies on.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PythonMetadata.class, name = "python"),
        @JsonSubTypes.Type(value = ShellMetadata.class, name = "shell")
})
public sealed interface SymbolMetadata permits PythonMetadata, ShellMetadata {
}
