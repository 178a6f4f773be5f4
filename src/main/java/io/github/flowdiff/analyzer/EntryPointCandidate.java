package io.github.flowdiff.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * What an {@link EntryPointFilter} sees about a heuristically chosen entry point. Caller and callee
 * counts include cross-language calls; {@code httpMethod} and {@code httpRoute} are set together
 * for route handlers.
 */
public record EntryPointCandidate(String qualifiedName,
                                  String name,
                                  String filePath,
                                  String language,
                                  boolean usesCliParsing,
                                  boolean calledInMainGuard,
                                  boolean test,
                                  boolean privateName,
                                  int callerCount,
                                  int calleeCount,
                                  @Nullable String httpMethod,
                                  @Nullable String httpRoute,
                                  @Nullable String documentation) {
}
