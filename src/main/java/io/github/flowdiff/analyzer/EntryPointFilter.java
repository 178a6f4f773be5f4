package io.github.flowdiff.analyzer;

import java.util.List;
import java.util.Set;

/**
 * External judgement on which heuristic entry points are worth showing. The orchestrator keeps
 * every candidate when the filter throws or returns null.
 */
@FunctionalInterface
public interface EntryPointFilter {

    /**
     * @return qualified names of the candidates to keep
     */
    Set<String> accept(List<EntryPointCandidate> candidates) throws Exception;
}
