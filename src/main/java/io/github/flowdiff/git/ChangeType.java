package io.github.flowdiff.git;

/**
 * How a file differs between two states. Copies are reported as additions.
 */
public enum ChangeType {
    ADDED,
    MODIFIED,
    DELETED,
    RENAMED
}
