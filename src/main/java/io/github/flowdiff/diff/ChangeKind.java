package io.github.flowdiff.diff;

public enum ChangeKind {
    ADDED,
    MODIFIED,
    DELETED
}
