package org.terragraph.engine.graph;

/**
 * Classifies how a directory was reached during scanning.
 */
public enum NodeKind {
    /** A directory reached through its own real path. */
    REGULAR,
    /** A directory whose path is a symlink alias for another directory. */
    SYMLINK
}
