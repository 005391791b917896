package org.terragraph.engine.graph;

/**
 * Lifecycle of a node during one run.
 * <p>
 * Every node starts {@link #PENDING}. {@link #SUCCEEDED}, {@link #FAILED} and {@link #SKIPPED}
 * are terminal and never change once set.
 */
public enum NodeStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED;

    /**
     * @return {@code true} if no further transition is allowed from this status.
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }
}
