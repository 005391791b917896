package org.terragraph.engine.exec;

/**
 * How an exit status is interpreted.
 */
public enum ExitClassification {
    /** Completed without changes. */
    SUCCESS,
    /** Completed and reported a diff; not a failure. */
    SUCCESS_WITH_DIFF,
    FAILURE;

    public boolean isSuccess() {
        return this != FAILURE;
    }
}
