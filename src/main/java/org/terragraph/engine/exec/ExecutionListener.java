package org.terragraph.engine.exec;

/**
 * Notified after each directory reaches a terminal status. Called on the scheduling thread.
 */
@FunctionalInterface
public interface ExecutionListener {

    void onResult(ExecutionResult result);
}
