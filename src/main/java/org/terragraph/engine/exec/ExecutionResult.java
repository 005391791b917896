package org.terragraph.engine.exec;

import java.nio.file.Path;
import java.util.List;

import org.terragraph.engine.graph.NodeStatus;

/**
 * Terminal outcome of one directory.
 *
 * @param directory          the directory.
 * @param status             terminal status.
 * @param output             captured tool output; empty for skipped directories.
 * @param hasChanges         whether the tool reported a diff.
 * @param privilegeSensitive whether the output contains privilege-sensitive (IAM) changes.
 * @param message            short reason for failures and skips, {@code null} otherwise.
 */
public record ExecutionResult(
    Path directory,
    NodeStatus status,
    List<String> output,
    boolean hasChanges,
    boolean privilegeSensitive,
    String message
) {

    public ExecutionResult {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Result status must be terminal: " + status);
        }
        output = List.copyOf(output);
    }

    static ExecutionResult skipped(Path directory, String message) {
        return new ExecutionResult(directory, NodeStatus.SKIPPED, List.of(), false, false, message);
    }

    static ExecutionResult failed(Path directory, List<String> output, String message) {
        return new ExecutionResult(directory, NodeStatus.FAILED, output, false, false, message);
    }
}
