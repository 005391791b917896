package org.terragraph.engine.exec;

import java.util.List;

/**
 * Outcome of one external tool invocation.
 *
 * @param exitCode process exit status.
 * @param output   captured output lines (stdout and stderr interleaved).
 */
public record ToolResult(int exitCode, List<String> output) {

    public ToolResult {
        output = List.copyOf(output);
    }
}
