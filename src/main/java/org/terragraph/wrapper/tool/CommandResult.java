package org.terragraph.wrapper.tool;

import java.util.List;

/**
 * Exit status and merged stdout/stderr lines of a finished process.
 */
public record CommandResult(int exitCode, List<String> output) {

    public CommandResult {
        output = List.copyOf(output);
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
