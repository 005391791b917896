package org.terragraph.wrapper.tool;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Runs an external command to completion.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * @param command     program and arguments.
     * @param directory   working directory.
     * @param environment variables merged over the inherited environment; {@code null} values are dropped.
     * @return the exit code and captured output.
     * @throws java.io.UncheckedIOException if the process cannot be started or its output cannot be read.
     */
    CommandResult run(List<String> command, Path directory, Map<String, String> environment);
}
