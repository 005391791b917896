package org.terragraph.engine.exec;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Runs the external infrastructure tool in one directory.
 * <p>
 * Implementations block until the process exits. Any timeout policy belongs to the implementation.
 */
@FunctionalInterface
public interface ToolInvoker {

    /**
     * @param directory   working directory of the invocation.
     * @param arguments   tool arguments, e.g. {@code ["plan", "-detailed-exitcode"]}.
     * @param environment variables merged over the inherited process environment.
     * @return exit code and captured output.
     * @throws java.io.UncheckedIOException if the process cannot be started.
     */
    ToolResult invoke(Path directory, List<String> arguments, Map<String, String> environment);
}
