package org.terragraph.engine.exec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Output and post-processing settings of a {@link GraphExecutor}.
 *
 * @param printOnlyChanges suppress the output of successful directories without a diff.
 * @param out              where captured tool output is printed.
 * @param privilegeScanner flags output that contains privilege-sensitive changes.
 * @param listeners        notified of every terminal result, in registration order.
 */
public record ExecutionOptions(
    boolean printOnlyChanges,
    PrintWriter out,
    Predicate<List<String>> privilegeScanner,
    List<ExecutionListener> listeners
) {

    public ExecutionOptions {
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(privilegeScanner, "privilegeScanner");
        listeners = List.copyOf(listeners);
    }

    /**
     * Prints all output, flags nothing as privilege-sensitive and has no listeners.
     */
    public static ExecutionOptions defaults(PrintWriter out) {
        return new ExecutionOptions(false, out, output -> false, List.of());
    }

    public ExecutionOptions withPrintOnlyChanges(boolean value) {
        return new ExecutionOptions(value, out, privilegeScanner, listeners);
    }

    public ExecutionOptions withPrivilegeScanner(Predicate<List<String>> scanner) {
        return new ExecutionOptions(printOnlyChanges, out, scanner, listeners);
    }

    public ExecutionOptions withListener(ExecutionListener listener) {
        List<ExecutionListener> extended = new ArrayList<>(listeners);
        extended.add(listener);
        return new ExecutionOptions(printOnlyChanges, out, privilegeScanner, extended);
    }
}
