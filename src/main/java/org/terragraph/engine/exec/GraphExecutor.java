package org.terragraph.engine.exec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terragraph.engine.graph.DependencyGraph;
import org.terragraph.engine.graph.NodeStatus;

/**
 * Drives dependency-respecting, bounded-parallel execution of the external tool.
 * <p>
 * <b>Wave protocol</b> for {@link #executeGraph(DependencyGraph, int, Operation)}:
 * <ol>
 *   <li>Collect pending nodes whose predecessors are all terminal.</li>
 *   <li>Nodes with a failed or skipped predecessor become {@link NodeStatus#SKIPPED} without running the
 *       tool; their own dependents are blocked in a later wave.</li>
 *   <li>The remaining nodes run on a fixed pool of {@code numParallel} threads.</li>
 *   <li>The scheduling thread waits for the whole wave, then records every result before computing the
 *       next wave.</li>
 * </ol>
 * Only the scheduling thread mutates the {@link RunSummary}; workers compute results but never write
 * state. A failure never cancels a sibling in the same wave.
 * <p>
 * One executor instance covers one run: the graph and the post-set share its summary.
 */
public class GraphExecutor {

    private static final Logger log = LoggerFactory.getLogger(GraphExecutor.class);

    private final ToolInvoker invoker;
    private final DirectoryEnvironment environment;
    private final ExecutionOptions options;
    private final RunSummary summary = new RunSummary();

    public GraphExecutor(ToolInvoker invoker, DirectoryEnvironment environment, ExecutionOptions options) {
        this.invoker = invoker;
        this.environment = environment;
        this.options = options;
    }

    public RunSummary summary() {
        return summary;
    }

    /**
     * Executes every node of {@code graph} in dependency order. Freezes the graph.
     *
     * @param graph       an acyclic graph.
     * @param numParallel maximum number of concurrent tool processes; must be positive.
     * @param operation   the tool operation to run.
     * @throws IllegalStateException if a node can never become ready, which indicates a cyclic graph.
     */
    public void executeGraph(DependencyGraph graph, int numParallel, Operation operation) {
        requirePositive(numParallel);
        graph.freeze();
        List<Path> order = new ArrayList<>(graph.paths());
        order.forEach(summary::register);
        if (order.isEmpty()) {
            return;
        }

        log.info("Executing '{}' over {} directories with {} parallel job(s)", operation.name(), order.size(),
            numParallel);
        Map<Path, Map<String, String>> environments = resolveEnvironments(order);

        ExecutorService pool = newPool(numParallel);
        try {
            int wave = 0;
            while (true) {
                List<Path> ready = readyNodes(graph, order);
                if (ready.isEmpty()) {
                    break;
                }
                wave++;
                List<Path> runnable = new ArrayList<>();
                for (Path directory : ready) {
                    Path blocker = firstUnsuccessfulPredecessor(graph, directory);
                    if (blocker != null) {
                        ExecutionResult skipped = ExecutionResult.skipped(directory,
                            "dependency " + blocker + " " + summary.status(blocker).name().toLowerCase(Locale.ROOT));
                        log.debug("Skipping {}: {}", directory, skipped.message());
                        finish(skipped);
                    } else {
                        runnable.add(directory);
                    }
                }
                log.debug("Wave {}: {} runnable, {} skipped", wave, runnable.size(), ready.size() - runnable.size());
                runWave(pool, runnable, operation, environments);
            }
        } finally {
            pool.shutdown();
        }

        List<Path> stuck = order.stream()
            .filter(path -> summary.status(path) == NodeStatus.PENDING)
            .toList();
        if (!stuck.isEmpty()) {
            throw new IllegalStateException("Directories never became ready (graph is not acyclic): " + stuck);
        }
    }

    /**
     * Executes every directory of {@code postSet} without ordering constraints. Independent of the outcome
     * of any graph execution.
     *
     * @param postSet     directories to run.
     * @param numParallel maximum number of concurrent tool processes; must be positive.
     * @param operation   the tool operation to run.
     */
    public void executePostGraph(Collection<Path> postSet, int numParallel, Operation operation) {
        requirePositive(numParallel);
        List<Path> directories = new ArrayList<>(new LinkedHashSet<>(postSet));
        directories.removeIf(path -> summary.status(path) != null);
        directories.forEach(summary::register);
        if (directories.isEmpty()) {
            return;
        }

        log.info("Executing '{}' over {} unordered directories with {} parallel job(s)", operation.name(),
            directories.size(), numParallel);
        Map<Path, Map<String, String>> environments = resolveEnvironments(directories);
        List<Path> runnable = directories.stream()
            .filter(path -> summary.status(path) == NodeStatus.PENDING)
            .toList();

        ExecutorService pool = newPool(numParallel);
        try {
            runWave(pool, runnable, operation, environments);
        } finally {
            pool.shutdown();
        }
    }

    private List<Path> readyNodes(DependencyGraph graph, List<Path> order) {
        List<Path> ready = new ArrayList<>();
        for (Path directory : order) {
            if (summary.status(directory) != NodeStatus.PENDING) {
                continue;
            }
            boolean allTerminal = graph.predecessors(directory).stream()
                .allMatch(predecessor -> summary.status(predecessor).isTerminal());
            if (allTerminal) {
                ready.add(directory);
            }
        }
        return ready;
    }

    private Path firstUnsuccessfulPredecessor(DependencyGraph graph, Path directory) {
        for (Path predecessor : graph.predecessors(directory)) {
            if (summary.status(predecessor) != NodeStatus.SUCCEEDED) {
                return predecessor;
            }
        }
        return null;
    }

    /**
     * Resolves environments up front, once per directory. A directory whose environment cannot be
     * resolved fails without running the tool.
     */
    private Map<Path, Map<String, String>> resolveEnvironments(List<Path> directories) {
        Map<Path, Map<String, String>> result = new LinkedHashMap<>();
        for (Path directory : directories) {
            try {
                result.put(directory, environment.resolve(directory));
            } catch (RuntimeException e) {
                log.error("Failed to resolve environment for {}: {}", directory, e.getMessage());
                finish(ExecutionResult.failed(directory, List.of(), e.getMessage()));
            }
        }
        return result;
    }

    private void runWave(ExecutorService pool, List<Path> runnable, Operation operation,
                         Map<Path, Map<String, String>> environments) {
        if (runnable.isEmpty()) {
            return;
        }
        List<Callable<ExecutionResult>> tasks = new ArrayList<>(runnable.size());
        for (Path directory : runnable) {
            summary.markRunning(directory);
            Map<String, String> env = environments.get(directory);
            tasks.add(() -> invoke(directory, operation, env));
        }

        List<Future<ExecutionResult>> futures;
        try {
            futures = pool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + runnable.size() + " directories", e);
        }

        for (int i = 0; i < futures.size(); i++) {
            Path directory = runnable.get(i);
            try {
                finish(futures.get(i).get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Invocation in {} failed: {}", directory, cause.getMessage());
                finish(ExecutionResult.failed(directory, List.of(), String.valueOf(cause.getMessage())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while collecting result of " + directory, e);
            }
        }
    }

    /**
     * Runs on a worker thread; must not touch the summary.
     */
    private ExecutionResult invoke(Path directory, Operation operation, Map<String, String> env) {
        log.debug("Running {} in {}", operation.arguments(), directory);
        ToolResult result = invoker.invoke(directory, operation.arguments(), env);
        ExitClassification classification = operation.classify(result.exitCode(), result.output());
        if (!classification.isSuccess()) {
            return ExecutionResult.failed(directory, result.output(), "exit code " + result.exitCode());
        }
        boolean sensitive = options.privilegeScanner().test(result.output());
        return new ExecutionResult(directory, NodeStatus.SUCCEEDED, result.output(),
            classification == ExitClassification.SUCCESS_WITH_DIFF, sensitive, null);
    }

    private void finish(ExecutionResult result) {
        summary.record(result);
        switch (result.status()) {
            case SUCCEEDED -> log.info("{} succeeded{}", result.directory(), result.hasChanges() ? " with changes" : "");
            case FAILED -> log.error("{} failed: {}", result.directory(), result.message());
            case SKIPPED -> log.warn("{} not applied: {}", result.directory(), result.message());
            default -> {
            }
        }
        printOutput(result);
        for (ExecutionListener listener : options.listeners()) {
            listener.onResult(result);
        }
    }

    private void printOutput(ExecutionResult result) {
        if (result.status() == NodeStatus.SKIPPED) {
            return;
        }
        if (options.printOnlyChanges() && result.status() == NodeStatus.SUCCEEDED && !result.hasChanges()) {
            return;
        }
        PrintWriter out = options.out();
        out.println("==> " + result.directory());
        result.output().forEach(out::println);
        out.flush();
    }

    private static ExecutorService newPool(int numParallel) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "tool-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(numParallel, factory);
    }

    private static void requirePositive(int numParallel) {
        if (numParallel < 1) {
            throw new IllegalArgumentException("numParallel must be positive, got " + numParallel);
        }
    }
}
