package org.terragraph.engine.exec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.terragraph.engine.graph.NodeStatus;

/**
 * Aggregated outcome of one invocation: failed, not applied (skipped) and succeeded directories together
 * with each directory's {@link ExecutionResult}.
 * <p>
 * All writes go through a single lock so that concurrent completions cannot race. Terminal statuses never
 * change. After {@link #complete()} the summary is read-only.
 */
public class RunSummary {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Path, NodeStatus> statuses = new LinkedHashMap<>();
    private final Map<Path, ExecutionResult> results = new LinkedHashMap<>();
    private final List<Path> failures = new ArrayList<>();
    private final List<Path> notApplied = new ArrayList<>();
    private final List<Path> succeeded = new ArrayList<>();
    private boolean completed;

    /**
     * Starts tracking {@code directory} as {@link NodeStatus#PENDING}. Already tracked directories keep
     * their status.
     */
    public void register(Path directory) {
        lock.lock();
        try {
            checkOpen();
            statuses.putIfAbsent(directory, NodeStatus.PENDING);
        } finally {
            lock.unlock();
        }
    }

    void markRunning(Path directory) {
        lock.lock();
        try {
            checkOpen();
            NodeStatus current = statuses.get(directory);
            if (current != NodeStatus.PENDING) {
                throw new IllegalStateException("Cannot start " + directory + " in status " + current);
            }
            statuses.put(directory, NodeStatus.RUNNING);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a terminal result.
     *
     * @throws IllegalStateException if the directory already has a terminal status or the run is complete.
     */
    public void record(ExecutionResult result) {
        lock.lock();
        try {
            checkOpen();
            Path directory = result.directory();
            NodeStatus current = statuses.get(directory);
            if (current != null && current.isTerminal()) {
                throw new IllegalStateException(directory + " already finished with " + current);
            }
            statuses.put(directory, result.status());
            results.put(directory, result);
            switch (result.status()) {
                case SUCCEEDED -> succeeded.add(directory);
                case FAILED -> failures.add(directory);
                case SKIPPED -> notApplied.add(directory);
                default -> throw new IllegalArgumentException("Not a terminal status: " + result.status());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the directory's status, or {@code null} if it is not tracked.
     */
    public NodeStatus status(Path directory) {
        lock.lock();
        try {
            return statuses.get(directory);
        } finally {
            lock.unlock();
        }
    }

    public Optional<ExecutionResult> result(Path directory) {
        lock.lock();
        try {
            return Optional.ofNullable(results.get(directory));
        } finally {
            lock.unlock();
        }
    }

    public List<ExecutionResult> results() {
        lock.lock();
        try {
            return List.copyOf(results.values());
        } finally {
            lock.unlock();
        }
    }

    public List<Path> failures() {
        return snapshot(failures);
    }

    public List<Path> notApplied() {
        return snapshot(notApplied);
    }

    public List<Path> succeeded() {
        return snapshot(succeeded);
    }

    public boolean hasFailures() {
        lock.lock();
        try {
            return !failures.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return directories whose result was flagged privilege-sensitive.
     */
    public List<Path> privilegeSensitive() {
        lock.lock();
        try {
            return results.values().stream()
                .filter(ExecutionResult::privilegeSensitive)
                .map(ExecutionResult::directory)
                .toList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends the run; every later write throws {@link IllegalStateException}.
     */
    public void complete() {
        lock.lock();
        try {
            completed = true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isCompleted() {
        lock.lock();
        try {
            return completed;
        } finally {
            lock.unlock();
        }
    }

    private List<Path> snapshot(List<Path> source) {
        lock.lock();
        try {
            return List.copyOf(source);
        } finally {
            lock.unlock();
        }
    }

    private void checkOpen() {
        if (completed) {
            throw new IllegalStateException("Run summary is complete and read-only");
        }
    }
}
