package org.terragraph.engine.graph;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;

/**
 * Directed graph of directories keyed by canonical path.
 * <p>
 * An edge {@code (a, b)} means "b depends on a": {@code a} must reach a terminal, non-failed state before
 * {@code b} may start. Edges are deduplicated and self-loops are rejected. Insertion order of nodes and edges
 * is preserved so that iteration (and therefore scheduling and reporting) is deterministic.
 * <p>
 * Topology is mutable until {@link #freeze()} is called; execution freezes the graph and every later
 * mutation throws {@link IllegalStateException}. This class is not thread-safe for mutation; once frozen
 * it is safe to read from multiple threads.
 */
public final class DependencyGraph {

    /**
     * A directed edge; {@code to} depends on {@code from}.
     *
     * @param from the prerequisite directory.
     * @param to   the dependent directory.
     */
    public record Edge(Path from, Path to) {
    }

    private final Map<Path, Node> nodes = new LinkedHashMap<>();
    private final Map<Path, Set<Path>> successors = new HashMap<>();
    private final Map<Path, Set<Path>> predecessors = new HashMap<>();
    private volatile boolean frozen;

    /**
     * Adds a node if no node with the same path exists yet.
     *
     * @param node the node to add.
     * @return {@code true} if the node was added, {@code false} if its path was already present.
     */
    public boolean addNode(Node node) {
        checkMutable();
        if (nodes.containsKey(node.path())) {
            return false;
        }
        nodes.put(node.path(), node);
        successors.put(node.path(), new LinkedHashSet<>());
        predecessors.put(node.path(), new LinkedHashSet<>());
        return true;
    }

    /**
     * Adds an edge meaning {@code to} depends on {@code from}. Missing endpoints are added as regular nodes.
     *
     * @return {@code true} if the edge is new.
     * @throws IllegalArgumentException if {@code from} equals {@code to}.
     */
    public boolean addEdge(Path from, Path to) {
        checkMutable();
        if (from.equals(to)) {
            throw new IllegalArgumentException("Self-loop is not allowed: " + from);
        }
        addNode(Node.regular(from));
        addNode(Node.regular(to));
        boolean added = successors.get(from).add(to);
        predecessors.get(to).add(from);
        return added;
    }

    public boolean contains(Path path) {
        return nodes.containsKey(path);
    }

    public Optional<Node> node(Path path) {
        return Optional.ofNullable(nodes.get(path));
    }

    public Collection<Node> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Set<Path> paths() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * @return directories that directly depend on {@code path}; empty if the path is unknown.
     */
    public Set<Path> successors(Path path) {
        Set<Path> result = successors.get(path);
        return result == null ? Set.of() : Collections.unmodifiableSet(result);
    }

    /**
     * @return directories {@code path} directly depends on; empty if the path is unknown.
     */
    public Set<Path> predecessors(Path path) {
        Set<Path> result = predecessors.get(path);
        return result == null ? Set.of() : Collections.unmodifiableSet(result);
    }

    public List<Edge> edges() {
        List<Edge> edges = new ArrayList<>();
        for (Map.Entry<Path, Set<Path>> entry : successors.entrySet()) {
            for (Path to : entry.getValue()) {
                edges.add(new Edge(entry.getKey(), to));
            }
        }
        return edges;
    }

    public boolean hasEdge(Path from, Path to) {
        Set<Path> out = successors.get(from);
        return out != null && out.contains(to);
    }

    /**
     * Returns every node reachable from {@code path} by following edges forward, excluding {@code path} itself.
     */
    public Set<Path> descendants(Path path) {
        return reach(path, successors);
    }

    /**
     * Returns every node from which {@code path} is reachable, excluding {@code path} itself.
     */
    public Set<Path> ancestors(Path path) {
        return reach(path, predecessors);
    }

    /**
     * @return {@code true} if {@code to} is reachable from {@code from} (a node always reaches itself).
     */
    public boolean hasPath(Path from, Path to) {
        if (from.equals(to)) {
            return contains(from);
        }
        return descendants(from).contains(to);
    }

    private Set<Path> reach(Path start, Map<Path, Set<Path>> adjacency) {
        Set<Path> visited = new LinkedHashSet<>();
        if (!adjacency.containsKey(start)) {
            return visited;
        }
        Queue<Path> queue = new ArrayDeque<>(adjacency.get(start));
        while (!queue.isEmpty()) {
            Path current = queue.poll();
            if (!current.equals(start) && visited.add(current)) {
                queue.addAll(adjacency.get(current));
            }
        }
        return visited;
    }

    /**
     * Searches for a cycle with an iterative depth-first search.
     *
     * @return one cycle as a path list whose first and last element are equal, or empty if the graph is acyclic.
     */
    public Optional<List<Path>> findCycle() {
        Map<Path, Integer> state = new HashMap<>();
        Map<Path, Path> parent = new HashMap<>();
        for (Path root : nodes.keySet()) {
            if (state.containsKey(root)) {
                continue;
            }
            Deque<Iterator<Path>> stack = new ArrayDeque<>();
            Deque<Path> pathStack = new ArrayDeque<>();
            state.put(root, 1);
            stack.push(successors.get(root).iterator());
            pathStack.push(root);
            while (!stack.isEmpty()) {
                Iterator<Path> it = stack.peek();
                Path current = pathStack.peek();
                if (!it.hasNext()) {
                    state.put(current, 2);
                    stack.pop();
                    pathStack.pop();
                    continue;
                }
                Path next = it.next();
                Integer nextState = state.get(next);
                if (nextState == null) {
                    state.put(next, 1);
                    parent.put(next, current);
                    stack.push(successors.get(next).iterator());
                    pathStack.push(next);
                } else if (nextState == 1) {
                    List<Path> cycle = new ArrayList<>();
                    cycle.add(next);
                    for (Path p = current; !p.equals(next); p = parent.get(p)) {
                        cycle.add(p);
                    }
                    cycle.add(next);
                    Collections.reverse(cycle);
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Orders all nodes so that every node appears after its predecessors (Kahn's algorithm).
     *
     * @throws CyclicDependencyException if the graph contains a cycle.
     */
    public List<Path> topologicalOrder() {
        Map<Path, Integer> inDegree = new HashMap<>();
        Queue<Path> ready = new ArrayDeque<>();
        for (Path path : nodes.keySet()) {
            int degree = predecessors.get(path).size();
            inDegree.put(path, degree);
            if (degree == 0) {
                ready.add(path);
            }
        }

        List<Path> sorted = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            Path current = ready.poll();
            sorted.add(current);
            for (Path dependent : successors.get(current)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (sorted.size() != nodes.size()) {
            throw new CyclicDependencyException(findCycle().orElse(List.of()));
        }
        return sorted;
    }

    /**
     * Forbids any further topology change.
     */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Graph is frozen; topology cannot change once execution has started");
        }
    }

    /**
     * Composes two graphs by union: a node is present if present in either input, an edge is present if
     * present in either input. Nodes are deduplicated by path; when both inputs hold a node for the same path,
     * the node from {@code first} wins. Neither input is modified.
     */
    public static DependencyGraph union(DependencyGraph first, DependencyGraph second) {
        DependencyGraph result = new DependencyGraph();
        for (DependencyGraph graph : List.of(first, second)) {
            graph.nodes().forEach(result::addNode);
        }
        for (DependencyGraph graph : List.of(first, second)) {
            for (Edge edge : graph.edges()) {
                result.addEdge(edge.from(), edge.to());
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "DependencyGraph{nodes=" + nodes.size() + ", edges=" + edges().size() + "}";
    }
}
