package org.terragraph.engine.build;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terragraph.engine.graph.DependencyGraph;
import org.terragraph.engine.graph.Node;

/**
 * Merges symlinked directories into a dependency graph so that an alias and its real directory are
 * scheduled as one unit.
 * <p>
 * For a symlink {@code S} to a target {@code T} that is a graph node:
 * <ul>
 *   <li>every edge {@code P -> T} is mirrored as {@code P -> S},</li>
 *   <li>the edge {@code T -> S} is added, so {@code S} never runs before {@code T} is resolved and is
 *       skipped if {@code T} fails,</li>
 *   <li>every edge {@code T -> X} is mirrored as {@code S -> X}.</li>
 * </ul>
 * A symlink whose target is not in the graph becomes a source node without synthetic edges. Existing edges
 * are never removed; an edge that would close a cycle is dropped and logged. Edges are mirrored from the
 * graph as it was before any alias was attached, so two aliases of one target never depend on each other.
 */
public class SymlinkReconciler {

    private static final Logger log = LoggerFactory.getLogger(SymlinkReconciler.class);

    /**
     * Adds {@code symlinks} to {@code graph} in place.
     *
     * @param graph    the graph to extend; must not be frozen.
     * @param symlinks symlinked directory mapped to its real directory.
     */
    public void connect(DependencyGraph graph, Map<Path, Path> symlinks) {
        List<Path> links = new ArrayList<>(symlinks.keySet());
        links.sort(null);

        // edges of each target as they were before any alias was attached
        Map<Path, List<Path>> predecessors = new HashMap<>();
        Map<Path, List<Path>> successors = new HashMap<>();
        for (Path target : symlinks.values()) {
            if (graph.contains(target)) {
                predecessors.computeIfAbsent(target, t -> List.copyOf(graph.predecessors(t)));
                successors.computeIfAbsent(target, t -> List.copyOf(graph.successors(t)));
            }
        }

        for (Path link : links) {
            Path target = symlinks.get(link);
            graph.addNode(Node.symlink(link, target));
            if (!graph.contains(target)) {
                log.debug("Symlink {} points outside the graph ({}); scheduled as a source node", link, target);
                continue;
            }

            for (Path predecessor : predecessors.get(target)) {
                addIfAcyclic(graph, predecessor, link);
            }
            addIfAcyclic(graph, target, link);
            for (Path successor : successors.get(target)) {
                if (!successor.equals(link)) {
                    addIfAcyclic(graph, link, successor);
                }
            }
        }
    }

    private void addIfAcyclic(DependencyGraph graph, Path from, Path to) {
        if (from.equals(to) || graph.hasPath(to, from)) {
            log.warn("Dropping symlink edge {} -> {}: it would create a cycle", from, to);
            return;
        }
        graph.addEdge(from, to);
    }
}
