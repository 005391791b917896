package org.terragraph.engine.graph;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when declared dependencies form a cycle.
 * <p>
 * Carries one cycle in edge order; the first and last element are the same directory.
 */
public class CyclicDependencyException extends GraphConstructionException {

    private final List<Path> cycle;

    public CyclicDependencyException(List<Path> cycle) {
        super("Cyclic dependency detected: " + cycle.stream()
            .map(Path::toString)
            .collect(Collectors.joining(" -> ")));
        this.cycle = List.copyOf(cycle);
    }

    public List<Path> getCycle() {
        return cycle;
    }
}
