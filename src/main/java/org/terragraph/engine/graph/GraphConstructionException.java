package org.terragraph.engine.graph;

/**
 * Base class for fatal errors raised while building a {@link DependencyGraph}.
 * <p>
 * A graph that fails construction cannot be scheduled safely, so these errors abort the whole run
 * before any external tool invocation.
 */
public class GraphConstructionException extends RuntimeException {

    public GraphConstructionException(String message) {
        super(message);
    }

    public GraphConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
