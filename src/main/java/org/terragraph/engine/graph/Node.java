package org.terragraph.engine.graph;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One tracked directory in a {@link DependencyGraph}.
 * <p>
 * Identity is the canonical absolute {@code path}; two nodes with the same path are the same node
 * regardless of kind. A {@link NodeKind#SYMLINK} node carries the real directory it points to.
 *
 * @param path   canonical absolute path of the directory, the unique key.
 * @param kind   whether the path is a regular directory or a symlink alias.
 * @param target resolved real directory for symlink nodes, {@code null} for regular nodes.
 */
public record Node(Path path, NodeKind kind, Path target) {

    public Node {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        if (kind == NodeKind.SYMLINK && target == null) {
            throw new IllegalArgumentException("Symlink node requires a target: " + path);
        }
    }

    public static Node regular(Path path) {
        return new Node(path, NodeKind.REGULAR, null);
    }

    public static Node symlink(Path path, Path target) {
        return new Node(path, NodeKind.SYMLINK, target);
    }

    public boolean isSymlink() {
        return kind == NodeKind.SYMLINK;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Node other)) {
            return false;
        }
        return path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return kind == NodeKind.SYMLINK ? path + " -> " + target : path.toString();
    }
}
