package org.terragraph.engine.impact;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Directories affected by a change, split by how they are reached.
 *
 * @param regular   directories reached through their real path.
 * @param symlinked directories reached through a symlink; callers may choose to run these sequentially.
 */
public record AffectedDirectories(Set<Path> regular, Set<Path> symlinked) {

    public AffectedDirectories {
        regular = Set.copyOf(regular);
        symlinked = Set.copyOf(symlinked);
    }

    public Set<Path> all() {
        Set<Path> all = new LinkedHashSet<>(regular);
        all.addAll(symlinked);
        return all;
    }

    public boolean isEmpty() {
        return regular.isEmpty() && symlinked.isEmpty();
    }
}
