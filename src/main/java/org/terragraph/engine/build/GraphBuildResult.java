package org.terragraph.engine.build;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.terragraph.engine.graph.DependencyGraph;

/**
 * Output of {@link GraphBuilder#build(Path)}.
 *
 * @param graph           directories ordered by declared dependencies; empty if no metadata was found.
 * @param postSet         directories without any ordering constraint, run as an unordered batch; sorted.
 * @param symlinks        symlinked directories still to be merged by {@link SymlinkReconciler}, mapped to
 *                        their real directory.
 * @param metadataPresent {@code false} if no directory in the tree declares dependencies at all.
 */
public record GraphBuildResult(
    DependencyGraph graph,
    Set<Path> postSet,
    Map<Path, Path> symlinks,
    boolean metadataPresent
) {

    public GraphBuildResult {
        postSet = Collections.unmodifiableSet(new LinkedHashSet<>(postSet));
        symlinks = Collections.unmodifiableMap(new LinkedHashMap<>(symlinks));
    }
}
