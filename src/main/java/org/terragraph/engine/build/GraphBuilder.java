package org.terragraph.engine.build;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terragraph.engine.graph.CyclicDependencyException;
import org.terragraph.engine.graph.DependencyGraph;
import org.terragraph.engine.graph.Node;
import org.terragraph.engine.graph.NoDependencyException;
import org.terragraph.engine.scan.DirectoryScanner;
import org.terragraph.engine.scan.ScanResult;
import org.terragraph.wrapper.config.WrapperConfig;
import org.terragraph.wrapper.config.WrapperConfigResolver;

/**
 * Builds the dependency graph of a directory tree from the {@code depends_on} declarations in
 * {@code .tf_wrapper} files.
 * <p>
 * Entries of {@code depends_on} are directories relative to the declaring directory (absolute paths are
 * used as-is). A dependency outside the scanned root must exist but is not added to the graph; it is
 * treated as managed elsewhere. Only regular directories contribute declarations; a symlinked directory
 * takes its place in the ordering from its target through {@link SymlinkReconciler}.
 */
public class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final DirectoryScanner scanner;
    private final WrapperConfigResolver configResolver;

    public GraphBuilder(DirectoryScanner scanner, WrapperConfigResolver configResolver) {
        this.scanner = scanner;
        this.configResolver = configResolver;
    }

    /**
     * Scans {@code root} and builds the graph and post-set.
     *
     * @param root the directory tree to process.
     * @return the graph, the post-set and the symlinks left to reconcile.
     * @throws NoDependencyException      if a declared dependency does not exist.
     * @throws CyclicDependencyException  if declarations form a cycle.
     * @throws com.typesafe.config.ConfigException if a wrapper file is malformed.
     */
    public GraphBuildResult build(Path root) {
        final Path scanRoot = DirectoryScanner.toRealPath(root);
        final ScanResult scan = scanner.scan(scanRoot);

        final List<Path> regular = new ArrayList<>(scan.regularDirectories());
        regular.sort(null);
        final Map<Path, Path> links = new TreeMap<>(scan.symlinks());

        final Map<Path, List<String>> declarations = new LinkedHashMap<>();
        for (Path directory : regular) {
            WrapperConfig config = configResolver.resolve(directory);
            if (config.declaresDependencies()) {
                declarations.put(directory, config.dependsOn());
            }
        }

        if (declarations.isEmpty()) {
            log.info("No dependency metadata found under {}; {} directories will run unordered",
                scanRoot, regular.size() + links.size());
            Set<Path> postSet = new LinkedHashSet<>(regular);
            postSet.addAll(links.keySet());
            return new GraphBuildResult(new DependencyGraph(), postSet, Map.of(), false);
        }

        final DependencyGraph graph = new DependencyGraph();
        for (Map.Entry<Path, List<String>> entry : declarations.entrySet()) {
            Path directory = entry.getKey();
            graph.addNode(Node.regular(directory));
            for (String declared : entry.getValue()) {
                Path dependency = resolveDependency(directory, declared);
                if (!dependency.startsWith(scanRoot)) {
                    log.debug("{} depends on {} outside of {}; not scheduled", directory, dependency, scanRoot);
                    continue;
                }
                if (dependency.equals(directory)) {
                    throw new CyclicDependencyException(List.of(directory, directory));
                }
                graph.addEdge(dependency, directory);
            }
        }

        graph.findCycle().ifPresent(cycle -> {
            throw new CyclicDependencyException(cycle);
        });

        final Set<Path> postSet = new LinkedHashSet<>();
        for (Path directory : regular) {
            if (!graph.contains(directory)) {
                postSet.add(directory);
            }
        }

        final Map<Path, Path> symlinks = new LinkedHashMap<>();
        for (Map.Entry<Path, Path> link : links.entrySet()) {
            if (postSet.contains(link.getValue())) {
                postSet.add(link.getKey());
            } else {
                symlinks.put(link.getKey(), link.getValue());
            }
        }

        log.info("Built dependency graph for {}: {} nodes, {} edges, {} unordered directories",
            scanRoot, graph.size(), graph.edges().size(), postSet.size());
        return new GraphBuildResult(graph, postSet, symlinks, true);
    }

    private Path resolveDependency(Path directory, String declared) {
        Path candidate = directory.resolve(declared.trim()).normalize();
        if (!Files.isDirectory(candidate) || !DirectoryScanner.hasSourceFiles(candidate)) {
            throw new NoDependencyException(candidate, directory);
        }
        return DirectoryScanner.toRealPath(candidate);
    }
}
