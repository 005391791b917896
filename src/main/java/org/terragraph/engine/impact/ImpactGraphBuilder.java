package org.terragraph.engine.impact;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystemLoopException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terragraph.engine.graph.DependencyGraph;
import org.terragraph.engine.scan.DirectoryScanner;

/**
 * Builds the three reachability graphs used for change-impact analysis over one repository tree.
 * <p>
 * In every graph, nodes are file or directory paths and an edge {@code (a, b)} means "a change to
 * {@code a} affects {@code b}". Paths are the ones seen while walking the tree with symlinks followed,
 * plus the real path of every symlinked file, so a change to a real file reaches every alias of it.
 */
public class ImpactGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(ImpactGraphBuilder.class);

    private static final Set<String> EXCLUDED_DIRECTORIES = Set.of(".terraform", ".git");

    private final List<Path> files;

    private ImpactGraphBuilder(List<Path> files) {
        this.files = files;
    }

    /**
     * Walks {@code repositoryRoot} once and returns a builder over the files found.
     *
     * @throws UncheckedIOException if the tree cannot be walked.
     */
    public static ImpactGraphBuilder scan(Path repositoryRoot) {
        Path start = DirectoryScanner.toRealPath(repositoryRoot);
        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(start, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                        Path name = dir.getFileName();
                        if (name != null && EXCLUDED_DIRECTORIES.contains(name.toString())) {
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (attrs.isRegularFile()) {
                            files.add(file.toAbsolutePath().normalize());
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                        if (exc instanceof FileSystemLoopException) {
                            log.debug("Skipping symlink loop at {}", file);
                            return FileVisitResult.CONTINUE;
                        }
                        throw exc;
                    }
                });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + start, e);
        }
        log.debug("Indexed {} files under {}", files.size(), start);
        return new ImpactGraphBuilder(files);
    }

    /**
     * Module usage: every {@code *.tf} file affects its directory, and a local module directory affects
     * every directory whose module blocks use it.
     */
    public DependencyGraph moduleUsageGraph() {
        DependencyGraph graph = new DependencyGraph();
        for (Path file : files) {
            if (!isSource(file)) {
                continue;
            }
            Path directory = file.getParent();
            graph.addEdge(file, directory);
            for (String source : SourceReferenceScanner.moduleSources(read(file))) {
                Path module = directory.resolve(source).normalize();
                addAliased(graph, module, directory);
            }
        }
        return graph;
    }

    /**
     * File inclusion: the real file behind a symlinked file affects the directory holding the symlink, and
     * a file read through a file function affects the directory reading it.
     */
    public DependencyGraph fileInclusionGraph() {
        DependencyGraph graph = new DependencyGraph();
        for (Path file : files) {
            Path directory = file.getParent();
            Path real = DirectoryScanner.toRealPath(file);
            if (!real.equals(file)) {
                graph.addEdge(real, directory);
            }
            if (isSource(file)) {
                for (String reference : SourceReferenceScanner.fileReferences(read(file))) {
                    addAliased(graph, directory.resolve(reference).normalize(), directory);
                }
            }
        }
        return graph;
    }

    /**
     * Auto-loaded variables: {@code terraform.tfvars} and {@code *.auto.tfvars} files (and their JSON forms)
     * affect the directory that loads them, under both the alias and the real path.
     */
    public DependencyGraph autoVariableGraph() {
        DependencyGraph graph = new DependencyGraph();
        for (Path file : files) {
            if (isAutoVariables(file)) {
                addAliased(graph, file, file.getParent());
            }
        }
        return graph;
    }

    /**
     * Union of the three graphs.
     */
    public DependencyGraph combinedGraph() {
        return DependencyGraph.union(
            DependencyGraph.union(moduleUsageGraph(), fileInclusionGraph()),
            autoVariableGraph());
    }

    private static void addAliased(DependencyGraph graph, Path from, Path to) {
        if (!from.equals(to)) {
            graph.addEdge(from, to);
        }
        Path real = DirectoryScanner.toRealPath(from);
        if (!real.equals(from) && !real.equals(to)) {
            graph.addEdge(real, to);
        }
    }

    static boolean isSource(Path file) {
        return file.getFileName().toString().endsWith(DirectoryScanner.SOURCE_SUFFIX);
    }

    static boolean isAutoVariables(Path file) {
        String name = file.getFileName().toString();
        return name.equals("terraform.tfvars") || name.equals("terraform.tfvars.json")
            || name.endsWith(".auto.tfvars") || name.endsWith(".auto.tfvars.json");
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }
}
