package org.terragraph.engine.impact;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terragraph.engine.graph.DependencyGraph;
import org.terragraph.engine.scan.DirectoryScanner;
import org.terragraph.wrapper.config.WrapperConfigResolver;

/**
 * Computes which Terraform directories are transitively affected by a set of changed files.
 * <p>
 * The module usage, file inclusion and auto-variable graphs of the repository are composed by union; every
 * descendant of a changed file is a candidate. A changed Terraform file also makes its own directory a
 * candidate, so deleted files are covered. A candidate is kept only if it lies within the scope root,
 * still exists, contains {@code *.tf} files and has not set {@code plan_check = false}.
 * <p>
 * Read-only. Widening the set of changed files never shrinks the result.
 */
public class ChangeImpactAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ChangeImpactAnalyzer.class);

    private final Path repositoryRoot;
    private final WrapperConfigResolver configResolver;

    public ChangeImpactAnalyzer(Path repositoryRoot, WrapperConfigResolver configResolver) {
        this.repositoryRoot = DirectoryScanner.toRealPath(repositoryRoot);
        this.configResolver = configResolver;
    }

    /**
     * @param changedFiles changed files, absolute or relative to the repository root.
     * @param scopeRoot    only directories below this path are returned.
     * @return the affected directories, split into regular and symlinked.
     */
    public AffectedDirectories affected(Collection<Path> changedFiles, Path scopeRoot) {
        Path scope = DirectoryScanner.toRealPath(scopeRoot);
        DependencyGraph combined = ImpactGraphBuilder.scan(repositoryRoot).combinedGraph();

        Set<Path> candidates = new LinkedHashSet<>();
        for (Path changed : changedFiles) {
            Path file = repositoryRoot.resolve(changed).normalize();
            if (isTerraformFile(file) && file.getParent() != null) {
                candidates.add(file.getParent());
            }
            Set<Path> nodes = new LinkedHashSet<>();
            nodes.add(file);
            nodes.add(DirectoryScanner.toRealPath(file));
            for (Path node : nodes) {
                if (combined.contains(node)) {
                    candidates.addAll(combined.descendants(node));
                }
            }
        }

        Set<Path> regular = new LinkedHashSet<>();
        Set<Path> symlinked = new LinkedHashSet<>();
        for (Path candidate : candidates) {
            if (!candidate.startsWith(scope) || !Files.isDirectory(candidate)
                || !DirectoryScanner.hasSourceFiles(candidate)) {
                continue;
            }
            if (!configResolver.resolve(candidate).planCheck()) {
                log.debug("{} opted out of plan checks", candidate);
                continue;
            }
            if (DirectoryScanner.toRealPath(candidate).equals(candidate)) {
                regular.add(candidate);
            } else {
                symlinked.add(candidate);
            }
        }

        log.info("{} changed file(s) affect {} directories ({} symlinked)", changedFiles.size(),
            regular.size() + symlinked.size(), symlinked.size());
        return new AffectedDirectories(regular, symlinked);
    }

    private static boolean isTerraformFile(Path file) {
        return ImpactGraphBuilder.isSource(file) || ImpactGraphBuilder.isAutoVariables(file)
            || file.getFileName().toString().endsWith(".tfvars");
    }
}
