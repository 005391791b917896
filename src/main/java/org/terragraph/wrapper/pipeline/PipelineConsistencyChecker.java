package org.terragraph.wrapper.pipeline;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terragraph.engine.scan.DirectoryScanner;
import org.terragraph.engine.scan.ScanResult;
import org.terragraph.wrapper.config.WrapperConfigResolver;

/**
 * Checks that pipeline manifests and the configuration tree agree.
 * <p>
 * Three kinds of problems are reported: Terraform directories that no manifest lists (unless their
 * wrapper config sets {@code pipeline_check = false}), manifest entries whose directory does not exist,
 * and directories listed more than once. Path filters restrict the check to directories below them.
 */
public class PipelineConsistencyChecker {

    private static final Logger log = LoggerFactory.getLogger(PipelineConsistencyChecker.class);

    private final DirectoryScanner scanner;
    private final WrapperConfigResolver configResolver;

    public PipelineConsistencyChecker(DirectoryScanner scanner, WrapperConfigResolver configResolver) {
        this.scanner = scanner;
        this.configResolver = configResolver;
    }

    /**
     * @param configDir root of the Terraform configuration tree.
     * @param manifests manifests to check against.
     * @param filters   restrict the check to these paths; empty means the whole tree.
     */
    public PipelineCheckReport check(Path configDir, List<PipelineManifest> manifests, Collection<Path> filters) {
        List<Path> scopes = filters.stream().map(DirectoryScanner::toRealPath).toList();

        Map<Path, List<ManifestEntry>> listed = new LinkedHashMap<>();
        for (PipelineManifest manifest : manifests) {
            for (ManifestEntry entry : manifest.entries()) {
                if (inScope(entry.directory(), scopes)) {
                    listed.computeIfAbsent(entry.directory(), d -> new ArrayList<>()).add(entry);
                }
            }
        }

        ScanResult scan = scanner.scan(configDir);
        TreeSet<Path> directories = new TreeSet<>(scan.regularDirectories());
        directories.addAll(scan.symlinks().keySet());

        List<Path> unlisted = new ArrayList<>();
        for (Path directory : directories) {
            if (!inScope(directory, scopes) || listed.containsKey(directory)) {
                continue;
            }
            if (configResolver.resolve(directory).pipelineCheck()) {
                unlisted.add(directory);
            } else {
                log.debug("Pipeline check disabled for {}", directory);
            }
        }

        List<ManifestEntry> dangling = new ArrayList<>();
        Map<Path, List<ManifestEntry>> duplicates = new TreeMap<>();
        listed.forEach((directory, entries) -> {
            if (!Files.isDirectory(directory)) {
                dangling.addAll(entries);
            }
            if (entries.size() > 1) {
                duplicates.put(directory, List.copyOf(entries));
            }
        });

        log.info("Pipeline check: {} directories, {} unlisted, {} dangling entries, {} duplicates",
            directories.size(), unlisted.size(), dangling.size(), duplicates.size());
        return new PipelineCheckReport(unlisted, dangling, duplicates);
    }

    private static boolean inScope(Path directory, List<Path> scopes) {
        return scopes.isEmpty() || scopes.stream().anyMatch(directory::startsWith);
    }
}
