package org.terragraph.wrapper.backend;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terragraph.engine.scan.DirectoryScanner;
import org.terragraph.engine.scan.ScanResult;
import org.terragraph.wrapper.config.WrapperConfig;
import org.terragraph.wrapper.config.WrapperConfigResolver;

/**
 * Verifies that every Terraform directory declares a remote-state backend.
 */
public class BackendChecker {

    private static final Logger log = LoggerFactory.getLogger(BackendChecker.class);

    private static final Pattern BACKEND_BLOCK = Pattern.compile("(?m)^\\s*backend\\s+\"([\\w-]+)\"");

    private final DirectoryScanner scanner;
    private final WrapperConfigResolver configResolver;

    public BackendChecker(DirectoryScanner scanner, WrapperConfigResolver configResolver) {
        this.scanner = scanner;
        this.configResolver = configResolver;
    }

    /**
     * @param paths roots to scan; each may itself be a Terraform directory.
     * @return directories that lack a backend and do not waive the check, sorted.
     */
    public List<Path> findMissingBackends(Collection<Path> paths) {
        TreeSet<Path> directories = new TreeSet<>();
        for (Path path : paths) {
            if (!Files.isDirectory(path)) {
                throw new IllegalArgumentException("Not a directory: " + path);
            }
            ScanResult scan = scanner.scan(path);
            directories.addAll(scan.regularDirectories());
            directories.addAll(scan.symlinks().keySet());
        }

        List<Path> missing = new ArrayList<>();
        for (Path directory : directories) {
            WrapperConfig config = configResolver.resolve(directory);
            if (!config.backendCheck() || !config.configureBackend()) {
                log.debug("Backend check waived for {}", directory);
                continue;
            }
            Optional<String> backend = backendType(directory);
            if (backend.isPresent()) {
                log.debug("{} uses backend '{}'", directory, backend.get());
            } else {
                missing.add(directory);
            }
        }
        log.info("Checked {} directories, {} without a backend", directories.size(), missing.size());
        return missing;
    }

    /**
     * @return the backend type declared by any {@code *.tf} file directly in {@code directory}.
     */
    static Optional<String> backendType(Path directory) {
        try (Stream<Path> entries = Files.list(directory)) {
            List<Path> sources = entries
                .filter(p -> p.getFileName().toString().endsWith(DirectoryScanner.SOURCE_SUFFIX))
                .sorted()
                .toList();
            for (Path source : sources) {
                Matcher matcher = BACKEND_BLOCK.matcher(Files.readString(source, StandardCharsets.UTF_8));
                if (matcher.find()) {
                    return Optional.of(matcher.group(1));
                }
            }
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read sources in " + directory, e);
        }
    }
}
