package org.terragraph.engine.scan;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a directory tree (following symlinks) and collects every directory that contains Terraform
 * sources ({@code *.tf} files).
 * <p>
 * Terraform's private cache ({@code .terraform}) and VCS metadata are never entered. A directory is
 * classified as a symlink when the path it was reached through differs from its real path; this covers
 * both a symlinked directory and every directory below it.
 */
public final class DirectoryScanner {

    private static final Logger log = LoggerFactory.getLogger(DirectoryScanner.class);

    public static final String SOURCE_SUFFIX = ".tf";
    private static final Set<String> EXCLUDED_DIRECTORIES = Set.of(".terraform", ".git");

    /**
     * Scans {@code root} for Terraform directories.
     *
     * @param root directory to walk; resolved to its real path first.
     * @return regular and symlinked directories found.
     * @throws UncheckedIOException if the tree cannot be walked.
     */
    public ScanResult scan(Path root) {
        final Path start = toRealPath(root);
        final Set<Path> regular = new LinkedHashSet<>();
        final Map<Path, Path> symlinks = new LinkedHashMap<>();

        try {
            Files.walkFileTree(start, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                        Path name = dir.getFileName();
                        if (name != null && EXCLUDED_DIRECTORIES.contains(name.toString())) {
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        if (hasSourceFiles(dir)) {
                            Path real = toRealPath(dir);
                            Path walked = dir.toAbsolutePath().normalize();
                            if (real.equals(walked)) {
                                regular.add(walked);
                            } else {
                                symlinks.put(walked, real);
                            }
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                        if (exc instanceof FileSystemLoopException) {
                            log.warn("Skipping symlink loop at {}", file);
                            return FileVisitResult.CONTINUE;
                        }
                        throw exc;
                    }
                });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + start, e);
        }

        log.debug("Scanned {}: {} regular directories, {} symlinked directories",
            start, regular.size(), symlinks.size());
        return new ScanResult(regular, symlinks);
    }

    /**
     * @return {@code true} if {@code dir} directly contains at least one {@code *.tf} file.
     */
    public static boolean hasSourceFiles(Path dir) {
        if (!Files.isDirectory(dir)) {
            return false;
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.anyMatch(p -> p.getFileName().toString().endsWith(SOURCE_SUFFIX)
                && Files.isRegularFile(p));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
    }

    /**
     * Resolves symlinks in {@code path}, falling back to the normalized absolute path if it does not exist.
     */
    public static Path toRealPath(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path.toAbsolutePath().normalize();
        }
    }
}
