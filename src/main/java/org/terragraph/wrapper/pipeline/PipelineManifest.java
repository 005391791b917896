package org.terragraph.wrapper.pipeline;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terragraph.engine.scan.DirectoryScanner;

/**
 * A deployment pipeline manifest: a CSV file with the header {@code step,directory}, one directory per row.
 * <p>
 * Blank lines and lines starting with {@code #} are ignored. Directories are relative to the base
 * directory the manifest is loaded against.
 */
public record PipelineManifest(Path file, List<ManifestEntry> entries) {

    private static final Logger log = LoggerFactory.getLogger(PipelineManifest.class);

    public static final String EXTENSION = ".csv";
    static final String HEADER = "step,directory";

    public PipelineManifest {
        entries = List.copyOf(entries);
    }

    /**
     * Parses one manifest file.
     *
     * @param file manifest to read.
     * @param base directory that manifest paths are relative to.
     * @throws PipelineManifestException if the header or a row is malformed.
     * @throws UncheckedIOException if the file cannot be read.
     */
    public static PipelineManifest load(Path file, Path base) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read pipeline manifest " + file, e);
        }
        Path root = DirectoryScanner.toRealPath(base);
        List<ManifestEntry> entries = new ArrayList<>();
        boolean headerSeen = false;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (!headerSeen) {
                if (!line.replace(" ", "").equalsIgnoreCase(HEADER)) {
                    throw new PipelineManifestException(file + ": expected header '" + HEADER + "' but found '" + line + "'");
                }
                headerSeen = true;
                continue;
            }
            String[] columns = line.split(",", -1);
            if (columns.length != 2 || columns[1].isBlank()) {
                throw new PipelineManifestException(file + ":" + (i + 1) + ": expected 'step,directory' but found '" + line + "'");
            }
            Path directory = root.resolve(columns[1].strip()).normalize();
            entries.add(new ManifestEntry(file, i + 1, columns[0].strip(), directory));
        }
        log.debug("Loaded {} entries from {}", entries.size(), file);
        return new PipelineManifest(file, entries);
    }

    /**
     * Loads every {@code *.csv} file in {@code pipelineDir}, sorted by file name.
     */
    public static List<PipelineManifest> loadAll(Path pipelineDir, Path base) {
        if (!Files.isDirectory(pipelineDir)) {
            throw new IllegalArgumentException("Pipeline directory does not exist: " + pipelineDir);
        }
        try (Stream<Path> files = Files.list(pipelineDir)) {
            return files
                .filter(f -> f.getFileName().toString().endsWith(EXTENSION) && Files.isRegularFile(f))
                .sorted()
                .map(f -> load(f, base))
                .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + pipelineDir, e);
        }
    }
}
