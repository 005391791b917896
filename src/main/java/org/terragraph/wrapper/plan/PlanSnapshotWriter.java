package org.terragraph.wrapper.plan;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Persists plan snapshots in a tree that mirrors the source tree:
 * <pre>
 *   {outputDir}/{path relative to base}/plan.tfplan   binary plan artifact
 *   {outputDir}/{path relative to base}/plan.json     structured plan (pretty printed)
 * </pre>
 */
public class PlanSnapshotWriter {

    private static final Logger log = LoggerFactory.getLogger(PlanSnapshotWriter.class);

    public static final String BINARY_PLAN = "plan.tfplan";
    public static final String JSON_PLAN = "plan.json";

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final Path outputDir;
    private final Path base;

    /**
     * @param outputDir root of the snapshot tree.
     * @param base      source directory that relative paths are computed against.
     */
    public PlanSnapshotWriter(Path outputDir, Path base) {
        this.outputDir = outputDir.toAbsolutePath().normalize();
        this.base = base.toAbsolutePath().normalize();
    }

    /**
     * Writes both files for {@code directory}.
     *
     * @param directory  the planned directory.
     * @param planFile   the binary plan written by the tool.
     * @param jsonOutput lines printed by {@code show -json} for the plan.
     * @return the snapshot directory.
     * @throws PlanConversionException if {@code jsonOutput} is not a JSON document.
     * @throws UncheckedIOException    if the files cannot be written.
     */
    public Path write(Path directory, Path planFile, List<String> jsonOutput) {
        JsonNode plan;
        try {
            plan = mapper.readTree(String.join("\n", jsonOutput));
        } catch (JsonProcessingException e) {
            throw new PlanConversionException("Plan of " + directory + " is not valid JSON", e);
        }
        if (plan == null || plan.isMissingNode()) {
            throw new PlanConversionException("Plan of " + directory + " is empty", null);
        }

        Path target = snapshotDirectory(directory);
        try {
            Files.createDirectories(target);
            Files.copy(planFile, target.resolve(BINARY_PLAN), StandardCopyOption.REPLACE_EXISTING);
            mapper.writeValue(target.resolve(JSON_PLAN).toFile(), plan);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write plan snapshot to " + target, e);
        }
        log.debug("Wrote plan snapshot for {} to {}", directory, target);
        return target;
    }

    Path snapshotDirectory(Path directory) {
        Path normalized = directory.toAbsolutePath().normalize();
        Path relative = normalized.startsWith(base) ? base.relativize(normalized) : Path.of(
            normalized.toString().replaceFirst("^[/\\\\]+", ""));
        return outputDir.resolve(relative);
    }
}
