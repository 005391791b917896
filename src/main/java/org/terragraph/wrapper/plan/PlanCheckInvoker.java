package org.terragraph.wrapper.plan;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terragraph.engine.exec.ToolInvoker;
import org.terragraph.engine.exec.ToolResult;
import org.terragraph.wrapper.tool.CommandResult;
import org.terragraph.wrapper.tool.CommandRunner;
import org.terragraph.wrapper.tool.ToolSettings;

/**
 * Plans a directory into a temporary plan file and, when a {@link PlanSnapshotWriter} is configured,
 * converts the plan with {@code show -json} and persists the snapshot.
 * <p>
 * A failed conversion turns the invocation into a failure (exit code 1), with the reason appended to
 * the captured output.
 */
public class PlanCheckInvoker implements ToolInvoker {

    private static final Logger log = LoggerFactory.getLogger(PlanCheckInvoker.class);

    static final int CONVERSION_FAILURE_EXIT_CODE = 1;
    private static final int PLAN_DIFF_EXIT_CODE = 2;

    private final ToolInvoker planner;
    private final CommandRunner runner;
    private final ToolSettings settings;
    private final PlanSnapshotWriter snapshotWriter;

    /**
     * @param planner        runs the plan itself (including {@code init}).
     * @param runner         runs {@code show -json}.
     * @param settings       tool settings.
     * @param snapshotWriter destination of snapshots, or {@code null} to skip conversion.
     */
    public PlanCheckInvoker(ToolInvoker planner, CommandRunner runner, ToolSettings settings,
                            PlanSnapshotWriter snapshotWriter) {
        this.planner = planner;
        this.runner = runner;
        this.settings = settings;
        this.snapshotWriter = snapshotWriter;
    }

    @Override
    public ToolResult invoke(Path directory, List<String> arguments, Map<String, String> environment) {
        Path planFile = createPlanFile();
        try {
            List<String> planArguments = new ArrayList<>(arguments);
            planArguments.add("-out=" + planFile);
            ToolResult plan = planner.invoke(directory, planArguments, environment);
            boolean planned = plan.exitCode() == 0 || plan.exitCode() == PLAN_DIFF_EXIT_CODE;
            if (!planned || snapshotWriter == null) {
                return plan;
            }
            return convert(directory, planFile, environment, plan);
        } finally {
            deleteQuietly(planFile);
        }
    }

    private ToolResult convert(Path directory, Path planFile, Map<String, String> environment, ToolResult plan) {
        List<String> output = new ArrayList<>(plan.output());
        CommandResult show = runner.run(List.of(settings.binary(), "show", "-json", planFile.toString()),
            directory, environment);
        if (!show.isSuccess()) {
            output.addAll(show.output());
            output.add("Failed to convert plan: show exited with " + show.exitCode());
            return new ToolResult(CONVERSION_FAILURE_EXIT_CODE, output);
        }
        try {
            snapshotWriter.write(directory, planFile, show.output());
        } catch (PlanConversionException | UncheckedIOException e) {
            log.error("Failed to store plan snapshot of {}: {}", directory, e.getMessage());
            output.add("Failed to convert plan: " + e.getMessage());
            return new ToolResult(CONVERSION_FAILURE_EXIT_CODE, output);
        }
        return new ToolResult(plan.exitCode(), output);
    }

    private static Path createPlanFile() {
        try {
            return Files.createTempFile("terragraph-", ".tfplan");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create temporary plan file", e);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temporary plan file {}: {}", file, e.getMessage());
        }
    }
}
