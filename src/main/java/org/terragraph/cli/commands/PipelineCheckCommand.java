package org.terragraph.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terragraph.cli.CommandLineInterface;
import org.terragraph.engine.scan.DirectoryScanner;
import org.terragraph.wrapper.config.WrapperConfigResolver;
import org.terragraph.wrapper.pipeline.ManifestEntry;
import org.terragraph.wrapper.pipeline.PipelineCheckReport;
import org.terragraph.wrapper.pipeline.PipelineConsistencyChecker;
import org.terragraph.wrapper.pipeline.PipelineManifest;
import org.terragraph.wrapper.pipeline.PipelineManifestException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Cross-checks the pipeline manifests ({@code step,directory} CSV files) against the configuration tree.
 */
@Command(
    name = "pipeline-check",
    description = "Verify that pipeline manifests and Terraform directories agree"
)
public class PipelineCheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PipelineCheckCommand.class);

    @Option(
        names = {"--pipeline-dir"},
        defaultValue = "pipelines",
        description = "Directory holding the pipeline manifests (default: ${DEFAULT-VALUE})"
    )
    private Path pipelineDir;

    @Option(
        names = {"--config-dir"},
        defaultValue = "config",
        description = "Root of the Terraform configuration tree (default: ${DEFAULT-VALUE})"
    )
    private Path configDir;

    @Option(
        names = {"--root"},
        defaultValue = ".",
        description = "Directory that manifest paths are relative to (default: ${DEFAULT-VALUE})"
    )
    private Path root;

    @Parameters(
        arity = "0..*",
        paramLabel = "PATH",
        description = "Only check directories below these paths"
    )
    private List<Path> filters = new ArrayList<>();

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Path pipelines = CommandSupport.existingDirectory(pipelineDir, spec.commandLine(), "--pipeline-dir");
        Path configuration = CommandSupport.existingDirectory(configDir, spec.commandLine(), "--config-dir");
        Path base = CommandSupport.existingDirectory(root, spec.commandLine(), "--root");
        parent.getConfig();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        List<PipelineManifest> manifests;
        try {
            manifests = PipelineManifest.loadAll(pipelines, base);
        } catch (PipelineManifestException e) {
            log.error("Invalid pipeline manifest: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }

        List<Path> scopes = filters.stream().map(path -> path.toAbsolutePath().normalize()).toList();
        PipelineCheckReport report = new PipelineConsistencyChecker(new DirectoryScanner(), new WrapperConfigResolver())
            .check(configuration, manifests, scopes);

        if (report.isClean()) {
            out.println("Pipelines are consistent");
            out.flush();
            return 0;
        }
        if (!report.unlisted().isEmpty()) {
            out.println("Directories missing from all pipelines:");
            report.unlisted().forEach(directory -> out.println("  " + directory));
        }
        if (!report.dangling().isEmpty()) {
            out.println("Pipeline entries pointing at missing directories:");
            report.dangling().forEach(entry -> out.println("  " + entry));
        }
        if (!report.duplicates().isEmpty()) {
            out.println("Directories listed more than once:");
            report.duplicates().forEach((directory, entries) -> {
                out.println("  " + directory);
                for (ManifestEntry entry : entries) {
                    out.println("    " + entry.manifest().getFileName() + ":" + entry.line() + " (" + entry.step() + ")");
                }
            });
        }
        out.flush();
        return 1;
    }
}
