package org.terragraph.cli.commands;

import java.io.PrintWriter;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terragraph.cli.CommandLineInterface;
import org.terragraph.cli.config.LoggingConfigurator;
import org.terragraph.engine.build.GraphBuildResult;
import org.terragraph.engine.build.GraphBuilder;
import org.terragraph.engine.build.SymlinkReconciler;
import org.terragraph.engine.exec.ExecutionOptions;
import org.terragraph.engine.exec.GraphExecutor;
import org.terragraph.engine.exec.Operation;
import org.terragraph.engine.exec.RunSummary;
import org.terragraph.engine.graph.DependencyGraph;
import org.terragraph.engine.graph.GraphConstructionException;
import org.terragraph.engine.scan.DirectoryScanner;
import org.terragraph.wrapper.audit.AuditClient;
import org.terragraph.wrapper.config.WrapperConfigResolver;
import org.terragraph.wrapper.tool.CommandRunner;
import org.terragraph.wrapper.tool.ProcessCommandRunner;
import org.terragraph.wrapper.tool.TerraformInvoker;
import org.terragraph.wrapper.tool.ToolSettings;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs an operation over every Terraform directory below {@code --path}, respecting the dependencies declared
 * with {@code depends_on}.
 * <p>
 * The dependency graph runs first. Directories outside the graph (the post-set) run afterwards as an
 * unordered batch, regular directories before symlinked ones. Exit code 1 when any directory failed or the
 * dependency metadata is invalid.
 */
@Command(
    name = "graph-apply",
    description = "Run a Terraform operation over a configuration tree in dependency order"
)
public class GraphApplyCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GraphApplyCommand.class);

    @Option(
        names = {"--path"},
        required = true,
        description = "Root of the configuration tree to run"
    )
    private Path path;

    @Option(
        names = {"--operation"},
        defaultValue = Operation.PLAN,
        description = "Terraform operation to run (default: ${DEFAULT-VALUE})"
    )
    private String operation;

    @Option(
        names = {"--parallel-jobs"},
        defaultValue = "4",
        description = "Maximum number of concurrent Terraform processes (default: ${DEFAULT-VALUE})"
    )
    private int parallelJobs;

    @Option(
        names = {"--debug"},
        description = "Enable debug logging"
    )
    private boolean debug;

    @Option(
        names = {"--print-only-changes"},
        description = "Only print the output of directories with changes or failures"
    )
    private boolean printOnlyChanges;

    @Option(
        names = {"--audit-api-url"},
        description = "Post the outcome of every directory to this URL"
    )
    private URI auditApiUrl;

    @Parameters(
        paramLabel = "TOOL_ARG",
        arity = "0..*",
        description = "Extra arguments passed to the Terraform operation"
    )
    private List<String> toolArguments = new ArrayList<>();

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        if (parallelJobs < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Invalid value for option '--parallel-jobs': must be a positive integer but was " + parallelJobs);
        }
        Path root = CommandSupport.existingDirectory(path, spec.commandLine(), "--path");
        Config config = parent.getConfig();
        if (debug) {
            LoggingConfigurator.enableDebug();
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        WrapperConfigResolver resolver = new WrapperConfigResolver();
        GraphBuildResult build;
        try {
            build = new GraphBuilder(new DirectoryScanner(), resolver).build(root);
        } catch (GraphConstructionException | ConfigException e) {
            log.error("Invalid dependency metadata: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
        DependencyGraph graph = build.graph();
        new SymlinkReconciler().connect(graph, build.symlinks());

        ToolSettings settings = ToolSettings.fromConfig(config);
        CommandRunner runner = new ProcessCommandRunner();
        if (!CommandSupport.checkToolVersion(config, runner, settings, root, err)) {
            return 1;
        }

        ExecutionOptions options = ExecutionOptions.defaults(out).withPrintOnlyChanges(printOnlyChanges);
        if (auditApiUrl != null) {
            options = options.withListener(new AuditClient(auditApiUrl, CommandSupport.repositoryRoot(runner, root)));
        }
        GraphExecutor executor = new GraphExecutor(new TerraformInvoker(runner, settings, resolver),
            CommandSupport.directoryEnvironment(config, resolver), options);
        Operation toolOperation = Operation.of(operation, toolArguments.toArray(new String[0]));

        executor.executeGraph(graph, parallelJobs, toolOperation);

        List<Path> regular = new ArrayList<>();
        List<Path> symlinked = new ArrayList<>();
        for (Path directory : build.postSet().stream().sorted().toList()) {
            (DirectoryScanner.toRealPath(directory).equals(directory) ? regular : symlinked).add(directory);
        }
        executor.executePostGraph(regular, parallelJobs, toolOperation);
        executor.executePostGraph(symlinked, parallelJobs, toolOperation);

        RunSummary summary = executor.summary();
        summary.complete();
        CommandSupport.printSummary(out, summary, false);
        return summary.hasFailures() ? 1 : 0;
    }
}
