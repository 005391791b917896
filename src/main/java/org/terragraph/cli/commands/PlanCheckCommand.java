package org.terragraph.cli.commands;

import java.io.PrintWriter;
import java.io.Writer;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terragraph.cli.CommandLineInterface;
import org.terragraph.engine.exec.ExecutionOptions;
import org.terragraph.engine.exec.GraphExecutor;
import org.terragraph.engine.exec.Operation;
import org.terragraph.engine.exec.RunSummary;
import org.terragraph.engine.impact.AffectedDirectories;
import org.terragraph.engine.impact.ChangeImpactAnalyzer;
import org.terragraph.engine.scan.DirectoryScanner;
import org.terragraph.engine.scan.ScanResult;
import org.terragraph.wrapper.config.WrapperConfigResolver;
import org.terragraph.wrapper.git.GitException;
import org.terragraph.wrapper.git.GitRepository;
import org.terragraph.wrapper.plan.IamChangeScanner;
import org.terragraph.wrapper.plan.PlanCheckInvoker;
import org.terragraph.wrapper.plan.PlanSnapshotWriter;
import org.terragraph.wrapper.tool.CommandRunner;
import org.terragraph.wrapper.tool.ProcessCommandRunner;
import org.terragraph.wrapper.tool.TerraformInvoker;
import org.terragraph.wrapper.tool.ToolSettings;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Plans every Terraform directory below a path (or only the ones affected by the current git changes) and
 * reports failures and privilege-sensitive changes.
 * <p>
 * Exit code: bit 0 is set when a plan failed, bit 1 when a plan changes IAM resources.
 */
@Command(
    name = "plan-check",
    description = "Plan Terraform directories and flag failures and IAM changes"
)
public class PlanCheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PlanCheckCommand.class);

    static final int EXIT_TOOL_FAILURE = 1;
    static final int EXIT_IAM_CHANGES = 2;

    static final String IAM_PATTERNS = "terragraph.plan-check.iam-resource-patterns";
    static final String BASE_REF = "terragraph.git.base-ref";

    @Parameters(
        index = "0",
        arity = "0..1",
        defaultValue = ".",
        paramLabel = "PATH",
        description = "Directory to check (default: current directory)"
    )
    private Path path;

    @Option(names = {"--skip-iam"}, description = "Do not flag IAM changes")
    private boolean skipIam;

    @Option(names = {"--modified-only"}, description = "Only plan directories affected by changes since the base ref")
    private boolean modifiedOnly;

    @Option(names = {"--print-diff"}, description = "Print the plan output of every directory")
    private boolean printDiff;

    @Option(names = {"--with-colors"}, description = "Keep Terraform's colored output")
    private boolean withColors;

    @Option(
        names = {"--parallel-jobs"},
        defaultValue = "4",
        description = "Maximum number of concurrent Terraform processes (default: ${DEFAULT-VALUE})"
    )
    private int parallelJobs;

    @Option(names = {"--output-dir"}, description = "Store plan.tfplan and plan.json for every directory here")
    private Path outputDir;

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
        Path root = CommandSupport.existingDirectory(path, spec.commandLine(), "PATH");
        Config config = parent.getConfig();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        CommandRunner runner = new ProcessCommandRunner();
        WrapperConfigResolver resolver = new WrapperConfigResolver();

        AffectedDirectories targets;
        try {
            targets = modifiedOnly ? changedDirectories(runner, resolver, root, config) : allDirectories(resolver, root);
        } catch (GitException e) {
            log.error("Cannot determine changed files: {}", e.getMessage());
            err.println("Error: --modified-only requires a git working tree: " + e.getMessage());
            return EXIT_TOOL_FAILURE;
        }
        if (targets.isEmpty()) {
            out.println("No directories to check");
            out.flush();
            return 0;
        }

        ToolSettings settings = ToolSettings.fromConfig(config).withColors(withColors);
        if (!CommandSupport.checkToolVersion(config, runner, settings, root, err)) {
            return EXIT_TOOL_FAILURE;
        }

        PrintWriter toolOutput = printDiff ? out : new PrintWriter(Writer.nullWriter());
        ExecutionOptions options = ExecutionOptions.defaults(toolOutput);
        if (!skipIam) {
            options = options.withPrivilegeScanner(new IamChangeScanner(config.getStringList(IAM_PATTERNS)));
        }
        PlanSnapshotWriter snapshots = outputDir == null
            ? null
            : new PlanSnapshotWriter(outputDir, DirectoryScanner.toRealPath(root));
        PlanCheckInvoker invoker = new PlanCheckInvoker(new TerraformInvoker(runner, settings, resolver), runner,
            settings, snapshots);
        GraphExecutor executor = new GraphExecutor(invoker, CommandSupport.directoryEnvironment(config, resolver),
            options);

        Operation plan = Operation.of(Operation.PLAN);
        executor.executePostGraph(targets.regular().stream().sorted().toList(), parallelJobs, plan);
        executor.executePostGraph(targets.symlinked().stream().sorted().toList(), parallelJobs, plan);

        RunSummary summary = executor.summary();
        summary.complete();
        CommandSupport.printSummary(out, summary, !printDiff);

        int exitCode = summary.hasFailures() ? EXIT_TOOL_FAILURE : 0;
        List<Path> sensitive = summary.privilegeSensitive();
        if (!sensitive.isEmpty()) {
            out.println();
            out.println("IAM changes found in:");
            sensitive.forEach(directory -> out.println("  " + directory));
            exitCode |= EXIT_IAM_CHANGES;
        }
        out.flush();
        return exitCode;
    }

    private AffectedDirectories changedDirectories(CommandRunner runner, WrapperConfigResolver resolver, Path root,
                                                   Config config) {
        GitRepository git = new GitRepository(runner, root);
        Path repositoryRoot = git.root();
        return new ChangeImpactAnalyzer(repositoryRoot, resolver)
            .affected(git.changedFiles(config.getString(BASE_REF)), root);
    }

    private static AffectedDirectories allDirectories(WrapperConfigResolver resolver, Path root) {
        ScanResult scan = new DirectoryScanner().scan(root);
        Set<Path> regular = scan.regularDirectories().stream()
            .filter(directory -> resolver.resolve(directory).planCheck())
            .collect(Collectors.toSet());
        Set<Path> symlinked = scan.symlinks().keySet().stream()
            .filter(directory -> resolver.resolve(directory).planCheck())
            .collect(Collectors.toSet());
        return new AffectedDirectories(regular, symlinked);
    }
}
