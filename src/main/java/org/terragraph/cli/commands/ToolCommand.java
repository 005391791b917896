package org.terragraph.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terragraph.cli.CommandLineInterface;
import org.terragraph.engine.exec.ToolResult;
import org.terragraph.wrapper.config.EnvVarResolutionException;
import org.terragraph.wrapper.config.EnvVarResolver;
import org.terragraph.wrapper.config.WrapperConfigResolver;
import org.terragraph.wrapper.tool.ProcessCommandRunner;
import org.terragraph.wrapper.tool.TerraformInvoker;
import org.terragraph.wrapper.tool.ToolSettings;
import org.terragraph.wrapper.tool.ToolTimeoutException;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs Terraform in a single directory with the environment its {@code .tf_wrapper} files declare.
 * <p>
 * Everything after the directory is passed to Terraform unchanged; the exit code is Terraform's.
 */
@Command(
    name = "tf",
    description = "Run Terraform in one directory with its wrapper environment"
)
public class ToolCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ToolCommand.class);

    @Option(
        names = {"--no-resolve-envvars"},
        description = "Do not resolve the environment variables declared in wrapper files"
    )
    private boolean noResolveEnvvars;

    @Parameters(index = "0", paramLabel = "DIRECTORY", description = "Directory to run Terraform in")
    private Path directory;

    @Parameters(
        index = "1..*",
        arity = "1..*",
        paramLabel = "TOOL_ARG",
        description = "Terraform command and arguments, e.g. plan -out=plan.tfplan"
    )
    private List<String> toolArguments;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Path workingDirectory = CommandSupport.existingDirectory(directory, spec.commandLine(), "DIRECTORY");
        Config config = parent.getConfig();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        WrapperConfigResolver resolver = new WrapperConfigResolver();
        Map<String, String> environment = Map.of();
        if (!noResolveEnvvars) {
            try {
                environment = new EnvVarResolver(CommandSupport.parameterStore(config))
                    .resolve(resolver.resolve(workingDirectory));
            } catch (EnvVarResolutionException e) {
                log.error("Cannot resolve environment of {}: {}", workingDirectory, e.getMessage());
                err.println("Error: " + e.getMessage());
                return 1;
            }
        }

        ToolSettings settings = ToolSettings.fromConfig(config).withInitBeforeRun(false).withColors(true);
        ProcessCommandRunner runner = new ProcessCommandRunner(line -> {
            out.println(line);
            out.flush();
        });
        try {
            ToolResult result = new TerraformInvoker(runner, settings, resolver)
                .invoke(workingDirectory, toolArguments, environment);
            return result.exitCode();
        } catch (ToolTimeoutException e) {
            log.error(e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
