package org.terragraph.cli.commands;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terragraph.engine.exec.DirectoryEnvironment;
import org.terragraph.engine.exec.ExecutionResult;
import org.terragraph.engine.exec.RunSummary;
import org.terragraph.wrapper.config.CachingParameterStore;
import org.terragraph.wrapper.config.EnvVarResolver;
import org.terragraph.wrapper.config.FileParameterStore;
import org.terragraph.wrapper.config.ParameterStore;
import org.terragraph.wrapper.config.WrapperConfigResolver;
import org.terragraph.wrapper.git.GitException;
import org.terragraph.wrapper.git.GitRepository;
import org.terragraph.wrapper.tool.CommandRunner;
import org.terragraph.wrapper.tool.ToolSettings;
import org.terragraph.wrapper.tool.ToolVersionCheck;
import org.terragraph.wrapper.tool.VersionCheckResult;

import com.typesafe.config.Config;

import picocli.CommandLine;

/**
 * Wiring shared by the subcommands.
 */
final class CommandSupport {

    private static final Logger log = LoggerFactory.getLogger(CommandSupport.class);

    static final String PARAMETER_STORE_FILE = "terragraph.parameter-store.file";
    static final String PARAMETER_STORE_CACHE_SIZE = "terragraph.parameter-store.cache-size";
    static final String VERSION_CHECK = "terragraph.tool.version-check";

    private CommandSupport() {
    }

    /**
     * Builds the parameter store named by {@code terragraph.parameter-store.file}, cached; an empty store if
     * the setting is absent.
     */
    static ParameterStore parameterStore(Config config) {
        if (!config.hasPath(PARAMETER_STORE_FILE) || config.getString(PARAMETER_STORE_FILE).isBlank()) {
            return ParameterStore.empty();
        }
        Path file = Path.of(config.getString(PARAMETER_STORE_FILE));
        return new CachingParameterStore(new FileParameterStore(file), config.getLong(PARAMETER_STORE_CACHE_SIZE));
    }

    static DirectoryEnvironment directoryEnvironment(Config config, WrapperConfigResolver resolver) {
        EnvVarResolver envVars = new EnvVarResolver(parameterStore(config));
        return directory -> envVars.resolve(resolver.resolve(directory));
    }

    /**
     * @return the git top-level directory of {@code path}, or {@code path} itself outside a working tree.
     */
    static Path repositoryRoot(CommandRunner runner, Path path) {
        try {
            return new GitRepository(runner, path).root();
        } catch (GitException e) {
            log.debug("{} is not inside a git working tree: {}", path, e.getMessage());
            return path;
        }
    }

    static Path existingDirectory(Path path, CommandLine commandLine, String option) {
        Path absolute = path.toAbsolutePath().normalize();
        if (!Files.isDirectory(absolute)) {
            throw new CommandLine.ParameterException(commandLine,
                "Invalid value for " + option + ": directory does not exist: " + absolute);
        }
        return absolute;
    }

    /**
     * Runs the tool version check unless {@code terragraph.tool.version-check} is off.
     *
     * @return {@code false} if the installed tool is missing or too old; the reason is printed to {@code err}.
     */
    static boolean checkToolVersion(Config config, CommandRunner runner, ToolSettings settings, Path directory,
                                    PrintWriter err) {
        if (!config.getBoolean(VERSION_CHECK)) {
            return true;
        }
        VersionCheckResult result;
        try {
            result = new ToolVersionCheck(runner, settings).check(directory);
        } catch (UncheckedIOException e) {
            result = new VersionCheckResult(false, null, "Could not run " + settings.binary() + ": " + e.getMessage());
        }
        if (!result.passed()) {
            log.error("Tool version check failed: {}", result.message());
            err.println("Error: " + result.message());
            return false;
        }
        log.debug("Using {}", result.message());
        return true;
    }

    static void printSummary(PrintWriter out, RunSummary summary, boolean includeFailureOutput) {
        out.println();
        out.println("=== Summary ===");
        out.printf("Succeeded:   %d%n", summary.succeeded().size());
        printList(out, "Failed", summary.failures());
        printList(out, "Not applied", summary.notApplied());
        if (includeFailureOutput) {
            for (Path failure : summary.failures()) {
                summary.result(failure).ifPresent(result -> printFailure(out, result));
            }
        }
        out.flush();
    }

    private static void printList(PrintWriter out, String label, List<Path> directories) {
        out.printf("%-12s %d%n", label + ":", directories.size());
        directories.forEach(directory -> out.println("  " + directory));
    }

    private static void printFailure(PrintWriter out, ExecutionResult result) {
        out.println();
        out.println("==> " + result.directory() + " (" + result.message() + ")");
        result.output().forEach(out::println);
    }
}
