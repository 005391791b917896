package org.terragraph.wrapper.tool;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terragraph.engine.exec.ToolInvoker;
import org.terragraph.engine.exec.ToolResult;
import org.terragraph.wrapper.config.WrapperConfigResolver;

/**
 * Runs Terraform in a directory: {@code init} first (when enabled), then the requested operation.
 * <p>
 * Each command is retried while it fails with a known transient error (see {@link RetriableErrors}),
 * up to {@link ToolSettings#maxAttempts()} attempts, sleeping with {@link JitteredBackoff} in between.
 * When the accumulated backoff reaches {@link ToolSettings#retryTimeout()} a {@link ToolTimeoutException}
 * is thrown. Environment variables must already be resolved; this class never resolves them again.
 */
public class TerraformInvoker implements ToolInvoker {

    private static final Logger log = LoggerFactory.getLogger(TerraformInvoker.class);

    private final CommandRunner runner;
    private final ToolSettings settings;
    private final WrapperConfigResolver configResolver;
    private final JitteredBackoff.Sleeper sleeper;

    public TerraformInvoker(CommandRunner runner, ToolSettings settings, WrapperConfigResolver configResolver) {
        this(runner, settings, configResolver, duration -> Thread.sleep(duration.toMillis()));
    }

    public TerraformInvoker(CommandRunner runner, ToolSettings settings, WrapperConfigResolver configResolver,
                            JitteredBackoff.Sleeper sleeper) {
        this.runner = runner;
        this.settings = settings;
        this.configResolver = configResolver;
        this.sleeper = sleeper;
    }

    @Override
    public ToolResult invoke(Path directory, List<String> arguments, Map<String, String> environment) {
        List<String> output = new ArrayList<>();
        if (settings.initBeforeRun()) {
            CommandResult init = runWithRetry(command(initArguments(directory)), directory, environment);
            output.addAll(init.output());
            if (!init.isSuccess()) {
                log.warn("init failed in {} with exit code {}", directory, init.exitCode());
                return new ToolResult(init.exitCode(), output);
            }
        }
        CommandResult result = runWithRetry(command(arguments), directory, environment);
        output.addAll(result.output());
        return new ToolResult(result.exitCode(), output);
    }

    /**
     * Runs {@code command} once per attempt until it succeeds, fails without a retriable error, or the
     * attempts are exhausted.
     */
    CommandResult runWithRetry(List<String> command, Path directory, Map<String, String> environment) {
        JitteredBackoff backoff = new JitteredBackoff(settings.baseDelay(), settings.maxDelay(), sleeper);
        CommandResult result = null;
        for (int attempt = 1; attempt <= settings.maxAttempts(); attempt++) {
            result = runner.run(command, directory, environment);
            List<String> transientErrors = RetriableErrors.find(result.output());
            if (result.isSuccess() || transientErrors.isEmpty() || attempt == settings.maxAttempts()) {
                break;
            }
            log.warn("Found network errors while running {} in {}: {}", command, directory, transientErrors);
            Duration waited;
            try {
                waited = backoff.next();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while retrying " + command, e);
            }
            if (waited.compareTo(settings.retryTimeout()) >= 0) {
                throw new ToolTimeoutException("Timed out retrying " + command + " in " + directory);
            }
        }
        return result;
    }

    private List<String> initArguments(Path directory) {
        List<String> arguments = new ArrayList<>(List.of("init", "-input=false"));
        if (!configResolver.resolve(directory).configureBackend()) {
            arguments.add("-backend=false");
        }
        return arguments;
    }

    private List<String> command(List<String> arguments) {
        List<String> command = new ArrayList<>();
        command.add(settings.binary());
        command.addAll(arguments);
        if (!settings.colors() && !arguments.contains("-no-color")) {
            command.add("-no-color");
        }
        return command;
    }
}
