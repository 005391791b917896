package org.terragraph.wrapper.tool;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Stderr is merged into stdout; each line can be
 * streamed to a consumer while it is captured.
 */
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    private final Consumer<String> lineListener;

    public ProcessCommandRunner() {
        this(line -> { });
    }

    /**
     * @param lineListener receives every output line as soon as it is read.
     */
    public ProcessCommandRunner(Consumer<String> lineListener) {
        this.lineListener = lineListener;
    }

    @Override
    public CommandResult run(List<String> command, Path directory, Map<String, String> environment) {
        ProcessBuilder builder = new ProcessBuilder(command)
            .directory(directory.toFile())
            .redirectErrorStream(true);
        Map<String, String> processEnvironment = builder.environment();
        environment.forEach((key, value) -> {
            if (value != null) {
                processEnvironment.put(key, value);
            }
        });

        log.debug("Executing {} in {}", command, directory);
        List<String> output = new ArrayList<>();
        try {
            Process process = builder.start();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.add(line);
                    lineListener.accept(line);
                }
            }
            int exitCode = process.waitFor();
            return new CommandResult(exitCode, output);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to run " + command + " in " + directory, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running " + command + " in " + directory, e);
        }
    }
}
