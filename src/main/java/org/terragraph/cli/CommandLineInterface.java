package org.terragraph.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terragraph.cli.commands.BackendCheckCommand;
import org.terragraph.cli.commands.GraphApplyCommand;
import org.terragraph.cli.commands.PipelineCheckCommand;
import org.terragraph.cli.commands.PlanCheckCommand;
import org.terragraph.cli.commands.ToolCommand;
import org.terragraph.cli.config.ConfigLoader;
import org.terragraph.cli.config.LoggingConfigurator;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "terragraph",
    mixinStandardHelpOptions = true,
    version = "terragraph 1.0",
    description = "Dependency-aware, parallel runner for Terraform configuration trees",
    subcommands = {
        GraphApplyCommand.class,
        PlanCheckCommand.class,
        BackendCheckCommand.class,
        PipelineCheckCommand.class,
        ToolCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Directories declare their dependencies with depends_on in a .tf_wrapper file:",
        "",
        "    depends_on = [\"../vpc\", \"../iam\"]"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    static final String LOGGING_FORMAT_PROPERTY = "terragraph.logging.format";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/terragraph.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("terragraph");
        // tool arguments such as -out=plan.tfplan must reach Terraform untouched
        commandLine.getSubcommands().get("tf").setStopAtPositional(true);
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.debug(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Failed to load or parse configuration: " + e.getMessage());
        }

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty(LOGGING_FORMAT_PROPERTY, "PLAIN".equalsIgnoreCase(format) ? "STDERR_PLAIN" : "STDERR");
            reconfigureLogback(logger);
        }
        try {
            LoggingConfigurator.configure(config);
        } catch (IllegalArgumentException | ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }

        initialized = true;
    }

    private void reconfigureLogback(Logger logger) {
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            spec.commandLine().getErr().println("Failed to reconfigure Logback: " + e.getMessage());
        }
        logger.debug("Logging reconfigured with format {}", System.getProperty(LOGGING_FORMAT_PROPERTY));
    }

    /**
     * @return the application configuration, loaded on first access.
     * @throws CommandLine.ParameterException if the configuration cannot be loaded.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
