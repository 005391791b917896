package org.terragraph.cli.config;

import java.io.File;
import java.net.URISyntaxException;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.List;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the application configuration of the {@code terragraph} CLI.
 * <p>
 * Layers, highest priority first:
 * <ol>
 *   <li>Java system properties ({@code -Dterragraph.tool.binary=tofu})</li>
 *   <li>Environment variables</li>
 *   <li>The configuration file found by {@link #resolve(File, ConfigMessageHandler)}</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved after all layers are composed, so overriding a referenced value also changes
 * every value derived from it.
 */
public final class ConfigLoader {

    private static final String CONFIG_DIR = "config";
    private static final String CONFIG_FILE_NAME = "terragraph.conf";

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is being located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * A place a configuration file may come from. Explicitly named files must exist.
     */
    private record Candidate(File file, String origin, boolean explicit) {
    }

    /**
     * Finds and loads the configuration file. The first match wins:
     * <ol>
     *   <li>{@code explicitConfigFile}, from the {@code --config} option</li>
     *   <li>{@code -Dconfig.file}</li>
     *   <li>{@code config/terragraph.conf} in the working directory</li>
     *   <li>{@code config/terragraph.conf} in the installation directory, next to {@code lib/}</li>
     *   <li>classpath defaults only</li>
     * </ol>
     *
     * @param explicitConfigFile file given on the command line, or {@code null}.
     * @param handler            receives one message naming the source that was used.
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or resolved.
     */
    public static Config resolve(File explicitConfigFile, ConfigMessageHandler handler) {
        for (Candidate candidate : candidates(explicitConfigFile)) {
            File file = candidate.file().getAbsoluteFile();
            if (file.exists()) {
                handler.log(MessageLevel.INFO, "Using configuration file from " + candidate.origin() + ": " + file);
                return loadFromFile(file);
            }
            if (candidate.explicit()) {
                throw new IllegalArgumentException("Configuration file not found: " + file);
            }
        }
        handler.log(MessageLevel.INFO, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME + " found, using built-in defaults");
        return loadDefaults();
    }

    private static List<Candidate> candidates(File explicitConfigFile) {
        List<Candidate> candidates = new ArrayList<>();
        if (explicitConfigFile != null) {
            candidates.add(new Candidate(explicitConfigFile, "--config", true));
        }
        String property = System.getProperty("config.file");
        if (property != null && !property.isBlank()) {
            candidates.add(new Candidate(new File(property), "-Dconfig.file", true));
        }
        candidates.add(new Candidate(new File(CONFIG_DIR, CONFIG_FILE_NAME), "working directory", false));
        File installationHome = installationHome();
        if (installationHome != null) {
            candidates.add(new Candidate(new File(new File(installationHome, CONFIG_DIR), CONFIG_FILE_NAME),
                "installation directory", false));
        }
        return candidates;
    }

    static Config loadFromFile(File configFile) {
        return compose(ConfigFactory.parseFile(configFile));
    }

    static Config loadDefaults() {
        return compose(ConfigFactory.empty());
    }

    private static Config compose(Config fileLayer) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(fileLayer)
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * The parent of the directory holding the running jar ({@code APP_HOME/lib/terragraph.jar}).
     *
     * @return the directory, or {@code null} when not running from a jar.
     */
    private static File installationHome() {
        CodeSource source = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (source == null || source.getLocation() == null) {
            return null;
        }
        File jar;
        try {
            jar = new File(source.getLocation().toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
        if (!jar.isFile() || jar.getParentFile() == null) {
            return null;
        }
        return jar.getParentFile().getParentFile();
    }
}
