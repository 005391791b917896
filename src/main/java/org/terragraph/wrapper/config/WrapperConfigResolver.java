package org.terragraph.wrapper.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigSyntax;

/**
 * Discovers the {@code .tf_wrapper} files that apply to a directory and merges them with
 * {@link WrapperConfig#merge(List)}.
 * <p>
 * Files are collected from the directory itself up to the filesystem root; the nearest file wins.
 * Results are cached per directory, so a resolver instance should live for one run only.
 */
public class WrapperConfigResolver {

    private static final Logger log = LoggerFactory.getLogger(WrapperConfigResolver.class);

    public static final String FILE_NAME = ".tf_wrapper";

    private static final ConfigParseOptions PARSE_OPTIONS = ConfigParseOptions.defaults()
        .setSyntax(ConfigSyntax.CONF)
        .setAllowMissing(false);

    private final Map<Path, Config> parsedFiles = new ConcurrentHashMap<>();
    private final Map<Path, WrapperConfig> resolved = new ConcurrentHashMap<>();

    /**
     * Resolves the merged configuration of {@code directory}.
     *
     * @param directory absolute directory path.
     * @return the merged configuration; {@link WrapperConfig#defaults()} values where nothing is set.
     * @throws com.typesafe.config.ConfigException if a wrapper file cannot be parsed.
     */
    public WrapperConfig resolve(Path directory) {
        Path normalized = directory.toAbsolutePath().normalize();
        return resolved.computeIfAbsent(normalized, this::load);
    }

    private WrapperConfig load(Path directory) {
        List<Config> layers = new ArrayList<>();
        Path own = directory.resolve(FILE_NAME);
        layers.add(Files.isRegularFile(own) ? parse(own) : ConfigFactory.empty());
        for (Path parent = directory.getParent(); parent != null; parent = parent.getParent()) {
            Path file = parent.resolve(FILE_NAME);
            if (Files.isRegularFile(file)) {
                layers.add(parse(file));
            }
        }
        log.debug("Resolved {} wrapper layer(s) for {}", layers.size(), directory);
        return WrapperConfig.merge(layers);
    }

    private Config parse(Path file) {
        return parsedFiles.computeIfAbsent(file, f -> ConfigFactory.parseFile(f.toFile(), PARSE_OPTIONS));
    }
}
