package org.terragraph.wrapper.config;

import java.nio.file.Path;
import java.util.Optional;

import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigValue;

/**
 * Parameter store backed by a local HOCON file whose top-level keys are parameter paths:
 * <pre>
 *   "/team/service/token" = "s3cr3t"
 * </pre>
 */
public class FileParameterStore implements ParameterStore {

    private final ConfigObject parameters;

    /**
     * @param file the parameter file.
     * @throws com.typesafe.config.ConfigException if the file is missing or malformed.
     */
    public FileParameterStore(Path file) {
        this.parameters = ConfigFactory.parseFile(file.toFile(), ConfigParseOptions.defaults().setAllowMissing(false))
            .root();
    }

    @Override
    public Optional<String> get(String path) {
        ConfigValue value = parameters.get(path);
        return value == null ? Optional.empty() : Optional.of(String.valueOf(value.unwrapped()));
    }
}
