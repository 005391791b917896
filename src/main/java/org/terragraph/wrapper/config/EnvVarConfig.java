package org.terragraph.wrapper.config;

import java.util.Objects;

/**
 * Declaration of one environment variable in a {@code .tf_wrapper} file.
 *
 * @param source where the value comes from.
 * @param value  literal value for {@link EnvVarSource#TEXT}.
 * @param path   parameter path for {@link EnvVarSource#SSM}.
 * @param name   process variable name for {@link EnvVarSource#PASSTHROUGH}; defaults to the declared key.
 */
public record EnvVarConfig(EnvVarSource source, String value, String path, String name) {

    public EnvVarConfig {
        Objects.requireNonNull(source, "source");
        if (source == EnvVarSource.TEXT && value == null) {
            throw new IllegalArgumentException("text envvar requires a value");
        }
        if (source == EnvVarSource.SSM && path == null) {
            throw new IllegalArgumentException("ssm envvar requires a path");
        }
    }

    public static EnvVarConfig text(String value) {
        return new EnvVarConfig(EnvVarSource.TEXT, value, null, null);
    }

    public static EnvVarConfig ssm(String path) {
        return new EnvVarConfig(EnvVarSource.SSM, null, path, null);
    }

    public static EnvVarConfig passthrough(String name) {
        return new EnvVarConfig(EnvVarSource.PASSTHROUGH, null, null, name);
    }
}
