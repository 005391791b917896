package org.terragraph.wrapper.config;

import java.util.Optional;

/**
 * Source of secret parameters referenced by {@code ssm} environment variables.
 */
@FunctionalInterface
public interface ParameterStore {

    /**
     * Looks up a parameter.
     *
     * @param path the parameter path, e.g. {@code /team/service/token}.
     * @return the value, or empty if the store has no such parameter.
     */
    Optional<String> get(String path);

    /**
     * A store without parameters; every lookup is empty.
     */
    static ParameterStore empty() {
        return path -> Optional.empty();
    }
}
