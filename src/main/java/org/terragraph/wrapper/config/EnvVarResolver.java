package org.terragraph.wrapper.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns the envvar declarations of a {@link WrapperConfig} into concrete values.
 * <p>
 * Values in {@code resolved_envvars} are taken as-is; declared variables override them.
 */
public class EnvVarResolver {

    private final ParameterStore parameterStore;
    private final Map<String, String> processEnvironment;

    public EnvVarResolver(ParameterStore parameterStore) {
        this(parameterStore, System.getenv());
    }

    public EnvVarResolver(ParameterStore parameterStore, Map<String, String> processEnvironment) {
        this.parameterStore = parameterStore;
        this.processEnvironment = Map.copyOf(processEnvironment);
    }

    /**
     * Resolves every variable of {@code config}.
     *
     * @throws EnvVarResolutionException if a passthrough variable is not set or a parameter does not exist.
     */
    public Map<String, String> resolve(WrapperConfig config) {
        Map<String, String> result = new LinkedHashMap<>(config.resolvedEnvvars());
        config.envvars().forEach((key, declaration) -> result.put(key, resolveOne(key, declaration)));
        return result;
    }

    private String resolveOne(String key, EnvVarConfig declaration) {
        return switch (declaration.source()) {
            case TEXT -> declaration.value();
            case PASSTHROUGH -> {
                String name = declaration.name() != null ? declaration.name() : key;
                String value = processEnvironment.get(name);
                if (value == null) {
                    throw new EnvVarResolutionException(key, "process variable " + name + " is not set");
                }
                yield value;
            }
            case SSM -> parameterStore.get(declaration.path())
                .orElseThrow(() -> new EnvVarResolutionException(key, "parameter " + declaration.path() + " not found"));
        };
    }
}
