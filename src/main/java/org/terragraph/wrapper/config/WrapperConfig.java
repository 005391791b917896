package org.terragraph.wrapper.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;

/**
 * Typed view of the merged {@code .tf_wrapper} configuration for one directory.
 * <p>
 * Wrapper files are HOCON (JSON is accepted too). Recognized keys:
 * <pre>
 *   configure_backend = true        # run "init" with backend configuration
 *   pipeline_check    = true        # directory must be listed in a pipeline manifest
 *   plan_check        = true        # directory takes part in plan-check / change impact
 *   backend_check     = true        # directory must declare a remote-state backend
 *   depends_on        = ["../vpc"]  # declared dependencies, never inherited
 *   envvars {
 *     REGION  { source = text, value = "us-west-2" }
 *     TOKEN   { source = ssm, path = "/team/token" }
 *     HOME    { source = passthrough }
 *   }
 *   resolved_envvars { ALREADY = "resolved" }
 * </pre>
 *
 * @param configureBackend whether the tool is initialized with a backend.
 * @param pipelineCheck    whether the directory must appear in a pipeline manifest.
 * @param planCheck        whether plan-check and change-impact analysis include the directory.
 * @param backendCheck     whether the directory must declare a backend.
 * @param envvars          declared environment variables, nearest file wins per key.
 * @param resolvedEnvvars  variables whose values are already known.
 * @param dependsOn        declared dependencies of this directory, or {@code null} if it declares none.
 */
public record WrapperConfig(
    boolean configureBackend,
    boolean pipelineCheck,
    boolean planCheck,
    boolean backendCheck,
    Map<String, EnvVarConfig> envvars,
    Map<String, String> resolvedEnvvars,
    List<String> dependsOn
) {

    static final String CONFIGURE_BACKEND = "configure_backend";
    static final String PIPELINE_CHECK = "pipeline_check";
    static final String PLAN_CHECK = "plan_check";
    static final String BACKEND_CHECK = "backend_check";
    static final String ENVVARS = "envvars";
    static final String RESOLVED_ENVVARS = "resolved_envvars";
    static final String DEPENDS_ON = "depends_on";

    private static final Config DEFAULTS = ConfigFactory.parseMap(Map.of(
        CONFIGURE_BACKEND, true,
        PIPELINE_CHECK, true,
        PLAN_CHECK, true,
        BACKEND_CHECK, true
    ));

    public WrapperConfig {
        envvars = Map.copyOf(envvars);
        resolvedEnvvars = Map.copyOf(resolvedEnvvars);
        dependsOn = dependsOn == null ? null : List.copyOf(dependsOn);
    }

    /**
     * Configuration of a directory without any wrapper file in its hierarchy.
     */
    public static WrapperConfig defaults() {
        return merge(List.of());
    }

    /**
     * @return {@code true} if the directory itself declares {@code depends_on} (possibly empty).
     */
    public boolean declaresDependencies() {
        return dependsOn != null;
    }

    /**
     * Merges wrapper files into one configuration.
     * <p>
     * {@code layers} are ordered nearest directory first: the first element is the directory's own file
     * (pass {@link ConfigFactory#empty()} when it has none), followed by the files of each ancestor.
     * A key set in a nearer file overrides the same key further up; {@code envvars} and
     * {@code resolved_envvars} are merged per variable. {@code depends_on} is only read from the first
     * layer. This function is pure: it reads nothing but its argument.
     *
     * @param layers parsed wrapper files, nearest first.
     * @return the merged configuration.
     * @throws ConfigException if a value has the wrong type.
     */
    public static WrapperConfig merge(List<Config> layers) {
        Config merged = ConfigFactory.empty();
        for (int i = 0; i < layers.size(); i++) {
            Config layer = layers.get(i);
            merged = merged.withFallback(i == 0 ? layer : layer.withoutPath(DEPENDS_ON));
        }
        merged = merged.withFallback(DEFAULTS).resolve();

        return new WrapperConfig(
            merged.getBoolean(CONFIGURE_BACKEND),
            merged.getBoolean(PIPELINE_CHECK),
            merged.getBoolean(PLAN_CHECK),
            merged.getBoolean(BACKEND_CHECK),
            parseEnvvars(merged),
            parseResolvedEnvvars(merged),
            merged.hasPath(DEPENDS_ON) ? merged.getStringList(DEPENDS_ON) : null
        );
    }

    private static Map<String, EnvVarConfig> parseEnvvars(Config merged) {
        Map<String, EnvVarConfig> result = new LinkedHashMap<>();
        if (!merged.hasPath(ENVVARS)) {
            return result;
        }
        ConfigObject object = merged.getObject(ENVVARS);
        for (String key : object.keySet()) {
            ConfigValue value = object.get(key);
            if (value.valueType() != ConfigValueType.OBJECT) {
                throw new ConfigException.WrongType(value.origin(), ENVVARS + "." + key, "object",
                    value.valueType().name());
            }
            Config entry = ((ConfigObject) value).toConfig();
            try {
                result.put(key, new EnvVarConfig(
                    EnvVarSource.fromName(entry.getString("source")),
                    entry.hasPath("value") ? entry.getString("value") : null,
                    entry.hasPath("path") ? entry.getString("path") : null,
                    entry.hasPath("name") ? entry.getString("name") : null
                ));
            } catch (IllegalArgumentException e) {
                throw new ConfigException.BadValue(value.origin(), ENVVARS + "." + key, e.getMessage(), e);
            }
        }
        return result;
    }

    private static Map<String, String> parseResolvedEnvvars(Config merged) {
        Map<String, String> result = new LinkedHashMap<>();
        if (!merged.hasPath(RESOLVED_ENVVARS)) {
            return result;
        }
        ConfigObject object = merged.getObject(RESOLVED_ENVVARS);
        for (String key : object.keySet()) {
            ConfigValue value = object.get(key);
            if (value.valueType() != ConfigValueType.NULL) {
                result.put(key, String.valueOf(value.unwrapped()));
            }
        }
        return result;
    }
}
