package org.terragraph.wrapper.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class EnvVarResolverTest {

    private final ParameterStore store = path -> "/team/token".equals(path) ? Optional.of("s3cr3t") : Optional.empty();

    @Test
    void resolvesEverySource() {
        WrapperConfig config = config(Map.of(
            "REGION", EnvVarConfig.text("us-west-2"),
            "TOKEN", EnvVarConfig.ssm("/team/token"),
            "USER", EnvVarConfig.passthrough(null),
            "CI_USER", EnvVarConfig.passthrough("USER")
        ), Map.of());

        Map<String, String> resolved = new EnvVarResolver(store, Map.of("USER", "deploy")).resolve(config);

        assertThat(resolved).containsOnly(
            Map.entry("REGION", "us-west-2"),
            Map.entry("TOKEN", "s3cr3t"),
            Map.entry("USER", "deploy"),
            Map.entry("CI_USER", "deploy"));
    }

    @Test
    void declaredVariablesOverrideResolvedOnes() {
        WrapperConfig config = config(Map.of("STAGE", EnvVarConfig.text("prod")),
            Map.of("STAGE", "dev", "OWNER", "platform"));

        Map<String, String> resolved = new EnvVarResolver(store, Map.of()).resolve(config);

        assertThat(resolved).containsOnly(Map.entry("STAGE", "prod"), Map.entry("OWNER", "platform"));
    }

    @Test
    void missingParameterFailsResolution() {
        WrapperConfig config = config(Map.of("KEY", EnvVarConfig.ssm("/missing")), Map.of());

        assertThatThrownBy(() -> new EnvVarResolver(store, Map.of()).resolve(config))
            .isInstanceOfSatisfying(EnvVarResolutionException.class,
                e -> assertThat(e.getVariable()).isEqualTo("KEY"))
            .hasMessageContaining("/missing");
    }

    @Test
    void unsetPassthroughVariableFailsResolution() {
        WrapperConfig config = config(Map.of("HOME", EnvVarConfig.passthrough(null)), Map.of());

        assertThatThrownBy(() -> new EnvVarResolver(store, Map.of()).resolve(config))
            .isInstanceOf(EnvVarResolutionException.class);
    }

    private static WrapperConfig config(Map<String, EnvVarConfig> envvars, Map<String, String> resolved) {
        return new WrapperConfig(true, true, true, true, envvars, resolved, List.of());
    }
}
