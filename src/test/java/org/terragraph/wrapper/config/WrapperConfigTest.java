package org.terragraph.wrapper.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

@Tag("unit")
class WrapperConfigTest {

    @Test
    void defaultsEnableEveryCheck() {
        WrapperConfig config = WrapperConfig.defaults();

        assertThat(config.configureBackend()).isTrue();
        assertThat(config.pipelineCheck()).isTrue();
        assertThat(config.planCheck()).isTrue();
        assertThat(config.backendCheck()).isTrue();
        assertThat(config.envvars()).isEmpty();
        assertThat(config.resolvedEnvvars()).isEmpty();
        assertThat(config.declaresDependencies()).isFalse();
    }

    @Test
    void nearestLayerWins() {
        Config own = parse("plan_check = false");
        Config parent = parse("plan_check = true\nbackend_check = false");
        Config root = parse("backend_check = true\nconfigure_backend = false");

        WrapperConfig config = WrapperConfig.merge(List.of(own, parent, root));

        assertThat(config.planCheck()).isFalse();
        assertThat(config.backendCheck()).isFalse();
        assertThat(config.configureBackend()).isFalse();
        assertThat(config.pipelineCheck()).isTrue();
    }

    @Test
    void envvarsMergePerVariable() {
        Config own = parse("""
            envvars {
              REGION { source = text, value = "eu-west-1" }
            }
            resolved_envvars { STAGE = prod }
            """);
        Config parent = parse("""
            envvars {
              REGION { source = text, value = "us-west-2" }
              TOKEN  { source = ssm, path = "/team/token" }
              HOME   { source = passthrough }
            }
            resolved_envvars { OWNER = platform }
            """);

        WrapperConfig config = WrapperConfig.merge(List.of(own, parent));

        assertThat(config.envvars())
            .containsEntry("REGION", EnvVarConfig.text("eu-west-1"))
            .containsEntry("TOKEN", EnvVarConfig.ssm("/team/token"))
            .containsEntry("HOME", EnvVarConfig.passthrough(null));
        assertThat(config.resolvedEnvvars()).containsEntry("STAGE", "prod").containsEntry("OWNER", "platform");
    }

    @Test
    void nullResolvedVariablesAreNotExported() {
        Config own = parse("resolved_envvars { STAGE = prod, LEGACY = null }");

        WrapperConfig config = WrapperConfig.merge(List.of(own));

        assertThat(config.resolvedEnvvars()).containsOnlyKeys("STAGE");
    }

    @Test
    void dependsOnIsOnlyReadFromTheOwnLayer() {
        Config parent = parse("depends_on = [\"../vpc\"]");

        WrapperConfig inherited = WrapperConfig.merge(List.of(ConfigFactory.empty(), parent));
        WrapperConfig own = WrapperConfig.merge(List.of(parse("depends_on = []"), parent));

        assertThat(inherited.declaresDependencies()).isFalse();
        assertThat(own.declaresDependencies()).isTrue();
        assertThat(own.dependsOn()).isEmpty();
    }

    @Test
    void unknownEnvvarSourceIsRejected() {
        Config own = parse("envvars { X { source = vault, path = \"/x\" } }");

        assertThatThrownBy(() -> WrapperConfig.merge(List.of(own)))
            .isInstanceOf(ConfigException.BadValue.class)
            .hasMessageContaining("vault");
    }

    @Test
    void envvarMustBeAnObject() {
        Config own = parse("envvars { X = plain }");

        assertThatThrownBy(() -> WrapperConfig.merge(List.of(own)))
            .isInstanceOf(ConfigException.WrongType.class);
    }

    @Test
    void textEnvvarRequiresAValue() {
        Config own = parse("envvars { X { source = text } }");

        assertThatThrownBy(() -> WrapperConfig.merge(List.of(own)))
            .isInstanceOf(ConfigException.BadValue.class);
    }

    private static Config parse(String hocon) {
        return ConfigFactory.parseString(hocon);
    }
}
