package org.terragraph.wrapper.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.ConfigException;

@Tag("integration")
class WrapperConfigResolverTest {

    @TempDir
    Path tempDir;

    @Test
    void collectsWrapperFilesUpTheHierarchy() throws IOException {
        Path app = Files.createDirectories(tempDir.resolve("config/prod/app"));
        Files.writeString(tempDir.resolve(WrapperConfigResolver.FILE_NAME), "backend_check = false\n");
        Files.writeString(tempDir.resolve("config/prod").resolve(WrapperConfigResolver.FILE_NAME),
            "envvars { STAGE { source = text, value = prod } }\n");
        Files.writeString(app.resolve(WrapperConfigResolver.FILE_NAME), "depends_on = [\"../vpc\"]\n");

        WrapperConfig config = new WrapperConfigResolver().resolve(app);

        assertThat(config.backendCheck()).isFalse();
        assertThat(config.envvars()).containsEntry("STAGE", EnvVarConfig.text("prod"));
        assertThat(config.dependsOn()).containsExactly("../vpc");
    }

    @Test
    void siblingsDoNotShareOwnSettings() throws IOException {
        Path vpc = Files.createDirectories(tempDir.resolve("vpc"));
        Path app = Files.createDirectories(tempDir.resolve("app"));
        Files.writeString(vpc.resolve(WrapperConfigResolver.FILE_NAME), "pipeline_check = false\ndepends_on = []\n");

        WrapperConfigResolver resolver = new WrapperConfigResolver();

        assertThat(resolver.resolve(vpc).pipelineCheck()).isFalse();
        assertThat(resolver.resolve(app).pipelineCheck()).isTrue();
        assertThat(resolver.resolve(app).declaresDependencies()).isFalse();
    }

    @Test
    void resultsAreCachedPerDirectory() throws IOException {
        Path app = Files.createDirectories(tempDir.resolve("app"));
        WrapperConfigResolver resolver = new WrapperConfigResolver();

        WrapperConfig first = resolver.resolve(app);
        Files.writeString(app.resolve(WrapperConfigResolver.FILE_NAME), "plan_check = false\n");

        assertThat(resolver.resolve(app)).isSameAs(first);
        assertThat(resolver.resolve(app.resolve("../app"))).isSameAs(first);
    }

    @Test
    void malformedWrapperFileFails() throws IOException {
        Path app = Files.createDirectories(tempDir.resolve("app"));
        Files.writeString(app.resolve(WrapperConfigResolver.FILE_NAME), "depends_on = [\n");

        assertThatThrownBy(() -> new WrapperConfigResolver().resolve(app))
            .isInstanceOf(ConfigException.class);
    }
}
