package org.terragraph.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag("integration")
class PipelineCheckCommandTest {

    @TempDir
    Path tempDir;

    private Path root;
    private Path pipelines;

    @BeforeEach
    void setUp() throws IOException {
        root = tempDir.toRealPath();
        pipelines = Files.createDirectories(root.resolve("pipelines"));
        terraformDirectory("config/vpc");
        terraformDirectory("config/app");
    }

    @Test
    void consistentPipelinesPass() throws IOException {
        Files.writeString(pipelines.resolve("deploy.csv"), "step,directory\nnet,config/vpc\napp,config/app\n");

        CliHarness cli = new CliHarness();
        int exitCode = run(cli);

        assertThat(exitCode).describedAs(cli.describe()).isZero();
        assertThat(cli.out.toString()).contains("Pipelines are consistent");
    }

    @Test
    void reportsEveryKindOfProblem() throws IOException {
        Files.writeString(pipelines.resolve("a.csv"), "step,directory\nnet,config/vpc\nold,config/gone\n");
        Files.writeString(pipelines.resolve("b.csv"), "step,directory\nnet,config/vpc\n");

        CliHarness cli = new CliHarness();
        int exitCode = run(cli);

        assertThat(exitCode).isEqualTo(1);
        assertThat(cli.out.toString()).contains(
            "Directories missing from all pipelines:",
            "  " + root.resolve("config/app"),
            "Pipeline entries pointing at missing directories:",
            "Directories listed more than once:",
            "a.csv:2 (net)",
            "b.csv:2 (net)");
    }

    @Test
    void malformedManifestFails() throws IOException {
        Files.writeString(pipelines.resolve("deploy.csv"), "directory\nconfig/vpc\n");

        CliHarness cli = new CliHarness();

        assertThat(run(cli)).isEqualTo(1);
        assertThat(cli.err.toString()).contains("expected header");
    }

    private int run(CliHarness cli) {
        return cli.execute("pipeline-check",
            "--pipeline-dir", pipelines.toString(),
            "--config-dir", root.resolve("config").toString(),
            "--root", root.toString());
    }

    private void terraformDirectory(String relative) throws IOException {
        Path directory = Files.createDirectories(root.resolve(relative));
        Files.writeString(directory.resolve("main.tf"), "resource \"null_resource\" \"x\" {}\n");
    }
}
