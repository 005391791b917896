package org.terragraph.wrapper.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag("integration")
class PipelineManifestTest {

    @TempDir
    Path tempDir;

    private Path root;

    @BeforeEach
    void setUp() throws IOException {
        root = tempDir.toRealPath();
    }

    @Test
    void parsesRowsRelativeToTheBase() throws IOException {
        Path file = Files.writeString(root.resolve("deploy.csv"), """
            # production rollout
            step,directory

            network,config/vpc
            apps, config/app/
            """);

        PipelineManifest manifest = PipelineManifest.load(file, root);

        assertThat(manifest.entries()).containsExactly(
            new ManifestEntry(file, 4, "network", root.resolve("config/vpc")),
            new ManifestEntry(file, 5, "apps", root.resolve("config/app")));
    }

    @Test
    void rejectsMissingHeader() throws IOException {
        Path file = Files.writeString(root.resolve("deploy.csv"), "network,config/vpc\n");

        assertThatThrownBy(() -> PipelineManifest.load(file, root))
            .isInstanceOf(PipelineManifestException.class)
            .hasMessageContaining("expected header");
    }

    @Test
    void rejectsMalformedRow() throws IOException {
        Path file = Files.writeString(root.resolve("deploy.csv"), "step,directory\nnetwork\n");

        assertThatThrownBy(() -> PipelineManifest.load(file, root))
            .isInstanceOf(PipelineManifestException.class)
            .hasMessageContaining("deploy.csv:2");
    }

    @Test
    void loadsEveryCsvInNameOrder() throws IOException {
        Path pipelines = Files.createDirectories(root.resolve("pipelines"));
        Files.writeString(pipelines.resolve("b.csv"), "step,directory\nx,config/b\n");
        Files.writeString(pipelines.resolve("a.csv"), "step,directory\nx,config/a\n");
        Files.writeString(pipelines.resolve("notes.txt"), "ignored");

        List<PipelineManifest> manifests = PipelineManifest.loadAll(pipelines, root);

        assertThat(manifests).extracting(m -> m.file().getFileName().toString()).containsExactly("a.csv", "b.csv");
    }

    @Test
    void missingPipelineDirectoryIsRejected() {
        assertThatThrownBy(() -> PipelineManifest.loadAll(root.resolve("missing"), root))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
