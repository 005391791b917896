package org.terragraph.engine.build;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.terragraph.engine.graph.CyclicDependencyException;
import org.terragraph.engine.graph.DependencyGraph;
import org.terragraph.engine.graph.NoDependencyException;
import org.terragraph.engine.scan.DirectoryScanner;
import org.terragraph.junit.extensions.logging.AllowLog;
import org.terragraph.junit.extensions.logging.LogLevel;
import org.terragraph.junit.extensions.logging.LogWatchExtension;
import org.terragraph.wrapper.config.WrapperConfigResolver;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
@AllowLog(level = LogLevel.INFO, loggerPattern = ".*GraphBuilder")
class GraphBuilderTest {

    @TempDir
    Path tempDir;

    private Path root;
    private GraphBuilder builder;

    @BeforeEach
    void setUp() throws IOException {
        root = tempDir.toRealPath();
        builder = new GraphBuilder(new DirectoryScanner(), new WrapperConfigResolver());
    }

    @Test
    void declaredDependenciesBecomeEdges() throws IOException {
        Path vpc = terraformDirectory("vpc", "depends_on = []");
        Path db = terraformDirectory("db", "depends_on = [\"../vpc\"]");
        Path app = terraformDirectory("app", "depends_on = [\"../vpc\", \"../db\"]");
        Path standalone = terraformDirectory("standalone", null);

        GraphBuildResult result = builder.build(root);

        DependencyGraph graph = result.graph();
        assertThat(result.metadataPresent()).isTrue();
        assertThat(graph.paths()).containsExactlyInAnyOrder(vpc, db, app);
        assertThat(graph.hasEdge(vpc, db)).isTrue();
        assertThat(graph.hasEdge(vpc, app)).isTrue();
        assertThat(graph.hasEdge(db, app)).isTrue();
        assertThat(graph.predecessors(vpc)).isEmpty();
        assertThat(result.postSet()).containsExactly(standalone);
    }

    @Test
    void missingDependencyIsNamed() throws IOException {
        Path app = terraformDirectory("app", "depends_on = [\"../Z\"]");

        assertThatThrownBy(() -> builder.build(root))
            .isInstanceOfSatisfying(NoDependencyException.class, e -> {
                assertThat(e.getMissingDirectory()).isEqualTo(root.resolve("Z"));
                assertThat(e.getDeclaringDirectory()).isEqualTo(app);
            })
            .hasMessageContaining("Z");
    }

    @Test
    void dependencyWithoutSourceFilesIsMissing() throws IOException {
        Files.createDirectories(root.resolve("empty"));
        terraformDirectory("app", "depends_on = [\"../empty\"]");

        assertThatThrownBy(() -> builder.build(root)).isInstanceOf(NoDependencyException.class);
    }

    @Test
    void cyclicDeclarationsAreRejected() throws IOException {
        terraformDirectory("a", "depends_on = [\"../b\"]");
        terraformDirectory("b", "depends_on = [\"../c\"]");
        terraformDirectory("c", "depends_on = [\"../a\"]");

        assertThatThrownBy(() -> builder.build(root))
            .isInstanceOfSatisfying(CyclicDependencyException.class,
                e -> assertThat(e.getCycle()).contains(root.resolve("a"), root.resolve("b"), root.resolve("c")));
    }

    @Test
    void withoutAnyDeclarationEverythingIsUnordered() throws IOException {
        Path a = terraformDirectory("a", null);
        Path b = terraformDirectory("b", "configure_backend = false");
        Path link = Files.createSymbolicLink(root.resolve("a-link"), a);

        GraphBuildResult result = builder.build(root);

        assertThat(result.metadataPresent()).isFalse();
        assertThat(result.graph().isEmpty()).isTrue();
        assertThat(result.postSet()).containsExactly(a, b, link);
        assertThat(result.symlinks()).isEmpty();
    }

    @Test
    void dependsOnIsNotInherited() throws IOException {
        Files.writeString(root.resolve(WrapperConfigResolver.FILE_NAME), "depends_on = [\"vpc\"]\n");
        Path vpc = terraformDirectory("vpc", "depends_on = []");
        Path app = terraformDirectory("app", null);

        GraphBuildResult result = builder.build(root);

        assertThat(result.graph().paths()).containsExactly(vpc);
        assertThat(result.postSet()).containsExactly(app);
    }

    @Test
    void symlinksAreSplitByTheirTarget() throws IOException {
        Path vpc = terraformDirectory("vpc", "depends_on = []");
        Path loose = terraformDirectory("loose", null);
        Path vpcLink = Files.createSymbolicLink(root.resolve("vpc-link"), vpc);
        Path looseLink = Files.createSymbolicLink(root.resolve("loose-link"), loose);

        GraphBuildResult result = builder.build(root);

        assertThat(result.symlinks()).containsOnlyKeys(vpcLink).containsEntry(vpcLink, vpc);
        assertThat(result.postSet()).containsExactly(loose, looseLink);
    }

    @Test
    void dependencyOutsideTheScanRootIsNotScheduled() throws IOException {
        Path shared = terraformDirectory("shared", null);
        Path stack = terraformDirectory("stacks/app", "depends_on = [\"../../shared\"]");

        GraphBuildResult result = builder.build(root.resolve("stacks"));

        assertThat(result.graph().paths()).containsExactly(stack);
        assertThat(result.graph().contains(shared)).isFalse();
    }

    private Path terraformDirectory(String relative, String wrapper) throws IOException {
        Path directory = Files.createDirectories(root.resolve(relative));
        Files.writeString(directory.resolve("main.tf"), "resource \"null_resource\" \"this\" {}\n");
        if (wrapper != null) {
            Files.writeString(directory.resolve(WrapperConfigResolver.FILE_NAME), wrapper + "\n");
        }
        return directory;
    }
}
