package org.terragraph.engine.scan;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag("integration")
class DirectoryScannerTest {

    @TempDir
    Path tempDir;

    private Path root;

    @BeforeEach
    void setUp() throws IOException {
        root = tempDir.toRealPath();
    }

    @Test
    void findsDirectoriesWithSourceFilesOnly() throws IOException {
        Path vpc = terraformDirectory(root.resolve("config/vpc"));
        Path app = terraformDirectory(root.resolve("config/app"));
        Files.createDirectories(root.resolve("config/docs"));
        Files.writeString(root.resolve("config/docs/README.md"), "docs");

        ScanResult result = new DirectoryScanner().scan(root);

        assertThat(result.regularDirectories()).containsExactlyInAnyOrder(vpc, app);
        assertThat(result.symlinks()).isEmpty();
    }

    @Test
    void skipsToolAndVcsDirectories() throws IOException {
        Path app = terraformDirectory(root.resolve("app"));
        terraformDirectory(app.resolve(".terraform/modules/vpc"));
        terraformDirectory(root.resolve(".git/hooks"));

        ScanResult result = new DirectoryScanner().scan(root);

        assertThat(result.regularDirectories()).containsExactly(app);
    }

    @Test
    void classifiesSymlinkedDirectories() throws IOException {
        Path shared = terraformDirectory(root.resolve("shared"));
        Files.createDirectories(root.resolve("envs"));
        Path link = Files.createSymbolicLink(root.resolve("envs/shared"), shared);

        ScanResult result = new DirectoryScanner().scan(root);

        assertThat(result.regularDirectories()).containsExactly(shared);
        assertThat(result.symlinks()).containsEntry(link, shared).hasSize(1);
    }

    @Test
    void emptyTreeProducesEmptyResult() {
        ScanResult result = new DirectoryScanner().scan(root);

        assertThat(result.isEmpty()).isTrue();
    }

    @Test
    void hasSourceFilesIgnoresNestedFiles() throws IOException {
        terraformDirectory(root.resolve("parent/child"));

        assertThat(DirectoryScanner.hasSourceFiles(root.resolve("parent"))).isFalse();
        assertThat(DirectoryScanner.hasSourceFiles(root.resolve("parent/child"))).isTrue();
        assertThat(DirectoryScanner.hasSourceFiles(root.resolve("missing"))).isFalse();
    }

    private static Path terraformDirectory(Path directory) throws IOException {
        Files.createDirectories(directory);
        Files.writeString(directory.resolve("main.tf"), "# empty\n");
        return directory;
    }
}
