package org.terragraph.wrapper.backend;

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
import org.terragraph.engine.scan.DirectoryScanner;
import org.terragraph.wrapper.config.WrapperConfigResolver;

@Tag("integration")
class BackendCheckerTest {

    private static final String S3_BACKEND = """
        terraform {
          backend "s3" {
            bucket = "state"
          }
        }
        """;

    @TempDir
    Path tempDir;

    private Path root;
    private BackendChecker checker;

    @BeforeEach
    void setUp() throws IOException {
        root = tempDir.toRealPath();
        checker = new BackendChecker(new DirectoryScanner(), new WrapperConfigResolver());
    }

    @Test
    void reportsDirectoriesWithoutBackend() throws IOException {
        directory("config/vpc", "backend.tf", S3_BACKEND);
        Path app = directory("config/app", "main.tf", "resource \"null_resource\" \"x\" {}\n");

        assertThat(checker.findMissingBackends(List.of(root.resolve("config")))).containsExactly(app);
    }

    @Test
    void waiverFromEitherFlagSkipsTheDirectory() throws IOException {
        Path noCheck = directory("config/local", "main.tf", "");
        Files.writeString(noCheck.resolve(WrapperConfigResolver.FILE_NAME), "backend_check = false\n");
        Path noBackend = directory("config/module-test", "main.tf", "");
        Files.writeString(noBackend.resolve(WrapperConfigResolver.FILE_NAME), "configure_backend = false\n");

        assertThat(checker.findMissingBackends(List.of(root.resolve("config")))).isEmpty();
    }

    @Test
    void readsBackendTypeFromAnySourceFile() throws IOException {
        Path vpc = directory("config/vpc", "main.tf", "resource \"null_resource\" \"x\" {}\n");
        Files.writeString(vpc.resolve("state.tf"), "terraform {\n  backend \"azurerm\" {}\n}\n");

        assertThat(BackendChecker.backendType(vpc)).contains("azurerm");
        assertThat(BackendChecker.backendType(directory("config/app", "main.tf", "# backend \"s3\"\n"))).isEmpty();
    }

    @Test
    void rejectsPathThatIsNotADirectory() {
        assertThatThrownBy(() -> checker.findMissingBackends(List.of(root.resolve("missing"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("missing");
    }

    private Path directory(String relative, String file, String content) throws IOException {
        Path directory = Files.createDirectories(root.resolve(relative));
        Files.writeString(directory.resolve(file), content);
        return directory;
    }
}
