package org.terragraph.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.terragraph.wrapper.config.WrapperConfigResolver;

import com.typesafe.config.ConfigFactory;

@Tag("integration")
class PlanCheckCommandTest {

    @TempDir
    Path tempDir;

    private Path root;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectories(tempDir.resolve("repo")).toRealPath();
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("terragraph.tool.binary");
        System.clearProperty("terragraph.tool.version-check");
        ConfigFactory.invalidateCaches();
    }

    @Test
    void testHelpOutput() {
        CliHarness cli = new CliHarness();

        cli.execute("plan-check", "--help");

        assertThat(cli.out.toString()).contains("--skip-iam", "--modified-only", "--print-diff", "--output-dir");
    }

    @Test
    void emptyTreeHasNothingToCheck() {
        CliHarness cli = new CliHarness();

        int exitCode = cli.execute("plan-check", root.toString());

        assertThat(exitCode).isZero();
        assertThat(cli.out.toString()).contains("No directories to check");
    }

    @Test
    void plansEveryParticipatingDirectory() throws IOException {
        System.setProperty("terragraph.tool.binary", "true");
        System.setProperty("terragraph.tool.version-check", "false");
        terraformDirectory("vpc");
        Path skipped = terraformDirectory("sandbox");
        Files.writeString(skipped.resolve(WrapperConfigResolver.FILE_NAME), "plan_check = false\n");

        CliHarness cli = new CliHarness();
        int exitCode = cli.execute("plan-check", root.toString(), "--print-diff");

        assertThat(exitCode).describedAs(cli.describe()).isZero();
        assertThat(cli.out.toString()).contains("==> " + root.resolve("vpc"), "Succeeded:   1")
            .doesNotContain("==> " + skipped);
    }

    @Test
    void failingPlanSetsTheFailureBit() throws IOException {
        System.setProperty("terragraph.tool.binary", "false");
        System.setProperty("terragraph.tool.version-check", "false");
        terraformDirectory("vpc");

        CliHarness cli = new CliHarness();
        int exitCode = cli.execute("plan-check", root.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(cli.out.toString()).contains("Failed:", "  " + root.resolve("vpc"));
    }

    @Test
    void iamChangesSetTheIamBit() throws IOException {
        useFakeTerraform();
        terraformDirectory("vpc");
        Files.writeString(terraformDirectory("roles").resolve("iam.tf"), "");

        CliHarness cli = new CliHarness();
        int exitCode = cli.execute("plan-check", root.toString());

        assertThat(exitCode).describedAs(cli.describe()).isEqualTo(2);
        assertThat(cli.out.toString()).contains("IAM changes found in:", "  " + root.resolve("roles"));
    }

    @Test
    void iamChangesAndFailuresCombine() throws IOException {
        useFakeTerraform();
        Files.writeString(terraformDirectory("roles").resolve("iam.tf"), "");
        Files.writeString(terraformDirectory("broken").resolve("broken.tf"), "");

        CliHarness cli = new CliHarness();
        int exitCode = cli.execute("plan-check", root.toString());

        assertThat(exitCode).describedAs(cli.describe()).isEqualTo(3);
    }

    @Test
    void skipIamIgnoresIamChanges() throws IOException {
        useFakeTerraform();
        Files.writeString(terraformDirectory("roles").resolve("iam.tf"), "");

        CliHarness cli = new CliHarness();
        int exitCode = cli.execute("plan-check", root.toString(), "--skip-iam");

        assertThat(exitCode).describedAs(cli.describe()).isZero();
        assertThat(cli.out.toString()).doesNotContain("IAM changes found in:");
    }

    @Test
    void snapshotsMirrorTheTreeBelowASymlinkedRoot() throws IOException {
        useFakeTerraform();
        terraformDirectory("vpc");
        Path link = Files.createSymbolicLink(tempDir.resolve("link"), root);
        Path outputDir = tempDir.resolve("snapshots");

        CliHarness cli = new CliHarness();
        int exitCode = cli.execute("plan-check", link.toString(), "--output-dir", outputDir.toString());

        assertThat(exitCode).describedAs(cli.describe()).isZero();
        assertThat(outputDir.resolve("vpc").resolve("plan.json")).isRegularFile();
        assertThat(outputDir.resolve("vpc").resolve("plan.tfplan")).isRegularFile();
    }

    /**
     * Installs a shell script standing in for terraform: {@code plan} fails in directories holding
     * {@code broken.tf} and reports an IAM role change (exit 2) in directories holding {@code iam.tf}.
     */
    private void useFakeTerraform() throws IOException {
        Path bin = Files.createDirectories(tempDir.resolve("bin"));
        Path tool = bin.resolve("terraform");
        Files.writeString(tool, String.join("\n",
            "#!/bin/sh",
            "case \"$1\" in",
            "  show) echo '{\"format_version\": \"1.0\"}' ;;",
            "  plan)",
            "    for arg in \"$@\"; do",
            "      case \"$arg\" in -out=*) : > \"${arg#-out=}\" ;; esac",
            "    done",
            "    if [ -f broken.tf ]; then echo 'Error: invalid configuration'; exit 1; fi",
            "    if [ -f iam.tf ]; then echo '  # aws_iam_role.x will be created'; exit 2; fi",
            "    ;;",
            "esac",
            "exit 0",
            ""));
        Files.setPosixFilePermissions(tool, PosixFilePermissions.fromString("rwxr-xr-x"));
        System.setProperty("terragraph.tool.binary", tool.toString());
        System.setProperty("terragraph.tool.version-check", "false");
        ConfigFactory.invalidateCaches();
    }

    private Path terraformDirectory(String relative) throws IOException {
        Path directory = Files.createDirectories(root.resolve(relative));
        Files.writeString(directory.resolve("main.tf"), "resource \"null_resource\" \"x\" {}\n");
        return directory;
    }
}
