package org.terragraph.engine.impact;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class SourceReferenceScannerTest {

    @Test
    void findsLocalModuleSourcesOnly() {
        String content = """
            module "vpc" {
              source = "../modules/vpc"
              cidr   = "10.0.0.0/16"
            }

            module "registry" {
              source  = "terraform-aws-modules/vpc/aws"
              version = "5.0.0"
            }

            module "local" {
              name   = "x"
              source = "./nested"
            }
            """;

        assertThat(SourceReferenceScanner.moduleSources(content)).containsExactly("../modules/vpc", "./nested");
    }

    @Test
    void ignoresCommentedOutModules() {
        String content = """
            # module "old" {
            #   source = "../modules/old"
            # }
            // module "older" { source = "../modules/older" }
            module "kept" {
              source = "../modules/kept" # pinned
            }
            """;

        assertThat(SourceReferenceScanner.moduleSources(content)).containsExactly("../modules/kept");
    }

    @Test
    void findsPathModuleRelativeFileFunctionArguments() {
        String content = """
            locals {
              policy   = file("${path.module}/policy.json")
              userdata = templatefile("${path.module}/templates/init.sh.tpl", { name = "x" })
              other    = file("/etc/hosts")
              hash     = filesha256("${path.module}/../shared/key.pub")
            }
            """;

        assertThat(SourceReferenceScanner.fileReferences(content))
            .containsExactly("policy.json", "templates/init.sh.tpl", "../shared/key.pub");
    }

    @Test
    void stripCommentsKeepsHashesInsideStrings() {
        String stripped = SourceReferenceScanner.stripComments("name = \"a#b//c\" # trailing\n");

        assertThat(stripped).isEqualTo("name = \"a#b//c\" \n");
    }
}
