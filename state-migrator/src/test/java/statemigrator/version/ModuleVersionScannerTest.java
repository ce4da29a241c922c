package statemigrator.version;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ModuleVersionScanner")
class ModuleVersionScannerTest {

    private static final Path FILE = Path.of("main.tf");

    @Test
    @DisplayName("should read registry sources with a version attribute")
    void shouldReadRegistrySources() {
        String text = """
                module "factory" {
                  source  = "app.terraform.io/acme/your-github-project-factory/github"
                  version = "~> 15.1.0"
                }
                """;

        List<ModulePin> pins = ModuleVersionScanner.scan(FILE, text);

        assertThat(pins).singleElement().satisfies(pin -> {
            assertThat(pin.instance()).isEqualTo("factory");
            assertThat(pin.moduleName()).isEqualTo("your-github-project-factory");
            assertThat(pin.version()).isEqualTo("15.1.0");
            assertThat(pin.file()).isEqualTo(FILE);
        });
    }

    @Test
    @DisplayName("should read the ref of git sources and strip the provider prefix")
    void shouldReadGitRefs() {
        String text = """
                module "vpc" {
                  source = "git::https://github.com/acme/terraform-aws-vpc?ref=v2.3.1"
                }
                """;

        ModulePin pin = ModuleVersionScanner.scan(FILE, text).get(0);

        assertThat(pin.moduleName()).isEqualTo("vpc");
        assertThat(pin.sourceName()).isEqualTo("terraform-aws-vpc");
        assertThat(pin.version()).isEqualTo("v2.3.1");
        assertThat(pin.isPinned()).isTrue();
    }

    @Test
    @DisplayName("should name submodule sources after the parent module")
    void shouldIgnoreSubdirectoryWhenNaming() {
        String text = """
                module "subnets" {
                  source  = "app.terraform.io/acme/vpc/aws//modules/subnets"
                  version = "1.2.0"
                }
                module "peering" {
                  source = "git::https://github.com/acme/terraform-aws-vpc//modules/peering?ref=v1.2.0"
                }
                """;

        List<ModulePin> pins = ModuleVersionScanner.scan(FILE, text);

        assertThat(pins).extracting(ModulePin::moduleName).containsExactly("vpc", "vpc");
        assertThat(pins.get(1).sourceName()).isEqualTo("terraform-aws-vpc");
        assertThat(pins.get(1).version()).isEqualTo("v1.2.0");
    }

    @Test
    @DisplayName("should treat a branch ref as unpinned")
    void shouldTreatBranchRefAsUnpinned() {
        String text = "module \"dns\" {\n  source = \"git::https://github.com/acme/terraform-aws-dns?ref=main\"\n}\n";

        assertThat(ModuleVersionScanner.scan(FILE, text).get(0).isPinned()).isFalse();
    }

    @Test
    @DisplayName("should ignore local modules")
    void shouldIgnoreLocalModules() {
        String text = "module \"local\" {\n  source = \"./modules/local\"\n}\n";

        assertThat(ModuleVersionScanner.scan(FILE, text)).isEmpty();
    }
}
