package statemigrator.stage.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import statemigrator.config.MissingBackendPolicy;
import statemigrator.exec.ScriptedCommandRunner;
import statemigrator.stage.StageResult;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BackendUpdateStage")
class BackendUpdateStageTest {

    private static final String BACKEND_TF = """
            terraform {
              cloud {
                organization = "acme"
                workspaces {
                  name = "svc"
                }
              }
            }
            """;

    @TempDir
    Path workDir;

    private StageFixture fixture;
    private BackendUpdateStage stage;

    @BeforeEach
    void setUp() {
        fixture = new StageFixture(workDir);
        stage = new BackendUpdateStage(new ScriptedCommandRunner());
    }

    @Test
    @DisplayName("should rewrite the backend and report changed files")
    void shouldRewriteBackend() throws Exception {
        Path file = fixture.cloneWith("backend.tf", BACKEND_TF);
        fixture.cloneWith("variables.tf", "variable \"x\" {}\n");

        StageResult result = fixture.execute(stage);

        assertThat(result.isSucceeded()).isTrue();
        assertThat(result.details()).containsExactly("backend.tf");
        assertThat(StageFixture.read(file))
                .contains("backend \"s3\"")
                .contains("\"svc/terraform.tfstate\"")
                .doesNotContain("cloud {");
    }

    @Test
    @DisplayName("should ignore provider caches")
    void shouldIgnoreProviderCaches() throws Exception {
        fixture.cloneWith("main.tf", BACKEND_TF);
        Path cached = fixture.cloneWith(".terraform/modules/x/main.tf", BACKEND_TF);

        fixture.execute(stage);

        assertThat(StageFixture.read(cached)).isEqualTo(BACKEND_TF);
    }

    @Test
    @DisplayName("should skip a file that is not valid UTF-8 and rewrite the rest")
    void shouldSkipUndecodableFile() throws Exception {
        Path main = fixture.cloneWith("main.tf", BACKEND_TF);
        byte[] latin1 = "variable \"caf\u00e9\" {}\n".getBytes(StandardCharsets.ISO_8859_1);
        Path variables = fixture.cloneWithBytes("variables.tf", latin1);

        StageResult result = fixture.execute(stage);

        assertThat(result.isSucceeded()).isTrue();
        assertThat(result.message()).isEqualTo("Rewrote backend in 1 file(s)");
        assertThat(result.details()).containsExactly("main.tf", "skipped variables.tf: not valid UTF-8");
        assertThat(StageFixture.read(main)).contains("backend \"s3\"");
        assertThat(Files.readAllBytes(variables)).isEqualTo(latin1);
    }

    @Nested
    @DisplayName("without a remote backend")
    class WithoutBackend {

        @BeforeEach
        void createPlainClone() throws Exception {
            fixture.cloneWith("main.tf", "resource \"null_resource\" \"x\" {}\n");
        }

        @Test
        @DisplayName("should fail fatally by default")
        void shouldFailByDefault() {
            StageResult result = fixture.execute(stage);

            assertThat(result.haltsPipeline()).isTrue();
            assertThat(result.message()).isEqualTo("No remote backend block found in 1 configuration file(s)");
        }

        @Test
        @DisplayName("should succeed when told to ignore missing backends")
        void shouldSucceedWhenIgnored() {
            fixture.configure(b -> b.missingBackendPolicy(MissingBackendPolicy.IGNORE));

            StageResult result = fixture.execute(stage);

            assertThat(result.isSucceeded()).isTrue();
            assertThat(result.message()).contains("already migrated");
        }
    }

    @Test
    @DisplayName("should analyse an existing clone without writing in dry-run mode")
    void shouldNotWriteInDryRun() throws Exception {
        Path file = fixture.cloneWith("backend.tf", BACKEND_TF);
        fixture.configure(b -> b.dryRun(true));

        StageResult result = fixture.execute(stage);

        assertThat(result.message()).isEqualTo("Would rewrite backend in 1 file(s)");
        assertThat(StageFixture.read(file)).isEqualTo(BACKEND_TF);
    }
}
