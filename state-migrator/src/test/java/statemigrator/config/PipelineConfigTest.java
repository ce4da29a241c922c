package statemigrator.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PipelineConfig")
class PipelineConfigTest {

    @Test
    @DisplayName("should provide sequential, failing-safe defaults")
    void shouldProvideDefaults() {
        PipelineConfig c = PipelineConfig.DEFAULTS;

        assertThat(c.concurrency()).isEqualTo(1);
        assertThat(c.dryRun()).isFalse();
        assertThat(c.autoPublish()).isFalse();
        assertThat(c.missingBackendPolicy()).isEqualTo(MissingBackendPolicy.FAIL);
        assertThat(c.commandTimeout()).isEqualTo(Duration.ofSeconds(300));
        assertThat(c.stateCopyTimeout()).isEqualTo(Duration.ofSeconds(600));
        assertThat(c.baseBranch()).isEqualTo("main");
    }

    @Test
    @DisplayName("should copy every value through toBuilder")
    void shouldCopyThroughToBuilder() {
        PipelineConfig original = PipelineConfig.builder()
                .organization("acme")
                .concurrency(3)
                .workDir(Path.of("/tmp/work"))
                .build();

        PipelineConfig copy = original.toBuilder().bucket("other-bucket").build();

        assertThat(copy.organization()).isEqualTo("acme");
        assertThat(copy.concurrency()).isEqualTo(3);
        assertThat(copy.bucket()).isEqualTo("other-bucket");
        assertThat(copy.repositoryDir("svc")).isEqualTo(Path.of("/tmp/work", "svc"));
    }

    @Test
    @DisplayName("should reject concurrency below one")
    void shouldRejectZeroConcurrency() {
        assertThatThrownBy(() -> PipelineConfig.builder().concurrency(0).build())
                .isInstanceOf(PipelineConfigException.class)
                .hasMessageContaining("concurrency");
    }

    @Test
    @DisplayName("should not print the credential profile")
    void shouldNotPrintProfile() {
        PipelineConfig c = PipelineConfig.builder().credentialProfile("prod-admin").build();

        assertThat(c.toString()).doesNotContain("prod-admin");
    }
}
