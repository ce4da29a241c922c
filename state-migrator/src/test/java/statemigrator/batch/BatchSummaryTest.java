package statemigrator.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import statemigrator.pipeline.RepositoryOutcome;
import statemigrator.pipeline.RepositoryTarget;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BatchSummary")
class BatchSummaryTest {

    private static RepositoryTarget target(String name) {
        return new RepositoryTarget("acme", name, "migrate-to-s3-backend");
    }

    @Test
    @DisplayName("should exit with zero when only skips occurred")
    void shouldIgnoreSkipsForExitCode() {
        BatchSummary summary = BatchSummary.of(
                List.of(RepositoryOutcome.skipped(target("bad"), "Invalid repository: nope")),
                Duration.ofSeconds(1), 1);

        assertThat(summary.isSuccessful()).isTrue();
        assertThat(summary.exitCode()).isZero();
        assertThat(summary.retryArgument()).isEmpty();
        assertThat(summary.skipped()).containsExactly("bad");
    }

    @Test
    @DisplayName("should list aborted repositories with their reason")
    void shouldReportAborted() {
        BatchSummary summary = BatchSummary.of(List.of(
                        RepositoryOutcome.aborted(target("alpha"), "batch cancelled", Duration.ZERO),
                        RepositoryOutcome.aborted(target("beta"), "batch cancelled", Duration.ZERO)),
                Duration.ZERO, 2);

        assertThat(summary.exitCode()).isEqualTo(1);
        assertThat(summary.failures()).containsExactly(
                new BatchSummary.Failure("alpha", null, "batch cancelled"),
                new BatchSummary.Failure("beta", null, "batch cancelled"));
        assertThat(summary.retryArgument()).isEqualTo("--repos alpha,beta");
        assertThat(summary.toString()).contains("failed=2");
    }

    @Test
    @DisplayName("should be empty for an empty batch")
    void shouldHandleEmpty() {
        BatchSummary summary = BatchSummary.of(List.of(), Duration.ZERO, 0);

        assertThat(summary.total()).isZero();
        assertThat(summary.failures()).isEmpty();
        assertThat(summary.exitCode()).isZero();
    }
}
