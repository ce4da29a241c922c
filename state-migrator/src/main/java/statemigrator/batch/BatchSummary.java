package statemigrator.batch;

import statemigrator.pipeline.OutcomeStatus;
import statemigrator.pipeline.RepositoryOutcome;
import statemigrator.stage.Stage;
import statemigrator.stage.StageResult;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable aggregate over every repository outcome of a batch.
 *
 * <p>Built once, after every pipeline reached a terminal state. Lists repository names
 * per status bucket, the first fatal stage and message per failure, and a retry argument
 * limited to the failed subset.
 */
public final class BatchSummary {

    /**
     * A failed repository with the stage and message that stopped it.
     *
     * @param repository the repository name
     * @param stage the first fatal stage, or null if the pipeline was aborted before any stage
     * @param message the failure message
     */
    public record Failure(String repository, Stage stage, String message) {}

    private final List<RepositoryOutcome> outcomes;
    private final Duration duration;
    private final int peakConcurrency;

    private BatchSummary(List<RepositoryOutcome> outcomes, Duration duration, int peakConcurrency) {
        this.outcomes = List.copyOf(outcomes);
        this.duration = duration;
        this.peakConcurrency = peakConcurrency;
    }

    /**
     * Builds a summary.
     *
     * @param outcomes outcomes in submission order
     * @param duration total wall-clock duration of the batch
     * @param peakConcurrency highest number of pipelines that ran at once
     */
    public static BatchSummary of(List<RepositoryOutcome> outcomes, Duration duration, int peakConcurrency) {
        return new BatchSummary(outcomes, duration, peakConcurrency);
    }

    /** Returns all outcomes in submission order. */
    public List<RepositoryOutcome> outcomes() { return outcomes; }

    public Duration duration() { return duration; }

    public int peakConcurrency() { return peakConcurrency; }

    public int total() { return outcomes.size(); }

    public int succeededCount() { return count(OutcomeStatus.SUCCEEDED); }

    public int failedCount() { return count(OutcomeStatus.FAILED); }

    public int skippedCount() { return count(OutcomeStatus.SKIPPED); }

    public List<String> succeeded() { return names(OutcomeStatus.SUCCEEDED); }

    public List<String> failed() { return names(OutcomeStatus.FAILED); }

    public List<String> skipped() { return names(OutcomeStatus.SKIPPED); }

    /** Returns one entry per failed repository. */
    public List<Failure> failures() {
        return outcomes.stream()
                .filter(o -> o.status() == OutcomeStatus.FAILED)
                .map(o -> {
                    StageResult first = o.firstFailure().orElse(null);
                    return first != null
                            ? new Failure(o.target().name(), first.stage(), first.message())
                            : new Failure(o.target().name(), null, o.reason());
                })
                .collect(Collectors.toList());
    }

    /** True if no repository failed. Skipped repositories do not count as failures. */
    public boolean isSuccessful() {
        return failedCount() == 0;
    }

    /** Process exit code: 0 when no repository failed, 1 otherwise. */
    public int exitCode() {
        return isSuccessful() ? 0 : 1;
    }

    /**
     * Returns the CLI argument that reruns only the failed repositories, or an empty
     * string when nothing failed.
     */
    public String retryArgument() {
        List<String> failed = failed();
        return failed.isEmpty() ? "" : "--repos " + String.join(",", failed);
    }

    private int count(OutcomeStatus status) {
        return (int) outcomes.stream().filter(o -> o.status() == status).count();
    }

    private List<String> names(OutcomeStatus status) {
        return outcomes.stream()
                .filter(o -> o.status() == status)
                .map(o -> o.target().name())
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "BatchSummary{" +
                "total=" + total() +
                ", succeeded=" + succeededCount() +
                ", failed=" + failedCount() +
                ", skipped=" + skippedCount() +
                ", durationMs=" + duration.toMillis() +
                '}';
    }
}
