package statemigrator.pipeline;

import statemigrator.stage.Stage;
import statemigrator.stage.StageResult;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable aggregate for one repository: its ordered stage results and final status.
 *
 * <p>On success it carries the proposal URL and the verified state location. Created
 * once by {@link RepositoryPipeline} when the pipeline reaches a terminal state.
 */
public final class RepositoryOutcome {

    private final RepositoryTarget target;
    private final List<StageResult> results;
    private final OutcomeStatus status;
    private final String proposalUrl;
    private final String stateLocation;
    private final String reason;
    private final Duration duration;

    RepositoryOutcome(RepositoryTarget target,
                      List<StageResult> results,
                      OutcomeStatus status,
                      String proposalUrl,
                      String stateLocation,
                      String reason,
                      Duration duration) {
        this.target = Objects.requireNonNull(target, "target");
        this.results = List.copyOf(results);
        this.status = Objects.requireNonNull(status, "status");
        this.proposalUrl = proposalUrl;
        this.stateLocation = stateLocation;
        this.reason = reason;
        this.duration = duration != null ? duration : Duration.ZERO;
    }

    /** Creates the outcome of a target rejected before any stage ran. */
    public static RepositoryOutcome skipped(RepositoryTarget target, String reason) {
        return new RepositoryOutcome(target, List.of(), OutcomeStatus.SKIPPED, null, null, reason, Duration.ZERO);
    }

    /**
     * Creates a failed outcome for a pipeline that never returned, e.g. because the batch
     * was interrupted.
     */
    public static RepositoryOutcome aborted(RepositoryTarget target, String reason, Duration duration) {
        return new RepositoryOutcome(target, List.of(), OutcomeStatus.FAILED, null, null, reason, duration);
    }

    public RepositoryTarget target() { return target; }

    /** Returns the stage results in execution order. */
    public List<StageResult> results() { return results; }

    public OutcomeStatus status() { return status; }

    /** Returns the proposal URL, or null unless the repository succeeded. */
    public String proposalUrl() { return proposalUrl; }

    /** Returns the verified state location, or null unless the repository succeeded. */
    public String stateLocation() { return stateLocation; }

    /** Returns why the target was skipped or aborted, or null. */
    public String reason() { return reason; }

    public Duration duration() { return duration; }

    /** Returns the result that halted the pipeline, if any. */
    public Optional<StageResult> firstFailure() {
        return results.stream().filter(StageResult::haltsPipeline).findFirst();
    }

    /** Returns the stage that halted the pipeline, if any. */
    public Optional<Stage> firstFailedStage() {
        return firstFailure().map(StageResult::stage);
    }

    /** Returns non-fatal failures recorded along the way. */
    public List<StageResult> warnings() {
        return results.stream()
                .filter(r -> r.isFailed() && !r.haltsPipeline())
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "RepositoryOutcome{" +
                "target=" + target.fullName() +
                ", status=" + status +
                ", stages=" + results.size() +
                firstFailedStage().map(s -> ", failedAt=" + s).orElse("") +
                '}';
    }
}
