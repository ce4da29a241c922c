package statemigrator.stage;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Immutable record of one stage run for one repository.
 *
 * <p>Created by a stage executor and appended to its repository's result list. The
 * {@code fatal} flag records whether a failure of this stage halts the repository.
 *
 * @param stage the stage
 * @param outcome succeeded, failed or skipped
 * @param message human-readable summary
 * @param duration wall-clock time spent
 * @param details structured detail such as changed files; may be empty
 * @param reference machine-readable reference produced by the stage (proposal URL,
 *                  state location), or null
 * @param fatal whether this stage was fatal when it ran
 */
public record StageResult(
        Stage stage,
        StageOutcome outcome,
        String message,
        Duration duration,
        List<String> details,
        String reference,
        boolean fatal
) {

    public StageResult {
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(outcome, "outcome");
        message = message != null ? message : "";
        duration = duration != null ? duration : Duration.ZERO;
        details = details != null ? List.copyOf(details) : List.of();
    }

    public static StageResult succeeded(Stage stage, String message) {
        return new StageResult(stage, StageOutcome.SUCCEEDED, message, Duration.ZERO, List.of(), null, true);
    }

    public static StageResult failed(Stage stage, String message, boolean fatal) {
        return new StageResult(stage, StageOutcome.FAILED, message, Duration.ZERO, List.of(), null, fatal);
    }

    public static StageResult skipped(Stage stage, String message) {
        return new StageResult(stage, StageOutcome.SKIPPED, message, Duration.ZERO, List.of(), null, false);
    }

    public boolean isSucceeded() {
        return outcome == StageOutcome.SUCCEEDED;
    }

    public boolean isFailed() {
        return outcome == StageOutcome.FAILED;
    }

    /** True if this result stops the repository's pipeline. */
    public boolean haltsPipeline() {
        return outcome == StageOutcome.FAILED && fatal;
    }

    public StageResult withDuration(Duration newDuration) {
        return new StageResult(stage, outcome, message, newDuration, details, reference, fatal);
    }

    public StageResult withDetails(List<String> newDetails) {
        return new StageResult(stage, outcome, message, duration, newDetails, reference, fatal);
    }

    public StageResult withReference(String newReference) {
        return new StageResult(stage, outcome, message, duration, details, newReference, fatal);
    }

    public StageResult withFatal(boolean newFatal) {
        return new StageResult(stage, outcome, message, duration, details, reference, newFatal);
    }

    /** Returns a copy whose message, details and reference have passed through {@code filter}. */
    public StageResult mapText(UnaryOperator<String> filter) {
        List<String> filtered = details.stream().map(filter).toList();
        return new StageResult(stage, outcome, filter.apply(message), duration, filtered,
                reference != null ? filter.apply(reference) : null, fatal);
    }
}
