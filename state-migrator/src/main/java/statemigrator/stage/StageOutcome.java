package statemigrator.stage;

/**
 * Outcome of one stage for one repository.
 */
public enum StageOutcome {
    SUCCEEDED,
    FAILED,
    SKIPPED
}
