package statemigrator.pipeline;

/**
 * Final status of a repository.
 */
public enum OutcomeStatus {
    /** Every stage completed without a fatal failure. */
    SUCCEEDED,
    /** A fatal stage failed; later stages did not run. */
    FAILED,
    /** Validation rejected the target; no stage ran. */
    SKIPPED
}
