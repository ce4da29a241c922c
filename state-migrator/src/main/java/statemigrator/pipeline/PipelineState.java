package statemigrator.pipeline;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a {@link RepositoryPipeline}.
 *
 * <pre>
 * PENDING ──► VALIDATING ──► RUNNING ──► SUCCEEDED
 *    │            │             └──────► FAILED
 *    └────────────┴─► SKIPPED
 * </pre>
 *
 * <p>{@link #SUCCEEDED}, {@link #FAILED} and {@link #SKIPPED} are terminal.
 */
public enum PipelineState {
    PENDING,
    VALIDATING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }

    /** Returns true if this state may move to {@code next}. */
    public boolean canTransitionTo(PipelineState next) {
        return allowedNext().contains(next);
    }

    private Set<PipelineState> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(VALIDATING, SKIPPED);
            case VALIDATING:
                return EnumSet.of(RUNNING, SKIPPED);
            case RUNNING:
                return EnumSet.of(SUCCEEDED, FAILED);
            default:
                return EnumSet.noneOf(PipelineState.class);
        }
    }
}
