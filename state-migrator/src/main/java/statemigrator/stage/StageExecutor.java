package statemigrator.stage;

import statemigrator.config.PipelineConfig;
import statemigrator.pipeline.RepositoryTarget;

import java.nio.file.Path;

/**
 * Runs one pipeline stage for one repository.
 *
 * <p>Implementations report every outcome, including failures and timeouts, through the
 * returned {@link StageResult}; they do not throw. Extend {@link AbstractStageExecutor}
 * to get that behavior.
 *
 * @see AbstractStageExecutor
 * @see StagePlan
 */
public interface StageExecutor {

    /** The stage this executor implements. */
    Stage stage();

    /**
     * Whether a failure of this stage halts the repository's pipeline.
     *
     * @param config the run configuration; some stages are fatal only under certain flags
     * @return true by default
     */
    default boolean isFatal(PipelineConfig config) {
        return true;
    }

    /**
     * Executes the stage.
     *
     * @param repoPath the repository's clone directory (may not exist yet before Fetch)
     * @param target the repository
     * @param config the run configuration
     * @return the stage result, never null
     */
    StageResult execute(Path repoPath, RepositoryTarget target, PipelineConfig config);
}
