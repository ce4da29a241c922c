package statemigrator.pipeline;

import statemigrator.batch.BatchSummary;
import statemigrator.stage.Stage;
import statemigrator.stage.StageResult;

import java.util.List;

/**
 * Receives progress events from the scheduler and the repository pipelines.
 *
 * <p>Repository events arrive on worker threads, possibly concurrently for different
 * repositories; implementations must be thread-safe. Exceptions thrown by a listener
 * are logged and otherwise ignored.
 *
 * @see NoopPipelineListener
 */
public interface PipelineListener {

    void batchStarted(List<RepositoryTarget> targets);

    void repositoryStarted(RepositoryTarget target);

    void stageStarted(RepositoryTarget target, Stage stage);

    void stageCompleted(RepositoryTarget target, StageResult result);

    void repositoryCompleted(RepositoryOutcome outcome);

    void batchCompleted(BatchSummary summary);

    /**
     * Returns a listener that forwards every event to each of {@code listeners} in order.
     */
    static PipelineListener compose(PipelineListener... listeners) {
        List<PipelineListener> all = List.of(listeners);
        return new PipelineListener() {
            @Override
            public void batchStarted(List<RepositoryTarget> targets) {
                all.forEach(l -> l.batchStarted(targets));
            }

            @Override
            public void repositoryStarted(RepositoryTarget target) {
                all.forEach(l -> l.repositoryStarted(target));
            }

            @Override
            public void stageStarted(RepositoryTarget target, Stage stage) {
                all.forEach(l -> l.stageStarted(target, stage));
            }

            @Override
            public void stageCompleted(RepositoryTarget target, StageResult result) {
                all.forEach(l -> l.stageCompleted(target, result));
            }

            @Override
            public void repositoryCompleted(RepositoryOutcome outcome) {
                all.forEach(l -> l.repositoryCompleted(outcome));
            }

            @Override
            public void batchCompleted(BatchSummary summary) {
                all.forEach(l -> l.batchCompleted(summary));
            }
        };
    }
}
