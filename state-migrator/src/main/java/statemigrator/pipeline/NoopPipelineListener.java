package statemigrator.pipeline;

import statemigrator.batch.BatchSummary;
import statemigrator.stage.Stage;
import statemigrator.stage.StageResult;

import java.util.List;

/**
 * Default no-op listener used when the caller doesn't supply one.
 */
public enum NoopPipelineListener implements PipelineListener {
    INSTANCE;

    @Override
    public void batchStarted(List<RepositoryTarget> targets) { /* no-op */ }

    @Override
    public void repositoryStarted(RepositoryTarget target) { /* no-op */ }

    @Override
    public void stageStarted(RepositoryTarget target, Stage stage) { /* no-op */ }

    @Override
    public void stageCompleted(RepositoryTarget target, StageResult result) { /* no-op */ }

    @Override
    public void repositoryCompleted(RepositoryOutcome outcome) { /* no-op */ }

    @Override
    public void batchCompleted(BatchSummary summary) { /* no-op */ }
}
