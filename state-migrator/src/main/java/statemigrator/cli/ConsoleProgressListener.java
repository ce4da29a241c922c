package statemigrator.cli;

import statemigrator.batch.BatchSummary;
import statemigrator.pipeline.OutcomeStatus;
import statemigrator.pipeline.PipelineListener;
import statemigrator.pipeline.RepositoryOutcome;
import statemigrator.pipeline.RepositoryTarget;
import statemigrator.stage.Stage;
import statemigrator.stage.StageResult;

import java.util.List;

/**
 * Prints one line per finished stage and repository. Lines from different workers
 * may interleave; each line carries the repository name.
 */
class ConsoleProgressListener implements PipelineListener {

    private final int totalStages;

    ConsoleProgressListener(int totalStages) {
        this.totalStages = totalStages;
    }

    @Override
    public void batchStarted(List<RepositoryTarget> targets) {
        ConsoleOutput.info("Migrating " + targets.size() + " repositor" + (targets.size() == 1 ? "y" : "ies"));
    }

    @Override
    public void repositoryStarted(RepositoryTarget target) {
        ConsoleOutput.info(target.fullName() + " started");
    }

    @Override
    public void stageStarted(RepositoryTarget target, Stage stage) {
        // stage completion is enough on the console
    }

    @Override
    public synchronized void stageCompleted(RepositoryTarget target, StageResult result) {
        String line = "[" + target.name() + "] [" + result.stage().number() + "/" + totalStages + "] "
                + result.stage().displayName() + ": " + result.message();
        switch (result.outcome()) {
            case SUCCEEDED -> ConsoleOutput.success(line);
            case SKIPPED -> ConsoleOutput.info(line);
            case FAILED -> {
                if (result.haltsPipeline()) {
                    ConsoleOutput.error(line);
                } else {
                    ConsoleOutput.warn(line);
                }
            }
        }
    }

    @Override
    public synchronized void repositoryCompleted(RepositoryOutcome outcome) {
        if (outcome.status() == OutcomeStatus.SKIPPED) {
            ConsoleOutput.warn(outcome.target().fullName() + " skipped: " + outcome.reason());
        }
    }

    @Override
    public void batchCompleted(BatchSummary summary) {
        // the command prints the full summary
    }
}
