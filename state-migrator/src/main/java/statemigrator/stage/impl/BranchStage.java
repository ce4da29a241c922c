package statemigrator.stage.impl;

import statemigrator.exceptions.StageException;
import statemigrator.exec.CommandResult;
import statemigrator.exec.CommandRunner;
import statemigrator.stage.AbstractStageExecutor;
import statemigrator.stage.Stage;
import statemigrator.stage.StageContext;
import statemigrator.stage.StageResult;

/**
 * Creates and switches to the migration branch, or switches to it if it already exists.
 */
public final class BranchStage extends AbstractStageExecutor {

    public BranchStage(CommandRunner runner) {
        super(runner);
    }

    @Override
    public Stage stage() {
        return Stage.BRANCH;
    }

    @Override
    protected StageResult perform(StageContext ctx) throws StageException {
        String branch = ctx.target().branch();
        CommandResult created = run(ctx, "git", "checkout", "-b", branch);
        if (created.isSuccess()) {
            return succeeded("Created branch " + branch);
        }
        log.info("Branch {} not created ({}), switching to existing branch", branch, created.failureReason());
        runOrFail(ctx, "Cannot create or switch to branch " + branch, "git", "checkout", branch);
        return succeeded("Switched to existing branch " + branch);
    }

    @Override
    protected StageResult preview(StageContext ctx) {
        return succeeded("Would create branch: " + planned(ctx, "git", "checkout", "-b", ctx.target().branch()));
    }
}
