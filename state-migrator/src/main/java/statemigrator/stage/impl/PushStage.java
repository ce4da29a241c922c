package statemigrator.stage.impl;

import statemigrator.exceptions.StageException;
import statemigrator.exec.CommandRunner;
import statemigrator.stage.AbstractStageExecutor;
import statemigrator.stage.Stage;
import statemigrator.stage.StageContext;
import statemigrator.stage.StageResult;

/**
 * Pushes the migration branch and sets its upstream.
 */
public final class PushStage extends AbstractStageExecutor {

    public PushStage(CommandRunner runner) {
        super(runner);
    }

    @Override
    public Stage stage() {
        return Stage.PUSH;
    }

    @Override
    protected StageResult perform(StageContext ctx) throws StageException {
        String branch = ctx.target().branch();
        runOrFail(ctx, "Push of " + branch + " failed", "git", "push", "-u", "origin", branch);
        return succeeded("Pushed " + branch);
    }

    @Override
    protected StageResult preview(StageContext ctx) {
        return succeeded("Would push: " + planned(ctx, "git", "push", "-u", "origin", ctx.target().branch()));
    }
}
