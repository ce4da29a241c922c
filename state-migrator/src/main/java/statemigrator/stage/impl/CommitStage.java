package statemigrator.stage.impl;

import statemigrator.exceptions.StageException;
import statemigrator.exec.CommandResult;
import statemigrator.exec.CommandRunner;
import statemigrator.stage.AbstractStageExecutor;
import statemigrator.stage.Stage;
import statemigrator.stage.StageContext;
import statemigrator.stage.StageResult;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Stages and commits all working-tree changes. Fails when there is nothing to commit,
 * since that means the repository had nothing to migrate.
 */
public final class CommitStage extends AbstractStageExecutor {

    public CommitStage(CommandRunner runner) {
        super(runner);
    }

    @Override
    public Stage stage() {
        return Stage.COMMIT;
    }

    @Override
    protected StageResult perform(StageContext ctx) throws StageException {
        runOrFail(ctx, "Cannot stage changes", "git", "add", "-A");
        CommandResult status = runOrFail(ctx, "Cannot read working tree status", "git", "status", "--porcelain");
        List<String> changes = Arrays.stream(status.stdout().split("\\R"))
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toList());
        if (changes.isEmpty()) {
            throw failure(ctx, "Working tree has no changes to commit");
        }
        runOrFail(ctx, "Commit failed", "git", "commit", "-m", ctx.config().commitMessage());
        return succeeded("Committed " + changes.size() + " change(s)").withDetails(changes);
    }

    @Override
    protected StageResult preview(StageContext ctx) {
        planned(ctx, "git", "add", "-A");
        return succeeded("Would commit: " + planned(ctx, "git", "commit", "-m", ctx.config().commitMessage()));
    }
}
