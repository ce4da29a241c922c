package statemigrator.stage.impl;

import statemigrator.exceptions.StageException;
import statemigrator.exec.CommandResult;
import statemigrator.exec.CommandRunner;
import statemigrator.stage.AbstractStageExecutor;
import statemigrator.stage.Stage;
import statemigrator.stage.StageContext;
import statemigrator.stage.StageResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Clones the repository into its own subdirectory of the working directory.
 * An existing clone is reused, so a rerun after a partial failure picks up where it left off.
 */
public final class FetchStage extends AbstractStageExecutor {

    public FetchStage(CommandRunner runner) {
        super(runner);
    }

    @Override
    public Stage stage() {
        return Stage.FETCH;
    }

    @Override
    protected StageResult perform(StageContext ctx) throws StageException {
        if (ctx.cloneExists()) {
            log.warn("Clone directory already exists, reusing {}", ctx.repoPath());
            return succeeded("Reusing existing clone at " + ctx.repoPath());
        }
        Path workDir = ctx.config().workDir();
        try {
            Files.createDirectories(workDir);
        } catch (IOException e) {
            throw failure(ctx, "Cannot create working directory " + workDir + ": " + e.getMessage());
        }
        CommandResult result = runIn(ctx, workDir, ctx.config().commandTimeout(),
                "gh", "repo", "clone", ctx.target().fullName(), ctx.repoPath().toString());
        if (!result.isSuccess()) {
            throw failure(ctx, "Clone of " + ctx.target().fullName() + " failed: " + result.failureReason());
        }
        return succeeded("Cloned " + ctx.target().fullName() + " into " + ctx.repoPath());
    }

    @Override
    protected StageResult preview(StageContext ctx) {
        if (ctx.cloneExists()) {
            return succeeded("Would reuse existing clone at " + ctx.repoPath());
        }
        String cmd = planned(ctx, "gh", "repo", "clone", ctx.target().fullName(), ctx.repoPath().toString());
        return succeeded("Would clone: " + cmd);
    }
}
