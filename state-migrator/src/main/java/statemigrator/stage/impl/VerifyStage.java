package statemigrator.stage.impl;

import statemigrator.config.PipelineConfig;
import statemigrator.exceptions.StageException;
import statemigrator.exec.CommandResult;
import statemigrator.exec.CommandRunner;
import statemigrator.stage.AbstractStageExecutor;
import statemigrator.stage.Stage;
import statemigrator.stage.StageContext;
import statemigrator.stage.StageResult;
import statemigrator.transform.ConfigTransformer;

/**
 * Confirms the relocated state object exists under the expected key with an exact-key
 * {@code head-object} lookup, so a neighbour such as {@code terraform.tfstate.backup}
 * does not count. The verified location becomes the result's reference.
 */
public final class VerifyStage extends AbstractStageExecutor {

    public VerifyStage(CommandRunner runner) {
        super(runner);
    }

    @Override
    public Stage stage() {
        return Stage.VERIFY;
    }

    @Override
    protected StageResult perform(StageContext ctx) throws StageException {
        String location = StateCopyStage.location(ctx.config(), ctx.target().name());
        CommandResult result = runIn(ctx, null, ctx.config().commandTimeout(), command(ctx));
        if (!result.isSuccess() || result.stdout().isBlank()) {
            throw failure(ctx, "State object not found at " + location);
        }
        return succeeded("State verified at " + location).withReference(location);
    }

    @Override
    protected StageResult preview(StageContext ctx) {
        String location = StateCopyStage.location(ctx.config(), ctx.target().name());
        return succeeded("Would verify " + location + ": " + planned(ctx, command(ctx)));
    }

    private static String[] command(StageContext ctx) {
        PipelineConfig config = ctx.config();
        return new String[] {
                "aws", "s3api", "head-object",
                "--bucket", config.bucket(),
                "--key", ConfigTransformer.stateKey(ctx.target().name()),
                "--profile", config.credentialProfile(),
                "--region", config.region()
        };
    }
}
