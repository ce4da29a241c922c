package statemigrator.stage.impl;

import statemigrator.config.PipelineConfig;
import statemigrator.exceptions.StageException;
import statemigrator.exec.CommandRequest;
import statemigrator.exec.CommandResult;
import statemigrator.exec.CommandRunner;
import statemigrator.stage.AbstractStageExecutor;
import statemigrator.stage.Stage;
import statemigrator.stage.StageContext;
import statemigrator.stage.StageResult;
import statemigrator.transform.ConfigTransformer;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs the external state-relocation script inside the clone.
 *
 * <p>The script receives repository identity and target backend through the environment;
 * the credential profile is passed as {@code AWS_PROFILE} and never logged. Uses the
 * longer state-copy timeout.
 */
public final class StateCopyStage extends AbstractStageExecutor {

    public static final String SCRIPT_NAME = "copy_state.sh";

    private final Path scriptsDir;

    /**
     * @param runner the command runner
     * @param scriptsDir directory containing {@value #SCRIPT_NAME}, or null if it was not found
     */
    public StateCopyStage(CommandRunner runner, Path scriptsDir) {
        super(runner);
        this.scriptsDir = scriptsDir;
    }

    @Override
    public Stage stage() {
        return Stage.STATE_COPY;
    }

    @Override
    protected StageResult perform(StageContext ctx) throws StageException {
        Path script = script();
        if (script == null || !Files.isRegularFile(script)) {
            throw failure(ctx, SCRIPT_NAME + " not found" + (script != null ? " at " + script : ""));
        }
        CommandResult result = runner.run(request(ctx, script, false));
        if (!result.isSuccess()) {
            throw failure(ctx, "State copy failed: " + result.failureReason());
        }
        return succeeded("State copied to " + location(ctx.config(), ctx.target().name()));
    }

    @Override
    protected StageResult preview(StageContext ctx) {
        Path script = script();
        if (script == null) {
            return succeeded("Would run " + SCRIPT_NAME + " (script location not resolved)");
        }
        CommandRequest request = request(ctx, script, true);
        runner.run(request);
        return succeeded("Would copy state to " + location(ctx.config(), ctx.target().name())
                + " using " + request.display());
    }

    private Path script() {
        return scriptsDir != null ? scriptsDir.resolve(SCRIPT_NAME) : null;
    }

    private static CommandRequest request(StageContext ctx, Path script, boolean dryRun) {
        PipelineConfig config = ctx.config();
        return CommandRequest.builder("bash", script.toString())
                .workingDir(ctx.repoPath())
                .timeout(config.stateCopyTimeout())
                .dryRun(dryRun)
                .env("AWS_PROFILE", config.credentialProfile())
                .env("AWS_REGION", config.region())
                .env("AWS_DEFAULT_REGION", config.region())
                .env("TF_STATE_BUCKET", config.bucket())
                .env("TF_STATE_KEY", ConfigTransformer.stateKey(ctx.target().name()))
                .env("TF_STATE_LOCK_TABLE", config.lockTable())
                .env("REPO_ORG", ctx.target().organization())
                .env("REPO_NAME", ctx.target().name())
                .build();
    }

    static String location(PipelineConfig config, String repoName) {
        return "s3://" + config.bucket() + "/" + ConfigTransformer.stateKey(repoName);
    }
}
