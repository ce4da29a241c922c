package statemigrator.stage.impl;

import statemigrator.config.PipelineConfig;
import statemigrator.exceptions.StageException;
import statemigrator.exec.CommandResult;
import statemigrator.exec.CommandRunner;
import statemigrator.stage.AbstractStageExecutor;
import statemigrator.stage.ProposalApprover;
import statemigrator.stage.Stage;
import statemigrator.stage.StageContext;
import statemigrator.stage.StageResult;

/**
 * Opens the pull request for the migration branch.
 *
 * <p>An open pull request for the branch is reused. Without auto-publish the
 * {@link ProposalApprover} is asked first; a declined proposal fails the repository
 * so it shows up in the retry list.
 */
public final class PublishProposalStage extends AbstractStageExecutor {

    private final ProposalApprover approver;

    public PublishProposalStage(CommandRunner runner, ProposalApprover approver) {
        super(runner);
        this.approver = approver;
    }

    @Override
    public Stage stage() {
        return Stage.PUBLISH_PROPOSAL;
    }

    @Override
    protected StageResult perform(StageContext ctx) throws StageException {
        String branch = ctx.target().branch();
        PipelineConfig config = ctx.config();

        CommandResult existing = run(ctx, "gh", "pr", "list", "--head", branch, "--state", "open",
                "--json", "url", "--jq", ".[0].url");
        String existingUrl = existing.isSuccess() ? lastLine(existing.stdout()) : "";
        if (!existingUrl.isEmpty()) {
            return succeeded("Reusing open pull request " + existingUrl).withReference(existingUrl);
        }

        if (!config.autoPublish() && !approver.approve(ctx.target(), config.proposalTitle())) {
            throw failure(ctx, "Pull request declined by operator");
        }

        CommandResult created = runOrFail(ctx, "Cannot open pull request",
                "gh", "pr", "create",
                "--title", config.proposalTitle(),
                "--body", config.proposalBody(),
                "--base", config.baseBranch(),
                "--head", branch);
        String url = lastLine(created.stdout());
        return succeeded("Opened pull request " + url).withReference(url.isEmpty() ? null : url);
    }

    @Override
    protected StageResult preview(StageContext ctx) {
        PipelineConfig config = ctx.config();
        String cmd = planned(ctx, "gh", "pr", "create",
                "--title", config.proposalTitle(),
                "--base", config.baseBranch(),
                "--head", ctx.target().branch());
        String note = config.autoPublish() ? "" : " after operator confirmation";
        return succeeded("Would open pull request" + note + ": " + cmd);
    }

    private static String lastLine(String text) {
        String[] lines = text.strip().split("\\R");
        return lines[lines.length - 1].strip();
    }
}
