package statemigrator.stage;

import statemigrator.exec.CommandRunner;
import statemigrator.stage.impl.BackendUpdateStage;
import statemigrator.stage.impl.BranchStage;
import statemigrator.stage.impl.CommitStage;
import statemigrator.stage.impl.FetchStage;
import statemigrator.stage.impl.ModuleUpdateStage;
import statemigrator.stage.impl.PublishProposalStage;
import statemigrator.stage.impl.PushStage;
import statemigrator.stage.impl.StateCopyStage;
import statemigrator.stage.impl.VerifyStage;
import statemigrator.stage.impl.VersionCheckStage;
import statemigrator.stage.impl.WorkflowUpdateStage;
import statemigrator.version.SemanticVersionComparator;
import statemigrator.version.VersionComparator;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered list of stage executors run for every repository.
 *
 * <p>Plans are built with {@link #of(List)}, which validates that:
 * <ul>
 *   <li>the plan is not empty</li>
 *   <li>each stage appears at most once</li>
 *   <li>executors follow {@link Stage} declaration order</li>
 * </ul>
 *
 * <p>{@link #standard} builds the full eleven-stage plan.
 */
public final class StagePlan {

    private final List<StageExecutor> executors;

    private StagePlan(List<StageExecutor> executors) {
        this.executors = executors;
    }

    /**
     * Builds a plan from executors in run order.
     *
     * @param executors the executors
     * @return the validated plan
     * @throws IllegalArgumentException if the list is empty, repeats a stage or is out of order
     */
    public static StagePlan of(List<? extends StageExecutor> executors) {
        Objects.requireNonNull(executors, "executors");
        if (executors.isEmpty()) {
            throw new IllegalArgumentException("A stage plan needs at least one stage");
        }
        Stage previous = null;
        for (StageExecutor executor : executors) {
            Stage stage = Objects.requireNonNull(executor.stage(), "stage");
            if (previous != null && stage.compareTo(previous) <= 0) {
                throw new IllegalArgumentException(
                        "Stage " + stage + " cannot follow " + previous + "; stages must be unique and in order");
            }
            previous = stage;
        }
        return new StagePlan(List.copyOf(executors));
    }

    /**
     * Builds the standard plan with semantic version comparison.
     *
     * @param runner command runner shared by all stages
     * @param approver asked before opening a proposal when auto-publish is off
     * @param scriptsDir directory holding the state-copy script, or null if unknown
     */
    public static StagePlan standard(CommandRunner runner, ProposalApprover approver, Path scriptsDir) {
        return standard(runner, approver, scriptsDir, SemanticVersionComparator.INSTANCE);
    }

    public static StagePlan standard(CommandRunner runner, ProposalApprover approver, Path scriptsDir,
                                     VersionComparator comparator) {
        List<StageExecutor> list = new ArrayList<>();
        list.add(new FetchStage(runner));
        list.add(new BranchStage(runner));
        list.add(new VersionCheckStage(runner, comparator));
        list.add(new StateCopyStage(runner, scriptsDir));
        list.add(new BackendUpdateStage(runner));
        list.add(new ModuleUpdateStage(runner));
        list.add(new WorkflowUpdateStage(runner));
        list.add(new CommitStage(runner));
        list.add(new PushStage(runner));
        list.add(new PublishProposalStage(runner, approver));
        list.add(new VerifyStage(runner));
        return of(list);
    }

    /** Returns the executors in run order. */
    public List<StageExecutor> executors() {
        return executors;
    }

    /** Returns the stages in run order. */
    public List<Stage> stages() {
        return executors.stream().map(StageExecutor::stage).toList();
    }

    public int size() {
        return executors.size();
    }
}
