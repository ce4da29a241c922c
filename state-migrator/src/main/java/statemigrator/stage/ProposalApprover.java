package statemigrator.stage;

import statemigrator.pipeline.RepositoryTarget;

/**
 * Asks whether a proposal may be opened for a repository. Consulted only when
 * auto-publish is off.
 */
@FunctionalInterface
public interface ProposalApprover {

    /**
     * @param target the repository
     * @param title the proposal title
     * @return true to open the proposal
     */
    boolean approve(RepositoryTarget target, String title);

    /** Approver that accepts every proposal. */
    static ProposalApprover always() {
        return (target, title) -> true;
    }
}
