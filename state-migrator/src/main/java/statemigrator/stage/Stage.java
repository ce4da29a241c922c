package statemigrator.stage;

/**
 * Pipeline stages in execution order. A repository passes through them strictly
 * in declaration order.
 */
public enum Stage {
    FETCH("Fetch"),
    BRANCH("Branch"),
    VERSION_CHECK("VersionCheck"),
    STATE_COPY("StateCopy"),
    BACKEND_UPDATE("BackendUpdate"),
    MODULE_UPDATE("ModuleUpdate"),
    WORKFLOW_UPDATE("WorkflowUpdate"),
    COMMIT("Commit"),
    PUSH("Push"),
    PUBLISH_PROPOSAL("PublishProposal"),
    VERIFY("Verify");

    private final String displayName;

    Stage(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /** Returns the 1-based position, as shown in progress output. */
    public int number() {
        return ordinal() + 1;
    }
}
