package statemigrator.logging;

import org.slf4j.MDC;

/**
 * Manages the MDC keys that attribute log lines to a repository and stage,
 * so output of concurrent pipelines can be told apart.
 */
public final class MdcContext {

    public static final String REPO = "repo";
    public static final String STAGE = "stage";

    private MdcContext() {}

    public static void setRepository(String repo) {
        MDC.put(REPO, repo);
    }

    public static void setStage(String stage) {
        MDC.put(STAGE, stage);
    }

    public static void clearStage() {
        MDC.remove(STAGE);
    }

    public static void clear() {
        MDC.remove(REPO);
        MDC.remove(STAGE);
    }
}
