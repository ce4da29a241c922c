package statemigrator.preflight;

import statemigrator.exec.CommandRequest;
import statemigrator.exec.CommandResult;
import statemigrator.exec.CommandRunner;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Passes when a command exits with status 0; used for tool presence
 * ({@code git --version}) and read-only access checks.
 */
public final class ToolCheck implements PreflightCheck {

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final CommandRunner runner;
    private final List<String> argv;
    private final Duration timeout;
    private final String failureHint;

    public ToolCheck(CommandRunner runner, List<String> argv, String failureHint) {
        this(runner, argv, DEFAULT_TIMEOUT, failureHint);
    }

    public ToolCheck(CommandRunner runner, List<String> argv, Duration timeout, String failureHint) {
        this.runner = runner;
        this.argv = List.copyOf(argv);
        this.timeout = timeout;
        this.failureHint = failureHint;
    }

    /** Checks that {@code tool --version} runs. */
    public static ToolCheck version(CommandRunner runner, String tool) {
        List<String> argv = new ArrayList<>();
        argv.add(tool);
        argv.add("--version");
        return new ToolCheck(runner, argv, tool + " is not installed or not on PATH");
    }

    @Override
    public PreflightResult run(String name) {
        CommandResult result = runner.run(CommandRequest.builder(argv).timeout(timeout).build());
        if (!result.isSuccess()) {
            return PreflightResult.fail(name, failureHint + " - " + result.failureReason(), null);
        }
        String firstLine = result.stdout().strip().split("\\R")[0];
        return PreflightResult.ok(name, firstLine);
    }
}
