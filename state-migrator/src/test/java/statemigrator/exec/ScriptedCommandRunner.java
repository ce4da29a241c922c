package statemigrator.exec;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Test double that records every request and answers from rules matched on the
 * command's display prefix. Unmatched commands succeed with empty output; dry-run
 * requests always get the synthetic dry-run result.
 */
public final class ScriptedCommandRunner implements CommandRunner {

    private record Rule(String prefix, Function<CommandRequest, CommandResult> response) {}

    private final List<CommandRequest> requests = new CopyOnWriteArrayList<>();
    private final List<Rule> rules = new CopyOnWriteArrayList<>();

    public ScriptedCommandRunner respond(String prefix, Function<CommandRequest, CommandResult> response) {
        rules.add(new Rule(prefix, response));
        return this;
    }

    public ScriptedCommandRunner stdout(String prefix, String stdout) {
        return respond(prefix, r -> new CommandResult(0, stdout, "", false));
    }

    public ScriptedCommandRunner fail(String prefix, String stderr) {
        return respond(prefix, r -> new CommandResult(1, "", stderr, false));
    }

    @Override
    public CommandResult run(CommandRequest request) {
        requests.add(request);
        if (request.dryRun()) {
            return CommandResult.dryRunResult();
        }
        for (Rule rule : rules) {
            if (request.display().startsWith(rule.prefix())) {
                return rule.response().apply(request);
            }
        }
        return new CommandResult(0, "", "", false);
    }

    public List<CommandRequest> requests() {
        return List.copyOf(requests);
    }

    /** Display strings of every request that was actually executed. */
    public List<String> executed() {
        return requests.stream()
                .filter(r -> !r.dryRun())
                .map(CommandRequest::display)
                .collect(Collectors.toList());
    }

    public boolean anyExecuted() {
        return requests.stream().anyMatch(r -> !r.dryRun());
    }
}
