package statemigrator.transform;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adds a secret-backed environment variable to CI workflow files that run terraform.
 *
 * <p>The entry {@code <VAR>: ${{ secrets.<NAME> }}} goes into the workflow's top-level
 * {@code env:} map, which is created just before {@code jobs:} if missing. Files that do
 * not mention terraform, already reference the secret, or use a flow-style {@code env:}
 * map are returned unchanged.
 */
public final class WorkflowTransformer {

    private static final Pattern TOP_LEVEL_ENV = Pattern.compile("(?m)^env:[ \\t]*(?:#[^\\n]*)?(\\r?\\n|\\z)");
    private static final Pattern TOP_LEVEL_ENV_INLINE = Pattern.compile("(?m)^env:[ \\t]*[{\\[]");
    private static final Pattern TOP_LEVEL_JOBS = Pattern.compile("(?m)^jobs:");
    private static final Pattern INDENT = Pattern.compile("^([ \\t]+)\\S");

    private final String envVar;
    private final String secretName;

    /**
     * @param envVar the environment variable to set, e.g. {@code GITHUB_TOKEN}
     * @param secretName the repository secret it reads from
     */
    public WorkflowTransformer(String envVar, String secretName) {
        this.envVar = envVar;
        this.secretName = secretName;
    }

    /**
     * Returns true if {@code workflow} needs the secret entry.
     */
    public boolean needsInjection(String workflow) {
        return workflow.toLowerCase(Locale.ROOT).contains("terraform")
                && !workflow.contains("secrets." + secretName);
    }

    /**
     * Injects the secret reference.
     *
     * @param workflow the workflow YAML text
     * @return the updated text and whether it changed
     */
    public TextRewrite inject(String workflow) {
        if (!needsInjection(workflow) || TOP_LEVEL_ENV_INLINE.matcher(workflow).find()) {
            return new TextRewrite(workflow, false);
        }
        String entry = envVar + ": ${{ secrets." + secretName + " }}";

        Matcher env = TOP_LEVEL_ENV.matcher(workflow);
        if (env.find()) {
            String newline = env.group(1).isEmpty() ? "\n" : env.group(1);
            String indent = indentOfNextLine(workflow, env.end());
            String insert = (env.group(1).isEmpty() ? newline : "") + indent + entry + newline;
            String updated = workflow.substring(0, env.end()) + insert + workflow.substring(env.end());
            return new TextRewrite(updated, true);
        }

        Matcher jobs = TOP_LEVEL_JOBS.matcher(workflow);
        if (jobs.find()) {
            String block = "env:\n  " + entry + "\n\n";
            String updated = workflow.substring(0, jobs.start()) + block + workflow.substring(jobs.start());
            return new TextRewrite(updated, true);
        }
        return new TextRewrite(workflow, false);
    }

    private static String indentOfNextLine(String text, int from) {
        int i = from;
        while (i < text.length()) {
            int nl = text.indexOf('\n', i);
            String line = nl < 0 ? text.substring(i) : text.substring(i, nl);
            if (!line.isBlank()) {
                Matcher m = INDENT.matcher(line);
                return m.find() ? m.group(1) : "  ";
            }
            if (nl < 0) break;
            i = nl + 1;
        }
        return "  ";
    }
}
