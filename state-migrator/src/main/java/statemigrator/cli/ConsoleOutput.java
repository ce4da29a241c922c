package statemigrator.cli;

import picocli.CommandLine;
import statemigrator.batch.BatchSummary;
import statemigrator.pipeline.RepositoryOutcome;
import statemigrator.preflight.PreflightReport;
import statemigrator.preflight.PreflightResult;

import java.time.Duration;
import java.util.Locale;

/**
 * ANSI-colored terminal output for the migration CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "================================================================";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner(boolean dryRun) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) STATE MIGRATOR|@" + (dryRun ? " @|fg(magenta) (dry run)|@" : "")));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(cyan) [MIGRATE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) x|@ " + message));
    }

    public static void preflight(PreflightReport report) {
        for (PreflightResult result : report.results()) {
            if (result.isOk()) {
                success(result.name() + ": " + result.message());
            } else {
                error(result.name() + ": " + result.message());
            }
        }
    }

    /**
     * Prints the end-of-batch summary, followed by rollback steps when a real run had failures.
     */
    public static void summary(BatchSummary summary, boolean dryRun, String branch) {
        System.out.println();
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold   MIGRATION SUMMARY|@"));
        System.out.println(RULE);
        System.out.println("Total repositories: " + summary.total());
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "Succeeded: @|fg(green) " + summary.succeededCount() + "|@"
                        + "  Failed: @|fg(red) " + summary.failedCount() + "|@"
                        + "  Skipped: @|fg(yellow) " + summary.skippedCount() + "|@"));
        System.out.println("Duration: " + formatDuration(summary.duration())
                + "  Peak concurrency: " + summary.peakConcurrency());

        for (RepositoryOutcome outcome : summary.outcomes()) {
            String name = outcome.target().fullName();
            switch (outcome.status()) {
                case SUCCEEDED -> {
                    String detail = outcome.proposalUrl() != null ? " " + outcome.proposalUrl() : "";
                    success(name + detail);
                    outcome.warnings().forEach(w ->
                            warn("  " + w.stage().displayName() + ": " + w.message()));
                }
                case SKIPPED -> warn(name + " skipped: " + outcome.reason());
                case FAILED -> error(name + " failed at "
                        + outcome.firstFailedStage().map(s -> s.displayName()).orElse("startup")
                        + ": " + outcome.firstFailure().map(f -> f.message()).orElse(outcome.reason()));
            }
        }

        if (summary.failedCount() > 0) {
            System.out.println();
            info("Retry failed repositories with: " + summary.retryArgument());
            if (!dryRun) {
                printRollback(branch);
            }
        }
        System.out.println(RULE);
    }

    private static void printRollback(String branch) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold,fg(red)   ROLLBACK INSTRUCTIONS|@"));
        System.out.println("For failed migrations you may need to:");
        System.out.println("  1. Close the pull request, if one was opened");
        System.out.println("  2. Delete the migration branch: git push origin --delete " + branch);
        System.out.println("  3. Review the log files in the migration log directory");
        System.out.println("  4. Re-run the migration after fixing the issues");
    }

    static String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        if (seconds < 60) {
            return String.format(Locale.ROOT, "%.1fs", duration.toMillis() / 1000.0);
        }
        long minutes = seconds / 60;
        if (minutes < 60) {
            return minutes + "m " + (seconds % 60) + "s";
        }
        return (minutes / 60) + "h " + (minutes % 60) + "m";
    }
}
