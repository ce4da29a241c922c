package statemigrator.cli;

import statemigrator.pipeline.RepositoryTarget;
import statemigrator.stage.ProposalApprover;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Asks the operator on the console before each proposal is opened. Prompts from
 * concurrent workers are serialized so questions and answers never interleave.
 */
class ConsoleConfirmationPrompt implements ProposalApprover {

    private final BufferedReader in;
    private final PrintStream out;

    ConsoleConfirmationPrompt(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public synchronized boolean approve(RepositoryTarget target, String title) {
        out.print("Open pull request \"" + title + "\" for " + target.fullName() + "? [y/N] ");
        out.flush();
        String answer;
        try {
            answer = in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read confirmation for " + target.fullName(), e);
        }
        if (answer == null) {
            // end of input counts as a decline
            return false;
        }
        String normalized = answer.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("y") || normalized.equals("yes");
    }
}
