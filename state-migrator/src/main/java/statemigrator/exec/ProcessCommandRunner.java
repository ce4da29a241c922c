package statemigrator.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import statemigrator.exceptions.CommandInterruptedException;
import statemigrator.exceptions.CommandTimeoutException;
import statemigrator.security.SecretSanitizer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * <p>stdout and stderr are drained on a shared daemon pool while the caller waits on
 * the process, so a child filling its pipe buffer cannot deadlock. When the timeout
 * expires, descendants are destroyed before the process itself.
 */
public final class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    // Daemon threads so readers never keep the JVM alive
    private static final ExecutorService READERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "command-output-reader");
        t.setDaemon(true);
        return t;
    });

    private static final long DRAIN_GRACE_MS = 2_000;

    private final SecretSanitizer sanitizer;

    public ProcessCommandRunner() {
        this(SecretSanitizer.INSTANCE);
    }

    public ProcessCommandRunner(SecretSanitizer sanitizer) {
        this.sanitizer = sanitizer;
    }

    @Override
    public CommandResult run(CommandRequest request) {
        String display = sanitizer.sanitize(request.display());
        if (request.dryRun()) {
            log.info("[dry-run] would run: {}", display);
            return CommandResult.dryRunResult();
        }

        log.debug("Running: {}", display);
        ProcessBuilder pb = new ProcessBuilder(request.argv());
        if (request.workingDir() != null) {
            pb.directory(request.workingDir().toFile());
        }
        pb.environment().putAll(request.environment());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.warn("Cannot start '{}': {}", request.executable(), e.getMessage());
            return new CommandResult(CommandResult.NOT_FOUND, "", sanitizer.sanitize(e.getMessage()), false);
        }
        // nothing is ever written to the child
        closeQuietly(process);

        CompletableFuture<String> out = drain(process.getInputStream());
        CompletableFuture<String> err = drain(process.getErrorStream());

        boolean finished = waitFor(process, request);
        if (!finished) {
            destroyTree(process);
            out.cancel(true);
            err.cancel(true);
            log.warn("Command '{}' timed out after {} s; process tree destroyed",
                    request.executable(), request.timeout().toSeconds());
            throw new CommandTimeoutException(request.executable(), request.timeout());
        }

        CommandResult result = new CommandResult(
                process.exitValue(),
                sanitizer.sanitize(collect(out)),
                sanitizer.sanitize(collect(err)),
                false);
        log.debug("'{}' exited with {}", request.executable(), result.exitCode());
        return result;
    }

    private boolean waitFor(Process process, CommandRequest request) {
        try {
            if (request.timeout().isZero() || request.timeout().isNegative()) {
                process.waitFor();
                return true;
            }
            return process.waitFor(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyTree(process);
            log.warn("Interrupted while waiting for '{}'; process tree destroyed", request.executable());
            throw new CommandInterruptedException(request.executable(), e);
        }
    }

    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(DRAIN_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                return "<output unavailable: " + e.getMessage() + ">";
            }
        }, READERS);
    }

    private static String collect(CompletableFuture<String> future) {
        try {
            return future.get(DRAIN_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException e) {
            // a grandchild may still hold the pipe open
            future.cancel(true);
            return "<output incomplete>";
        }
    }

    private static void closeQuietly(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Closing stdin failed: {}", e.getMessage());
        }
    }
}
