package com.gridfacts.core.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * <p>Standard error is discarded. Standard output is read on a separate thread so that a
 * chatty tool cannot block on a full pipe while we wait for it with a timeout.
 */
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final Duration timeout;

    public ProcessCommandRunner() {
        this(DEFAULT_TIMEOUT);
    }

    /**
     * Creates a runner with the given per-command timeout.
     *
     * @param timeout maximum time to wait for each command
     */
    public ProcessCommandRunner(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public CommandResult run(List<String> command) {
        String printable = String.join(" ", command);
        log.debug("Running: {}", printable);

        Process process;
        try {
            process = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
        } catch (IOException e) {
            log.warn("Could not start command: {} ({})", printable, e.getMessage());
            return CommandResult.notStarted(command);
        }

        CompletableFuture<List<String>> output = CompletableFuture.supplyAsync(() -> readLines(process));

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                destroyTree(process, output);
                log.warn("Command timed out after {}s: {}", timeout.toSeconds(), printable);
                return CommandResult.timedOut(command);
            }

            int exitCode = process.exitValue();
            List<String> lines = output.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (exitCode != 0) {
                log.debug("Command exited with code {}: {}", exitCode, printable);
                return CommandResult.failed(command, exitCode);
            }

            log.debug("Command produced {} lines: {}", lines.size(), printable);
            return CommandResult.ok(command, lines);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyTree(process, output);
            log.warn("Interrupted while waiting for: {}", printable);
            return CommandResult.timedOut(command);
        } catch (TimeoutException e) {
            // exited, but a background child still holds stdout open
            destroyTree(process, output);
            log.warn("Output of {} not complete after {}s", printable, timeout.toSeconds());
            return CommandResult.timedOut(command);
        } catch (ExecutionException e) {
            log.warn("Could not read output of: {} ({})", printable, e.getMessage());
            return CommandResult.failed(command, process.exitValue());
        }
    }

    /**
     * Kills the process and everything it started, then abandons the output reader.
     *
     * <p>The clusterware tools are shell wrappers around a JVM, so killing only the wrapper
     * leaves the worker running and holding stdout.
     */
    private static void destroyTree(Process process, CompletableFuture<List<String>> output) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        output.cancel(true);
    }

    private static List<String> readLines(Process process) {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line.strip());
            }
        } catch (IOException e) {
            // Stream closes when the process is destroyed; keep what was read
            log.debug("Output stream closed early: {}", e.getMessage());
        }
        return lines;
    }
}
