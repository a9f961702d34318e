package com.gridfacts.core.command;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one external command invocation.
 *
 * <p>Keeps "the tool ran and printed nothing" apart from "the tool failed". Callers that only
 * care about data use {@link #linesOrEmpty()}, which folds every failure into a single empty
 * line, the contract the clusterware tools have always been consumed with.
 *
 * @param command argument vector that was run
 * @param status how the invocation ended
 * @param exitCode process exit code, or -1 when the process never exited normally
 * @param lines trimmed stdout lines (possibly partial for failed invocations)
 */
public record CommandResult(
    List<String> command,
    Status status,
    int exitCode,
    List<String> lines
) {
    /**
     * How an invocation ended.
     */
    public enum Status {
        /** Exit code 0 */
        OK,
        /** Non-zero exit code */
        FAILED,
        /** Killed after exceeding the configured timeout */
        TIMED_OUT,
        /** Process could not be launched */
        NOT_STARTED
    }

    /**
     * Compact constructor with validation.
     */
    public CommandResult {
        Objects.requireNonNull(status, "status must not be null");
        command = command == null ? List.of() : List.copyOf(command);
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    /**
     * Creates a successful result.
     *
     * @param command argument vector
     * @param lines trimmed stdout lines
     * @return OK result
     */
    public static CommandResult ok(List<String> command, List<String> lines) {
        return new CommandResult(command, Status.OK, 0, lines);
    }

    /**
     * Creates a result for a process that exited with a non-zero code.
     *
     * @param command argument vector
     * @param exitCode exit code
     * @return FAILED result
     */
    public static CommandResult failed(List<String> command, int exitCode) {
        return new CommandResult(command, Status.FAILED, exitCode, List.of());
    }

    /**
     * Creates a result for a process killed on timeout.
     *
     * @param command argument vector
     * @return TIMED_OUT result
     */
    public static CommandResult timedOut(List<String> command) {
        return new CommandResult(command, Status.TIMED_OUT, -1, List.of());
    }

    /**
     * Creates a result for a process that could not be started.
     *
     * @param command argument vector
     * @return NOT_STARTED result
     */
    public static CommandResult notStarted(List<String> command) {
        return new CommandResult(command, Status.NOT_STARTED, -1, List.of());
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    /**
     * Returns true if the command succeeded and printed at least one non-blank line.
     *
     * @return true when there is usable output
     */
    public boolean hasData() {
        return isOk() && lines.stream().anyMatch(line -> !line.isBlank());
    }

    /**
     * Returns the captured lines, or a single empty line when the command did not succeed.
     *
     * @return output lines, never empty
     */
    public List<String> linesOrEmpty() {
        if (!isOk() || lines.isEmpty()) {
            return List.of("");
        }
        return lines;
    }

    /**
     * Returns the first output line, or an empty string.
     *
     * @return first line
     */
    public String firstLine() {
        return linesOrEmpty().get(0);
    }

    /**
     * Returns the command as a single space separated string for logs and messages.
     *
     * @return printable command
     */
    public String commandLine() {
        return String.join(" ", command);
    }
}
