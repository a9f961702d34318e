package com.gridfacts.core.command;

import java.util.Arrays;
import java.util.List;

/**
 * Runs an external command and captures its standard output.
 *
 * <p>Implementations never throw for a failing tool; the failure is reported through
 * {@link CommandResult#status()}.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * Runs the given argument vector and waits for it to finish.
     *
     * @param command program path followed by its arguments
     * @return captured result
     */
    CommandResult run(List<String> command);

    /**
     * Varargs convenience for {@link #run(List)}.
     *
     * @param command program path followed by its arguments
     * @return captured result
     */
    default CommandResult run(String... command) {
        return run(Arrays.asList(command));
    }
}
