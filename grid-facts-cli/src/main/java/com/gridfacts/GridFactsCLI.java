package com.gridfacts;

import com.gridfacts.cli.CollectCommand;
import com.gridfacts.cli.ListCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for Grid Facts.
 *
 * <p>Grid Facts runs the Oracle Grid Infrastructure tools of the local host and reports the
 * cluster topology (networks, VIPs, SCANs, listeners, databases) as JSON or as a summary.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code collect} - Collect facts from the local Grid Infrastructure home</li>
 *   <li>{@code list} - List available renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Collect facts, home taken from ORACLE_HOME or discovered
 * gridfacts collect
 *
 * # Explicit home, human-readable output
 * gridfacts collect --oracle-home /u01/app/19.0.0/grid --format console
 * }</pre>
 */
@Command(
    name = "gridfacts",
    mixinStandardHelpOptions = true,
    version = "Grid Facts 1.0.0-SNAPSHOT",
    description = "Collects Oracle Grid Infrastructure topology facts",
    subcommands = {
        CollectCommand.class,
        ListCommand.class
    }
)
public class GridFactsCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(GridFactsCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("Grid Facts - Oracle Grid Infrastructure topology collector");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'gridfacts --help' to see available commands");
        System.out.println("Use 'gridfacts <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the picocli command line with the logging options applied before any sub-command runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        GridFactsCLI cli = new GridFactsCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }
}
