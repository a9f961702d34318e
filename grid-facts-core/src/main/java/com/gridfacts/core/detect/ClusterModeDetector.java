package com.gridfacts.core.detect;

import com.gridfacts.core.command.CommandResult;
import com.gridfacts.core.command.CommandRunner;
import com.gridfacts.core.host.GridTools;
import com.gridfacts.core.host.PreconditionFailedException;
import com.gridfacts.core.parser.impl.VersionLineParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Tells a full clusterware install from Oracle Restart and reads the software version.
 *
 * <p>{@code olsnodes} lists cluster nodes; on Oracle Restart it prints nothing, which is the
 * only signal used to pick the mode.
 */
public class ClusterModeDetector {

    private static final Logger log = LoggerFactory.getLogger(ClusterModeDetector.class);

    /** Key holding the headline version in both modes. */
    public static final String VERSION = "version";

    /** {@code crsctl query has} sub-queries, in query order. */
    public static final List<String> RESTART_VERSION_QUERIES =
        List.of("releaseversion", "releasepatch", "softwareversion", "softwarepatch");

    private final CommandRunner runner;
    private final VersionLineParser versionParser;

    public ClusterModeDetector(CommandRunner runner) {
        this(runner, new VersionLineParser());
    }

    public ClusterModeDetector(CommandRunner runner, VersionLineParser versionParser) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.versionParser = Objects.requireNonNull(versionParser, "versionParser must not be null");
    }

    /**
     * Returns true when {@code olsnodes} lists at least one node.
     *
     * <p>A non-zero exit without output means Oracle Restart. A timeout or a launch failure
     * says nothing about the mode and is fatal.
     *
     * @param tools tool paths
     * @return true for a full clusterware install, false for Oracle Restart
     * @throws PreconditionFailedException if {@code olsnodes} timed out or could not be started
     */
    public boolean isCrsMode(GridTools tools) {
        CommandResult result = runner.run(tools.olsnodes().toString());
        if (result.status() == CommandResult.Status.TIMED_OUT
                || result.status() == CommandResult.Status.NOT_STARTED) {
            throw new PreconditionFailedException(
                "Cannot detect cluster mode: " + result.commandLine() + " " + describe(result.status()));
        }
        boolean crs = result.hasData();
        log.info("Detected {} mode", crs ? "clusterware" : "Oracle Restart");
        return crs;
    }

    private static String describe(CommandResult.Status status) {
        return status == CommandResult.Status.TIMED_OUT ? "timed out" : "could not be started";
    }

    /**
     * Reads the software version.
     *
     * <p>In clusterware mode the raw {@code crsctl query crs activeversion} line is stored under
     * {@value #VERSION}. In Oracle Restart mode each of {@link #RESTART_VERSION_QUERIES} is stored
     * under its own key: the bracketed version when the line ends with one, else the raw line.
     * {@value #VERSION} then holds the first bracketed version found.
     *
     * @param tools tool paths
     * @param crsMode result of {@link #isCrsMode(GridTools)}
     * @return version keys in query order
     */
    public Map<String, String> detectVersion(GridTools tools, boolean crsMode) {
        Map<String, String> version = new LinkedHashMap<>();
        String crsctl = tools.crsctl().toString();

        if (crsMode) {
            version.put(VERSION, runner.run(crsctl, "query", "crs", "activeversion").firstLine());
            return version;
        }

        for (String query : RESTART_VERSION_QUERIES) {
            String line = runner.run(crsctl, "query", "has", query).firstLine();
            Optional<String> extracted = versionParser.extractVersion(line);
            if (extracted.isPresent()) {
                version.put(query, extracted.get());
                version.putIfAbsent(VERSION, extracted.get());
            } else {
                log.debug("No bracketed version in {} output, keeping raw line: {}", query, line);
                version.put(query, line);
            }
        }
        return version;
    }
}
