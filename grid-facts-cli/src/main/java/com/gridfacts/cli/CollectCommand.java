package com.gridfacts.cli;

import com.gridfacts.core.command.ProcessCommandRunner;
import com.gridfacts.core.config.ConfigLoader;
import com.gridfacts.core.config.FactsConfig;
import com.gridfacts.core.facts.FactAssembler;
import com.gridfacts.core.host.GridHomeLocator;
import com.gridfacts.core.host.LocalHostResolver;
import com.gridfacts.core.host.PreconditionFailedException;
import com.gridfacts.core.model.ClusterFacts;
import com.gridfacts.core.renderer.FactsRenderer;
import com.gridfacts.core.renderer.RenderContext;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to collect facts from the local Grid Infrastructure home.
 *
 * <p>Resolves the home (option, configuration, {@code ORACLE_HOME}, running daemons, oratab),
 * runs the clusterware tools and renders the result.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * gridfacts collect
 * gridfacts collect --oracle-home /u01/app/19.0.0/grid
 * gridfacts collect --format console
 * gridfacts collect --output /tmp/gi_facts.json
 * }</pre>
 */
@Command(
    name = "collect",
    description = "Collect Grid Infrastructure facts from this host",
    mixinStandardHelpOptions = true
)
public class CollectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CollectCommand.class);

    @Option(
        names = {"--oracle-home", "--oh"},
        description = "Grid Infrastructure home (default: ORACLE_HOME or auto-detected)"
    )
    private String oracleHome;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: gridfacts.yaml)"
    )
    private Path configPath = Paths.get("gridfacts.yaml");

    @Option(
        names = {"-f", "--format"},
        description = "Output format: json or console (overrides config)"
    )
    private String format;

    @Option(
        names = {"-o", "--output"},
        description = "Output file (default: standard output)"
    )
    private Path outputFile;

    @Option(
        names = {"--timeout"},
        description = "Per-command timeout in seconds (overrides config)"
    )
    private Integer timeoutSeconds;

    @Override
    public Integer call() {
        try {
            FactsConfig config = ConfigLoader.load(configPath);

            String formatId = format != null ? format : config.outputFormat();
            Optional<FactsRenderer> renderer = findRenderer(formatId);
            if (renderer.isEmpty()) {
                log.error("Unknown format: {}. Use 'gridfacts list renderers'", formatId);
                System.err.println("✗ Unknown format: " + formatId);
                return 1;
            }

            ProcessCommandRunner runner = new ProcessCommandRunner(
                timeoutSeconds != null && timeoutSeconds > 0
                    ? Duration.ofSeconds(timeoutSeconds)
                    : config.commandTimeout());

            GridHomeLocator locator = new GridHomeLocator(
                oracleHome != null ? oracleHome : config.oracleHome(),
                System.getenv(),
                config.procRootPath(),
                config.oratabPath());

            ClusterFacts facts = new FactAssembler(runner, new LocalHostResolver()).collect(locator);
            facts.warnings().forEach(warning -> log.warn("{}", warning));

            renderer.get().render(facts, new RenderContext(resolveOutputFile(config), Map.of()));
            return 0;

        } catch (PreconditionFailedException e) {
            log.error("Cannot collect facts: {}", e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Collection failed", e);
            System.err.println("✗ Collection failed: " + e.getMessage());
            return 1;
        }
    }

    private Path resolveOutputFile(FactsConfig config) {
        if (outputFile != null) {
            return outputFile;
        }
        if (config.output() != null && config.output().file() != null && !config.output().file().isBlank()) {
            return Paths.get(config.output().file());
        }
        return null;
    }

    static Optional<FactsRenderer> findRenderer(String id) {
        for (FactsRenderer renderer : ServiceLoader.load(FactsRenderer.class)) {
            if (renderer.getId().equalsIgnoreCase(id)) {
                return Optional.of(renderer);
            }
        }
        return Optional.empty();
    }
}
