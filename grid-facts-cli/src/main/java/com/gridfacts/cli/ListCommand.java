package com.gridfacts.cli;

import com.gridfacts.core.detect.ClusterModeDetector;
import com.gridfacts.core.parser.impl.EndpointFormat;
import com.gridfacts.core.renderer.FactsRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available renderers or the output formats understood by the parsers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * gridfacts list renderers
 * gridfacts list formats
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available renderers or supported clusterware output formats",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: renderers or formats"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase()) {
            case "renderers", "renderer" -> listRenderers();
            case "formats", "format" -> listFormats();
            default -> {
                log.error("Unknown type: {}. Use: renderers or formats", type);
                yield 1;
            }
        };
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        boolean found = false;
        for (FactsRenderer renderer : ServiceLoader.load(FactsRenderer.class)) {
            found = true;
            System.out.printf("  • %s%n", renderer.getId());
        }

        if (!found) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }

    private int listFormats() {
        System.out.println("SCAN listener endpoint formats (tried in order):");
        for (EndpointFormat endpointFormat : EndpointFormat.KNOWN_FORMATS) {
            System.out.printf("  • %s: %s%n", endpointFormat.release(), endpointFormat.pattern().pattern());
        }
        System.out.println();
        System.out.println("Oracle Restart version queries:");
        for (String query : ClusterModeDetector.RESTART_VERSION_QUERIES) {
            System.out.printf("  • crsctl query has %s%n", query);
        }
        return 0;
    }
}
