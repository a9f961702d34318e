package com.gridfacts.core.facts;

import com.gridfacts.core.command.CommandResult;
import com.gridfacts.core.command.CommandRunner;
import com.gridfacts.core.detect.ClusterModeDetector;
import com.gridfacts.core.host.GridHomeLocator;
import com.gridfacts.core.host.GridTools;
import com.gridfacts.core.host.HostResolver;
import com.gridfacts.core.model.ClusterFacts;
import com.gridfacts.core.model.Listener;
import com.gridfacts.core.model.Network;
import com.gridfacts.core.model.Scan;
import com.gridfacts.core.model.ScanListener;
import com.gridfacts.core.model.Vip;
import com.gridfacts.core.parser.MalformedRecordException;
import com.gridfacts.core.parser.RecordParser;
import com.gridfacts.core.parser.impl.ListenerConfigParser;
import com.gridfacts.core.parser.impl.ListenerStatusParser;
import com.gridfacts.core.parser.impl.NetworkParser;
import com.gridfacts.core.parser.impl.ScanListenerEndpointParser;
import com.gridfacts.core.parser.impl.ScanParser;
import com.gridfacts.core.parser.impl.VipParser;
import com.gridfacts.core.resolver.CrossReferenceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Collects {@link ClusterFacts} from a Grid Infrastructure home.
 *
 * <p>Steps run strictly in this order, each one seeing what the previous ones produced:
 * <ol>
 *   <li>resolve the home and verify the tools (fatal on failure)</li>
 *   <li>detect clusterware or Oracle Restart mode</li>
 *   <li>cluster name and version</li>
 *   <li>networks, then VIPs, then SCANs</li>
 *   <li>local listeners (need the VIPs) and, in clusterware mode, SCAN listeners (need the SCANs)</li>
 *   <li>database list</li>
 * </ol>
 *
 * <p>A {@link MalformedRecordException} in one record type empties that type only and is
 * reported in {@link ClusterFacts#warnings()}; the other types are still collected.
 */
public class FactAssembler {

    private static final Logger log = LoggerFactory.getLogger(FactAssembler.class);

    private final CommandRunner runner;
    private final HostResolver hostResolver;
    private final ClusterModeDetector modeDetector;
    private final RecordParser<Network> networkParser;
    private final RecordParser<Vip> vipParser;
    private final RecordParser<Scan> scanParser;
    private final ListenerStatusParser listenerStatusParser = new ListenerStatusParser();
    private final ListenerConfigParser listenerConfigParser = new ListenerConfigParser();
    private final ScanListenerEndpointParser scanListenerParser = new ScanListenerEndpointParser();

    /**
     * Creates an assembler.
     *
     * @param runner runs the clusterware tools
     * @param hostResolver local host name and FQDN lookups
     */
    public FactAssembler(CommandRunner runner, HostResolver hostResolver) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.hostResolver = Objects.requireNonNull(hostResolver, "hostResolver must not be null");
        this.modeDetector = new ClusterModeDetector(runner);
        this.networkParser = new NetworkParser();
        this.vipParser = new VipParser(hostResolver);
        this.scanParser = new ScanParser(hostResolver);
    }

    /**
     * Locates the home, verifies its tools and collects facts.
     *
     * @param locator home locator
     * @return collected facts
     * @throws com.gridfacts.core.host.PreconditionFailedException if the home or its tools are missing
     */
    public ClusterFacts collect(GridHomeLocator locator) {
        Path home = locator.resolve();
        log.info("Using Grid Infrastructure home: {}", home);
        return collect(GridTools.forHome(home).verify());
    }

    /**
     * Collects facts using the given tools without verifying them.
     *
     * @param tools tool paths
     * @return collected facts
     */
    public ClusterFacts collect(GridTools tools) {
        List<String> warnings = new ArrayList<>();

        boolean crsMode = modeDetector.isCrsMode(tools);
        FactsContext initial = FactsContext.initial(tools, hostResolver.shortHostname(), crsMode);

        String clusterName = runner.run(tools.cemutlo().toString(), "-n").firstLine();
        Map<String, String> version = modeDetector.detectVersion(tools, crsMode);

        FactsContext withNetworks = initial.withNetworks(
            step(networkParser.getId(), () -> collectNetworks(initial), Map.of(), warnings));
        FactsContext withVips = withNetworks.withVips(
            step(vipParser.getId(), () -> collectVips(withNetworks), Map.of(), warnings));
        FactsContext context = withVips.withScans(
            step(scanParser.getId(), () -> collectScans(withVips), Map.of(), warnings));

        List<Listener> listeners = step("local_listener", () -> collectListeners(context), List.of(), warnings);
        List<ScanListener> scanListeners = crsMode
            ? step("scan_listener", () -> collectScanListeners(context), List.of(), warnings)
            : List.of();
        List<String> databases = collectDatabases(context);

        log.info("Collected {} networks, {} VIPs, {} SCANs, {} listeners, {} SCAN listeners, {} databases",
            context.networks().size(), context.vips().size(), context.scans().size(),
            listeners.size(), scanListeners.size(), databases.size());

        return new ClusterFacts(
            clusterName,
            version,
            List.copyOf(context.vips().values()),
            List.copyOf(context.networks().values()),
            List.copyOf(context.scans().values()),
            listeners,
            scanListeners,
            databases,
            tools.home().toString(),
            crsMode,
            warnings
        );
    }

    public Map<String, Network> collectNetworks(FactsContext context) {
        return parse(networkParser, runner.run(context.srvctl(), "config", "network"));
    }

    public Map<String, Vip> collectVips(FactsContext context) {
        return parse(vipParser, runner.run(context.srvctl(), "config", "vip", "-n", context.shortHostname()));
    }

    public Map<String, Scan> collectScans(FactsContext context) {
        return parse(scanParser, runner.run(context.srvctl(), "config", "scan", "-all"));
    }

    /**
     * Collects the enabled local listeners and links them to this node's VIPs.
     *
     * @param context context holding the VIPs
     * @return listeners in status output order
     */
    public List<Listener> collectListeners(FactsContext context) {
        List<String> command = new ArrayList<>(List.of(context.srvctl(), "status", "listener"));
        if (context.crsMode()) {
            command.addAll(List.of("-n", context.shortHostname()));
        }
        List<String> names = listenerStatusParser.enabledListeners(runner.run(command).linesOrEmpty());

        CrossReferenceResolver resolver = new CrossReferenceResolver(context.vips(), context.scans());
        List<Listener> listeners = new ArrayList<>();
        for (String name : names) {
            CommandResult config = runner.run(context.srvctl(), "config", "listener", "-l", name);
            listeners.add(resolver.resolve(listenerConfigParser.parse(name, config.linesOrEmpty())));
        }
        return listeners;
    }

    /**
     * Collects one SCAN listener per network that has a SCAN and reports endpoints.
     *
     * @param context context holding the networks and SCANs
     * @return SCAN listeners in network order
     */
    public List<ScanListener> collectScanListeners(FactsContext context) {
        CrossReferenceResolver resolver = new CrossReferenceResolver(context.vips(), context.scans());
        List<ScanListener> scanListeners = new ArrayList<>();
        for (String networkId : context.networks().keySet()) {
            CommandResult output = runner.run(context.srvctl(), "config", "scan_listener", "-k", networkId);
            Optional<String> endpoints = scanListenerParser.findEndpoints(output.linesOrEmpty());
            endpoints.flatMap(spec -> resolver.scanListener(networkId, spec)).ifPresent(scanListeners::add);
        }
        return scanListeners;
    }

    /**
     * Returns the configured database names as printed by {@code srvctl config database}.
     *
     * @param context run context
     * @return non-blank output lines
     */
    public List<String> collectDatabases(FactsContext context) {
        return runner.run(context.srvctl(), "config", "database").linesOrEmpty().stream()
            .filter(line -> !line.isBlank())
            .toList();
    }

    private <T> Map<String, T> parse(RecordParser<T> parser, CommandResult result) {
        if (!result.isOk()) {
            log.debug("No {} data: {} ended with {}", parser.getId(), result.commandLine(), result.status());
        }
        return parser.parse(result.linesOrEmpty(), result.commandLine());
    }

    private <T> T step(String id, Supplier<T> collector, T fallback, List<String> warnings) {
        try {
            return collector.get();
        } catch (MalformedRecordException e) {
            log.warn("Skipping {} records: {}", id, e.getMessage());
            warnings.add(id + ": " + e.getMessage());
            return fallback;
        }
    }
}
