package com.gridfacts.core.resolver;

import com.gridfacts.core.model.Listener;
import com.gridfacts.core.model.Scan;
import com.gridfacts.core.model.ScanListener;
import com.gridfacts.core.model.Vip;
import com.gridfacts.core.parser.base.EndpointSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Links listeners to the VIP or SCAN of their network.
 *
 * <p>Both maps are keyed by network number and must be complete before any listener is resolved.
 * The resolver only reads them, so calls may run concurrently.
 */
public class CrossReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(CrossReferenceResolver.class);

    private final Map<String, Vip> vipsByNetwork;
    private final Map<String, Scan> scansByNetwork;

    /**
     * Creates a resolver over already parsed VIPs and SCANs.
     *
     * @param vipsByNetwork VIPs keyed by network number
     * @param scansByNetwork SCANs keyed by network number
     */
    public CrossReferenceResolver(Map<String, Vip> vipsByNetwork, Map<String, Scan> scansByNetwork) {
        this.vipsByNetwork = vipsByNetwork == null ? Map.of() : Map.copyOf(vipsByNetwork);
        this.scansByNetwork = scansByNetwork == null ? Map.of() : Map.copyOf(scansByNetwork);
    }

    /**
     * Copies the address fields of the listener's VIP onto the listener.
     *
     * @param listener unresolved listener
     * @return resolved listener, or the input unchanged if its network has no VIP
     */
    public Listener resolve(Listener listener) {
        if (listener.networkId() == null) {
            return listener;
        }
        Vip vip = vipsByNetwork.get(listener.networkId());
        if (vip == null) {
            log.debug("Listener {} is on network {} which has no VIP on this node",
                listener.name(), listener.networkId());
            return listener;
        }
        return listener.withVip(vip);
    }

    /**
     * Builds the SCAN listener record of a network.
     *
     * @param networkId network number
     * @param endpoints endpoint spec found for the network
     * @return SCAN listener, empty when the network has no SCAN
     */
    public Optional<ScanListener> scanListener(String networkId, String endpoints) {
        Scan scan = scansByNetwork.get(networkId);
        if (scan == null) {
            log.debug("No SCAN on network {}, skipping SCAN listener", networkId);
            return Optional.empty();
        }
        return Optional.of(new ScanListener(
            networkId,
            scan.fqdn(),
            endpoints,
            EndpointSpec.parse(endpoints),
            scan.ipv4(),
            scan.ipv6()
        ));
    }
}
