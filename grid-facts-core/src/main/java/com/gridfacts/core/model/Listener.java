package com.gridfacts.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Local (node) listener registered with the clusterware.
 *
 * <p>{@code address}, {@code ipv4} and {@code ipv6} are copied from the VIP of the listener's
 * network; they stay null when the listener has no network or the network has no VIP on this node.
 *
 * @param name listener name
 * @param type listener type (e.g. "Database Listener")
 * @param networkId network number, or null when not reported
 * @param endpoints raw endpoint spec, e.g. {@code TCP:1521/TCPS:1522}
 * @param protocolPorts lower-cased protocol to port, in endpoint order
 * @param address VIP fully qualified name, or null
 * @param ipv4 VIP IPv4 address, or null
 * @param ipv6 VIP IPv6 address, or null
 */
public record Listener(
    String name,
    String type,
    String networkId,
    String endpoints,
    Map<String, String> protocolPorts,
    String address,
    String ipv4,
    String ipv6
) {
    /**
     * Compact constructor with validation.
     */
    public Listener {
        Objects.requireNonNull(name, "name must not be null");
        protocolPorts = protocolPorts == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(protocolPorts));
    }

    /**
     * Returns a copy of this listener carrying the given VIP's addresses.
     *
     * @param vip VIP of the listener's network
     * @return resolved listener
     */
    public Listener withVip(Vip vip) {
        return new Listener(name, type, networkId, endpoints, protocolPorts, vip.fqdn(), vip.ipv4(), vip.ipv6());
    }

    /**
     * Returns true if the VIP-derived address fields are populated.
     *
     * @return true when resolved against a VIP
     */
    public boolean isResolved() {
        return address != null;
    }
}
