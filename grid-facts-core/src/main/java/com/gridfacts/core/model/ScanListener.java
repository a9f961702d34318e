package com.gridfacts.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * SCAN listener of one cluster network.
 *
 * @param networkId network number
 * @param scanAddress fully qualified SCAN name of the network
 * @param endpoints raw endpoint spec
 * @param protocolPorts lower-cased protocol to port, in endpoint order
 * @param ipv4 SCAN IPv4 addresses
 * @param ipv6 SCAN IPv6 addresses
 */
public record ScanListener(
    String networkId,
    String scanAddress,
    String endpoints,
    Map<String, String> protocolPorts,
    List<String> ipv4,
    List<String> ipv6
) {
    /**
     * Compact constructor with validation.
     */
    public ScanListener {
        Objects.requireNonNull(networkId, "networkId must not be null");
        Objects.requireNonNull(endpoints, "endpoints must not be null");
        protocolPorts = protocolPorts == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(protocolPorts));
        ipv4 = ipv4 == null ? List.of() : List.copyOf(ipv4);
        ipv6 = ipv6 == null ? List.of() : List.copyOf(ipv6);
    }
}
