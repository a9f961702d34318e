package com.gridfacts.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Single Client Access Name configured on one cluster network.
 *
 * <p>A SCAN usually resolves to several addresses, so both address families are lists
 * kept in the order the clusterware reported them.
 *
 * @param networkId owning network number
 * @param name SCAN name as configured
 * @param fqdn fully qualified form of {@code name}
 * @param ipv4 IPv4 SCAN VIP addresses
 * @param ipv6 IPv6 SCAN VIP addresses
 */
public record Scan(
    String networkId,
    String name,
    String fqdn,
    List<String> ipv4,
    List<String> ipv6
) {
    /**
     * Compact constructor with validation.
     */
    public Scan {
        Objects.requireNonNull(networkId, "networkId must not be null");
        ipv4 = ipv4 == null ? List.of() : List.copyOf(ipv4);
        ipv6 = ipv6 == null ? List.of() : List.copyOf(ipv6);
    }
}
