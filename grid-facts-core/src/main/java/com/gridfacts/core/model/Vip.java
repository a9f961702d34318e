package com.gridfacts.core.model;

import java.util.Objects;

/**
 * Node virtual IP bound to one cluster network.
 *
 * @param networkId owning network number
 * @param name VIP host name as configured
 * @param fqdn fully qualified form of {@code name}
 * @param ipv4 IPv4 address, or null
 * @param ipv6 IPv6 address, or null
 */
public record Vip(
    String networkId,
    String name,
    String fqdn,
    String ipv4,
    String ipv6
) {
    /**
     * Compact constructor with validation.
     */
    public Vip {
        Objects.requireNonNull(networkId, "networkId must not be null");
    }
}
