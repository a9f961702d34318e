package com.gridfacts.core.model;

import java.util.Objects;

/**
 * A logical cluster network as reported by {@code srvctl config network}.
 *
 * @param id network number (small non-negative integer, unique per host)
 * @param ipv4Subnet IPv4 subnet line content, or null when not configured
 * @param ipv6Subnet IPv6 subnet line content, or null when not configured
 */
public record Network(
    String id,
    String ipv4Subnet,
    String ipv6Subnet
) {
    /**
     * Compact constructor with validation.
     */
    public Network {
        Objects.requireNonNull(id, "id must not be null");
    }
}
