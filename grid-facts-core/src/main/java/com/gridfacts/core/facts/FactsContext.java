package com.gridfacts.core.facts;

import com.gridfacts.core.host.GridTools;
import com.gridfacts.core.model.Network;
import com.gridfacts.core.model.Scan;
import com.gridfacts.core.model.Vip;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * State shared by the collection steps of one run.
 *
 * <p>Each step receives the context built by the steps before it, so the dependency of
 * listeners on VIPs and SCANs is visible in the method signatures.
 *
 * @param tools tool paths
 * @param shortHostname local host name without domain
 * @param crsMode true for a full clusterware install
 * @param networks networks keyed by network number
 * @param vips VIPs of this node keyed by network number
 * @param scans SCANs keyed by network number
 */
public record FactsContext(
    GridTools tools,
    String shortHostname,
    boolean crsMode,
    Map<String, Network> networks,
    Map<String, Vip> vips,
    Map<String, Scan> scans
) {
    /**
     * Compact constructor with validation.
     */
    public FactsContext {
        Objects.requireNonNull(tools, "tools must not be null");
        Objects.requireNonNull(shortHostname, "shortHostname must not be null");
        networks = copy(networks);
        vips = copy(vips);
        scans = copy(scans);
    }

    /**
     * Creates a context before any record has been parsed.
     *
     * @param tools tool paths
     * @param shortHostname local host name without domain
     * @param crsMode true for a full clusterware install
     * @return initial context
     */
    public static FactsContext initial(GridTools tools, String shortHostname, boolean crsMode) {
        return new FactsContext(tools, shortHostname, crsMode, Map.of(), Map.of(), Map.of());
    }

    public FactsContext withNetworks(Map<String, Network> networks) {
        return new FactsContext(tools, shortHostname, crsMode, networks, vips, scans);
    }

    public FactsContext withVips(Map<String, Vip> vips) {
        return new FactsContext(tools, shortHostname, crsMode, networks, vips, scans);
    }

    public FactsContext withScans(Map<String, Scan> scans) {
        return new FactsContext(tools, shortHostname, crsMode, networks, vips, scans);
    }

    /**
     * Returns the srvctl path as a string for building command lines.
     *
     * @return srvctl path
     */
    public String srvctl() {
        return tools.srvctl().toString();
    }

    private static <V> Map<String, V> copy(Map<String, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
