package com.gridfacts.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate of everything collected from one Grid Infrastructure home.
 *
 * <p>This is the sole output of {@link com.gridfacts.core.facts.FactAssembler}. Renderers
 * consume it to produce JSON or console output.
 *
 * @param clusterName cluster name from {@code cemutlo -n} (empty when unavailable)
 * @param version labelled version strings; {@code version} in CRS mode, four
 *                {@code crsctl query has} keys plus {@code version} in Oracle Restart mode
 * @param vips node VIPs
 * @param networks cluster networks
 * @param scans SCAN definitions
 * @param localListeners local listeners
 * @param scanListeners SCAN listeners (always empty in Oracle Restart mode)
 * @param databases database unique names, verbatim
 * @param crsHome Grid Infrastructure home the tools were run from
 * @param crsMode true for a full clusterware install, false for Oracle Restart
 * @param warnings failures of individual collection steps that did not abort the run
 */
public record ClusterFacts(
    String clusterName,
    Map<String, String> version,
    List<Vip> vips,
    List<Network> networks,
    List<Scan> scans,
    List<Listener> localListeners,
    List<ScanListener> scanListeners,
    List<String> databases,
    String crsHome,
    boolean crsMode,
    List<String> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public ClusterFacts {
        Objects.requireNonNull(crsHome, "crsHome must not be null");
        if (clusterName == null) {
            clusterName = "";
        }
        version = version == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(version));
        vips = vips == null ? List.of() : List.copyOf(vips);
        networks = networks == null ? List.of() : List.copyOf(networks);
        scans = scans == null ? List.of() : List.copyOf(scans);
        localListeners = localListeners == null ? List.of() : List.copyOf(localListeners);
        scanListeners = scanListeners == null ? List.of() : List.copyOf(scanListeners);
        databases = databases == null ? List.of() : List.copyOf(databases);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Returns true if any collection step reported a problem.
     *
     * @return true when warnings are present
     */
    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
