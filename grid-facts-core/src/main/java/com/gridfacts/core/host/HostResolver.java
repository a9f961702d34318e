package com.gridfacts.core.host;

/**
 * Host name lookups needed while collecting facts.
 */
public interface HostResolver {

    /**
     * Returns the local host name up to the first dot.
     *
     * @return short host name
     */
    String shortHostname();

    /**
     * Returns the fully qualified form of a host name.
     *
     * <p>Names that already contain a dot are returned unchanged.
     *
     * @param hostname short or qualified host name
     * @return fully qualified name, or {@code hostname} when it cannot be resolved
     */
    String fqdn(String hostname);
}
