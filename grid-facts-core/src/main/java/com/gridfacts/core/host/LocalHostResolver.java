package com.gridfacts.core.host;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * {@link HostResolver} using the JVM's name service.
 */
public class LocalHostResolver implements HostResolver {

    private static final Logger log = LoggerFactory.getLogger(LocalHostResolver.class);

    @Override
    public String shortHostname() {
        String hostname;
        try {
            hostname = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Could not determine local host name: {}", e.getMessage());
            hostname = System.getenv().getOrDefault("HOSTNAME", "localhost");
        }
        int dot = hostname.indexOf('.');
        return dot < 0 ? hostname : hostname.substring(0, dot);
    }

    @Override
    public String fqdn(String hostname) {
        if (hostname == null || hostname.isEmpty() || hostname.contains(".")) {
            return hostname;
        }
        try {
            String canonical = InetAddress.getByName(hostname).getCanonicalHostName();
            // getCanonicalHostName falls back to the literal address when reverse lookup fails
            return canonical.contains(".") && !Character.isDigit(canonical.charAt(0)) ? canonical : hostname;
        } catch (UnknownHostException e) {
            log.debug("Could not resolve {}: {}", hostname, e.getMessage());
            return hostname;
        }
    }
}
