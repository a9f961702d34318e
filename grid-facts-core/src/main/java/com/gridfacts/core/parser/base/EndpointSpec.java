package com.gridfacts.core.parser.base;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Splits listener endpoint specs such as {@code TCP:1521/TCPS:1522}.
 */
public final class EndpointSpec {

    private EndpointSpec() {
        // Utility class
    }

    /**
     * Parses an endpoint spec into protocol to port.
     *
     * <p>Protocols are lower-cased. Tokens without a colon are skipped.
     *
     * @param spec endpoint spec, may be null
     * @return protocol to port in spec order
     */
    public static Map<String, String> parse(String spec) {
        if (spec == null || spec.isBlank()) {
            return Map.of();
        }
        Map<String, String> ports = new LinkedHashMap<>();
        for (String token : spec.trim().split("/")) {
            int colon = token.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String protocol = token.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String port = token.substring(colon + 1).trim();
            ports.put(protocol, port);
        }
        return Collections.unmodifiableMap(ports);
    }
}
