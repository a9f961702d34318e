package com.gridfacts.core.parser.impl;

import com.gridfacts.core.parser.base.AbstractLineParser;

import java.util.List;
import java.util.Optional;

/**
 * Finds the endpoint spec in {@code srvctl config scan_listener -k <network>} output.
 *
 * <pre>
 * SCAN Listeners for network 1:
 * Registration invited nodes:
 * Registration invited subnets:
 * Endpoints: TCP:1521
 * SCAN Listener LISTENER_SCAN1 exists
 * </pre>
 */
public class ScanListenerEndpointParser extends AbstractLineParser {

    private final List<EndpointFormat> formats;

    public ScanListenerEndpointParser() {
        this(EndpointFormat.KNOWN_FORMATS);
    }

    /**
     * Creates a parser trying the given formats in order.
     *
     * @param formats endpoint formats, most recent release first
     */
    public ScanListenerEndpointParser(List<EndpointFormat> formats) {
        this.formats = List.copyOf(formats);
    }

    /**
     * Returns the endpoint spec from the first line matching any format.
     *
     * @param lines output lines
     * @return endpoint spec, empty when no line matches
     */
    public Optional<String> findEndpoints(List<String> lines) {
        for (String line : lines) {
            if (line == null || line.isEmpty()) {
                continue;
            }
            for (EndpointFormat format : formats) {
                Optional<String> spec = format.match(line);
                if (spec.isPresent()) {
                    log.debug("Matched {} SCAN listener format: {}", format.release(), line);
                    return spec;
                }
            }
        }
        return Optional.empty();
    }
}
