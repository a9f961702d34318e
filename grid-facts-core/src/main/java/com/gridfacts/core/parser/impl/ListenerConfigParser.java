package com.gridfacts.core.parser.impl;

import com.gridfacts.core.model.Listener;
import com.gridfacts.core.parser.base.AbstractLineParser;
import com.gridfacts.core.parser.base.EndpointSpec;

import java.util.List;

/**
 * Parses {@code srvctl config listener -l <name>}.
 *
 * <pre>
 * Name: LISTENER
 * Type: Database Listener
 * Network: 1, Owner: grid
 * Home: &lt;CRS home&gt;
 * End points: TCP:1521
 * Listener is enabled.
 * </pre>
 *
 * <p>The result is unresolved: VIP addresses are attached later by
 * {@link com.gridfacts.core.resolver.CrossReferenceResolver}.
 */
public class ListenerConfigParser extends AbstractLineParser {

    private static final String NAME = "Name:";
    private static final String TYPE = "Type:";
    private static final String NETWORK = "Network:";
    private static final String END_POINTS = "End points:";

    /**
     * Parses one listener's configuration.
     *
     * @param requestedName name the configuration was requested for, used when output has no Name line
     * @param lines output lines
     * @return listener without VIP addresses
     */
    public Listener parse(String requestedName, List<String> lines) {
        String name = null;
        String type = null;
        String networkId = null;
        String endpoints = null;

        for (String line : lines) {
            if (line == null || line.isEmpty()) {
                continue;
            }
            String value;
            if ((value = valueAfter(line, NAME)) != null) {
                name = value;
            } else if ((value = valueAfter(line, TYPE)) != null) {
                type = value;
            } else if ((value = valueAfter(line, NETWORK)) != null) {
                int comma = value.indexOf(',');
                networkId = (comma < 0 ? value : value.substring(0, comma)).trim();
            } else if ((value = valueAfter(line, END_POINTS)) != null) {
                endpoints = value;
            }
        }

        if (name == null || name.isEmpty()) {
            name = requestedName;
        }
        if (networkId != null && networkId.isEmpty()) {
            networkId = null;
        }
        return new Listener(name, type, networkId, endpoints, EndpointSpec.parse(endpoints), null, null, null);
    }
}
