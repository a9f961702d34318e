package com.gridfacts.core.parser.impl;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One known way a SCAN listener's endpoints are printed by {@code srvctl config scan_listener}.
 *
 * <p>Formats are tried in the order of {@link #KNOWN_FORMATS}; supporting a new release means
 * adding an entry.
 *
 * @param release releases printing this format, for logs
 * @param pattern pattern matched against each line
 * @param group capture group holding the endpoint spec
 */
public record EndpointFormat(String release, Pattern pattern, int group) {

    /** {@code Endpoints: TCP:1521} */
    public static final EndpointFormat ENDPOINTS = new EndpointFormat(
        "19c", Pattern.compile("Endpoints: (.+)"), 1);

    /** {@code SCAN Listener LISTENER_SCAN1 exists. Port: TCP:1521} */
    public static final EndpointFormat LISTENER_PORT = new EndpointFormat(
        "12c/18c", Pattern.compile("SCAN Listener (.+) exists\\. Port: (.+)"), 2);

    public static final List<EndpointFormat> KNOWN_FORMATS = List.of(ENDPOINTS, LISTENER_PORT);

    /**
     * Extracts the endpoint spec if the line is in this format.
     *
     * @param line output line
     * @return endpoint spec
     */
    public Optional<String> match(String line) {
        Matcher matcher = pattern.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String spec = matcher.group(group).trim();
        return spec.isEmpty() ? Optional.empty() : Optional.of(spec);
    }
}
