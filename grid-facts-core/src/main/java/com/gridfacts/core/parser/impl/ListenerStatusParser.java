package com.gridfacts.core.parser.impl;

import com.gridfacts.core.parser.base.AbstractLineParser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts enabled listener names from {@code srvctl status listener}.
 *
 * <pre>
 * Listener LISTENER is enabled
 * Listener LISTENER is running on node(s): rac1
 * </pre>
 */
public class ListenerStatusParser extends AbstractLineParser {

    private static final String ENABLED = "is enabled";
    private static final Pattern LISTENER_ENABLED = Pattern.compile("Listener (.+) is enabled");

    /**
     * Returns the names of enabled listeners, in output order, without duplicates.
     *
     * @param lines output lines
     * @return listener names
     */
    public List<String> enabledListeners(List<String> lines) {
        List<String> names = new ArrayList<>();
        for (String line : lines) {
            if (line == null || !line.contains(ENABLED)) {
                continue;
            }
            Matcher matcher = findFirst(LISTENER_ENABLED, line);
            if (matcher == null) {
                log.debug("Ignoring status line without listener name: {}", line);
                continue;
            }
            String name = matcher.group(1).trim();
            if (!names.contains(name)) {
                names.add(name);
            }
        }
        return names;
    }
}
