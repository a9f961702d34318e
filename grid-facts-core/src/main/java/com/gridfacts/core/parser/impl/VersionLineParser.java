package com.gridfacts.core.parser.impl;

import com.gridfacts.core.parser.base.AbstractLineParser;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts version numbers from {@code crsctl query has ...} output such as
 * {@code Oracle High Availability Services release version on the local node is [19.0.0.0.0]}.
 */
public class VersionLineParser extends AbstractLineParser {

    private static final Pattern TRAILING_VERSION = Pattern.compile("\\[([0-9.]+)\\]$");

    /**
     * Returns the version inside the bracket group that ends the line.
     *
     * @param line output line
     * @return version, empty when the line does not end with a bracketed version
     */
    public Optional<String> extractVersion(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher matcher = findFirst(TRAILING_VERSION, line.trim());
        return matcher == null ? Optional.empty() : Optional.ofNullable(extractGroup(matcher, 1));
    }
}
