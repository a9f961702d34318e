package com.gridfacts.core.parser;

/**
 * Thrown when a line that starts a record lacks a mandatory field.
 *
 * <p>Carries the raw line and the command that printed it so the problem can be reported
 * against a specific clusterware release.
 */
public class MalformedRecordException extends RuntimeException {

    private final String line;
    private final String source;

    public MalformedRecordException(String message, String line, String source) {
        super(message + ": '" + line + "' (from: " + source + ")");
        this.line = line;
        this.source = source;
    }

    public String getLine() {
        return line;
    }

    public String getSource() {
        return source;
    }
}
