package com.gridfacts.core.parser.base;

import com.gridfacts.core.parser.MalformedRecordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base class for parsers of clusterware command output.
 *
 * <p>Provides:
 * <ul>
 *   <li>one logger per concrete parser class</li>
 *   <li>labelled-prefix extraction ({@link #valueAfter(String, String)})</li>
 *   <li>pattern helpers ({@link #findFirst(Pattern, String)}, {@link #extractGroup(Matcher, int)})</li>
 *   <li>{@link MalformedRecordException} creation</li>
 * </ul>
 *
 * <p>Fields are read by stripping a literal label such as {@code "VIP Name:"} and trimming the
 * remainder, so a changed amount of padding after the colon does not shift the value.
 */
public abstract class AbstractLineParser {

    /**
     * Logger instance for this parser.
     * Automatically initialized with the concrete parser class name.
     */
    protected final Logger log;

    protected AbstractLineParser() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    /**
     * Returns the trimmed text following {@code label} if the line starts with it.
     *
     * @param line output line
     * @param label literal label including its colon, e.g. {@code "Subnet IPv4:"}
     * @return value after the label, or null when the line does not start with the label
     */
    protected String valueAfter(String line, String label) {
        if (line == null || !line.startsWith(label)) {
            return null;
        }
        return line.substring(label.length()).trim();
    }

    /**
     * Finds the first match of a pattern in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return matcher if found, null otherwise
     */
    protected Matcher findFirst(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher : null;
    }

    /**
     * Extracts a numbered group from a matcher.
     *
     * @param matcher matcher with results
     * @param groupIndex index of the capture group (1-based)
     * @return captured text, or null if group not found
     */
    protected String extractGroup(Matcher matcher, int groupIndex) {
        try {
            return matcher.group(groupIndex);
        } catch (IndexOutOfBoundsException | IllegalStateException e) {
            return null;
        }
    }

    /**
     * Creates the exception for a record start line that cannot be parsed.
     *
     * @param reason what is missing
     * @param line offending line
     * @param source command that printed the line
     * @return exception to throw
     */
    protected MalformedRecordException malformed(String reason, String line, String source) {
        log.debug("Malformed record in output of {}: {}", source, line);
        return new MalformedRecordException(reason, line, source);
    }
}
