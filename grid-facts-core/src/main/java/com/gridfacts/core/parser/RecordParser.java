package com.gridfacts.core.parser;

import java.util.List;
import java.util.Map;

/**
 * Folds the line-oriented output of one clusterware sub-command into keyed records.
 *
 * <p>The clusterware does not document these formats and they drift between releases
 * (12c, 18c, 19c). Implementations therefore match only the lines they know and ignore
 * everything else. A line is only treated as an error when it starts a record but lacks the
 * structure the record needs; see {@link MalformedRecordException}.
 *
 * @param <T> record type
 */
public interface RecordParser<T> {

    /**
     * Returns a short identifier used in logs and warnings (e.g. "vip").
     *
     * @return parser identifier
     */
    String getId();

    /**
     * Parses captured command output.
     *
     * @param lines trimmed output lines, may be empty
     * @param source command that produced the lines, for error messages
     * @return records keyed by their natural key (usually the network number), in input order
     * @throws MalformedRecordException if a record start line cannot be parsed
     */
    Map<String, T> parse(List<String> lines, String source);
}
