package com.gridfacts.core.parser.base;

import com.gridfacts.core.parser.RecordParser;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for parsers whose records are introduced by a header line and continued by
 * labelled field lines.
 *
 * <p>Subclasses keep a builder for the record in progress. A header line flushes the previous
 * builder and starts a new one; the last builder is flushed at end of input. Builders that never
 * received their key are dropped.
 *
 * @param <T> record type
 * @param <B> mutable builder for the record in progress
 */
public abstract class AbstractRecordParser<T, B extends AbstractRecordParser.RecordBuilder<T>>
        extends AbstractLineParser implements RecordParser<T> {

    /**
     * Mutable state of the record being parsed.
     *
     * @param <T> record type
     */
    public interface RecordBuilder<T> {

        /**
         * Returns the key of the record, or null while it is unknown.
         *
         * @return record key
         */
        String key();

        /**
         * Builds the immutable record.
         *
         * @return record
         */
        T build();
    }

    @Override
    public Map<String, T> parse(List<String> lines, String source) {
        Map<String, T> records = new LinkedHashMap<>();
        B current = null;

        for (String line : lines) {
            if (line == null || line.isEmpty()) {
                continue;
            }
            B started = startRecord(line, source);
            if (started != null) {
                flush(current, records);
                current = started;
            } else if (current != null) {
                applyField(current, line);
            }
        }
        flush(current, records);

        log.debug("Parsed {} {} records from {}", records.size(), getId(), source);
        return records;
    }

    /**
     * Returns a new builder if the line starts a record.
     *
     * @param line output line
     * @param source command that printed the line
     * @return builder for the new record, or null when the line is not a record header
     * @throws com.gridfacts.core.parser.MalformedRecordException if the header lacks its key
     */
    protected abstract B startRecord(String line, String source);

    /**
     * Applies a non-header line to the record in progress. Unknown lines must be ignored.
     *
     * @param builder record in progress
     * @param line output line
     */
    protected abstract void applyField(B builder, String line);

    private void flush(B builder, Map<String, T> records) {
        if (builder != null && builder.key() != null) {
            if (records.containsKey(builder.key())) {
                log.warn("Duplicate {} record for key {}, keeping the last one", getId(), builder.key());
            }
            records.put(builder.key(), builder.build());
        }
    }
}
