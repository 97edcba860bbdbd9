package com.enterprise.sqltemplate.template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Ordered, append-only list of values bound during one render.
 * {@link #bind(Object)} stores the value and returns {@code $N}, where N is
 * its 1-based position. Not thread-safe: one instance per render.
 *
 * <p>A {@link #tracked()} list returns an opaque per-render marker instead of
 * {@code $N}. {@link #resolve(String)} turns the markers back into {@code $N}
 * and records where each one landed, so placeholders are never confused with
 * {@code $N}-looking text that came from the template or the data.</p>
 */
public class ArgumentList {

    private static final char MARKER_START = '\uE000';
    private static final char MARKER_END = '\uE001';

    private final List<Object> values = new ArrayList<>();
    private final String markerPrefix;

    public ArgumentList() {
        this(null);
    }

    private ArgumentList(String markerPrefix) {
        this.markerPrefix = markerPrefix;
    }

    static ArgumentList tracked() {
        return new ArgumentList(MARKER_START + UUID.randomUUID().toString() + "#");
    }

    /**
     * Appends a value and returns its positional placeholder (e.g. "$3").
     * {@code null} is stored as-is and binds as SQL NULL.
     */
    public String bind(Object value) {
        values.add(value);
        int ordinal = values.size();
        return markerPrefix == null ? "$" + ordinal : markerPrefix + ordinal + MARKER_END;
    }

    /** Placeholder counter; always equals the number of bound values. */
    public int size() {
        return values.size();
    }

    public List<Object> values() {
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * Replaces the markers emitted by this list with {@code $N} (native) and
     * {@code ?} (JDBC), recording the position and ordinal of each.
     *
     * @throws IllegalStateException if this list is not tracked
     */
    RenderedSql resolve(String text) {
        if (markerPrefix == null) {
            throw new IllegalStateException("Only tracked argument lists emit markers");
        }
        StringBuilder nativeSql = new StringBuilder(text.length());
        StringBuilder jdbcSql = new StringBuilder(text.length());
        List<RenderedSql.Placeholder> placeholders = new ArrayList<>();
        int from = 0;
        int start;
        while ((start = text.indexOf(markerPrefix, from)) >= 0) {
            int digits = start + markerPrefix.length();
            int end = text.indexOf(MARKER_END, digits);
            if (end < 0) {
                throw new IllegalStateException("Truncated placeholder marker at offset " + start);
            }
            int ordinal = Integer.parseInt(text.substring(digits, end));
            nativeSql.append(text, from, start);
            jdbcSql.append(text, from, start);
            placeholders.add(new RenderedSql.Placeholder(nativeSql.length(), ordinal));
            nativeSql.append('$').append(ordinal);
            jdbcSql.append('?');
            from = end + 1;
        }
        nativeSql.append(text, from, text.length());
        jdbcSql.append(text, from, text.length());
        return new RenderedSql(nativeSql.toString(), jdbcSql.toString(), values, placeholders);
    }
}
