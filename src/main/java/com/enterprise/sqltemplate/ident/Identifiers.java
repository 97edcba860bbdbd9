package com.enterprise.sqltemplate.ident;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * SQL injection guard for identifiers (schema, table, column names) taken
 * from untrusted input. Identifiers cannot be bound as parameters, so the
 * only defence is a strict allow-list followed by quoting.
 *
 * <p>Stateless; safe for concurrent use.</p>
 */
public final class Identifiers {

    private Identifiers() {}

    /** PostgreSQL truncates identifiers beyond this many bytes (NAMEDATALEN - 1). */
    public static final int MAX_SEGMENT_LENGTH = 63;

    // One or more dot-separated segments: letter/underscore, then alphanumeric/underscore
    private static final Pattern IDENTIFIER_PATTERN =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    private static final Pattern DOT = Pattern.compile("\\.");

    /**
     * Returns {@code true} if {@code s} is an identifier or dotted identifier
     * path whose every segment is 1..63 characters long.
     */
    public static boolean isValid(String s) {
        if (s == null || !IDENTIFIER_PATTERN.matcher(s).matches()) {
            return false;
        }
        for (String segment : DOT.split(s, -1)) {
            if (segment.isEmpty() || segment.length() > MAX_SEGMENT_LENGTH) {
                return false;
            }
        }
        return true;
    }

    /**
     * Pre-validation gate for single path segments (database, schema or table
     * name from a URL). Letters, digits, underscore and hyphen only; no dots,
     * no quotes. The value still has to be quoted before it reaches SQL text.
     */
    public static boolean isSafeSegment(String s) {
        if (s == null || s.isEmpty()
                || s.getBytes(StandardCharsets.UTF_8).length > MAX_SEGMENT_LENGTH) {
            return false;
        }
        return s.codePoints().allMatch(cp ->
                Character.isLetter(cp) || Character.isDigit(cp) || cp == '_' || cp == '-');
    }

    /**
     * Validates and quotes an identifier path: {@code schema.table} becomes
     * {@code "schema"."table"}. Embedded double quotes are doubled.
     *
     * @throws InvalidIdentifierException if {@link #isValid(String)} rejects the input
     */
    public static String quote(String s) {
        if (!isValid(s)) {
            throw new InvalidIdentifierException(s);
        }
        StringBuilder quoted = new StringBuilder(s.length() + 8);
        for (String segment : DOT.split(s, -1)) {
            if (quoted.length() > 0) {
                quoted.append('.');
            }
            quoted.append('"').append(segment.replace("\"", "\"\"")).append('"');
        }
        return quoted.toString();
    }

    /**
     * Splits a comma-separated identifier list and validates every entry.
     * An empty string yields an empty list. All-or-nothing: the first invalid
     * entry fails the whole call.
     *
     * @throws InvalidCsvEntryException naming the first invalid entry
     */
    public static List<String> splitAndValidateCsv(String s) {
        if (s == null || s.isEmpty()) {
            return List.of();
        }
        List<String> entries = new ArrayList<>();
        for (String entry : s.split(",", -1)) {
            if (!isValid(entry)) {
                throw new InvalidCsvEntryException(entry, s);
            }
            entries.add(entry);
        }
        return List.copyOf(entries);
    }
}
