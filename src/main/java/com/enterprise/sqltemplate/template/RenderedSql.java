package com.enterprise.sqltemplate.template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Output of one render: SQL text with {@code $N} placeholders plus the
 * values for those placeholders, position N at index N-1.
 *
 * <p>Results produced by {@link SqlTemplateRenderer} know exactly where the
 * registry put each placeholder; {@code $N}-looking text elsewhere (string
 * literals, {@code inFormat} output) is left alone by {@link #toJdbc()} and
 * {@link #verify()}.</p>
 */
public class RenderedSql {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$(0|[1-9]\\d*)");

    private final String sql;
    private final String jdbcSql;
    private final List<Object> arguments;
    private final List<Placeholder> placeholders;

    /**
     * For hand-written SQL: every {@code $N} token in {@code sql} is taken to
     * be a placeholder.
     */
    public RenderedSql(String sql, List<Object> arguments) {
        this.sql = Objects.requireNonNull(sql, "sql");
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        List<Placeholder> found = new ArrayList<>();
        Matcher m = PLACEHOLDER.matcher(sql);
        StringBuilder jdbc = new StringBuilder();
        while (m.find()) {
            found.add(new Placeholder(m.start(), ordinal(m)));
            m.appendReplacement(jdbc, "?");
        }
        m.appendTail(jdbc);
        this.jdbcSql = jdbc.toString();
        this.placeholders = Collections.unmodifiableList(found);
    }

    RenderedSql(String sql, String jdbcSql, List<Object> arguments, List<Placeholder> placeholders) {
        this.sql = Objects.requireNonNull(sql, "sql");
        this.jdbcSql = Objects.requireNonNull(jdbcSql, "jdbcSql");
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        this.placeholders = Collections.unmodifiableList(new ArrayList<>(placeholders));
    }

    public String sql() { return sql; }

    public List<Object> arguments() { return arguments; }

    /** Placeholders in text order, with their offset in {@link #sql()}. */
    public List<Placeholder> placeholders() { return placeholders; }

    /**
     * JDBC form: each placeholder becomes {@code ?}, values in placeholder
     * order. For rendered output this is {@link #arguments()} unchanged.
     *
     * @throws IllegalStateException if a placeholder has no bound argument
     */
    public JdbcQuery toJdbc() {
        Object[] values = new Object[placeholders.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = arguments.get(checkedOrdinal(placeholders.get(i).ordinal()) - 1);
        }
        return new JdbcQuery(jdbcSql, values);
    }

    /** Returns the SQL with all argument values inlined for debugging. */
    public String toDebugString() {
        StringBuilder inlined = new StringBuilder();
        int from = 0;
        for (Placeholder p : placeholders) {
            inlined.append(sql, from, p.offset());
            int n = p.ordinal();
            inlined.append(n >= 1 && n <= arguments.size() ? inline(arguments.get(n - 1)) : "$" + n);
            from = p.offset() + p.token().length();
        }
        inlined.append(sql, from, sql.length());
        return inlined.toString();
    }

    /**
     * Verifies every placeholder has a bound argument and every argument is
     * referenced by a placeholder.
     */
    public void verify() {
        TreeSet<Integer> referenced = new TreeSet<>();
        for (Placeholder p : placeholders) {
            referenced.add(checkedOrdinal(p.ordinal()));
        }
        for (int n = 1; n <= arguments.size(); n++) {
            if (!referenced.contains(n)) {
                throw new IllegalStateException("Argument $" + n + " is bound but never referenced");
            }
        }
    }

    private int checkedOrdinal(int n) {
        if (n < 1 || n > arguments.size()) {
            throw new IllegalStateException(
                    "SQL references $" + n + " but only " + arguments.size() + " argument(s) were bound");
        }
        return n;
    }

    private static int ordinal(Matcher m) {
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Placeholder out of range: " + m.group(), e);
        }
    }

    private static String inline(Object value) {
        if (value instanceof String s) {
            return "'" + s.replace("'", "''") + "'";
        }
        return String.valueOf(value);
    }

    @Override
    public String toString() {
        return sql;
    }

    public record JdbcQuery(String sql, Object[] values) {}

    /** A {@code $N} token at {@code offset} in the native SQL. */
    public record Placeholder(int offset, int ordinal) {

        public String token() {
            return "$" + ordinal;
        }
    }
}
