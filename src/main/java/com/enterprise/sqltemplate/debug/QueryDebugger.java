package com.enterprise.sqltemplate.debug;

import com.enterprise.sqltemplate.template.RenderedSql;

import java.util.List;

/**
 * Debug utility: formats a {@link RenderedSql} showing native-placeholder SQL,
 * JDBC SQL, values-inlined SQL, and the argument list with types.
 */
public final class QueryDebugger {

    private QueryDebugger() {}

    public static String format(RenderedSql rendered) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== SQL Template Debug ===\n");

        sb.append("SQL (native):\n  ").append(rendered.sql()).append("\n");

        sb.append("SQL (jdbc):\n  ");
        try {
            sb.append(rendered.toJdbc().sql()).append("\n");
        } catch (IllegalStateException e) {
            // placeholder without a bound argument
            sb.append("<unavailable: ").append(e.getMessage()).append(">\n");
        }

        sb.append("SQL (values inlined):\n  ").append(rendered.toDebugString()).append("\n");

        List<Object> args = rendered.arguments();
        sb.append("Arguments (").append(args.size()).append("):\n");
        for (int i = 0; i < args.size(); i++) {
            Object val = args.get(i);
            String typeName = val != null ? val.getClass().getSimpleName() : "null";
            sb.append("  $").append(i + 1).append(" = ").append(val)
                    .append(" (").append(typeName).append(")\n");
        }
        sb.append("==========================");
        return sb.toString();
    }
}
