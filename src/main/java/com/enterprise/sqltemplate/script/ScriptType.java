package com.enterprise.sqltemplate.script;

import java.util.Locale;

/**
 * Kind of script file, encoded in its name as {@code <script>.<suffix>.sql}.
 */
public enum ScriptType {

    READ("read"),
    WRITE("write"),
    UPDATE("update"),
    DELETE("delete");

    private final String suffix;

    ScriptType(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    /** {@code orders} + READ = {@code orders.read.sql} */
    public String fileName(String script) {
        return script + "." + suffix + ".sql";
    }

    /**
     * GET reads, POST writes, PATCH and PUT update, DELETE deletes.
     *
     * @throws IllegalArgumentException for any other verb
     */
    public static ScriptType fromHttpMethod(String method) {
        if (method == null) {
            throw new IllegalArgumentException("HTTP method must not be null");
        }
        return switch (method.toUpperCase(Locale.ROOT)) {
            case "GET" -> READ;
            case "POST" -> WRITE;
            case "PATCH", "PUT" -> UPDATE;
            case "DELETE" -> DELETE;
            default -> throw new IllegalArgumentException("Unsupported HTTP method for scripts: " + method);
        };
    }
}
