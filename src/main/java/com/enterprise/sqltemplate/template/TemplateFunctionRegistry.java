package com.enterprise.sqltemplate.template;

import com.enterprise.sqltemplate.ident.Identifiers;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Functions exposed to a SQL template during one render. Literal values go
 * through {@link #sqlVal(String)} / {@link #sqlList(String)} and end up in
 * the {@link ArgumentList}; only their placeholders appear in the SQL text.
 *
 * <p>Holds per-render state (the argument list, and writes into the template
 * data through {@link #defaultOrValue(String, String)}). Create one instance
 * per render with {@link #forRender(Map)}; never share an instance between
 * renders or threads.</p>
 *
 * <p>Failure policy per function is declared in {@link TemplateFunction}:
 * only {@link #ident(String)} throws, everything else degrades to an empty
 * value.</p>
 */
public final class TemplateFunctionRegistry {

    private final Map<String, Object> templateData;
    private final ArgumentList arguments;

    private TemplateFunctionRegistry(Map<String, Object> templateData, ArgumentList arguments) {
        this.templateData = templateData;
        this.arguments = arguments;
    }

    /**
     * Creates a registry for a single render. The map is used directly, not
     * copied, and must be mutable if the template calls {@code defaultOrValue}.
     */
    public static TemplateFunctionRegistry forRender(Map<String, Object> templateData) {
        return forRender(templateData, new ArgumentList());
    }

    static TemplateFunctionRegistry forRender(Map<String, Object> templateData, ArgumentList arguments) {
        return new TemplateFunctionRegistry(Objects.requireNonNull(templateData, "templateData"), arguments);
    }

    public Map<String, Object> templateData() {
        return templateData;
    }

    /** Values bound so far, in placeholder order. */
    public List<Object> arguments() {
        return arguments.values();
    }

    // ==================== Lookup ====================

    public boolean isSet(String key) {
        return templateData.containsKey(key);
    }

    /**
     * Returns the value under {@code key}. When the key is absent the default
     * is stored in the template data first, so later lookups see it too.
     */
    public Object defaultOrValue(String key, String defaultValue) {
        if (!isSet(key)) {
            templateData.put(key, defaultValue);
        }
        return templateData.get(key);
    }

    // ==================== Text helpers ====================

    /**
     * Inlines the value as an {@code IN} list: {@code ('a', 'b')}.
     * Values are NOT escaped or bound. Only use with input validated upstream;
     * prefer {@link #sqlList(String)}.
     */
    public String inFormat(String key) {
        Object value = templateData.get(key);
        if (value instanceof List<?> items) {
            return items.stream()
                    .map(String::valueOf)
                    .collect(Collectors.joining("', '", "('", "')"));
        }
        return "('" + (value == null ? "" : value) + "')";
    }

    /**
     * Percent-decodes {@code value} itself (it is not a lookup key).
     * Malformed escapes yield an empty string.
     */
    public String unEscape(String value) {
        if (value == null) {
            return "";
        }
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    /** Plain delimiter split, trailing empty pieces kept. An empty separator splits per character. */
    public List<String> split(String original, String separator) {
        if (original == null) {
            return List.of();
        }
        if (separator == null || separator.isEmpty()) {
            return original.codePoints()
                    .mapToObj(Character::toString)
                    .collect(Collectors.toList());
        }
        return Arrays.asList(original.split(Pattern.quote(separator), -1));
    }

    /**
     * Lenient pagination: same text as {@link Pagination#limitOffset(String, String)},
     * or an empty string when either argument is not an integer.
     */
    public String limitOffset(String pageNumber, String pageSize) {
        try {
            return Pagination.limitOffset(pageNumber, pageSize);
        } catch (PageParseException e) {
            return "";
        }
    }

    // ==================== Binding ====================

    /** Binds the value under {@code key} and returns its placeholder, e.g. {@code $1}. */
    public String sqlVal(String key) {
        return arguments.bind(templateData.get(key));
    }

    /**
     * Binds a list element by element, {@code ($1,$2,$3)}, or a scalar as a
     * single-element list, {@code ($4)}.
     */
    public String sqlList(String key) {
        Object value = templateData.get(key);
        if (value instanceof List<?> items) {
            List<String> placeholders = new ArrayList<>(items.size());
            for (Object item : items) {
                placeholders.add(arguments.bind(item));
            }
            return "(" + String.join(",", placeholders) + ")";
        }
        return "(" + arguments.bind(value) + ")";
    }

    /**
     * Quotes the identifier stored under {@code key}. Missing or non-string
     * values are treated as the empty string and therefore rejected.
     *
     * @throws com.enterprise.sqltemplate.ident.InvalidIdentifierException
     *         if the value is not a valid identifier path
     */
    public String ident(String key) {
        Object value = templateData.get(key);
        return Identifiers.quote(value instanceof String s ? s : "");
    }
}
