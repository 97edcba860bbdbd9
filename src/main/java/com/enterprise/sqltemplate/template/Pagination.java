package com.enterprise.sqltemplate.template;

import java.util.regex.Pattern;

/**
 * ANSI {@code LIMIT ... OFFSET ...} text from page number / page size strings.
 * Both inputs are parsed to integers first, so the output is safe to inline.
 */
public final class Pagination {

    private Pagination() {}

    // Optional sign, ASCII digits only; Long.parseLong alone would accept other Unicode digits
    private static final Pattern ASCII_INTEGER = Pattern.compile("[+-]?[0-9]+");

    /**
     * Strict form. A page number below 1 is treated as page 1. Values are
     * 64-bit signed integers.
     *
     * @throws PageParseException if either argument is not an integer
     */
    public static String limitOffset(String pageNumberText, String pageSizeText) {
        long pageNumber = parse(pageNumberText);
        long pageSize = parse(pageSizeText);
        if (pageNumber < 1) {
            pageNumber = 1;
        }
        return "LIMIT " + pageSize + " OFFSET(" + pageNumber + " - 1) * " + pageSize;
    }

    private static long parse(String text) {
        if (text == null || !ASCII_INTEGER.matcher(text).matches()) {
            throw new PageParseException(text, new NumberFormatException("For input string: \"" + text + "\""));
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new PageParseException(text, e);
        }
    }
}
