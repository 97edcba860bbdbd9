package com.enterprise.sqltemplate.template;

/**
 * Page number or page size text that is not an integer.
 */
public class PageParseException extends IllegalArgumentException {

    private final String input;

    public PageParseException(String input, NumberFormatException cause) {
        super("invalid pagination value: " + input, cause);
        this.input = input;
    }

    public String input() {
        return input;
    }
}
