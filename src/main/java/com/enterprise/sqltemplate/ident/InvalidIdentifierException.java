package com.enterprise.sqltemplate.ident;

/**
 * Raised when a string fails the identifier allow-list. Carries the rejected
 * input so callers can report it without re-parsing the message.
 */
public class InvalidIdentifierException extends IllegalArgumentException {

    private final String identifier;

    public InvalidIdentifierException(String identifier) {
        this("invalid identifier: " + identifier, identifier);
    }

    protected InvalidIdentifierException(String message, String identifier) {
        super(message);
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }
}
