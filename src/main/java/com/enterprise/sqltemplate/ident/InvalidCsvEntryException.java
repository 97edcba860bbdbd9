package com.enterprise.sqltemplate.ident;

/**
 * First entry of a comma-separated identifier list that failed validation.
 */
public class InvalidCsvEntryException extends InvalidIdentifierException {

    private final String csv;

    public InvalidCsvEntryException(String entry, String csv) {
        super("invalid identifier: " + entry, entry);
        this.csv = csv;
    }

    /** The complete list the entry was taken from. */
    public String csv() {
        return csv;
    }
}
