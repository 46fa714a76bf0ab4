package com.acme.strmatch.common;

/**
 * A record handed to the matcher is structurally unusable, typically because
 * the identifier column is missing or blank.  Only the offending record is
 * rejected; callers decide whether the rest of the batch continues.
 */
public class ProfileSchemaException extends RuntimeException {

    private final String column;
    private final String record;

    public ProfileSchemaException(String column, String record, String message) {
        super(message + " (column=" + column + ", record=" + record + ")");
        this.column = column;
        this.record = record;
    }

    public String getColumn() {
        return column;
    }

    public String getRecord() {
        return record;
    }
}
