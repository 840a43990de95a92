package com.poisearch.exception;

/**
 * A stored record violates an entity invariant, e.g. carries an unknown category
 * code or lacks coordinates. Signals schema drift, never a valid record.
 */
public class MalformedRecordException extends RuntimeException {

    public MalformedRecordException(long recordId, String message) {
        super("Malformed point of interest record " + recordId + ": " + message);
    }
}
