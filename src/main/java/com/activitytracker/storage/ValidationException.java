package com.activitytracker.storage;

/**
 * Rejected taxonomy or rule write: duplicate name, unknown parent, malformed pattern or color.
 * Nothing is persisted when this is thrown.
 */
public class ValidationException extends Exception {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
