package com.activitytracker.storage;

/**
 * I/O or connection fault in the persistent store.
 */
public class StorageException extends Exception {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
