package com.umitunal.cronlite.error;

/**
 * Thrown when the durable mirror fails to read or write job data.
 * When raised by a store mutation, the in-memory index has already been
 * updated and may have diverged from the mirror.
 */
public class PersistenceException extends Exception {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
