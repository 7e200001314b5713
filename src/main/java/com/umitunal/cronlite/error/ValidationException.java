package com.umitunal.cronlite.error;

/**
 * Thrown when a job, record or argument fails validation.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
