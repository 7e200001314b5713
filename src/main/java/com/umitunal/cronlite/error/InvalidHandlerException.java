package com.umitunal.cronlite.error;

/**
 * Thrown when registering a handler that cannot be invoked.
 */
public class InvalidHandlerException extends ValidationException {

    public InvalidHandlerException(String message) {
        super(message);
    }
}
