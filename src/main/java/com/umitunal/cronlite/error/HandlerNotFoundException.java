package com.umitunal.cronlite.error;

/**
 * Thrown when a handler name has no registration in this process.
 */
public class HandlerNotFoundException extends RuntimeException {
    private final String handlerName;

    public HandlerNotFoundException(String handlerName) {
        super("Handler \"" + handlerName + "\" not found");
        this.handlerName = handlerName;
    }

    public HandlerNotFoundException(String handlerName, String jobId) {
        super("Handler \"" + handlerName + "\" not found for job " + jobId);
        this.handlerName = handlerName;
    }

    public String getHandlerName() {
        return handlerName;
    }
}
