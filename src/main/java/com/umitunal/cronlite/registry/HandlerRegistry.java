package com.umitunal.cronlite.registry;

import com.umitunal.cronlite.core.JobHandler;
import com.umitunal.cronlite.error.HandlerNotFoundException;
import com.umitunal.cronlite.error.InvalidHandlerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process mapping from handler names to executable handlers.
 *
 * Jobs persist only the handler name; every process that executes jobs must
 * register the names it expects to run. Nothing here is persisted.
 */
public class HandlerRegistry {
    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Create a registry with the built-in {@code defaultHandler},
     * {@code consoleHandler} and {@code emailHandler}, each of which logs the
     * payload it receives.
     */
    public static HandlerRegistry withDefaults() {
        HandlerRegistry registry = new HandlerRegistry();
        registry.register("defaultHandler", data -> {
            log.info("Default handler: {}", data);
            return null;
        });
        registry.register("consoleHandler", data -> {
            log.info("Job executed: {}", data);
            return null;
        });
        registry.register("emailHandler", data -> {
            log.info("Sending email: {}", data);
            return null;
        });
        return registry;
    }

    /**
     * Register a handler, replacing any handler already registered under the name.
     *
     * @throws InvalidHandlerException if the name is blank or the handler is null
     */
    public void register(String name, JobHandler handler) {
        if (name == null || name.isBlank()) {
            throw new InvalidHandlerException("Handler name must not be blank");
        }
        if (handler == null) {
            throw new InvalidHandlerException("Handler for \"" + name + "\" must not be null");
        }
        if (handlers.put(name, handler) != null) {
            log.debug("Replaced handler {}", name);
        }
    }

    /**
     * @throws HandlerNotFoundException if no handler is registered under the name
     */
    public JobHandler get(String name) {
        JobHandler handler = name == null ? null : handlers.get(name);
        if (handler == null) {
            throw new HandlerNotFoundException(name);
        }
        return handler;
    }

    public boolean has(String name) {
        return name != null && handlers.containsKey(name);
    }

    /**
     * @return true if a handler was registered under the name
     */
    public boolean remove(String name) {
        return name != null && handlers.remove(name) != null;
    }

    /**
     * Gets the registered names in alphabetical order.
     */
    public List<String> listNames() {
        List<String> names = new ArrayList<>(handlers.keySet());
        Collections.sort(names);
        return names;
    }
}
