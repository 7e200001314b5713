package com.umitunal.cronlite.core;

import java.util.Map;

/**
 * Executable logic registered under a name and invoked with a job's payload.
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * Handle a job payload.
     *
     * @param data the job payload
     * @return an optional result, logged and otherwise ignored
     * @throws Exception if the job failed; the message becomes the job's last error
     */
    Object handle(Map<String, Object> data) throws Exception;
}
