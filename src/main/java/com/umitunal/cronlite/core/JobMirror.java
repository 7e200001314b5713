package com.umitunal.cronlite.core;

import com.umitunal.cronlite.error.PersistenceException;
import com.umitunal.cronlite.model.JobRecord;

import java.util.List;
import java.util.Map;

/**
 * Durable key/value store with a time-ordered index that mirrors job state
 * across process restarts.
 *
 * Records are flat: every field is a string. A mirror must be opened before use
 * and closed when the owning process shuts down.
 */
public interface JobMirror extends AutoCloseable {

    /**
     * Open the underlying connection or database.
     */
    void open() throws PersistenceException;

    boolean isOpen();

    /**
     * Store the full record of a job, replacing any previous record and
     * moving its time-index entry to the record's schedule time.
     */
    void put(String jobId, JobRecord record) throws PersistenceException;

    /**
     * Load every stored record.
     * Records whose stored bytes cannot be decoded are skipped.
     */
    List<JobRecord> getAll() throws PersistenceException;

    /**
     * Load the records scheduled at or before the given instant, in time order.
     *
     * @param uptoInstant inclusive upper bound (millis since epoch)
     */
    List<JobRecord> getDue(long uptoInstant) throws PersistenceException;

    /**
     * Overwrite some fields of an existing record.
     *
     * @throws PersistenceException if no record exists for the job
     */
    void updateFields(String jobId, Map<String, String> fields) throws PersistenceException;

    /**
     * Delete the record and its time-index entry. Deleting an unknown id is a no-op.
     */
    void delete(String jobId) throws PersistenceException;

    @Override
    void close();
}
