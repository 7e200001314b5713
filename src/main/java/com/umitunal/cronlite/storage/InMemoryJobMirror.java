package com.umitunal.cronlite.storage;

import com.umitunal.cronlite.core.JobMirror;
import com.umitunal.cronlite.error.PersistenceException;
import com.umitunal.cronlite.model.JobRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Volatile job mirror that keeps records in memory.
 * Useful for tests and for processes that do not need to survive restarts.
 */
public class InMemoryJobMirror implements JobMirror {
    private final Map<String, JobRecord> records = new HashMap<>();
    private boolean open;

    @Override
    public synchronized void open() {
        open = true;
    }

    @Override
    public synchronized boolean isOpen() {
        return open;
    }

    @Override
    public synchronized void put(String jobId, JobRecord record) throws PersistenceException {
        ensureOpen();
        records.put(jobId, record.copy());
    }

    @Override
    public synchronized List<JobRecord> getAll() throws PersistenceException {
        ensureOpen();
        List<JobRecord> all = new ArrayList<>(records.size());
        for (JobRecord record : records.values()) {
            all.add(record.copy());
        }
        return all;
    }

    @Override
    public synchronized List<JobRecord> getDue(long uptoInstant) throws PersistenceException {
        ensureOpen();
        List<JobRecord> due = new ArrayList<>();
        for (JobRecord record : records.values()) {
            OptionalLong time = record.getScheduleTime();
            if (time.isPresent() && time.getAsLong() <= uptoInstant) {
                due.add(record.copy());
            }
        }
        due.sort(Comparator.comparingLong(r -> r.getScheduleTime().getAsLong()));
        return due;
    }

    @Override
    public synchronized void updateFields(String jobId, Map<String, String> fields) throws PersistenceException {
        ensureOpen();
        JobRecord record = records.get(jobId);
        if (record == null) {
            throw new PersistenceException("No stored record for job " + jobId);
        }
        record.merge(fields);
    }

    @Override
    public synchronized void delete(String jobId) throws PersistenceException {
        ensureOpen();
        records.remove(jobId);
    }

    /**
     * Gets a copy of the stored record, or null.
     */
    public synchronized JobRecord get(String jobId) {
        JobRecord record = records.get(jobId);
        return record == null ? null : record.copy();
    }

    public synchronized int size() {
        return records.size();
    }

    @Override
    public synchronized void close() {
        open = false;
    }

    private void ensureOpen() throws PersistenceException {
        if (!open) {
            throw new PersistenceException("Job mirror is not open");
        }
    }
}
