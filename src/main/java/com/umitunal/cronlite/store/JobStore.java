package com.umitunal.cronlite.store;

import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.JobHandler;
import com.umitunal.cronlite.core.JobMirror;
import com.umitunal.cronlite.core.StoreMetrics;
import com.umitunal.cronlite.cron.CronEvaluator;
import com.umitunal.cronlite.cron.CronUtilsEvaluator;
import com.umitunal.cronlite.error.InvalidCronExpressionException;
import com.umitunal.cronlite.error.HandlerNotFoundException;
import com.umitunal.cronlite.error.PersistenceException;
import com.umitunal.cronlite.error.ValidationException;
import com.umitunal.cronlite.model.JobRecord;
import com.umitunal.cronlite.model.JobRecordMapper;
import com.umitunal.cronlite.model.ScheduledJob;
import com.umitunal.cronlite.registry.HandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Authoritative in-memory index over scheduled jobs, mirrored to a durable store.
 *
 * Jobs are indexed by id and by schedule time. Every mutation is applied in
 * memory first and then written through to the mirror before the method returns.
 * A mirror failure is reported to the caller but the in-memory change is kept,
 * so memory and mirror may diverge until the next {@link #init()}.
 */
public class JobStore {
    private static final Logger log = LoggerFactory.getLogger(JobStore.class);

    private final JobMirror mirror;
    private final HandlerRegistry handlerRegistry;
    private final JobRecordMapper mapper;
    private final CronEvaluator cronEvaluator;

    private final Map<String, ScheduledJob> jobs = new HashMap<>();
    private final NavigableMap<Long, Set<String>> timeIndex = new TreeMap<>();
    // Time under which each job currently sits in the time index
    private final Map<String, Long> indexedTimes = new HashMap<>();

    public JobStore(JobMirror mirror, HandlerRegistry handlerRegistry) {
        this(mirror, handlerRegistry, new JobRecordMapper());
    }

    public JobStore(JobMirror mirror, HandlerRegistry handlerRegistry, JobRecordMapper mapper) {
        this(mirror, handlerRegistry, mapper, new CronUtilsEvaluator());
    }

    /**
     * @param cronEvaluator used to reject recurring jobs whose cron expression cannot be parsed
     */
    public JobStore(JobMirror mirror, HandlerRegistry handlerRegistry, JobRecordMapper mapper,
                    CronEvaluator cronEvaluator) {
        this.mirror = mirror;
        this.handlerRegistry = handlerRegistry;
        this.mapper = mapper;
        this.cronEvaluator = cronEvaluator;
    }

    /**
     * Rebuild both indexes from the mirror, replacing anything held in memory.
     * Corrupt records are logged and skipped.
     *
     * @return number of jobs loaded
     */
    public synchronized int init() throws PersistenceException {
        log.info("Initializing job store...");
        List<JobRecord> records = mirror.getAll();

        jobs.clear();
        timeIndex.clear();
        indexedTimes.clear();

        int skipped = 0;
        for (JobRecord record : records) {
            ScheduledJob job;
            try {
                job = mapper.fromRecord(record);
                requireValidCron(job);
            } catch (ValidationException e) {
                log.warn("Skipping corrupt job record: {}", e.getMessage());
                skipped++;
                continue;
            }
            jobs.put(job.getId(), job);
            index(job.getId(), job.getScheduleTime());

            if (job.getStatus() == Job.Status.RUNNING) {
                log.warn("Job {} was interrupted while running and needs manual intervention", job.getId());
            }
        }

        logSummary(skipped);
        return jobs.size();
    }

    /**
     * Insert or replace a job by id and mirror it.
     *
     * @return the job id
     * @throws InvalidCronExpressionException if the job recurs on an unparsable cron expression
     * @throws PersistenceException if the mirror write failed; the job stays indexed in memory
     */
    public synchronized String addJob(ScheduledJob job) throws PersistenceException {
        if (job == null) {
            throw new ValidationException("Job must not be null");
        }
        requireValidCron(job);
        String id = job.getId();
        ScheduledJob previous = jobs.put(id, job);
        if (previous != null) {
            log.debug("Replacing job {}", id);
        }
        unindex(id);
        index(id, job.getScheduleTime());

        mirror.put(id, mapper.toRecord(job));
        return id;
    }

    /**
     * Take every pending job scheduled at or before {@code now} and consume its
     * time-index entries. Jobs in a consumed entry that are no longer pending are
     * dropped from the time index without being returned.
     *
     * @return due jobs in schedule-time order
     */
    public synchronized List<ScheduledJob> getDueJobs(long now) {
        NavigableMap<Long, Set<String>> due = timeIndex.headMap(now, true);
        if (due.isEmpty()) {
            return List.of();
        }

        List<ScheduledJob> dueJobs = new ArrayList<>();
        Iterator<Map.Entry<Long, Set<String>>> buckets = due.entrySet().iterator();
        while (buckets.hasNext()) {
            Map.Entry<Long, Set<String>> bucket = buckets.next();
            for (String id : bucket.getValue()) {
                indexedTimes.remove(id);
                ScheduledJob job = jobs.get(id);
                if (job != null && job.isDue(now)) {
                    dueJobs.add(job);
                }
            }
            buckets.remove();
        }

        if (!dueJobs.isEmpty()) {
            log.debug("Found {} due job(s): {}", dueJobs.size(), ids(dueJobs));
        }
        return dueJobs;
    }

    /**
     * Move a job to the given status within its current execution cycle.
     *
     * @return false if the job is unknown
     * @throws IllegalStateException if the transition is not allowed
     */
    public synchronized boolean updateJobStatus(String jobId, Job.Status status) throws PersistenceException {
        ScheduledJob job = jobs.get(jobId);
        if (job == null) {
            log.warn("Job {} not found in memory", jobId);
            return false;
        }
        job.transitionTo(status);
        log.debug("Job {} status changed to: {}", jobId, status.wireName());

        mirror.updateFields(jobId, Map.of(JobRecord.STATUS, status.wireName()));
        return true;
    }

    /**
     * Record the outcome of an execution attempt. The job becomes completed when
     * {@code lastError} is null and failed otherwise.
     *
     * @return false if the job is unknown
     */
    public synchronized boolean updateJobExecution(String jobId, long executedAt, String lastError, int retryCount)
            throws PersistenceException {
        ScheduledJob job = jobs.get(jobId);
        if (job == null) {
            log.warn("Job {} not found in memory", jobId);
            return false;
        }
        job.recordExecution(executedAt, lastError, retryCount);

        Map<String, String> fields = new HashMap<>();
        fields.put(JobRecord.STATUS, job.getStatus().wireName());
        fields.put(JobRecord.EXECUTED_AT, Long.toString(executedAt));
        fields.put(JobRecord.LAST_ERROR, lastError == null ? "" : lastError);
        fields.put(JobRecord.RETRY_COUNT, Integer.toString(retryCount));
        mirror.updateFields(jobId, fields);
        return true;
    }

    /**
     * Reset a finished recurring job to pending at a new schedule time and mirror
     * the whole record.
     *
     * @return false if the job is unknown
     */
    public synchronized boolean rescheduleJob(String jobId, long nextScheduleTime) throws PersistenceException {
        ScheduledJob job = jobs.get(jobId);
        if (job == null) {
            log.warn("Job {} not found in memory for rescheduling", jobId);
            return false;
        }
        job.resetForNextRun(nextScheduleTime);
        unindex(jobId);
        index(jobId, nextScheduleTime);

        mirror.put(jobId, mapper.toRecord(job));
        return true;
    }

    /**
     * Remove a job from both indexes and from the mirror. The mirror delete is
     * issued even when the job is not held in memory.
     *
     * @return false if the job was not held in memory
     */
    public synchronized boolean removeJob(String jobId) throws PersistenceException {
        ScheduledJob removed = jobs.remove(jobId);
        if (removed == null) {
            log.warn("Job {} not found in memory for removal", jobId);
        }
        unindex(jobId);

        mirror.delete(jobId);
        return removed != null;
    }

    /**
     * Remove every non-recurring failed job from both layers.
     *
     * @return number of jobs purged
     */
    public synchronized int purgeFailedJobs() throws PersistenceException {
        List<String> failed = new ArrayList<>();
        for (ScheduledJob job : jobs.values()) {
            if (job.getStatus() == Job.Status.FAILED && !job.isRecurring()) {
                failed.add(job.getId());
            }
        }
        for (String id : failed) {
            removeJob(id);
        }
        if (!failed.isEmpty()) {
            log.info("Purged {} failed job(s)", failed.size());
        }
        return failed.size();
    }

    /**
     * Resolve the handler registered for a job.
     *
     * @throws HandlerNotFoundException if the handler name is not registered
     */
    public JobHandler getHandlerForJob(Job job) {
        try {
            return handlerRegistry.get(job.getHandlerName());
        } catch (HandlerNotFoundException e) {
            throw new HandlerNotFoundException(job.getHandlerName(), job.getId());
        }
    }

    /**
     * Checks if the store still holds this exact job instance, i.e. it has not
     * been removed or replaced by id since it was handed out.
     */
    public synchronized boolean holds(Job job) {
        return job != null && jobs.get(job.getId()) == job;
    }

    public synchronized Optional<Job> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public synchronized List<Job> getAllJobs() {
        return new ArrayList<>(jobs.values());
    }

    public synchronized int getPendingCount() {
        int count = 0;
        for (ScheduledJob job : jobs.values()) {
            if (job.getStatus() == Job.Status.PENDING) {
                count++;
            }
        }
        return count;
    }

    public synchronized int size() {
        return jobs.size();
    }

    public synchronized StoreMetrics getMetrics() {
        long pending = 0;
        long running = 0;
        long completed = 0;
        long failed = 0;

        for (ScheduledJob job : jobs.values()) {
            switch (job.getStatus()) {
                case PENDING -> pending++;
                case RUNNING -> running++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
            }
        }

        return new StoreMetrics(jobs.size(), pending, running, completed, failed, indexedTimes.size());
    }

    /**
     * Checks if the job currently has a time-index entry, i.e. can still be offered as due.
     */
    public synchronized boolean isIndexed(String jobId) {
        return indexedTimes.containsKey(jobId);
    }

    private void requireValidCron(ScheduledJob job) {
        if (job.isRecurring() && job.hasCronExpression() && !cronEvaluator.validate(job.getCronExpression())) {
            throw new InvalidCronExpressionException(job.getCronExpression(),
                    "Recurring job " + job.getId() + " cannot be scheduled");
        }
    }

    private void index(String jobId, long scheduleTime) {
        timeIndex.computeIfAbsent(scheduleTime, t -> new LinkedHashSet<>()).add(jobId);
        indexedTimes.put(jobId, scheduleTime);
    }

    private void unindex(String jobId) {
        Long scheduleTime = indexedTimes.remove(jobId);
        if (scheduleTime == null) {
            return;
        }
        Set<String> bucket = timeIndex.get(scheduleTime);
        if (bucket != null) {
            bucket.remove(jobId);
            if (bucket.isEmpty()) {
                timeIndex.remove(scheduleTime);
            }
        }
    }

    private void logSummary(int skipped) {
        long now = System.currentTimeMillis();
        long dueNow = indexedTimes.values().stream().filter(t -> t <= now).count();

        log.info("Loaded {} job(s) from mirror ({} due now, {} skipped)", jobs.size(), dueNow, skipped);
        if (!timeIndex.isEmpty()) {
            long msUntil = timeIndex.firstKey() - now;
            if (msUntil > 0) {
                log.info("Next job runs in {} seconds", String.format("%.1f", msUntil / 1000.0));
            } else {
                log.info("Jobs are due for execution");
            }
        }
        log.info("Job store initialization complete");
    }

    private static List<String> ids(List<? extends Job> jobs) {
        List<String> ids = new ArrayList<>(jobs.size());
        for (Job job : jobs) {
            ids.add(job.getId());
        }
        return ids;
    }
}
