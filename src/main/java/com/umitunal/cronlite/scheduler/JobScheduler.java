package com.umitunal.cronlite.scheduler;

import com.umitunal.cronlite.config.SchedulerConfig;
import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.JobHandler;
import com.umitunal.cronlite.cron.CronEvaluator;
import com.umitunal.cronlite.cron.CronUtilsEvaluator;
import com.umitunal.cronlite.error.InvalidCronExpressionException;
import com.umitunal.cronlite.error.PersistenceException;
import com.umitunal.cronlite.error.ValidationException;
import com.umitunal.cronlite.model.RetryStrategy;
import com.umitunal.cronlite.model.ScheduledJob;
import com.umitunal.cronlite.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tick-driven scheduler that polls the job store for due jobs and executes them.
 *
 * Due jobs of one tick run sequentially on the ticking thread. A job id never
 * executes in two overlapping invocations: a second call for an id that is
 * already in flight is skipped. Handler failures never escape a tick; they are
 * recorded on the job instead.
 */
public class JobScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private static final int RESULT_PREVIEW_LENGTH = 100;
    private static final long ID_SUFFIX_BOUND = 101_559_956_668_416L; // 36^9

    private final JobStore store;
    private final SchedulerConfig config;
    private final CronEvaluator cronEvaluator;
    private final Clock clock;
    private final AtomicBoolean running;
    private final Set<String> inFlight;
    private final AtomicLong executedCount;
    private final AtomicLong failedCount;
    private final ScheduledExecutorService timer;
    private final ExecutorService handlerPool;

    private ScheduledFuture<?> tickTask;

    private JobScheduler(Builder builder) {
        this.store = builder.store;
        this.config = builder.config;
        this.cronEvaluator = builder.cronEvaluator != null
                ? builder.cronEvaluator
                : new CronUtilsEvaluator(builder.config.getZone());
        this.clock = builder.clock;
        this.running = new AtomicBoolean(false);
        this.inFlight = ConcurrentHashMap.newKeySet();
        this.executedCount = new AtomicLong(0);
        this.failedCount = new AtomicLong(0);
        this.timer = Executors.newSingleThreadScheduledExecutor(namedThreads("cronlite-scheduler"));
        this.handlerPool = config.hasExecutionTimeout()
                ? Executors.newCachedThreadPool(namedThreads("cronlite-handler"))
                : null;
    }

    /**
     * Start ticking: run one tick immediately on the calling thread, then every
     * tick interval on the scheduler thread. Does nothing if already running.
     */
    public void start() {
        if (timer.isShutdown()) {
            throw new IllegalStateException("Scheduler has been closed");
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        log.info("Scheduler started, polling for due jobs every {} ms", config.getTickIntervalMs());

        safeTick();

        synchronized (this) {
            if (running.get() && tickTask == null) {
                tickTask = timer.scheduleAtFixedRate(this::safeTick,
                        config.getTickIntervalMs(), config.getTickIntervalMs(), TimeUnit.MILLISECONDS);
            }
        }
    }

    /**
     * Stop scheduling new ticks. Executions already in flight are not interrupted.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        synchronized (this) {
            if (tickTask != null) {
                tickTask.cancel(false);
                tickTask = null;
            }
        }
        log.info("Scheduler stopped");
    }

    /**
     * Run one poll-and-execute cycle. Does nothing unless the scheduler is running.
     *
     * @return number of due jobs picked up
     */
    public int tick() {
        if (!running.get()) {
            return 0;
        }

        long now = clock.millis();
        List<ScheduledJob> dueJobs = store.getDueJobs(now);

        for (ScheduledJob job : dueJobs) {
            executeJob(job);
        }
        return dueJobs.size();
    }

    /**
     * Execute one job through its full cycle: mark it running, invoke its handler,
     * then record the outcome and remove, retain or reschedule it.
     *
     * @return true if the handler completed successfully
     */
    public boolean executeJob(Job job) {
        String id = job.getId();
        if (!inFlight.add(id)) {
            log.warn("Job {} is already executing, skipping duplicate", id);
            return false;
        }

        long startTime = clock.millis();
        try {
            if (job.getStatus() != Job.Status.PENDING) {
                log.warn("Job {} is {} and cannot be executed", id, job.getStatus().wireName());
                return false;
            }
            if (!store.updateJobStatus(id, Job.Status.RUNNING)) {
                return false;
            }
            log.info("Job {} started | handler: {}", id, job.getHandlerName());

            Object result;
            try {
                JobHandler handler = store.getHandlerForJob(job);
                result = invoke(handler, job);
            } catch (Exception e) {
                fail(job, e, startTime);
                return false;
            }

            return complete(job, result, startTime);
        } catch (PersistenceException | RuntimeException e) {
            if (job.getStatus() == Job.Status.RUNNING) {
                fail(job, e, startTime);
            } else {
                log.error("Job {} could not be started", id, e);
            }
            return false;
        } finally {
            inFlight.remove(id);
        }
    }

    /**
     * Schedule a one-shot job to run after a delay.
     *
     * @return the generated job id
     */
    public String scheduleJob(String handlerName, long delayMs, Map<String, Object> data)
            throws PersistenceException {
        return scheduleJob(handlerName, delayMs, data, null);
    }

    public String scheduleJob(String handlerName, long delayMs, Map<String, Object> data,
                              RetryStrategy retryStrategy) throws PersistenceException {
        long now = clock.millis();
        ScheduledJob job = ScheduledJob.builder(generateJobId(now), now + delayMs, handlerName)
                .withData(data)
                .withRetryStrategy(retryStrategy)
                .withCreatedAt(now)
                .build();

        store.addJob(job);
        log.info("Job {} scheduled | handler: {} | runs in {} ms", job.getId(), handlerName, delayMs);
        return job.getId();
    }

    /**
     * Schedule a job that runs at every occurrence of a cron expression.
     *
     * @return the generated job id
     * @throws InvalidCronExpressionException if the expression cannot be parsed
     */
    public String scheduleRecurringJob(String handlerName, String cronExpression, Map<String, Object> data)
            throws PersistenceException {
        if (!cronEvaluator.validate(cronExpression)) {
            throw new InvalidCronExpressionException(cronExpression, "Expression cannot be parsed");
        }
        long now = clock.millis();
        long first = cronEvaluator.nextOccurrence(cronExpression, now);

        ScheduledJob job = ScheduledJob.builder(generateJobId(now), first, handlerName)
                .withData(data)
                .withCronExpression(cronExpression)
                .withCreatedAt(now)
                .build();

        store.addJob(job);
        log.info("Recurring job {} scheduled | handler: {} | cron: {} | first run: {}",
                job.getId(), handlerName, cronExpression, Instant.ofEpochMilli(first));
        return job.getId();
    }

    /**
     * Schedule a job that runs every {@code intervalMs} after its previous execution.
     *
     * @return the generated job id
     */
    public String scheduleIntervalJob(String handlerName, long intervalMs, Map<String, Object> data)
            throws PersistenceException {
        if (intervalMs <= 0) {
            throw new ValidationException("Interval must be positive: " + intervalMs);
        }
        long now = clock.millis();
        ScheduledJob job = ScheduledJob.builder(generateJobId(now), now + intervalMs, handlerName)
                .withData(data)
                .withIntervalMs(intervalMs)
                .withCreatedAt(now)
                .build();

        store.addJob(job);
        log.info("Recurring job {} scheduled | handler: {} | every {} ms", job.getId(), handlerName, intervalMs);
        return job.getId();
    }

    public boolean isRunning() { return running.get(); }
    public long getExecutedCount() { return executedCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
    public int getInFlightCount() { return inFlight.size(); }
    public JobStore getStore() { return store; }

    /**
     * Stop ticking and release the scheduler threads.
     */
    @Override
    public void close() {
        stop();
        timer.shutdown();
        if (handlerPool != null) {
            handlerPool.shutdown();
        }
    }

    private void safeTick() {
        try {
            tick();
        } catch (Throwable t) {
            // A task that throws is never run again by the executor
            log.error("Unexpected error during scheduler tick", t);
        }
    }

    private Object invoke(JobHandler handler, Job job) throws Exception {
        if (handlerPool == null) {
            return handler.handle(job.getData());
        }

        long timeout = config.getExecutionTimeoutMs();
        Future<Object> future = handlerPool.submit(() -> handler.handle(job.getData()));
        try {
            return future.get(timeout, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new TimeoutException("Job timed out after " + timeout + " ms");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Exception) {
                throw (Exception) e.getCause();
            }
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    private boolean complete(Job job, Object result, long startTime) {
        String id = job.getId();
        long executedAt = clock.millis();
        if (result != null && log.isDebugEnabled()) {
            log.debug("Job {} result: {}", id, preview(result));
        }

        if (!store.holds(job)) {
            executedCount.incrementAndGet();
            log.info("Job {} completed after being replaced or removed, leaving the store untouched", id);
            return true;
        }

        // Resolved before recording success so an unschedulable job ends up failed, not stranded
        long nextTime = 0;
        if (job.isRecurring()) {
            try {
                nextTime = nextScheduleTime(job, executedAt);
            } catch (RuntimeException e) {
                fail(job, e, startTime);
                return false;
            }
        }

        executedCount.incrementAndGet();
        log.info("Job {} completed | duration: {}ms", id, executedAt - startTime);

        try {
            store.updateJobExecution(id, executedAt, null, job.getRetryCount());
        } catch (PersistenceException | RuntimeException e) {
            log.error("Could not record completion of job {}", id, e);
        }

        try {
            if (job.isRecurring()) {
                store.rescheduleJob(id, nextTime);
                log.info("Job {} rescheduled for {}", id, Instant.ofEpochMilli(nextTime));
            } else {
                store.removeJob(id);
                log.info("Job {} removed", id);
            }
        } catch (PersistenceException | RuntimeException e) {
            log.error("Could not finish execution cycle of job {}", id, e);
        }
        return true;
    }

    private void fail(Job job, Exception error, long startTime) {
        String id = job.getId();
        String message = messageOf(error);
        long executedAt = clock.millis();
        int retryCount = job.getRetryCount() + 1;
        failedCount.incrementAndGet();
        log.warn("Job {} failed after {}ms | attempt {} | {}", id, executedAt - startTime, retryCount, message);

        if (!store.holds(job)) {
            log.info("Job {} was replaced or removed while running, leaving the store untouched", id);
            return;
        }

        try {
            store.updateJobExecution(id, executedAt, message, retryCount);
        } catch (PersistenceException | RuntimeException e) {
            log.error("Could not record failure of job {}", id, e);
        }

        if (job.getStatus() != Job.Status.FAILED) {
            return;
        }
        if (!job.isRecurring()) {
            log.info("Job {} retained for retry (attempt {})", id, retryCount);
            return;
        }
        try {
            reschedule(job, executedAt);
        } catch (PersistenceException | RuntimeException e) {
            log.error("Could not reschedule failed job {}", id, e);
        }
    }

    private void reschedule(Job job, long from) throws PersistenceException {
        long next = nextScheduleTime(job, from);
        store.rescheduleJob(job.getId(), next);
        log.info("Job {} rescheduled for {}", job.getId(), Instant.ofEpochMilli(next));
    }

    private long nextScheduleTime(Job job, long from) {
        String cron = job.getCronExpression();
        if (cron != null && !cron.isBlank()) {
            return cronEvaluator.nextOccurrence(cron, from);
        }
        return from + job.getIntervalMs();
    }

    private static String messageOf(Exception error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getName() : message;
    }

    private static String preview(Object result) {
        String text = String.valueOf(result);
        return text.length() > RESULT_PREVIEW_LENGTH ? text.substring(0, RESULT_PREVIEW_LENGTH) + "..." : text;
    }

    private static String generateJobId(long now) {
        return "job-" + now + "-" + Long.toString(ThreadLocalRandom.current().nextLong(ID_SUFFIX_BOUND), 36);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static Builder builder(JobStore store) {
        return new Builder(store);
    }

    public static class Builder {
        private final JobStore store;
        private SchedulerConfig config = SchedulerConfig.defaults();
        private CronEvaluator cronEvaluator;
        private Clock clock = Clock.systemUTC();

        private Builder(JobStore store) {
            this.store = store;
        }

        public Builder withConfig(SchedulerConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Default: cron-utils evaluator in the configured zone.
         */
        public Builder withCronEvaluator(CronEvaluator cronEvaluator) {
            this.cronEvaluator = cronEvaluator;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public JobScheduler build() {
            if (store == null) {
                throw new IllegalArgumentException("Job store is required");
            }
            return new JobScheduler(this);
        }
    }
}
