package com.umitunal.cronlite.store;

import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.StoreMetrics;
import com.umitunal.cronlite.error.HandlerNotFoundException;
import com.umitunal.cronlite.error.InvalidCronExpressionException;
import com.umitunal.cronlite.error.PersistenceException;
import com.umitunal.cronlite.error.ValidationException;
import com.umitunal.cronlite.model.JobRecord;
import com.umitunal.cronlite.model.JobRecordMapper;
import com.umitunal.cronlite.model.ScheduledJob;
import com.umitunal.cronlite.registry.HandlerRegistry;
import com.umitunal.cronlite.storage.InMemoryJobMirror;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class JobStoreTest {

    private FlakyMirror mirror;
    private HandlerRegistry registry;
    private JobStore store;

    @BeforeEach
    void setUp() throws Exception {
        mirror = new FlakyMirror();
        mirror.open();
        registry = new HandlerRegistry();
        store = new JobStore(mirror, registry);
        store.init();
    }

    private static ScheduledJob job(String id, long scheduleTime) {
        return ScheduledJob.builder(id, scheduleTime, "handler")
                .withData(Map.of("id", id))
                .build();
    }

    private static List<String> ids(List<? extends Job> jobs) {
        return jobs.stream().map(Job::getId).toList();
    }

    @Test
    @DisplayName("Should index and mirror added jobs")
    void testAddJob() throws Exception {
        // When
        String id = store.addJob(job("job-1", 1_000));

        // Then
        assertThat(id).isEqualTo("job-1");
        assertThat(store.getJob("job-1")).isPresent();
        assertThat(store.isIndexed("job-1")).isTrue();
        assertThat(mirror.get("job-1").get(JobRecord.SCHEDULE_TIME)).isEqualTo("1000");
        assertThat(mirror.get("job-1").get(JobRecord.STATUS)).isEqualTo("pending");
    }

    @Test
    @DisplayName("Should reject a null job")
    void testAddNull() {
        assertThatThrownBy(() -> store.addJob(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Should reject a recurring job with an unparsable cron expression before storing it")
    void testAddInvalidCron() {
        // Given
        ScheduledJob job = ScheduledJob.builder("cron-1", 1_000, "handler")
                .withCronExpression("not a cron")
                .build();

        // When/Then
        assertThatThrownBy(() -> store.addJob(job))
                .isInstanceOf(InvalidCronExpressionException.class)
                .hasMessageContaining("not a cron");
        assertThat(store.getJob("cron-1")).isEmpty();
        assertThat(store.isIndexed("cron-1")).isFalse();
        assertThat(mirror.get("cron-1")).isNull();
    }

    @Test
    @DisplayName("Should return due jobs in time order and only once")
    void testDueJobsConsumedOnce() throws Exception {
        // Given
        store.addJob(job("second", 2_000));
        store.addJob(job("first", 1_000));
        store.addJob(job("future", 10_000));

        // When
        List<ScheduledJob> due = store.getDueJobs(2_000);

        // Then
        assertThat(ids(due)).containsExactly("first", "second");
        assertThat(store.getDueJobs(2_000)).isEmpty();
        assertThat(store.isIndexed("first")).isFalse();
        assertThat(store.isIndexed("future")).isTrue();
        assertThat(store.getJob("first")).isPresent();
    }

    @Test
    @DisplayName("Should not return jobs scheduled after now")
    void testFutureNotDue() throws Exception {
        store.addJob(job("job-1", 1_001));

        assertThat(store.getDueJobs(1_000)).isEmpty();
        assertThat(ids(store.getDueJobs(1_001))).containsExactly("job-1");
    }

    @Test
    @DisplayName("Should drop non-pending jobs from the time index without returning them")
    void testNonPendingDropped() throws Exception {
        // Given
        store.addJob(job("job-1", 1_000));
        store.updateJobStatus("job-1", Job.Status.RUNNING);

        // When/Then
        assertThat(store.getDueJobs(5_000)).isEmpty();
        assertThat(store.isIndexed("job-1")).isFalse();
        assertThat(store.getJob("job-1").orElseThrow().getStatus()).isEqualTo(Job.Status.RUNNING);
    }

    @Test
    @DisplayName("Should replace a job with the same id and forget its old schedule time")
    void testReplaceById() throws Exception {
        // Given
        store.addJob(job("job-1", 1_000));

        // When
        store.addJob(job("job-1", 9_000));

        // Then
        assertThat(store.size()).isEqualTo(1);
        assertThat(store.getDueJobs(5_000)).isEmpty();
        assertThat(ids(store.getDueJobs(9_000))).containsExactly("job-1");
    }

    @Test
    @DisplayName("Should mirror status and execution outcome")
    void testStatusAndExecution() throws Exception {
        // Given
        store.addJob(job("ok", 1_000));
        store.addJob(job("bad", 1_000));
        store.updateJobStatus("ok", Job.Status.RUNNING);
        store.updateJobStatus("bad", Job.Status.RUNNING);
        assertThat(mirror.get("ok").get(JobRecord.STATUS)).isEqualTo("running");

        // When
        store.updateJobExecution("ok", 1_500, null, 0);
        store.updateJobExecution("bad", 1_600, "boom", 1);

        // Then
        assertThat(store.getJob("ok").orElseThrow().getStatus()).isEqualTo(Job.Status.COMPLETED);
        assertThat(mirror.get("ok").get(JobRecord.STATUS)).isEqualTo("completed");
        assertThat(mirror.get("ok").get(JobRecord.EXECUTED_AT)).isEqualTo("1500");
        assertThat(mirror.get("ok").get(JobRecord.LAST_ERROR)).isEmpty();

        assertThat(store.getJob("bad").orElseThrow().getStatus()).isEqualTo(Job.Status.FAILED);
        assertThat(mirror.get("bad").get(JobRecord.STATUS)).isEqualTo("failed");
        assertThat(mirror.get("bad").get(JobRecord.LAST_ERROR)).isEqualTo("boom");
        assertThat(mirror.get("bad").get(JobRecord.RETRY_COUNT)).isEqualTo("1");
    }

    @Test
    @DisplayName("Should report unknown ids without touching the mirror")
    void testUnknownIds() throws Exception {
        assertThat(store.updateJobStatus("ghost", Job.Status.RUNNING)).isFalse();
        assertThat(store.updateJobExecution("ghost", 1, null, 0)).isFalse();
        assertThat(store.rescheduleJob("ghost", 1)).isFalse();
        assertThat(mirror.size()).isZero();
    }

    @Test
    @DisplayName("Should reject transitions outside the execution cycle")
    void testInvalidTransition() throws Exception {
        store.addJob(job("job-1", 1_000));

        assertThatThrownBy(() -> store.updateJobStatus("job-1", Job.Status.COMPLETED))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should reschedule a finished recurring job to pending")
    void testReschedule() throws Exception {
        // Given
        store.addJob(ScheduledJob.builder("rec", 1_000, "handler").withIntervalMs(500).build());
        store.getDueJobs(1_000);
        store.updateJobStatus("rec", Job.Status.RUNNING);
        store.updateJobExecution("rec", 1_010, "boom", 1);

        // When
        store.rescheduleJob("rec", 1_510);

        // Then
        Job job = store.getJob("rec").orElseThrow();
        assertThat(job.getStatus()).isEqualTo(Job.Status.PENDING);
        assertThat(job.getLastError()).isNull();
        assertThat(job.getRetryCount()).isZero();
        assertThat(mirror.get("rec").get(JobRecord.SCHEDULE_TIME)).isEqualTo("1510");
        assertThat(mirror.get("rec").get(JobRecord.STATUS)).isEqualTo("pending");
        assertThat(ids(store.getDueJobs(1_510))).containsExactly("rec");
    }

    @Test
    @DisplayName("Should remove jobs from memory, index and mirror")
    void testRemove() throws Exception {
        // Given
        store.addJob(job("job-1", 1_000));
        mirror.put("orphan", new JobRecord().put(JobRecord.ID, "orphan").put(JobRecord.SCHEDULE_TIME, "1"));

        // When/Then
        assertThat(store.removeJob("job-1")).isTrue();
        assertThat(store.getJob("job-1")).isEmpty();
        assertThat(store.getDueJobs(5_000)).isEmpty();
        assertThat(mirror.get("job-1")).isNull();

        assertThat(store.removeJob("orphan")).isFalse();
        assertThat(mirror.get("orphan")).isNull();
    }

    @Test
    @DisplayName("Should keep the in-memory change when the mirror write fails")
    void testNoRollbackOnMirrorFailure() throws Exception {
        // Given
        mirror.failWrites = true;

        // When/Then
        assertThatThrownBy(() -> store.addJob(job("job-1", 1_000)))
                .isInstanceOf(PersistenceException.class);
        assertThat(store.getJob("job-1")).isPresent();
        assertThat(mirror.get("job-1")).isNull();
        assertThat(ids(store.getDueJobs(1_000))).containsExactly("job-1");
    }

    @Test
    @DisplayName("Should rebuild from the mirror and stay idempotent")
    void testInit() throws Exception {
        // Given
        JobRecordMapper mapper = new JobRecordMapper();
        mirror.put("a", mapper.toRecord(job("a", 1_000)));
        mirror.put("b", mapper.toRecord(job("b", 2_000)));

        // When
        assertThat(store.init()).isEqualTo(2);
        assertThat(store.init()).isEqualTo(2);

        // Then
        assertThat(store.size()).isEqualTo(2);
        assertThat(ids(store.getDueJobs(2_000))).containsExactly("a", "b");
    }

    @Test
    @DisplayName("Should skip corrupt records and keep interrupted running jobs out of the due set")
    void testInitRecovery() throws Exception {
        // Given
        JobRecordMapper mapper = new JobRecordMapper();
        mirror.put("good", mapper.toRecord(job("good", 1_000)));
        mirror.put("corrupt", new JobRecord().put(JobRecord.ID, "corrupt").put(JobRecord.SCHEDULE_TIME, "soon"));
        JobRecord interrupted = mapper.toRecord(job("interrupted", 1_000));
        interrupted.put(JobRecord.STATUS, "running");
        mirror.put("interrupted", interrupted);

        // When
        int loaded = store.init();

        // Then
        assertThat(loaded).isEqualTo(2);
        assertThat(store.getJob("corrupt")).isEmpty();
        assertThat(store.getJob("interrupted").orElseThrow().getStatus()).isEqualTo(Job.Status.RUNNING);
        assertThat(ids(store.getDueJobs(5_000))).containsExactly("good");
    }

    @Test
    @DisplayName("Should skip recovered recurring jobs whose cron expression cannot be parsed")
    void testInitSkipsInvalidCron() throws Exception {
        // Given
        JobRecordMapper mapper = new JobRecordMapper();
        mirror.put("good", mapper.toRecord(job("good", 1_000)));
        JobRecord broken = mapper.toRecord(ScheduledJob.builder("broken", 1_000, "handler")
                .withCronExpression("*/5 * * * * *")
                .build());
        broken.put(JobRecord.CRON_EXPRESSION, "every now and then");
        mirror.put("broken", broken);

        // When
        int loaded = store.init();

        // Then
        assertThat(loaded).isEqualTo(1);
        assertThat(store.getJob("broken")).isEmpty();
        assertThat(ids(store.getDueJobs(5_000))).containsExactly("good");
    }

    @Test
    @DisplayName("Should tell whether a job instance is still the one held under its id")
    void testHolds() throws Exception {
        // Given
        ScheduledJob original = job("job-1", 1_000);
        store.addJob(original);

        // When
        ScheduledJob replacement = job("job-1", 2_000);
        store.addJob(replacement);

        // Then
        assertThat(store.holds(original)).isFalse();
        assertThat(store.holds(replacement)).isTrue();
        store.removeJob("job-1");
        assertThat(store.holds(replacement)).isFalse();
    }

    @Test
    @DisplayName("Should purge only one-shot failed jobs")
    void testPurgeFailedJobs() throws Exception {
        // Given
        store.addJob(job("failed", 1_000));
        store.addJob(job("pending", 1_000));
        store.updateJobStatus("failed", Job.Status.RUNNING);
        store.updateJobExecution("failed", 1_100, "boom", 1);

        // When
        int purged = store.purgeFailedJobs();

        // Then
        assertThat(purged).isEqualTo(1);
        assertThat(store.getJob("failed")).isEmpty();
        assertThat(mirror.get("failed")).isNull();
        assertThat(store.getJob("pending")).isPresent();
    }

    @Test
    @DisplayName("Should resolve handlers by the job's handler name")
    void testGetHandlerForJob() throws Exception {
        // Given
        registry.register("handler", data -> "done");
        ScheduledJob known = job("job-1", 1_000);
        ScheduledJob unknown = ScheduledJob.builder("job-2", 1_000, "missing").build();

        // When/Then
        assertThat(store.getHandlerForJob(known).handle(known.getData())).isEqualTo("done");
        assertThatThrownBy(() -> store.getHandlerForJob(unknown))
                .isInstanceOf(HandlerNotFoundException.class)
                .hasMessageContaining("missing")
                .hasMessageContaining("job-2");
    }

    @Test
    @DisplayName("Should count jobs by status")
    void testMetrics() throws Exception {
        // Given
        store.addJob(job("a", 1_000));
        store.addJob(job("b", 1_000));
        store.addJob(job("c", 1_000));
        store.updateJobStatus("c", Job.Status.RUNNING);

        // When
        StoreMetrics metrics = store.getMetrics();

        // Then
        assertThat(metrics.getTotalJobs()).isEqualTo(3);
        assertThat(metrics.getPendingJobs()).isEqualTo(2);
        assertThat(metrics.getRunningJobs()).isEqualTo(1);
        assertThat(store.getPendingCount()).isEqualTo(2);
        assertThat(store.getAllJobs()).hasSize(3);
    }

    /**
     * In-memory mirror whose writes can be made to fail.
     */
    static class FlakyMirror extends InMemoryJobMirror {
        volatile boolean failWrites;

        @Override
        public void put(String jobId, JobRecord record) throws PersistenceException {
            failIfRequested();
            super.put(jobId, record);
        }

        @Override
        public void updateFields(String jobId, Map<String, String> fields) throws PersistenceException {
            failIfRequested();
            super.updateFields(jobId, fields);
        }

        @Override
        public void delete(String jobId) throws PersistenceException {
            failIfRequested();
            super.delete(jobId);
        }

        private void failIfRequested() throws PersistenceException {
            if (failWrites) {
                throw new PersistenceException("Simulated mirror outage");
            }
        }
    }
}
