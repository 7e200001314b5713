package com.umitunal.examples;

import com.umitunal.cronlite.config.SchedulerConfig;
import com.umitunal.cronlite.config.StorageConfig;
import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.cron.CronUtilsEvaluator;
import com.umitunal.cronlite.model.ScheduledJob;
import com.umitunal.cronlite.registry.HandlerRegistry;
import com.umitunal.cronlite.scheduler.JobScheduler;
import com.umitunal.cronlite.storage.RocksJobMirror;
import com.umitunal.cronlite.store.JobStore;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Recurring jobs example - cron and fixed-interval schedules.
 */
public class RecurringJobsExample {

    public static void main(String[] args) {
        System.out.println("=== Recurring Jobs Example ===\n");

        StorageConfig config = StorageConfig.newBuilder("/tmp/cronlite-recurring")
                .withDurableWrites(false)
                .build();

        AtomicInteger heartbeats = new AtomicInteger();
        HandlerRegistry handlers = new HandlerRegistry();
        handlers.register("heartbeat", data -> {
            System.out.println("  Heartbeat #" + heartbeats.incrementAndGet() + " from " + data.get("service"));
            return null;
        });
        handlers.register("flaky", data -> {
            throw new IllegalStateException("Downstream service unavailable");
        });

        CronUtilsEvaluator cron = new CronUtilsEvaluator(ZoneOffset.UTC);
        String everySecond = "* * * * * *";
        System.out.println("'" + everySecond + "' means: " + cron.describe(everySecond));
        System.out.println("Next 3 runs:");
        for (long at : cron.nextOccurrences(everySecond, 3, System.currentTimeMillis())) {
            System.out.println("  " + Instant.ofEpochMilli(at));
        }

        try (RocksJobMirror mirror = new RocksJobMirror(config)) {
            mirror.open();
            JobStore store = new JobStore(mirror, handlers);
            store.init();

            try (JobScheduler scheduler = JobScheduler.builder(store)
                    .withConfig(SchedulerConfig.newBuilder()
                            .withTickInterval(100)
                            .withZone(ZoneOffset.UTC)
                            .build())
                    .withCronEvaluator(cron)
                    .build()) {

                String cronJob = scheduler.scheduleRecurringJob("heartbeat", everySecond, Map.of("service", "api"));
                String intervalJob = scheduler.scheduleIntervalJob("flaky", 400, Map.of());

                scheduler.start();
                Thread.sleep(2500);
                scheduler.stop();

                for (String id : new String[]{cronJob, intervalJob}) {
                    Job job = store.getJob(id).orElseThrow();
                    System.out.println("\n" + ((ScheduledJob) job).getScheduleDescription());
                    System.out.println("  " + job);
                    System.out.println("  next run: " + Instant.ofEpochMilli(job.getScheduleTime()));
                }
                System.out.println("\nExecuted: " + scheduler.getExecutedCount()
                        + ", failed: " + scheduler.getFailedCount());

                store.removeJob(cronJob);
                store.removeJob(intervalJob);
            }
        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
