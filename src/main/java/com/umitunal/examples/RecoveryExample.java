package com.umitunal.examples;

import com.umitunal.cronlite.config.SchedulerConfig;
import com.umitunal.cronlite.config.StorageConfig;
import com.umitunal.cronlite.registry.HandlerRegistry;
import com.umitunal.cronlite.scheduler.JobScheduler;
import com.umitunal.cronlite.storage.RocksJobMirror;
import com.umitunal.cronlite.store.JobStore;

import java.util.Map;

/**
 * Restart recovery example - jobs scheduled before a restart still run after it.
 */
public class RecoveryExample {

    public static void main(String[] args) {
        System.out.println("=== Restart Recovery Example ===\n");

        StorageConfig config = StorageConfig.newBuilder("/tmp/cronlite-recovery")
                .withDurableWrites(true)
                .build();

        HandlerRegistry handlers = HandlerRegistry.withDefaults();

        try {
            // First process: schedule and shut down before anything runs
            try (RocksJobMirror mirror = new RocksJobMirror(config)) {
                mirror.open();
                JobStore store = new JobStore(mirror, handlers);
                store.init();

                JobScheduler scheduler = JobScheduler.builder(store).build();
                scheduler.scheduleJob("consoleHandler", 200, Map.of("report", "daily"));
                scheduler.scheduleJob("consoleHandler", 400, Map.of("report", "weekly"));
                scheduler.close();

                System.out.println("Scheduled 2 jobs, shutting down");
                System.out.println(store.getMetrics());
            }

            Thread.sleep(500);

            // Second process: reload and run whatever became due while down
            try (RocksJobMirror mirror = new RocksJobMirror(config)) {
                mirror.open();
                JobStore store = new JobStore(mirror, handlers);
                int loaded = store.init();
                System.out.println("\nRecovered " + loaded + " jobs after restart");

                try (JobScheduler scheduler = JobScheduler.builder(store)
                        .withConfig(SchedulerConfig.newBuilder().withTickInterval(100).build())
                        .build()) {
                    scheduler.start();
                    Thread.sleep(300);
                    System.out.println("Executed " + scheduler.getExecutedCount() + " overdue jobs");
                }
                System.out.println(store.getMetrics());
            }
        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
