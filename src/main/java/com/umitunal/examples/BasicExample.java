package com.umitunal.examples;

import com.umitunal.cronlite.config.SchedulerConfig;
import com.umitunal.cronlite.config.StorageConfig;
import com.umitunal.cronlite.registry.HandlerRegistry;
import com.umitunal.cronlite.scheduler.JobScheduler;
import com.umitunal.cronlite.storage.RocksJobMirror;
import com.umitunal.cronlite.store.JobStore;

import java.util.Map;

/**
 * Basic usage example - one-shot delayed jobs.
 */
public class BasicExample {

    public static void main(String[] args) {
        System.out.println("=== Basic Scheduling Example ===\n");

        StorageConfig config = StorageConfig.newBuilder("/tmp/cronlite-basic")
                .withDurableWrites(false)
                .build();

        HandlerRegistry handlers = HandlerRegistry.withDefaults();
        handlers.register("sendEmail", data -> {
            System.out.println("  Sending email to " + data.get("to") + ": " + data.get("subject"));
            return "sent";
        });

        try (RocksJobMirror mirror = new RocksJobMirror(config)) {
            mirror.open();
            JobStore store = new JobStore(mirror, handlers);
            store.init();

            try (JobScheduler scheduler = JobScheduler.builder(store)
                    .withConfig(SchedulerConfig.newBuilder().withTickInterval(200).build())
                    .build()) {

                // Schedule jobs
                scheduler.scheduleJob("sendEmail", 300, Map.of("to", "alice@example.com", "subject", "Welcome"));
                scheduler.scheduleJob("sendEmail", 600, Map.of("to", "bob@example.com", "subject", "Reminder"));
                scheduler.scheduleJob("consoleHandler", 100, Map.of("message", "Hello from cronlite"));

                System.out.println("Scheduled 3 jobs");
                System.out.println(store.getMetrics());

                scheduler.start();
                Thread.sleep(1000);

                System.out.println("\nExecuted: " + scheduler.getExecutedCount()
                        + ", failed: " + scheduler.getFailedCount());
                System.out.println(store.getMetrics());
            }
        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
