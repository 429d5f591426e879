package com.umitunal.examples;

import com.umitunal.cronrelay.config.RelayProperties;
import com.umitunal.cronrelay.config.StorageConfig;
import com.umitunal.cronrelay.consumer.ConsumerConfig;
import com.umitunal.cronrelay.consumer.EventConsumer;
import com.umitunal.cronrelay.model.JobDefinition;
import com.umitunal.cronrelay.model.JobSpec;
import com.umitunal.cronrelay.publisher.StreamEventPublisher;
import com.umitunal.cronrelay.scheduler.JobScheduler;
import com.umitunal.cronrelay.scheduler.SchedulerConfig;
import com.umitunal.cronrelay.storage.RocksStreamStore;
import com.umitunal.cronrelay.time.AbsoluteTimeCodec;

import java.util.Map;
import java.util.Properties;

/**
 * Scheduling example - one-time and recurring jobs relayed to a consumer.
 * Settings come from {@code cronrelay.properties}; any key can be overridden with a
 * system property, e.g. {@code -Dcronrelay.storage.data-directory=/tmp/cronrelay}.
 */
public class ScheduledJobsExample {

    public static void main(String[] args) {
        System.out.println("=== Scheduled Jobs Example ===\n");

        Properties props = RelayProperties.load();
        StorageConfig storageConfig = StorageConfig.fromProperties(props);
        SchedulerConfig schedulerConfig = SchedulerConfig.fromProperties(props);
        ConsumerConfig consumerConfig = ConsumerConfig.fromProperties(props);
        System.out.println(schedulerConfig);
        System.out.println(consumerConfig);

        try (RocksStreamStore store = new RocksStreamStore(storageConfig);
             JobScheduler scheduler = new JobScheduler(new StreamEventPublisher(store), schedulerConfig);
             EventConsumer consumer = new EventConsumer(store)) {

            consumer.registerHandler(schedulerConfig.getEventType(), event ->
                    System.out.println("  Triggered: " + event.getData().get("jobName")
                            + " payload=" + event.getData().get("payload")));
            consumer.start(consumerConfig);

            JobDefinition inTwoSeconds = scheduler.createOneTimeAfter("water-plants", "2s",
                    Map.of("message", "Water the plants"));
            String at = AbsoluteTimeCodec.formatAbsolute(System.currentTimeMillis() + 4000, schedulerConfig.getZone());
            JobDefinition atTime = scheduler.createOneTimeAt("stand-up", at, Map.of("message", "Stand up"));
            JobDefinition daily = scheduler.createJob(JobSpec.recurring("daily-report", "0 9 * * *")
                    .payload(Map.of("report", "daily"))
                    .build());

            System.out.println("Created: " + inTwoSeconds);
            System.out.println("Created: " + atTime);
            System.out.println("Created: " + daily);
            System.out.println(scheduler.stats());

            System.out.println("\nWaiting 5 seconds...");
            Thread.sleep(5000);

            System.out.println("\n" + scheduler.getJob(inTwoSeconds.getId()).orElseThrow());
            System.out.println(scheduler.stats());
            System.out.println("Consumer processed: " + consumer.getProcessedCount());
            System.out.println(store.getMetrics(schedulerConfig.getStreamName()));

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
