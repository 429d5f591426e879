package com.umitunal.examples;

import com.umitunal.cronrelay.config.StorageConfig;
import com.umitunal.cronrelay.consumer.ConsumerConfig;
import com.umitunal.cronrelay.consumer.EventConsumer;
import com.umitunal.cronrelay.model.DomainEvent;
import com.umitunal.cronrelay.publisher.StreamEventPublisher;
import com.umitunal.cronrelay.storage.RocksStreamStore;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Recovery example - an event whose handler failed is redelivered after a restart.
 */
public class RecoveryExample {

    public static void main(String[] args) {
        System.out.println("=== Event Recovery Example ===\n");

        StorageConfig config = StorageConfig.newBuilder("/tmp/cronrelay-recovery")
                .build();
        String stream = "recovery:" + System.currentTimeMillis();
        ConsumerConfig consumerConfig = ConsumerConfig.newBuilder(stream, "mailers", "mailer-1")
                .withBlockMs(300)
                .build();

        try (RocksStreamStore store = new RocksStreamStore(config)) {

            new StreamEventPublisher(store).publish(stream, DomainEvent.create("email", "example",
                    System.currentTimeMillis(), Map.of("to", "someone@example.com")));

            AtomicBoolean outage = new AtomicBoolean(true);
            EventConsumer consumer = new EventConsumer(store);
            consumer.registerHandler("email", event -> {
                if (outage.get()) {
                    throw new IllegalStateException("mail server unavailable");
                }
                System.out.println("  Sent email to " + event.getData().get("to"));
            });

            consumer.start(consumerConfig);
            Thread.sleep(1000);
            consumer.stop();

            System.out.println("Handler failed " + consumer.getFailedCount() + " time(s)");
            System.out.println("Pending: " + store.pending(stream, "mailers"));

            // Restart with the same consumer name: pending entries are re-read first
            outage.set(false);
            consumer.start(consumerConfig);
            Thread.sleep(1000);
            consumer.stop();

            System.out.println("\nProcessed after restart: " + consumer.getProcessedCount());
            System.out.println(store.getMetrics(stream));

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
