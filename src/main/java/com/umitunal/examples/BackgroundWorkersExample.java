package com.umitunal.examples;

import com.umitunal.cronrelay.config.StorageConfig;
import com.umitunal.cronrelay.consumer.ConsumerConfig;
import com.umitunal.cronrelay.consumer.EventConsumer;
import com.umitunal.cronrelay.consumer.EventHandler;
import com.umitunal.cronrelay.model.DomainEvent;
import com.umitunal.cronrelay.publisher.EventPublisher;
import com.umitunal.cronrelay.publisher.StreamEventPublisher;
import com.umitunal.cronrelay.storage.RocksStreamStore;

import java.util.Map;

/**
 * Background workers example - three consumers in one group share a stream.
 */
public class BackgroundWorkersExample {

    public static void main(String[] args) {
        System.out.println("=== Background Workers Example ===\n");

        StorageConfig config = StorageConfig.newBuilder("/tmp/cronrelay-workers")
                .build();
        String stream = "tasks:" + System.currentTimeMillis();

        try (RocksStreamStore store = new RocksStreamStore(config)) {

            EventPublisher publisher = new StreamEventPublisher(store);
            for (int i = 1; i <= 12; i++) {
                publisher.publish(stream, DomainEvent.create("task", "example", System.currentTimeMillis(),
                        Map.of("task", "Task #" + i)));
            }

            System.out.println("Published 12 events");
            System.out.println(store.getMetrics(stream));

            EventHandler handler = event -> {
                System.out.println("  " + Thread.currentThread().getName() + " processing: " + event.getData().get("task"));
                Thread.sleep(200); // Simulate work
            };

            EventConsumer worker1 = new EventConsumer(store);
            EventConsumer worker2 = new EventConsumer(store);
            EventConsumer worker3 = new EventConsumer(store);
            worker1.registerHandler("task", handler);
            worker2.registerHandler("task", handler);
            worker3.registerHandler("task", handler);

            worker1.start(ConsumerConfig.newBuilder(stream, "workers", "worker-1").withCount(2).withBlockMs(500).build());
            worker2.start(ConsumerConfig.newBuilder(stream, "workers", "worker-2").withCount(2).withBlockMs(500).build());
            worker3.start(ConsumerConfig.newBuilder(stream, "workers", "worker-3").withCount(2).withBlockMs(500).build());

            // Wait for completion
            Thread.sleep(3000);

            worker1.stop();
            worker2.stop();
            worker3.stop();

            System.out.println("\nWorker 1 processed: " + worker1.getProcessedCount());
            System.out.println("Worker 2 processed: " + worker2.getProcessedCount());
            System.out.println("Worker 3 processed: " + worker3.getProcessedCount());

            System.out.println("\n" + store.getMetrics(stream));

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
