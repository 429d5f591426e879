package com.umitunal.cronrelay.consumer;

import com.umitunal.cronrelay.core.StreamEntry;
import com.umitunal.cronrelay.core.StreamEntryId;
import com.umitunal.cronrelay.core.StreamStore;
import com.umitunal.cronrelay.exception.CodecException;
import com.umitunal.cronrelay.exception.GroupExistsException;
import com.umitunal.cronrelay.exception.StreamStoreException;
import com.umitunal.cronrelay.model.DomainEvent;
import com.umitunal.cronrelay.serialization.EventRecordCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Member of a consumer group on one stream, dispatching entries to handlers by event type.
 *
 * Instances sharing a group name split the stream between them; each entry reaches one
 * of them. An entry is acknowledged once its handler returns, or straight away when no
 * handler is registered for its type. Entries whose handler throws, or that cannot be
 * decoded, stay in the group's pending list and are re-read the next time a consumer with
 * the same name starts, or claimed by another member when idle claiming is enabled.
 *
 * The read loop runs on its own thread. {@link #stop()} is cooperative: the loop sees it
 * after the current read returns and in-flight handlers complete.
 */
public class EventConsumer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventConsumer.class);

    private final StreamStore store;
    private final EventRecordCodec recordCodec;
    private final Map<String, EventHandler> handlers = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong processedCount = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);
    private final AtomicLong unroutableCount = new AtomicLong(0);

    private volatile ConsumerConfig config;
    private Thread consumerThread;

    public EventConsumer(StreamStore store) {
        this(store, new EventRecordCodec());
    }

    public EventConsumer(StreamStore store, EventRecordCodec recordCodec) {
        this.store = store;
        this.recordCodec = recordCodec;
    }

    /**
     * Route events of {@code eventType} to {@code handler}, replacing any earlier registration.
     */
    public void registerHandler(String eventType, EventHandler handler) {
        EventHandler previous = handlers.put(eventType, handler);
        if (previous != null) {
            logger.warn("Handler for event type {} replaced", eventType);
        } else {
            logger.debug("Handler registered for event type {}", eventType);
        }
    }

    /**
     * Make sure the group exists, then start the read loop in the background.
     *
     * @throws StreamStoreException if the group cannot be created
     * @throws IllegalStateException if this consumer is already running
     */
    public void start(ConsumerConfig config) throws StreamStoreException {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Consumer " + config.getConsumerName() + " is already running");
        }

        try {
            ensureGroup(config);
        } catch (StreamStoreException | RuntimeException e) {
            running.set(false);
            throw e;
        }

        this.config = config;
        consumerThread = new Thread(() -> run(config), "EventConsumer-" + config.getConsumerName());
        consumerThread.setDaemon(false);
        consumerThread.start();

        logger.info("Starting event consumer: stream={}, group={}, consumer={}",
                config.getStreamName(), config.getGroupName(), config.getConsumerName());
    }

    /**
     * Ask the loop to exit and wait for it to finish its current iteration.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        logger.info("Stopping event consumer {}...", config.getConsumerName());

        Thread thread = consumerThread;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(config.getBlockMs() + 5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public long getProcessedCount() { return processedCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
    public long getUnroutableCount() { return unroutableCount.get(); }
    public boolean isRunning() { return running.get(); }

    /**
     * Name from the config this consumer was last started with, or null before the first start.
     */
    public String getConsumerName() {
        ConsumerConfig current = config;
        return current == null ? null : current.getConsumerName();
    }

    @Override
    public void close() {
        stop();
    }

    private void ensureGroup(ConsumerConfig config) throws StreamStoreException {
        try {
            store.createGroup(config.getStreamName(), config.getGroupName(), config.getGroupStartId(), true);
            logger.info("Consumer group created: stream={}, group={}", config.getStreamName(), config.getGroupName());
        } catch (GroupExistsException e) {
            logger.debug("Consumer group already exists: stream={}, group={}",
                    config.getStreamName(), config.getGroupName());
        }
    }

    private void run(ConsumerConfig config) {
        // Entries delivered to this consumer name before a crash or handler failure come first
        StreamEntryId recoveredUpTo = StreamEntryId.MIN;
        boolean recovering = true;
        long lastClaimAt = 0;

        try {
            while (running.get()) {
                try {
                    if (recovering) {
                        List<StreamEntry> pending = store.readPending(config.getStreamName(), config.getGroupName(),
                                config.getConsumerName(), recoveredUpTo, config.getCount());
                        if (pending.isEmpty()) {
                            recovering = false;
                            continue;
                        }
                        logger.info("Re-processing {} pending entries for consumer {}",
                                pending.size(), config.getConsumerName());
                        process(config, pending);
                        recoveredUpTo = pending.get(pending.size() - 1).getId();
                        continue;
                    }

                    if (config.getClaimIdleMs() > 0
                            && System.currentTimeMillis() - lastClaimAt >= config.getClaimIdleMs()) {
                        lastClaimAt = System.currentTimeMillis();
                        List<StreamEntry> claimed = store.claimIdle(config.getStreamName(), config.getGroupName(),
                                config.getConsumerName(), config.getClaimIdleMs(), config.getCount());
                        if (!claimed.isEmpty()) {
                            logger.info("Claimed {} idle entries for consumer {}", claimed.size(), config.getConsumerName());
                            process(config, claimed);
                        }
                    }

                    List<StreamEntry> entries = store.readGroup(config.getStreamName(), config.getGroupName(),
                            config.getConsumerName(), config.getCount(), config.getBlockMs());
                    process(config, entries);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (StreamStoreException | RuntimeException e) {
                    if (!running.get()) {
                        break;
                    }
                    logger.error("Error consuming events from stream {}", config.getStreamName(), e);
                    if (!backoff(config.getRetryBackoffMs())) {
                        break;
                    }
                }
            }
        } finally {
            running.set(false);
            logger.info("Event consumer {} stopped", config.getConsumerName());
        }
    }

    private void process(ConsumerConfig config, List<StreamEntry> entries) throws StreamStoreException {
        for (StreamEntry entry : entries) {
            processEntry(config, entry);
        }
    }

    private void processEntry(ConsumerConfig config, StreamEntry entry) throws StreamStoreException {
        DomainEvent event;
        try {
            event = recordCodec.fromFields(entry.getFields());
        } catch (CodecException e) {
            failedCount.incrementAndGet();
            logger.error("Unparseable entry {} on stream {} left pending", entry.getId(), config.getStreamName(), e);
            return;
        }

        logger.debug("Processing event {} of type {}", event.getEventId(), event.getEventType());

        EventHandler handler = handlers.get(event.getEventType());
        if (handler == null) {
            logger.warn("No handler registered for event type {}, acknowledging entry {}",
                    event.getEventType(), entry.getId());
            store.acknowledge(config.getStreamName(), config.getGroupName(), entry.getId());
            unroutableCount.incrementAndGet();
            return;
        }

        try {
            handler.handle(event);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            failedCount.incrementAndGet();
            logger.error("Handler failed for event {} (entry {}), left pending for redelivery",
                    event.getEventId(), entry.getId(), e);
            return;
        }

        store.acknowledge(config.getStreamName(), config.getGroupName(), entry.getId());
        processedCount.incrementAndGet();
        logger.debug("Event {} processed and acknowledged", event.getEventId());
    }

    private boolean backoff(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
