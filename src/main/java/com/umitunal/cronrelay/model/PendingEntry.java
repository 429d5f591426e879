package com.umitunal.cronrelay.model;

import com.umitunal.cronrelay.core.StreamEntryId;

/**
 * An entry delivered to a consumer of a group and not yet acknowledged.
 * Stored per group by the stream store.
 */
public class PendingEntry {
    private String entryId;
    private String consumer;
    private long deliveredAt;
    private int deliveryCount;

    // Required by Kryo
    public PendingEntry() {
    }

    public PendingEntry(StreamEntryId entryId, String consumer, long deliveredAt) {
        this.entryId = entryId.toString();
        this.consumer = consumer;
        this.deliveredAt = deliveredAt;
        this.deliveryCount = 1;
    }

    public StreamEntryId getEntryId() {
        return StreamEntryId.parse(entryId);
    }

    public String getConsumer() {
        return consumer;
    }

    public long getDeliveredAt() {
        return deliveredAt;
    }

    public int getDeliveryCount() {
        return deliveryCount;
    }

    public long idleMillis(long now) {
        return Math.max(0, now - deliveredAt);
    }

    /**
     * Record another delivery, possibly to a different consumer.
     */
    public void redeliver(String consumer, long now) {
        this.consumer = consumer;
        this.deliveredAt = now;
        this.deliveryCount++;
    }

    @Override
    public String toString() {
        return String.format("PendingEntry{id=%s, consumer='%s', deliveredAt=%d, deliveries=%d}",
                entryId, consumer, deliveredAt, deliveryCount);
    }
}
