package com.umitunal.cronrelay.model;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable event relayed through a stream. {@code eventType} selects the consumer handler.
 */
public final class DomainEvent {
    private final String eventId;
    private final String eventType;
    private final String source;
    private final long timestamp;
    private final Map<String, Object> data;

    public DomainEvent(String eventId, String eventType, String source, long timestamp, Map<String, Object> data) {
        this.eventId = Objects.requireNonNull(eventId, "eventId");
        this.eventType = Objects.requireNonNull(eventType, "eventType");
        this.source = source;
        this.timestamp = timestamp;
        this.data = Documents.immutableCopy(data);
    }

    /**
     * New event with a random id.
     */
    public static DomainEvent create(String eventType, String source, long timestamp, Map<String, Object> data) {
        return new DomainEvent(UUID.randomUUID().toString(), eventType, source, timestamp, data);
    }

    public String getEventId() { return eventId; }
    public String getEventType() { return eventType; }
    public String getSource() { return source; }
    public long getTimestamp() { return timestamp; }
    public Map<String, Object> getData() { return data; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DomainEvent)) return false;
        DomainEvent that = (DomainEvent) o;
        return timestamp == that.timestamp
                && eventId.equals(that.eventId)
                && eventType.equals(that.eventType)
                && Objects.equals(source, that.source)
                && data.equals(that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, eventType, source, timestamp, data);
    }

    @Override
    public String toString() {
        return String.format("DomainEvent{eventId='%s', type='%s', source='%s', timestamp=%d}",
                eventId, eventType, source, timestamp);
    }
}
