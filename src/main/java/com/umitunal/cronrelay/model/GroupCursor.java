package com.umitunal.cronrelay.model;

import com.umitunal.cronrelay.core.StreamEntryId;

/**
 * Position of a consumer group in a stream: the last entry handed to any of its consumers.
 */
public class GroupCursor {
    private String group;
    private String lastDeliveredId;
    private long createdAt;

    // Required by Kryo
    public GroupCursor() {
    }

    public GroupCursor(String group, StreamEntryId lastDeliveredId, long createdAt) {
        this.group = group;
        this.lastDeliveredId = lastDeliveredId.toString();
        this.createdAt = createdAt;
    }

    public String getGroup() {
        return group;
    }

    public StreamEntryId getLastDeliveredId() {
        return StreamEntryId.parse(lastDeliveredId);
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void advanceTo(StreamEntryId id) {
        this.lastDeliveredId = id.toString();
    }
}
