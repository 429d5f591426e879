package com.umitunal.cronrelay.model;

import com.umitunal.cronrelay.core.StreamEntryId;

/**
 * Per-stream bookkeeping: entry count and the last id assigned. The last id is kept
 * after its entry is trimmed so ids never go backwards.
 */
public class StreamHead {
    private String lastId;
    private long length;
    private long createdAt;

    // Required by Kryo
    public StreamHead() {
    }

    public StreamHead(long createdAt) {
        this.lastId = StreamEntryId.MIN.toString();
        this.length = 0;
        this.createdAt = createdAt;
    }

    public StreamEntryId getLastId() {
        return StreamEntryId.parse(lastId);
    }

    public long getLength() {
        return length;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void appended(StreamEntryId id) {
        this.lastId = id.toString();
        this.length++;
    }

    public void trimmed(long count) {
        this.length = Math.max(0, length - count);
    }
}
