package com.umitunal.cronrelay.core;

/**
 * Metrics and statistics for stream monitoring.
 */
public class StreamMetrics {
    private final long length;
    private final long groups;
    private final long pendingEntries;
    private final StreamEntryId firstEntryId;
    private final StreamEntryId lastEntryId;

    public StreamMetrics(long length, long groups, long pendingEntries,
                         StreamEntryId firstEntryId, StreamEntryId lastEntryId) {
        this.length = length;
        this.groups = groups;
        this.pendingEntries = pendingEntries;
        this.firstEntryId = firstEntryId;
        this.lastEntryId = lastEntryId;
    }

    public long getLength() { return length; }
    public long getGroups() { return groups; }

    /**
     * Delivered but unacknowledged entries, summed over all groups.
     */
    public long getPendingEntries() { return pendingEntries; }

    /** Null when the stream is empty. */
    public StreamEntryId getFirstEntryId() { return firstEntryId; }

    /** Last id ever assigned, which survives trimming. Null if nothing was appended. */
    public StreamEntryId getLastEntryId() { return lastEntryId; }

    @Override
    public String toString() {
        return String.format(
            "StreamMetrics{length=%d, groups=%d, pending=%d, first=%s, last=%s}",
            length, groups, pendingEntries, firstEntryId, lastEntryId
        );
    }
}
