package com.umitunal.cronrelay.core;

import com.umitunal.cronrelay.exception.GroupExistsException;
import com.umitunal.cronrelay.exception.NoSuchGroupException;
import com.umitunal.cronrelay.exception.StreamStoreException;
import com.umitunal.cronrelay.model.PendingEntry;

import java.util.List;
import java.util.Map;

/**
 * Durable, append-only, ordered log of entries with consumer groups.
 *
 * Each group keeps a cursor of the last entry delivered to any of its consumers and a
 * pending-entry list of entries delivered but not yet acknowledged. Every entry is
 * delivered to exactly one consumer of a group by {@link #readGroup}; entries stay
 * pending until {@link #acknowledge} and can be re-read by their consumer with
 * {@link #readPending} or taken over by another consumer with {@link #claimIdle}.
 *
 * Implementations must be safe for concurrent use.
 */
public interface StreamStore extends AutoCloseable {

    /**
     * Append an entry to a stream, creating the stream if needed.
     *
     * @return the id assigned to the entry
     */
    StreamEntryId append(String stream, Map<String, String> fields) throws StreamStoreException;

    /**
     * Create a consumer group whose cursor starts at {@code startId}; entries with greater
     * ids will be delivered.
     *
     * @param createStream create the stream if absent instead of failing
     * @throws GroupExistsException if the group already exists
     */
    void createGroup(String stream, String group, StreamEntryId startId, boolean createStream)
            throws StreamStoreException;

    /**
     * Deliver up to {@code count} entries never delivered to the group, recording them as
     * pending for {@code consumer}. Blocks up to {@code blockMs} when none are available.
     *
     * @return delivered entries, empty if the wait timed out
     * @throws NoSuchGroupException if the group does not exist
     */
    List<StreamEntry> readGroup(String stream, String group, String consumer, int count, long blockMs)
            throws StreamStoreException, InterruptedException;

    /**
     * Re-read entries pending for {@code consumer} with ids greater than {@code after},
     * oldest first, incrementing their delivery count. Entries trimmed from the stream are
     * dropped from the pending list.
     */
    List<StreamEntry> readPending(String stream, String group, String consumer, StreamEntryId after, int count)
            throws StreamStoreException;

    /**
     * Transfer entries pending in the group for longer than {@code minIdleMs} to
     * {@code consumer} and return them.
     */
    List<StreamEntry> claimIdle(String stream, String group, String consumer, long minIdleMs, int count)
            throws StreamStoreException;

    /**
     * Remove entries from the group's pending list.
     *
     * @return number of entries that were pending
     */
    long acknowledge(String stream, String group, StreamEntryId... ids) throws StreamStoreException;

    /**
     * Snapshot of the group's pending-entry list, oldest first.
     */
    List<PendingEntry> pending(String stream, String group) throws StreamStoreException;

    long length(String stream) throws StreamStoreException;

    /**
     * Delete the oldest entries so that at most {@code maxLength} remain.
     *
     * @return number of entries deleted
     */
    long trim(String stream, long maxLength) throws StreamStoreException;

    StreamMetrics getMetrics(String stream) throws StreamStoreException;
}
