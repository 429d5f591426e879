package com.umitunal.cronrelay.consumer;

import com.umitunal.cronrelay.core.StreamEntry;
import com.umitunal.cronrelay.core.StreamEntryId;
import com.umitunal.cronrelay.core.StreamMetrics;
import com.umitunal.cronrelay.core.StreamStore;
import com.umitunal.cronrelay.exception.StreamStoreException;
import com.umitunal.cronrelay.model.PendingEntry;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Store whose first {@code failures} group reads throw, then delegates normally.
 */
class FailingReadStore implements StreamStore {
    private final StreamStore delegate;
    private final Supplier<Throwable> error;
    private final AtomicInteger remaining;
    private final AtomicInteger thrown = new AtomicInteger();

    FailingReadStore(StreamStore delegate, int failures, Supplier<Throwable> error) {
        this.delegate = delegate;
        this.remaining = new AtomicInteger(failures);
        this.error = error;
    }

    int getThrownCount() {
        return thrown.get();
    }

    @Override
    public List<StreamEntry> readGroup(String stream, String group, String consumer, int count, long blockMs)
            throws StreamStoreException, InterruptedException {
        if (remaining.getAndDecrement() > 0) {
            thrown.incrementAndGet();
            Throwable t = error.get();
            if (t instanceof StreamStoreException) {
                throw (StreamStoreException) t;
            }
            if (t instanceof RuntimeException) {
                throw (RuntimeException) t;
            }
            throw (Error) t;
        }
        return delegate.readGroup(stream, group, consumer, count, blockMs);
    }

    @Override
    public StreamEntryId append(String stream, Map<String, String> fields) throws StreamStoreException {
        return delegate.append(stream, fields);
    }

    @Override
    public void createGroup(String stream, String group, StreamEntryId startId, boolean createStream)
            throws StreamStoreException {
        delegate.createGroup(stream, group, startId, createStream);
    }

    @Override
    public List<StreamEntry> readPending(String stream, String group, String consumer, StreamEntryId after, int count)
            throws StreamStoreException {
        return delegate.readPending(stream, group, consumer, after, count);
    }

    @Override
    public List<StreamEntry> claimIdle(String stream, String group, String consumer, long minIdleMs, int count)
            throws StreamStoreException {
        return delegate.claimIdle(stream, group, consumer, minIdleMs, count);
    }

    @Override
    public long acknowledge(String stream, String group, StreamEntryId... ids) throws StreamStoreException {
        return delegate.acknowledge(stream, group, ids);
    }

    @Override
    public List<PendingEntry> pending(String stream, String group) throws StreamStoreException {
        return delegate.pending(stream, group);
    }

    @Override
    public long length(String stream) throws StreamStoreException {
        return delegate.length(stream);
    }

    @Override
    public long trim(String stream, long maxLength) throws StreamStoreException {
        return delegate.trim(stream, maxLength);
    }

    @Override
    public StreamMetrics getMetrics(String stream) throws StreamStoreException {
        return delegate.getMetrics(stream);
    }

    @Override
    public void close() {
        // owned by the test
    }
}
