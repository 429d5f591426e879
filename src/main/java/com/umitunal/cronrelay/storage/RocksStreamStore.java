package com.umitunal.cronrelay.storage;

import com.umitunal.cronrelay.config.StorageConfig;
import com.umitunal.cronrelay.core.StreamEntry;
import com.umitunal.cronrelay.core.StreamEntryId;
import com.umitunal.cronrelay.core.StreamMetrics;
import com.umitunal.cronrelay.core.StreamStore;
import com.umitunal.cronrelay.exception.GroupExistsException;
import com.umitunal.cronrelay.exception.NoSuchGroupException;
import com.umitunal.cronrelay.exception.StreamStoreException;
import com.umitunal.cronrelay.model.GroupCursor;
import com.umitunal.cronrelay.model.PendingEntry;
import com.umitunal.cronrelay.model.StreamHead;
import com.umitunal.cronrelay.serialization.FieldSetCodec;
import com.umitunal.cronrelay.serialization.KryoCodec;
import com.umitunal.cronrelay.serialization.PayloadCodec;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * RocksDB-backed implementation of StreamStore.
 *
 * Entries, group cursors and pending-entry lists of all streams share one database
 * (see {@link StreamKeys} for the layout). Every operation runs under a store-wide lock and
 * each mutation commits as one transaction, so a group read moves the cursor and records the
 * pending entries atomically. Blocked group readers wait on a condition signalled by
 * {@link #append}.
 */
public class RocksStreamStore implements StreamStore {
    private static final Logger logger = LoggerFactory.getLogger(RocksStreamStore.class);

    private final OptimisticTransactionDB transactionDB;
    private final WriteOptions writeOpts;
    private final OptimisticTransactionOptions txnOpts;
    private final ReadOptions scanReadOpts;
    private final Options dbOptions;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final Clock clock;

    private final PayloadCodec<Map<String, String>> fieldCodec = new FieldSetCodec();
    private final PayloadCodec<StreamHead> headCodec = new KryoCodec<>(StreamHead.class);
    private final PayloadCodec<GroupCursor> cursorCodec = new KryoCodec<>(GroupCursor.class);
    private final PayloadCodec<PendingEntry> pendingCodec = new KryoCodec<>(PendingEntry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition entriesAppended = lock.newCondition();
    private volatile boolean closed;

    public RocksStreamStore(StorageConfig config) throws StreamStoreException {
        this(config, Clock.systemUTC());
    }

    public RocksStreamStore(StorageConfig config, Clock clock) throws StreamStoreException {
        this.clock = clock;

        RocksDB.loadLibrary();

        this.blockCache = new LRUCache((long) config.getBlockCacheSizeMB() * 1024 * 1024);
        this.bloomFilter = new BloomFilter(10, false);

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true);

        this.dbOptions = new Options()
                .setCreateIfMissing(true)
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize((long) config.getMemoryBufferSizeMB() * 1024 * 1024)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setTableFormatConfig(tableConfig);

        try {
            this.transactionDB = OptimisticTransactionDB.open(dbOptions, config.getDataDirectory());
        } catch (RocksDBException e) {
            dbOptions.close();
            blockCache.close();
            bloomFilter.close();
            throw new StreamStoreException("Failed to open stream store at " + config.getDataDirectory(), e);
        }

        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites());
        this.txnOpts = new OptimisticTransactionOptions();

        // Scans should not pollute the block cache
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        logger.info("Stream store opened at {} (durableWrites={})",
                config.getDataDirectory(), config.isDurableWrites());
    }

    @Override
    public StreamEntryId append(String stream, Map<String, String> fields) throws StreamStoreException {
        lock.lock();
        try {
            ensureOpen();
            StreamHead head = loadHead(stream);
            if (head == null) {
                head = new StreamHead(clock.millis());
            }

            StreamEntryId id = head.getLastId().next(clock.millis());
            head.appended(id);

            try (Transaction txn = beginTransaction()) {
                txn.put(StreamKeys.entry(stream, id), fieldCodec.encode(fields));
                txn.put(StreamKeys.head(stream), headCodec.encode(head));
                txn.commit();
            }

            entriesAppended.signalAll();
            return id;
        } catch (RocksDBException e) {
            throw new StreamStoreException("Failed to append to stream " + stream, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * A null {@code startId} starts the group after the stream's last entry, so only
     * entries appended afterwards are delivered.
     */
    @Override
    public void createGroup(String stream, String group, StreamEntryId startId, boolean createStream)
            throws StreamStoreException {
        lock.lock();
        try {
            ensureOpen();
            StreamHead head = loadHead(stream);
            boolean newStream = head == null;
            if (newStream) {
                if (!createStream) {
                    throw new StreamStoreException("Stream " + stream + " does not exist");
                }
                head = new StreamHead(clock.millis());
            }

            byte[] groupKey = StreamKeys.group(stream, group);
            if (transactionDB.get(groupKey) != null) {
                throw new GroupExistsException(stream, group);
            }

            StreamEntryId start = startId != null ? startId : head.getLastId();
            try (Transaction txn = beginTransaction()) {
                if (newStream) {
                    txn.put(StreamKeys.head(stream), headCodec.encode(head));
                }
                txn.put(groupKey, cursorCodec.encode(new GroupCursor(group, start, clock.millis())));
                txn.commit();
            }
            logger.debug("Created group {} on stream {} at {}", group, stream, start);
        } catch (RocksDBException e) {
            throw new StreamStoreException("Failed to create group " + group + " on stream " + stream, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * A non-positive {@code blockMs} returns immediately.
     */
    @Override
    public List<StreamEntry> readGroup(String stream, String group, String consumer, int count, long blockMs)
            throws StreamStoreException, InterruptedException {
        requirePositive(count);
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0, blockMs));

        lock.lockInterruptibly();
        try {
            while (true) {
                ensureOpen();
                List<StreamEntry> delivered = deliverNew(stream, group, consumer, count);
                if (!delivered.isEmpty()) {
                    return delivered;
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return delivered;
                }
                entriesAppended.awaitNanos(remaining);
            }
        } catch (RocksDBException e) {
            throw new StreamStoreException("Failed to read group " + group + " on stream " + stream, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<StreamEntry> readPending(String stream, String group, String consumer, StreamEntryId after,
                                         int count) throws StreamStoreException {
        requirePositive(count);
        lock.lock();
        try {
            ensureOpen();
            requireGroup(stream, group);
            return redeliverPending(stream, group, consumer, after, count,
                    pending -> consumer.equals(pending.getConsumer()));
        } catch (RocksDBException e) {
            throw new StreamStoreException("Failed to read pending entries of group " + group, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<StreamEntry> claimIdle(String stream, String group, String consumer, long minIdleMs, int count)
            throws StreamStoreException {
        requirePositive(count);
        lock.lock();
        try {
            ensureOpen();
            requireGroup(stream, group);
            long now = clock.millis();
            return redeliverPending(stream, group, consumer, StreamEntryId.MIN, count,
                    pending -> pending.idleMillis(now) >= minIdleMs);
        } catch (RocksDBException e) {
            throw new StreamStoreException("Failed to claim idle entries of group " + group, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long acknowledge(String stream, String group, StreamEntryId... ids) throws StreamStoreException {
        lock.lock();
        try {
            ensureOpen();
            long acknowledged = 0;
            try (Transaction txn = beginTransaction()) {
                for (StreamEntryId id : ids) {
                    byte[] key = StreamKeys.pending(stream, group, id);
                    if (transactionDB.get(key) != null) {
                        txn.delete(key);
                        acknowledged++;
                    }
                }
                txn.commit();
            }
            return acknowledged;
        } catch (RocksDBException e) {
            throw new StreamStoreException("Failed to acknowledge entries of group " + group, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<PendingEntry> pending(String stream, String group) throws StreamStoreException {
        List<PendingEntry> result = new ArrayList<>();
        lock.lock();
        try {
            ensureOpen();
            requireGroup(stream, group);
            byte[] prefix = StreamKeys.pendingPrefix(stream, group);
            try (RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
                for (iter.seek(prefix); iter.isValid() && StreamKeys.startsWith(iter.key(), prefix); iter.next()) {
                    result.add(pendingCodec.decode(iter.value()));
                }
            }
            return result;
        } catch (RocksDBException e) {
            throw new StreamStoreException("Failed to list pending entries of group " + group, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long length(String stream) throws StreamStoreException {
        lock.lock();
        try {
            ensureOpen();
            StreamHead head = loadHead(stream);
            return head == null ? 0 : head.getLength();
        } catch (RocksDBException e) {
            throw new StreamStoreException("Failed to read length of stream " + stream, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long trim(String stream, long maxLength) throws StreamStoreException {
        if (maxLength < 0) {
            throw new IllegalArgumentException("maxLength must be >= 0");
        }
        lock.lock();
        try {
            ensureOpen();
            StreamHead head = loadHead(stream);
            if (head == null || head.getLength() <= maxLength) {
                return 0;
            }

            long excess = head.getLength() - maxLength;
            long deleted = 0;
            byte[] prefix = StreamKeys.entryPrefix(stream);

            try (Transaction txn = beginTransaction();
                 RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
                for (iter.seek(prefix);
                     iter.isValid() && deleted < excess && StreamKeys.startsWith(iter.key(), prefix);
                     iter.next()) {
                    txn.delete(iter.key());
                    deleted++;
                }
                head.trimmed(deleted);
                txn.put(StreamKeys.head(stream), headCodec.encode(head));
                txn.commit();
            }

            logger.debug("Trimmed {} entries from stream {}", deleted, stream);
            return deleted;
        } catch (RocksDBException e) {
            throw new StreamStoreException("Failed to trim stream " + stream, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public StreamMetrics getMetrics(String stream) throws StreamStoreException {
        lock.lock();
        try {
            ensureOpen();
            StreamHead head = loadHead(stream);
            if (head == null) {
                return new StreamMetrics(0, 0, 0, null, null);
            }

            long groups = countKeys(StreamKeys.groupPrefix(stream));
            long pending = countKeys(StreamKeys.pendingStreamPrefix(stream));

            StreamEntryId first = null;
            byte[] prefix = StreamKeys.entryPrefix(stream);
            try (RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
                iter.seek(prefix);
                if (iter.isValid() && StreamKeys.startsWith(iter.key(), prefix)) {
                    first = StreamKeys.idOf(iter.key());
                }
            }

            StreamEntryId last = StreamEntryId.MIN.equals(head.getLastId()) ? null : head.getLastId();
            return new StreamMetrics(head.getLength(), groups, pending, first, last);
        } catch (RocksDBException e) {
            throw new StreamStoreException("Failed to read metrics of stream " + stream, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            entriesAppended.signalAll();

            scanReadOpts.close();
            txnOpts.close();
            writeOpts.close();
            transactionDB.close();
            dbOptions.close();
            blockCache.close();
            bloomFilter.close();
        } finally {
            lock.unlock();
        }
        logger.info("Stream store closed");
    }

    /**
     * Hand entries after the group cursor to {@code consumer}. Caller holds the lock.
     */
    private List<StreamEntry> deliverNew(String stream, String group, String consumer, int count)
            throws RocksDBException, StreamStoreException {
        GroupCursor cursor = requireGroup(stream, group);
        StreamEntryId last = cursor.getLastDeliveredId();
        List<StreamEntry> delivered = new ArrayList<>();

        byte[] prefix = StreamKeys.entryPrefix(stream);
        try (RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            for (iter.seek(StreamKeys.entry(stream, last));
                 iter.isValid() && delivered.size() < count && StreamKeys.startsWith(iter.key(), prefix);
                 iter.next()) {
                StreamEntryId id = StreamKeys.idOf(iter.key());
                if (id.compareTo(last) <= 0) {
                    continue;
                }
                delivered.add(new StreamEntry(id, fieldCodec.decode(iter.value())));
            }
        }

        if (delivered.isEmpty()) {
            return delivered;
        }

        long now = clock.millis();
        try (Transaction txn = beginTransaction()) {
            for (StreamEntry entry : delivered) {
                PendingEntry pending = new PendingEntry(entry.getId(), consumer, now);
                txn.put(StreamKeys.pending(stream, group, entry.getId()), pendingCodec.encode(pending));
            }
            cursor.advanceTo(delivered.get(delivered.size() - 1).getId());
            txn.put(StreamKeys.group(stream, group), cursorCodec.encode(cursor));
            txn.commit();
        }
        return delivered;
    }

    /**
     * Redeliver pending entries after {@code after} accepted by {@code filter} to {@code consumer}.
     * Pending entries whose stream entry was trimmed are dropped. Caller holds the lock.
     */
    private List<StreamEntry> redeliverPending(String stream, String group, String consumer,
                                               StreamEntryId after, int count, Predicate<PendingEntry> filter)
            throws RocksDBException {
        List<StreamEntry> result = new ArrayList<>();
        long now = clock.millis();
        byte[] prefix = StreamKeys.pendingPrefix(stream, group);

        try (Transaction txn = beginTransaction();
             RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            for (iter.seek(StreamKeys.pending(stream, group, after));
                 iter.isValid() && result.size() < count && StreamKeys.startsWith(iter.key(), prefix);
                 iter.next()) {
                StreamEntryId id = StreamKeys.idOf(iter.key());
                PendingEntry pending = pendingCodec.decode(iter.value());
                if (id.compareTo(after) <= 0 || !filter.test(pending)) {
                    continue;
                }

                byte[] value = transactionDB.get(StreamKeys.entry(stream, id));
                if (value == null) {
                    txn.delete(iter.key());
                    logger.debug("Dropped pending entry {} of group {}: entry was trimmed", id, group);
                    continue;
                }

                pending.redeliver(consumer, now);
                txn.put(iter.key(), pendingCodec.encode(pending));
                result.add(new StreamEntry(id, fieldCodec.decode(value)));
            }
            txn.commit();
        }
        return result;
    }

    private GroupCursor requireGroup(String stream, String group) throws RocksDBException, NoSuchGroupException {
        byte[] value = transactionDB.get(StreamKeys.group(stream, group));
        if (value == null) {
            throw new NoSuchGroupException(stream, group);
        }
        return cursorCodec.decode(value);
    }

    private StreamHead loadHead(String stream) throws RocksDBException {
        byte[] value = transactionDB.get(StreamKeys.head(stream));
        return value == null ? null : headCodec.decode(value);
    }

    private long countKeys(byte[] prefix) {
        long count = 0;
        try (RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            for (iter.seek(prefix); iter.isValid() && StreamKeys.startsWith(iter.key(), prefix); iter.next()) {
                count++;
            }
        }
        return count;
    }

    private Transaction beginTransaction() {
        return transactionDB.beginTransaction(writeOpts, txnOpts);
    }

    private void ensureOpen() throws StreamStoreException {
        if (closed) {
            throw new StreamStoreException("Stream store is closed");
        }
    }

    private static void requirePositive(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0");
        }
    }
}
