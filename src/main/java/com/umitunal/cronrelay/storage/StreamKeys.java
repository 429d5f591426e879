package com.umitunal.cronrelay.storage;

import com.umitunal.cronrelay.core.StreamEntryId;

import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB key layout. Every key starts with a one byte record type followed by the
 * length-prefixed stream name, so one stream's records of a type form a contiguous range:
 *
 * <pre>
 * H [stream]                   stream head
 * E [stream] [id]              entry
 * G [stream] [group]           group cursor
 * P [stream] [group] [id]      pending entry
 * </pre>
 *
 * Ids are 16 big-endian bytes, so entries and pending entries iterate in id order.
 */
final class StreamKeys {
    static final byte HEAD = 'H';
    static final byte ENTRY = 'E';
    static final byte GROUP = 'G';
    static final byte PENDING = 'P';

    private StreamKeys() {
    }

    static byte[] head(String stream) {
        return prefix(HEAD, stream, null, 0).array();
    }

    static byte[] entryPrefix(String stream) {
        return prefix(ENTRY, stream, null, 0).array();
    }

    static byte[] entry(String stream, StreamEntryId id) {
        return prefix(ENTRY, stream, null, StreamEntryId.BYTES).put(id.toBytes()).array();
    }

    static byte[] groupPrefix(String stream) {
        return prefix(GROUP, stream, null, 0).array();
    }

    static byte[] group(String stream, String group) {
        return prefix(GROUP, stream, group, 0).array();
    }

    static byte[] pendingPrefix(String stream, String group) {
        return prefix(PENDING, stream, group, 0).array();
    }

    static byte[] pendingStreamPrefix(String stream) {
        return prefix(PENDING, stream, null, 0).array();
    }

    static byte[] pending(String stream, String group, StreamEntryId id) {
        return prefix(PENDING, stream, group, StreamEntryId.BYTES).put(id.toBytes()).array();
    }

    /**
     * Id stored in the last 16 bytes of an entry or pending key.
     */
    static StreamEntryId idOf(byte[] key) {
        return StreamEntryId.fromBytes(key, key.length - StreamEntryId.BYTES);
    }

    static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (key[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static ByteBuffer prefix(byte type, String stream, String group, int extra) {
        byte[] streamBytes = stream.getBytes(UTF_8);
        byte[] groupBytes = group != null ? group.getBytes(UTF_8) : null;
        int size = 1 + 4 + streamBytes.length
                + (groupBytes != null ? 4 + groupBytes.length : 0)
                + extra;

        ByteBuffer buffer = ByteBuffer.allocate(size);
        buffer.put(type);
        buffer.putInt(streamBytes.length);
        buffer.put(streamBytes);
        if (groupBytes != null) {
            buffer.putInt(groupBytes.length);
            buffer.put(groupBytes);
        }
        return buffer;
    }
}
