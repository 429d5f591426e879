package com.umitunal.cronrelay.core;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Store-assigned identifier of a stream entry, written as {@code <millis>-<sequence>}.
 * Ids are strictly increasing within a stream.
 */
public final class StreamEntryId implements Comparable<StreamEntryId> {

    /**
     * Sorts before every assigned id. A group created at this id receives the whole stream.
     */
    public static final StreamEntryId MIN = new StreamEntryId(0, 0);

    public static final int BYTES = 16;

    private final long millis;
    private final long sequence;

    public StreamEntryId(long millis, long sequence) {
        if (millis < 0 || sequence < 0) {
            throw new IllegalArgumentException("Stream entry id parts must be non-negative: " + millis + "-" + sequence);
        }
        this.millis = millis;
        this.sequence = sequence;
    }

    public long getMillis() { return millis; }
    public long getSequence() { return sequence; }

    /**
     * Next id for an append at {@code nowMillis}: the current time with sequence 0, or the
     * same millisecond with the sequence bumped when the clock has not moved past this id.
     */
    public StreamEntryId next(long nowMillis) {
        if (nowMillis > millis) {
            return new StreamEntryId(nowMillis, 0);
        }
        return new StreamEntryId(millis, sequence + 1);
    }

    public static StreamEntryId parse(String text) {
        Objects.requireNonNull(text, "text");
        int dash = text.indexOf('-');
        try {
            if (dash < 0) {
                return new StreamEntryId(Long.parseLong(text), 0);
            }
            return new StreamEntryId(Long.parseLong(text.substring(0, dash)),
                    Long.parseLong(text.substring(dash + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid stream entry id: " + text, e);
        }
    }

    /**
     * Big-endian encoding; byte order matches id order for non-negative parts.
     */
    public byte[] toBytes() {
        return ByteBuffer.allocate(BYTES).putLong(millis).putLong(sequence).array();
    }

    public static StreamEntryId fromBytes(byte[] bytes, int offset) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes, offset, BYTES);
        return new StreamEntryId(buffer.getLong(), buffer.getLong());
    }

    @Override
    public int compareTo(StreamEntryId other) {
        int cmp = Long.compare(millis, other.millis);
        return cmp != 0 ? cmp : Long.compare(sequence, other.sequence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StreamEntryId)) return false;
        StreamEntryId that = (StreamEntryId) o;
        return millis == that.millis && sequence == that.sequence;
    }

    @Override
    public int hashCode() {
        return Objects.hash(millis, sequence);
    }

    @Override
    public String toString() {
        return millis + "-" + sequence;
    }
}
