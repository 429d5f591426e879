package com.umitunal.cronrelay.consumer;

import com.umitunal.cronrelay.core.StreamEntryId;

import java.util.Objects;
import java.util.Properties;

/**
 * Stream, group and polling settings for an {@link EventConsumer}.
 */
public class ConsumerConfig {
    public static final String PREFIX = "cronrelay.consumer.";

    private final String streamName;
    private final String groupName;
    private final String consumerName;
    private final int count;
    private final long blockMs;
    private final long retryBackoffMs;
    private final long claimIdleMs;
    private final StreamEntryId groupStartId;

    private ConsumerConfig(Builder builder) {
        this.streamName = builder.streamName;
        this.groupName = builder.groupName;
        this.consumerName = builder.consumerName;
        this.count = builder.count;
        this.blockMs = builder.blockMs;
        this.retryBackoffMs = builder.retryBackoffMs;
        this.claimIdleMs = builder.claimIdleMs;
        this.groupStartId = builder.groupStartId;
    }

    public String getStreamName() { return streamName; }
    public String getGroupName() { return groupName; }
    public String getConsumerName() { return consumerName; }
    public int getCount() { return count; }
    public long getBlockMs() { return blockMs; }
    public long getRetryBackoffMs() { return retryBackoffMs; }
    public long getClaimIdleMs() { return claimIdleMs; }
    public StreamEntryId getGroupStartId() { return groupStartId; }

    public static Builder newBuilder(String streamName, String groupName, String consumerName) {
        return new Builder(streamName, groupName, consumerName);
    }

    /**
     * Read {@code cronrelay.consumer.*} keys: {@code stream}, {@code group} and {@code name}
     * are required; {@code count}, {@code block-ms}, {@code retry-backoff-ms} and
     * {@code claim-idle-ms} are optional.
     */
    public static ConsumerConfig fromProperties(Properties props) {
        Builder builder = newBuilder(
                required(props, "stream"),
                required(props, "group"),
                required(props, "name"));

        String count = props.getProperty(PREFIX + "count");
        if (count != null) {
            builder.withCount(Integer.parseInt(count.trim()));
        }
        String block = props.getProperty(PREFIX + "block-ms");
        if (block != null) {
            builder.withBlockMs(Long.parseLong(block.trim()));
        }
        String backoff = props.getProperty(PREFIX + "retry-backoff-ms");
        if (backoff != null) {
            builder.withRetryBackoffMs(Long.parseLong(backoff.trim()));
        }
        String claim = props.getProperty(PREFIX + "claim-idle-ms");
        if (claim != null) {
            builder.withClaimIdleMs(Long.parseLong(claim.trim()));
        }
        return builder.build();
    }

    private static String required(Properties props, String key) {
        String value = props.getProperty(PREFIX + key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing property " + PREFIX + key);
        }
        return value.trim();
    }

    @Override
    public String toString() {
        return String.format("ConsumerConfig{stream='%s', group='%s', consumer='%s', count=%d, blockMs=%d}",
                streamName, groupName, consumerName, count, blockMs);
    }

    public static class Builder {
        private final String streamName;
        private final String groupName;
        private final String consumerName;
        private int count = 10;
        private long blockMs = 5000;
        private long retryBackoffMs = 1000;
        private long claimIdleMs = 0;
        private StreamEntryId groupStartId = StreamEntryId.MIN;

        private Builder(String streamName, String groupName, String consumerName) {
            this.streamName = Objects.requireNonNull(streamName, "streamName");
            this.groupName = Objects.requireNonNull(groupName, "groupName");
            this.consumerName = Objects.requireNonNull(consumerName, "consumerName");
        }

        /**
         * Maximum entries claimed per read.
         * Default: 10
         */
        public Builder withCount(int count) {
            if (count <= 0) {
                throw new IllegalArgumentException("count must be > 0");
            }
            this.count = count;
            return this;
        }

        /**
         * How long one read waits for new entries.
         * Default: 5000 ms
         */
        public Builder withBlockMs(long blockMs) {
            this.blockMs = blockMs;
            return this;
        }

        /**
         * Pause after a failed read before polling again.
         * Default: 1000 ms
         */
        public Builder withRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
            return this;
        }

        /**
         * Take over entries left pending by any consumer of the group for at least this long.
         * Default: 0 (disabled)
         */
        public Builder withClaimIdleMs(long claimIdleMs) {
            this.claimIdleMs = claimIdleMs;
            return this;
        }

        /**
         * Cursor position used when the group has to be created. Null starts after the
         * current end of the stream.
         * Default: {@link StreamEntryId#MIN}, i.e. the whole stream
         */
        public Builder withGroupStartId(StreamEntryId groupStartId) {
            this.groupStartId = groupStartId;
            return this;
        }

        public ConsumerConfig build() {
            return new ConsumerConfig(this);
        }
    }
}
