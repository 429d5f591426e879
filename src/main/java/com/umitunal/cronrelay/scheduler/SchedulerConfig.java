package com.umitunal.cronrelay.scheduler;

import java.time.ZoneId;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings for a {@link JobScheduler}: where fired events go and how they are labelled.
 */
public class SchedulerConfig {
    public static final String PREFIX = "cronrelay.scheduler.";

    public static final String DEFAULT_STREAM = "cronjob:events";
    public static final String DEFAULT_EVENT_SOURCE = "cronjob";
    public static final String DEFAULT_EVENT_TYPE = "cronjob:trigger";

    private final String streamName;
    private final String eventSource;
    private final String eventType;
    private final ZoneId zone;
    private final int timerThreads;
    private final int oneTimeRetryAttempts;
    private final long retryDelayMs;

    private SchedulerConfig(Builder builder) {
        this.streamName = builder.streamName;
        this.eventSource = builder.eventSource;
        this.eventType = builder.eventType;
        this.zone = builder.zone;
        this.timerThreads = builder.timerThreads;
        this.oneTimeRetryAttempts = builder.oneTimeRetryAttempts;
        this.retryDelayMs = builder.retryDelayMs;
    }

    public String getStreamName() { return streamName; }
    public String getEventSource() { return eventSource; }
    public String getEventType() { return eventType; }
    public ZoneId getZone() { return zone; }
    public int getTimerThreads() { return timerThreads; }
    public int getOneTimeRetryAttempts() { return oneTimeRetryAttempts; }
    public long getRetryDelayMs() { return retryDelayMs; }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static SchedulerConfig defaults() {
        return new Builder().build();
    }

    /**
     * Read {@code cronrelay.scheduler.*} keys. Every key is optional: {@code stream},
     * {@code event-source}, {@code event-type}, {@code zone}, {@code timer-threads},
     * {@code one-time-retry-attempts}, {@code retry-delay-ms}.
     */
    public static SchedulerConfig fromProperties(Properties props) {
        Builder builder = newBuilder();
        String stream = props.getProperty(PREFIX + "stream");
        if (stream != null && !stream.isBlank()) {
            builder.withStreamName(stream.trim());
        }
        String source = props.getProperty(PREFIX + "event-source");
        if (source != null && !source.isBlank()) {
            builder.withEventSource(source.trim());
        }
        String type = props.getProperty(PREFIX + "event-type");
        if (type != null && !type.isBlank()) {
            builder.withEventType(type.trim());
        }
        String zone = props.getProperty(PREFIX + "zone");
        if (zone != null && !zone.isBlank()) {
            builder.withZone(ZoneId.of(zone.trim()));
        }
        String threads = props.getProperty(PREFIX + "timer-threads");
        if (threads != null) {
            builder.withTimerThreads(Integer.parseInt(threads.trim()));
        }
        String attempts = props.getProperty(PREFIX + "one-time-retry-attempts");
        if (attempts != null) {
            builder.withOneTimeRetryAttempts(Integer.parseInt(attempts.trim()));
        }
        String delay = props.getProperty(PREFIX + "retry-delay-ms");
        if (delay != null) {
            builder.withRetryDelayMs(Long.parseLong(delay.trim()));
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return String.format("SchedulerConfig{stream='%s', source='%s', type='%s', zone=%s, timerThreads=%d, oneTimeRetryAttempts=%d}",
                streamName, eventSource, eventType, zone, timerThreads, oneTimeRetryAttempts);
    }

    public static class Builder {
        private String streamName = DEFAULT_STREAM;
        private String eventSource = DEFAULT_EVENT_SOURCE;
        private String eventType = DEFAULT_EVENT_TYPE;
        private ZoneId zone = ZoneId.systemDefault();
        private int timerThreads = 2;
        private int oneTimeRetryAttempts = 0;
        private long retryDelayMs = 1000;

        private Builder() {
        }

        /**
         * Default: cronjob:events
         */
        public Builder withStreamName(String streamName) {
            this.streamName = Objects.requireNonNull(streamName, "streamName");
            return this;
        }

        /**
         * Default: cronjob
         */
        public Builder withEventSource(String eventSource) {
            this.eventSource = Objects.requireNonNull(eventSource, "eventSource");
            return this;
        }

        /**
         * Default: cronjob:trigger
         */
        public Builder withEventType(String eventType) {
            this.eventType = Objects.requireNonNull(eventType, "eventType");
            return this;
        }

        /**
         * Zone used to evaluate cron schedules and absolute time text.
         * Default: system zone
         */
        public Builder withZone(ZoneId zone) {
            this.zone = Objects.requireNonNull(zone, "zone");
            return this;
        }

        /**
         * Default: 2
         */
        public Builder withTimerThreads(int timerThreads) {
            if (timerThreads <= 0) {
                throw new IllegalArgumentException("timerThreads must be > 0");
            }
            this.timerThreads = timerThreads;
            return this;
        }

        /**
         * How many more times a one-time job is fired after its publish fails. With 0 a
         * failed publish disables the job and records the error on it.
         * Default: 0
         */
        public Builder withOneTimeRetryAttempts(int attempts) {
            if (attempts < 0) {
                throw new IllegalArgumentException("oneTimeRetryAttempts must be >= 0");
            }
            this.oneTimeRetryAttempts = attempts;
            return this;
        }

        /**
         * Default: 1000 ms
         */
        public Builder withRetryDelayMs(long retryDelayMs) {
            if (retryDelayMs < 0) {
                throw new IllegalArgumentException("retryDelayMs must be >= 0");
            }
            this.retryDelayMs = retryDelayMs;
            return this;
        }

        public SchedulerConfig build() {
            return new SchedulerConfig(this);
        }
    }
}
