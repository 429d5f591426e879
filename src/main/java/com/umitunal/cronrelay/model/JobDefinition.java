package com.umitunal.cronrelay.model;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of a scheduled job.
 *
 * Recurring jobs carry a cron {@code schedule}; one-time jobs carry a {@code fireTime} in
 * epoch milliseconds and, once fired, {@code executed} and {@code executedAt}. The
 * scheduler replaces the snapshot on every change, so instances handed to callers never move.
 */
public final class JobDefinition {
    private final String id;
    private final String name;
    private final JobKind kind;
    private final String schedule;
    private final Long fireTime;
    private final boolean enabled;
    private final boolean executed;
    private final Long executedAt;
    private final Map<String, Object> payload;
    private final long createdAt;
    private final long updatedAt;
    private final String lastError;

    private JobDefinition(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.name = builder.name;
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        this.schedule = builder.schedule;
        this.fireTime = builder.fireTime;
        this.enabled = builder.enabled;
        this.executed = builder.executed;
        this.executedAt = builder.executedAt;
        this.payload = Documents.immutableCopy(builder.payload);
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.lastError = builder.lastError;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public JobKind getKind() { return kind; }

    /** Cron expression; null for one-time jobs. */
    public String getSchedule() { return schedule; }

    /** Epoch millis to fire at; null for recurring jobs. */
    public Long getFireTime() { return fireTime; }

    public boolean isEnabled() { return enabled; }
    public boolean isExecuted() { return executed; }
    public Long getExecutedAt() { return executedAt; }
    public Map<String, Object> getPayload() { return payload; }
    public long getCreatedAt() { return createdAt; }
    public long getUpdatedAt() { return updatedAt; }

    /**
     * Message of the last failed publish attempt for this job, or null.
     */
    public String getLastError() { return lastError; }

    public boolean isRecurring() {
        return kind == JobKind.RECURRING;
    }

    public boolean isOneTime() {
        return kind == JobKind.ONE_TIME;
    }

    public Builder toBuilder() {
        return new Builder(id, kind)
                .name(name)
                .schedule(schedule)
                .fireTime(fireTime)
                .enabled(enabled)
                .executed(executed)
                .executedAt(executedAt)
                .payload(payload)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .lastError(lastError);
    }

    public static Builder newBuilder(String id, JobKind kind) {
        return new Builder(id, kind);
    }

    @Override
    public String toString() {
        return String.format("JobDefinition{id='%s', name='%s', kind=%s, schedule=%s, fireTime=%s, enabled=%s, executed=%s}",
                id, name, kind, schedule, fireTime, enabled, executed);
    }

    public static class Builder {
        private final String id;
        private final JobKind kind;
        private String name;
        private String schedule;
        private Long fireTime;
        private boolean enabled = true;
        private boolean executed;
        private Long executedAt;
        private Map<String, Object> payload;
        private long createdAt;
        private long updatedAt;
        private String lastError;

        private Builder(String id, JobKind kind) {
            this.id = id;
            this.kind = kind;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder schedule(String schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder fireTime(Long fireTime) {
            this.fireTime = fireTime;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder executed(boolean executed) {
            this.executed = executed;
            return this;
        }

        public Builder executedAt(Long executedAt) {
            this.executedAt = executedAt;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder createdAt(long createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(long updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public JobDefinition build() {
            return new JobDefinition(this);
        }
    }
}
