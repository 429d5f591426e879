package com.umitunal.cronrelay.model;

import java.util.Map;

/**
 * Caller input for creating a job. Kind-specific fields are validated by the scheduler.
 */
public final class JobSpec {
    private final String name;
    private final String kind;
    private final String schedule;
    private final Long fireTime;
    private final boolean enabled;
    private final Map<String, Object> payload;

    private JobSpec(Builder builder) {
        this.name = builder.name;
        this.kind = builder.kind;
        this.schedule = builder.schedule;
        this.fireTime = builder.fireTime;
        this.enabled = builder.enabled;
        this.payload = builder.payload;
    }

    public String getName() { return name; }

    /**
     * Kind as supplied by the caller; may be unknown or null.
     */
    public String getKind() { return kind; }

    public String getSchedule() { return schedule; }
    public Long getFireTime() { return fireTime; }
    public boolean isEnabled() { return enabled; }
    public Map<String, Object> getPayload() { return payload; }

    public static Builder recurring(String name, String schedule) {
        return newBuilder().name(name).kind(JobKind.RECURRING).schedule(schedule);
    }

    public static Builder oneTime(String name, long fireTime) {
        return newBuilder().name(name).kind(JobKind.ONE_TIME).fireTime(fireTime);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String kind;
        private String schedule;
        private Long fireTime;
        private boolean enabled = true;
        private Map<String, Object> payload;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder kind(JobKind kind) {
            this.kind = kind == null ? null : kind.getValue();
            return this;
        }

        public Builder kind(String kind) {
            this.kind = kind;
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

        /**
         * Default: true
         */
        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public JobSpec build() {
            return new JobSpec(this);
        }
    }
}
