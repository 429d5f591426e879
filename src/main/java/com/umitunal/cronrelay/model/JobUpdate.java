package com.umitunal.cronrelay.model;

import java.util.Map;

/**
 * Partial update of a job. Null fields are left unchanged.
 */
public final class JobUpdate {
    private final String name;
    private final String kind;
    private final String schedule;
    private final Long fireTime;
    private final Boolean enabled;
    private final Map<String, Object> payload;

    private JobUpdate(Builder builder) {
        this.name = builder.name;
        this.kind = builder.kind;
        this.schedule = builder.schedule;
        this.fireTime = builder.fireTime;
        this.enabled = builder.enabled;
        this.payload = builder.payload;
    }

    public String getName() { return name; }

    /**
     * Present only so that attempts to change the kind can be rejected.
     */
    public String getKind() { return kind; }

    public String getSchedule() { return schedule; }
    public Long getFireTime() { return fireTime; }
    public Boolean getEnabled() { return enabled; }
    public Map<String, Object> getPayload() { return payload; }

    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("JobUpdate{name=%s, kind=%s, schedule=%s, fireTime=%s, enabled=%s, payload=%s}",
                name, kind, schedule, fireTime, enabled, payload == null ? null : payload.keySet());
    }

    public static class Builder {
        private String name;
        private String kind;
        private String schedule;
        private Long fireTime;
        private Boolean enabled;
        private Map<String, Object> payload;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
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

        public Builder enabled(Boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public JobUpdate build() {
            return new JobUpdate(this);
        }
    }
}
