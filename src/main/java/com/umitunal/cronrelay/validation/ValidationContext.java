package com.umitunal.cronrelay.validation;

import java.util.Objects;

/**
 * Who is performing a gated action, and whether the call is only a pre-check.
 */
public final class ValidationContext {
    private final String actorId;
    private final boolean dryRun;

    public ValidationContext(String actorId, boolean dryRun) {
        this.actorId = Objects.requireNonNull(actorId, "actorId");
        this.dryRun = dryRun;
    }

    public static ValidationContext of(String actorId) {
        return new ValidationContext(actorId, false);
    }

    public static ValidationContext dryRun(String actorId) {
        return new ValidationContext(actorId, true);
    }

    public String getActorId() { return actorId; }
    public boolean isDryRun() { return dryRun; }

    @Override
    public String toString() {
        return "ValidationContext{actorId='" + actorId + "', dryRun=" + dryRun + "}";
    }
}
