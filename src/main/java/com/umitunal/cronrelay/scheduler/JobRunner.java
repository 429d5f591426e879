package com.umitunal.cronrelay.scheduler;

import com.umitunal.cronrelay.model.JobDefinition;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A job definition paired with its live timer. Owned by {@link JobScheduler}.
 *
 * All mutation happens under {@link #lock()}. Each armed timer captures the generation it
 * was armed in; cancelling or re-arming bumps the generation so a timer that already
 * started running sees it is stale and does nothing.
 */
final class JobRunner {
    private final String jobId;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile JobDefinition definition;
    private ScheduledFuture<?> timer;
    private long generation;
    private int failedAttempts;
    private boolean removed;

    JobRunner(JobDefinition definition) {
        this.jobId = definition.getId();
        this.definition = definition;
    }

    String getJobId() {
        return jobId;
    }

    JobDefinition getDefinition() {
        return definition;
    }

    void setDefinition(JobDefinition definition) {
        this.definition = definition;
    }

    void lock() {
        lock.lock();
    }

    void unlock() {
        lock.unlock();
    }

    boolean isRemoved() {
        return removed;
    }

    void markRemoved() {
        cancelTimer();
        removed = true;
    }

    boolean hasTimer() {
        return timer != null;
    }

    /**
     * Cancel the live timer, if any, and return the generation a new timer should carry.
     */
    long cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
        return ++generation;
    }

    void setTimer(ScheduledFuture<?> timer) {
        this.timer = timer;
    }

    /**
     * Called by a firing timer; drops the handle since a one-shot timer is consumed.
     */
    boolean claimFiring(long firingGeneration) {
        if (removed || firingGeneration != generation) {
            return false;
        }
        timer = null;
        return true;
    }

    int getFailedAttempts() {
        return failedAttempts;
    }

    int recordFailedAttempt() {
        return ++failedAttempts;
    }

    void resetFailedAttempts() {
        failedAttempts = 0;
    }
}
