package com.umitunal.cronrelay.model;

/**
 * Counts over the scheduler's job table.
 */
public class JobStats {
    private final long total;
    private final long recurring;
    private final long oneTime;
    private final long active;
    private final long executed;

    public JobStats(long total, long recurring, long oneTime, long active, long executed) {
        this.total = total;
        this.recurring = recurring;
        this.oneTime = oneTime;
        this.active = active;
        this.executed = executed;
    }

    public long getTotal() { return total; }
    public long getRecurring() { return recurring; }
    public long getOneTime() { return oneTime; }
    public long getActive() { return active; }
    public long getExecuted() { return executed; }

    @Override
    public String toString() {
        return String.format("JobStats{total=%d, recurring=%d, oneTime=%d, active=%d, executed=%d}",
                total, recurring, oneTime, active, executed);
    }
}
