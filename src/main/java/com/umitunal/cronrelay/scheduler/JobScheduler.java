package com.umitunal.cronrelay.scheduler;

import com.umitunal.cronrelay.exception.ImmutableFieldException;
import com.umitunal.cronrelay.exception.JobNotFoundException;
import com.umitunal.cronrelay.exception.PublishException;
import com.umitunal.cronrelay.exception.TerminalStateException;
import com.umitunal.cronrelay.exception.ValidationException;
import com.umitunal.cronrelay.model.DomainEvent;
import com.umitunal.cronrelay.model.JobDefinition;
import com.umitunal.cronrelay.model.JobKind;
import com.umitunal.cronrelay.model.JobSpec;
import com.umitunal.cronrelay.model.JobStats;
import com.umitunal.cronrelay.model.JobUpdate;
import com.umitunal.cronrelay.publisher.EventPublisher;
import com.umitunal.cronrelay.time.AbsoluteTimeCodec;
import com.umitunal.cronrelay.time.DurationCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the set of jobs and their timers, and publishes an event each time a job fires.
 *
 * Recurring jobs follow a five-field cron schedule and fire until stopped or deleted.
 * One-time jobs fire once at their fire time and then become terminal: executed, disabled,
 * and closed to further start or update.
 *
 * Every operation on a job, including its firing, runs under that job's lock, so an update
 * can never interleave with a concurrent fire of the same job. Changing a job cancels its
 * timer before the new definition is stored and arms a fresh one afterwards.
 *
 * A failed publish is logged. A recurring job simply fires again at its next scheduled time.
 * A one-time job is re-fired after {@link SchedulerConfig#getRetryDelayMs()} up to
 * {@link SchedulerConfig#getOneTimeRetryAttempts()} times; once attempts run out it is
 * disabled without being marked executed and the failure is kept in
 * {@link JobDefinition#getLastError()}.
 */
public class JobScheduler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(JobScheduler.class);

    private final EventPublisher publisher;
    private final SchedulerConfig config;
    private final Clock clock;
    private final Map<String, JobRunner> jobs = new ConcurrentHashMap<>();
    private final ScheduledThreadPoolExecutor timers;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public JobScheduler(EventPublisher publisher) {
        this(publisher, SchedulerConfig.defaults());
    }

    public JobScheduler(EventPublisher publisher, SchedulerConfig config) {
        this(publisher, config, Clock.systemUTC());
    }

    public JobScheduler(EventPublisher publisher, SchedulerConfig config, Clock clock) {
        this.publisher = publisher;
        this.config = config;
        this.clock = clock;
        this.timers = new ScheduledThreadPoolExecutor(config.getTimerThreads(), new TimerThreadFactory());
        this.timers.setRemoveOnCancelPolicy(true);
    }

    // ---- job lifecycle ----

    /**
     * Validate {@code spec}, store the job and arm its timer when enabled.
     *
     * @throws ValidationException on a missing name, unknown kind, missing or malformed
     *                             schedule, or a fire time that is not in the future
     */
    public JobDefinition createJob(JobSpec spec) {
        ensureOpen();
        if (spec.getName() == null || spec.getName().isBlank()) {
            throw new ValidationException("name", "Job name is required");
        }
        if (spec.getKind() == null) {
            throw new ValidationException("kind", "Job type is required");
        }
        JobKind kind = JobKind.fromValue(spec.getKind());
        long now = clock.millis();

        JobDefinition.Builder builder = JobDefinition.newBuilder(UUID.randomUUID().toString(), kind)
                .name(spec.getName())
                .enabled(spec.isEnabled())
                .payload(spec.getPayload())
                .createdAt(now)
                .updatedAt(now);

        if (kind == JobKind.RECURRING) {
            builder.schedule(CronSchedule.parse(spec.getSchedule()).getExpression());
        } else {
            requireFutureFireTime(spec.getFireTime(), now);
            builder.fireTime(spec.getFireTime());
        }

        JobDefinition definition = builder.build();
        JobRunner runner = new JobRunner(definition);
        runner.lock();
        try {
            jobs.put(definition.getId(), runner);
            if (definition.isEnabled()) {
                arm(runner, now);
            }
        } finally {
            runner.unlock();
        }

        logger.info("Job created: id={}, name={}, kind={}, schedule={}, fireTime={}, enabled={}",
                definition.getId(), definition.getName(), kind, definition.getSchedule(),
                definition.getFireTime(), definition.isEnabled());
        return definition;
    }

    /**
     * Create a one-time job from absolute local time text ({@code yyyyMMddHHmmss}) in the
     * configured zone.
     */
    public JobDefinition createOneTimeAt(String name, String absoluteTime, Map<String, Object> payload) {
        long fireTime = AbsoluteTimeCodec.parseAbsolute(absoluteTime, config.getZone());
        return createJob(JobSpec.oneTime(name, fireTime).payload(payload).build());
    }

    /**
     * Create a one-time job firing after a relative duration such as {@code 1h30m}.
     */
    public JobDefinition createOneTimeAfter(String name, String duration, Map<String, Object> payload) {
        long fireTime = DurationCodec.futureFromDuration(duration, clock.millis());
        return createJob(JobSpec.oneTime(name, fireTime).payload(payload).build());
    }

    public Optional<JobDefinition> getJob(String jobId) {
        JobRunner runner = jobs.get(jobId);
        return runner == null ? Optional.empty() : Optional.of(runner.getDefinition());
    }

    /**
     * All jobs ordered by creation time.
     */
    public List<JobDefinition> listJobs() {
        List<JobDefinition> result = new ArrayList<>();
        for (JobRunner runner : jobs.values()) {
            result.add(runner.getDefinition());
        }
        result.sort(Comparator.comparingLong(JobDefinition::getCreatedAt).thenComparing(JobDefinition::getId));
        return result;
    }

    /**
     * Merge {@code update} into the job and re-arm it. A rejected update leaves the job and
     * its timer as they were.
     *
     * @throws JobNotFoundException    if no job has this id
     * @throws ImmutableFieldException if the update names a different kind
     * @throws TerminalStateException  if the job is an executed one-time job
     * @throws ValidationException     if the merged job is invalid
     */
    public JobDefinition updateJob(String jobId, JobUpdate update) {
        ensureOpen();
        JobRunner runner = require(jobId);
        runner.lock();
        try {
            ensurePresent(runner);
            JobDefinition current = runner.getDefinition();

            if (update.getKind() != null && JobKind.fromValue(update.getKind()) != current.getKind()) {
                throw new ImmutableFieldException("kind",
                        "Job type cannot be changed from " + current.getKind() + " to " + update.getKind());
            }
            if (current.isExecuted()) {
                throw new TerminalStateException(jobId, "Cannot update already executed one-time job");
            }

            long now = clock.millis();
            JobDefinition.Builder builder = current.toBuilder().updatedAt(now);
            if (update.getName() != null) {
                if (update.getName().isBlank()) {
                    throw new ValidationException("name", "Job name must not be blank");
                }
                builder.name(update.getName());
            }
            if (update.getEnabled() != null) {
                builder.enabled(update.getEnabled());
            }
            if (update.getPayload() != null) {
                builder.payload(update.getPayload());
            }
            if (current.isRecurring()) {
                if (update.getFireTime() != null) {
                    throw new ValidationException("fireTime", "Recurring jobs do not take a fire time");
                }
                if (update.getSchedule() != null) {
                    builder.schedule(CronSchedule.parse(update.getSchedule()).getExpression());
                }
            } else {
                if (update.getSchedule() != null) {
                    throw new ValidationException("schedule", "One-time jobs do not take a schedule");
                }
                if (update.getFireTime() != null) {
                    requireFutureFireTime(update.getFireTime(), now);
                    builder.fireTime(update.getFireTime());
                }
            }
            JobDefinition updated = builder.build();
            if (updated.isOneTime() && updated.isEnabled()) {
                requireFutureFireTime(updated.getFireTime(), now);
            }

            runner.cancelTimer();
            runner.resetFailedAttempts();
            runner.setDefinition(updated);
            if (updated.isEnabled()) {
                arm(runner, now);
            }

            logger.info("Job updated: id={}, {}", jobId, update);
            return updated;
        } finally {
            runner.unlock();
        }
    }

    /**
     * Cancel the job's timer and remove it.
     *
     * @return false if no job had this id
     */
    public boolean deleteJob(String jobId) {
        JobRunner runner = jobs.remove(jobId);
        if (runner == null) {
            return false;
        }
        runner.lock();
        try {
            runner.markRemoved();
        } finally {
            runner.unlock();
        }
        logger.info("Job deleted: id={}", jobId);
        return true;
    }

    /**
     * Enable the job and arm its timer.
     *
     * @throws JobNotFoundException   if no job has this id
     * @throws TerminalStateException if the job is an executed one-time job
     * @throws ValidationException    if a one-time job's fire time has passed
     */
    public void startJob(String jobId) {
        ensureOpen();
        JobRunner runner = require(jobId);
        runner.lock();
        try {
            ensurePresent(runner);
            JobDefinition current = runner.getDefinition();
            if (current.isExecuted()) {
                throw new TerminalStateException(jobId, "Cannot start already executed one-time job");
            }
            long now = clock.millis();
            if (current.isOneTime() && current.getFireTime() <= now) {
                throw new ValidationException("fireTime", "Cannot start one-time job: scheduled time has passed");
            }

            runner.cancelTimer();
            runner.resetFailedAttempts();
            runner.setDefinition(current.toBuilder().enabled(true).updatedAt(now).build());
            arm(runner, now);
            logger.info("Job started: id={}", jobId);
        } finally {
            runner.unlock();
        }
    }

    /**
     * Disable the job and cancel its timer.
     *
     * @throws JobNotFoundException if no job has this id
     */
    public void stopJob(String jobId) {
        JobRunner runner = require(jobId);
        runner.lock();
        try {
            ensurePresent(runner);
            runner.cancelTimer();
            JobDefinition current = runner.getDefinition();
            runner.setDefinition(current.toBuilder().enabled(false).updatedAt(clock.millis()).build());
            logger.info("Job stopped: id={}", jobId);
        } finally {
            runner.unlock();
        }
    }

    /**
     * Cancel every live timer. Definitions are left untouched, so jobs keep their
     * {@code enabled} flag and can be started again.
     */
    public void stopAll() {
        for (JobRunner runner : jobs.values()) {
            runner.lock();
            try {
                if (runner.hasTimer()) {
                    runner.cancelTimer();
                    logger.info("Job timer cancelled: id={}", runner.getJobId());
                }
            } finally {
                runner.unlock();
            }
        }
    }

    public int activeJobCount() {
        int count = 0;
        for (JobRunner runner : jobs.values()) {
            if (runner.getDefinition().isEnabled()) {
                count++;
            }
        }
        return count;
    }

    public JobStats stats() {
        long total = 0;
        long recurring = 0;
        long oneTime = 0;
        long active = 0;
        long executed = 0;
        for (JobRunner runner : jobs.values()) {
            JobDefinition definition = runner.getDefinition();
            total++;
            if (definition.isRecurring()) {
                recurring++;
            } else {
                oneTime++;
                if (definition.isExecuted()) {
                    executed++;
                }
            }
            if (definition.isEnabled()) {
                active++;
            }
        }
        return new JobStats(total, recurring, oneTime, active, executed);
    }

    /**
     * Number of timers waiting to fire. Cancelled timers are removed from the queue at once.
     */
    int armedTimerCount() {
        return timers.getQueue().size();
    }

    public SchedulerConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        stopAll();
        timers.shutdown();
        try {
            if (!timers.awaitTermination(5, TimeUnit.SECONDS)) {
                timers.shutdownNow();
            }
        } catch (InterruptedException e) {
            timers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Job scheduler closed with {} jobs", jobs.size());
    }

    // ---- timers ----

    private void arm(JobRunner runner, long now) {
        JobDefinition definition = runner.getDefinition();
        long fireAt;
        if (definition.isOneTime()) {
            fireAt = definition.getFireTime();
        } else {
            Optional<Long> next = nextRecurringFire(definition, now);
            if (next.isEmpty()) {
                logger.warn("Schedule of job {} has no future fire time, leaving it idle", definition.getId());
                runner.cancelTimer();
                return;
            }
            fireAt = next.get();
        }
        schedule(runner, fireAt, Math.max(0, fireAt - now));
    }

    private void schedule(JobRunner runner, long fireAt, long delayMs) {
        long generation = runner.cancelTimer();
        try {
            runner.setTimer(timers.schedule(() -> fire(runner, generation, fireAt), delayMs, TimeUnit.MILLISECONDS));
            logger.debug("Job {} armed to fire at {} (in {} ms)", runner.getJobId(), Instant.ofEpochMilli(fireAt), delayMs);
        } catch (RejectedExecutionException e) {
            logger.debug("Scheduler closed, job {} not armed", runner.getJobId());
        }
    }

    private Optional<Long> nextRecurringFire(JobDefinition definition, long afterMillis) {
        ZonedDateTime after = Instant.ofEpochMilli(afterMillis).atZone(config.getZone());
        return CronSchedule.parse(definition.getSchedule())
                .nextFireAfter(after)
                .map(next -> next.toInstant().toEpochMilli());
    }

    private void fire(JobRunner runner, long generation, long scheduledFireAt) {
        runner.lock();
        try {
            if (!runner.claimFiring(generation)) {
                logger.debug("Skipping stale timer for job {}", runner.getJobId());
                return;
            }
            JobDefinition definition = runner.getDefinition();
            if (!definition.isEnabled()) {
                return;
            }

            long now = clock.millis();
            long scheduledTime = definition.isOneTime() ? definition.getFireTime() : now;
            DomainEvent event = DomainEvent.create(config.getEventType(), config.getEventSource(), now,
                    eventData(definition, scheduledTime));

            logger.info("Firing job: id={}, name={}, kind={}", definition.getId(), definition.getName(),
                    definition.getKind());
            String error = null;
            try {
                String entryId = publisher.publish(config.getStreamName(), event);
                logger.info("Job {} published event {} as entry {}", definition.getId(), event.getEventId(), entryId);
            } catch (PublishException | RuntimeException e) {
                error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                logger.error("Failed to publish event for job {}", definition.getId(), e);
            }

            if (definition.isRecurring()) {
                runner.setDefinition(definition.toBuilder().lastError(error).build());
                long from = Math.max(clock.millis(), scheduledFireAt);
                Optional<Long> next = nextRecurringFire(definition, from);
                if (next.isPresent()) {
                    schedule(runner, next.get(), Math.max(0, next.get() - clock.millis()));
                } else {
                    logger.warn("Schedule of job {} has no future fire time, leaving it idle", definition.getId());
                }
            } else if (error == null) {
                long executedAt = clock.millis();
                runner.setDefinition(definition.toBuilder()
                        .executed(true)
                        .executedAt(executedAt)
                        .enabled(false)
                        .lastError(null)
                        .updatedAt(executedAt)
                        .build());
                runner.cancelTimer();
                logger.info("One-time job {} executed and disabled", definition.getId());
            } else {
                handleOneTimeFailure(runner, definition, error);
            }
        } catch (RuntimeException e) {
            logger.error("Unexpected error while firing job {}", runner.getJobId(), e);
        } finally {
            runner.unlock();
        }
    }

    private void handleOneTimeFailure(JobRunner runner, JobDefinition definition, String error) {
        int attempts = runner.recordFailedAttempt();
        if (attempts <= config.getOneTimeRetryAttempts()) {
            runner.setDefinition(definition.toBuilder().lastError(error).build());
            logger.warn("Retrying one-time job {} in {} ms (attempt {} of {})", definition.getId(),
                    config.getRetryDelayMs(), attempts, config.getOneTimeRetryAttempts());
            schedule(runner, clock.millis() + config.getRetryDelayMs(), config.getRetryDelayMs());
            return;
        }
        runner.cancelTimer();
        runner.setDefinition(definition.toBuilder()
                .enabled(false)
                .lastError(error)
                .updatedAt(clock.millis())
                .build());
        logger.error("One-time job {} disabled after {} failed publish attempt(s); it was not delivered",
                definition.getId(), attempts);
    }

    private Map<String, Object> eventData(JobDefinition definition, long scheduledTime) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("jobId", definition.getId());
        data.put("jobName", definition.getName());
        data.put("scheduledTime", scheduledTime);
        data.put("payload", definition.getPayload());
        return data;
    }

    // ---- helpers ----

    private JobRunner require(String jobId) {
        JobRunner runner = jobs.get(jobId);
        if (runner == null) {
            throw new JobNotFoundException(jobId);
        }
        return runner;
    }

    private void ensurePresent(JobRunner runner) {
        if (runner.isRemoved()) {
            throw new JobNotFoundException(runner.getJobId());
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Job scheduler is closed");
        }
    }

    private static void requireFutureFireTime(Long fireTime, long now) {
        if (fireTime == null) {
            throw new ValidationException("fireTime", "One-time jobs require a fire time (epoch milliseconds)");
        }
        if (fireTime <= now) {
            throw new ValidationException("fireTime", String.format(
                    "Fire time must be in the future. Received: %d (%s), current: %d (%s)",
                    fireTime, Instant.ofEpochMilli(fireTime), now, Instant.ofEpochMilli(now)));
        }
    }

    private static final class TimerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "JobScheduler-timer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
