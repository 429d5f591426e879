package com.umitunal.cronrelay.scheduler;

import com.umitunal.cronrelay.MutableClock;
import com.umitunal.cronrelay.exception.FormatException;
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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

class JobSchedulerTest {

    private static final long NOW = Instant.parse("2025-01-01T08:00:00Z").toEpochMilli();

    private MutableClock clock;
    private List<DomainEvent> published;
    private List<String> publishedStreams;
    private JobScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        published = new CopyOnWriteArrayList<>();
        publishedStreams = new CopyOnWriteArrayList<>();
        scheduler = newScheduler(SchedulerConfig.newBuilder().withZone(ZoneOffset.UTC).build(), recording());
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    private JobScheduler newScheduler(SchedulerConfig config, EventPublisher publisher) {
        return new JobScheduler(publisher, config, clock);
    }

    private EventPublisher recording() {
        return (stream, event) -> {
            publishedStreams.add(stream);
            published.add(event);
            return "1-" + published.size();
        };
    }

    /**
     * Create a disabled one-time job two minutes out, then move the clock so that starting
     * it leaves {@code remainingMs} of real time until it fires.
     */
    private JobDefinition armOneTimeJob(JobScheduler target, long remainingMs) {
        JobDefinition job = target.createJob(JobSpec.oneTime("reminder", NOW + 120_000)
                .enabled(false)
                .payload(Map.of("text", "drink water"))
                .build());
        clock.advance(120_000 - remainingMs);
        target.startJob(job.getId());
        return job;
    }

    @Nested
    @DisplayName("createJob")
    class Create {

        @Test
        @DisplayName("Should create a recurring job with a valid cron expression")
        void testRecurring() {
            // When
            JobDefinition job = scheduler.createJob(JobSpec.recurring("morning", "0 9 * * *")
                    .payload(Map.of("text", "good morning"))
                    .build());

            // Then
            assertThat(job.getId()).isNotBlank();
            assertThat(job.getKind()).isEqualTo(JobKind.RECURRING);
            assertThat(job.getSchedule()).isEqualTo("0 9 * * *");
            assertThat(job.getFireTime()).isNull();
            assertThat(job.isEnabled()).isTrue();
            assertThat(job.getCreatedAt()).isEqualTo(NOW);
            assertThat(job.getPayload()).containsEntry("text", "good morning");
            assertThat(scheduler.getJob(job.getId())).contains(job);
        }

        @Test
        @DisplayName("Should reject a cron expression with hour 25")
        void testInvalidCron() {
            assertThatThrownBy(() -> scheduler.createJob(JobSpec.recurring("bad", "0 25 * * *").build()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("0 25 * * *")
                    .satisfies(e -> assertThat(((ValidationException) e).getField()).isEqualTo("schedule"));
            assertThat(scheduler.listJobs()).isEmpty();
        }

        @Test
        @DisplayName("Should require a schedule for recurring jobs")
        void testMissingSchedule() {
            assertThatThrownBy(() -> scheduler.createJob(JobSpec.newBuilder().name("x").kind("recurring").build()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("schedule");
        }

        @Test
        @DisplayName("Should reject a one-time job in the past")
        void testPastFireTime() {
            assertThatThrownBy(() -> scheduler.createJob(JobSpec.oneTime("late", NOW - 1000).build()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("future")
                    .satisfies(e -> assertThat(((ValidationException) e).getField()).isEqualTo("fireTime"));
            assertThatThrownBy(() -> scheduler.createJob(JobSpec.oneTime("now", NOW).build()))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Should accept a one-time job two minutes out")
        void testFutureFireTime() {
            JobDefinition job = scheduler.createJob(JobSpec.oneTime("soon", NOW + 120_000).build());

            assertThat(job.getFireTime()).isEqualTo(NOW + 120_000);
            assertThat(job.isExecuted()).isFalse();
            assertThat(job.getExecutedAt()).isNull();
        }

        @Test
        @DisplayName("Should reject unknown kinds and missing names")
        void testBadSpec() {
            assertThatThrownBy(() -> scheduler.createJob(JobSpec.newBuilder().name("x").kind("weekly")
                    .schedule("0 9 * * *").build()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("weekly");
            assertThatThrownBy(() -> scheduler.createJob(JobSpec.newBuilder().name("x").build()))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> scheduler.createJob(JobSpec.recurring(" ", "0 9 * * *").build()))
                    .isInstanceOf(ValidationException.class)
                    .satisfies(e -> assertThat(((ValidationException) e).getField()).isEqualTo("name"));
        }

        @Test
        @DisplayName("Should keep the stored and fired payload independent of the caller's maps")
        @SuppressWarnings("unchecked")
        void testPayloadIsolated() {
            // Given
            Map<String, Object> recipient = new HashMap<>();
            recipient.put("to", "alice");
            Map<String, Object> payload = new HashMap<>();
            payload.put("msg", recipient);
            payload.put("tags", new ArrayList<>(List.of("a")));
            JobDefinition job = scheduler.createJob(JobSpec.oneTime("isolated", NOW + 120_000)
                    .enabled(false)
                    .payload(payload)
                    .build());

            // When
            recipient.put("to", "mallory");
            ((List<Object>) payload.get("tags")).add("b");
            clock.advance(119_900);
            scheduler.startJob(job.getId());

            // Then
            Map<String, Object> expected = Map.of("msg", Map.of("to", "alice"), "tags", List.of("a"));
            assertThat(scheduler.getJob(job.getId()).orElseThrow().getPayload()).isEqualTo(expected);
            await().atMost(5, TimeUnit.SECONDS).until(() -> published.size() == 1);
            assertThat(published.get(0).getData()).containsEntry("payload", expected);
            assertThatThrownBy(() -> ((Map<String, Object>) job.getPayload().get("msg")).put("to", "eve"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("Should create one-time jobs from absolute time and duration text")
        void testFromText() {
            // When
            JobDefinition at = scheduler.createOneTimeAt("at", "20250101083000", Map.of());
            JobDefinition after = scheduler.createOneTimeAfter("after", "1h30m", Map.of("k", "v"));

            // Then
            assertThat(at.getFireTime()).isEqualTo(NOW + 30 * 60_000);
            assertThat(after.getFireTime()).isEqualTo(NOW + 90 * 60_000);
            assertThat(after.getPayload()).containsEntry("k", "v");
            assertThatThrownBy(() -> scheduler.createOneTimeAt("bad", "20251321120000", Map.of()))
                    .isInstanceOf(FormatException.class);
            assertThatThrownBy(() -> scheduler.createOneTimeAt("past", "20241231235959", Map.of()))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> scheduler.createOneTimeAfter("zero", "0s", Map.of()))
                    .isInstanceOf(FormatException.class);
        }
    }

    @Nested
    @DisplayName("firing")
    class Firing {

        @Test
        @DisplayName("Should fire a one-time job exactly once and make it terminal")
        void testOneTimeFiresOnce() throws Exception {
            // Given
            JobDefinition job = armOneTimeJob(scheduler, 200);

            // When
            await().atMost(5, TimeUnit.SECONDS)
                    .until(() -> scheduler.getJob(job.getId()).orElseThrow().isExecuted());
            Thread.sleep(300);

            // Then
            JobDefinition fired = scheduler.getJob(job.getId()).orElseThrow();
            assertThat(fired.isExecuted()).isTrue();
            assertThat(fired.isEnabled()).isFalse();
            assertThat(fired.getExecutedAt()).isEqualTo(clock.millis());
            assertThat(published).hasSize(1);
            assertThatThrownBy(() -> scheduler.startJob(job.getId()))
                    .isInstanceOf(TerminalStateException.class);
            assertThatThrownBy(() -> scheduler.updateJob(job.getId(), JobUpdate.newBuilder().name("again").build()))
                    .isInstanceOf(TerminalStateException.class);
        }

        @Test
        @DisplayName("Should publish the job data as a cronjob:trigger event")
        void testEventShape() {
            // Given
            JobDefinition job = armOneTimeJob(scheduler, 100);

            // When
            await().atMost(5, TimeUnit.SECONDS).until(() -> published.size() == 1);

            // Then
            DomainEvent event = published.get(0);
            assertThat(publishedStreams).containsExactly("cronjob:events");
            assertThat(event.getEventType()).isEqualTo("cronjob:trigger");
            assertThat(event.getSource()).isEqualTo("cronjob");
            assertThat(event.getEventId()).isNotEqualTo(job.getId());
            assertThat(event.getData())
                    .containsEntry("jobId", job.getId())
                    .containsEntry("jobName", "reminder")
                    .containsEntry("scheduledTime", NOW + 120_000)
                    .containsEntry("payload", Map.of("text", "drink water"));
        }

        @Test
        @DisplayName("Should fire a recurring job on its schedule and re-arm it")
        void testRecurringFires() {
            // Given - 100 ms before the minute turns
            clock.set(Instant.parse("2025-01-01T08:00:59.900Z").toEpochMilli());

            // When
            JobDefinition job = scheduler.createJob(JobSpec.recurring("every-minute", "* * * * *").build());

            // Then
            await().atMost(5, TimeUnit.SECONDS).until(() -> published.size() == 1);
            assertThat(published.get(0).getData()).containsEntry("scheduledTime", clock.millis());
            JobDefinition after = scheduler.getJob(job.getId()).orElseThrow();
            assertThat(after.isEnabled()).isTrue();
            assertThat(after.isExecuted()).isFalse();
            assertThat(after.getLastError()).isNull();
        }

        @Test
        @DisplayName("Should disable a one-time job whose publish failed without marking it executed")
        void testPublishFailureNoRetry() {
            // Given
            AtomicInteger calls = new AtomicInteger();
            scheduler.close();
            scheduler = newScheduler(SchedulerConfig.newBuilder().withZone(ZoneOffset.UTC).build(),
                    (stream, event) -> {
                        calls.incrementAndGet();
                        throw new PublishException(stream, "store unreachable", null);
                    });

            // When
            JobDefinition job = armOneTimeJob(scheduler, 100);

            // Then
            await().atMost(5, TimeUnit.SECONDS)
                    .until(() -> !scheduler.getJob(job.getId()).orElseThrow().isEnabled());
            JobDefinition failed = scheduler.getJob(job.getId()).orElseThrow();
            assertThat(failed.isExecuted()).isFalse();
            assertThat(failed.getLastError()).isEqualTo("store unreachable");
            assertThat(calls.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should retry a failed one-time publish when retries are configured")
        void testPublishFailureWithRetry() {
            // Given
            AtomicInteger calls = new AtomicInteger();
            scheduler.close();
            scheduler = newScheduler(SchedulerConfig.newBuilder()
                            .withZone(ZoneOffset.UTC)
                            .withOneTimeRetryAttempts(2)
                            .withRetryDelayMs(50)
                            .build(),
                    (stream, event) -> {
                        if (calls.incrementAndGet() < 3) {
                            throw new PublishException(stream, "flaky", null);
                        }
                        return "1-0";
                    });

            // When
            JobDefinition job = armOneTimeJob(scheduler, 100);

            // Then
            await().atMost(5, TimeUnit.SECONDS)
                    .until(() -> scheduler.getJob(job.getId()).orElseThrow().isExecuted());
            assertThat(calls.get()).isEqualTo(3);
            assertThat(scheduler.getJob(job.getId()).orElseThrow().getLastError()).isNull();
        }

        @Test
        @DisplayName("Should not fire a job stopped before its time")
        void testStopPreventsFiring() throws Exception {
            // Given
            JobDefinition job = armOneTimeJob(scheduler, 300);

            // When
            scheduler.stopJob(job.getId());
            Thread.sleep(600);

            // Then
            assertThat(published).isEmpty();
            assertThat(scheduler.getJob(job.getId()).orElseThrow().isEnabled()).isFalse();
        }

        @Test
        @DisplayName("Should not fire a deleted job")
        void testDeletePreventsFiring() throws Exception {
            // Given
            JobDefinition job = armOneTimeJob(scheduler, 300);

            // When
            boolean deleted = scheduler.deleteJob(job.getId());
            Thread.sleep(600);

            // Then
            assertThat(deleted).isTrue();
            assertThat(published).isEmpty();
            assertThat(scheduler.getJob(job.getId())).isEmpty();
        }
    }

    @Nested
    @DisplayName("updateJob")
    class Update {

        @Test
        @DisplayName("Should refuse to change the kind of a job")
        void testKindImmutable() {
            // Given
            JobDefinition job = scheduler.createJob(JobSpec.oneTime("once", NOW + 60_000).build());

            // Then
            assertThatThrownBy(() -> scheduler.updateJob(job.getId(), JobUpdate.newBuilder().kind("recurring").build()))
                    .isInstanceOf(ImmutableFieldException.class)
                    .satisfies(e -> assertThat(((ImmutableFieldException) e).getField()).isEqualTo("kind"));
        }

        @Test
        @DisplayName("Should reject an unknown kind in an update as invalid")
        void testUnknownKindOnUpdate() {
            JobDefinition job = scheduler.createJob(JobSpec.oneTime("once", NOW + 60_000).build());

            assertThatThrownBy(() -> scheduler.updateJob(job.getId(), JobUpdate.newBuilder().kind("bogus").build()))
                    .isInstanceOf(ValidationException.class)
                    .satisfies(e -> assertThat(((ValidationException) e).getField()).isEqualTo("kind"));
            assertThat(scheduler.getJob(job.getId())).contains(job);
        }

        @Test
        @DisplayName("Should accept the current kind in an update")
        void testSameKind() {
            JobDefinition job = scheduler.createJob(JobSpec.oneTime("once", NOW + 60_000).build());

            JobDefinition updated = scheduler.updateJob(job.getId(), JobUpdate.newBuilder().kind("one-time").name("renamed").build());

            assertThat(updated.getName()).isEqualTo("renamed");
        }

        @Test
        @DisplayName("Should merge fields and bump updatedAt")
        void testMerge() {
            // Given
            JobDefinition job = scheduler.createJob(JobSpec.recurring("report", "0 9 * * *")
                    .payload(Map.of("v", 1))
                    .build());
            clock.advance(5000);

            // When
            JobDefinition updated = scheduler.updateJob(job.getId(), JobUpdate.newBuilder()
                    .schedule("30 17 * * 1-5")
                    .build());

            // Then
            assertThat(updated.getId()).isEqualTo(job.getId());
            assertThat(updated.getName()).isEqualTo("report");
            assertThat(updated.getSchedule()).isEqualTo("30 17 * * 1-5");
            assertThat(updated.getPayload()).containsEntry("v", 1);
            assertThat(updated.getCreatedAt()).isEqualTo(NOW);
            assertThat(updated.getUpdatedAt()).isEqualTo(NOW + 5000);
            assertThat(scheduler.getJob(job.getId())).contains(updated);
        }

        @Test
        @DisplayName("Should keep the previous definition when the update is invalid")
        void testInvalidUpdate() {
            // Given
            JobDefinition job = scheduler.createJob(JobSpec.recurring("report", "0 9 * * *").build());

            // When
            assertThatThrownBy(() -> scheduler.updateJob(job.getId(), JobUpdate.newBuilder()
                    .name("new name")
                    .schedule("not a cron")
                    .build()))
                    .isInstanceOf(ValidationException.class);

            // Then
            assertThat(scheduler.getJob(job.getId())).contains(job);
        }

        @Test
        @DisplayName("Should reject a past fire time and schedule fields of the other kind")
        void testKindSpecificFields() {
            JobDefinition once = scheduler.createJob(JobSpec.oneTime("once", NOW + 60_000).build());
            JobDefinition recurring = scheduler.createJob(JobSpec.recurring("rec", "0 9 * * *").build());

            assertThatThrownBy(() -> scheduler.updateJob(once.getId(), JobUpdate.newBuilder().fireTime(NOW - 1).build()))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> scheduler.updateJob(once.getId(), JobUpdate.newBuilder().schedule("0 9 * * *").build()))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> scheduler.updateJob(recurring.getId(), JobUpdate.newBuilder().fireTime(NOW + 1).build()))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Should fail for an unknown job")
        void testUnknownJob() {
            assertThatThrownBy(() -> scheduler.updateJob("missing", JobUpdate.newBuilder().name("x").build()))
                    .isInstanceOf(JobNotFoundException.class)
                    .hasMessage("Job not found: missing");
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Should toggle enabled with stop and start")
        void testStopStart() {
            // Given
            JobDefinition job = scheduler.createJob(JobSpec.recurring("rec", "0 9 * * *").build());

            // When
            scheduler.stopJob(job.getId());
            boolean afterStop = scheduler.getJob(job.getId()).orElseThrow().isEnabled();
            scheduler.startJob(job.getId());

            // Then
            assertThat(afterStop).isFalse();
            assertThat(scheduler.getJob(job.getId()).orElseThrow().isEnabled()).isTrue();
        }

        @Test
        @DisplayName("Should refuse to start a one-time job whose time has passed")
        void testStartAfterFireTime() {
            // Given
            JobDefinition job = scheduler.createJob(JobSpec.oneTime("once", NOW + 1000).enabled(false).build());
            clock.advance(2000);

            // Then
            assertThatThrownBy(() -> scheduler.startJob(job.getId()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("passed");
        }

        @Test
        @DisplayName("Should report missing jobs")
        void testMissing() {
            assertThat(scheduler.getJob("missing")).isEmpty();
            assertThat(scheduler.deleteJob("missing")).isFalse();
            assertThatThrownBy(() -> scheduler.startJob("missing")).isInstanceOf(JobNotFoundException.class);
            assertThatThrownBy(() -> scheduler.stopJob("missing")).isInstanceOf(JobNotFoundException.class);
        }

        @Test
        @DisplayName("Should list jobs in creation order")
        void testListJobs() {
            JobDefinition first = scheduler.createJob(JobSpec.recurring("a", "0 9 * * *").build());
            clock.advance(1);
            JobDefinition second = scheduler.createJob(JobSpec.oneTime("b", NOW + 60_000).build());

            assertThat(scheduler.listJobs()).extracting(JobDefinition::getId)
                    .containsExactly(first.getId(), second.getId());
        }

        @Test
        @DisplayName("Should count jobs by kind and state")
        void testStats() {
            // Given
            scheduler.createJob(JobSpec.recurring("a", "0 9 * * *").build());
            scheduler.createJob(JobSpec.recurring("b", "0 10 * * *").enabled(false).build());
            scheduler.createJob(JobSpec.oneTime("c", NOW + 60_000).build());
            JobDefinition fired = armOneTimeJob(scheduler, 100);
            await().atMost(5, TimeUnit.SECONDS)
                    .until(() -> scheduler.getJob(fired.getId()).orElseThrow().isExecuted());

            // When
            JobStats stats = scheduler.stats();

            // Then
            assertThat(stats.getTotal()).isEqualTo(4);
            assertThat(stats.getRecurring()).isEqualTo(2);
            assertThat(stats.getOneTime()).isEqualTo(2);
            assertThat(stats.getActive()).isEqualTo(2);
            assertThat(stats.getExecuted()).isEqualTo(1);
            assertThat(scheduler.activeJobCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should cancel timers on stopAll but keep definitions")
        void testStopAll() throws Exception {
            // Given
            JobDefinition job = armOneTimeJob(scheduler, 300);

            // When
            scheduler.stopAll();
            Thread.sleep(600);

            // Then
            assertThat(published).isEmpty();
            assertThat(scheduler.getJob(job.getId()).orElseThrow().isEnabled()).isTrue();
        }

        @Test
        @DisplayName("Should reject new jobs after close")
        void testClosed() {
            scheduler.close();

            assertThatThrownBy(() -> scheduler.createJob(JobSpec.recurring("a", "0 9 * * *").build()))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("concurrent changes")
    class ConcurrentChanges {
        private final CountDownLatch publishing = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);

        private EventPublisher blockingPublisher() {
            return (stream, event) -> {
                published.add(event);
                publishing.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "1-" + published.size();
            };
        }

        private void useBlockingPublisher() {
            scheduler.close();
            scheduler = newScheduler(SchedulerConfig.newBuilder().withZone(ZoneOffset.UTC).build(), blockingPublisher());
        }

        @Test
        @DisplayName("Should wait for an in-flight fire before applying an update and keep one timer")
        void testUpdateDuringFire() throws Exception {
            // Given
            useBlockingPublisher();
            clock.set(Instant.parse("2025-01-01T08:00:59.900Z").toEpochMilli());
            JobDefinition job = scheduler.createJob(JobSpec.recurring("every-minute", "* * * * *").build());
            assertThat(publishing.await(5, TimeUnit.SECONDS)).isTrue();

            // When
            CompletableFuture<JobDefinition> update = CompletableFuture.supplyAsync(() ->
                    scheduler.updateJob(job.getId(), JobUpdate.newBuilder().schedule("*/5 * * * *").build()));
            Thread.sleep(100);
            boolean doneWhilePublishing = update.isDone();
            release.countDown();
            JobDefinition updated = update.get(5, TimeUnit.SECONDS);

            // Then
            assertThat(doneWhilePublishing).isFalse();
            assertThat(updated.getSchedule()).isEqualTo("*/5 * * * *");
            assertThat(scheduler.getJob(job.getId())).contains(updated);
            assertThat(published).hasSize(1);
            assertThat(scheduler.armedTimerCount()).isEqualTo(1);

            scheduler.stopJob(job.getId());
            assertThat(scheduler.armedTimerCount()).isZero();
        }

        @Test
        @DisplayName("Should finish an in-flight one-time fire before a stop and leave no timer")
        void testStopDuringFire() throws Exception {
            // Given
            useBlockingPublisher();
            JobDefinition job = armOneTimeJob(scheduler, 100);
            assertThat(publishing.await(5, TimeUnit.SECONDS)).isTrue();

            // When
            CompletableFuture<Void> stop = CompletableFuture.runAsync(() -> scheduler.stopJob(job.getId()));
            Thread.sleep(100);
            boolean doneWhilePublishing = stop.isDone();
            release.countDown();
            stop.get(5, TimeUnit.SECONDS);
            Thread.sleep(300);

            // Then
            assertThat(doneWhilePublishing).isFalse();
            JobDefinition after = scheduler.getJob(job.getId()).orElseThrow();
            assertThat(after.isExecuted()).isTrue();
            assertThat(after.isEnabled()).isFalse();
            assertThat(published).hasSize(1);
            assertThat(scheduler.armedTimerCount()).isZero();
        }

        @Test
        @DisplayName("Should drop the old timer when a due one-time job is rescheduled")
        void testRescheduleBeforeFire() throws Exception {
            // Given
            JobDefinition job = armOneTimeJob(scheduler, 200);
            long newFireTime = clock.millis() + 600;

            // When
            for (int i = 0; i < 5; i++) {
                scheduler.updateJob(job.getId(), JobUpdate.newBuilder().fireTime(newFireTime).build());
            }
            int armedAfterUpdates = scheduler.armedTimerCount();
            Thread.sleep(350);
            int publishedBeforeNewTime = published.size();

            // Then
            assertThat(armedAfterUpdates).isEqualTo(1);
            assertThat(publishedBeforeNewTime).isZero();
            await().atMost(5, TimeUnit.SECONDS).until(() -> published.size() == 1);
            assertThat(published.get(0).getData()).containsEntry("scheduledTime", newFireTime);
            Thread.sleep(300);
            assertThat(published).hasSize(1);
            assertThat(scheduler.armedTimerCount()).isZero();
        }
    }
}
