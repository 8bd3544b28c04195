package com.projectpulse.service.runtime;

import com.projectpulse.core.bus.EventBus;
import com.projectpulse.core.events.AlertRaised;
import com.projectpulse.core.events.CycleCompleted;
import com.projectpulse.core.events.CycleStarted;
import com.projectpulse.core.model.Activity;
import com.projectpulse.core.model.CycleType;
import com.projectpulse.core.model.Destination;
import com.projectpulse.core.model.Post;
import com.projectpulse.core.model.PostStatus;
import com.projectpulse.core.model.ScheduleState;
import com.projectpulse.core.model.Source;
import com.projectpulse.core.store.InMemoryActivityStore;
import com.projectpulse.core.store.StoreUnavailableException;
import com.projectpulse.publishers.api.PermanentPublishException;
import com.projectpulse.publishers.api.PublishOutcome;
import com.projectpulse.publishers.api.Publisher;
import com.projectpulse.publishers.api.RetryablePublishException;
import com.projectpulse.publishers.api.Summarizer;
import com.projectpulse.publishers.format.ContentFormatter;
import com.projectpulse.service.config.ScheduleConfig;
import com.projectpulse.service.support.MutableClock;
import com.projectpulse.service.support.RecordingSleeper;
import com.projectpulse.service.support.ScriptedPublisher;
import com.projectpulse.service.support.StoreFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CycleSchedulerTest {
    private static final Instant NOW = Instant.parse("2026-02-10T09:00:00Z");
    private static final ContentFormatter FORMATTER = new ContentFormatter("#pulse", List.of(), ZoneOffset.UTC);

    private InMemoryActivityStore store;
    private EventBus bus;
    private List<Object> events;
    private ScriptedPublisher microblogA;
    private ScriptedPublisher microblogB;
    private ScriptedPublisher blog;
    private Summarizer summarizer;

    @BeforeEach
    void setUp() {
        store = new InMemoryActivityStore();
        bus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        bus.subscribeAll(events::add);
        microblogA = new ScriptedPublisher(Destination.MICROBLOG_A);
        microblogB = new ScriptedPublisher(Destination.MICROBLOG_B);
        blog = new ScriptedPublisher(Destination.BLOG);
        summarizer = activities -> "# Weekly summary\n\n" + activities.size() + " updates";
    }

    @Test
    void dailyCyclePublishesOnlyTheNewestActivitiesUpToTheDailyCap() {
        for (int i = 5; i >= 1; i--) {
            StoreFixtures.newsworthy(store, "r" + i, NOW.minus(Duration.ofHours(i)));
        }

        CycleOutcome outcome = scheduler(schedule(3)).runCycle(CycleType.DAILY, NOW);

        assertEquals(CycleOutcome.Status.COMPLETED, outcome.status());
        assertEquals(List.of("5", "4", "3"), outcome.candidates().stream().map(CycleOutcome.CandidateResult::signature).toList());
        assertEquals(3, microblogA.published().size());
        assertEquals(3, microblogB.published().size());
        assertEquals(EnumSet.of(Destination.MICROBLOG_A, Destination.MICROBLOG_B), outcome.succeeded());
        assertEquals(0, outcome.exitCode());

        ScheduleState state = store.scheduleState();
        assertEquals(NOW, state.lastDailyRunAt());
        assertEquals(3, state.postsPublishedOn(LocalDate.of(2026, 2, 10)));
        assertEquals(NOW, state.lastPostAt(Destination.MICROBLOG_A));
        assertEquals(NOW, state.lastPostAt(Destination.MICROBLOG_B));
    }

    @Test
    void equalObservationTimesPreferTheLaterInsertion() {
        Instant sameTime = NOW.minus(Duration.ofHours(2));
        Activity first = StoreFixtures.newsworthy(store, "first", sameTime);
        Activity second = StoreFixtures.newsworthy(store, "second", sameTime);

        CycleOutcome outcome = scheduler(schedule(1)).runCycle(CycleType.DAILY, NOW);

        assertEquals(1, outcome.candidates().size());
        assertEquals(Set.of(second.id()), outcome.candidates().get(0).activityIds());
        assertTrue(store.findPost(String.valueOf(first.id()), Destination.MICROBLOG_A).isEmpty());
    }

    @Test
    void dailyCycleWithinTheMinimumIntervalIsSkipped() {
        StoreFixtures.newsworthy(store, "r1", NOW.minus(Duration.ofHours(1)));
        CycleScheduler scheduler = scheduler(schedule(10));
        scheduler.runCycle(CycleType.DAILY, NOW);
        StoreFixtures.newsworthy(store, "r2", NOW.plus(Duration.ofMinutes(10)));

        CycleOutcome outcome = scheduler.runCycle(CycleType.DAILY, NOW.plus(Duration.ofMinutes(30)));

        assertEquals(CycleOutcome.Status.SKIPPED, outcome.status());
        assertTrue(outcome.candidates().isEmpty());
        assertEquals(0, outcome.exitCode());
        assertEquals(1, microblogA.published().size());
        assertEquals(NOW, store.scheduleState().lastDailyRunAt());
        CycleCompleted completed = last(CycleCompleted.class);
        assertTrue(completed.skipped());
    }

    @Test
    void publishedActivitiesAreNeverPublishedAgain() {
        StoreFixtures.newsworthy(store, "r1", NOW.minus(Duration.ofHours(3)));
        StoreFixtures.newsworthy(store, "r2", NOW.minus(Duration.ofHours(2)));
        CycleScheduler scheduler = scheduler(schedule(10));

        scheduler.runCycle(CycleType.DAILY, NOW);
        CycleOutcome second = scheduler.runCycle(CycleType.DAILY, NOW.plus(Duration.ofHours(2)));

        assertTrue(second.candidates().isEmpty());
        assertEquals(2, microblogA.published().size());
        assertEquals(2, microblogB.published().size());
        assertEquals(2, store.scheduleState().postsPublishedOn(LocalDate.of(2026, 2, 10)));
    }

    @Test
    void retryableDestinationIsRetriedByTheNextCycleWithoutRepostingTheOther() {
        Activity activity = StoreFixtures.newsworthy(store, "r1", NOW.minus(Duration.ofHours(1)));
        microblogA.thenFailAlways(new RetryablePublishException("HTTP 503"));
        scheduler(schedule(10)).runCycle(CycleType.DAILY, NOW);
        microblogA = new ScriptedPublisher(Destination.MICROBLOG_A);

        CycleOutcome next = scheduler(schedule(10)).runCycle(CycleType.DAILY, NOW.plus(Duration.ofHours(2)));

        assertEquals(1, next.candidates().size());
        assertEquals(Set.of(Destination.MICROBLOG_A), next.candidates().get(0).results().keySet());
        Post post = store.findPost(String.valueOf(activity.id()), Destination.MICROBLOG_A).orElseThrow();
        assertEquals(PostStatus.SUCCEEDED, post.status());
        assertEquals(4, post.attemptCount());
        assertEquals(1, microblogB.published().size());
        assertEquals(1, store.scheduleState().postsPublishedOn(LocalDate.of(2026, 2, 10)));
    }

    @Test
    void oneFailingDestinationDoesNotBlockTheOther() {
        StoreFixtures.newsworthy(store, "r1", NOW.minus(Duration.ofHours(1)));
        microblogA.thenFail(new PermanentPublishException("account suspended"));

        CycleOutcome outcome = scheduler(schedule(10)).runCycle(CycleType.DAILY, NOW);

        assertEquals(EnumSet.of(Destination.MICROBLOG_A), outcome.permanent());
        assertEquals(EnumSet.of(Destination.MICROBLOG_B), outcome.succeeded());
        assertEquals(1, outcome.exitCode());
        assertEquals(NOW, store.scheduleState().lastPostAt(Destination.MICROBLOG_A));
        assertEquals(NOW, store.scheduleState().lastPostAt(Destination.MICROBLOG_B));
    }

    @Test
    void exhaustedRetriesLeaveLastPostAtUnchanged() {
        StoreFixtures.newsworthy(store, "r1", NOW.minus(Duration.ofHours(1)));
        microblogA.thenFailAlways(new RetryablePublishException("HTTP 503"));
        microblogB.thenFailAlways(new RetryablePublishException("HTTP 502"));

        CycleOutcome outcome = scheduler(schedule(10)).runCycle(CycleType.DAILY, NOW);

        assertEquals(EnumSet.of(Destination.MICROBLOG_A, Destination.MICROBLOG_B), outcome.retryable());
        assertEquals(2, outcome.exitCode());
        ScheduleState state = store.scheduleState();
        assertNull(state.lastPostAt(Destination.MICROBLOG_A));
        assertNull(state.lastPostAt(Destination.MICROBLOG_B));
        assertEquals(0, state.postsPublishedOn(LocalDate.of(2026, 2, 10)));
        assertEquals(NOW, state.lastDailyRunAt());
    }

    @Test
    void destinationPostedRecentlyIsLeftOutOfTheCycle() {
        StoreFixtures.newsworthy(store, "r1", NOW.minus(Duration.ofHours(1)));
        store.updateScheduleState(state -> state.withLastPostAt(Destination.MICROBLOG_A, NOW.minus(Duration.ofMinutes(30))));

        CycleOutcome outcome = scheduler(schedule(10)).runCycle(CycleType.DAILY, NOW);

        assertEquals(Set.of(Destination.MICROBLOG_B), outcome.candidates().get(0).results().keySet());
        assertTrue(microblogA.published().isEmpty());
    }

    @Test
    void disabledDestinationIsNeverSelected() {
        StoreFixtures.newsworthy(store, "r1", NOW.minus(Duration.ofHours(1)));

        CycleOutcome outcome = scheduler(schedule(10), EnumSet.of(Destination.MICROBLOG_A)).runCycle(CycleType.DAILY, NOW);

        assertEquals(Set.of(Destination.MICROBLOG_A), outcome.candidates().get(0).results().keySet());
        assertTrue(microblogB.published().isEmpty());
    }

    @Test
    void dailyCounterResetsOnANewLocalDay() {
        StoreFixtures.newsworthy(store, "r1", Instant.parse("2026-02-10T08:30:00Z"));
        StoreFixtures.newsworthy(store, "r2", Instant.parse("2026-02-10T08:40:00Z"));
        StoreFixtures.newsworthy(store, "r3", Instant.parse("2026-02-10T08:50:00Z"));
        CycleScheduler scheduler = scheduler(schedule(2));

        assertEquals(2, scheduler.runCycle(CycleType.DAILY, NOW).candidates().size());
        assertTrue(scheduler.runCycle(CycleType.DAILY, Instant.parse("2026-02-10T20:00:00Z")).candidates().isEmpty());
        CycleOutcome nextDay = scheduler.runCycle(CycleType.DAILY, Instant.parse("2026-02-11T08:00:00Z"));

        assertEquals(List.of("1"), nextDay.candidates().stream().map(CycleOutcome.CandidateResult::signature).toList());
        ScheduleState state = store.scheduleState();
        assertEquals(LocalDate.of(2026, 2, 11), state.postsPublishedOn());
        assertEquals(1, state.postsPublishedToday());
    }

    @Test
    void unclassifiedAndOldActivitiesAreNotCandidates() {
        StoreFixtures.newsworthy(store, "old", NOW.minus(Duration.ofHours(30)));
        StoreFixtures.seed(store, Source.CHAT, "noise", "message", "ok", NOW.minus(Duration.ofHours(1)), false);

        CycleOutcome outcome = scheduler(schedule(10)).runCycle(CycleType.DAILY, NOW);

        assertEquals(CycleOutcome.Status.COMPLETED, outcome.status());
        assertTrue(outcome.candidates().isEmpty());
        assertEquals(NOW, store.scheduleState().lastDailyRunAt());
    }

    @Test
    void weeklyCycleAggregatesTheWindowIntoOneBlogPost() {
        Instant lastWeekly = NOW.minus(Duration.ofDays(7));
        store.updateScheduleState(state -> state.withWeeklyRun(lastWeekly));
        StoreFixtures.newsworthy(store, "before", lastWeekly.minus(Duration.ofHours(1)));
        Activity inside1 = StoreFixtures.newsworthy(store, "inside1", NOW.minus(Duration.ofDays(3)));
        Activity inside2 = StoreFixtures.newsworthy(store, "inside2", NOW.minus(Duration.ofDays(1)));
        StoreFixtures.seed(store, Source.CHAT, "chatter", "message", "lol", NOW.minus(Duration.ofDays(2)), false);

        CycleOutcome outcome = scheduler(schedule(10), EnumSet.of(Destination.BLOG)).runCycle(CycleType.WEEKLY, NOW);

        assertEquals(1, outcome.candidates().size());
        assertEquals(Set.of(inside1.id(), inside2.id()), outcome.candidates().get(0).activityIds());
        assertEquals(List.of("# Weekly summary\n\n2 updates"), blog.published());
        assertEquals(EnumSet.of(Destination.BLOG), outcome.succeeded());
        assertTrue(microblogA.published().isEmpty());
        ScheduleState state = store.scheduleState();
        assertEquals(NOW, state.lastWeeklyRunAt());
        assertEquals(NOW, state.lastPostAt(Destination.BLOG));
        assertEquals(0, state.postsPublishedToday());
    }

    @Test
    void weeklyCycleFallsBackToTheDigestWhenTheSummarizerFails() {
        StoreFixtures.newsworthy(store, "r1", NOW.minus(Duration.ofDays(1)));
        summarizer = activities -> {
            throw new IllegalStateException("summarizer returned HTTP 529");
        };

        scheduler(schedule(10)).runCycle(CycleType.WEEKLY, NOW);

        assertEquals(1, blog.published().size());
        assertTrue(blog.published().get(0).startsWith("# Weekly Update: February 03 - February 10, 2026"));
        assertEquals("summarizer", last(AlertRaised.class).category());
    }

    @Test
    void weeklyCycleWithoutSummarizerUsesTheDigest() {
        StoreFixtures.newsworthy(store, "r1", NOW.minus(Duration.ofDays(1)));
        summarizer = null;

        scheduler(schedule(10)).runCycle(CycleType.WEEKLY, NOW);

        assertTrue(blog.published().get(0).startsWith("# Weekly Update:"));
    }

    @Test
    void retryableWeeklyFailureRebuildsTheSameWindowNextTime() {
        Activity activity = StoreFixtures.newsworthy(store, "r1", NOW.minus(Duration.ofDays(1)));
        blog.thenFailAlways(new RetryablePublishException("disk busy"));

        CycleOutcome failed = scheduler(schedule(10), EnumSet.of(Destination.BLOG)).runCycle(CycleType.WEEKLY, NOW);

        assertEquals(EnumSet.of(Destination.BLOG), failed.retryable());
        assertEquals(2, failed.exitCode());
        assertNull(store.scheduleState().lastWeeklyRunAt());

        blog = new ScriptedPublisher(Destination.BLOG);
        Instant later = NOW.plus(Duration.ofHours(6));
        CycleOutcome retried = scheduler(schedule(10), EnumSet.of(Destination.BLOG)).runCycle(CycleType.WEEKLY, later);

        assertEquals(Set.of(activity.id()), retried.candidates().get(0).activityIds());
        assertEquals(EnumSet.of(Destination.BLOG), retried.succeeded());
        assertEquals(later, store.scheduleState().lastWeeklyRunAt());
    }

    @Test
    void weeklyCycleSkipsActivitiesAlreadyCoveredByAWeeklyPost() {
        StoreFixtures.newsworthy(store, "r1", NOW.minus(Duration.ofDays(2)));
        scheduler(schedule(10)).runCycle(CycleType.WEEKLY, NOW);
        store.updateScheduleState(state -> new ScheduleState(
                state.lastDailyRunAt(), null, state.postsPublishedToday(), state.postsPublishedOn(), state.lastPostAt()));
        Activity fresh = StoreFixtures.newsworthy(store, "r2", NOW.plus(Duration.ofHours(1)));

        CycleOutcome outcome = scheduler(schedule(10)).runCycle(CycleType.WEEKLY, NOW.plus(Duration.ofHours(2)));

        assertEquals(Set.of(fresh.id()), outcome.candidates().get(0).activityIds());
    }

    @Test
    void publishedWeeklyPostIsAnnouncedOnTheMicroblogs() {
        Activity first = StoreFixtures.newsworthy(store, "r1", NOW.minus(Duration.ofDays(2)));
        Activity second = StoreFixtures.newsworthy(store, "r2", NOW.minus(Duration.ofDays(1)));
        blog.then(content -> PublishOutcome.published("https://blog.example.org/2026-02-10-weekly-summary/"));

        CycleOutcome outcome = scheduler(schedule(10)).runCycle(CycleType.WEEKLY, NOW);

        String weeklySignature = Post.signatureOf(Set.of(first.id(), second.id()));
        assertEquals(List.of(weeklySignature, "weekly-announce:" + weeklySignature),
                outcome.candidates().stream().map(CycleOutcome.CandidateResult::signature).toList());
        assertEquals(Set.of(Destination.BLOG), outcome.candidates().get(0).results().keySet());
        assertEquals(EnumSet.allOf(Destination.class), outcome.succeeded());
        assertEquals(1, blog.published().size());
        String announcement = microblogA.published().get(0);
        assertTrue(announcement.startsWith("📊 Weekly summary"), announcement);
        assertTrue(announcement.contains("https://blog.example.org/2026-02-10-weekly-summary/"), announcement);
        assertTrue(microblogB.published().get(0).length() <= Destination.MICROBLOG_B.characterLimit());

        Post row = store.findPost("weekly-announce:" + weeklySignature, Destination.MICROBLOG_A).orElseThrow();
        assertEquals(CycleType.WEEKLY, row.cycleType());
        assertEquals(PostStatus.SUCCEEDED, row.status());
        ScheduleState state = store.scheduleState();
        assertEquals(NOW, state.lastWeeklyRunAt());
        assertEquals(NOW, state.lastPostAt(Destination.MICROBLOG_A));
        assertEquals(0, state.postsPublishedToday());
    }

    @Test
    void weeklyPostThatFailedIsNotAnnounced() {
        StoreFixtures.newsworthy(store, "r1", NOW.minus(Duration.ofDays(1)));
        blog.thenFail(new PermanentPublishException("posts directory is read-only"));

        CycleOutcome outcome = scheduler(schedule(10)).runCycle(CycleType.WEEKLY, NOW);

        assertEquals(1, outcome.candidates().size());
        assertEquals(EnumSet.of(Destination.BLOG), outcome.permanent());
        assertTrue(microblogA.published().isEmpty());
        assertTrue(microblogB.published().isEmpty());
    }

    @Test
    void retryableAnnouncementIsRetriedWithoutReopeningTheWindow() {
        Activity activity = StoreFixtures.newsworthy(store, "r1", NOW.minus(Duration.ofDays(1)));
        microblogA.thenFailAlways(new RetryablePublishException("HTTP 503"));

        CycleOutcome first = scheduler(schedule(10)).runCycle(CycleType.WEEKLY, NOW);

        assertEquals(EnumSet.of(Destination.MICROBLOG_A), first.retryable());
        assertEquals(NOW, store.scheduleState().lastWeeklyRunAt());

        microblogA = new ScriptedPublisher(Destination.MICROBLOG_A);
        Instant later = NOW.plus(Duration.ofDays(7));
        CycleOutcome next = scheduler(schedule(10)).runCycle(CycleType.WEEKLY, later);

        assertEquals(List.of("weekly-announce:" + activity.id()),
                next.candidates().stream().map(CycleOutcome.CandidateResult::signature).toList());
        assertEquals(Set.of(Destination.MICROBLOG_A), next.candidates().get(0).results().keySet());
        assertEquals(1, microblogA.published().size());
        assertTrue(microblogA.published().get(0).contains("ref-1"), microblogA.published().get(0));
        assertEquals(1, blog.published().size());
        assertEquals(1, microblogB.published().size());
        assertEquals(later, store.scheduleState().lastWeeklyRunAt());
    }

    @Test
    void phasesAreObservablePerCycleType() {
        StoreFixtures.newsworthy(store, "r1", NOW.minus(Duration.ofDays(1)));
        AtomicReference<CyclePhase> weeklyPhase = new AtomicReference<>();
        AtomicReference<CyclePhase> dailyPhase = new AtomicReference<>();
        CycleScheduler scheduler = scheduler(schedule(10));
        blog.then(content -> {
            weeklyPhase.set(scheduler.phase(CycleType.WEEKLY));
            dailyPhase.set(scheduler.phase(CycleType.DAILY));
            return PublishOutcome.published("https://blog.example.org/post/");
        });

        scheduler.runCycle(CycleType.WEEKLY, NOW);

        assertEquals(CyclePhase.PUBLISHING, weeklyPhase.get());
        assertEquals(CyclePhase.IDLE, dailyPhase.get());
        assertEquals(CyclePhase.IDLE, scheduler.phase(CycleType.WEEKLY));
    }

    @Test
    void cycleEventsBracketTheRun() {
        StoreFixtures.newsworthy(store, "r1", NOW.minus(Duration.ofHours(1)));

        scheduler(schedule(10)).runCycle(CycleType.DAILY, NOW);

        assertTrue(events.get(0) instanceof CycleStarted);
        CycleCompleted completed = last(CycleCompleted.class);
        assertEquals(1, completed.candidates());
        assertEquals(EnumSet.of(Destination.MICROBLOG_A, Destination.MICROBLOG_B), completed.succeeded());
    }

    @Test
    void storeFailureAbortsTheCycleWithoutRecording() {
        InMemoryActivityStore failing = new InMemoryActivityStore() {
            @Override
            public ScheduleState updateScheduleState(UnaryOperator<ScheduleState> update) {
                throw new StoreUnavailableException("state file unwritable", new IOException("EACCES"));
            }
        };
        store = failing;
        StoreFixtures.newsworthy(store, "r1", NOW.minus(Duration.ofHours(1)));
        CycleScheduler scheduler = scheduler(schedule(10));

        assertThrows(StoreUnavailableException.class, () -> scheduler.runCycle(CycleType.DAILY, NOW));
        assertNull(store.scheduleState().lastDailyRunAt());
        assertEquals(CyclePhase.IDLE, scheduler.phase(CycleType.DAILY));
    }

    private CycleScheduler scheduler(ScheduleConfig schedule) {
        return scheduler(schedule, EnumSet.allOf(Destination.class));
    }

    private CycleScheduler scheduler(ScheduleConfig schedule, Set<Destination> enabled) {
        Map<Destination, Publisher> publishers = new EnumMap<>(Destination.class);
        publishers.put(Destination.MICROBLOG_A, microblogA);
        publishers.put(Destination.MICROBLOG_B, microblogB);
        publishers.put(Destination.BLOG, blog);
        PublishCoordinator coordinator = new PublishCoordinator(
                store,
                publishers,
                FORMATTER,
                bus,
                schedule.retry(),
                schedule.publishParallelism(),
                new RecordingSleeper(),
                new MutableClock(NOW, ZoneOffset.UTC)
        );
        return new CycleScheduler(store, coordinator, FORMATTER, summarizer, schedule, enabled, bus);
    }

    private static ScheduleConfig schedule(int maxDailyPosts) {
        return new ScheduleConfig(
                Duration.ofHours(1),
                maxDailyPosts,
                Duration.ofHours(24),
                Duration.ofDays(7),
                "UTC",
                ScheduleConfig.RetryPolicy.defaults(),
                3
        );
    }

    private <T> T last(Class<T> type) {
        T found = null;
        for (Object event : events) {
            if (type.isInstance(event)) {
                found = type.cast(event);
            }
        }
        if (found == null) {
            throw new AssertionError("No " + type.getSimpleName() + " published");
        }
        return found;
    }
}
