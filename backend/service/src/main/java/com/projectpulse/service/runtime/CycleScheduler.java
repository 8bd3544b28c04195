package com.projectpulse.service.runtime;

import com.projectpulse.core.bus.EventBus;
import com.projectpulse.core.events.AlertRaised;
import com.projectpulse.core.events.CycleCompleted;
import com.projectpulse.core.events.CycleStarted;
import com.projectpulse.core.model.Activity;
import com.projectpulse.core.model.Candidate;
import com.projectpulse.core.model.CycleType;
import com.projectpulse.core.model.Destination;
import com.projectpulse.core.model.Post;
import com.projectpulse.core.model.PostStatus;
import com.projectpulse.core.model.ScheduleState;
import com.projectpulse.core.store.ActivityStore;
import com.projectpulse.publishers.api.Summarizer;
import com.projectpulse.publishers.format.ContentFormatter;
import com.projectpulse.service.config.ScheduleConfig;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs daily and weekly publish cycles against the store. Each call to {@link #runCycle(CycleType, Instant)} is
 * one complete cycle; nothing here reads the wall clock to decide what to publish.
 */
public class CycleScheduler {
    private static final Logger LOGGER = Logger.getLogger(CycleScheduler.class.getName());

    static final Comparator<Activity> NEWEST_FIRST = Comparator
            .comparing(Activity::observedAt, Comparator.reverseOrder())
            .thenComparing(Activity::id, Comparator.reverseOrder());

    private final ActivityStore store;
    private final PublishCoordinator coordinator;
    private final ContentFormatter formatter;
    private final Summarizer summarizer;
    private final ScheduleConfig schedule;
    private final Set<Destination> enabledDestinations;
    private final EventBus eventBus;
    private final ZoneId zone;
    private final Map<CycleType, ReentrantLock> locks = new EnumMap<>(CycleType.class);
    private final Map<CycleType, CyclePhase> phases = new EnumMap<>(CycleType.class);

    /**
     * @param summarizer may be {@code null}; weekly bodies then always come from the digest
     */
    public CycleScheduler(
            ActivityStore store,
            PublishCoordinator coordinator,
            ContentFormatter formatter,
            Summarizer summarizer,
            ScheduleConfig schedule,
            Set<Destination> enabledDestinations,
            EventBus eventBus
    ) {
        this.store = store;
        this.coordinator = coordinator;
        this.formatter = formatter;
        this.summarizer = summarizer;
        this.schedule = schedule;
        this.enabledDestinations = enabledDestinations.isEmpty()
                ? EnumSet.noneOf(Destination.class)
                : EnumSet.copyOf(enabledDestinations);
        this.eventBus = eventBus;
        this.zone = schedule.zoneId();
        for (CycleType type : CycleType.values()) {
            locks.put(type, new ReentrantLock());
            phases.put(type, CyclePhase.IDLE);
        }
    }

    public CyclePhase phase(CycleType cycleType) {
        synchronized (phases) {
            return phases.get(cycleType);
        }
    }

    /**
     * Runs one cycle. Cycles of the same type wait for each other; a daily and a weekly cycle may overlap.
     *
     * @throws com.projectpulse.core.store.StoreUnavailableException when the store fails; the schedule state is
     *                                                               then left as it was
     */
    public CycleOutcome runCycle(CycleType cycleType, Instant now) {
        ReentrantLock lock = locks.get(cycleType);
        lock.lock();
        try {
            eventBus.publish(new CycleStarted(now, cycleType));
            CycleOutcome outcome = cycleType == CycleType.DAILY ? runDaily(now) : runWeekly(now);
            eventBus.publish(new CycleCompleted(
                    now,
                    cycleType,
                    outcome.skipped(),
                    outcome.candidates().size(),
                    outcome.succeeded(),
                    outcome.retryable(),
                    outcome.permanent()
            ));
            LOGGER.info(() -> cycleType + " cycle " + outcome.status() + ": candidates=" + outcome.candidates().size()
                    + " succeeded=" + outcome.succeeded() + " retryable=" + outcome.retryable()
                    + " permanent=" + outcome.permanent());
            return outcome;
        } finally {
            enter(cycleType, CyclePhase.IDLE);
            lock.unlock();
        }
    }

    private CycleOutcome runDaily(Instant now) {
        enter(CycleType.DAILY, CyclePhase.COLLECTING);
        ScheduleState state = store.scheduleState();

        enter(CycleType.DAILY, CyclePhase.SELECTING);
        if (withinInterval(state.lastDailyRunAt(), now)) {
            LOGGER.info("Daily cycle skipped; last run at " + state.lastDailyRunAt());
            return CycleOutcome.skipped(CycleType.DAILY);
        }
        LocalDate today = now.atZone(zone).toLocalDate();
        int remaining = Math.max(0, schedule.maxDailyPosts() - state.postsPublishedOn(today));

        Set<Destination> eligible = EnumSet.noneOf(Destination.class);
        for (Destination destination : CycleType.DAILY.destinations()) {
            if (enabledDestinations.contains(destination) && !withinInterval(state.lastPostAt(destination), now)) {
                eligible.add(destination);
            }
        }

        List<Selection> selections = new ArrayList<>();
        if (!eligible.isEmpty() && remaining > 0) {
            List<Activity> newsworthy = new ArrayList<>();
            for (Activity activity : store.activitiesObservedBetween(now.minus(schedule.dailyLookback()), now)) {
                if (activity.markedNewsworthy()) {
                    newsworthy.add(activity);
                }
            }
            newsworthy.sort(NEWEST_FIRST);
            for (Activity activity : newsworthy) {
                if (selections.size() >= remaining) {
                    break;
                }
                Candidate candidate = Candidate.daily(activity);
                Set<Destination> pending = pendingDestinations(candidate, eligible);
                if (!pending.isEmpty()) {
                    selections.add(new Selection(candidate, pending, hasSucceeded(candidate, CycleType.DAILY.destinations())));
                }
            }
        }

        enter(CycleType.DAILY, CyclePhase.PUBLISHING);
        List<CycleOutcome.CandidateResult> results = publishAll(selections);

        enter(CycleType.DAILY, CyclePhase.RECORDING);
        int firstSuccesses = 0;
        for (int i = 0; i < results.size(); i++) {
            if (!selections.get(i).previouslySucceeded() && reachedFirstSuccess(results.get(i))) {
                firstSuccesses++;
            }
        }
        Set<Destination> posted = postedDestinations(results);
        int counted = firstSuccesses;
        store.updateScheduleState(current -> {
            ScheduleState next = current.withDailyRun(now).withPublishedPosts(today, counted);
            for (Destination destination : posted) {
                next = next.withLastPostAt(destination, now);
            }
            return next;
        });
        return CycleOutcome.completed(CycleType.DAILY, results);
    }

    private CycleOutcome runWeekly(Instant now) {
        enter(CycleType.WEEKLY, CyclePhase.COLLECTING);
        ScheduleState state = store.scheduleState();

        enter(CycleType.WEEKLY, CyclePhase.SELECTING);
        Instant windowStart = state.lastWeeklyRunAt() != null
                ? state.lastWeeklyRunAt()
                : now.minus(schedule.weeklyLookback());
        Set<Long> covered = new HashSet<>();
        for (Post post : store.postsCreatedSince(null)) {
            if (post.cycleType() == CycleType.WEEKLY && post.status().terminal()
                    && !post.signature().startsWith(Candidate.ANNOUNCEMENT_PREFIX)) {
                covered.addAll(post.activityIds());
            }
        }
        List<Activity> activities = new ArrayList<>();
        for (Activity activity : store.activitiesObservedBetween(windowStart, now)) {
            if (activity.markedNewsworthy() && !covered.contains(activity.id())) {
                activities.add(activity);
            }
        }
        Set<Destination> destinations = EnumSet.noneOf(Destination.class);
        for (Destination destination : CycleType.WEEKLY.destinations()) {
            if (enabledDestinations.contains(destination)) {
                destinations.add(destination);
            }
        }

        List<Selection> selections = new ArrayList<>();
        if (!activities.isEmpty() && !destinations.isEmpty()) {
            Candidate candidate = Candidate.weekly(activities, weeklyBody(activities, windowStart, now), windowStart, now);
            Set<Destination> pending = pendingDestinations(candidate, destinations);
            if (!pending.isEmpty()) {
                selections.add(new Selection(candidate, pending, false));
            }
        }
        Set<Destination> announceTo = EnumSet.noneOf(Destination.class);
        for (Destination destination : CycleType.DAILY.destinations()) {
            if (enabledDestinations.contains(destination)) {
                announceTo.add(destination);
            }
        }
        List<Selection> announcements = announceTo.isEmpty() ? new ArrayList<>() : unfinishedAnnouncements(announceTo);

        enter(CycleType.WEEKLY, CyclePhase.PUBLISHING);
        List<CycleOutcome.CandidateResult> weeklyResults = publishAll(selections);
        for (int i = 0; i < weeklyResults.size(); i++) {
            PostResult blog = weeklyResults.get(i).result(Destination.BLOG);
            if (blog != null && blog.succeeded() && !announceTo.isEmpty()) {
                Candidate announcement = selections.get(i).candidate().announcement(blog.externalReference());
                Set<Destination> pending = pendingDestinations(announcement, announceTo);
                if (!pending.isEmpty()) {
                    announcements.add(new Selection(announcement, pending, false));
                }
            }
        }
        List<CycleOutcome.CandidateResult> results = new ArrayList<>(weeklyResults);
        results.addAll(publishAll(announcements));

        enter(CycleType.WEEKLY, CyclePhase.RECORDING);
        CycleOutcome outcome = CycleOutcome.completed(CycleType.WEEKLY, results);
        // announcements are retried from their own rows, so only the weekly post holds the window open
        boolean rebuildWindow = !CycleOutcome.completed(CycleType.WEEKLY, weeklyResults).retryable().isEmpty();
        Set<Destination> posted = postedDestinations(results);
        store.updateScheduleState(current -> {
            ScheduleState next = rebuildWindow ? current : current.withWeeklyRun(now);
            for (Destination destination : posted) {
                next = next.withLastPostAt(destination, now);
            }
            return next;
        });
        if (rebuildWindow) {
            LOGGER.warning("Weekly post left retryable; the next weekly run rebuilds the window from " + windowStart);
        }
        return outcome;
    }

    /**
     * Announcements of earlier weekly posts that are still owed to a microblog, rebuilt from their post rows.
     */
    private List<Selection> unfinishedAnnouncements(Set<Destination> announceTo) {
        Map<String, Set<Long>> owed = new LinkedHashMap<>();
        for (Post post : store.postsCreatedSince(null)) {
            if (post.signature().startsWith(Candidate.ANNOUNCEMENT_PREFIX) && !post.status().terminal()) {
                owed.putIfAbsent(post.signature(), post.activityIds());
            }
        }
        List<Selection> selections = new ArrayList<>();
        for (Map.Entry<String, Set<Long>> entry : owed.entrySet()) {
            String weeklySignature = entry.getKey().substring(Candidate.ANNOUNCEMENT_PREFIX.length());
            Optional<Post> blog = store.findPost(weeklySignature, Destination.BLOG)
                    .filter(post -> post.status() == PostStatus.SUCCEEDED);
            List<Activity> activities = new ArrayList<>();
            for (Long id : new TreeSet<>(entry.getValue())) {
                store.findActivity(id).ifPresent(activities::add);
            }
            if (blog.isEmpty() || activities.size() != entry.getValue().size()) {
                LOGGER.warning("Dropping announcement " + entry.getKey() + "; its weekly post or activities are gone");
                continue;
            }
            Instant start = activities.stream().map(Activity::observedAt).min(Comparator.naturalOrder()).orElseThrow();
            Candidate candidate = Candidate.weekly(activities, null, start, blog.get().createdAt())
                    .announcement(blog.get().externalReference());
            Set<Destination> pending = pendingDestinations(candidate, announceTo);
            if (!pending.isEmpty()) {
                selections.add(new Selection(candidate, pending, false));
            }
        }
        return selections;
    }

    private List<CycleOutcome.CandidateResult> publishAll(List<Selection> selections) {
        List<CycleOutcome.CandidateResult> results = new ArrayList<>();
        for (Selection selection : selections) {
            if (Thread.currentThread().isInterrupted()) {
                LOGGER.warning("Cycle interrupted; " + (selections.size() - results.size()) + " candidates left unpublished");
                break;
            }
            Candidate candidate = selection.candidate();
            Map<Destination, PostResult> published = coordinator.publish(candidate, selection.destinations());
            results.add(new CycleOutcome.CandidateResult(candidate.signature(), candidate.activityIds(), published));
        }
        return results;
    }

    private String weeklyBody(List<Activity> activities, Instant windowStart, Instant windowEnd) {
        if (summarizer != null) {
            try {
                String summary = summarizer.summarize(activities);
                if (summary != null && !summary.isBlank()) {
                    return summary;
                }
                LOGGER.warning("Summarizer returned an empty summary; using the digest");
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Summarizer failed; using the digest", e);
                eventBus.publish(new AlertRaised(
                        windowEnd,
                        "summarizer",
                        "Summarizer failed: " + e.getMessage(),
                        Map.of("activities", activities.size())
                ));
            }
        }
        return formatter.digest(activities, windowStart, windowEnd);
    }

    private Set<Destination> pendingDestinations(Candidate candidate, Set<Destination> destinations) {
        Set<Destination> pending = EnumSet.noneOf(Destination.class);
        for (Destination destination : destinations) {
            boolean terminal = store.findPost(candidate.signature(), destination)
                    .map(post -> post.status().terminal())
                    .orElse(false);
            if (!terminal) {
                pending.add(destination);
            }
        }
        return pending;
    }

    private boolean hasSucceeded(Candidate candidate, Set<Destination> destinations) {
        for (Destination destination : destinations) {
            boolean succeeded = store.findPost(candidate.signature(), destination)
                    .map(post -> post.status() == PostStatus.SUCCEEDED)
                    .orElse(false);
            if (succeeded) {
                return true;
            }
        }
        return false;
    }

    private static boolean reachedFirstSuccess(CycleOutcome.CandidateResult result) {
        for (PostResult post : result.results().values()) {
            if (post.succeeded() && !post.alreadyPublished()) {
                return true;
            }
        }
        return false;
    }

    private static Set<Destination> postedDestinations(List<CycleOutcome.CandidateResult> results) {
        Set<Destination> posted = EnumSet.noneOf(Destination.class);
        for (CycleOutcome.CandidateResult result : results) {
            for (PostResult post : result.results().values()) {
                if (post.alreadyPublished()) {
                    continue;
                }
                if (post.status() == PostStatus.SUCCEEDED || post.status() == PostStatus.FAILED_PERMANENT) {
                    posted.add(post.destination());
                }
            }
        }
        return posted;
    }

    private boolean withinInterval(Instant last, Instant now) {
        return last != null && Duration.between(last, now).compareTo(schedule.minPostInterval()) < 0;
    }

    private void enter(CycleType cycleType, CyclePhase phase) {
        synchronized (phases) {
            phases.put(cycleType, phase);
        }
    }

    private record Selection(Candidate candidate, Set<Destination> destinations, boolean previouslySucceeded) {
    }
}
