package com.projectpulse.core.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

/**
 * Durable cursor of the scheduler. Instances are immutable; every mutation returns a copy.
 */
public record ScheduleState(
        Instant lastDailyRunAt,
        Instant lastWeeklyRunAt,
        int postsPublishedToday,
        LocalDate postsPublishedOn,
        Map<Destination, Instant> lastPostAt
) {
    public ScheduleState {
        lastPostAt = lastPostAt == null || lastPostAt.isEmpty()
                ? Map.of()
                : Map.copyOf(new EnumMap<>(lastPostAt));
    }

    public static ScheduleState initial() {
        return new ScheduleState(null, null, 0, null, Map.of());
    }

    public Instant lastRunAt(CycleType cycleType) {
        return cycleType == CycleType.DAILY ? lastDailyRunAt : lastWeeklyRunAt;
    }

    public Instant lastPostAt(Destination destination) {
        return lastPostAt.get(destination);
    }

    /**
     * Posts counted for {@code today}; a counter that belongs to another local day reads as zero.
     */
    public int postsPublishedOn(LocalDate today) {
        return today.equals(postsPublishedOn) ? postsPublishedToday : 0;
    }

    public ScheduleState withDailyRun(Instant at) {
        return new ScheduleState(at, lastWeeklyRunAt, postsPublishedToday, postsPublishedOn, lastPostAt);
    }

    public ScheduleState withWeeklyRun(Instant at) {
        return new ScheduleState(lastDailyRunAt, at, postsPublishedToday, postsPublishedOn, lastPostAt);
    }

    public ScheduleState withPublishedPosts(LocalDate today, int newlyPublished) {
        return new ScheduleState(
                lastDailyRunAt,
                lastWeeklyRunAt,
                postsPublishedOn(today) + newlyPublished,
                today,
                lastPostAt
        );
    }

    public ScheduleState withLastPostAt(Destination destination, Instant at) {
        Map<Destination, Instant> next = new EnumMap<>(Destination.class);
        next.putAll(lastPostAt);
        next.put(destination, at);
        return new ScheduleState(lastDailyRunAt, lastWeeklyRunAt, postsPublishedToday, postsPublishedOn, next);
    }
}
