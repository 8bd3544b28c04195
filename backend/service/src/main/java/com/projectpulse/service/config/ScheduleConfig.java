package com.projectpulse.service.config;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Rate limits and windows of the publish cycles ({@code schedule.json}). Durations are ISO-8601, e.g. {@code PT1H}.
 *
 * @param minPostInterval    minimum time between two daily cycles and between two posts to one destination
 * @param maxDailyPosts      daily candidates allowed per local day
 * @param dailyLookback      how far back a daily cycle looks for newsworthy activities
 * @param weeklyLookback     weekly window used before the first weekly run
 * @param zone               time zone whose calendar day resets the daily counter
 * @param publishParallelism upper bound of concurrent destination tasks per candidate
 */
public record ScheduleConfig(
        Duration minPostInterval,
        int maxDailyPosts,
        Duration dailyLookback,
        Duration weeklyLookback,
        String zone,
        RetryPolicy retry,
        int publishParallelism
) {
    public ScheduleConfig {
        minPostInterval = minPostInterval == null ? Duration.ofHours(1) : minPostInterval;
        maxDailyPosts = maxDailyPosts <= 0 ? 10 : maxDailyPosts;
        dailyLookback = dailyLookback == null ? Duration.ofHours(24) : dailyLookback;
        weeklyLookback = weeklyLookback == null ? Duration.ofDays(7) : weeklyLookback;
        zone = zone == null || zone.isBlank() ? "UTC" : zone;
        retry = retry == null ? RetryPolicy.defaults() : retry;
        publishParallelism = publishParallelism <= 0 ? 3 : publishParallelism;
    }

    public static ScheduleConfig defaults() {
        return new ScheduleConfig(null, 0, null, null, null, null, 0);
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    /**
     * Attempt {@code n} (1-based) that fails with a retryable error waits {@code initialBackoff * multiplier^(n-1)}.
     */
    public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier) {
        public RetryPolicy {
            maxAttempts = maxAttempts <= 0 ? 3 : maxAttempts;
            initialBackoff = initialBackoff == null ? Duration.ofSeconds(1) : initialBackoff;
            multiplier = multiplier < 1.0 ? 4.0 : multiplier;
        }

        public static RetryPolicy defaults() {
            return new RetryPolicy(3, Duration.ofSeconds(1), 4.0);
        }

        public Duration backoffAfter(int failedAttempt) {
            double factor = Math.pow(multiplier, Math.max(0, failedAttempt - 1));
            return Duration.ofMillis(Math.round(initialBackoff.toMillis() * factor));
        }
    }
}
