package com.projectpulse.service.runtime;

import com.projectpulse.core.model.Activity;
import com.projectpulse.core.model.CycleType;
import com.projectpulse.core.model.Destination;
import com.projectpulse.core.model.Post;
import com.projectpulse.core.model.PostStatus;
import com.projectpulse.core.model.Source;
import com.projectpulse.core.store.ActivityStore;
import com.projectpulse.service.store.EventStore;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Counts posts, activities and alerts of the last days for the {@code stats} command.
 */
public record PostingStats(
        Instant since,
        Map<Destination, Integer> postsByDestination,
        Map<PostStatus, Integer> postsByStatus,
        Map<CycleType, Integer> postsByCycleType,
        Map<Source, Integer> activitiesBySource,
        int newsworthyActivities,
        int alerts
) {
    public static PostingStats collect(ActivityStore store, EventStore events, Instant since, Instant now) {
        Map<Destination, Integer> byDestination = new EnumMap<>(Destination.class);
        Map<PostStatus, Integer> byStatus = new EnumMap<>(PostStatus.class);
        Map<CycleType, Integer> byCycleType = new EnumMap<>(CycleType.class);
        for (Post post : store.postsCreatedSince(since)) {
            byDestination.merge(post.destination(), 1, Integer::sum);
            byStatus.merge(post.status(), 1, Integer::sum);
            byCycleType.merge(post.cycleType(), 1, Integer::sum);
        }

        Map<Source, Integer> bySource = new EnumMap<>(Source.class);
        int newsworthy = 0;
        for (Activity activity : store.activitiesObservedBetween(since, now)) {
            bySource.merge(activity.source(), 1, Integer::sum);
            if (activity.markedNewsworthy()) {
                newsworthy++;
            }
        }

        int alerts = events.query(since, Optional.of("AlertRaised"), Integer.MAX_VALUE).size();
        return new PostingStats(since, byDestination, byStatus, byCycleType, bySource, newsworthy, alerts);
    }

    public int totalPosts() {
        return postsByDestination.values().stream().mapToInt(Integer::intValue).sum();
    }

    public String render() {
        StringBuilder out = new StringBuilder();
        out.append("Since ").append(since).append('\n');
        out.append("Posts: ").append(totalPosts()).append('\n');
        for (Destination destination : Destination.values()) {
            out.append("  ").append(destination).append(": ")
                    .append(postsByDestination.getOrDefault(destination, 0)).append('\n');
        }
        out.append("By status:\n");
        for (PostStatus status : PostStatus.values()) {
            out.append("  ").append(status).append(": ").append(postsByStatus.getOrDefault(status, 0)).append('\n');
        }
        out.append("Daily posts: ").append(postsByCycleType.getOrDefault(CycleType.DAILY, 0)).append('\n');
        out.append("Weekly posts: ").append(postsByCycleType.getOrDefault(CycleType.WEEKLY, 0)).append('\n');
        out.append("Activities:\n");
        for (Source source : Source.values()) {
            out.append("  ").append(source).append(": ").append(activitiesBySource.getOrDefault(source, 0)).append('\n');
        }
        out.append("Newsworthy activities: ").append(newsworthyActivities).append('\n');
        out.append("Alerts: ").append(alerts).append('\n');
        return out.toString();
    }
}
