package com.projectpulse.core.model;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

public record Post(
        long id,
        String signature,
        Set<Long> activityIds,
        Destination destination,
        CycleType cycleType,
        PostStatus status,
        int attemptCount,
        Instant createdAt,
        Instant lastAttemptAt,
        String externalReference,
        String lastError
) {
    public Post {
        activityIds = activityIds == null ? Set.of() : Set.copyOf(activityIds);
    }

    /**
     * Stable signature of a set of activity ids: ascending ids joined by commas.
     */
    public static String signatureOf(Collection<Long> activityIds) {
        return new TreeSet<>(activityIds).stream()
                .map(String::valueOf)
                .collect(Collectors.joining(","));
    }

    public static String signatureOf(List<Activity> activities) {
        return signatureOf(activities.stream().map(Activity::id).toList());
    }

    public Post withStatus(PostStatus next, Instant attemptAt, String reference, String error, boolean countAttempt) {
        return new Post(
                id,
                signature,
                activityIds,
                destination,
                cycleType,
                next,
                countAttempt ? attemptCount + 1 : attemptCount,
                createdAt,
                attemptAt == null ? lastAttemptAt : attemptAt,
                reference == null ? externalReference : reference,
                error
        );
    }
}
