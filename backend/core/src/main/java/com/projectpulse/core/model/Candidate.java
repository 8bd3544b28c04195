package com.projectpulse.core.model;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A unit of publishing: one activity for a daily cycle, the whole window for a weekly one, or the microblog
 * announcement of a weekly post that already went out.
 *
 * @param body        pre-rendered text, set for weekly candidates only
 * @param windowStart exclusive start of the weekly window
 * @param windowEnd   inclusive end of the weekly window
 * @param announces   reference of the published weekly post this candidate announces; {@code null} otherwise
 */
public record Candidate(
        CycleType cycleType,
        List<Activity> activities,
        String body,
        Instant windowStart,
        Instant windowEnd,
        String announces
) {
    public static final String ANNOUNCEMENT_PREFIX = "weekly-announce:";

    public Candidate {
        Objects.requireNonNull(cycleType, "cycleType is required");
        activities = List.copyOf(activities);
        if (activities.isEmpty()) {
            throw new IllegalArgumentException("candidate needs at least one activity");
        }
    }

    public static Candidate daily(Activity activity) {
        return new Candidate(CycleType.DAILY, List.of(activity), null, null, null, null);
    }

    public static Candidate weekly(List<Activity> activities, String body, Instant windowStart, Instant windowEnd) {
        return new Candidate(CycleType.WEEKLY, activities, body, windowStart, windowEnd, null);
    }

    /**
     * Follow-up of a published weekly candidate. It keeps the weekly activities but posts under its own signature, so
     * the weekly post and its announcement never share a post row.
     */
    public Candidate announcement(String reference) {
        if (cycleType != CycleType.WEEKLY || isAnnouncement()) {
            throw new IllegalStateException("only weekly posts are announced");
        }
        return new Candidate(CycleType.WEEKLY, activities, body, windowStart, windowEnd, reference == null ? "" : reference);
    }

    public boolean isAnnouncement() {
        return announces != null;
    }

    public String signature() {
        String signature = Post.signatureOf(activities);
        return isAnnouncement() ? ANNOUNCEMENT_PREFIX + signature : signature;
    }

    public Set<Long> activityIds() {
        Set<Long> ids = new LinkedHashSet<>();
        activities.forEach(activity -> ids.add(activity.id()));
        return ids;
    }

    public Activity primary() {
        return activities.get(0);
    }
}
