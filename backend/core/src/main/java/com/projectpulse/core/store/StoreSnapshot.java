package com.projectpulse.core.store;

import com.projectpulse.core.model.Activity;
import com.projectpulse.core.model.Post;
import com.projectpulse.core.model.ScheduleState;

import java.util.List;

public record StoreSnapshot(
        long nextActivityId,
        long nextPostId,
        List<Activity> activities,
        List<Post> posts,
        ScheduleState scheduleState
) {
    public StoreSnapshot {
        activities = activities == null ? List.of() : List.copyOf(activities);
        posts = posts == null ? List.of() : List.copyOf(posts);
        scheduleState = scheduleState == null ? ScheduleState.initial() : scheduleState;
        nextActivityId = Math.max(1, nextActivityId);
        nextPostId = Math.max(1, nextPostId);
    }

    public static StoreSnapshot empty() {
        return new StoreSnapshot(1, 1, List.of(), List.of(), ScheduleState.initial());
    }
}
