package com.projectpulse.core.store;

import com.projectpulse.core.model.Activity;
import com.projectpulse.core.model.Admission;
import com.projectpulse.core.model.CycleType;
import com.projectpulse.core.model.Destination;
import com.projectpulse.core.model.Fingerprint;
import com.projectpulse.core.model.Post;
import com.projectpulse.core.model.PostStatus;
import com.projectpulse.core.model.RawActivity;
import com.projectpulse.core.model.ScheduleState;
import com.projectpulse.core.model.Source;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Durable record of activities, posts and the scheduler cursor. Every method is atomic; implementations throw
 * {@link StoreUnavailableException} when the backing storage cannot be reached.
 */
public interface ActivityStore {

    /**
     * Returns the activity holding {@code fingerprint}, or stores a new unclassified one built from {@code raw}.
     * Concurrent calls with the same fingerprint store exactly one activity.
     */
    Admission findOrCreate(Fingerprint fingerprint, RawActivity raw);

    Optional<Activity> findActivity(long activityId);

    Activity markNewsworthy(long activityId, boolean newsworthy);

    /**
     * Activities with {@code from < observedAt <= to}, in insertion order. A {@code null} bound is open.
     */
    List<Activity> activitiesObservedBetween(Instant from, Instant to);

    List<Activity> unclassifiedActivities();

    /**
     * Newest newsworthy activity of {@code source} inserted before {@code beforeActivityId}.
     */
    Optional<Activity> latestNewsworthy(Source source, long beforeActivityId);

    boolean consumedBySucceededPost(long activityId);

    /**
     * Returns the single post row for ({@code signature}, {@code destination}), creating it as
     * {@link PostStatus#PENDING} when absent. A non-terminal row is reset to pending; a terminal row is returned as is.
     */
    Post acquirePost(String signature, Set<Long> activityIds, Destination destination, CycleType cycleType, Instant now);

    Optional<Post> findPost(String signature, Destination destination);

    /**
     * Records one publish attempt. A succeeded post is never changed.
     */
    Post recordAttempt(long postId, PostStatus status, Instant attemptAt, String externalReference, String error);

    /**
     * Changes a post's status without counting an attempt. A succeeded post is never changed.
     */
    Post markPost(long postId, PostStatus status, String error);

    List<Post> postsCreatedSince(Instant since);

    ScheduleState scheduleState();

    /**
     * Atomically applies {@code update} to the current schedule state and stores the result.
     */
    ScheduleState updateScheduleState(UnaryOperator<ScheduleState> update);
}
