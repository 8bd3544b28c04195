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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Activity store held in memory behind a single lock. The lock is the uniqueness constraint: lookups and inserts
 * of one fingerprint never interleave. Subclasses make the store durable through {@link #persist(StoreSnapshot)};
 * a failed persist rolls the in-memory change back before the exception reaches the caller. Subclasses shared
 * between processes widen the lock through {@link #access(boolean, Supplier)}.
 */
public class InMemoryActivityStore implements ActivityStore {
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, Activity> activities = new LinkedHashMap<>();
    private final Map<String, Long> fingerprints = new HashMap<>();
    private final Map<Long, Post> posts = new LinkedHashMap<>();
    private final Map<String, Long> postKeys = new HashMap<>();
    private ScheduleState scheduleState = ScheduleState.initial();
    private long nextActivityId = 1;
    private long nextPostId = 1;

    public InMemoryActivityStore() {
        this(StoreSnapshot.empty());
    }

    protected InMemoryActivityStore(StoreSnapshot initial) {
        restore(initial);
    }

    /**
     * Called under the store lock after every mutation.
     */
    protected void persist(StoreSnapshot snapshot) {
    }

    /**
     * Runs one store operation. Called under the store lock, once per outermost operation; {@code mutating} is true
     * when the operation may change state. The default runs {@code operation} directly.
     */
    protected <T> T access(boolean mutating, Supplier<T> operation) {
        return operation.get();
    }

    /**
     * Replaces the whole in-memory state. Used by subclasses that pick up changes made by other writers.
     */
    protected final void replace(StoreSnapshot snapshot) {
        lock.lock();
        try {
            activities.clear();
            fingerprints.clear();
            posts.clear();
            postKeys.clear();
            restore(snapshot);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Admission findOrCreate(Fingerprint fingerprint, RawActivity raw) {
        return locked(true, () -> {
            String key = fingerprint.key();
            Long existingId = fingerprints.get(key);
            if (existingId != null) {
                return Admission.duplicate(activities.get(existingId));
            }
            long id = nextActivityId;
            Activity created = new Activity(
                    id,
                    raw.source(),
                    raw.sourceNativeId(),
                    fingerprint.contentHash(),
                    raw.observedAt(),
                    raw.payload(),
                    null
            );
            activities.put(id, created);
            fingerprints.put(key, id);
            nextActivityId = id + 1;
            commit(() -> {
                activities.remove(id);
                fingerprints.remove(key);
                nextActivityId = id;
            });
            return Admission.admitted(created);
        });
    }

    @Override
    public Optional<Activity> findActivity(long activityId) {
        return locked(false, () -> Optional.ofNullable(activities.get(activityId)));
    }

    @Override
    public Activity markNewsworthy(long activityId, boolean newsworthy) {
        return locked(true, () -> {
            Activity previous = requireActivity(activityId);
            Activity updated = previous.withNewsworthy(newsworthy);
            activities.put(activityId, updated);
            commit(() -> activities.put(activityId, previous));
            return updated;
        });
    }

    @Override
    public List<Activity> activitiesObservedBetween(Instant from, Instant to) {
        return locked(false, () -> {
            List<Activity> matched = new ArrayList<>();
            for (Activity activity : activities.values()) {
                Instant observedAt = activity.observedAt();
                if (from != null && !observedAt.isAfter(from)) {
                    continue;
                }
                if (to != null && observedAt.isAfter(to)) {
                    continue;
                }
                matched.add(activity);
            }
            return matched;
        });
    }

    @Override
    public List<Activity> unclassifiedActivities() {
        return locked(false, () -> activities.values().stream().filter(activity -> !activity.classified()).toList());
    }

    @Override
    public Optional<Activity> latestNewsworthy(Source source, long beforeActivityId) {
        return locked(false, () -> {
            Activity latest = null;
            for (Activity activity : activities.values()) {
                if (activity.id() >= beforeActivityId) {
                    break;
                }
                if (activity.source() == source && activity.markedNewsworthy()) {
                    latest = activity;
                }
            }
            return Optional.ofNullable(latest);
        });
    }

    @Override
    public boolean consumedBySucceededPost(long activityId) {
        return locked(false, () -> posts.values().stream()
                .anyMatch(post -> post.status() == PostStatus.SUCCEEDED && post.activityIds().contains(activityId)));
    }

    @Override
    public Post acquirePost(
            String signature,
            Set<Long> activityIds,
            Destination destination,
            CycleType cycleType,
            Instant now
    ) {
        return locked(true, () -> {
            String key = postKey(signature, destination);
            Long existingId = postKeys.get(key);
            if (existingId != null) {
                Post existing = posts.get(existingId);
                if (existing.status().terminal() || existing.status() == PostStatus.PENDING) {
                    return existing;
                }
                Post pending = existing.withStatus(PostStatus.PENDING, null, null, existing.lastError(), false);
                posts.put(existingId, pending);
                commit(() -> posts.put(existingId, existing));
                return pending;
            }
            long id = nextPostId;
            Post created = new Post(
                    id,
                    signature,
                    activityIds,
                    destination,
                    cycleType,
                    PostStatus.PENDING,
                    0,
                    now,
                    null,
                    null,
                    null
            );
            posts.put(id, created);
            postKeys.put(key, id);
            nextPostId = id + 1;
            commit(() -> {
                posts.remove(id);
                postKeys.remove(key);
                nextPostId = id;
            });
            return created;
        });
    }

    @Override
    public Optional<Post> findPost(String signature, Destination destination) {
        return locked(false, () -> {
            Long id = postKeys.get(postKey(signature, destination));
            return id == null ? Optional.<Post>empty() : Optional.of(posts.get(id));
        });
    }

    @Override
    public Post recordAttempt(long postId, PostStatus status, Instant attemptAt, String externalReference, String error) {
        return updatePost(postId, previous -> previous.withStatus(status, attemptAt, externalReference, error, true));
    }

    @Override
    public Post markPost(long postId, PostStatus status, String error) {
        return updatePost(postId, previous -> previous.withStatus(status, null, null, error, false));
    }

    @Override
    public List<Post> postsCreatedSince(Instant since) {
        return locked(false, () -> posts.values().stream()
                .filter(post -> since == null || !post.createdAt().isBefore(since))
                .toList());
    }

    @Override
    public ScheduleState scheduleState() {
        return locked(false, () -> scheduleState);
    }

    @Override
    public ScheduleState updateScheduleState(UnaryOperator<ScheduleState> update) {
        return locked(true, () -> {
            ScheduleState previous = scheduleState;
            scheduleState = Objects.requireNonNull(update.apply(previous), "updated schedule state is required");
            commit(() -> scheduleState = previous);
            return scheduleState;
        });
    }

    protected final StoreSnapshot snapshot() {
        lock.lock();
        try {
            return new StoreSnapshot(
                    nextActivityId,
                    nextPostId,
                    new ArrayList<>(activities.values()),
                    new ArrayList<>(posts.values()),
                    scheduleState
            );
        } finally {
            lock.unlock();
        }
    }

    private void restore(StoreSnapshot snapshot) {
        long maxActivityId = 0;
        for (Activity activity : snapshot.activities()) {
            activities.put(activity.id(), activity);
            fingerprints.put(activity.fingerprint().key(), activity.id());
            maxActivityId = Math.max(maxActivityId, activity.id());
        }
        long maxPostId = 0;
        for (Post post : snapshot.posts()) {
            posts.put(post.id(), post);
            postKeys.put(postKey(post.signature(), post.destination()), post.id());
            maxPostId = Math.max(maxPostId, post.id());
        }
        scheduleState = snapshot.scheduleState();
        nextActivityId = Math.max(snapshot.nextActivityId(), maxActivityId + 1);
        nextPostId = Math.max(snapshot.nextPostId(), maxPostId + 1);
    }

    private Post updatePost(long postId, UnaryOperator<Post> change) {
        return locked(true, () -> {
            Post previous = posts.get(postId);
            if (previous == null) {
                throw new IllegalArgumentException("Unknown post: " + postId);
            }
            if (previous.status() == PostStatus.SUCCEEDED) {
                return previous;
            }
            Post updated = change.apply(previous);
            posts.put(postId, updated);
            commit(() -> posts.put(postId, previous));
            return updated;
        });
    }

    private <T> T locked(boolean mutating, Supplier<T> operation) {
        lock.lock();
        try {
            if (lock.getHoldCount() > 1) {
                return operation.get();
            }
            return access(mutating, operation);
        } finally {
            lock.unlock();
        }
    }

    private Activity requireActivity(long activityId) {
        Activity activity = activities.get(activityId);
        if (activity == null) {
            throw new IllegalArgumentException("Unknown activity: " + activityId);
        }
        return activity;
    }

    private void commit(Runnable undo) {
        try {
            persist(snapshot());
        } catch (StoreUnavailableException e) {
            undo.run();
            throw e;
        }
    }

    private static String postKey(String signature, Destination destination) {
        return signature + "|" + destination.name();
    }
}
