package com.projectpulse.service.runtime;

import com.projectpulse.core.bus.EventBus;
import com.projectpulse.core.events.PublishAttempted;
import com.projectpulse.core.model.Candidate;
import com.projectpulse.core.model.Destination;
import com.projectpulse.core.model.Post;
import com.projectpulse.core.model.PostStatus;
import com.projectpulse.core.store.ActivityStore;
import com.projectpulse.core.store.StoreUnavailableException;
import com.projectpulse.publishers.api.ContentRenderer;
import com.projectpulse.publishers.api.ContentTooLongException;
import com.projectpulse.publishers.api.PublishException;
import com.projectpulse.publishers.api.PublishOutcome;
import com.projectpulse.publishers.api.Publisher;
import com.projectpulse.service.config.ScheduleConfig.RetryPolicy;

import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Publishes one candidate to several destinations, one task per destination. Every attempt is written to the
 * candidate's post row before the next one starts, so a crash never loses an attempt that reached an adapter.
 */
public class PublishCoordinator {
    private static final Logger LOGGER = Logger.getLogger(PublishCoordinator.class.getName());
    private static final long CANCEL_GRACE_SECONDS = 5;

    private final ActivityStore store;
    private final Map<Destination, Publisher> publishers;
    private final ContentRenderer renderer;
    private final EventBus eventBus;
    private final RetryPolicy retryPolicy;
    private final int parallelism;
    private final Sleeper sleeper;
    private final Clock clock;

    public PublishCoordinator(
            ActivityStore store,
            Map<Destination, Publisher> publishers,
            ContentRenderer renderer,
            EventBus eventBus,
            RetryPolicy retryPolicy,
            int parallelism,
            Sleeper sleeper,
            Clock clock
    ) {
        this.store = store;
        this.publishers = publishers.isEmpty() ? Map.of() : new EnumMap<>(publishers);
        this.renderer = renderer;
        this.eventBus = eventBus;
        this.retryPolicy = retryPolicy;
        this.parallelism = Math.max(1, parallelism);
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Returns one result per requested destination. When the calling thread is interrupted the remaining tasks are
     * cancelled, their posts are left {@link PostStatus#FAILED_RETRYABLE} and the interrupt flag is restored.
     *
     * @throws StoreUnavailableException when any task could not reach the store
     */
    public Map<Destination, PostResult> publish(Candidate candidate, Set<Destination> destinations) {
        Map<Destination, PostResult> results = new EnumMap<>(Destination.class);
        if (destinations.isEmpty()) {
            return results;
        }

        Map<Destination, Post> rows = new EnumMap<>(Destination.class);
        for (Destination destination : destinations) {
            rows.put(destination, store.acquirePost(
                    candidate.signature(),
                    candidate.activityIds(),
                    destination,
                    candidate.cycleType(),
                    clock.instant()
            ));
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, rows.size()), threadFactory());
        Map<Destination, Future<PostResult>> futures = new LinkedHashMap<>();
        try {
            for (Map.Entry<Destination, Post> row : rows.entrySet()) {
                futures.put(row.getKey(), pool.submit(() -> publishTo(candidate, row.getValue())));
            }
            for (Map.Entry<Destination, Future<PostResult>> entry : futures.entrySet()) {
                results.put(entry.getKey(), await(entry.getKey(), entry.getValue(), rows.get(entry.getKey())));
            }
        } catch (InterruptedException e) {
            futures.values().forEach(future -> future.cancel(true));
            pool.shutdownNow();
            awaitQuietly(pool);
            for (Map.Entry<Destination, Post> row : rows.entrySet()) {
                results.computeIfAbsent(row.getKey(), destination -> abandon(row.getValue()));
            }
            Thread.currentThread().interrupt();
            LOGGER.warning("Publishing of " + candidate.signature() + " was interrupted");
        } catch (StoreUnavailableException e) {
            futures.values().forEach(future -> future.cancel(true));
            throw e;
        } finally {
            pool.shutdownNow();
        }
        return results;
    }

    private PostResult await(Destination destination, Future<PostResult> future, Post row) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StoreUnavailableException storeUnavailable) {
                throw storeUnavailable;
            }
            LOGGER.log(Level.SEVERE, "Publishing to " + destination + " failed unexpectedly", cause);
            return PostResult.of(store.markPost(row.id(), PostStatus.FAILED_RETRYABLE, String.valueOf(cause)));
        } catch (CancellationException e) {
            return abandon(row);
        }
    }

    private PostResult abandon(Post row) {
        Post current = store.findPost(row.signature(), row.destination()).orElse(row);
        if (current.status().terminal()) {
            return PostResult.of(current);
        }
        return PostResult.of(store.markPost(current.id(), PostStatus.FAILED_RETRYABLE, "cancelled"));
    }

    private PostResult publishTo(Candidate candidate, Post acquired) throws InterruptedException {
        if (acquired.status() == PostStatus.SUCCEEDED) {
            return PostResult.alreadyPublished(acquired);
        }
        Post post = acquired.status() == PostStatus.PENDING
                ? acquired
                : store.markPost(acquired.id(), PostStatus.PENDING, acquired.lastError());
        Destination destination = post.destination();

        Publisher publisher = publishers.get(destination);
        if (publisher == null) {
            return PostResult.of(record(post, PostStatus.FAILED_PERMANENT, null, "No publisher configured for " + destination));
        }

        boolean shortened = false;
        int failedAttempts = 0;
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("publishing to " + destination + " cancelled");
            }
            String error;
            try {
                String content = renderer.render(candidate, destination, shortened);
                PublishOutcome outcome = publisher.publish(content);
                if (outcome.success()) {
                    post = record(post, PostStatus.SUCCEEDED, outcome.externalReference(), null);
                    LOGGER.info(() -> "Published " + candidate.signature() + " to " + destination);
                    return PostResult.of(post);
                }
                error = publisher.name() + " reported no success";
            } catch (ContentTooLongException e) {
                if (shortened) {
                    return PostResult.of(record(post, PostStatus.FAILED_PERMANENT, null, e.getMessage()));
                }
                // The shortened retry happens immediately and does not count against the retry budget.
                shortened = true;
                post = record(post, PostStatus.PENDING, null, e.getMessage());
                continue;
            } catch (PublishException e) {
                if (!e.retryable()) {
                    LOGGER.warning("Permanent failure publishing " + candidate.signature() + " to " + destination + ": "
                            + e.getMessage());
                    return PostResult.of(record(post, PostStatus.FAILED_PERMANENT, null, e.getMessage()));
                }
                error = e.getMessage();
            } catch (StoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Unclassified failure publishing to " + destination, e);
                error = e.toString();
            }

            failedAttempts++;
            if (failedAttempts >= retryPolicy.maxAttempts()) {
                LOGGER.warning("Giving up on " + candidate.signature() + " for " + destination + " after "
                        + failedAttempts + " attempts: " + error);
                return PostResult.of(record(post, PostStatus.FAILED_RETRYABLE, null, error));
            }
            post = record(post, PostStatus.PENDING, null, error);
            sleeper.sleep(retryPolicy.backoffAfter(failedAttempts));
        }
    }

    private Post record(Post post, PostStatus status, String reference, String error) {
        Post updated = store.recordAttempt(post.id(), status, clock.instant(), reference, error);
        eventBus.publish(new PublishAttempted(
                clock.instant(),
                updated.id(),
                updated.signature(),
                updated.destination(),
                updated.attemptCount(),
                updated.status(),
                error
        ));
        return updated;
    }

    private static void awaitQuietly(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(CANCEL_GRACE_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.warning("Publish tasks did not stop within " + CANCEL_GRACE_SECONDS + "s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "publish-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
