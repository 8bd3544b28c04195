package com.projectpulse.service.runtime;

import com.projectpulse.core.events.AlertRaised;
import com.projectpulse.core.model.Activity;
import com.projectpulse.core.model.CycleType;
import com.projectpulse.core.model.Destination;
import com.projectpulse.core.model.Post;
import com.projectpulse.core.model.PostStatus;
import com.projectpulse.core.model.Source;
import com.projectpulse.core.store.InMemoryActivityStore;
import com.projectpulse.service.store.JsonlEventStore;
import com.projectpulse.service.support.StoreFixtures;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PostingStatsTest {
    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    @Test
    void countsPostsActivitiesAndAlertsInsideTheWindow() throws Exception {
        InMemoryActivityStore store = new InMemoryActivityStore();
        Activity release = StoreFixtures.newsworthy(store, "v1.0", NOW.minus(Duration.ofHours(3)));
        StoreFixtures.seed(store, Source.CHAT, "$evt1", "message", "hello there", NOW.minus(Duration.ofHours(2)), false);
        StoreFixtures.seed(store, Source.CHAT, "$old", "message", "long ago", NOW.minus(Duration.ofDays(30)), false);

        String signature = Post.signatureOf(Set.of(release.id()));
        Post microblog = store.acquirePost(signature, Set.of(release.id()), Destination.MICROBLOG_A, CycleType.DAILY,
                NOW.minus(Duration.ofHours(1)));
        store.recordAttempt(microblog.id(), PostStatus.SUCCEEDED, NOW.minus(Duration.ofHours(1)), "https://social/1", null);
        Post other = store.acquirePost(signature, Set.of(release.id()), Destination.MICROBLOG_B, CycleType.DAILY,
                NOW.minus(Duration.ofHours(1)));
        store.recordAttempt(other.id(), PostStatus.FAILED_RETRYABLE, NOW.minus(Duration.ofHours(1)), null, "timeout");

        Path dir = Files.createTempDirectory("stats-test");
        JsonlEventStore events = new JsonlEventStore(dir.resolve("events.jsonl"));
        events.append(new AlertRaised(NOW.minus(Duration.ofDays(20)), "collector", "too old", Map.of()));
        events.append(new AlertRaised(NOW.minus(Duration.ofHours(4)), "summarizer", "unavailable", Map.of()));

        PostingStats stats = PostingStats.collect(store, events, NOW.minus(Duration.ofDays(7)), NOW);

        assertEquals(2, stats.totalPosts());
        assertEquals(1, stats.postsByDestination().get(Destination.MICROBLOG_A));
        assertEquals(1, stats.postsByStatus().get(PostStatus.SUCCEEDED));
        assertEquals(1, stats.postsByStatus().get(PostStatus.FAILED_RETRYABLE));
        assertEquals(2, stats.postsByCycleType().get(CycleType.DAILY));
        assertEquals(1, stats.activitiesBySource().get(Source.CHAT));
        assertEquals(1, stats.activitiesBySource().get(Source.REPOSITORY));
        assertEquals(1, stats.newsworthyActivities());
        assertEquals(1, stats.alerts());
    }

    @Test
    void rendersEveryDestinationEvenWithoutPosts() throws Exception {
        Path dir = Files.createTempDirectory("stats-test");
        PostingStats stats = PostingStats.collect(
                new InMemoryActivityStore(),
                new JsonlEventStore(dir.resolve("events.jsonl")),
                NOW.minus(Duration.ofDays(7)),
                NOW
        );

        String rendered = stats.render();
        assertTrue(rendered.contains("Posts: 0"));
        assertTrue(rendered.contains("  BLOG: 0"));
        assertTrue(rendered.contains("Weekly posts: 0"));
        assertTrue(rendered.contains("Alerts: 0"));
    }
}
