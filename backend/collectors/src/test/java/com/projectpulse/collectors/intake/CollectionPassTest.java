package com.projectpulse.collectors.intake;

import com.projectpulse.collectors.api.CollectorContext;
import com.projectpulse.collectors.api.CollectorResult;
import com.projectpulse.collectors.config.FilterConfig;
import com.projectpulse.collectors.support.EventCapture;
import com.projectpulse.collectors.support.MutableClock;
import com.projectpulse.collectors.support.ScriptedCollector;
import com.projectpulse.collectors.support.TestContexts;
import com.projectpulse.core.bus.EventBus;
import com.projectpulse.core.events.ActivityAdmitted;
import com.projectpulse.core.events.AlertRaised;
import com.projectpulse.core.events.CollectorTickCompleted;
import com.projectpulse.core.events.CollectorTickStarted;
import com.projectpulse.core.model.ActivityPayload;
import com.projectpulse.core.model.RawActivity;
import com.projectpulse.core.model.Source;
import com.projectpulse.core.store.InMemoryActivityStore;
import com.projectpulse.core.store.StoreSnapshot;
import com.projectpulse.core.store.StoreUnavailableException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CollectionPassTest {
    private static final Instant NOW = Instant.parse("2026-02-09T20:00:00Z");
    private static final Instant SINCE = NOW.minusSeconds(3600);

    private final EventBus bus = TestContexts.strictBus();
    private final EventCapture capture = new EventCapture(bus);
    private final CollectorContext context = TestContexts.context(bus, new MutableClock(NOW, ZoneOffset.UTC), Map.of());

    @Test
    void failingCollectorDoesNotBlockTheOthers() {
        InMemoryActivityStore store = new InMemoryActivityStore();
        ScriptedCollector chat = ScriptedCollector.returning("chat", Source.CHAT, List.of(
                chat("$1", "The new plugin loader landed on main today"),
                chat("$2", "ok")
        ));
        ScriptedCollector repo = ScriptedCollector.failing("repo", Source.REPOSITORY, new IllegalStateException("HTTP status 502"));

        List<CollectorResult> results = pass(store, chat, repo).run(SINCE);

        Map<String, CollectorResult> byName = results.stream().collect(Collectors.toMap(CollectorResult::collector, Function.identity()));
        assertTrue(byName.get("chat").success());
        assertEquals(2, byName.get("chat").stat("admitted"));
        assertEquals(1, byName.get("chat").stat("newsworthy"));
        assertFalse(byName.get("repo").success());
        assertTrue(byName.get("repo").message().contains("HTTP status 502"));
        assertEquals(List.of(SINCE), chat.sinceValues());

        assertEquals(2, capture.byType(CollectorTickStarted.class).size());
        assertEquals(2, capture.byType(CollectorTickCompleted.class).size());
        assertEquals(2, capture.byType(ActivityAdmitted.class).size());
        List<AlertRaised> alerts = capture.byType(AlertRaised.class);
        assertEquals(1, alerts.size());
        assertEquals("collector", alerts.get(0).category());
        assertEquals(2, store.activitiesObservedBetween(null, null).size());
    }

    @Test
    void secondRunOnlyCountsDuplicates() {
        InMemoryActivityStore store = new InMemoryActivityStore();
        ScriptedCollector chat = ScriptedCollector.returning("chat", Source.CHAT, List.of(
                chat("$1", "The new plugin loader landed on main today")
        ));
        CollectionPass pass = pass(store, chat);

        pass.run(SINCE);
        CollectorResult second = pass.run(SINCE).get(0);

        assertEquals(0, second.stat("admitted"));
        assertEquals(1, second.stat("duplicates"));
        assertEquals(1, capture.byType(ActivityAdmitted.class).size());
    }

    @Test
    void collectorThrowingSynchronouslyIsReportedAsFailure() {
        ScriptedCollector broken = new ScriptedCollector("broken", Source.STATISTICS, () -> {
            throw new IllegalArgumentException("Missing required config key: statisticsCollector");
        });

        List<CollectorResult> results = pass(new InMemoryActivityStore(), broken).run(SINCE);

        assertFalse(results.get(0).success());
        assertTrue(results.get(0).message().contains("Missing required config key"));
    }

    @Test
    void classificationFailureRaisesAlertAndKeepsActivityPending() {
        InMemoryActivityStore store = new InMemoryActivityStore();
        ContentFilter broken = new ContentFilter(store, FilterConfig.defaults()) {
            @Override
            boolean evaluate(com.projectpulse.core.model.Activity activity) {
                throw new IllegalStateException("rule exploded");
            }
        };
        ScriptedCollector chat = ScriptedCollector.returning("chat", Source.CHAT, List.of(
                chat("$1", "The new plugin loader landed on main today")
        ));
        CollectionPass pass = new CollectionPass(List.of(chat), context, new Deduplicator(store), broken);

        CollectorResult result = pass.run(SINCE).get(0);

        assertTrue(result.success());
        assertEquals(1, result.stat("classificationFailures"));
        assertEquals(1, store.unclassifiedActivities().size());
        assertEquals("classification", capture.byType(AlertRaised.class).get(0).category());

        new CollectionPass(List.of(), context, new Deduplicator(store), new ContentFilter(store, FilterConfig.defaults()))
                .run(SINCE);
        assertTrue(store.unclassifiedActivities().isEmpty());
    }

    @Test
    void storeFailureAbortsThePass() {
        InMemoryActivityStore failing = new InMemoryActivityStore() {
            @Override
            protected void persist(StoreSnapshot snapshot) {
                throw new StoreUnavailableException("disk gone", new IOException("EIO"));
            }
        };
        ScriptedCollector chat = ScriptedCollector.returning("chat", Source.CHAT, List.of(chat("$1", "anything at all here")));

        assertThrows(StoreUnavailableException.class, () -> pass(failing, chat).run(SINCE));
        assertTrue(failing.activitiesObservedBetween(null, null).isEmpty());
    }

    private CollectionPass pass(InMemoryActivityStore store, ScriptedCollector... collectors) {
        return new CollectionPass(List.of(collectors), context, new Deduplicator(store), new ContentFilter(store, FilterConfig.defaults()));
    }

    private static RawActivity chat(String id, String text) {
        return new RawActivity(Source.CHAT, id, NOW, ActivityPayload.of("@alice:example.org", text, null, "message"));
    }
}
