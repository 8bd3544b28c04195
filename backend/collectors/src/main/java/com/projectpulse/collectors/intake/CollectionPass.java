package com.projectpulse.collectors.intake;

import com.projectpulse.collectors.api.Collector;
import com.projectpulse.collectors.api.CollectorContext;
import com.projectpulse.collectors.api.CollectorResult;
import com.projectpulse.collectors.http.JsonFetcher;
import com.projectpulse.core.events.ActivityAdmitted;
import com.projectpulse.core.events.AlertRaised;
import com.projectpulse.core.events.CollectorTickCompleted;
import com.projectpulse.core.events.CollectorTickStarted;
import com.projectpulse.core.model.Activity;
import com.projectpulse.core.model.Admission;
import com.projectpulse.core.model.RawActivity;
import com.projectpulse.core.store.StoreUnavailableException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One collection run: every collector is polled concurrently, each raw activity is admitted and newly stored
 * ones are classified. A failing collector is reported in its own result and never affects the others.
 */
public class CollectionPass {
    private static final Logger LOGGER = Logger.getLogger(CollectionPass.class.getName());

    private final List<Collector> collectors;
    private final CollectorContext context;
    private final Deduplicator deduplicator;
    private final ContentFilter filter;

    public CollectionPass(List<Collector> collectors, CollectorContext context, Deduplicator deduplicator, ContentFilter filter) {
        this.collectors = List.copyOf(collectors);
        this.context = context;
        this.deduplicator = deduplicator;
        this.filter = filter;
    }

    /**
     * @throws StoreUnavailableException when the store fails; remaining collectors are still awaited
     */
    public List<CollectorResult> run(Instant since) {
        ContentFilter.Reclassification pending = filter.reclassifyPending();
        pending.failures().forEach(this::raiseClassificationAlert);
        if (!pending.classified().isEmpty()) {
            LOGGER.info(() -> "Reclassified " + pending.classified().size() + " pending activities");
        }

        List<CompletableFuture<CollectorResult>> tasks = new ArrayList<>();
        for (Collector collector : collectors) {
            tasks.add(runCollector(collector, since));
        }
        CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new)).exceptionally(ignored -> null).join();

        List<CollectorResult> results = new ArrayList<>();
        for (CompletableFuture<CollectorResult> task : tasks) {
            try {
                results.add(task.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof StoreUnavailableException storeFailure) {
                    throw storeFailure;
                }
                throw e;
            }
        }
        return results;
    }

    private CompletableFuture<CollectorResult> runCollector(Collector collector, Instant since) {
        Instant startedAt = context.clock().instant();
        context.eventBus().publish(new CollectorTickStarted(startedAt, collector.name(), since));

        CompletableFuture<List<RawActivity>> fetch;
        try {
            fetch = collector.collect(context, since);
        } catch (RuntimeException e) {
            fetch = CompletableFuture.failedFuture(e);
        }

        return fetch.handle((batch, error) -> {
            long durationMillis = Duration.between(startedAt, context.clock().instant()).toMillis();
            if (error != null) {
                String message = "Collector " + collector.name() + " failed: " + JsonFetcher.rootMessage(error);
                LOGGER.log(Level.WARNING, message, error);
                context.eventBus().publish(new AlertRaised(
                        context.clock().instant(),
                        "collector",
                        message,
                        Map.of("collector", collector.name(), "source", collector.source().name())
                ));
                context.eventBus().publish(new CollectorTickCompleted(
                        context.clock().instant(), collector.name(), false, 0, 0, durationMillis));
                return CollectorResult.failure(collector.name(), message, Map.of("collected", 0, "admitted", 0));
            }
            CollectorResult result = ingest(collector, batch);
            context.eventBus().publish(new CollectorTickCompleted(
                    context.clock().instant(),
                    collector.name(),
                    true,
                    result.stat("collected"),
                    result.stat("admitted"),
                    Duration.between(startedAt, context.clock().instant()).toMillis()
            ));
            return result;
        });
    }

    private CollectorResult ingest(Collector collector, List<RawActivity> batch) {
        int admitted = 0;
        int duplicates = 0;
        int newsworthy = 0;
        int classificationFailures = 0;
        for (RawActivity raw : batch) {
            Admission admission = deduplicator.admit(raw);
            if (admission.duplicate()) {
                duplicates++;
                continue;
            }
            admitted++;
            Activity activity = admission.activity();
            try {
                activity = filter.classify(activity);
                if (activity.markedNewsworthy()) {
                    newsworthy++;
                }
            } catch (ClassificationException e) {
                classificationFailures++;
                LOGGER.log(Level.WARNING, e.getMessage(), e);
                raiseClassificationAlert(e);
            }
            context.eventBus().publish(new ActivityAdmitted(
                    context.clock().instant(),
                    activity.id(),
                    activity.source(),
                    activity.fingerprint().key(),
                    activity.newsworthy()
            ));
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("collected", batch.size());
        stats.put("admitted", admitted);
        stats.put("duplicates", duplicates);
        stats.put("newsworthy", newsworthy);
        stats.put("classificationFailures", classificationFailures);
        String message = collector.name() + ": " + batch.size() + " collected, " + admitted + " admitted, "
                + newsworthy + " newsworthy";
        LOGGER.info(message);
        return CollectorResult.success(collector.name(), message, stats);
    }

    private void raiseClassificationAlert(ClassificationException failure) {
        context.eventBus().publish(new AlertRaised(
                context.clock().instant(),
                "classification",
                failure.getMessage(),
                Map.of("activityId", failure.activityId())
        ));
    }
}
