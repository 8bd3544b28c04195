package com.projectpulse.collectors.statistics;

import com.fasterxml.jackson.databind.JsonNode;
import com.projectpulse.collectors.api.Collector;
import com.projectpulse.collectors.api.CollectorContext;
import com.projectpulse.collectors.config.StatisticsCollectorConfig;
import com.projectpulse.collectors.http.JsonFetcher;
import com.projectpulse.core.model.ActivityPayload;
import com.projectpulse.core.model.RawActivity;
import com.projectpulse.core.model.Source;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Takes one snapshot of a JSON statistics endpoint per local day. Nested numeric fields become dot-separated
 * metric names; everything else is ignored.
 */
public class StatisticsCollector implements Collector {
    public static final String CONFIG_KEY = "statisticsCollector";

    @Override
    public String name() {
        return "statisticsCollector";
    }

    @Override
    public Source source() {
        return Source.STATISTICS;
    }

    @Override
    public CompletableFuture<List<RawActivity>> collect(CollectorContext ctx, Instant since) {
        StatisticsCollectorConfig cfg = ctx.requiredConfig(CONFIG_KEY, StatisticsCollectorConfig.class);
        return JsonFetcher.get(ctx, cfg.url(), Map.of())
                .thenApply(body -> List.of(toActivity(body, cfg, ctx.clock().instant())));
    }

    RawActivity toActivity(JsonNode body, StatisticsCollectorConfig cfg, Instant observedAt) {
        Map<String, Double> metrics = new TreeMap<>();
        flatten("", body, metrics);
        if (metrics.isEmpty()) {
            throw new IllegalStateException("Statistics response from " + cfg.url() + " has no numeric fields");
        }
        ZoneId zone = cfg.zone() == null || cfg.zone().isBlank() ? ZoneId.of("UTC") : ZoneId.of(cfg.zone());
        LocalDate day = LocalDate.ofInstant(observedAt, zone);
        String summary = metrics.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + formatNumber(entry.getValue()))
                .collect(Collectors.joining(", "));
        ActivityPayload payload = new ActivityPayload(
                null,
                "usage statistics for " + day + ": " + summary,
                null,
                "snapshot",
                null,
                null,
                observedAt,
                metrics
        );
        return new RawActivity(Source.STATISTICS, "stats-" + day, observedAt, payload);
    }

    static void flatten(String prefix, JsonNode node, Map<String, Double> out) {
        if (node.isNumber()) {
            if (!prefix.isEmpty()) {
                out.put(prefix, node.asDouble());
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = prefix.isEmpty() ? field.getKey() : prefix + "." + field.getKey();
            flatten(key, field.getValue(), out);
        }
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
