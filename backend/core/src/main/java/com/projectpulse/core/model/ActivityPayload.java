package com.projectpulse.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Normalized fields needed to format an activity.
 *
 * @param kind          source-specific event kind, e.g. {@code message}, {@code push}, {@code comment}, {@code snapshot}
 * @param branch        branch an event refers to, when it refers to one
 * @param defaultBranch default branch of the repository the event belongs to
 * @param occurredAt    original event time as reported by the source
 * @param metrics       numeric values such as commit counts or statistics
 */
public record ActivityPayload(
        String actor,
        String summary,
        String link,
        String kind,
        String branch,
        String defaultBranch,
        Instant occurredAt,
        Map<String, Double> metrics
) {
    public ActivityPayload {
        summary = summary == null ? "" : summary;
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    public static ActivityPayload of(String actor, String summary, String link, String kind) {
        return new ActivityPayload(actor, summary, link, kind, null, null, null, Map.of());
    }

    public String contentText() {
        StringJoiner joiner = new StringJoiner(" ");
        if (actor != null) {
            joiner.add(actor);
        }
        joiner.add(summary);
        if (link != null) {
            joiner.add(link);
        }
        return joiner.toString();
    }

    public Double metric(String name) {
        return metrics.get(name);
    }
}
