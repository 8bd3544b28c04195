package com.projectpulse.collectors.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.projectpulse.collectors.api.Collector;
import com.projectpulse.collectors.api.CollectorContext;
import com.projectpulse.collectors.config.RepositoryCollectorConfig;
import com.projectpulse.collectors.http.JsonFetcher;
import com.projectpulse.core.model.ActivityPayload;
import com.projectpulse.core.model.RawActivity;
import com.projectpulse.core.model.Source;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Reads an organisation's public event feed from the GitHub REST API.
 */
public class RepositoryEventCollector implements Collector {
    public static final String CONFIG_KEY = "repositoryCollector";
    private static final Logger LOGGER = Logger.getLogger(RepositoryEventCollector.class.getName());
    private static final String BRANCH_REF_PREFIX = "refs/heads/";

    @Override
    public String name() {
        return "repositoryCollector";
    }

    @Override
    public Source source() {
        return Source.REPOSITORY;
    }

    @Override
    public CompletableFuture<List<RawActivity>> collect(CollectorContext ctx, Instant since) {
        RepositoryCollectorConfig cfg = ctx.requiredConfig(CONFIG_KEY, RepositoryCollectorConfig.class);
        String apiUrl = cfg.apiUrl() == null || cfg.apiUrl().isBlank() ? "https://api.github.com" : cfg.apiUrl();
        if (apiUrl.endsWith("/")) {
            apiUrl = apiUrl.substring(0, apiUrl.length() - 1);
        }
        int perPage = cfg.perPage() <= 0 ? 30 : Math.min(cfg.perPage(), 100);
        String url = apiUrl + "/orgs/" + cfg.organization() + "/events?per_page=" + perPage;

        Map<String, String> headers = new HashMap<>();
        headers.put("X-GitHub-Api-Version", "2022-11-28");
        if (cfg.token() != null && !cfg.token().isBlank()) {
            headers.put("Authorization", "Bearer " + cfg.token());
        }
        return JsonFetcher.get(ctx, url, headers)
                .thenApply(body -> toActivities(body, cfg, ctx.clock().instant(), since));
    }

    List<RawActivity> toActivities(JsonNode body, RepositoryCollectorConfig cfg, Instant observedAt, Instant since) {
        List<RawActivity> activities = new ArrayList<>();
        for (JsonNode event : body) {
            Instant createdAt = parseInstant(event.path("created_at").asText(null));
            if (since != null && createdAt != null && createdAt.isBefore(since)) {
                continue;
            }
            Optional<ActivityPayload> payload = toPayload(event, cfg, createdAt);
            if (payload.isEmpty()) {
                continue;
            }
            activities.add(new RawActivity(Source.REPOSITORY, event.path("id").asText(null), observedAt, payload.get()));
        }
        return activities;
    }

    private Optional<ActivityPayload> toPayload(JsonNode event, RepositoryCollectorConfig cfg, Instant createdAt) {
        String type = event.path("type").asText("");
        String actor = event.path("actor").path("login").asText(null);
        String repo = event.path("repo").path("name").asText("");
        JsonNode payload = event.path("payload");
        String defaultBranch = textOr(payload.path("repository").path("default_branch"), cfg.defaultBranch());

        switch (type) {
            case "PushEvent" -> {
                String branch = stripRef(payload.path("ref").asText(""));
                int commits = payload.path("size").asInt(payload.path("commits").size());
                String summary = "pushed " + commits + (commits == 1 ? " commit" : " commits")
                        + " to " + branch + " in " + repo;
                return Optional.of(new ActivityPayload(actor, summary,
                        "https://github.com/" + repo + "/commits/" + branch,
                        "push", branch, defaultBranch, createdAt, Map.of("commits", (double) commits)));
            }
            case "PullRequestEvent" -> {
                JsonNode pr = payload.path("pull_request");
                String action = payload.path("action").asText("updated");
                if ("closed".equals(action) && pr.path("merged").asBoolean(false)) {
                    action = "merged";
                }
                String summary = action + " pull request #" + pr.path("number").asInt()
                        + " in " + repo + ": " + pr.path("title").asText("");
                return Optional.of(new ActivityPayload(actor, summary, pr.path("html_url").asText(null),
                        "pull_request", pr.path("base").path("ref").asText(null), defaultBranch, createdAt, Map.of()));
            }
            case "IssuesEvent" -> {
                JsonNode issue = payload.path("issue");
                String summary = payload.path("action").asText("updated") + " issue #" + issue.path("number").asInt()
                        + " in " + repo + ": " + issue.path("title").asText("");
                return Optional.of(new ActivityPayload(actor, summary, issue.path("html_url").asText(null),
                        "issue", null, defaultBranch, createdAt, Map.of()));
            }
            case "ReleaseEvent" -> {
                JsonNode release = payload.path("release");
                String name = textOr(release.path("name"), release.path("tag_name").asText(""));
                String summary = "released " + name + " of " + repo;
                return Optional.of(new ActivityPayload(actor, summary, release.path("html_url").asText(null),
                        "release", null, defaultBranch, createdAt, Map.of()));
            }
            case "IssueCommentEvent", "CommitCommentEvent", "PullRequestReviewCommentEvent" -> {
                JsonNode comment = payload.path("comment");
                String branch = "PullRequestReviewCommentEvent".equals(type)
                        ? payload.path("pull_request").path("head").path("ref").asText(null)
                        : defaultBranch;
                String summary = "commented in " + repo + ": " + comment.path("body").asText("");
                return Optional.of(new ActivityPayload(actor, summary, comment.path("html_url").asText(null),
                        "comment", branch, defaultBranch, createdAt, Map.of()));
            }
            default -> {
                LOGGER.fine(() -> "Ignoring repository event type " + type);
                return Optional.empty();
            }
        }
    }

    private static String stripRef(String ref) {
        return ref.startsWith(BRANCH_REF_PREFIX) ? ref.substring(BRANCH_REF_PREFIX.length()) : ref;
    }

    private static String textOr(JsonNode node, String fallback) {
        String value = node.asText("");
        return value.isBlank() ? fallback : value;
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
