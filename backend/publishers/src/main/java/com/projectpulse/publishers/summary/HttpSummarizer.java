package com.projectpulse.publishers.summary;

import com.fasterxml.jackson.databind.JsonNode;
import com.projectpulse.core.model.Activity;
import com.projectpulse.core.model.ActivityPayload;
import com.projectpulse.core.util.JsonUtils;
import com.projectpulse.core.util.TextUtils;
import com.projectpulse.publishers.api.Summarizer;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Asks a text-generation API (Anthropic Messages format) to write the weekly blog post.
 */
public class HttpSummarizer implements Summarizer {
    private static final Logger LOGGER = Logger.getLogger(HttpSummarizer.class.getName());
    private static final String API_VERSION = "2023-06-01";
    private static final DateTimeFormatter ACTIVITY_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final HttpClient httpClient;
    private final Duration timeout;
    private final String apiUrl;
    private final String apiKey;
    private final String model;
    private final int maxTokens;
    private final String projectName;
    private final ZoneId zone;

    public HttpSummarizer(
            HttpClient httpClient,
            Duration timeout,
            String apiUrl,
            String apiKey,
            String model,
            int maxTokens,
            String projectName,
            ZoneId zone
    ) {
        this.httpClient = httpClient;
        this.timeout = timeout;
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.model = model;
        this.maxTokens = maxTokens <= 0 ? 2000 : maxTokens;
        this.projectName = projectName;
        this.zone = zone;
    }

    @Override
    public String summarize(List<Activity> activities) {
        if (apiKey.isEmpty()) {
            throw new IllegalStateException("No summarizer API key configured");
        }
        String requestBody;
        try {
            requestBody = JsonUtils.objectMapper().writeValueAsString(Map.of(
                    "model", model,
                    "max_tokens", maxTokens,
                    "messages", List.of(Map.of("role", "user", "content", prompt(activities)))
            ));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to encode summarizer request", e);
        }
        HttpRequest request = HttpRequest.newBuilder(URI.create(apiUrl + "/v1/messages"))
                .timeout(timeout)
                .header("x-api-key", apiKey)
                .header("anthropic-version", API_VERSION)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new IllegalStateException("Summarizer request failed with status " + response.statusCode());
            }
            JsonNode root = JsonUtils.objectMapper().readTree(response.body());
            StringBuilder text = new StringBuilder();
            for (JsonNode block : root.path("content")) {
                if ("text".equals(block.path("type").asText())) {
                    text.append(block.path("text").asText(""));
                }
            }
            if (text.toString().isBlank()) {
                throw new IllegalStateException("Summarizer returned no text");
            }
            LOGGER.info(() -> "Generated weekly summary (" + text.length() + " characters)");
            return text.toString().strip();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Summarizer request interrupted", e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Summarizer request failed", e);
        }
    }

    String prompt(List<Activity> activities) {
        String lines = activities.stream().map(this::describe).collect(Collectors.joining("\n"));
        return "You are writing the weekly summary blog post for " + projectName + ".\n\n"
                + "Here are this week's activities, one per line:\n\n"
                + lines + "\n\n"
                + "Write a Markdown blog post whose first line is a '# ' title. Group related activities, "
                + "highlight releases and notable development progress, and keep a friendly, community-focused tone.";
    }

    private String describe(Activity activity) {
        ActivityPayload payload = activity.payload();
        StringBuilder line = new StringBuilder()
                .append("Source: ").append(activity.source())
                .append(" | Kind: ").append(payload.kind())
                .append(" | Summary: ").append(TextUtils.truncate(TextUtils.collapseWhitespace(payload.summary()), 200))
                .append(" | Author: ").append(payload.actor() == null ? "Unknown" : payload.actor())
                .append(" | Date: ").append(ACTIVITY_TIME.format(activity.observedAt().atZone(zone)));
        if (payload.link() != null) {
            line.append(" | URL: ").append(payload.link());
        }
        return line.toString();
    }
}
