package com.projectpulse.publishers.mastodon;

import com.fasterxml.jackson.databind.JsonNode;
import com.projectpulse.core.model.Destination;
import com.projectpulse.core.util.HashingUtils;
import com.projectpulse.publishers.api.PermanentPublishException;
import com.projectpulse.publishers.api.PublishException;
import com.projectpulse.publishers.api.PublishOutcome;
import com.projectpulse.publishers.api.Publisher;
import com.projectpulse.publishers.http.PublishHttp;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Posts public statuses to a Mastodon instance.
 */
public class MastodonPublisher implements Publisher {
    private static final Logger LOGGER = Logger.getLogger(MastodonPublisher.class.getName());

    private final HttpClient httpClient;
    private final Duration timeout;
    private final Destination destination;
    private final String instanceUrl;
    private final String accessToken;

    public MastodonPublisher(HttpClient httpClient, Duration timeout, Destination destination, String instanceUrl, String accessToken) {
        this.httpClient = httpClient;
        this.timeout = timeout;
        this.destination = destination;
        this.instanceUrl = instanceUrl.endsWith("/") ? instanceUrl.substring(0, instanceUrl.length() - 1) : instanceUrl;
        this.accessToken = accessToken == null ? "" : accessToken.trim();
    }

    @Override
    public String name() {
        return "mastodon";
    }

    @Override
    public Destination destination() {
        return destination;
    }

    @Override
    public PublishOutcome publish(String content) throws PublishException {
        requireToken();
        HttpRequest request = HttpRequest.newBuilder(URI.create(instanceUrl + "/api/v1/statuses"))
                .timeout(timeout)
                .header("Authorization", "Bearer " + accessToken)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                // the instance collapses repeated submissions of the same text into one status
                .header("Idempotency-Key", HashingUtils.sha256(content))
                .POST(HttpRequest.BodyPublishers.ofString(PublishHttp.toJson(Map.of("status", content, "visibility", "public"))))
                .build();
        HttpResponse<String> response = PublishHttp.send(httpClient, request, name());
        JsonNode status = PublishHttp.readAccepted(response.body(), name());
        String id = status.path("id").asText("");
        if (id.isBlank()) {
            LOGGER.warning("Mastodon accepted the status with HTTP " + response.statusCode() + " but returned no id");
            return PublishOutcome.published(null);
        }
        String url = status.path("url").asText("");
        LOGGER.info(() -> "Posted status " + id + " to " + instanceUrl);
        return PublishOutcome.published(url.isBlank() ? id : url);
    }

    @Override
    public void checkConnection() throws PublishException {
        requireToken();
        HttpRequest request = HttpRequest.newBuilder(URI.create(instanceUrl + "/api/v1/accounts/verify_credentials"))
                .timeout(timeout)
                .header("Authorization", "Bearer " + accessToken)
                .header("Accept", "application/json")
                .GET()
                .build();
        JsonNode account = PublishHttp.readJson(PublishHttp.send(httpClient, request, name()).body(), name());
        LOGGER.info(() -> "Connected to " + instanceUrl + " as @" + account.path("username").asText("?"));
    }

    private void requireToken() throws PermanentPublishException {
        if (accessToken.isEmpty()) {
            throw new PermanentPublishException("No access token configured for " + name());
        }
    }
}
