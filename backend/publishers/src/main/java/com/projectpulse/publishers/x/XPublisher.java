package com.projectpulse.publishers.x;

import com.fasterxml.jackson.databind.JsonNode;
import com.projectpulse.core.model.Destination;
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
 * Creates posts through the X API v2 with an OAuth 2.0 user access token.
 */
public class XPublisher implements Publisher {
    private static final Logger LOGGER = Logger.getLogger(XPublisher.class.getName());

    private final HttpClient httpClient;
    private final Duration timeout;
    private final Destination destination;
    private final String apiUrl;
    private final String accessToken;

    public XPublisher(HttpClient httpClient, Duration timeout, Destination destination, String apiUrl, String accessToken) {
        this.httpClient = httpClient;
        this.timeout = timeout;
        this.destination = destination;
        String base = apiUrl == null || apiUrl.isBlank() ? "https://api.x.com" : apiUrl;
        this.apiUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        this.accessToken = accessToken == null ? "" : accessToken.trim();
    }

    @Override
    public String name() {
        return "x";
    }

    @Override
    public Destination destination() {
        return destination;
    }

    @Override
    public PublishOutcome publish(String content) throws PublishException {
        requireToken();
        HttpRequest request = HttpRequest.newBuilder(URI.create(apiUrl + "/2/tweets"))
                .timeout(timeout)
                .header("Authorization", "Bearer " + accessToken)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(PublishHttp.toJson(Map.of("text", content))))
                .build();
        HttpResponse<String> response = PublishHttp.send(httpClient, request, name());
        String id = PublishHttp.readAccepted(response.body(), name()).path("data").path("id").asText("");
        if (id.isBlank()) {
            LOGGER.warning("X accepted the post with HTTP " + response.statusCode() + " but returned no post id");
            return PublishOutcome.published(null);
        }
        LOGGER.info(() -> "Posted " + id + " to X");
        return PublishOutcome.published("https://x.com/i/web/status/" + id);
    }

    @Override
    public void checkConnection() throws PublishException {
        requireToken();
        HttpRequest request = HttpRequest.newBuilder(URI.create(apiUrl + "/2/users/me"))
                .timeout(timeout)
                .header("Authorization", "Bearer " + accessToken)
                .GET()
                .build();
        JsonNode user = PublishHttp.readJson(PublishHttp.send(httpClient, request, name()).body(), name());
        if (user.path("data").path("username").asText("").isBlank()) {
            throw new PermanentPublishException("X API returned no user data");
        }
        LOGGER.info(() -> "Connected to X as @" + user.path("data").path("username").asText());
    }

    private void requireToken() throws PermanentPublishException {
        if (accessToken.isEmpty()) {
            throw new PermanentPublishException("No access token configured for " + name());
        }
    }
}
