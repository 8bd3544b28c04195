package com.projectpulse.publishers.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.projectpulse.core.util.JsonUtils;
import com.projectpulse.publishers.api.ContentTooLongException;
import com.projectpulse.publishers.api.PermanentPublishException;
import com.projectpulse.publishers.api.PublishException;
import com.projectpulse.publishers.api.RetryablePublishException;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Sends one request for a publisher and maps the outcome onto the publish exception hierarchy.
 */
public final class PublishHttp {
    private static final Logger LOGGER = Logger.getLogger(PublishHttp.class.getName());
    private static final Pattern LENGTH_COMPLAINT = Pattern.compile(
            "too long|character limit|exceeds|length",
            Pattern.CASE_INSENSITIVE
    );
    private static final int MAX_ERROR_BODY = 300;

    private PublishHttp() {
    }

    public static HttpResponse<String> send(HttpClient httpClient, HttpRequest request, String target) throws PublishException {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RetryablePublishException(target + " request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryablePublishException(target + " request interrupted", e);
        }
        check(response.statusCode(), response.body(), target);
        return response;
    }

    /**
     * 401 and 403 are permanent; 400 and 422 mentioning length are {@link ContentTooLongException}; any other 4xx
     * is permanent except 429; 429 and everything else outside 2xx is retryable.
     */
    public static void check(int status, String body, String target) throws PublishException {
        if (status >= 200 && status < 300) {
            return;
        }
        String message = target + " returned HTTP " + status + ": " + abbreviate(body);
        if (status == 401 || status == 403) {
            throw new PermanentPublishException(message);
        }
        if ((status == 400 || status == 422) && body != null && LENGTH_COMPLAINT.matcher(body).find()) {
            throw new ContentTooLongException(message);
        }
        if (status == 429) {
            throw new RetryablePublishException(message);
        }
        if (status >= 400 && status < 500) {
            throw new PermanentPublishException(message);
        }
        throw new RetryablePublishException(message);
    }

    public static JsonNode readJson(String body, String target) throws PublishException {
        try {
            return JsonUtils.objectMapper().readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new RetryablePublishException(target + " returned invalid JSON", e);
        }
    }

    /**
     * Parses the body of a response whose request was already accepted. The post exists remotely, so an unreadable
     * body yields a missing node instead of an error that would send the same content again.
     */
    public static JsonNode readAccepted(String body, String target) {
        try {
            JsonNode node = JsonUtils.objectMapper().readTree(body == null ? "" : body);
            return node == null ? MissingNode.getInstance() : node;
        } catch (JsonProcessingException e) {
            LOGGER.warning(target + " accepted the post but returned invalid JSON: " + abbreviate(body));
            return MissingNode.getInstance();
        }
    }

    public static String toJson(Object value) {
        try {
            return JsonUtils.objectMapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode request body", e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        String flat = body.replaceAll("\\s+", " ").trim();
        return flat.length() <= MAX_ERROR_BODY ? flat : flat.substring(0, MAX_ERROR_BODY) + "...";
    }
}
