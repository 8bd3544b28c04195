package com.projectpulse.collectors.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.projectpulse.collectors.api.CollectorContext;
import com.projectpulse.core.util.JsonUtils;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * GETs a JSON document with the context's client and timeout.
 */
public final class JsonFetcher {
    private JsonFetcher() {
    }

    public static CompletableFuture<JsonNode> get(CollectorContext ctx, String url, Map<String, String> headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                .GET()
                .timeout(ctx.requestTimeout())
                .header("Accept", "application/json");
        headers.forEach(builder::header);

        return ctx.httpClient().sendAsync(builder.build(), HttpResponse.BodyHandlers.ofString())
                .orTimeout(ctx.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(response -> {
                    if (response.statusCode() >= 400) {
                        throw new CompletionException(new IllegalStateException(
                                "HTTP status " + response.statusCode() + " from " + url));
                    }
                    try {
                        return JsonUtils.objectMapper().readTree(response.body());
                    } catch (JsonProcessingException e) {
                        throw new CompletionException(new IllegalStateException("Invalid JSON from " + url, e));
                    }
                });
    }

    public static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static String rootMessage(Throwable throwable) {
        Throwable root = rootCause(throwable);
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
