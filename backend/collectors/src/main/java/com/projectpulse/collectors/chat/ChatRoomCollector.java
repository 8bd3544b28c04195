package com.projectpulse.collectors.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.projectpulse.collectors.api.Collector;
import com.projectpulse.collectors.api.CollectorContext;
import com.projectpulse.collectors.config.ChatCollectorConfig;
import com.projectpulse.collectors.http.JsonFetcher;
import com.projectpulse.core.model.ActivityPayload;
import com.projectpulse.core.model.RawActivity;
import com.projectpulse.core.model.Source;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Reads the most recent text messages of one Matrix room through the client-server API.
 */
public class ChatRoomCollector implements Collector {
    public static final String CONFIG_KEY = "chatCollector";

    @Override
    public String name() {
        return "chatCollector";
    }

    @Override
    public Source source() {
        return Source.CHAT;
    }

    @Override
    public CompletableFuture<List<RawActivity>> collect(CollectorContext ctx, Instant since) {
        ChatCollectorConfig cfg = ctx.requiredConfig(CONFIG_KEY, ChatCollectorConfig.class);
        String url = stripTrailingSlash(cfg.homeserver())
                + "/_matrix/client/v3/rooms/" + encode(cfg.roomId())
                + "/messages?dir=b&limit=" + Math.max(1, cfg.limit());
        Map<String, String> headers = new HashMap<>();
        if (cfg.accessToken() != null && !cfg.accessToken().isBlank()) {
            headers.put("Authorization", "Bearer " + cfg.accessToken());
        }
        return JsonFetcher.get(ctx, url, headers)
                .thenApply(body -> toActivities(body, cfg, ctx.clock().instant(), since));
    }

    List<RawActivity> toActivities(JsonNode body, ChatCollectorConfig cfg, Instant observedAt, Instant since) {
        List<RawActivity> activities = new ArrayList<>();
        for (JsonNode event : body.path("chunk")) {
            if (!"m.room.message".equals(event.path("type").asText())) {
                continue;
            }
            String text = event.path("content").path("body").asText("");
            String eventId = event.path("event_id").asText("");
            if (text.isBlank() || eventId.isBlank()) {
                continue;
            }
            Instant sentAt = Instant.ofEpochMilli(event.path("origin_server_ts").asLong(0));
            if (since != null && sentAt.isBefore(since)) {
                continue;
            }
            ActivityPayload payload = new ActivityPayload(
                    event.path("sender").asText(null),
                    text,
                    "https://matrix.to/#/" + cfg.roomId() + "/" + eventId,
                    "message",
                    null,
                    null,
                    sentAt,
                    Map.of()
            );
            activities.add(new RawActivity(Source.CHAT, eventId, observedAt, payload));
        }
        return activities;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
