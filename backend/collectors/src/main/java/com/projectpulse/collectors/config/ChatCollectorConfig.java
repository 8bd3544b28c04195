package com.projectpulse.collectors.config;

/**
 * Matrix room to read. The access token is injected from the environment, never from the config file.
 */
public record ChatCollectorConfig(String homeserver, String roomId, String accessToken, int limit) {
    public ChatCollectorConfig withAccessToken(String token) {
        return new ChatCollectorConfig(homeserver, roomId, token, limit);
    }
}
