package com.projectpulse.service.config;

import com.projectpulse.collectors.config.ChatCollectorConfig;
import com.projectpulse.collectors.config.RepositoryCollectorConfig;
import com.projectpulse.collectors.config.StatisticsCollectorConfig;

/**
 * Endpoints of the activity sources ({@code sources.json}). Tokens are filled in from the environment.
 */
public record SourcesConfig(
        ChatCollectorConfig chat,
        RepositoryCollectorConfig repository,
        StatisticsCollectorConfig statistics,
        int requestTimeoutSeconds
) {
    public SourcesConfig {
        requestTimeoutSeconds = requestTimeoutSeconds <= 0 ? 10 : requestTimeoutSeconds;
    }
}
