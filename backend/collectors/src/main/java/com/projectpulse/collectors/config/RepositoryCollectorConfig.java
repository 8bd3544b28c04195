package com.projectpulse.collectors.config;

public record RepositoryCollectorConfig(
        String apiUrl,
        String organization,
        String token,
        String defaultBranch,
        int perPage
) {
    public RepositoryCollectorConfig withToken(String value) {
        return new RepositoryCollectorConfig(apiUrl, organization, value, defaultBranch, perPage);
    }
}
