package com.projectpulse.service.config;

import java.util.Map;

/**
 * Credentials read from the environment. Missing values are empty strings.
 */
public record Secrets(
        String chatAccessToken,
        String repositoryToken,
        String microblogAToken,
        String microblogBToken,
        String summarizerApiKey
) {
    public static Secrets fromEnvironment(Map<String, String> env) {
        return new Secrets(
                env.getOrDefault("CHAT_ACCESS_TOKEN", ""),
                env.getOrDefault("REPOSITORY_TOKEN", ""),
                env.getOrDefault("MICROBLOG_A_TOKEN", ""),
                env.getOrDefault("MICROBLOG_B_TOKEN", ""),
                env.getOrDefault("SUMMARIZER_API_KEY", "")
        );
    }

    @Override
    public String toString() {
        return "Secrets[redacted]";
    }
}
