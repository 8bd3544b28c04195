package com.projectpulse.service.config;

import java.util.List;

/**
 * Publisher endpoints, blog location, summarizer and hashtags ({@code destinations.json}).
 */
public record DestinationsConfig(
        Microblog microblogA,
        Microblog microblogB,
        Blog blog,
        SummarizerSettings summarizer,
        Format format,
        int requestTimeoutSeconds
) {
    public DestinationsConfig {
        format = format == null ? new Format(null, null) : format;
        summarizer = summarizer == null ? new SummarizerSettings(false, null, null, 0, null) : summarizer;
        requestTimeoutSeconds = requestTimeoutSeconds <= 0 ? 15 : requestTimeoutSeconds;
    }

    /**
     * @param service {@code mastodon} or {@code x}
     */
    public record Microblog(boolean enabled, String service, String url) {
    }

    public record Blog(boolean enabled, String postsDirectory, String siteUrl, String author) {
    }

    public record SummarizerSettings(boolean enabled, String apiUrl, String model, int maxTokens, String projectName) {
        public SummarizerSettings {
            apiUrl = apiUrl == null || apiUrl.isBlank() ? "https://api.anthropic.com" : apiUrl;
            projectName = projectName == null || projectName.isBlank() ? "the project" : projectName;
        }
    }

    public record Format(String projectHashtag, List<String> extraHashtags) {
        public Format {
            extraHashtags = extraHashtags == null ? List.of() : List.copyOf(extraHashtags);
        }
    }
}
