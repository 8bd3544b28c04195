package com.projectpulse.collectors.config;

import java.util.List;

/**
 * Thresholds of the newsworthiness rules, one block per source.
 */
public record FilterConfig(Chat chat, Repository repository, Statistics statistics) {
    public FilterConfig {
        chat = chat == null ? Chat.defaults() : chat;
        repository = repository == null ? Repository.defaults() : repository;
        statistics = statistics == null ? Statistics.defaults() : statistics;
    }

    public static FilterConfig defaults() {
        return new FilterConfig(null, null, null);
    }

    /**
     * @param keywords when non-empty, a message must mention one of them
     */
    public record Chat(int minLength, List<String> noisePatterns, List<String> keywords) {
        public Chat {
            noisePatterns = noisePatterns == null ? List.of() : List.copyOf(noisePatterns);
            keywords = keywords == null ? List.of() : List.copyOf(keywords);
        }

        public static Chat defaults() {
            return new Chat(20, List.of("^\\+1$", "^(thanks|thank you|thx)[.!]*$", "^(lol|ok|okay)[.!]*$"), List.of());
        }
    }

    public record Repository(List<String> ignoredKinds, int minPushCommits) {
        public Repository {
            ignoredKinds = ignoredKinds == null ? List.of() : List.copyOf(ignoredKinds);
        }

        public static Repository defaults() {
            return new Repository(List.of(), 1);
        }
    }

    /**
     * @param trackedMetrics metric names to compare; empty means every metric of the snapshot
     */
    public record Statistics(List<String> trackedMetrics, double relativeThreshold) {
        public Statistics {
            trackedMetrics = trackedMetrics == null ? List.of() : List.copyOf(trackedMetrics);
        }

        public static Statistics defaults() {
            return new Statistics(List.of(), 0.05);
        }
    }
}
