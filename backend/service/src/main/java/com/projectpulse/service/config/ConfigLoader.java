package com.projectpulse.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.projectpulse.collectors.config.FilterConfig;
import com.projectpulse.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public final class ConfigLoader {
    private ConfigLoader() {
    }

    /**
     * Reads every config file and injects secrets. Paths default to {@code config/}, {@code state/pulse.json} and
     * {@code logs/events.jsonl} relative to the working directory.
     */
    public static PulseConfig load(Map<String, String> env) {
        Path configDir = Path.of(env.getOrDefault("PULSE_CONFIG_DIR", "config"));
        Path stateFile = Path.of(env.getOrDefault("PULSE_STATE_FILE", "state/pulse.json"));
        Path eventLog = Path.of(env.getOrDefault("PULSE_EVENT_LOG", "logs/events.jsonl"));
        Secrets secrets = Secrets.fromEnvironment(env);

        return new PulseConfig(
                configDir,
                stateFile,
                eventLog,
                loadCollectors(configDir),
                withSecrets(loadSources(configDir), secrets),
                loadFilter(configDir),
                loadSchedule(configDir),
                loadDestinations(configDir),
                secrets
        );
    }

    public static List<CollectorConfig> loadCollectors(Path configDir) {
        return read(configDir.resolve("collectors.json"), new TypeReference<>() {
        });
    }

    public static SourcesConfig loadSources(Path configDir) {
        return read(configDir.resolve("sources.json"), new TypeReference<>() {
        });
    }

    public static FilterConfig loadFilter(Path configDir) {
        return read(configDir.resolve("filter.json"), new TypeReference<>() {
        });
    }

    public static ScheduleConfig loadSchedule(Path configDir) {
        ScheduleConfig config = read(configDir.resolve("schedule.json"), new TypeReference<>() {
        });
        try {
            config.zoneId();
        } catch (RuntimeException e) {
            throw new IllegalStateException("Invalid zone '" + config.zone() + "' in " + configDir.resolve("schedule.json"), e);
        }
        return config;
    }

    public static DestinationsConfig loadDestinations(Path configDir) {
        return read(configDir.resolve("destinations.json"), new TypeReference<>() {
        });
    }

    private static SourcesConfig withSecrets(SourcesConfig sources, Secrets secrets) {
        return new SourcesConfig(
                sources.chat() == null ? null : sources.chat().withAccessToken(secrets.chatAccessToken()),
                sources.repository() == null ? null : sources.repository().withToken(secrets.repositoryToken()),
                sources.statistics(),
                sources.requestTimeoutSeconds()
        );
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        T value;
        try (InputStream in = Files.newInputStream(path)) {
            value = JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
        if (value == null) {
            throw new IllegalStateException("Empty config in " + path);
        }
        return value;
    }
}
