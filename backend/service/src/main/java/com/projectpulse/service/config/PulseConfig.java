package com.projectpulse.service.config;

import com.projectpulse.collectors.config.FilterConfig;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything the CLI needs to wire one run.
 */
public record PulseConfig(
        Path configDir,
        Path stateFile,
        Path eventLog,
        List<CollectorConfig> collectors,
        SourcesConfig sources,
        FilterConfig filter,
        ScheduleConfig schedule,
        DestinationsConfig destinations,
        Secrets secrets
) {
    public boolean collectorEnabled(String name) {
        for (CollectorConfig collector : collectors) {
            if (collector.name().equals(name)) {
                return collector.enabled();
            }
        }
        return false;
    }
}
