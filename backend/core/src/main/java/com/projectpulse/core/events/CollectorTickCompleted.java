package com.projectpulse.core.events;

import java.time.Instant;

public record CollectorTickCompleted(
        Instant timestamp,
        String collectorName,
        boolean success,
        int collected,
        int admitted,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "CollectorTickCompleted";
    }
}
