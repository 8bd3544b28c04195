package com.projectpulse.core.events;

import java.time.Instant;

public record CollectorTickStarted(Instant timestamp, String collectorName, Instant since) implements Event {
    @Override
    public String type() {
        return "CollectorTickStarted";
    }
}
