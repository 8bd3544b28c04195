package com.projectpulse.core.events;

import com.projectpulse.core.model.CycleType;
import com.projectpulse.core.model.Destination;

import java.time.Instant;
import java.util.Set;

public record CycleCompleted(
        Instant timestamp,
        CycleType cycleType,
        boolean skipped,
        int candidates,
        Set<Destination> succeeded,
        Set<Destination> retryable,
        Set<Destination> permanent
) implements Event {
    @Override
    public String type() {
        return "CycleCompleted";
    }
}
