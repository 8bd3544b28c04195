package com.projectpulse.core.events;

import com.projectpulse.core.model.CycleType;

import java.time.Instant;

public record CycleStarted(Instant timestamp, CycleType cycleType) implements Event {
    @Override
    public String type() {
        return "CycleStarted";
    }
}
