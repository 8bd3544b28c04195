package com.projectpulse.core.model;

import java.util.EnumSet;
import java.util.Set;

public enum CycleType {
    DAILY(EnumSet.of(Destination.MICROBLOG_A, Destination.MICROBLOG_B)),
    WEEKLY(EnumSet.of(Destination.BLOG));

    private final Set<Destination> destinations;

    CycleType(Set<Destination> destinations) {
        this.destinations = destinations;
    }

    public Set<Destination> destinations() {
        return EnumSet.copyOf(destinations);
    }
}
