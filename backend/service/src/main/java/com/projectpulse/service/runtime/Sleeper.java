package com.projectpulse.service.runtime;

import java.time.Duration;

/**
 * Waits between publish attempts. Tests record the requested delays instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
